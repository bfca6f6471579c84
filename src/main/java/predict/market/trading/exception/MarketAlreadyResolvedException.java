package predict.market.trading.exception;

/**
 * Exception thrown when resolving a market twice
 */
public class MarketAlreadyResolvedException extends BusinessException {
    public MarketAlreadyResolvedException(String message) {
        super(message);
    }
}
