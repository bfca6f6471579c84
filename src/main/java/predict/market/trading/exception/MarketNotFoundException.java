package predict.market.trading.exception;

/**
 * Exception thrown when a market does not exist
 */
public class MarketNotFoundException extends BusinessException {
    public MarketNotFoundException(String message) {
        super(message);
    }
}
