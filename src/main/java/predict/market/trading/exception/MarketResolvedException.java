package predict.market.trading.exception;

/**
 * Exception thrown when mutating a market that has already been resolved
 */
public class MarketResolvedException extends BusinessException {
    public MarketResolvedException(String message) {
        super(message);
    }
}
