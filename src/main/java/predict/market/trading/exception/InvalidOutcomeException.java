package predict.market.trading.exception;

/**
 * Exception thrown when an outcome does not belong to the market
 */
public class InvalidOutcomeException extends BusinessException {
    public InvalidOutcomeException(String message) {
        super(message);
    }
}
