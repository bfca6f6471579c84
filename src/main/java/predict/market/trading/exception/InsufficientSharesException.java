package predict.market.trading.exception;

/**
 * Exception thrown when a user does not hold enough unreserved shares
 */
public class InsufficientSharesException extends BusinessException {
    public InsufficientSharesException(String message) {
        super(message);
    }
}
