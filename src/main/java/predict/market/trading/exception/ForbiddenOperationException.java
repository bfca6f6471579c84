package predict.market.trading.exception;

/**
 * Exception thrown when the caller is neither the owner nor an administrator
 */
public class ForbiddenOperationException extends BusinessException {
    public ForbiddenOperationException(String message) {
        super(message);
    }
}
