package predict.market.trading.exception;

/**
 * Base class for expected business failures
 * Thrown inside a transactional operation, it rolls back every write made so far
 */
public class BusinessException extends RuntimeException {
    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
