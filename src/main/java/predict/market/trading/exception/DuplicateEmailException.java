package predict.market.trading.exception;

/**
 * Exception thrown when registering an email that is already taken
 */
public class DuplicateEmailException extends BusinessException {
    public DuplicateEmailException(String message) {
        super(message);
    }
}
