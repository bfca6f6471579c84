package predict.market.trading.exception;

/**
 * Exception thrown when a user does not exist
 */
public class UserNotFoundException extends BusinessException {
    public UserNotFoundException(String message) {
        super(message);
    }
}
