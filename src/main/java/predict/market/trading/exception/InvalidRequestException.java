package predict.market.trading.exception;

/**
 * Exception thrown when request input is malformed or out of range
 */
public class InvalidRequestException extends BusinessException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
