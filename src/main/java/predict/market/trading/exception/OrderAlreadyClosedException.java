package predict.market.trading.exception;

/**
 * Exception thrown when cancelling an order that is no longer OPEN
 */
public class OrderAlreadyClosedException extends BusinessException {
    public OrderAlreadyClosedException(String message) {
        super(message);
    }
}
