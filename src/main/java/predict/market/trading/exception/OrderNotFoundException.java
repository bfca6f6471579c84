package predict.market.trading.exception;

/**
 * Exception thrown when an order does not exist
 */
public class OrderNotFoundException extends BusinessException {
    public OrderNotFoundException(String message) {
        super(message);
    }
}
