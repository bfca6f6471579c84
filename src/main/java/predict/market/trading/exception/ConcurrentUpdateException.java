package predict.market.trading.exception;

/**
 * Exception thrown when a compare-and-swap update lost a race with another transaction
 */
public class ConcurrentUpdateException extends BusinessException {
    public ConcurrentUpdateException(String message) {
        super(message);
    }
}
