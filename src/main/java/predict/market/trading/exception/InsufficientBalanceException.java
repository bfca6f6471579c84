package predict.market.trading.exception;

/**
 * Exception thrown when a user has insufficient balance
 */
public class InsufficientBalanceException extends BusinessException {
    public InsufficientBalanceException(String message) {
        super(message);
    }
}
