package predict.market.trading.enums;

/**
 * Order lifecycle status
 * Transitions are one-way: OPEN -> FILLED or OPEN -> CANCELLED
 */
public enum OrderStatus {
    /**
     * Accepted and not fully filled
     */
    OPEN,

    /**
     * filled == amount
     */
    FILLED,

    /**
     * Cancelled by the owner, an administrator, or market resolution
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
