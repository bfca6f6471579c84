package predict.market.trading.enums;

/**
 * Order side - BUY or SELL shares of an outcome
 */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
