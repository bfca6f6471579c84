package predict.market.trading.enums;

/**
 * Order type enum - LIMIT or MARKET
 */
public enum OrderType {
    /**
     * Limit order - rests at the caller's price until matched or cancelled
     */
    LIMIT,

    /**
     * Market order - fills immediately against resting limit orders at maker prices
     */
    MARKET
}
