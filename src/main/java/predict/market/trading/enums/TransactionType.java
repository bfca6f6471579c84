package predict.market.trading.enums;

/**
 * Reason tag for every balance change recorded by the ledger
 */
public enum TransactionType {
    DEPOSIT,
    TRADE_BUY,
    TRADE_SELL,
    ORDER_RESERVE,
    ORDER_CANCEL_REFUND,
    ORDER_REFUND,
    MARKET_RESOLUTION_PAYOUT
}
