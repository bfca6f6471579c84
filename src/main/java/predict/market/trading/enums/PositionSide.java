package predict.market.trading.enums;

/**
 * Explicit side of a holding.
 * YES is a long position in the outcome; NO is reserved for positions against it.
 */
public enum PositionSide {
    YES,
    NO
}
