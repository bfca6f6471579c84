package predict.market.trading.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point scales and rounding rules shared by the engine
 */
public final class DecimalScales {

    /**
     * Scale for currency amounts and share quantities
     */
    public static final int AMOUNT_SCALE = 8;

    /**
     * Scale for probabilities
     */
    public static final int PROBABILITY_SCALE = 4;

    public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private DecimalScales() {
    }

    /**
     * Money or shares rounded half-up to 8 places
     */
    public static BigDecimal amount(BigDecimal value) {
        return value.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Probability rounded half-up to 4 places
     */
    public static BigDecimal probability(BigDecimal value) {
        return value.setScale(PROBABILITY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Shares bought with a notional at a price, rounded down so the buyer never receives more than paid for
     */
    public static BigDecimal sharesFor(BigDecimal notional, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Trade price must be positive: " + price);
        }
        return notional.divide(price, AMOUNT_SCALE, RoundingMode.DOWN);
    }

    /**
     * Notional value of shares at a price, rounded down
     */
    public static BigDecimal notionalOf(BigDecimal shares, BigDecimal price) {
        return shares.multiply(price).setScale(AMOUNT_SCALE, RoundingMode.DOWN);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
