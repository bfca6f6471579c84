package predict.market.trading.service.pricing;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.util.DecimalScales;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Volume-sensitive price impact and sibling redistribution.
 * Pure arithmetic, no I/O. Every result is at scale 4 and the values of a market sum to exactly 1.
 */
@Component
public class ProbabilityModel {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final BigDecimal impactCoefficient;
    private final BigDecimal floor;
    private final BigDecimal ceiling;

    public ProbabilityModel(@Value("${market.pricing.impact-coefficient:0.001}") BigDecimal impactCoefficient,
                            @Value("${market.pricing.min-probability:0.01}") BigDecimal floor,
                            @Value("${market.pricing.max-probability:0.99}") BigDecimal ceiling) {
        this.impactCoefficient = impactCoefficient;
        this.floor = floor;
        this.ceiling = ceiling;
    }

    /**
     * {@code 0.001 x (notional / max(volume, 1)) x 100}
     *
     * @param notional traded currency amount
     * @param volumeBasis market volume the trade is measured against
     */
    public BigDecimal impactFactor(BigDecimal notional, BigDecimal volumeBasis) {
        BigDecimal effectiveVolume = volumeBasis == null ? BigDecimal.ONE : volumeBasis.max(BigDecimal.ONE);
        BigDecimal volumeRatio = notional.divide(effectiveVolume, MC);
        return impactCoefficient.multiply(volumeRatio, MC).multiply(DecimalScales.ONE_HUNDRED, MC);
    }

    /**
     * Move one probability by the impact of a trade, clamped to [floor, upperBound] and rounded to 4 places
     *
     * @param outcomeCount number of outcomes in the market, siblings must keep at least the floor each
     */
    public BigDecimal shift(BigDecimal current, BigDecimal impact, OrderSide side, int outcomeCount) {
        BigDecimal raw = side == OrderSide.BUY
                ? current.add(impact.multiply(BigDecimal.ONE.subtract(current), MC), MC)
                : current.subtract(impact.multiply(current, MC), MC);
        return DecimalScales.probability(clamp(raw, upperBound(outcomeCount)));
    }

    /**
     * Apply a trade to a market's probabilities
     *
     * @param current probabilities keyed by outcome id, iteration order preserved in the result
     * @param tradedOutcomeId outcome that was traded
     * @param notional traded currency amount
     * @param volumeBasis market volume the trade is measured against
     * @param side taker direction
     * @return new probabilities for every outcome, summing to 1
     */
    public Map<Long, BigDecimal> reprice(Map<Long, BigDecimal> current, Long tradedOutcomeId,
                                         BigDecimal notional, BigDecimal volumeBasis, OrderSide side) {
        BigDecimal traded = current.get(tradedOutcomeId);
        if (traded == null) {
            throw new IllegalArgumentException("Outcome " + tradedOutcomeId + " is not part of the market");
        }
        if (current.size() < 2) {
            return new LinkedHashMap<>(current);
        }

        BigDecimal updated = shift(traded, impactFactor(notional, volumeBasis), side, current.size());

        Map<Long, BigDecimal> siblings = new LinkedHashMap<>(current);
        siblings.remove(tradedOutcomeId);
        Map<Long, BigDecimal> redistributed = redistribute(siblings, BigDecimal.ONE.subtract(updated));

        Map<Long, BigDecimal> result = new LinkedHashMap<>();
        for (Long id : current.keySet()) {
            result.put(id, id.equals(tradedOutcomeId) ? updated : redistributed.get(id));
        }
        return result;
    }

    /**
     * Rescale siblings so they sum to {@code budget}, keeping their relative odds.
     * Siblings that would fall under the floor are pinned to it and the rest share what is left.
     * Rounding residue goes to the largest sibling.
     */
    Map<Long, BigDecimal> redistribute(Map<Long, BigDecimal> siblings, BigDecimal budget) {
        Set<Long> pinned = new HashSet<>();
        Map<Long, BigDecimal> scaled = new LinkedHashMap<>();

        boolean changed = true;
        while (changed) {
            changed = false;
            BigDecimal free = budget.subtract(floor.multiply(BigDecimal.valueOf(pinned.size())));
            BigDecimal weight = BigDecimal.ZERO;
            int freeCount = 0;
            for (Map.Entry<Long, BigDecimal> e : siblings.entrySet()) {
                if (!pinned.contains(e.getKey())) {
                    weight = weight.add(e.getValue());
                    freeCount++;
                }
            }

            for (Map.Entry<Long, BigDecimal> e : siblings.entrySet()) {
                if (pinned.contains(e.getKey())) {
                    scaled.put(e.getKey(), floor);
                    continue;
                }
                BigDecimal value = weight.signum() == 0
                        ? free.divide(BigDecimal.valueOf(freeCount), MC)
                        : e.getValue().multiply(free, MC).divide(weight, MC);
                if (value.compareTo(floor) < 0) {
                    pinned.add(e.getKey());
                    changed = true;
                }
                scaled.put(e.getKey(), value);
            }
        }

        Map<Long, BigDecimal> rounded = new LinkedHashMap<>();
        BigDecimal sum = BigDecimal.ZERO;
        Long largest = null;
        for (Map.Entry<Long, BigDecimal> e : scaled.entrySet()) {
            BigDecimal value = DecimalScales.probability(e.getValue());
            rounded.put(e.getKey(), value);
            sum = sum.add(value);
            if (largest == null || value.compareTo(rounded.get(largest)) > 0) {
                largest = e.getKey();
            }
        }

        BigDecimal residual = DecimalScales.probability(budget).subtract(sum);
        if (largest != null && residual.signum() != 0) {
            rounded.put(largest, rounded.get(largest).add(residual));
        }
        return rounded;
    }

    /**
     * Highest probability one outcome may reach while every other outcome keeps the floor
     */
    public BigDecimal upperBound(int outcomeCount) {
        BigDecimal reservedForSiblings = floor.multiply(BigDecimal.valueOf(Math.max(outcomeCount - 1, 1)));
        return ceiling.min(BigDecimal.ONE.subtract(reservedForSiblings));
    }

    /**
     * Equal split 1/N at 4 places, residue on the first outcome
     */
    public BigDecimal[] initialSplit(int outcomeCount) {
        BigDecimal[] split = new BigDecimal[outcomeCount];
        BigDecimal each = BigDecimal.ONE.divide(BigDecimal.valueOf(outcomeCount), DecimalScales.PROBABILITY_SCALE,
                RoundingMode.DOWN);
        BigDecimal residual = BigDecimal.ONE.subtract(each.multiply(BigDecimal.valueOf(outcomeCount)));
        for (int i = 0; i < outcomeCount; i++) {
            split[i] = i == 0 ? each.add(residual) : each;
        }
        return split;
    }

    private BigDecimal clamp(BigDecimal value, BigDecimal upper) {
        if (value.compareTo(floor) < 0) {
            return floor;
        }
        return value.min(upper);
    }
}
