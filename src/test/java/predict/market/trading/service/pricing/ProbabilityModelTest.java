package predict.market.trading.service.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import predict.market.trading.enums.OrderSide;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the price impact arithmetic
 */
@DisplayName("Probability Model Tests")
class ProbabilityModelTest {

    private final ProbabilityModel model = new ProbabilityModel(
            new BigDecimal("0.001"), new BigDecimal("0.01"), new BigDecimal("0.99"));

    @Test
    @DisplayName("Scenario 1: First trade on an empty market hits the ceiling")
    void testFirstTradeOnEmptyMarket() {
        Map<Long, BigDecimal> after = model.reprice(probs("0.5", "0.5"), 1L,
                new BigDecimal("50"), BigDecimal.ZERO, OrderSide.BUY);

        assertThat(after.get(1L)).isEqualByComparingTo("0.99");
        assertThat(after.get(2L)).isEqualByComparingTo("0.01");
    }

    @Test
    @DisplayName("Scenario 2: Small BUY and SELL move the price symmetrically")
    void testSmallTrades() {
        // ratio 0.1, impact 0.01
        Map<Long, BigDecimal> up = model.reprice(probs("0.5", "0.5"), 1L,
                new BigDecimal("100"), new BigDecimal("1000"), OrderSide.BUY);
        Map<Long, BigDecimal> down = model.reprice(probs("0.5", "0.5"), 1L,
                new BigDecimal("100"), new BigDecimal("1000"), OrderSide.SELL);

        assertThat(up.get(1L)).isEqualByComparingTo("0.505");
        assertThat(up.get(2L)).isEqualByComparingTo("0.495");
        assertThat(down.get(1L)).isEqualByComparingTo("0.495");
        assertThat(down.get(2L)).isEqualByComparingTo("0.505");
    }

    @Test
    @DisplayName("Scenario 3: Siblings keep their relative odds")
    void testProportionalRedistribution() {
        Map<Long, BigDecimal> after = model.reprice(probs("0.4", "0.4", "0.2"), 1L,
                new BigDecimal("200"), new BigDecimal("1000"), OrderSide.BUY);

        assertThat(after.get(1L)).isEqualByComparingTo("0.412");
        assertThat(after.get(2L)).isEqualByComparingTo("0.392");
        assertThat(after.get(3L)).isEqualByComparingTo("0.196");
        assertSumIsOne(after);
    }

    @Test
    @DisplayName("Scenario 4: Siblings never fall below the floor")
    void testFloorPinning() {
        Map<Long, BigDecimal> after = model.reprice(probs("0.5", "0.48", "0.02"), 1L,
                new BigDecimal("50"), BigDecimal.ZERO, OrderSide.BUY);

        assertThat(after.get(1L)).isEqualByComparingTo("0.98");
        assertThat(after.get(2L)).isEqualByComparingTo("0.01");
        assertThat(after.get(3L)).isEqualByComparingTo("0.01");
        assertSumIsOne(after);
    }

    @Test
    @DisplayName("Scenario 5: Rounding residue keeps the sum at exactly 1")
    void testRoundingResidue() {
        Map<Long, BigDecimal> after = model.reprice(probs("0.3334", "0.3333", "0.3333"), 1L,
                new BigDecimal("10"), new BigDecimal("1000"), OrderSide.BUY);

        assertThat(after.get(1L)).isEqualByComparingTo("0.3341");
        assertThat(after.values()).allMatch(p -> p.scale() <= 4);
        assertSumIsOne(after);
    }

    @Test
    @DisplayName("Impact factor uses max(volume, 1)")
    void testImpactFactor() {
        assertThat(model.impactFactor(new BigDecimal("50"), BigDecimal.ZERO)).isEqualByComparingTo("5");
        assertThat(model.impactFactor(new BigDecimal("50"), null)).isEqualByComparingTo("5");
        assertThat(model.impactFactor(new BigDecimal("100"), new BigDecimal("1000"))).isEqualByComparingTo("0.01");
    }

    @Test
    @DisplayName("Upper bound leaves the floor for every sibling")
    void testUpperBound() {
        assertThat(model.upperBound(2)).isEqualByComparingTo("0.99");
        assertThat(model.upperBound(4)).isEqualByComparingTo("0.97");
    }

    @Test
    @DisplayName("Initial split is 1/N with the residue on the first outcome")
    void testInitialSplit() {
        assertThat(model.initialSplit(2)).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("0.5"), new BigDecimal("0.5"));
        assertThat(model.initialSplit(3)).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("0.3334"), new BigDecimal("0.3333"), new BigDecimal("0.3333"));
        assertThat(model.initialSplit(4)).usingElementComparator(BigDecimal::compareTo)
                .containsOnly(new BigDecimal("0.25"));
    }

    private static Map<Long, BigDecimal> probs(String... values) {
        Map<Long, BigDecimal> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put((long) i + 1, new BigDecimal(values[i]));
        }
        return map;
    }

    private static void assertSumIsOne(Map<Long, BigDecimal> probabilities) {
        BigDecimal sum = probabilities.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum).isEqualByComparingTo("1");
    }
}
