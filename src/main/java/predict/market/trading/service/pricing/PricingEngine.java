package predict.market.trading.service.pricing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import predict.market.trading.domain.Outcome;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.exception.ConcurrentUpdateException;
import predict.market.trading.exception.InvalidOutcomeException;
import predict.market.trading.mapper.OutcomeMapper;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pricing Engine: the only writer of Outcome.probability.
 * Reads the market's outcomes, reprices them with {@link ProbabilityModel}
 * and writes each change with compare-and-swap against the value it read.
 */
@Slf4j
@Service
public class PricingEngine {

    @Autowired
    private OutcomeMapper outcomeMapper;

    @Autowired
    private ProbabilityModel probabilityModel;

    /**
     * Apply the price impact of one trade. Must run inside the trade's transaction.
     *
     * @param marketId market of the traded outcome
     * @param outcomeId traded outcome
     * @param notional traded currency amount
     * @param volumeBasis market volume the impact is measured against: pre-trade for AMM trades, post-fill for book fills
     * @param side taker direction
     * @return probabilities after the update, keyed by outcome id
     * @throws ConcurrentUpdateException if another transaction changed a probability since it was read
     */
    public Map<Long, BigDecimal> applyTradeImpact(Long marketId, Long outcomeId, BigDecimal notional,
                                                  BigDecimal volumeBasis, OrderSide side) {
        List<Outcome> outcomes = outcomeMapper.findByMarketId(marketId);

        Map<Long, BigDecimal> before = new LinkedHashMap<>();
        outcomes.forEach(o -> before.put(o.getOutcomeId(), o.getProbability()));
        if (!before.containsKey(outcomeId)) {
            throw new InvalidOutcomeException("Outcome " + outcomeId + " does not belong to market " + marketId);
        }

        Map<Long, BigDecimal> after = probabilityModel.reprice(before, outcomeId, notional, volumeBasis, side);

        for (Map.Entry<Long, BigDecimal> entry : after.entrySet()) {
            BigDecimal expected = before.get(entry.getKey());
            if (expected.compareTo(entry.getValue()) == 0) {
                continue;
            }
            int updated = outcomeMapper.compareAndSetProbability(entry.getKey(), expected, entry.getValue());
            if (updated == 0) {
                throw new ConcurrentUpdateException(String.format(
                        "Probability of outcome %d changed concurrently (expected %s)",
                        entry.getKey(), expected.toPlainString()));
            }
        }

        log.info("Probabilities repriced: marketId={}, outcomeId={}, side={}, notional={}, volumeBasis={}, {} -> {}",
                marketId, outcomeId, side, notional, volumeBasis, before, after);
        return after;
    }

    /**
     * Current probability of an outcome, read fresh from the store
     */
    public BigDecimal currentProbability(Long outcomeId) {
        Outcome outcome = outcomeMapper.findById(outcomeId);
        if (outcome == null) {
            throw new InvalidOutcomeException("Outcome not found: " + outcomeId);
        }
        return outcome.getProbability();
    }
}
