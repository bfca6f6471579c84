package predict.market.trading.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import predict.market.trading.domain.Market;
import predict.market.trading.domain.Order;
import predict.market.trading.domain.Outcome;
import predict.market.trading.domain.UserOutcome;
import predict.market.trading.dto.ResolutionResult;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.enums.OrderType;
import predict.market.trading.enums.TransactionType;
import predict.market.trading.event.MarketResolvedEvent;
import predict.market.trading.exception.ConcurrentUpdateException;
import predict.market.trading.exception.MarketAlreadyResolvedException;
import predict.market.trading.mapper.MarketMapper;
import predict.market.trading.mapper.OutcomeMapper;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolution Engine: settles a market once its winning outcome is known.
 * Winners are paid 1.00 per share, every holding is closed out, open orders are cancelled
 * and unfilled limit buys refunded.
 */
@Slf4j
@Service
public class ResolutionService {

    private static final BigDecimal PAYOUT_PER_SHARE = BigDecimal.ONE;

    @Autowired
    private UserService userService;

    @Autowired
    private MarketService marketService;

    @Autowired
    private MarketMapper marketMapper;

    @Autowired
    private OutcomeMapper outcomeMapper;

    @Autowired
    private OrderService orderService;

    @Autowired
    private PositionBookService positionBookService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private MeterRegistry meterRegistry;

    /**
     * Resolve a market in one transaction
     *
     * @param adminId caller, must be an administrator
     * @param marketId market to resolve
     * @param winningOutcomeId outcome that occurred
     * @return settlement totals
     */
    @Retryable(retryFor = {ConcurrentUpdateException.class, CannotAcquireLockException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 20, multiplier = 2))
    @Transactional
    public ResolutionResult resolveMarket(Long adminId, Long marketId, Long winningOutcomeId) {
        log.info("Resolving market: marketId={}, winningOutcomeId={}, adminId={}", marketId, winningOutcomeId, adminId);

        userService.requireAdmin(adminId);

        Market market = marketService.lockMarket(marketId);
        if (market.isClosed()) {
            throw new MarketAlreadyResolvedException("Market is already resolved: " + marketId);
        }
        Outcome winner = marketService.requireOutcome(market, winningOutcomeId);

        if (marketMapper.markResolved(marketId, winner.getOutcomeId()) == 0) {
            throw new MarketAlreadyResolvedException("Market is already resolved: " + marketId);
        }
        outcomeMapper.markResolved(winner.getOutcomeId());

        // Pay winners before the holdings are zeroed
        int holdersPaid = 0;
        BigDecimal totalPayout = BigDecimal.ZERO;
        for (UserOutcome holding : positionBookService.getOpenPositions(marketId)) {
            if (!holding.getOutcomeId().equals(winner.getOutcomeId())) {
                continue;
            }
            BigDecimal payout = holding.getQuantity().multiply(PAYOUT_PER_SHARE);
            ledgerService.apply(holding.getUserId(), payout, TransactionType.MARKET_RESOLUTION_PAYOUT,
                    payoutMetadata(marketId, holding));
            holdersPaid++;
            totalPayout = totalPayout.add(payout);
        }

        int holdingsClosed = positionBookService.closeOutMarket(marketId);

        int ordersCancelled = 0;
        BigDecimal totalRefunded = BigDecimal.ZERO;
        List<Order> openOrders = orderService.findOpenByMarket(marketId);
        for (Order order : openOrders) {
            BigDecimal remaining = order.getRemaining();
            orderService.closeOrder(order, OrderStatus.CANCELLED);
            ordersCancelled++;

            if (order.getType() == OrderType.LIMIT && order.isBuy() && remaining.signum() > 0) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("orderId", order.getOrderId());
                metadata.put("marketId", marketId);
                metadata.put("reason", "market_resolved");
                ledgerService.apply(order.getUserId(), remaining, TransactionType.ORDER_REFUND, metadata);
                totalRefunded = totalRefunded.add(remaining);
            }
        }

        ResolutionResult result = ResolutionResult.builder()
                .success(true)
                .marketId(marketId)
                .winningOutcomeId(winner.getOutcomeId())
                .resolvedBy(adminId)
                .holdersPaid(holdersPaid)
                .totalPayout(totalPayout)
                .holdingsClosed(holdingsClosed)
                .ordersCancelled(ordersCancelled)
                .totalRefunded(totalRefunded)
                .build();

        eventPublisher.publishEvent(MarketResolvedEvent.fromResult(result));
        meterRegistry.counter("market.resolutions").increment();

        log.info("Market resolved: marketId={}, winner={}, holdersPaid={}, totalPayout={}, holdingsClosed={}, "
                        + "ordersCancelled={}, totalRefunded={}",
                marketId, winner.getOutcomeId(), holdersPaid, totalPayout, holdingsClosed,
                ordersCancelled, totalRefunded);
        return result;
    }

    private static Map<String, Object> payoutMetadata(Long marketId, UserOutcome holding) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("marketId", marketId);
        metadata.put("outcomeId", holding.getOutcomeId());
        metadata.put("shares", holding.getQuantity());
        metadata.put("payoutPerShare", PAYOUT_PER_SHARE);
        return metadata;
    }
}
