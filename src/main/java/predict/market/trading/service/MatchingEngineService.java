package predict.market.trading.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import predict.market.trading.domain.Market;
import predict.market.trading.domain.Order;
import predict.market.trading.domain.Outcome;
import predict.market.trading.domain.Trade;
import predict.market.trading.dto.Fill;
import predict.market.trading.dto.MatchResult;
import predict.market.trading.dto.PlaceOrderRequest;
import predict.market.trading.dto.PlaceOrderResult;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.enums.OrderType;
import predict.market.trading.enums.TransactionType;
import predict.market.trading.exception.ConcurrentUpdateException;
import predict.market.trading.exception.InvalidRequestException;
import predict.market.trading.exception.OrderAlreadyClosedException;
import predict.market.trading.exception.OrderNotFoundException;
import predict.market.trading.service.pricing.PricingEngine;
import predict.market.trading.strategy.OrderMatchingStrategy;
import predict.market.trading.util.DecimalScales;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core matching engine service
 * Places and cancels orders, matches them against resting liquidity and settles every fill
 * in the same transaction
 */
@Slf4j
@Service
public class MatchingEngineService {

    @Autowired
    private Map<OrderType, OrderMatchingStrategy> strategies;

    @Autowired
    private OrderService orderService;

    @Autowired
    private TradeService tradeService;

    @Autowired
    private MarketService marketService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PositionBookService positionBookService;

    @Autowired
    private PricingEngine pricingEngine;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter limitOrderCounter;
    private Counter marketOrderCounter;
    private Counter fillCounter;
    private Counter cancelCounter;

    @PostConstruct
    public void initMetrics() {
        limitOrderCounter = Counter.builder("market.orders.placed")
                .description("Orders accepted by the matching engine")
                .tag("type", "LIMIT")
                .register(meterRegistry);
        marketOrderCounter = Counter.builder("market.orders.placed")
                .description("Orders accepted by the matching engine")
                .tag("type", "MARKET")
                .register(meterRegistry);
        fillCounter = Counter.builder("market.orders.fills")
                .description("Fills between an incoming and a resting order")
                .register(meterRegistry);
        cancelCounter = Counter.builder("market.orders.cancelled")
                .description("Orders cancelled by their owner or an administrator")
                .register(meterRegistry);
    }

    /**
     * Accept an order, match it and settle the fills
     *
     * @Transactional ensures atomicity:
     * - Order insert and fill updates
     * - Trade rows, holdings and ledger entries
     * - Probability and volume updates
     * All succeed or all rollback together. A lost compare-and-swap is retried in a new transaction.
     *
     * @param userId the order owner
     * @param request the order to place
     * @return the order with its fill state and the resting orders it matched
     */
    @Retryable(retryFor = {ConcurrentUpdateException.class, CannotAcquireLockException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 20, multiplier = 2))
    @Transactional
    public PlaceOrderResult placeOrder(Long userId, PlaceOrderRequest request) {
        log.info("Placing order: userId={}, marketId={}, outcomeId={}, side={}, type={}, price={}, amount={}",
                userId, request.getMarketId(), request.getOutcomeId(), request.getSide(),
                request.getType(), request.getPrice(), request.getAmount());

        validate(request);
        ledgerService.getUser(userId);

        Market market = marketService.lockMarket(request.getMarketId());
        marketService.requireOpen(market);
        Outcome outcome = marketService.requireOutcome(market, request.getOutcomeId());

        BigDecimal amount = DecimalScales.amount(request.getAmount());
        if (request.getSide() == OrderSide.BUY) {
            ledgerService.requireBalance(userId, amount);
        } else {
            positionBookService.requireAvailable(userId, outcome.getOutcomeId(), amount);
        }

        // MARKET orders record the probability at placement; fills use each maker's price
        BigDecimal price = request.getType() == OrderType.LIMIT
                ? DecimalScales.probability(request.getPrice())
                : outcome.getProbability();

        Order order = orderService.createOrder(Order.builder()
                .userId(userId)
                .marketId(market.getMarketId())
                .outcomeId(outcome.getOutcomeId())
                .side(request.getSide())
                .type(request.getType())
                .price(price)
                .amount(amount)
                .build());

        if (order.getType() == OrderType.LIMIT && order.isBuy()) {
            ledgerService.apply(userId, amount.negate(), TransactionType.ORDER_RESERVE, orderMetadata(order));
        }

        OrderMatchingStrategy strategy = strategies.get(order.getType());
        if (strategy == null) {
            throw new IllegalArgumentException("No matching strategy found for order type: " + order.getType());
        }

        List<Order> resting = strategy.consumesLiquidity()
                ? orderService.findResting(market.getMarketId(), outcome.getOutcomeId(),
                        order.getSide().opposite(), userId)
                : Collections.emptyList();

        MatchResult result = strategy.match(order, resting);

        if (!result.getFills().isEmpty()) {
            settle(market, order, result.getFills());
            orderService.saveFill(order, BigDecimal.ZERO);
        }

        (order.getType() == OrderType.LIMIT ? limitOrderCounter : marketOrderCounter).increment();
        fillCounter.increment(result.getFills().size());

        log.info("Order processing complete: orderId={}, status={}, filled={}/{}, fills={}, shares={}, notional={}",
                order.getOrderId(), order.getStatus(), order.getFilled(), order.getAmount(),
                result.getFills().size(), result.totalShares(), result.totalNotional());

        return PlaceOrderResult.fromMatch(result);
    }

    /**
     * Cancel an OPEN order and refund the unfilled reservation of a LIMIT BUY
     *
     * @param callerId the owner or an administrator
     * @param orderId the order to cancel
     * @return the cancelled order
     */
    @Retryable(retryFor = {ConcurrentUpdateException.class, CannotAcquireLockException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 20, multiplier = 2))
    @Transactional
    public Order cancelOrder(Long callerId, Long orderId) {
        log.info("Cancelling order: orderId={}, callerId={}", orderId, callerId);

        Order order = orderService.getOrderById(orderId);
        if (order == null) {
            throw new OrderNotFoundException("Order not found: " + orderId);
        }
        orderService.requireOwnerOrAdmin(callerId, order);

        Market market = marketService.lockMarket(order.getMarketId());

        // Re-read under the market lock so the refund sees the latest fill
        order = orderService.getOrderById(orderId);
        if (order.getStatus() != OrderStatus.OPEN) {
            throw new OrderAlreadyClosedException(
                    "Order " + orderId + " is already " + order.getStatus());
        }
        marketService.requireOpen(market);

        BigDecimal refund = order.getRemaining();
        orderService.closeOrder(order, OrderStatus.CANCELLED);

        if (order.getType() == OrderType.LIMIT && order.isBuy() && refund.signum() > 0) {
            ledgerService.apply(order.getUserId(), refund, TransactionType.ORDER_CANCEL_REFUND, orderMetadata(order));
        }

        cancelCounter.increment();
        log.info("Order cancelled: orderId={}, userId={}, refund={}",
                orderId, order.getUserId(), order.isBuy() ? refund : BigDecimal.ZERO);
        return order;
    }

    /**
     * Write each fill: maker update, one trade per side, holdings, balances, volume and price impact
     */
    private void settle(Market market, Order taker, List<Fill> fills) {
        BigDecimal volume = market.getVolume() == null ? BigDecimal.ZERO : market.getVolume();

        for (Fill fill : fills) {
            Order maker = fill.getMakerOrder();
            orderService.saveFill(maker, fill.getMakerFilledBefore());

            Order buyOrder = taker.isBuy() ? taker : maker;
            Order sellOrder = taker.isBuy() ? maker : taker;

            tradeService.createTrade(tradeFor(buyOrder, fill));
            tradeService.createTrade(tradeFor(sellOrder, fill));

            positionBookService.acquire(buyOrder.getUserId(), buyOrder.getOutcomeId(),
                    fill.getShares(), fill.getPrice());
            if (taker.isBuy()) {
                ledgerService.apply(buyOrder.getUserId(), fill.getNotional().negate(), TransactionType.TRADE_BUY,
                        fillMetadata(buyOrder, fill, null));
            }

            BigDecimal realizedPnL = positionBookService.dispose(sellOrder.getUserId(), sellOrder.getOutcomeId(),
                    fill.getShares(), fill.getPrice());
            ledgerService.apply(sellOrder.getUserId(), fill.getNotional(), TransactionType.TRADE_SELL,
                    fillMetadata(sellOrder, fill, realizedPnL));

            // book fills count toward volume before their own impact is priced
            marketService.addVolume(market.getMarketId(), fill.getNotional());
            volume = volume.add(fill.getNotional());
            pricingEngine.applyTradeImpact(market.getMarketId(), taker.getOutcomeId(),
                    fill.getNotional(), volume, taker.getSide());

            log.debug("Fill settled: taker={}, maker={}, shares={}, notional={}, price={}",
                    taker.getOrderId(), maker.getOrderId(), fill.getShares(), fill.getNotional(), fill.getPrice());
        }
    }

    private Trade tradeFor(Order order, Fill fill) {
        return Trade.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .marketId(order.getMarketId())
                .outcomeId(order.getOutcomeId())
                .side(order.getSide())
                .amount(fill.getNotional())
                .shares(fill.getShares())
                .price(fill.getPrice())
                .build();
    }

    private void validate(PlaceOrderRequest request) {
        if (request.getSide() == null || request.getType() == null) {
            throw new InvalidRequestException("Order side and type are required");
        }
        if (!DecimalScales.isPositive(request.getAmount())) {
            throw new InvalidRequestException("Amount must be greater than 0");
        }
        if (request.getType() == OrderType.LIMIT) {
            if (request.getPrice() == null) {
                throw new InvalidRequestException("Price is required for LIMIT orders");
            }
            if (request.getPrice().compareTo(new BigDecimal("0.01")) < 0
                    || request.getPrice().compareTo(new BigDecimal("0.99")) > 0) {
                throw new InvalidRequestException("Price must be between 0.01 and 0.99");
            }
        }
    }

    private static Map<String, Object> orderMetadata(Order order) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("orderId", order.getOrderId());
        metadata.put("marketId", order.getMarketId());
        metadata.put("outcomeId", order.getOutcomeId());
        metadata.put("price", order.getPrice());
        return metadata;
    }

    private static Map<String, Object> fillMetadata(Order order, Fill fill, BigDecimal profitLoss) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("orderId", order.getOrderId());
        metadata.put("marketId", order.getMarketId());
        metadata.put("outcomeId", order.getOutcomeId());
        metadata.put("shares", fill.getShares());
        metadata.put("price", fill.getPrice());
        if (profitLoss != null) {
            metadata.put("profitLoss", profitLoss);
        }
        return metadata;
    }
}
