package predict.market.trading.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import predict.market.trading.domain.Order;
import predict.market.trading.domain.Outcome;
import predict.market.trading.domain.User;
import predict.market.trading.dto.OpenOrdersResponse;
import predict.market.trading.dto.OrderBookDepthResponse;
import predict.market.trading.dto.OrderResponse;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.exception.ConcurrentUpdateException;
import predict.market.trading.exception.ForbiddenOperationException;
import predict.market.trading.exception.OrderNotFoundException;
import predict.market.trading.mapper.OrderMapper;
import predict.market.trading.mapper.OutcomeMapper;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Service for Order entity management
 * Handles order persistence, guarded state changes and queries
 */
@Slf4j
@Service
public class OrderService {

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OutcomeMapper outcomeMapper;

    @Autowired
    private UserService userService;

    /**
     * Persist a new order as OPEN with nothing filled
     *
     * @param order the order to create
     * @return the created order with generated ID
     */
    public Order createOrder(Order order) {
        LocalDateTime now = LocalDateTime.now();
        order.setCreatedAt(now);
        order.setUpdatedAt(now);
        order.setFilled(BigDecimal.ZERO);
        order.setStatus(OrderStatus.OPEN);

        orderMapper.insert(order);

        log.info("Order created: orderId={}, userId={}, marketId={}, outcomeId={}, side={}, type={}, price={}, amount={}",
                order.getOrderId(), order.getUserId(), order.getMarketId(), order.getOutcomeId(),
                order.getSide(), order.getType(), order.getPrice(), order.getAmount());
        return order;
    }

    /**
     * Write an order's new filled amount and status, guarded by the filled amount it had when read
     *
     * @throws ConcurrentUpdateException if the stored order no longer matches
     */
    public void saveFill(Order order, BigDecimal expectedFilled) {
        int updated = orderMapper.applyFill(order.getOrderId(), expectedFilled, order.getFilled(), order.getStatus());
        if (updated == 0) {
            throw new ConcurrentUpdateException("Order changed concurrently: orderId=" + order.getOrderId());
        }
        log.debug("Order fill saved: orderId={}, status={}, filled={}/{}",
                order.getOrderId(), order.getStatus(), order.getFilled(), order.getAmount());
    }

    /**
     * Move an OPEN order to a terminal status
     *
     * @throws ConcurrentUpdateException if the order was no longer OPEN
     */
    public void closeOrder(Order order, OrderStatus status) {
        OrderStatus oldStatus = order.getStatus();
        int updated = orderMapper.closeOrder(order.getOrderId(), status);
        if (updated == 0) {
            throw new ConcurrentUpdateException("Order changed concurrently: orderId=" + order.getOrderId());
        }
        order.setStatus(status);
        order.setUpdatedAt(LocalDateTime.now());

        log.info("Order status changed: orderId={}, {} -> {}", order.getOrderId(), oldStatus, status);
    }

    /**
     * Get order by ID
     *
     * @return the order, or null if not found
     */
    public Order getOrderById(Long orderId) {
        return orderMapper.findById(orderId);
    }

    /**
     * Get an order the caller owns, or any order for an administrator
     */
    public Order getOrderForCaller(Long callerId, Long orderId) {
        Order order = orderMapper.findById(orderId);
        if (order == null) {
            throw new OrderNotFoundException("Order not found: " + orderId);
        }
        requireOwnerOrAdmin(callerId, order);
        return order;
    }

    /**
     * @throws ForbiddenOperationException if the caller neither owns the order nor is an administrator
     */
    public void requireOwnerOrAdmin(Long callerId, Order order) {
        if (order.getUserId().equals(callerId)) {
            return;
        }
        User caller = userService.getUser(callerId);
        if (!caller.isAdministrator()) {
            throw new ForbiddenOperationException("Not authorized to access order " + order.getOrderId());
        }
    }

    /**
     * Opposite-side liquidity for an incoming order, in priority order
     */
    public List<Order> findResting(Long marketId, Long outcomeId, OrderSide restingSide, Long excludeUserId) {
        return orderMapper.findResting(marketId, outcomeId, restingSide, excludeUserId);
    }

    public List<Order> findOpenByMarket(Long marketId) {
        return orderMapper.findOpenByMarketId(marketId);
    }

    /**
     * Page through OPEN orders. When both market and outcome are given the aggregated book is attached.
     */
    public OpenOrdersResponse listOpenOrders(Long marketId, Long outcomeId, Long userId, PageRequest pageRequest) {
        List<Order> orders = orderMapper.findOpen(marketId, outcomeId, userId, pageRequest.offset(), pageRequest.limit());
        long total = orderMapper.countOpen(marketId, outcomeId, userId);

        OrderBookDepthResponse depth = null;
        if (marketId != null && outcomeId != null) {
            depth = getOrderBookDepth(marketId, outcomeId);
        }

        return OpenOrdersResponse.builder()
                .orders(PageResponse.of(orders, pageRequest.page(), pageRequest.limit(), total)
                        .map(OrderResponse::fromOrder))
                .orderBook(depth)
                .build();
    }

    /**
     * Aggregate resting LIMIT orders of an outcome by price level
     */
    public OrderBookDepthResponse getOrderBookDepth(Long marketId, Long outcomeId) {
        Map<BigDecimal, OrderBookDepthResponse.PriceLevel> bids = new TreeMap<>(Comparator.reverseOrder());
        Map<BigDecimal, OrderBookDepthResponse.PriceLevel> asks = new TreeMap<>();

        for (Order order : orderMapper.findRestingByOutcome(marketId, outcomeId)) {
            OrderBookDepthResponse.PriceLevel level = (order.isBuy() ? bids : asks).computeIfAbsent(
                    order.getPrice().stripTrailingZeros(),
                    price -> new OrderBookDepthResponse.PriceLevel(order.getPrice(), BigDecimal.ZERO, 0));
            level.setRemaining(level.getRemaining().add(order.getRemaining()));
            level.setOrderCount(level.getOrderCount() + 1);
        }

        List<OrderBookDepthResponse.PriceLevel> bidLevels = new ArrayList<>(bids.values());
        List<OrderBookDepthResponse.PriceLevel> askLevels = new ArrayList<>(asks.values());
        BigDecimal bestBid = bidLevels.isEmpty() ? null : bidLevels.get(0).getPrice();
        BigDecimal bestAsk = askLevels.isEmpty() ? null : askLevels.get(0).getPrice();
        Outcome outcome = outcomeMapper.findById(outcomeId);

        return OrderBookDepthResponse.builder()
                .marketId(marketId)
                .outcomeId(outcomeId)
                .probability(outcome == null ? null : outcome.getProbability())
                .bids(bidLevels)
                .asks(askLevels)
                .bestBid(bestBid)
                .bestAsk(bestAsk)
                .spread(bestBid != null && bestAsk != null ? bestAsk.subtract(bestBid) : null)
                .build();
    }
}
