package predict.market.trading.strategy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import predict.market.trading.domain.Order;
import predict.market.trading.dto.Fill;
import predict.market.trading.dto.MatchResult;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.enums.OrderType;
import predict.market.trading.util.DecimalScales;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Matching strategy for MARKET orders.
 * Walks the resting opposite side best price first and fills at each maker's price.
 * An unfilled remainder stays on the order as OPEN but is never rested.
 */
@Slf4j
@Component
public class MarketOrderMatchingStrategy implements OrderMatchingStrategy {

    @Override
    public OrderType supportedType() {
        return OrderType.MARKET;
    }

    @Override
    public MatchResult match(Order incomingOrder, List<Order> restingOrders) {
        log.debug("Matching MARKET order: orderId={}, side={}, outcomeId={}, amount={}, resting={}",
                incomingOrder.getOrderId(), incomingOrder.getSide(), incomingOrder.getOutcomeId(),
                incomingOrder.getAmount(), restingOrders.size());

        List<Fill> fills = new ArrayList<>();

        for (Order bookOrder : restingOrders) {
            if (incomingOrder.getRemaining().signum() <= 0) {
                break;
            }
            if (bookOrder.getRemaining().signum() <= 0) {
                continue;
            }

            Fill fill = incomingOrder.isBuy()
                    ? fillBuyAgainstSell(incomingOrder, bookOrder)
                    : fillSellAgainstBuy(incomingOrder, bookOrder);
            if (fill == null) {
                continue;
            }

            fills.add(fill);
            log.debug("MARKET fill: orderId={} with {} at price {}: shares={}, notional={}",
                    incomingOrder.getOrderId(), bookOrder.getOrderId(),
                    fill.getPrice(), fill.getShares(), fill.getNotional());
        }

        updateOrderStatus(incomingOrder);
        boolean fullyMatched = incomingOrder.getStatus() == OrderStatus.FILLED;

        if (!fullyMatched) {
            log.warn("MARKET order {} insufficient liquidity: filled {}/{}, remaining={}",
                    incomingOrder.getOrderId(), incomingOrder.getFilled(),
                    incomingOrder.getAmount(), incomingOrder.getRemaining());
        }

        log.info("MARKET order match complete: orderId={}, status={}, filled={}/{}, fills={}",
                incomingOrder.getOrderId(), incomingOrder.getStatus(),
                incomingOrder.getFilled(), incomingOrder.getAmount(), fills.size());

        return MatchResult.builder()
                .updatedOrder(incomingOrder)
                .fills(fills)
                .fullyMatched(fullyMatched)
                .build();
    }

    /**
     * Incoming BUY spends notional, the resting SELL delivers shares
     */
    private Fill fillBuyAgainstSell(Order buyOrder, Order sellOrder) {
        BigDecimal price = sellOrder.getPrice();
        BigDecimal budget = buyOrder.getRemaining();
        BigDecimal offered = sellOrder.getRemaining();

        BigDecimal shares = DecimalScales.sharesFor(budget, price);
        BigDecimal notional = budget;
        if (shares.compareTo(offered) > 0) {
            shares = offered;
            notional = DecimalScales.notionalOf(offered, price);
        }
        if (shares.signum() <= 0 || notional.signum() <= 0) {
            return null;
        }

        BigDecimal makerFilledBefore = sellOrder.getFilled();
        buyOrder.setFilled(buyOrder.getFilled().add(notional));
        sellOrder.setFilled(makerFilledBefore.add(shares));
        markMaker(sellOrder);

        return Fill.builder()
                .makerOrder(sellOrder)
                .makerFilledBefore(makerFilledBefore)
                .price(price)
                .shares(shares)
                .notional(notional)
                .build();
    }

    /**
     * Incoming SELL delivers shares, the resting BUY pays from its reserved notional
     */
    private Fill fillSellAgainstBuy(Order sellOrder, Order buyOrder) {
        BigDecimal price = buyOrder.getPrice();
        BigDecimal offered = sellOrder.getRemaining();
        BigDecimal budget = buyOrder.getRemaining();

        BigDecimal shares = offered;
        BigDecimal notional = DecimalScales.notionalOf(offered, price);
        if (notional.compareTo(budget) > 0) {
            notional = budget;
            shares = DecimalScales.sharesFor(budget, price);
        }
        if (shares.signum() <= 0 || notional.signum() <= 0) {
            return null;
        }

        BigDecimal makerFilledBefore = buyOrder.getFilled();
        sellOrder.setFilled(sellOrder.getFilled().add(shares));
        buyOrder.setFilled(makerFilledBefore.add(notional));
        markMaker(buyOrder);

        return Fill.builder()
                .makerOrder(buyOrder)
                .makerFilledBefore(makerFilledBefore)
                .price(price)
                .shares(shares)
                .notional(notional)
                .build();
    }

    private void markMaker(Order bookOrder) {
        bookOrder.setStatus(bookOrder.isFullyFilled() ? OrderStatus.FILLED : OrderStatus.OPEN);
        bookOrder.setUpdatedAt(LocalDateTime.now());
    }

    /**
     * FILLED when nothing remains, otherwise the order stays OPEN with its partial fill
     */
    private void updateOrderStatus(Order order) {
        order.setStatus(order.isFullyFilled() ? OrderStatus.FILLED : OrderStatus.OPEN);
        order.setUpdatedAt(LocalDateTime.now());
    }
}
