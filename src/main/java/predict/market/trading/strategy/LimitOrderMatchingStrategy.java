package predict.market.trading.strategy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import predict.market.trading.domain.Order;
import predict.market.trading.dto.MatchResult;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.enums.OrderType;

import java.util.List;

/**
 * Matching strategy for LIMIT orders.
 * A limit order never crosses on arrival: it rests OPEN at its price and is
 * consumed later by incoming MARKET orders.
 */
@Slf4j
@Component
public class LimitOrderMatchingStrategy implements OrderMatchingStrategy {

    @Override
    public OrderType supportedType() {
        return OrderType.LIMIT;
    }

    @Override
    public MatchResult match(Order incomingOrder, List<Order> restingOrders) {
        incomingOrder.setStatus(OrderStatus.OPEN);

        log.debug("LIMIT order resting: orderId={}, side={}, outcomeId={}, price={}, amount={}",
                incomingOrder.getOrderId(), incomingOrder.getSide(), incomingOrder.getOutcomeId(),
                incomingOrder.getPrice(), incomingOrder.getAmount());

        return MatchResult.builder()
                .updatedOrder(incomingOrder)
                .fullyMatched(false)
                .build();
    }

    @Override
    public boolean consumesLiquidity() {
        return false;
    }
}
