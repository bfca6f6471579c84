package predict.market.trading.strategy;

import predict.market.trading.domain.Order;
import predict.market.trading.dto.MatchResult;
import predict.market.trading.enums.OrderType;

import java.util.List;

/**
 * Strategy interface for order matching
 * Different implementations handle LIMIT and MARKET order types
 */
public interface OrderMatchingStrategy {
    /**
     * Execute order matching logic.
     * Implementations only compute fills; settlement happens in the engine.
     *
     * @param incomingOrder the order to match, already persisted
     * @param restingOrders opposite-side resting orders in priority order
     * @return MatchResult with the updated incoming order and its fills
     */
    MatchResult match(Order incomingOrder, List<Order> restingOrders);

    /**
     * Order type this strategy handles
     */
    OrderType supportedType();

    /**
     * Whether this strategy needs the resting opposite side loaded
     */
    default boolean consumesLiquidity() {
        return true;
    }
}
