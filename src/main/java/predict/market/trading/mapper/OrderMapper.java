package predict.market.trading.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import predict.market.trading.domain.Order;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.OrderStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * MyBatis mapper interface for Order entity
 */
@Mapper
public interface OrderMapper {

    /**
     * Insert a new order
     * @param order the order to insert
     * @return number of rows affected
     */
    int insert(Order order);

    /**
     * Find order by ID
     * @param orderId the order ID
     * @return the order, or null if not found
     */
    Order findById(@Param("orderId") Long orderId);

    /**
     * Resting OPEN LIMIT orders on one side of an outcome, in price-time priority.
     * SELL orders come back cheapest first, BUY orders highest first; ties go to the oldest order.
     *
     * @param side side of the resting orders
     * @param excludeUserId owner whose orders are skipped, so an order never fills against its own user
     */
    List<Order> findResting(@Param("marketId") Long marketId,
                            @Param("outcomeId") Long outcomeId,
                            @Param("side") OrderSide side,
                            @Param("excludeUserId") Long excludeUserId);

    /**
     * All resting OPEN LIMIT orders of an outcome, both sides, for depth aggregation
     */
    List<Order> findRestingByOutcome(@Param("marketId") Long marketId, @Param("outcomeId") Long outcomeId);

    /**
     * Record a fill, guarded by the previously read filled amount and OPEN status
     *
     * @return number of rows affected, 0 if the order changed underneath us
     */
    int applyFill(@Param("orderId") Long orderId,
                  @Param("expectedFilled") BigDecimal expectedFilled,
                  @Param("filled") BigDecimal filled,
                  @Param("status") OrderStatus status);

    /**
     * Move an OPEN order to a terminal status
     *
     * @return number of rows affected, 0 if the order was no longer OPEN
     */
    int closeOrder(@Param("orderId") Long orderId, @Param("status") OrderStatus status);

    /**
     * All OPEN orders of a market (both types, both sides)
     */
    List<Order> findOpenByMarketId(@Param("marketId") Long marketId);

    /**
     * Shares committed to the user's OPEN LIMIT SELL orders on an outcome
     */
    BigDecimal sumOpenSellRemaining(@Param("userId") Long userId, @Param("outcomeId") Long outcomeId);

    /**
     * Page through OPEN orders with optional filters, newest first
     */
    List<Order> findOpen(@Param("marketId") Long marketId,
                         @Param("outcomeId") Long outcomeId,
                         @Param("userId") Long userId,
                         @Param("offset") int offset,
                         @Param("limit") int limit);

    long countOpen(@Param("marketId") Long marketId,
                   @Param("outcomeId") Long outcomeId,
                   @Param("userId") Long userId);
}
