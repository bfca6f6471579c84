package predict.market.trading.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.enums.OrderType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Order entity.
 * BUY orders are sized in currency notional, SELL orders in shares;
 * {@code amount} and {@code filled} always share the unit of the order's side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    /**
     * Unique order identifier
     */
    private Long orderId;

    /**
     * User who placed the order
     */
    private Long userId;

    private Long marketId;

    private Long outcomeId;

    /**
     * Order side - BUY or SELL
     */
    private OrderSide side;

    /**
     * Order type - LIMIT or MARKET
     */
    private OrderType type;

    /**
     * Limit price for LIMIT orders, probability snapshot for MARKET orders
     */
    private BigDecimal price;

    /**
     * Requested notional (BUY) or shares (SELL)
     */
    private BigDecimal amount;

    /**
     * Portion of amount already executed
     */
    @Builder.Default
    private BigDecimal filled = BigDecimal.ZERO;

    private OrderStatus status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Get remaining amount to be filled
     */
    @JsonIgnore
    public BigDecimal getRemaining() {
        return amount.subtract(filled);
    }

    /**
     * Check if order is completely filled
     */
    @JsonIgnore
    public boolean isFullyFilled() {
        return filled.compareTo(amount) >= 0;
    }

    @JsonIgnore
    public boolean isBuy() {
        return side == OrderSide.BUY;
    }
}
