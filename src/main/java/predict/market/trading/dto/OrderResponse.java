package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Order;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.enums.OrderType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Order response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Order response")
public class OrderResponse {

    @Schema(description = "Order ID", example = "12345")
    private Long orderId;

    @Schema(description = "User ID", example = "1")
    private Long userId;

    @Schema(description = "Market ID", example = "3")
    private Long marketId;

    @Schema(description = "Outcome ID", example = "7")
    private Long outcomeId;

    @Schema(description = "Order side", example = "BUY")
    private OrderSide side;

    @Schema(description = "Order type", example = "LIMIT")
    private OrderType type;

    @Schema(description = "Price", example = "0.45")
    private BigDecimal price;

    @Schema(description = "Notional for BUY, shares for SELL", example = "100")
    private BigDecimal amount;

    @Schema(description = "Filled amount", example = "30")
    private BigDecimal filled;

    @Schema(description = "Remaining amount", example = "70")
    private BigDecimal remaining;

    @Schema(description = "Order status", example = "OPEN")
    private OrderStatus status;

    @Schema(description = "Created timestamp", example = "2025-01-15T10:30:00")
    private LocalDateTime createdAt;

    @Schema(description = "Updated timestamp", example = "2025-01-15T10:30:01")
    private LocalDateTime updatedAt;

    /**
     * Convert Order entity to OrderResponse DTO
     */
    public static OrderResponse fromOrder(Order order) {
        if (order == null) {
            return null;
        }

        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .marketId(order.getMarketId())
                .outcomeId(order.getOutcomeId())
                .side(order.getSide())
                .type(order.getType())
                .price(order.getPrice())
                .amount(order.getAmount())
                .filled(order.getFilled())
                .remaining(order.getRemaining())
                .status(order.getStatus())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
