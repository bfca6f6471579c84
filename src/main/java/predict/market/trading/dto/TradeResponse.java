package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Trade;
import predict.market.trading.enums.OrderSide;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Trade response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Trade record")
public class TradeResponse {

    private Long tradeId;

    @Schema(description = "Order the trade belongs to, absent for AMM trades")
    private Long orderId;

    private Long userId;

    private Long marketId;

    private Long outcomeId;

    private OrderSide side;

    @Schema(description = "Currency notional", example = "50")
    private BigDecimal amount;

    @Schema(description = "Shares exchanged", example = "100")
    private BigDecimal shares;

    @Schema(description = "Price per share", example = "0.5")
    private BigDecimal price;

    private LocalDateTime createdAt;

    public static TradeResponse fromTrade(Trade trade) {
        return TradeResponse.builder()
                .tradeId(trade.getTradeId())
                .orderId(trade.getOrderId())
                .userId(trade.getUserId())
                .marketId(trade.getMarketId())
                .outcomeId(trade.getOutcomeId())
                .side(trade.getSide())
                .amount(trade.getAmount())
                .shares(trade.getShares())
                .price(trade.getPrice())
                .createdAt(trade.getCreatedAt())
                .build();
    }
}
