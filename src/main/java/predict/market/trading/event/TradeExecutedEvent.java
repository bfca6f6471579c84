package predict.market.trading.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Trade;
import predict.market.trading.enums.OrderSide;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Event published for every persisted trade row
 * Published to trade-output topic after the owning transaction commits
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeExecutedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Unique message ID for idempotency (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private Long tradeId;

    /**
     * Order the trade belongs to, null for AMM trades
     */
    private Long orderId;

    private Long userId;

    private Long marketId;

    private Long outcomeId;

    private OrderSide side;

    /**
     * Notional exchanged
     */
    private BigDecimal amount;

    private BigDecimal shares;

    private BigDecimal price;

    /**
     * Create event from Trade entity
     */
    public static TradeExecutedEvent fromTrade(Trade trade) {
        return TradeExecutedEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .tradeId(trade.getTradeId())
                .orderId(trade.getOrderId())
                .userId(trade.getUserId())
                .marketId(trade.getMarketId())
                .outcomeId(trade.getOutcomeId())
                .side(trade.getSide())
                .amount(trade.getAmount())
                .shares(trade.getShares())
                .price(trade.getPrice())
                .build();
    }
}
