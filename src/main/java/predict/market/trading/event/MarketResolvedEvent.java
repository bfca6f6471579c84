package predict.market.trading.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.dto.ResolutionResult;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Event published once a market has been resolved and settled
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketResolvedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String messageId;

    private Long timestamp;

    private Long marketId;

    private Long winningOutcomeId;

    private Long resolvedBy;

    private Integer holdersPaid;

    private BigDecimal totalPayout;

    private Integer ordersCancelled;

    private BigDecimal totalRefunded;

    public static MarketResolvedEvent fromResult(ResolutionResult result) {
        return MarketResolvedEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .marketId(result.getMarketId())
                .winningOutcomeId(result.getWinningOutcomeId())
                .resolvedBy(result.getResolvedBy())
                .holdersPaid(result.getHoldersPaid())
                .totalPayout(result.getTotalPayout())
                .ordersCancelled(result.getOrdersCancelled())
                .totalRefunded(result.getTotalRefunded())
                .build();
    }
}
