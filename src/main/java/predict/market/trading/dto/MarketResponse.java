package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Market;
import predict.market.trading.domain.Outcome;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Market response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Market")
public class MarketResponse {

    private Long marketId;

    private String title;

    private String description;

    private String category;

    private LocalDateTime endDate;

    private Long creatorId;

    @Schema(description = "Cumulative traded notional", example = "1250.5")
    private BigDecimal volume;

    private Boolean isResolved;

    private Long resolvedOutcomeId;

    private LocalDateTime createdAt;

    private List<OutcomeResponse> outcomes;

    @Schema(description = "Most recent trades, only on the detail view")
    private List<TradeResponse> recentTrades;

    public static MarketResponse fromMarket(Market market, List<Outcome> outcomes) {
        return MarketResponse.builder()
                .marketId(market.getMarketId())
                .title(market.getTitle())
                .description(market.getDescription())
                .category(market.getCategory())
                .endDate(market.getEndDate())
                .creatorId(market.getCreatorId())
                .volume(market.getVolume())
                .isResolved(market.getIsResolved())
                .resolvedOutcomeId(market.getResolvedOutcomeId())
                .createdAt(market.getCreatedAt())
                .outcomes(outcomes.stream().map(OutcomeResponse::fromOutcome).toList())
                .build();
    }
}
