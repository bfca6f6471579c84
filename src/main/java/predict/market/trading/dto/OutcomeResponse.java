package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Outcome;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome")
public class OutcomeResponse {

    private Long outcomeId;

    private String title;

    private String description;

    @Schema(description = "Current probability, also the share price", example = "0.5")
    private BigDecimal probability;

    private Boolean isResolved;

    public static OutcomeResponse fromOutcome(Outcome outcome) {
        return OutcomeResponse.builder()
                .outcomeId(outcome.getOutcomeId())
                .title(outcome.getTitle())
                .description(outcome.getDescription())
                .probability(outcome.getProbability())
                .isResolved(outcome.getIsResolved())
                .build();
    }
}
