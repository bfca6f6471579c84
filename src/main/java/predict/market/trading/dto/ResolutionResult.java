package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Settlement summary of ResolveMarket
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Market resolution result")
public class ResolutionResult {

    private boolean success;

    private Long marketId;

    private Long winningOutcomeId;

    private Long resolvedBy;

    @Schema(description = "Number of holders of the winning outcome that were paid", example = "12")
    private Integer holdersPaid;

    @Schema(description = "Sum of payouts at 1.00 per winning share", example = "840")
    private BigDecimal totalPayout;

    @Schema(description = "Holdings zeroed, winners and losers", example = "30")
    private Integer holdingsClosed;

    @Schema(description = "Open orders cancelled", example = "4")
    private Integer ordersCancelled;

    @Schema(description = "Sum refunded to unfilled limit buys", example = "75")
    private BigDecimal totalRefunded;
}
