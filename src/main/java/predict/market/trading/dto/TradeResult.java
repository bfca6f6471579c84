package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of ExecuteTrade
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Execute trade result")
public class TradeResult {

    private TradeResponse trade;

    @Schema(description = "Realized profit or loss, present for sells", example = "2.5")
    private BigDecimal realizedPnL;

    @Schema(description = "Balance after the trade", example = "950")
    private BigDecimal balanceAfter;

    @Schema(description = "Traded outcome probability after price impact", example = "0.55")
    private BigDecimal newProbability;
}
