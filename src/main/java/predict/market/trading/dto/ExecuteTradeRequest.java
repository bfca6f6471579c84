package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.enums.OrderSide;

import java.math.BigDecimal;

/**
 * Immediate trade against the current probability
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Execute trade request")
public class ExecuteTradeRequest {

    @NotNull(message = "Market ID cannot be null")
    @Schema(description = "Market ID", example = "1", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long marketId;

    @NotNull(message = "Outcome ID cannot be null")
    @Schema(description = "Outcome ID", example = "1", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long outcomeId;

    @NotNull(message = "Trade side cannot be null")
    @Schema(description = "Trade side", example = "BUY", allowableValues = {"BUY", "SELL"},
            requiredMode = Schema.RequiredMode.REQUIRED)
    private OrderSide side;

    @NotNull(message = "Amount cannot be null")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 12, fraction = 8, message = "Amount must have at most 12 integer digits and 8 fractional digits")
    @Schema(description = "Currency amount, or share count when sharesMode is true", example = "50",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private BigDecimal amount;

    @Builder.Default
    @Schema(description = "Interpret amount as shares instead of currency", example = "false")
    private boolean sharesMode = false;
}
