package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resolve market request")
public class ResolveMarketRequest {

    @NotNull(message = "Winning outcome ID cannot be null")
    @Schema(description = "Winning outcome ID", example = "1", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long winningOutcomeId;
}
