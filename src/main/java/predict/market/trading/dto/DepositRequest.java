package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Deposit request")
public class DepositRequest {

    @NotNull(message = "Amount cannot be null")
    @Schema(description = "Amount to deposit, between 10 and 10000", example = "250")
    private BigDecimal amount;
}
