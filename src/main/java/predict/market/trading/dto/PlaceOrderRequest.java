package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.OrderType;

import java.math.BigDecimal;

/**
 * Place order request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Place order request")
public class PlaceOrderRequest {

    @NotNull(message = "Market ID cannot be null")
    @Schema(description = "Market ID", example = "1", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long marketId;

    @NotNull(message = "Outcome ID cannot be null")
    @Schema(description = "Outcome ID", example = "1", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long outcomeId;

    @NotNull(message = "Order side cannot be null")
    @Schema(description = "Order side", example = "BUY", allowableValues = {"BUY", "SELL"},
            requiredMode = Schema.RequiredMode.REQUIRED)
    private OrderSide side;

    @NotNull(message = "Order type cannot be null")
    @Schema(description = "Order type", example = "LIMIT", allowableValues = {"LIMIT", "MARKET"},
            requiredMode = Schema.RequiredMode.REQUIRED)
    private OrderType type;

    @NotNull(message = "Amount cannot be null")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @Digits(integer = 12, fraction = 8, message = "Amount must have at most 12 integer digits and 8 fractional digits")
    @Schema(description = "Notional to spend for BUY, shares to sell for SELL", example = "100",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private BigDecimal amount;

    @DecimalMin(value = "0.01", message = "Price must be between 0.01 and 0.99")
    @DecimalMax(value = "0.99", message = "Price must be between 0.01 and 0.99")
    @Digits(integer = 1, fraction = 4, message = "Price must have at most 4 fractional digits")
    @Schema(description = "Limit price (required for LIMIT, ignored for MARKET)", example = "0.45")
    private BigDecimal price;
}
