package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.enums.PositionSide;

import java.math.BigDecimal;

/**
 * One holding valued at the current probability
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Holding")
public class HoldingResponse {

    private Long outcomeId;

    private String outcomeTitle;

    private PositionSide positionSide;

    private BigDecimal quantity;

    private BigDecimal avgPrice;

    private BigDecimal currentPrice;

    @Schema(description = "quantity x currentPrice", example = "60")
    private BigDecimal currentValue;

    @Schema(description = "currentValue minus cost basis", example = "10")
    private BigDecimal unrealizedPnL;

    @Schema(description = "Unrealized P&L over cost basis, in percent", example = "20")
    private BigDecimal percentChange;

    private Boolean isResolved;

    private Boolean isWinner;
}
