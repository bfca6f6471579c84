package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Holdings grouped by market with portfolio totals
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Portfolio")
public class PortfolioResponse {

    private Long userId;

    private BigDecimal balance;

    private List<MarketHoldings> markets;

    private Summary summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MarketHoldings {

        private Long marketId;

        private String marketTitle;

        private Boolean isResolved;

        private List<HoldingResponse> holdings;

        private BigDecimal totalValue;

        private BigDecimal totalPnL;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {

        @Schema(description = "Current value of all holdings", example = "420.5")
        private BigDecimal totalValue;

        @Schema(description = "Sum of unrealized P&L", example = "20.5")
        private BigDecimal totalPnL;

        @Schema(description = "totalPnL over total cost basis, in percent", example = "5.12")
        private BigDecimal pnlPercentage;

        private Integer positionCount;
    }
}
