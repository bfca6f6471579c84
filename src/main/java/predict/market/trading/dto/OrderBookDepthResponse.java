package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Resting LIMIT orders of one outcome grouped by price
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resting limit orders of an outcome by price level")
public class OrderBookDepthResponse {

    @Schema(description = "Market ID", example = "1")
    private Long marketId;

    @Schema(description = "Outcome ID", example = "2")
    private Long outcomeId;

    @Schema(description = "Current probability of the outcome", example = "0.4700")
    private BigDecimal probability;

    @Schema(description = "BUY levels, highest price first. Remaining is notional")
    private List<PriceLevel> bids;

    @Schema(description = "SELL levels, lowest price first. Remaining is shares")
    private List<PriceLevel> asks;

    @Schema(description = "Best bid price", example = "0.45")
    private BigDecimal bestBid;

    @Schema(description = "Best ask price", example = "0.48")
    private BigDecimal bestAsk;

    @Schema(description = "bestAsk - bestBid, absent unless both sides rest", example = "0.03")
    private BigDecimal spread;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Price level")
    public static class PriceLevel {

        @Schema(description = "Price", example = "0.45")
        private BigDecimal price;

        @Schema(description = "Unfilled amount at this price in the side's unit", example = "250")
        private BigDecimal remaining;

        @Schema(description = "Number of orders at this price", example = "3")
        private Integer orderCount;
    }
}
