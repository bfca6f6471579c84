package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Open order listing, with depth when a single outcome was requested
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Open orders")
public class OpenOrdersResponse {

    private PageResponse<OrderResponse> orders;

    @Schema(description = "Present when both marketId and outcomeId were given")
    private OrderBookDepthResponse orderBook;
}
