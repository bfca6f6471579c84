package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of PlaceOrder
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Place order result")
public class PlaceOrderResult {

    private OrderResponse order;

    @Schema(description = "Resting orders this order filled against, in execution order")
    private List<Long> matchedOrderIds;

    @Schema(description = "Whether the order was filled completely", example = "false")
    private boolean fullyFilled;

    public static PlaceOrderResult fromMatch(MatchResult result) {
        return PlaceOrderResult.builder()
                .order(OrderResponse.fromOrder(result.getUpdatedOrder()))
                .matchedOrderIds(result.getMatchedOrderIds())
                .fullyFilled(result.isFullyMatched())
                .build();
    }
}
