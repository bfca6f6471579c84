package predict.market.trading.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Order;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of order matching operation
 * Contains the incoming order with its new fill state and the fills to settle
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {
    /**
     * The incoming order with updated filled and status
     */
    private Order updatedOrder;

    /**
     * Fills in execution order
     */
    @Builder.Default
    private List<Fill> fills = new ArrayList<>();

    /**
     * Whether the incoming order was fully matched
     */
    private boolean fullyMatched;

    public List<Long> getMatchedOrderIds() {
        return fills.stream().map(fill -> fill.getMakerOrder().getOrderId()).toList();
    }

    public BigDecimal totalShares() {
        return fills.stream().map(Fill::getShares).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalNotional() {
        return fills.stream().map(Fill::getNotional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
