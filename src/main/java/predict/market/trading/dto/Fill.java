package predict.market.trading.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Order;

import java.math.BigDecimal;

/**
 * One execution between an incoming order and a resting order, priced at the resting order's price
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Fill {
    /**
     * Resting order after the fill was applied
     */
    private Order makerOrder;

    /**
     * Maker's filled amount before this fill, used to guard the update
     */
    private BigDecimal makerFilledBefore;

    private BigDecimal price;

    private BigDecimal shares;

    /**
     * Currency paid by the buyer and received by the seller
     */
    private BigDecimal notional;
}
