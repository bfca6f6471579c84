package predict.market.trading.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.enums.OrderSide;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Immutable execution record for one side of a fill
 * An order book match produces two rows, an AMM trade produces one
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {
    private Long tradeId;

    /**
     * Order this side belongs to, null for AMM trades
     */
    private Long orderId;

    private Long userId;

    private Long marketId;

    private Long outcomeId;

    private OrderSide side;

    /**
     * Currency notional exchanged
     */
    private BigDecimal amount;

    /**
     * Shares exchanged
     */
    private BigDecimal shares;

    /**
     * Execution price per share
     */
    private BigDecimal price;

    private LocalDateTime createdAt;
}
