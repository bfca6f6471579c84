package predict.market.trading.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.enums.PositionSide;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A user's holding in one outcome, unique per (userId, outcomeId)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserOutcome {
    private Long id;

    private Long userId;

    private Long outcomeId;

    /**
     * Shares owned, never negative
     */
    private BigDecimal quantity;

    /**
     * Weighted-average cost per share
     */
    private BigDecimal avgPrice;

    @Builder.Default
    private PositionSide positionSide = PositionSide.YES;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
