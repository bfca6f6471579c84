package predict.market.trading.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Prediction market owning two or more outcomes
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Market {
    /**
     * Unique market identifier
     */
    private Long marketId;

    private String title;

    private String description;

    /**
     * Category used for filtering (e.g. "Politics", "Sports")
     */
    private String category;

    /**
     * Time after which the question is expected to be answered
     */
    private LocalDateTime endDate;

    /**
     * Administrator who created the market
     */
    private Long creatorId;

    /**
     * Cumulative traded notional
     */
    @Builder.Default
    private BigDecimal volume = BigDecimal.ZERO;

    /**
     * One-way flag, false to true at resolution
     */
    @Builder.Default
    private Boolean isResolved = false;

    /**
     * Winning outcome, set exactly once at resolution
     */
    private Long resolvedOutcomeId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isClosed() {
        return Boolean.TRUE.equals(isResolved);
    }
}
