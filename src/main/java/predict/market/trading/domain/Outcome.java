package predict.market.trading.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One possible answer of a market. Its probability doubles as the share price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Outcome {
    private Long outcomeId;

    private Long marketId;

    private String title;

    private String description;

    /**
     * Current probability in [0.01, 0.99], scale 4
     */
    private BigDecimal probability;

    @Builder.Default
    private Boolean isResolved = false;
}
