package predict.market.trading.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.enums.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Append-only ledger entry, one per balance change
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {
    private Long transactionId;

    private Long userId;

    /**
     * Signed balance delta
     */
    private BigDecimal amount;

    private TransactionType type;

    /**
     * Optional details, e.g. {"profitLoss": 1.25, "orderId": 7}
     */
    private Map<String, Object> metadata;

    private LocalDateTime createdAt;
}
