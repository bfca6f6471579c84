package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import predict.market.trading.domain.Transaction;
import predict.market.trading.enums.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ledger entry")
public class TransactionResponse {

    private Long transactionId;

    @Schema(description = "Signed balance change", example = "-50")
    private BigDecimal amount;

    private TransactionType type;

    private Map<String, Object> metadata;

    private LocalDateTime createdAt;

    public static TransactionResponse fromTransaction(Transaction tx) {
        return TransactionResponse.builder()
                .transactionId(tx.getTransactionId())
                .amount(tx.getAmount())
                .type(tx.getType())
                .metadata(tx.getMetadata())
                .createdAt(tx.getCreatedAt())
                .build();
    }
}
