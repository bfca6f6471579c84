package predict.market.trading.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * User account holding the virtual currency balance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    /**
     * Unique user identifier
     */
    private Long userId;

    /**
     * Display name
     */
    private String name;

    /**
     * Login email (unique)
     */
    private String email;

    /**
     * BCrypt hash of the password
     */
    @JsonIgnore
    private String passwordHash;

    /**
     * Spendable balance, never negative
     */
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    /**
     * Whether the user may create and resolve markets
     */
    @Builder.Default
    private Boolean isAdmin = false;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isAdministrator() {
        return Boolean.TRUE.equals(isAdmin);
    }
}
