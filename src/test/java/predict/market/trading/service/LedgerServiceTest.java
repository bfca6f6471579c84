package predict.market.trading.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import predict.market.trading.BaseIntegrationTest;
import predict.market.trading.domain.User;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.TransactionResponse;
import predict.market.trading.enums.TransactionType;
import predict.market.trading.exception.InsufficientBalanceException;
import predict.market.trading.exception.InvalidRequestException;
import predict.market.trading.exception.UserNotFoundException;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Ledger Service Tests")
class LedgerServiceTest extends BaseIntegrationTest {

    @Autowired
    private LedgerService ledgerService;

    @Test
    @DisplayName("Deposit credits the balance and records a DEPOSIT entry")
    void testDeposit() {
        User user = createUser("Saver");

        User after = ledgerService.deposit(user.getUserId(), new BigDecimal("250"));

        assertThat(after.getBalance()).isEqualByComparingTo("1250");
        assertThat(transactionMapper.findByUserIdAndType(user.getUserId(), TransactionType.DEPOSIT))
                .singleElement()
                .satisfies(tx -> {
                    assertThat(tx.getAmount()).isEqualByComparingTo("250");
                    assertThat(tx.getMetadata()).containsEntry("source", "virtual");
                });
    }

    @Test
    @DisplayName("Deposits outside 10..10000 are rejected")
    void testDepositLimits() {
        User user = createUser("Saver");

        assertThatThrownBy(() -> ledgerService.deposit(user.getUserId(), new BigDecimal("5")))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> ledgerService.deposit(user.getUserId(), new BigDecimal("10000.01")))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(ledgerService.deposit(user.getUserId(), new BigDecimal("10")).getBalance())
                .isEqualByComparingTo("1010");
    }

    @Test
    @DisplayName("A debit that would overdraw fails without writing anything")
    void testOverdraw() {
        User user = createUser("Spender");

        assertThatThrownBy(() -> ledgerService.apply(user.getUserId(), new BigDecimal("-1000.01"),
                TransactionType.TRADE_BUY, Map.of()))
                .isInstanceOf(InsufficientBalanceException.class);
        assertBalance(user, "1000");
        assertThat(transactionMapper.countByUserId(user.getUserId())).isZero();

        ledgerService.apply(user.getUserId(), new BigDecimal("-1000"), TransactionType.TRADE_BUY, null);
        assertBalance(user, "0");
    }

    @Test
    @DisplayName("Unknown users are reported as not found")
    void testUnknownUser() {
        assertThatThrownBy(() -> ledgerService.apply(999_999L, BigDecimal.TEN, TransactionType.DEPOSIT, null))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("Transaction history is paginated newest first")
    void testTransactionHistory() {
        User user = createUser("Saver");
        ledgerService.deposit(user.getUserId(), new BigDecimal("10"));
        ledgerService.deposit(user.getUserId(), new BigDecimal("20"));
        ledgerService.deposit(user.getUserId(), new BigDecimal("30"));

        PageResponse<TransactionResponse> page = ledgerService.getTransactions(user.getUserId(), PageRequest.of(1, 2, 50));

        assertThat(page.getTotal()).isEqualTo(3);
        assertThat(page.getItems()).hasSize(2);
        assertThat(page.getItems().get(0).getAmount()).isEqualByComparingTo("30");
        assertThat(page.getItems().get(1).getAmount()).isEqualByComparingTo("20");
    }
}
