package predict.market.trading.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import predict.market.trading.domain.Transaction;
import predict.market.trading.domain.User;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.TransactionResponse;
import predict.market.trading.enums.TransactionType;
import predict.market.trading.exception.InsufficientBalanceException;
import predict.market.trading.exception.InvalidRequestException;
import predict.market.trading.exception.UserNotFoundException;
import predict.market.trading.mapper.TransactionMapper;
import predict.market.trading.mapper.UserMapper;
import predict.market.trading.util.DecimalScales;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Ledger: the only writer of User.balance and Transaction rows.
 * Every balance change is one conditional UPDATE plus one appended transaction.
 */
@Slf4j
@Service
public class LedgerService {

    @Autowired
    private UserMapper userMapper;

    @Autowired
    private TransactionMapper transactionMapper;

    @Value("${market.ledger.min-deposit:10}")
    private BigDecimal minDeposit;

    @Value("${market.ledger.max-deposit:10000}")
    private BigDecimal maxDeposit;

    /**
     * Apply a signed delta to a user's balance and append the matching transaction.
     * Must run inside the caller's transaction; a failure rolls back the whole operation.
     *
     * @param userId the user whose balance changes
     * @param delta signed amount, negative for debits
     * @param type reason tag
     * @param metadata optional details stored as JSON
     * @return the appended transaction
     * @throws InsufficientBalanceException if a debit would take the balance below zero
     */
    public Transaction apply(Long userId, BigDecimal delta, TransactionType type, Map<String, Object> metadata) {
        BigDecimal amount = DecimalScales.amount(delta);

        int updated = userMapper.applyBalanceDelta(userId, amount);
        if (updated == 0) {
            User user = userMapper.findById(userId);
            if (user == null) {
                throw new UserNotFoundException("User not found: " + userId);
            }
            throw new InsufficientBalanceException(String.format(
                    "Insufficient balance: userId=%d, balance=%s, required=%s",
                    userId, user.getBalance().toPlainString(), amount.negate().toPlainString()));
        }

        Transaction transaction = Transaction.builder()
                .userId(userId)
                .amount(amount)
                .type(type)
                .metadata(metadata)
                .createdAt(LocalDateTime.now())
                .build();
        transactionMapper.insert(transaction);

        log.debug("Ledger entry: userId={}, type={}, amount={}, txId={}",
                userId, type, amount, transaction.getTransactionId());
        return transaction;
    }

    /**
     * Check that the user can cover a debit, without changing anything
     *
     * @return the user as read
     */
    public User requireBalance(Long userId, BigDecimal required) {
        User user = getUser(userId);
        if (user.getBalance().compareTo(required) < 0) {
            throw new InsufficientBalanceException(String.format(
                    "Insufficient balance: userId=%d, balance=%s, required=%s",
                    userId, user.getBalance().toPlainString(), required.toPlainString()));
        }
        return user;
    }

    public User getUser(Long userId) {
        User user = userMapper.findById(userId);
        if (user == null) {
            throw new UserNotFoundException("User not found: " + userId);
        }
        return user;
    }

    public BigDecimal getBalance(Long userId) {
        return getUser(userId).getBalance();
    }

    /**
     * Credit virtual currency to a user
     */
    @Transactional
    public User deposit(Long userId, BigDecimal amount) {
        if (amount == null || amount.compareTo(minDeposit) < 0 || amount.compareTo(maxDeposit) > 0) {
            throw new InvalidRequestException(String.format(
                    "Deposit amount must be between %s and %s", minDeposit.toPlainString(), maxDeposit.toPlainString()));
        }

        getUser(userId);
        apply(userId, amount, TransactionType.DEPOSIT, Map.of("source", "virtual"));

        log.info("Deposit completed: userId={}, amount={}", userId, amount);
        return getUser(userId);
    }

    public PageResponse<TransactionResponse> getTransactions(Long userId, PageRequest pageRequest) {
        List<Transaction> items = transactionMapper.findByUserId(userId, pageRequest.offset(), pageRequest.limit());
        long total = transactionMapper.countByUserId(userId);
        return PageResponse.of(items, pageRequest.page(), pageRequest.limit(), total)
                .map(TransactionResponse::fromTransaction);
    }
}
