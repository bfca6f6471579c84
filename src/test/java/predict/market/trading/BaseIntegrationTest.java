package predict.market.trading;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;
import predict.market.trading.domain.Order;
import predict.market.trading.domain.User;
import predict.market.trading.domain.UserOutcome;
import predict.market.trading.dto.CreateMarketRequest;
import predict.market.trading.dto.MarketResponse;
import predict.market.trading.dto.RegisterUserRequest;
import predict.market.trading.mapper.OrderMapper;
import predict.market.trading.mapper.OutcomeMapper;
import predict.market.trading.mapper.TradeMapper;
import predict.market.trading.mapper.TransactionMapper;
import predict.market.trading.mapper.UserMapper;
import predict.market.trading.mapper.UserOutcomeMapper;
import predict.market.trading.service.MarketService;
import predict.market.trading.service.PositionBookService;
import predict.market.trading.service.UserService;
import predict.market.trading.service.kafka.MarketEventProducerService;
import predict.market.trading.service.kafka.TradeEventProducerService;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for integration tests
 * Every test runs in a transaction that is rolled back afterwards, so events never reach Kafka
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
public abstract class BaseIntegrationTest {

    private static final AtomicInteger USER_SEQ = new AtomicInteger();

    @MockBean
    protected TradeEventProducerService tradeEventProducerService;

    @MockBean
    protected MarketEventProducerService marketEventProducerService;

    @Autowired
    protected UserService userService;

    @Autowired
    protected MarketService marketService;

    @Autowired
    protected PositionBookService positionBookService;

    @Autowired
    protected UserMapper userMapper;

    @Autowired
    protected OrderMapper orderMapper;

    @Autowired
    protected OutcomeMapper outcomeMapper;

    @Autowired
    protected TradeMapper tradeMapper;

    @Autowired
    protected TransactionMapper transactionMapper;

    @Autowired
    protected UserOutcomeMapper userOutcomeMapper;

    // ============= FIXTURES =============

    protected User createUser(String name) {
        return userService.register(RegisterUserRequest.builder()
                .name(name)
                .email(name.toLowerCase() + "." + USER_SEQ.incrementAndGet() + "@test.local")
                .password("secret123")
                .build());
    }

    protected User createAdmin() {
        User admin = createUser("Admin");
        userMapper.updateAdmin(admin.getUserId(), true);
        return userMapper.findById(admin.getUserId());
    }

    /**
     * Market with the given outcomes, each starting at an equal share
     */
    protected MarketResponse createMarket(User admin, String... outcomeTitles) {
        return marketService.createMarket(admin.getUserId(), CreateMarketRequest.builder()
                .title("Will it rain tomorrow?")
                .description("Resolves YES if any rain is recorded downtown")
                .category("weather")
                .endDate(LocalDateTime.now().plusDays(7))
                .outcomes(Arrays.stream(outcomeTitles)
                        .map(t -> CreateMarketRequest.OutcomeSpec.builder().title(t).build())
                        .toList())
                .build());
    }

    protected MarketResponse createBinaryMarket(User admin) {
        return createMarket(admin, "Yes", "No");
    }

    protected Long outcomeId(MarketResponse market, int index) {
        return market.getOutcomes().get(index).getOutcomeId();
    }

    /**
     * Give a user shares directly, bypassing trading
     */
    protected void seedHolding(User user, Long outcomeId, String shares, String avgPrice) {
        positionBookService.acquire(user.getUserId(), outcomeId, new BigDecimal(shares), new BigDecimal(avgPrice));
    }

    // ============= ASSERTION UTILITIES =============

    protected BigDecimal balanceOf(User user) {
        return userMapper.findById(user.getUserId()).getBalance();
    }

    protected void assertBalance(User user, String expected) {
        assertThat(balanceOf(user)).isEqualByComparingTo(expected);
    }

    protected void assertHolding(User user, Long outcomeId, String expectedQuantity) {
        UserOutcome holding = userOutcomeMapper.findByUserAndOutcome(user.getUserId(), outcomeId);
        if (new BigDecimal(expectedQuantity).signum() == 0) {
            assertThat(holding == null || holding.getQuantity().signum() == 0).isTrue();
        } else {
            assertThat(holding).isNotNull();
            assertThat(holding.getQuantity()).isEqualByComparingTo(expectedQuantity);
        }
    }

    /**
     * Assert order state as stored
     */
    protected void assertOrderState(Long orderId, String expectedStatus, String expectedFilled) {
        Order stored = orderMapper.findById(orderId);
        assertThat(stored.getStatus().name()).isEqualTo(expectedStatus);
        assertThat(stored.getFilled()).isEqualByComparingTo(expectedFilled);
    }

    protected BigDecimal probabilityOf(Long outcomeId) {
        return outcomeMapper.findById(outcomeId).getProbability();
    }
}
