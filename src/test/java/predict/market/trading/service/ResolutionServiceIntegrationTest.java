package predict.market.trading.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import predict.market.trading.BaseIntegrationTest;
import predict.market.trading.domain.Market;
import predict.market.trading.domain.User;
import predict.market.trading.dto.MarketResponse;
import predict.market.trading.dto.PlaceOrderResult;
import predict.market.trading.dto.ResolutionResult;
import predict.market.trading.enums.TransactionType;
import predict.market.trading.exception.ForbiddenOperationException;
import predict.market.trading.exception.InvalidOutcomeException;
import predict.market.trading.exception.MarketAlreadyResolvedException;
import predict.market.trading.exception.MarketNotFoundException;
import predict.market.trading.testutil.OrderRequestBuilder;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for market resolution and settlement
 */
@DisplayName("Resolution Service Integration Tests")
class ResolutionServiceIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ResolutionService resolutionService;

    @Autowired
    private MatchingEngineService matchingEngineService;

    private User admin;
    private MarketResponse market;
    private Long yes;
    private Long no;

    @BeforeEach
    void setUp() {
        admin = createAdmin();
        market = createBinaryMarket(admin);
        yes = outcomeId(market, 0);
        no = outcomeId(market, 1);
    }

    @Test
    @DisplayName("Scenario 1: Winners are paid 1.00 per share, losers get nothing, open orders are cancelled")
    void testResolve_SettlesEverything() {
        // GIVEN: A holds 40 YES, B holds 25 NO, C has a resting LIMIT BUY, D has a resting LIMIT SELL
        User holderA = createUser("HolderA");
        User holderB = createUser("HolderB");
        User bidder = createUser("Bidder");
        User asker = createUser("Asker");
        seedHolding(holderA, yes, "40", "0.45");
        seedHolding(holderB, no, "25", "0.55");
        seedHolding(asker, no, "10", "0.50");

        PlaceOrderResult bid = matchingEngineService.placeOrder(bidder.getUserId(),
                OrderRequestBuilder.limit().buy().on(market.getMarketId(), yes).price("0.40").amount("100").build());
        PlaceOrderResult ask = matchingEngineService.placeOrder(asker.getUserId(),
                OrderRequestBuilder.limit().sell().on(market.getMarketId(), no).price("0.60").amount("10").build());
        assertBalance(bidder, "900");

        // WHEN
        ResolutionResult result = resolutionService.resolveMarket(admin.getUserId(), market.getMarketId(), yes);

        // THEN
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getHoldersPaid()).isEqualTo(1);
        assertThat(result.getTotalPayout()).isEqualByComparingTo("40");
        assertThat(result.getHoldingsClosed()).isEqualTo(3);
        assertThat(result.getOrdersCancelled()).isEqualTo(2);
        assertThat(result.getTotalRefunded()).isEqualByComparingTo("100");

        assertBalance(holderA, "1040");
        assertBalance(holderB, "1000");
        assertBalance(bidder, "1000");
        assertBalance(asker, "1000");

        assertHolding(holderA, yes, "0");
        assertHolding(holderB, no, "0");
        assertHolding(asker, no, "0");

        assertOrderState(bid.getOrder().getOrderId(), "CANCELLED", "0");
        assertOrderState(ask.getOrder().getOrderId(), "CANCELLED", "0");

        assertThat(transactionMapper.findByUserIdAndType(holderA.getUserId(), TransactionType.MARKET_RESOLUTION_PAYOUT))
                .singleElement()
                .satisfies(tx -> assertThat(tx.getAmount()).isEqualByComparingTo("40"));
        assertThat(transactionMapper.findByUserIdAndType(bidder.getUserId(), TransactionType.ORDER_REFUND))
                .singleElement()
                .satisfies(tx -> assertThat(tx.getAmount()).isEqualByComparingTo("100"));

        Market stored = marketService.getMarketById(market.getMarketId());
        assertThat(stored.getIsResolved()).isTrue();
        assertThat(stored.getResolvedOutcomeId()).isEqualTo(yes);
        assertThat(outcomeMapper.findById(yes).getIsResolved()).isTrue();
        assertThat(outcomeMapper.findById(no).getIsResolved()).isFalse();
    }

    @Test
    @DisplayName("Scenario 2: A market resolves at most once")
    void testResolveTwice() {
        User holder = createUser("Holder");
        seedHolding(holder, yes, "10", "0.50");
        resolutionService.resolveMarket(admin.getUserId(), market.getMarketId(), yes);

        assertThatThrownBy(() -> resolutionService.resolveMarket(admin.getUserId(), market.getMarketId(), no))
                .isInstanceOf(MarketAlreadyResolvedException.class);
        assertBalance(holder, "1010");
    }

    @Test
    @DisplayName("Scenario 3: Checks run admin, market, resolved state, outcome")
    void testPreconditions() {
        User user = createUser("Someone");
        MarketResponse other = createBinaryMarket(admin);

        assertThatThrownBy(() -> resolutionService.resolveMarket(user.getUserId(), market.getMarketId(), yes))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThatThrownBy(() -> resolutionService.resolveMarket(admin.getUserId(), 999_999L, yes))
                .isInstanceOf(MarketNotFoundException.class);
        assertThatThrownBy(() -> resolutionService.resolveMarket(admin.getUserId(), market.getMarketId(), outcomeId(other, 0)))
                .isInstanceOf(InvalidOutcomeException.class);

        assertThat(marketService.getMarketById(market.getMarketId()).getIsResolved()).isFalse();
    }
}
