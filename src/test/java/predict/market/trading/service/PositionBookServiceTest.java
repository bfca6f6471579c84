package predict.market.trading.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import predict.market.trading.BaseIntegrationTest;
import predict.market.trading.domain.User;
import predict.market.trading.domain.UserOutcome;
import predict.market.trading.dto.HoldingResponse;
import predict.market.trading.dto.MarketResponse;
import predict.market.trading.dto.PortfolioResponse;
import predict.market.trading.enums.PositionSide;
import predict.market.trading.exception.InsufficientSharesException;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Position Book Service Tests")
class PositionBookServiceTest extends BaseIntegrationTest {

    private User trader;
    private MarketResponse market;
    private Long yes;

    @BeforeEach
    void setUp() {
        trader = createUser("Trader");
        market = createBinaryMarket(createAdmin());
        yes = outcomeId(market, 0);
    }

    @Test
    @DisplayName("Buys average the cost, sells realize P&L against it")
    void testAcquireAndDispose() {
        // GIVEN
        positionBookService.acquire(trader.getUserId(), yes, new BigDecimal("100"), new BigDecimal("0.40"));
        UserOutcome holding = positionBookService.acquire(trader.getUserId(), yes, new BigDecimal("100"), new BigDecimal("0.60"));

        // THEN
        assertThat(holding.getQuantity()).isEqualByComparingTo("200");
        assertThat(holding.getAvgPrice()).isEqualByComparingTo("0.50");
        assertThat(holding.getPositionSide()).isEqualTo(PositionSide.YES);

        // WHEN: Partial then full sell
        BigDecimal pnl = positionBookService.dispose(trader.getUserId(), yes, new BigDecimal("50"), new BigDecimal("0.70"));
        assertThat(pnl).isEqualByComparingTo("10");
        assertHolding(trader, yes, "150");

        BigDecimal loss = positionBookService.dispose(trader.getUserId(), yes, new BigDecimal("150"), new BigDecimal("0.30"));
        assertThat(loss).isEqualByComparingTo("-30");
        assertThat(positionBookService.getHolding(trader.getUserId(), yes)).isNull();
    }

    @Test
    @DisplayName("Selling more than held is rejected")
    void testOversell() {
        positionBookService.acquire(trader.getUserId(), yes, new BigDecimal("10"), new BigDecimal("0.50"));

        assertThatThrownBy(() -> positionBookService.dispose(trader.getUserId(), yes, new BigDecimal("10.5"), new BigDecimal("0.50")))
                .isInstanceOf(InsufficientSharesException.class);
        assertHolding(trader, yes, "10");
    }

    @Test
    @DisplayName("Portfolio values holdings at the current probability")
    void testPortfolio() {
        // GIVEN: 100 shares at 0.40, current probability 0.50
        positionBookService.acquire(trader.getUserId(), yes, new BigDecimal("100"), new BigDecimal("0.40"));

        // WHEN
        PortfolioResponse portfolio = positionBookService.getPortfolio(trader.getUserId());

        // THEN
        assertThat(portfolio.getBalance()).isEqualByComparingTo("1000");
        assertThat(portfolio.getMarkets()).singleElement().satisfies(group -> {
            assertThat(group.getMarketId()).isEqualTo(market.getMarketId());
            assertThat(group.getTotalValue()).isEqualByComparingTo("50");
            assertThat(group.getTotalPnL()).isEqualByComparingTo("10");
        });

        HoldingResponse holding = portfolio.getMarkets().get(0).getHoldings().get(0);
        assertThat(holding.getCurrentPrice()).isEqualByComparingTo("0.50");
        assertThat(holding.getCurrentValue()).isEqualByComparingTo("50");
        assertThat(holding.getUnrealizedPnL()).isEqualByComparingTo("10");
        assertThat(holding.getPercentChange()).isEqualByComparingTo("25");
        assertThat(holding.getIsResolved()).isFalse();
        assertThat(holding.getIsWinner()).isFalse();

        assertThat(portfolio.getSummary().getPositionCount()).isEqualTo(1);
        assertThat(portfolio.getSummary().getPnlPercentage()).isEqualByComparingTo("25");
    }
}
