package predict.market.trading.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import predict.market.trading.BaseIntegrationTest;
import predict.market.trading.domain.Trade;
import predict.market.trading.domain.User;
import predict.market.trading.dto.ExecuteTradeRequest;
import predict.market.trading.dto.MarketResponse;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.TradeResponse;
import predict.market.trading.dto.TradeResult;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.exception.InsufficientBalanceException;
import predict.market.trading.exception.InsufficientSharesException;
import predict.market.trading.exception.InvalidOutcomeException;
import predict.market.trading.exception.MarketResolvedException;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for trades against the current probability
 */
@DisplayName("Trade Service Integration Tests")
class TradeServiceIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private TradeService tradeService;

    @Autowired
    private ResolutionService resolutionService;

    private User admin;
    private User trader;
    private MarketResponse market;
    private Long yes;
    private Long no;

    @BeforeEach
    void setUp() {
        admin = createAdmin();
        trader = createUser("Trader");
        market = createBinaryMarket(admin);
        yes = outcomeId(market, 0);
        no = outcomeId(market, 1);
    }

    @Test
    @DisplayName("Scenario 1: First BUY on a fresh market moves the price to the ceiling")
    void testBuy_FreshMarket() {
        // WHEN: Spend 50 at 0.50
        TradeResult result = tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.BUY, "50", false));

        // THEN: 100 shares, volume ratio 50 gives the full move to 0.99
        assertThat(result.getTrade().getShares()).isEqualByComparingTo("100");
        assertThat(result.getTrade().getPrice()).isEqualByComparingTo("0.50");
        assertThat(result.getTrade().getOrderId()).isNull();
        assertThat(result.getBalanceAfter()).isEqualByComparingTo("950");
        assertThat(result.getNewProbability()).isEqualByComparingTo("0.99");
        assertThat(result.getRealizedPnL()).isNull();

        assertThat(probabilityOf(yes)).isEqualByComparingTo("0.99");
        assertThat(probabilityOf(no)).isEqualByComparingTo("0.01");
        assertThat(probabilityOf(yes).add(probabilityOf(no))).isEqualByComparingTo("1");
        assertHolding(trader, yes, "100");
        assertThat(marketService.getMarketById(market.getMarketId()).getVolume()).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("Scenario 2: Selling shares realizes profit at the moved price")
    void testBuyThenSellShares() {
        // GIVEN: 100 shares bought at 0.50, price now 0.99
        tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.BUY, "50", false));

        // WHEN: Sell all 100 shares
        TradeResult sell = tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.SELL, "100", true));

        // THEN: 99 proceeds, 49 realized
        assertThat(sell.getTrade().getAmount()).isEqualByComparingTo("99");
        assertThat(sell.getRealizedPnL()).isEqualByComparingTo("49");
        assertThat(sell.getBalanceAfter()).isEqualByComparingTo("1049");
        assertHolding(trader, yes, "0");

        // volume before was 50, ratio 1.98, impact 0.198 -> 0.99 - 0.198 x 0.99
        assertThat(probabilityOf(yes)).isEqualByComparingTo("0.7940");
        assertThat(probabilityOf(no)).isEqualByComparingTo("0.2060");
    }

    @Test
    @DisplayName("Scenario 3: Shares mode BUY and currency mode SELL")
    void testAmountModes() {
        // WHEN: Buy 10 shares at 0.50
        TradeResult buy = tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.BUY, "10", true));

        // THEN
        assertThat(buy.getTrade().getAmount()).isEqualByComparingTo("5");
        assertThat(buy.getTrade().getShares()).isEqualByComparingTo("10");
        assertBalance(trader, "995");

        // WHEN: Sell 2.5 worth at the new price
        TradeResult sell = tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.SELL, "2.5", false));

        // THEN: shares = 2.5 / p, proceeds exactly 2.5
        assertThat(sell.getTrade().getAmount()).isEqualByComparingTo("2.5");
        assertThat(sell.getTrade().getShares()).isPositive();
        assertBalance(trader, "997.5");
    }

    @Test
    @DisplayName("Scenario 4: Rejected trades leave balances and holdings untouched")
    void testRejections() {
        assertThatThrownBy(() -> tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.BUY, "1500", false)))
                .isInstanceOf(InsufficientBalanceException.class);
        assertThatThrownBy(() -> tradeService.executeTrade(trader.getUserId(), request(no, OrderSide.SELL, "5", true)))
                .isInstanceOf(InsufficientSharesException.class);

        MarketResponse other = createBinaryMarket(admin);
        assertThatThrownBy(() -> tradeService.executeTrade(trader.getUserId(), request(outcomeId(other, 0), OrderSide.BUY, "5", false)))
                .isInstanceOf(InvalidOutcomeException.class);

        assertBalance(trader, "1000");
        assertThat(probabilityOf(yes)).isEqualByComparingTo("0.50");

        resolutionService.resolveMarket(admin.getUserId(), market.getMarketId(), yes);
        assertThatThrownBy(() -> tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.BUY, "5", false)))
                .isInstanceOf(MarketResolvedException.class);
    }

    @Test
    @DisplayName("Scenario 5: Trade history is newest first and appears on the market")
    void testTradeHistory() {
        // GIVEN
        tradeService.executeTrade(trader.getUserId(), request(yes, OrderSide.BUY, "10", false));
        tradeService.executeTrade(trader.getUserId(), request(no, OrderSide.BUY, "10", false));

        // WHEN
        List<TradeResponse> history = tradeService.getTradeHistory(trader.getUserId(), PageRequest.of(1, 10, 50)).getItems();

        // THEN
        assertThat(history).hasSize(2);
        assertThat(history.get(0).getOutcomeId()).isEqualTo(no);
        assertThat(history.get(1).getOutcomeId()).isEqualTo(yes);

        List<Trade> recent = tradeMapper.findRecentByMarketId(market.getMarketId(), 10);
        assertThat(recent).hasSize(2);
        assertThat(marketService.getMarket(market.getMarketId()).getRecentTrades()).hasSize(2);
    }

    private ExecuteTradeRequest request(Long outcomeId, OrderSide side, String amount, boolean sharesMode) {
        return ExecuteTradeRequest.builder()
                .marketId(market.getMarketId())
                .outcomeId(outcomeId)
                .side(side)
                .amount(new java.math.BigDecimal(amount))
                .sharesMode(sharesMode)
                .build();
    }
}
