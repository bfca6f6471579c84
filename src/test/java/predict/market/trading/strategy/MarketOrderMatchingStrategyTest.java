package predict.market.trading.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import predict.market.trading.domain.Order;
import predict.market.trading.dto.Fill;
import predict.market.trading.dto.MatchResult;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.OrderStatus;
import predict.market.trading.enums.OrderType;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for fill arithmetic, no database
 */
@DisplayName("Market Order Matching Strategy Tests")
class MarketOrderMatchingStrategyTest {

    private final MarketOrderMatchingStrategy strategy = new MarketOrderMatchingStrategy();

    @Test
    @DisplayName("BUY notional is capped by the shares each resting sell offers")
    void testBuyAgainstSells() {
        // GIVEN: 10 to spend, 10 shares at 0.40 then 100 at 0.50
        Order buy = order(1L, OrderSide.BUY, OrderType.MARKET, "0.45", "10");
        Order ask1 = order(2L, OrderSide.SELL, OrderType.LIMIT, "0.40", "10");
        Order ask2 = order(3L, OrderSide.SELL, OrderType.LIMIT, "0.50", "100");

        // WHEN
        MatchResult result = strategy.match(buy, List.of(ask1, ask2));

        // THEN: 4 buys all of ask1, the other 6 buys 12 shares of ask2
        assertThat(result.isFullyMatched()).isTrue();
        assertThat(result.getFills()).hasSize(2);
        assertFill(result.getFills().get(0), ask1, "10", "4", "0");
        assertFill(result.getFills().get(1), ask2, "12", "6", "0");
        assertThat(result.totalShares()).isEqualByComparingTo("22");
        assertThat(result.totalNotional()).isEqualByComparingTo("10");

        assertThat(buy.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(ask1.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(ask2.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(ask2.getFilled()).isEqualByComparingTo("12");
    }

    @Test
    @DisplayName("SELL shares are capped by the notional each resting buy has left")
    void testSellAgainstBuys() {
        // GIVEN: 30 shares, bids with 12 left at 0.60 and 100 left at 0.50
        Order sell = order(1L, OrderSide.SELL, OrderType.MARKET, "0.55", "30");
        Order bid1 = order(2L, OrderSide.BUY, OrderType.LIMIT, "0.60", "12");
        Order bid2 = order(3L, OrderSide.BUY, OrderType.LIMIT, "0.50", "100");

        // WHEN
        MatchResult result = strategy.match(sell, List.of(bid1, bid2));

        // THEN: bid1 takes 20 shares for its 12, bid2 takes the last 10 for 5
        assertThat(result.getMatchedOrderIds()).containsExactly(2L, 3L);
        assertFill(result.getFills().get(0), bid1, "20", "12", "0");
        assertFill(result.getFills().get(1), bid2, "10", "5", "0");
        assertThat(sell.getFilled()).isEqualByComparingTo("30");
        assertThat(bid1.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(bid2.getFilled()).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("No liquidity leaves the order OPEN and unfilled")
    void testNoLiquidity() {
        Order buy = order(1L, OrderSide.BUY, OrderType.MARKET, "0.50", "10");

        MatchResult result = strategy.match(buy, List.of());

        assertThat(result.isFullyMatched()).isFalse();
        assertThat(result.getFills()).isEmpty();
        assertThat(buy.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(buy.getFilled()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("LIMIT orders rest without consuming liquidity")
    void testLimitStrategyRests() {
        LimitOrderMatchingStrategy limit = new LimitOrderMatchingStrategy();
        Order bid = order(1L, OrderSide.BUY, OrderType.LIMIT, "0.40", "10");

        MatchResult result = limit.match(bid, List.of());

        assertThat(limit.consumesLiquidity()).isFalse();
        assertThat(strategy.consumesLiquidity()).isTrue();
        assertThat(result.getFills()).isEmpty();
        assertThat(bid.getStatus()).isEqualTo(OrderStatus.OPEN);
    }

    private static void assertFill(Fill fill, Order maker, String shares, String notional, String makerFilledBefore) {
        assertThat(fill.getMakerOrder()).isSameAs(maker);
        assertThat(fill.getPrice()).isEqualByComparingTo(maker.getPrice());
        assertThat(fill.getShares()).isEqualByComparingTo(shares);
        assertThat(fill.getNotional()).isEqualByComparingTo(notional);
        assertThat(fill.getMakerFilledBefore()).isEqualByComparingTo(makerFilledBefore);
    }

    private static Order order(Long id, OrderSide side, OrderType type, String price, String amount) {
        return Order.builder()
                .orderId(id)
                .userId(id * 10)
                .marketId(1L)
                .outcomeId(1L)
                .side(side)
                .type(type)
                .price(new BigDecimal(price))
                .amount(new BigDecimal(amount))
                .status(OrderStatus.OPEN)
                .build();
    }
}
