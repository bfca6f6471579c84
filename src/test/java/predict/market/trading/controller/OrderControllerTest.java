package predict.market.trading.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import predict.market.trading.BaseIntegrationTest;
import predict.market.trading.domain.User;
import predict.market.trading.dto.MarketResponse;
import predict.market.trading.dto.PlaceOrderResult;
import predict.market.trading.service.MatchingEngineService;
import predict.market.trading.testutil.OrderRequestBuilder;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the order endpoints: status codes and the response envelope
 */
@AutoConfigureMockMvc
@DisplayName("Order Controller Tests")
class OrderControllerTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MatchingEngineService matchingEngineService;

    private User trader;
    private MarketResponse market;

    @BeforeEach
    void setUp() {
        User admin = createAdmin();
        trader = createUser("Trader");
        market = createBinaryMarket(admin);
    }

    @Test
    @DisplayName("Scenario 1: LIMIT BUY is created, reserved and listed")
    void testPlaceLimitOrder() throws Exception {
        mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", trader.getUserId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(limitBuyJson("0.40", "100")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.code").value(201))
                .andExpect(jsonPath("$.data.order.status").value("OPEN"))
                .andExpect(jsonPath("$.data.order.side").value("BUY"))
                .andExpect(jsonPath("$.data.fullyFilled").value(false));

        assertBalance(trader, "900");

        mockMvc.perform(get("/api/v1/orders")
                        .header("X-User-Id", trader.getUserId())
                        .param("marketId", market.getMarketId().toString())
                        .param("outcomeId", outcomeId(market, 0).toString())
                        .param("mine", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.orders.items", hasSize(1)))
                .andExpect(jsonPath("$.data.orders.total").value(1))
                .andExpect(jsonPath("$.data.orderBook.bestBid").value(0.4))
                .andExpect(jsonPath("$.data.orderBook.bids[0].remaining").value(100.0))
                .andExpect(jsonPath("$.data.orderBook.bids[0].orderCount").value(1))
                .andExpect(jsonPath("$.data.orderBook.asks", hasSize(0)));
    }

    @Test
    @DisplayName("Scenario 2: Malformed requests are rejected with 400")
    void testBadRequests() throws Exception {
        // missing caller header
        mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(limitBuyJson("0.40", "100")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));

        // bean validation on amount
        mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", trader.getUserId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(limitBuyJson("0.40", "-5")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.amount").exists());

        // price outside [0.01, 0.99]
        mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", trader.getUserId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(limitBuyJson("1.50", "10")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.price").exists());

        // insufficient balance comes from the service layer
        mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", trader.getUserId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(limitBuyJson("0.40", "5000")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    @DisplayName("Scenario 3: Unknown order is 404, a stranger's order is 403")
    void testLookupErrors() throws Exception {
        mockMvc.perform(get("/api/v1/orders/{orderId}", 987654321L)
                        .header("X-User-Id", trader.getUserId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));

        Long orderId = placeLimitBuy();
        User stranger = createUser("Stranger");

        mockMvc.perform(get("/api/v1/orders/{orderId}", orderId)
                        .header("X-User-Id", stranger.getUserId()))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/v1/orders/{orderId}", orderId)
                        .header("X-User-Id", trader.getUserId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.orderId").value(orderId));
    }

    @Test
    @DisplayName("Scenario 4: Cancel refunds once, the second cancel is 409")
    void testDoubleCancel() throws Exception {
        Long orderId = placeLimitBuy();

        mockMvc.perform(delete("/api/v1/orders/{orderId}", orderId)
                        .header("X-User-Id", trader.getUserId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
        assertBalance(trader, "1000");

        mockMvc.perform(delete("/api/v1/orders/{orderId}", orderId)
                        .header("X-User-Id", trader.getUserId()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
        assertBalance(trader, "1000");
    }

    private Long placeLimitBuy() {
        PlaceOrderResult result = matchingEngineService.placeOrder(trader.getUserId(), OrderRequestBuilder.limit()
                .on(market.getMarketId(), outcomeId(market, 0))
                .buy().price("0.40").amount("100")
                .build());
        return result.getOrder().getOrderId();
    }

    private String limitBuyJson(String price, String amount) {
        return String.format(
                "{\"marketId\": %d, \"outcomeId\": %d, \"side\": \"BUY\", \"type\": \"LIMIT\", "
                        + "\"price\": %s, \"amount\": %s}",
                market.getMarketId(), outcomeId(market, 0), price, amount);
    }
}
