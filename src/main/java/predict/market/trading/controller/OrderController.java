package predict.market.trading.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import predict.market.trading.domain.Order;
import predict.market.trading.dto.ApiResponse;
import predict.market.trading.dto.OpenOrdersResponse;
import predict.market.trading.dto.OrderResponse;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PlaceOrderRequest;
import predict.market.trading.dto.PlaceOrderResult;
import predict.market.trading.service.MatchingEngineService;
import predict.market.trading.service.OrderService;

/**
 * REST Controller for Order management
 * Handles order placement, query, and cancellation operations
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orders")
@Validated
@Tag(name = "Order Management", description = "APIs for order operations")
public class OrderController {

    private static final int MAX_PAGE_SIZE = 100;

    @Autowired
    private MatchingEngineService matchingEngineService;

    @Autowired
    private OrderService orderService;

    /**
     * Place a new order
     * Matching and settlement happen before the response is returned
     *
     * @param userId the caller
     * @param request the order
     * @return API response with the order and the resting orders it filled against
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Place an order",
        description = "Place a LIMIT or MARKET order on an outcome. LIMIT BUY reserves the amount; " +
                      "MARKET orders fill against resting LIMIT orders at the resting price."
    )
    public ApiResponse<PlaceOrderResult> placeOrder(
            @Parameter(description = "Caller user ID", required = true)
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody PlaceOrderRequest request) {
        log.info("Received place order request: userId={}, {}", userId, request);
        PlaceOrderResult result = matchingEngineService.placeOrder(userId, request);
        return ApiResponse.created("Order placed successfully", result);
    }

    /**
     * Query order by ID
     */
    @GetMapping("/{orderId}")
    @Operation(summary = "Query order by ID", description = "Owner or administrator only")
    public ApiResponse<OrderResponse> getOrder(
            @RequestHeader("X-User-Id") Long userId,
            @Parameter(description = "Order ID", required = true)
            @PathVariable @NotNull Long orderId) {
        log.debug("Querying order: orderId={}, userId={}", orderId, userId);
        Order order = orderService.getOrderForCaller(userId, orderId);
        return ApiResponse.success(OrderResponse.fromOrder(order));
    }

    /**
     * List open orders, with aggregated depth when both market and outcome are given
     */
    @GetMapping
    @Operation(
        summary = "List open orders",
        description = "Optionally filtered by market, outcome, or the caller's own orders. " +
                      "When marketId and outcomeId are both given, aggregated depth is included."
    )
    public ApiResponse<OpenOrdersResponse> listOpenOrders(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) Long marketId,
            @RequestParam(required = false) Long outcomeId,
            @Parameter(description = "Only the caller's own orders")
            @RequestParam(defaultValue = "false") boolean mine,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        PageRequest pageRequest = PageRequest.of(page, limit, MAX_PAGE_SIZE);
        return ApiResponse.success(orderService.listOpenOrders(marketId, outcomeId, mine ? userId : null, pageRequest));
    }

    /**
     * Cancel an order
     *
     * @param userId the owner or an administrator
     * @param orderId the order ID to cancel
     * @return API response with cancelled order details
     */
    @DeleteMapping("/{orderId}")
    @Operation(
        summary = "Cancel an order",
        description = "Cancel an OPEN order. The unfilled part of a LIMIT BUY is refunded."
    )
    public ApiResponse<OrderResponse> cancelOrder(
            @RequestHeader("X-User-Id") Long userId,
            @Parameter(description = "Order ID", required = true)
            @PathVariable @NotNull Long orderId) {
        log.info("Received cancel order request: orderId={}, userId={}", orderId, userId);
        Order cancelled = matchingEngineService.cancelOrder(userId, orderId);
        return ApiResponse.success("Order cancelled successfully", OrderResponse.fromOrder(cancelled));
    }
}
