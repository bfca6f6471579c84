package predict.market.trading.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import predict.market.trading.dto.ApiResponse;
import predict.market.trading.dto.ExecuteTradeRequest;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.TradeResponse;
import predict.market.trading.dto.TradeResult;
import predict.market.trading.service.TradeService;

/**
 * REST Controller for immediate trades and trade history
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/trades")
@Validated
@Tag(name = "Trades", description = "Trade at the current probability and query trade history")
public class TradeController {

    private static final int MAX_PAGE_SIZE = 50;

    @Autowired
    private TradeService tradeService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Execute a trade",
        description = "Buy or sell an outcome at its current probability. The price moves after the trade."
    )
    public ApiResponse<TradeResult> executeTrade(
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody ExecuteTradeRequest request) {
        log.info("Received trade request: userId={}, {}", userId, request);
        return ApiResponse.created("Trade executed successfully", tradeService.executeTrade(userId, request));
    }

    @GetMapping
    @Operation(summary = "Trade history", description = "The caller's trades, newest first")
    public ApiResponse<PageResponse<TradeResponse>> getTrades(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ApiResponse.success(tradeService.getTradeHistory(userId, PageRequest.of(page, limit, MAX_PAGE_SIZE)));
    }
}
