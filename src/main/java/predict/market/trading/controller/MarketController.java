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
import predict.market.trading.dto.ApiResponse;
import predict.market.trading.dto.CreateMarketRequest;
import predict.market.trading.dto.MarketResponse;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.ResolutionResult;
import predict.market.trading.dto.ResolveMarketRequest;
import predict.market.trading.service.MarketService;
import predict.market.trading.service.ResolutionService;

/**
 * REST Controller for the market catalogue and resolution
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/markets")
@Validated
@Tag(name = "Markets", description = "APIs for market operations")
public class MarketController {

    private static final int MAX_PAGE_SIZE = 50;

    @Autowired
    private MarketService marketService;

    @Autowired
    private ResolutionService resolutionService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a market", description = "Administrator only. Outcomes start with an equal split.")
    public ApiResponse<MarketResponse> createMarket(
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody CreateMarketRequest request) {
        log.info("Creating market: userId={}, title={}", userId, request.getTitle());
        return ApiResponse.created("Market created successfully", marketService.createMarket(userId, request));
    }

    @GetMapping("/{marketId}")
    @Operation(summary = "Get market", description = "Market with outcomes and its most recent trades")
    public ApiResponse<MarketResponse> getMarket(
            @Parameter(description = "Market ID", required = true)
            @PathVariable @NotNull Long marketId) {
        return ApiResponse.success(marketService.getMarket(marketId));
    }

    @GetMapping
    @Operation(summary = "List markets", description = "Newest first, optionally filtered by category")
    public ApiResponse<PageResponse<MarketResponse>> listMarkets(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ApiResponse.success(marketService.listMarkets(category, PageRequest.of(page, limit, MAX_PAGE_SIZE)));
    }

    /**
     * Resolve a market: pay winners, close holdings, cancel open orders
     */
    @PostMapping("/{marketId}/resolve")
    @Operation(summary = "Resolve a market", description = "Administrator only")
    public ApiResponse<ResolutionResult> resolveMarket(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable @NotNull Long marketId,
            @Valid @RequestBody ResolveMarketRequest request) {
        log.info("Received resolve request: marketId={}, winningOutcomeId={}, userId={}",
                marketId, request.getWinningOutcomeId(), userId);
        ResolutionResult result = resolutionService.resolveMarket(userId, marketId, request.getWinningOutcomeId());
        return ApiResponse.success("Market resolved successfully", result);
    }
}
