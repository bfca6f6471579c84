package predict.market.trading.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import predict.market.trading.domain.User;
import predict.market.trading.dto.ApiResponse;
import predict.market.trading.dto.DepositRequest;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.PortfolioResponse;
import predict.market.trading.dto.RegisterUserRequest;
import predict.market.trading.dto.TransactionResponse;
import predict.market.trading.dto.UserResponse;
import predict.market.trading.service.LedgerService;
import predict.market.trading.service.PositionBookService;
import predict.market.trading.service.UserService;

/**
 * REST Controller for User management
 * Handles registration, balance, transaction history and holdings
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@Validated
@Tag(name = "User Management", description = "APIs for user operations")
public class UserController {

    private static final int MAX_PAGE_SIZE = 50;

    @Autowired
    private UserService userService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PositionBookService positionBookService;

    /**
     * Register a new user
     *
     * @param request the registration request
     * @return API response with created user details
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register a user", description = "Create an account with the starting balance")
    public ApiResponse<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        log.info("Registering user: email={}", request.getEmail());
        User user = userService.register(request);
        return ApiResponse.created("User created successfully", UserResponse.fromUser(user));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user", description = "Profile and balance of the caller")
    public ApiResponse<UserResponse> me(@RequestHeader("X-User-Id") Long userId) {
        return ApiResponse.success(UserResponse.fromUser(userService.getUser(userId)));
    }

    @PostMapping("/me/deposits")
    @Operation(summary = "Deposit", description = "Add virtual funds to the caller's balance")
    public ApiResponse<UserResponse> deposit(
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody DepositRequest request) {
        log.info("Deposit request: userId={}, amount={}", userId, request.getAmount());
        User user = ledgerService.deposit(userId, request.getAmount());
        return ApiResponse.success("Deposit successful", UserResponse.fromUser(user));
    }

    @GetMapping("/me/transactions")
    @Operation(summary = "Transaction history", description = "The caller's ledger entries, newest first")
    public ApiResponse<PageResponse<TransactionResponse>> transactions(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ApiResponse.success(ledgerService.getTransactions(userId, PageRequest.of(page, limit, MAX_PAGE_SIZE)));
    }

    @GetMapping("/me/holdings")
    @Operation(summary = "Portfolio", description = "Open holdings valued at the current probability")
    public ApiResponse<PortfolioResponse> holdings(@RequestHeader("X-User-Id") Long userId) {
        userService.getUser(userId);
        return ApiResponse.success(positionBookService.getPortfolio(userId));
    }
}
