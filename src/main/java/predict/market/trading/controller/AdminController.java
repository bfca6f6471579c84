package predict.market.trading.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import predict.market.trading.dto.ApiResponse;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.UserResponse;
import predict.market.trading.service.UserService;

/**
 * Administrator-only user operations
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@Validated
@Tag(name = "Administration", description = "Administrator-only operations")
public class AdminController {

    private static final int MAX_PAGE_SIZE = 100;

    @Autowired
    private UserService userService;

    @GetMapping("/users")
    @Operation(summary = "List users")
    public ApiResponse<PageResponse<UserResponse>> listUsers(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ApiResponse.success(userService.listUsers(userId, PageRequest.of(page, limit, MAX_PAGE_SIZE)));
    }

    @PostMapping("/users/{targetUserId}/admin")
    @Operation(summary = "Grant administrator rights")
    public ApiResponse<UserResponse> grantAdmin(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable @NotNull Long targetUserId) {
        log.info("Grant admin request: targetUserId={}, by={}", targetUserId, userId);
        return ApiResponse.success("Administrator granted", UserResponse.fromUser(userService.grantAdmin(userId, targetUserId)));
    }
}
