package predict.market.trading.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import predict.market.trading.domain.User;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.RegisterUserRequest;
import predict.market.trading.dto.UserResponse;
import predict.market.trading.exception.DuplicateEmailException;
import predict.market.trading.exception.ForbiddenOperationException;
import predict.market.trading.exception.UserNotFoundException;
import predict.market.trading.mapper.UserMapper;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * User management service
 */
@Service
@Slf4j
public class UserService {

    @Autowired
    private UserMapper userMapper;

    @Value("${market.user.starting-balance:1000}")
    private BigDecimal startingBalance;

    /**
     * Emails that are granted administrator rights on registration
     */
    @Value("${market.admin.bootstrap-emails:}")
    private String[] bootstrapAdminEmails;

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder();

    /**
     * Register a new user with the starting balance
     */
    @Transactional
    public User register(RegisterUserRequest request) {
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);
        if (userMapper.findByEmail(email) != null) {
            throw new DuplicateEmailException("Email already registered: " + email);
        }

        LocalDateTime now = LocalDateTime.now();
        User user = User.builder()
                .name(request.getName().trim())
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .balance(startingBalance)
                .isAdmin(isBootstrapAdmin(email))
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEmailException("Email already registered: " + email);
        }

        log.info("User registered: userId={}, email={}, admin={}", user.getUserId(), email, user.getIsAdmin());
        return user;
    }

    public User getUser(Long userId) {
        User user = userMapper.findById(userId);
        if (user == null) {
            throw new UserNotFoundException("User not found: " + userId);
        }
        return user;
    }

    /**
     * @throws ForbiddenOperationException if the user is not an administrator
     */
    public User requireAdmin(Long userId) {
        User user = userMapper.findById(userId);
        if (user == null || !user.isAdministrator()) {
            throw new ForbiddenOperationException("Administrator privileges required");
        }
        return user;
    }

    /**
     * Grant administrator rights to another user
     */
    @Transactional
    public User grantAdmin(Long callerId, Long targetUserId) {
        requireAdmin(callerId);
        User target = getUser(targetUserId);
        if (!target.isAdministrator()) {
            userMapper.updateAdmin(targetUserId, true);
            target.setIsAdmin(true);
            log.info("Administrator granted: userId={}, by={}", targetUserId, callerId);
        }
        return target;
    }

    public PageResponse<UserResponse> listUsers(Long callerId, PageRequest pageRequest) {
        requireAdmin(callerId);
        List<User> users = userMapper.findPage(pageRequest.offset(), pageRequest.limit());
        return PageResponse.of(users, pageRequest.page(), pageRequest.limit(), userMapper.countAll())
                .map(UserResponse::fromUser);
    }

    /**
     * Check a password against the stored hash
     */
    public boolean passwordMatches(User user, String rawPassword) {
        return passwordEncoder.matches(rawPassword, user.getPasswordHash());
    }

    private boolean isBootstrapAdmin(String email) {
        return bootstrapAdminEmails != null && Arrays.stream(bootstrapAdminEmails)
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .anyMatch(email::equals);
    }
}
