package predict.market.trading.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import predict.market.trading.domain.User;

import java.math.BigDecimal;
import java.util.List;

/**
 * MyBatis mapper for User operations
 */
@Mapper
public interface UserMapper {
    /**
     * Insert a new user
     */
    int insert(User user);

    /**
     * Find user by ID
     */
    User findById(@Param("userId") Long userId);

    /**
     * Find user by email
     */
    User findByEmail(@Param("email") String email);

    /**
     * Add a signed delta to the balance in one statement.
     * The row is only updated when the resulting balance stays non-negative.
     *
     * @return number of rows affected, 0 when the user is missing or the debit would overdraw
     */
    int applyBalanceDelta(@Param("userId") Long userId, @Param("delta") BigDecimal delta);

    /**
     * Set the administrator flag
     */
    int updateAdmin(@Param("userId") Long userId, @Param("isAdmin") boolean isAdmin);

    /**
     * Page through users, newest first
     */
    List<User> findPage(@Param("offset") int offset, @Param("limit") int limit);

    long countAll();
}
