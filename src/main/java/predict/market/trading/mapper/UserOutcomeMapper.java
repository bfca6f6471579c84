package predict.market.trading.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import predict.market.trading.domain.UserOutcome;

import java.util.List;

/**
 * MyBatis mapper for holdings
 */
@Mapper
public interface UserOutcomeMapper {

    int insert(UserOutcome holding);

    UserOutcome findByUserAndOutcome(@Param("userId") Long userId, @Param("outcomeId") Long outcomeId);

    /**
     * Write back quantity and average price
     */
    int update(UserOutcome holding);

    int deleteById(@Param("id") Long id);

    /**
     * Holdings with quantity > 0 across all outcomes of a market
     */
    List<UserOutcome> findPositiveByMarketId(@Param("marketId") Long marketId);

    /**
     * Holdings with quantity > 0 of one user
     */
    List<UserOutcome> findPositiveByUserId(@Param("userId") Long userId);

    /**
     * Zero every holding in a market, keeping the rows
     */
    int zeroByMarketId(@Param("marketId") Long marketId);
}
