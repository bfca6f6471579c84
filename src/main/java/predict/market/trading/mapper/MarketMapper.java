package predict.market.trading.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import predict.market.trading.domain.Market;

import java.math.BigDecimal;
import java.util.List;

/**
 * MyBatis mapper for Market operations
 */
@Mapper
public interface MarketMapper {

    int insert(Market market);

    Market findById(@Param("marketId") Long marketId);

    /**
     * Read the market row with SELECT ... FOR UPDATE.
     * Every mutating engine operation takes this lock first, so work on one market serializes.
     */
    Market lockById(@Param("marketId") Long marketId);

    /**
     * Page through markets, newest first, optionally filtered by category
     */
    List<Market> findPage(@Param("category") String category,
                          @Param("offset") int offset,
                          @Param("limit") int limit);

    long count(@Param("category") String category);

    long countUnresolved();

    /**
     * Increment cumulative traded notional
     */
    int addVolume(@Param("marketId") Long marketId, @Param("delta") BigDecimal delta);

    /**
     * Flip isResolved to true and record the winner, only if still unresolved
     *
     * @return 1 when this call resolved the market, 0 otherwise
     */
    int markResolved(@Param("marketId") Long marketId, @Param("outcomeId") Long outcomeId);
}
