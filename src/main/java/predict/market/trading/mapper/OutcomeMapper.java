package predict.market.trading.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import predict.market.trading.domain.Outcome;

import java.math.BigDecimal;
import java.util.List;

/**
 * MyBatis mapper for Outcome operations
 */
@Mapper
public interface OutcomeMapper {

    int insert(Outcome outcome);

    Outcome findById(@Param("outcomeId") Long outcomeId);

    /**
     * All outcomes of a market in creation order
     */
    List<Outcome> findByMarketId(@Param("marketId") Long marketId);

    /**
     * Compare-and-swap the probability
     *
     * @return 1 when the stored value still equalled {@code expected}, 0 when another writer got there first
     */
    int compareAndSetProbability(@Param("outcomeId") Long outcomeId,
                                 @Param("expected") BigDecimal expected,
                                 @Param("updated") BigDecimal updated);

    int markResolved(@Param("outcomeId") Long outcomeId);
}
