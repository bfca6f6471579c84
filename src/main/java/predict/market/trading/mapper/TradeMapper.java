package predict.market.trading.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import predict.market.trading.domain.Trade;

import java.util.List;

/**
 * MyBatis mapper for Trade records
 */
@Mapper
public interface TradeMapper {

    int insert(Trade trade);

    Trade findById(@Param("tradeId") Long tradeId);

    List<Trade> findByUserId(@Param("userId") Long userId,
                             @Param("offset") int offset,
                             @Param("limit") int limit);

    long countByUserId(@Param("userId") Long userId);

    /**
     * Most recent trades of a market
     */
    List<Trade> findRecentByMarketId(@Param("marketId") Long marketId, @Param("limit") int limit);

    List<Trade> findByOrderId(@Param("orderId") Long orderId);
}
