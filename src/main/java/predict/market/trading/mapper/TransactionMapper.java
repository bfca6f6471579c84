package predict.market.trading.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import predict.market.trading.domain.Transaction;
import predict.market.trading.enums.TransactionType;

import java.util.List;

/**
 * MyBatis mapper for ledger entries
 */
@Mapper
public interface TransactionMapper {

    int insert(Transaction transaction);

    List<Transaction> findByUserId(@Param("userId") Long userId,
                                   @Param("offset") int offset,
                                   @Param("limit") int limit);

    long countByUserId(@Param("userId") Long userId);

    List<Transaction> findByUserIdAndType(@Param("userId") Long userId,
                                          @Param("type") TransactionType type);
}
