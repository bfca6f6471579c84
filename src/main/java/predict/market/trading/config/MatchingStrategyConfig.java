package predict.market.trading.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import predict.market.trading.enums.OrderType;
import predict.market.trading.strategy.OrderMatchingStrategy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires matching strategies by order type and turns on the retry proxies
 * used by the engine's compare-and-swap writes
 */
@Slf4j
@Configuration
@EnableRetry
public class MatchingStrategyConfig {

    /**
     * One strategy per {@link OrderType}; startup fails if a type is missing or claimed twice
     */
    @Bean
    public Map<OrderType, OrderMatchingStrategy> matchingStrategies(List<OrderMatchingStrategy> strategies) {
        Map<OrderType, OrderMatchingStrategy> byType = new EnumMap<>(OrderType.class);
        for (OrderMatchingStrategy strategy : strategies) {
            OrderMatchingStrategy previous = byType.put(strategy.supportedType(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate matching strategy for " + strategy.supportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + strategy.getClass().getSimpleName());
            }
        }
        for (OrderType type : OrderType.values()) {
            if (!byType.containsKey(type)) {
                throw new IllegalStateException("No matching strategy registered for " + type);
            }
        }
        log.info("Matching strategies registered: {}", byType.keySet());
        return byType;
    }
}
