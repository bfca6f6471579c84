package predict.market.trading.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import predict.market.trading.mapper.MarketMapper;
import predict.market.trading.mapper.OrderMapper;

/**
 * Prometheus metrics: common tags plus book-level gauges.
 * Counters for orders, fills, trades and resolutions are registered by the services that own them.
 */
@Slf4j
@Configuration
public class MetricsConfig {

    @Value("${spring.application.name:prediction-market-engine}")
    private String applicationName;

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTagsCustomizer() {
        return registry -> {
            registry.config().commonTags("service", applicationName, "component", "trading-core");
            log.info("Registered common metric tags: service={}", applicationName);
        };
    }

    /**
     * Gauges read from the store on each scrape
     */
    @Bean
    public MeterBinder bookGauges(OrderMapper orderMapper, MarketMapper marketMapper) {
        return registry -> {
            Gauge.builder("market.orders.open", orderMapper, m -> m.countOpen(null, null, null))
                    .description("OPEN orders across all markets")
                    .register(registry);
            Gauge.builder("market.markets.unresolved", marketMapper, MarketMapper::countUnresolved)
                    .description("Markets still accepting orders")
                    .register(registry);
        };
    }
}
