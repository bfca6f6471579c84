package predict.market.trading.config;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.serializer.JsonSerializer;
import predict.market.trading.event.MarketResolvedEvent;
import predict.market.trading.event.TradeExecutedEvent;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producers for engine events.
 * Each event type gets its own template bound to its topic, keyed by market id.
 */
@Configuration
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${kafka.topics.trade-output}")
    private String tradeOutputTopic;

    @Value("${kafka.topics.market-resolution}")
    private String marketResolutionTopic;

    /**
     * Shared producer settings. Events leave only after the database commit,
     * so a send may be slow but must not be lost or duplicated.
     */
    @Bean
    public Map<String, Object> eventProducerProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        // plain JSON payloads, consumers need no Java type headers
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        return props;
    }

    @Bean
    public KafkaTemplate<String, TradeExecutedEvent> tradeKafkaTemplate() {
        return templateFor(tradeOutputTopic);
    }

    @Bean
    public KafkaTemplate<String, MarketResolvedEvent> resolutionKafkaTemplate() {
        return templateFor(marketResolutionTopic);
    }

    private <T> KafkaTemplate<String, T> templateFor(String topic) {
        KafkaTemplate<String, T> template = new KafkaTemplate<>(
                new DefaultKafkaProducerFactory<>(eventProducerProperties()));
        template.setDefaultTopic(topic);
        return template;
    }
}
