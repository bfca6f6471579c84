package predict.market.trading.service.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import predict.market.trading.event.MarketResolvedEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes market settlements to the market resolution topic
 */
@Slf4j
@Service
public class MarketEventProducerService {

    @Autowired
    private KafkaTemplate<String, MarketResolvedEvent> resolutionKafkaTemplate;

    public CompletableFuture<SendResult<String, MarketResolvedEvent>> publishResolution(MarketResolvedEvent event) {
        log.info("Publishing market resolution: marketId={}, winningOutcomeId={}, holdersPaid={}, totalPayout={}",
                event.getMarketId(), event.getWinningOutcomeId(), event.getHoldersPaid(), event.getTotalPayout());

        return resolutionKafkaTemplate.sendDefault(String.valueOf(event.getMarketId()), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Market resolution publish failed: marketId={}, error={}",
                                event.getMarketId(), ex.getMessage(), ex);
                    } else {
                        log.info("Market resolution published: marketId={}, partition={}, offset={}",
                                event.getMarketId(), result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    }
                });
    }
}
