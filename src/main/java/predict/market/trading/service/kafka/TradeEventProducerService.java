package predict.market.trading.service.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import predict.market.trading.event.TradeExecutedEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes executed trades to the trade output topic
 */
@Slf4j
@Service
public class TradeEventProducerService {

    @Autowired
    private KafkaTemplate<String, TradeExecutedEvent> tradeKafkaTemplate;

    /**
     * Send one trade. Keyed by market so a market's trades keep their order on one partition.
     * The trade is already committed, so a failed send is only logged.
     */
    public CompletableFuture<SendResult<String, TradeExecutedEvent>> publishTrade(TradeExecutedEvent event) {
        log.debug("Publishing trade: tradeId={}, orderId={}, marketId={}, outcomeId={}, side={}, shares={}, price={}",
                event.getTradeId(), event.getOrderId(), event.getMarketId(), event.getOutcomeId(),
                event.getSide(), event.getShares(), event.getPrice());

        return tradeKafkaTemplate.sendDefault(String.valueOf(event.getMarketId()), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Trade publish failed: tradeId={}, marketId={}, error={}",
                                event.getTradeId(), event.getMarketId(), ex.getMessage(), ex);
                        return;
                    }
                    log.info("Trade published: tradeId={}, topic={}, partition={}, offset={}",
                            event.getTradeId(), result.getRecordMetadata().topic(),
                            result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                });
    }
}
