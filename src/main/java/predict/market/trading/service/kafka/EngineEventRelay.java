package predict.market.trading.service.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import predict.market.trading.event.MarketResolvedEvent;
import predict.market.trading.event.TradeExecutedEvent;

/**
 * Forwards engine events to Kafka once the transaction that produced them has committed.
 * Events from rolled-back work are dropped.
 */
@Slf4j
@Component
public class EngineEventRelay {

    @Autowired
    private TradeEventProducerService tradeEventProducerService;

    @Autowired
    private MarketEventProducerService marketEventProducerService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTradeExecuted(TradeExecutedEvent event) {
        try {
            tradeEventProducerService.publishTrade(event);
        } catch (Exception e) {
            log.error("Trade event relay failed: tradeId={}, error={}", event.getTradeId(), e.getMessage(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onMarketResolved(MarketResolvedEvent event) {
        try {
            marketEventProducerService.publishResolution(event);
        } catch (Exception e) {
            log.error("Resolution event relay failed: marketId={}, error={}", event.getMarketId(), e.getMessage(), e);
        }
    }
}
