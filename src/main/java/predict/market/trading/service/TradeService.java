package predict.market.trading.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import predict.market.trading.domain.Market;
import predict.market.trading.domain.Outcome;
import predict.market.trading.domain.Trade;
import predict.market.trading.dto.ExecuteTradeRequest;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.TradeResponse;
import predict.market.trading.dto.TradeResult;
import predict.market.trading.enums.OrderSide;
import predict.market.trading.enums.TransactionType;
import predict.market.trading.event.TradeExecutedEvent;
import predict.market.trading.exception.ConcurrentUpdateException;
import predict.market.trading.exception.InvalidRequestException;
import predict.market.trading.mapper.TradeMapper;
import predict.market.trading.service.pricing.PricingEngine;
import predict.market.trading.util.DecimalScales;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trade records and the immediate-execution path that trades against the current probability
 */
@Slf4j
@Service
public class TradeService {

    @Autowired
    private TradeMapper tradeMapper;

    @Autowired
    private MarketService marketService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PositionBookService positionBookService;

    @Autowired
    private PricingEngine pricingEngine;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter ammBuyCounter;
    private Counter ammSellCounter;

    @PostConstruct
    public void initMetrics() {
        ammBuyCounter = Counter.builder("market.amm.trades")
                .description("Trades executed against the current probability")
                .tag("side", "BUY")
                .register(meterRegistry);
        ammSellCounter = Counter.builder("market.amm.trades")
                .description("Trades executed against the current probability")
                .tag("side", "SELL")
                .register(meterRegistry);
    }

    /**
     * Persist a trade row and queue its event for after commit
     *
     * @param trade the trade to create
     * @return the created trade with generated ID
     */
    public Trade createTrade(Trade trade) {
        if (trade.getCreatedAt() == null) {
            trade.setCreatedAt(LocalDateTime.now());
        }
        tradeMapper.insert(trade);
        eventPublisher.publishEvent(TradeExecutedEvent.fromTrade(trade));

        log.debug("Trade created: tradeId={}, orderId={}, userId={}, side={}, amount={}, shares={}, price={}",
                trade.getTradeId(), trade.getOrderId(), trade.getUserId(), trade.getSide(),
                trade.getAmount(), trade.getShares(), trade.getPrice());
        return trade;
    }

    /**
     * Buy or sell immediately at the outcome's current probability, then apply the price impact.
     * The house is the counterparty, so only one trade row is written.
     */
    @Retryable(retryFor = {ConcurrentUpdateException.class, CannotAcquireLockException.class},
               maxAttempts = 3, backoff = @Backoff(delay = 20, multiplier = 2))
    @Transactional
    public TradeResult executeTrade(Long userId, ExecuteTradeRequest request) {
        log.info("Executing trade: userId={}, marketId={}, outcomeId={}, side={}, amount={}, sharesMode={}",
                userId, request.getMarketId(), request.getOutcomeId(), request.getSide(),
                request.getAmount(), request.isSharesMode());

        if (!DecimalScales.isPositive(request.getAmount())) {
            throw new InvalidRequestException("Amount must be greater than 0");
        }
        ledgerService.getUser(userId);

        Market market = marketService.lockMarket(request.getMarketId());
        marketService.requireOpen(market);
        Outcome outcome = marketService.requireOutcome(market, request.getOutcomeId());

        BigDecimal price = outcome.getProbability();
        if (!DecimalScales.isPositive(price)) {
            throw new IllegalStateException("Outcome " + outcome.getOutcomeId() + " has non-positive probability");
        }

        BigDecimal amount = DecimalScales.amount(request.getAmount());
        BigDecimal notional;
        BigDecimal shares;
        BigDecimal realizedPnL = null;

        if (request.getSide() == OrderSide.BUY) {
            notional = request.isSharesMode() ? DecimalScales.notionalOf(amount, price) : amount;
            shares = DecimalScales.sharesFor(notional, price);
            if (!DecimalScales.isPositive(notional) || !DecimalScales.isPositive(shares)) {
                throw new InvalidRequestException("Trade amount is too small");
            }
            ledgerService.requireBalance(userId, notional);

            positionBookService.acquire(userId, outcome.getOutcomeId(), shares, price);
            ledgerService.apply(userId, notional.negate(), TransactionType.TRADE_BUY,
                    tradeMetadata(market, outcome, shares, price, null));
            ammBuyCounter.increment();
        } else {
            shares = request.isSharesMode() ? amount : DecimalScales.sharesFor(amount, price);
            notional = request.isSharesMode() ? DecimalScales.notionalOf(amount, price) : amount;
            if (!DecimalScales.isPositive(notional) || !DecimalScales.isPositive(shares)) {
                throw new InvalidRequestException("Trade amount is too small");
            }
            positionBookService.requireAvailable(userId, outcome.getOutcomeId(), shares);

            realizedPnL = positionBookService.dispose(userId, outcome.getOutcomeId(), shares, price);
            ledgerService.apply(userId, notional, TransactionType.TRADE_SELL,
                    tradeMetadata(market, outcome, shares, price, realizedPnL));
            ammSellCounter.increment();
        }

        Trade trade = createTrade(Trade.builder()
                .userId(userId)
                .marketId(market.getMarketId())
                .outcomeId(outcome.getOutcomeId())
                .side(request.getSide())
                .amount(notional)
                .shares(shares)
                .price(price)
                .build());

        Map<Long, BigDecimal> probabilities = pricingEngine.applyTradeImpact(market.getMarketId(),
                outcome.getOutcomeId(), notional, market.getVolume(), request.getSide());
        marketService.addVolume(market.getMarketId(), notional);

        log.info("Trade executed: tradeId={}, userId={}, side={}, notional={}, shares={}, price={}, newProbability={}",
                trade.getTradeId(), userId, trade.getSide(), notional, shares, price,
                probabilities.get(outcome.getOutcomeId()));

        return TradeResult.builder()
                .trade(TradeResponse.fromTrade(trade))
                .realizedPnL(realizedPnL)
                .balanceAfter(ledgerService.getBalance(userId))
                .newProbability(probabilities.get(outcome.getOutcomeId()))
                .build();
    }

    public PageResponse<TradeResponse> getTradeHistory(Long userId, PageRequest pageRequest) {
        List<Trade> trades = tradeMapper.findByUserId(userId, pageRequest.offset(), pageRequest.limit());
        long total = tradeMapper.countByUserId(userId);
        return PageResponse.of(trades, pageRequest.page(), pageRequest.limit(), total)
                .map(TradeResponse::fromTrade);
    }

    public List<Trade> getTradesByOrderId(Long orderId) {
        return tradeMapper.findByOrderId(orderId);
    }

    /**
     * Metadata stored with TRADE_BUY / TRADE_SELL ledger entries
     */
    static Map<String, Object> tradeMetadata(Market market, Outcome outcome, BigDecimal shares,
                                             BigDecimal price, BigDecimal profitLoss) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("marketId", market.getMarketId());
        metadata.put("outcomeId", outcome.getOutcomeId());
        metadata.put("shares", shares);
        metadata.put("price", price);
        if (profitLoss != null) {
            metadata.put("profitLoss", profitLoss);
        }
        return metadata;
    }
}
