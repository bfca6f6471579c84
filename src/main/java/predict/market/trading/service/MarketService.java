package predict.market.trading.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import predict.market.trading.domain.Market;
import predict.market.trading.domain.Outcome;
import predict.market.trading.dto.CreateMarketRequest;
import predict.market.trading.dto.MarketResponse;
import predict.market.trading.dto.PageRequest;
import predict.market.trading.dto.PageResponse;
import predict.market.trading.dto.TradeResponse;
import predict.market.trading.exception.InvalidOutcomeException;
import predict.market.trading.exception.InvalidRequestException;
import predict.market.trading.exception.MarketNotFoundException;
import predict.market.trading.exception.MarketResolvedException;
import predict.market.trading.mapper.MarketMapper;
import predict.market.trading.mapper.OutcomeMapper;
import predict.market.trading.mapper.TradeMapper;
import predict.market.trading.service.pricing.ProbabilityModel;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Market catalogue: creation, lookup, and the row lock every mutating operation starts with
 */
@Slf4j
@Service
public class MarketService {

    private static final int RECENT_TRADES = 10;

    @Autowired
    private MarketMapper marketMapper;

    @Autowired
    private OutcomeMapper outcomeMapper;

    @Autowired
    private TradeMapper tradeMapper;

    @Autowired
    private UserService userService;

    @Autowired
    private ProbabilityModel probabilityModel;

    /**
     * Create a market with an equal probability split across its outcomes
     */
    @Transactional
    public MarketResponse createMarket(Long callerId, CreateMarketRequest request) {
        userService.requireAdmin(callerId);

        if (!request.getEndDate().isAfter(LocalDateTime.now())) {
            throw new InvalidRequestException("End date must be in the future");
        }
        if (request.getOutcomes() == null || request.getOutcomes().size() < 2) {
            throw new InvalidRequestException("A market needs at least 2 outcomes");
        }

        LocalDateTime now = LocalDateTime.now();
        Market market = Market.builder()
                .title(request.getTitle().trim())
                .description(request.getDescription().trim())
                .category(request.getCategory().trim())
                .endDate(request.getEndDate())
                .creatorId(callerId)
                .volume(BigDecimal.ZERO)
                .isResolved(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        marketMapper.insert(market);

        BigDecimal[] split = probabilityModel.initialSplit(request.getOutcomes().size());
        for (int i = 0; i < split.length; i++) {
            CreateMarketRequest.OutcomeSpec spec = request.getOutcomes().get(i);
            outcomeMapper.insert(Outcome.builder()
                    .marketId(market.getMarketId())
                    .title(spec.getTitle().trim())
                    .description(spec.getDescription())
                    .probability(split[i])
                    .isResolved(false)
                    .build());
        }

        log.info("Market created: marketId={}, title={}, outcomes={}, by={}",
                market.getMarketId(), market.getTitle(), split.length, callerId);
        return MarketResponse.fromMarket(market, outcomeMapper.findByMarketId(market.getMarketId()));
    }

    /**
     * Market detail with outcomes and the most recent trades
     */
    public MarketResponse getMarket(Long marketId) {
        Market market = getMarketById(marketId);
        MarketResponse response = MarketResponse.fromMarket(market, outcomeMapper.findByMarketId(marketId));
        response.setRecentTrades(tradeMapper.findRecentByMarketId(marketId, RECENT_TRADES).stream()
                .map(TradeResponse::fromTrade)
                .toList());
        return response;
    }

    public PageResponse<MarketResponse> listMarkets(String category, PageRequest pageRequest) {
        List<Market> markets = marketMapper.findPage(category, pageRequest.offset(), pageRequest.limit());
        long total = marketMapper.count(category);
        return PageResponse.of(markets, pageRequest.page(), pageRequest.limit(), total)
                .map(m -> MarketResponse.fromMarket(m, outcomeMapper.findByMarketId(m.getMarketId())));
    }

    public Market getMarketById(Long marketId) {
        Market market = marketMapper.findById(marketId);
        if (market == null) {
            throw new MarketNotFoundException("Market not found: " + marketId);
        }
        return market;
    }

    /**
     * Lock the market row for the rest of the current transaction
     *
     * @throws MarketNotFoundException if the market does not exist
     */
    public Market lockMarket(Long marketId) {
        Market market = marketMapper.lockById(marketId);
        if (market == null) {
            throw new MarketNotFoundException("Market not found: " + marketId);
        }
        return market;
    }

    /**
     * @throws MarketResolvedException if the market no longer accepts trading
     */
    public void requireOpen(Market market) {
        if (market.isClosed()) {
            throw new MarketResolvedException("Market is already resolved: " + market.getMarketId());
        }
    }

    /**
     * @throws InvalidOutcomeException if the outcome is missing or belongs to another market
     */
    public Outcome requireOutcome(Market market, Long outcomeId) {
        Outcome outcome = outcomeMapper.findById(outcomeId);
        if (outcome == null || !outcome.getMarketId().equals(market.getMarketId())) {
            throw new InvalidOutcomeException(
                    "Outcome " + outcomeId + " does not belong to market " + market.getMarketId());
        }
        return outcome;
    }

    public void addVolume(Long marketId, BigDecimal notional) {
        marketMapper.addVolume(marketId, notional);
    }

    public List<Outcome> getOutcomes(Long marketId) {
        return outcomeMapper.findByMarketId(marketId);
    }
}
