package predict.market.trading.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import predict.market.trading.domain.Market;
import predict.market.trading.domain.Outcome;
import predict.market.trading.domain.UserOutcome;
import predict.market.trading.dto.HoldingResponse;
import predict.market.trading.dto.PortfolioResponse;
import predict.market.trading.enums.PositionSide;
import predict.market.trading.exception.InsufficientSharesException;
import predict.market.trading.mapper.MarketMapper;
import predict.market.trading.mapper.OrderMapper;
import predict.market.trading.mapper.OutcomeMapper;
import predict.market.trading.mapper.UserOutcomeMapper;
import predict.market.trading.util.DecimalScales;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Position Book: the only writer of UserOutcome holdings
 */
@Slf4j
@Service
public class PositionBookService {

    @Autowired
    private UserOutcomeMapper userOutcomeMapper;

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OutcomeMapper outcomeMapper;

    @Autowired
    private MarketMapper marketMapper;

    @Autowired
    private LedgerService ledgerService;

    /**
     * Add bought shares to a holding, recomputing the weighted-average cost
     *
     * @return the holding after the update
     */
    public UserOutcome acquire(Long userId, Long outcomeId, BigDecimal shares, BigDecimal price) {
        LocalDateTime now = LocalDateTime.now();
        UserOutcome holding = userOutcomeMapper.findByUserAndOutcome(userId, outcomeId);

        if (holding == null) {
            holding = UserOutcome.builder()
                    .userId(userId)
                    .outcomeId(outcomeId)
                    .quantity(DecimalScales.amount(shares))
                    .avgPrice(DecimalScales.amount(price))
                    .positionSide(PositionSide.YES)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            userOutcomeMapper.insert(holding);
            log.debug("Holding opened: userId={}, outcomeId={}, qty={}, avg={}",
                    userId, outcomeId, holding.getQuantity(), holding.getAvgPrice());
            return holding;
        }

        BigDecimal oldQty = holding.getQuantity();
        BigDecimal newQty = oldQty.add(shares);
        BigDecimal cost = oldQty.multiply(holding.getAvgPrice()).add(shares.multiply(price));

        holding.setQuantity(DecimalScales.amount(newQty));
        holding.setAvgPrice(cost.divide(newQty, DecimalScales.AMOUNT_SCALE, RoundingMode.HALF_UP));
        holding.setUpdatedAt(now);
        userOutcomeMapper.update(holding);

        log.debug("Holding increased: userId={}, outcomeId={}, qty={}, avg={}",
                userId, outcomeId, holding.getQuantity(), holding.getAvgPrice());
        return holding;
    }

    /**
     * Remove sold shares from a holding. A full sell deletes the row.
     *
     * @return realized P&L, {@code sold x (price - avgPrice)}
     * @throws InsufficientSharesException if the holding is smaller than {@code shares}
     */
    public BigDecimal dispose(Long userId, Long outcomeId, BigDecimal shares, BigDecimal price) {
        UserOutcome holding = userOutcomeMapper.findByUserAndOutcome(userId, outcomeId);
        if (holding == null || holding.getQuantity().compareTo(shares) < 0) {
            throw new InsufficientSharesException(String.format(
                    "Insufficient shares: userId=%d, outcomeId=%d, held=%s, required=%s",
                    userId, outcomeId,
                    holding == null ? "0" : holding.getQuantity().toPlainString(),
                    shares.toPlainString()));
        }

        BigDecimal realizedPnL = DecimalScales.amount(shares.multiply(price.subtract(holding.getAvgPrice())));
        BigDecimal remaining = holding.getQuantity().subtract(shares);

        if (remaining.signum() == 0) {
            userOutcomeMapper.deleteById(holding.getId());
            log.debug("Holding closed: userId={}, outcomeId={}, realizedPnL={}", userId, outcomeId, realizedPnL);
        } else {
            holding.setQuantity(DecimalScales.amount(remaining));
            holding.setUpdatedAt(LocalDateTime.now());
            userOutcomeMapper.update(holding);
            log.debug("Holding reduced: userId={}, outcomeId={}, qty={}, realizedPnL={}",
                    userId, outcomeId, holding.getQuantity(), realizedPnL);
        }
        return realizedPnL;
    }

    /**
     * Shares held minus shares committed to the user's open LIMIT SELL orders
     */
    public BigDecimal availableShares(Long userId, Long outcomeId) {
        UserOutcome holding = userOutcomeMapper.findByUserAndOutcome(userId, outcomeId);
        if (holding == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal reserved = orderMapper.sumOpenSellRemaining(userId, outcomeId);
        return holding.getQuantity().subtract(reserved == null ? BigDecimal.ZERO : reserved);
    }

    /**
     * @throws InsufficientSharesException if fewer than {@code shares} are available
     */
    public void requireAvailable(Long userId, Long outcomeId, BigDecimal shares) {
        BigDecimal available = availableShares(userId, outcomeId);
        if (available.compareTo(shares) < 0) {
            throw new InsufficientSharesException(String.format(
                    "Insufficient shares: userId=%d, outcomeId=%d, available=%s, required=%s",
                    userId, outcomeId, available.toPlainString(), shares.toPlainString()));
        }
    }

    public UserOutcome getHolding(Long userId, Long outcomeId) {
        return userOutcomeMapper.findByUserAndOutcome(userId, outcomeId);
    }

    /**
     * Holdings with a positive quantity in any outcome of the market
     */
    public List<UserOutcome> getOpenPositions(Long marketId) {
        return userOutcomeMapper.findPositiveByMarketId(marketId);
    }

    /**
     * Zero every holding of a resolved market. Rows are kept for history.
     *
     * @return number of holdings closed
     */
    public int closeOutMarket(Long marketId) {
        int closed = userOutcomeMapper.zeroByMarketId(marketId);
        log.info("Holdings closed out: marketId={}, count={}", marketId, closed);
        return closed;
    }

    /**
     * Value every open holding of a user at the current probability, grouped by market
     */
    public PortfolioResponse getPortfolio(Long userId) {
        BigDecimal balance = ledgerService.getBalance(userId);
        List<UserOutcome> holdings = userOutcomeMapper.findPositiveByUserId(userId);

        Map<Long, PortfolioResponse.MarketHoldings> byMarket = new LinkedHashMap<>();
        BigDecimal totalValue = BigDecimal.ZERO;
        BigDecimal totalCost = BigDecimal.ZERO;

        for (UserOutcome holding : holdings) {
            Outcome outcome = outcomeMapper.findById(holding.getOutcomeId());
            Market market = marketMapper.findById(outcome.getMarketId());

            BigDecimal cost = holding.getQuantity().multiply(holding.getAvgPrice());
            BigDecimal value = DecimalScales.amount(holding.getQuantity().multiply(outcome.getProbability()));
            BigDecimal pnl = DecimalScales.amount(value.subtract(cost));

            HoldingResponse response = HoldingResponse.builder()
                    .outcomeId(outcome.getOutcomeId())
                    .outcomeTitle(outcome.getTitle())
                    .positionSide(holding.getPositionSide())
                    .quantity(holding.getQuantity())
                    .avgPrice(holding.getAvgPrice())
                    .currentPrice(outcome.getProbability())
                    .currentValue(value)
                    .unrealizedPnL(pnl)
                    .percentChange(percentOf(pnl, cost))
                    .isResolved(market.isClosed())
                    .isWinner(outcome.getOutcomeId().equals(market.getResolvedOutcomeId()))
                    .build();

            PortfolioResponse.MarketHoldings group = byMarket.computeIfAbsent(market.getMarketId(),
                    id -> PortfolioResponse.MarketHoldings.builder()
                            .marketId(id)
                            .marketTitle(market.getTitle())
                            .isResolved(market.getIsResolved())
                            .holdings(new ArrayList<>())
                            .totalValue(BigDecimal.ZERO)
                            .totalPnL(BigDecimal.ZERO)
                            .build());
            group.getHoldings().add(response);
            group.setTotalValue(group.getTotalValue().add(value));
            group.setTotalPnL(group.getTotalPnL().add(pnl));

            totalValue = totalValue.add(value);
            totalCost = totalCost.add(cost);
        }

        BigDecimal totalPnL = DecimalScales.amount(totalValue.subtract(totalCost));
        return PortfolioResponse.builder()
                .userId(userId)
                .balance(balance)
                .markets(new ArrayList<>(byMarket.values()))
                .summary(PortfolioResponse.Summary.builder()
                        .totalValue(DecimalScales.amount(totalValue))
                        .totalPnL(totalPnL)
                        .pnlPercentage(percentOf(totalPnL, totalCost))
                        .positionCount(holdings.size())
                        .build())
                .build();
    }

    private BigDecimal percentOf(BigDecimal part, BigDecimal base) {
        if (base.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return part.multiply(DecimalScales.ONE_HUNDRED).divide(base, 2, RoundingMode.HALF_UP);
    }
}
