package com.marketscan.backtest;

import com.marketscan.api.dto.request.BacktestRequest;
import com.marketscan.config.EngineProperties;
import com.marketscan.domain.enums.ExitReason;
import com.marketscan.domain.enums.TradeStatus;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.RiskMetrics;
import com.marketscan.domain.model.Trade;
import com.marketscan.marketdata.MarketDataProperties;
import com.marketscan.marketdata.SimulatedMarketDataSource;
import com.marketscan.money.EntryPlan;
import com.marketscan.money.ExitDecision;
import com.marketscan.money.MoneyManager;
import com.marketscan.reporting.RiskMetricsCalculator;
import com.marketscan.strategy.StrategyVoters;
import com.marketscan.strategy.Vote;
import com.marketscan.strategy.VoterParameters;
import com.marketscan.timeseries.Candle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays a single voter bar by bar over simulated history.
 *
 * <p>Entries use the same sizing and exit levels as the live engine. An open position closes
 * on take-profit, stop-loss or trailing stop, or when the voter signals the opposite
 * direction. Each bar sees only the candles up to and including itself. Results are
 * deterministic for a given symbol and bar count since the simulated walk is seeded per symbol.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final StrategyVoters strategyVoters;
    private final MoneyManager moneyManager;
    private final RiskMetricsCalculator riskMetricsCalculator;
    private final MarketDataProperties marketDataProperties;
    private final EngineProperties engineProperties;
    private final Clock clock;

    public BacktestService(
            StrategyVoters strategyVoters,
            MoneyManager moneyManager,
            RiskMetricsCalculator riskMetricsCalculator,
            MarketDataProperties marketDataProperties,
            EngineProperties engineProperties,
            Clock clock) {
        this.strategyVoters = strategyVoters;
        this.moneyManager = moneyManager;
        this.riskMetricsCalculator = riskMetricsCalculator;
        this.marketDataProperties = marketDataProperties;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    public BacktestResult run(BacktestRequest request) {
        // A private source so the backtest never advances the engine's live walk
        SimulatedMarketDataSource history = new SimulatedMarketDataSource(marketDataProperties, clock);
        return replay(request, history.fetchCandles(request.getSymbol(), request.getBars()));
    }

    /** Replays the request's voter over {@code candles}, oldest first. */
    public BacktestResult replay(BacktestRequest request, List<Candle> candles) {
        VoterParameters params = VoterParameters.of(request.getParams());
        int warmUp = engineProperties.getMinCandles();
        int window = engineProperties.getCandleCount();

        BigDecimal capital = request.getInitialCapital();
        List<BigDecimal> pnls = new ArrayList<>();
        List<Trade> closings = new ArrayList<>();
        List<BacktestTrade> trades = new ArrayList<>();
        Position position = null;

        for (int i = warmUp; i < candles.size(); i++) {
            List<Candle> visible = candles.subList(Math.max(0, i + 1 - window), i + 1);
            Candle bar = candles.get(i);
            BigDecimal price = bar.getClose();
            Vote vote = strategyVoters.vote(request.getVoterKind(), visible, params);

            if (position != null) {
                ExitDecision exit = moneyManager.evaluateExit(position, price);
                ExitReason reason = exit.reason();
                if (reason == null && isOpposite(position, vote)) {
                    reason = ExitReason.OPPOSITE_SIGNAL;
                }
                if (reason == null) {
                    position = exit.position();
                    continue;
                }
                BigDecimal pnl = position.unrealizedPnl(price).setScale(2, RoundingMode.HALF_UP);
                capital = capital.add(pnl);
                pnls.add(pnl);
                closings.add(Trade.builder()
                        .id("bt-" + trades.size())
                        .symbol(request.getSymbol())
                        .side(position.getSide().exitSide())
                        .quantity(position.getQuantity())
                        .price(price)
                        .status(TradeStatus.EXECUTED)
                        .timestamp(bar.getTimestamp())
                        .pnl(pnl)
                        .build());
                trades.add(new BacktestTrade(
                        position.getSide(),
                        position.getQuantity(),
                        position.getOpenedAt(),
                        position.getEntryPrice(),
                        bar.getTimestamp(),
                        price,
                        pnl,
                        reason));
                position = null;
                continue;
            }

            if (vote == Vote.HOLD) {
                continue;
            }
            EntryPlan plan = moneyManager.planEntry(
                    request.getSymbol(), vote, price, moneyManager.currentAtr(visible), capital, pnls);
            if (plan.isTradeable()) {
                position = Position.builder()
                        .symbol(request.getSymbol())
                        .side(plan.side())
                        .entryPrice(price)
                        .quantity(plan.quantity())
                        .stopLoss(plan.stopLoss())
                        .takeProfit(plan.takeProfit())
                        .trailingPeak(price)
                        .openedAt(bar.getTimestamp())
                        .build();
            }
        }

        RiskMetrics metrics = riskMetricsCalculator.calculate(
                closings, request.getInitialCapital(), capital, BigDecimal.ZERO, BigDecimal.ZERO, 0);
        int winners = (int) pnls.stream().filter(p -> p.signum() > 0).count();
        int losers = (int) pnls.stream().filter(p -> p.signum() < 0).count();
        log.info(
                "Backtest {} {} over {} bars: {} trades, P&L {}",
                request.getVoterKind(),
                request.getSymbol(),
                candles.size(),
                trades.size(),
                capital.subtract(request.getInitialCapital()));

        return new BacktestResult(
                request.getSymbol(),
                request.getVoterKind(),
                candles.size(),
                trades.size(),
                winners,
                losers,
                metrics.getWinRate(),
                capital.subtract(request.getInitialCapital()),
                capital,
                metrics.getMaxDrawdown(),
                metrics.getSharpeRatio(),
                metrics.getProfitFactor(),
                position != null,
                List.copyOf(trades));
    }

    private static boolean isOpposite(Position position, Vote vote) {
        return position.isLong() ? vote == Vote.SELL : vote == Vote.BUY;
    }
}
