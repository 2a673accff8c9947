package com.marketscan.engine;

import com.marketscan.config.EngineProperties;
import com.marketscan.domain.enums.ScanAction;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.StrategyDefinition;
import com.marketscan.domain.model.Trade;
import com.marketscan.domain.model.WeightedSignal;
import com.marketscan.exception.RiskLimitExceededException;
import com.marketscan.ledger.PositionLedger;
import com.marketscan.money.EntryPlan;
import com.marketscan.money.ExitDecision;
import com.marketscan.money.MoneyManager;
import com.marketscan.observability.ScanMetricsService;
import com.marketscan.risk.DailyRiskGate;
import com.marketscan.strategy.AggregatedVote;
import com.marketscan.strategy.SignalAggregator;
import com.marketscan.strategy.Vote;
import com.marketscan.timeseries.Candle;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One symbol's share of a tick.
 *
 * <p>With an open position only the exit rules run; a closed position is not re-entered in
 * the same tick. Without a position the enabled voters are aggregated and a non-HOLD decision
 * passes through the daily risk gate and the position sizer before the ledger opens it. A
 * SELL decision opens a short.
 *
 * <p>Exceptions other than a risk rejection propagate to the engine, which turns them into an
 * ERROR signal for the symbol.
 */
@Component
public class SymbolScanner {

    private static final Logger log = LoggerFactory.getLogger(SymbolScanner.class);

    private final SignalAggregator signalAggregator;
    private final MoneyManager moneyManager;
    private final DailyRiskGate dailyRiskGate;
    private final PositionLedger positionLedger;
    private final ScanMetricsService scanMetricsService;
    private final EngineProperties engineProperties;
    private final Clock clock;

    public SymbolScanner(
            SignalAggregator signalAggregator,
            MoneyManager moneyManager,
            DailyRiskGate dailyRiskGate,
            PositionLedger positionLedger,
            ScanMetricsService scanMetricsService,
            EngineProperties engineProperties,
            Clock clock) {
        this.signalAggregator = signalAggregator;
        this.moneyManager = moneyManager;
        this.dailyRiskGate = dailyRiskGate;
        this.positionLedger = positionLedger;
        this.scanMetricsService = scanMetricsService;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    public WeightedSignal scan(String symbol, ScanContext context, List<StrategyDefinition> strategies) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Candle> candles = context.dataSource().fetchCandles(symbol, engineProperties.getCandleCount());
        if (candles.size() < engineProperties.getMinCandles()) {
            log.debug("{}: {} candles, need {}", symbol, candles.size(), engineProperties.getMinCandles());
            return insufficientData(symbol, now, candles.size());
        }

        BigDecimal price = candles.get(candles.size() - 1).getClose();
        BigDecimal atr = moneyManager.currentAtr(candles);

        Position open = positionLedger.getPosition(symbol).orElse(null);
        if (open != null) {
            return manageOpenPosition(open, price, context, now);
        }
        return evaluateEntry(symbol, candles, price, atr, context, strategies, now);
    }

    /**
     * Aggregated signal with a sizing preview, without touching the ledger or risk counters.
     */
    public WeightedSignal preview(String symbol, ScanContext context, List<StrategyDefinition> strategies) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Candle> candles = context.dataSource().fetchCandles(symbol, engineProperties.getCandleCount());
        if (candles.size() < engineProperties.getMinCandles()) {
            return insufficientData(symbol, now, candles.size());
        }
        BigDecimal price = candles.get(candles.size() - 1).getClose();
        AggregatedVote vote = signalAggregator.aggregate(candles, strategies);
        WeightedSignal.WeightedSignalBuilder signal = baseSignal(symbol, now, vote, price).action(ScanAction.HOLD);
        if (vote.decision() == Vote.HOLD) {
            return signal.build();
        }
        EntryPlan plan = moneyManager.planEntry(
                symbol,
                vote.decision(),
                price,
                moneyManager.currentAtr(candles),
                context.riskState().getCapital(),
                positionLedger.getClosedTradePnls());
        return signal.suggestedQuantity(plan.quantity())
                .stopLoss(plan.stopLoss())
                .takeProfit(plan.takeProfit())
                .note("preview, not traded")
                .build();
    }

    private WeightedSignal manageOpenPosition(Position open, BigDecimal price, ScanContext context, LocalDateTime now) {
        String symbol = open.getSymbol();
        ExitDecision exit = moneyManager.evaluateExit(open, price);
        WeightedSignal.WeightedSignalBuilder signal = WeightedSignal.builder()
                .symbol(symbol)
                .timestamp(now)
                .votes(Map.of())
                .decision(Vote.HOLD)
                .price(price)
                .suggestedQuantity(open.getQuantity())
                .stopLoss(open.getStopLoss())
                .takeProfit(open.getTakeProfit());

        if (!exit.shouldExit()) {
            positionLedger.updateTrailingPeak(exit.position());
            return signal.action(ScanAction.IN_POSITION).build();
        }

        Trade closing = positionLedger.closePosition(symbol, price);
        context.riskState().recordRealizedPnl(closing.getPnl());
        scanMetricsService.positionClosed();
        log.info("{}: {} exit at {}, P&L {}", symbol, exit.reason(), price, closing.getPnl());
        return signal.action(ScanAction.POSITION_CLOSED)
                .note(exit.reason().name())
                .build();
    }

    private WeightedSignal evaluateEntry(
            String symbol,
            List<Candle> candles,
            BigDecimal price,
            BigDecimal atr,
            ScanContext context,
            List<StrategyDefinition> strategies,
            LocalDateTime now) {
        AggregatedVote vote = signalAggregator.aggregate(candles, strategies);
        WeightedSignal.WeightedSignalBuilder signal = baseSignal(symbol, now, vote, price);
        if (vote.decision() == Vote.HOLD) {
            return signal.action(ScanAction.HOLD).build();
        }

        try {
            dailyRiskGate.enforce(symbol, context.riskState());
        } catch (RiskLimitExceededException e) {
            log.info("{}: {} signal blocked by risk limits", symbol, vote.decision());
            return signal.action(ScanAction.RISK_BLOCKED).note(e.getMessage()).build();
        }

        EntryPlan plan = moneyManager.planEntry(
                symbol, vote.decision(), price, atr, context.riskState().getCapital(), positionLedger.getClosedTradePnls());
        signal.suggestedQuantity(plan.quantity()).stopLoss(plan.stopLoss()).takeProfit(plan.takeProfit());
        if (!plan.isTradeable()) {
            log.info("{}: {} signal sized to zero (ATR {})", symbol, vote.decision(), atr);
            return signal.action(ScanAction.SIZE_SUPPRESSED).build();
        }

        positionLedger.openPosition(
                symbol,
                plan.side(),
                price,
                plan.quantity(),
                plan.stopLoss(),
                plan.takeProfit(),
                attributeStrategy(vote, strategies));
        context.riskState().recordEntry(symbol);
        scanMetricsService.positionOpened();
        return signal.action(ScanAction.POSITION_OPENED).build();
    }

    /** The single strategy that voted for the decision, or null when several (or none) did. */
    static String attributeStrategy(AggregatedVote vote, List<StrategyDefinition> strategies) {
        List<StrategyDefinition> agreeing = strategies.stream()
                .filter(s -> vote.votes().get(s.getKind()) == vote.decision())
                .toList();
        return agreeing.size() == 1 ? agreeing.get(0).getId() : null;
    }

    private static WeightedSignal.WeightedSignalBuilder baseSignal(
            String symbol, LocalDateTime now, AggregatedVote vote, BigDecimal price) {
        return WeightedSignal.builder()
                .symbol(symbol)
                .timestamp(now)
                .votes(vote.votes())
                .score(vote.score())
                .decision(vote.decision())
                .confidence(vote.confidence())
                .price(price);
    }

    private static WeightedSignal insufficientData(String symbol, LocalDateTime now, int available) {
        return WeightedSignal.builder()
                .symbol(symbol)
                .timestamp(now)
                .votes(Map.of())
                .decision(Vote.HOLD)
                .action(ScanAction.HOLD)
                .note("insufficient data: " + available + " candles")
                .build();
    }
}
