package com.marketscan.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketscan.config.EngineProperties;
import com.marketscan.domain.enums.PositionSide;
import com.marketscan.domain.enums.ScanAction;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.StrategyDefinition;
import com.marketscan.domain.model.WeightedSignal;
import com.marketscan.engine.ScanContext;
import com.marketscan.engine.SymbolScanner;
import com.marketscan.ledger.PositionLedger;
import com.marketscan.ledger.TradeStore;
import com.marketscan.marketdata.MarketDataSource;
import com.marketscan.money.MoneyManagementConfig;
import com.marketscan.money.MoneyManager;
import com.marketscan.money.PositionSizerRegistry;
import com.marketscan.money.impl.AtrRiskSizer;
import com.marketscan.money.impl.HalfKellySizer;
import com.marketscan.observability.ScanMetricsService;
import com.marketscan.risk.DailyRiskGate;
import com.marketscan.risk.RiskLimits;
import com.marketscan.risk.RiskState;
import com.marketscan.strategy.AggregatedVote;
import com.marketscan.strategy.SignalAggregator;
import com.marketscan.strategy.Vote;
import com.marketscan.strategy.VoterKind;
import com.marketscan.timeseries.Candle;
import com.marketscan.unit.support.CandleFixtures;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Scanner decisions with the real money manager, risk gate and ledger; voters and market data
 * are mocked.
 */
@ExtendWith(MockitoExtension.class)
class SymbolScannerTest {

    private static final String SYMBOL = CandleFixtures.SYMBOL;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-11T05:00:00Z"), ZoneId.of("Asia/Kolkata"));

    private static final StrategyDefinition SMA = StrategyDefinition.builder()
            .id("s-sma").name("SMA Crossover").kind(VoterKind.SMA_CROSSOVER).build();
    private static final StrategyDefinition RSI = StrategyDefinition.builder()
            .id("s-rsi").name("RSI").kind(VoterKind.RSI).build();
    private static final List<StrategyDefinition> STRATEGIES = List.of(SMA, RSI);

    @Mock
    private SignalAggregator signalAggregator;

    @Mock
    private TradeStore tradeStore;

    @Mock
    private ScanMetricsService scanMetricsService;

    @Mock
    private MarketDataSource dataSource;

    private PositionLedger ledger;
    private RiskState riskState;
    private ScanContext context;
    private SymbolScanner scanner;

    @BeforeEach
    void setUp() {
        MoneyManagementConfig moneyConfig = new MoneyManagementConfig();
        AtrRiskSizer atrRiskSizer = new AtrRiskSizer(moneyConfig);
        MoneyManager moneyManager = new MoneyManager(
                moneyConfig,
                new PositionSizerRegistry(List.of(atrRiskSizer, new HalfKellySizer(moneyConfig, atrRiskSizer))));
        DailyRiskGate gate = new DailyRiskGate(RiskLimits.builder()
                .dailyLossPercentage(new BigDecimal("5.0"))
                .maxTradesPerSymbolPerDay(2)
                .build());
        ledger = new PositionLedger(tradeStore, CLOCK, 3);
        riskState = new RiskState(new BigDecimal("100000"), LocalDate.of(2025, 6, 11));
        context = new ScanContext(null, dataSource, riskState, new BigDecimal("100000"));
        scanner = new SymbolScanner(
                signalAggregator, moneyManager, gate, ledger, scanMetricsService, new EngineProperties(), CLOCK);
    }

    /** 60 bars with a constant true range of 4, so the ATR is 4; the last bar closes at {@code lastClose}. */
    private static List<Candle> candlesEndingAt(double lastClose) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < 59; i++) {
            candles.add(CandleFixtures.candle(i, 100, 102, 98, 100, 1000));
        }
        candles.add(CandleFixtures.candle(59, 100, Math.max(102, lastClose), Math.min(98, lastClose), lastClose, 1000));
        return candles;
    }

    private void givenCandles(List<Candle> candles) {
        when(dataSource.fetchCandles(eq(SYMBOL), anyInt())).thenReturn(candles);
    }

    private void givenVote(Vote decision, Map<VoterKind, Vote> votes, double score) {
        when(signalAggregator.aggregate(anyList(), eq(STRATEGIES)))
                .thenReturn(new AggregatedVote(votes, score, decision, 0.5));
    }

    @Nested
    @DisplayName("Without an open position")
    class Entry {

        @Test
        @DisplayName("Too few candles holds without voting")
        void insufficientData() {
            givenCandles(CandleFixtures.flat(30, 100));

            WeightedSignal signal = scanner.scan(SYMBOL, context, STRATEGIES);

            assertThat(signal.getAction()).isEqualTo(ScanAction.HOLD);
            assertThat(signal.getNote()).isEqualTo("insufficient data: 30 candles");
            verify(signalAggregator, never()).aggregate(anyList(), anyList());
        }

        @Test
        @DisplayName("A HOLD decision opens nothing")
        void holdDecision() {
            givenCandles(candlesEndingAt(100));
            givenVote(Vote.HOLD, Map.of(VoterKind.SMA_CROSSOVER, Vote.HOLD, VoterKind.RSI, Vote.HOLD), 0.0);

            WeightedSignal signal = scanner.scan(SYMBOL, context, STRATEGIES);

            assertThat(signal.getAction()).isEqualTo(ScanAction.HOLD);
            assertThat(signal.getPrice()).isEqualByComparingTo("100");
            assertThat(ledger.hasOpenPosition(SYMBOL)).isFalse();
        }

        @Test
        @DisplayName("A BUY decision opens a sized long attributed to the voting strategy")
        void buyOpensLong() {
            givenCandles(candlesEndingAt(100));
            givenVote(Vote.BUY, Map.of(VoterKind.SMA_CROSSOVER, Vote.BUY, VoterKind.RSI, Vote.HOLD), 0.56);

            WeightedSignal signal = scanner.scan(SYMBOL, context, STRATEGIES);

            // risk 2000 / (2 * ATR 4) = 250 shares
            assertThat(signal.getAction()).isEqualTo(ScanAction.POSITION_OPENED);
            assertThat(signal.getSuggestedQuantity()).isEqualTo(250);
            assertThat(signal.getStopLoss()).isEqualByComparingTo("92");
            assertThat(signal.getTakeProfit()).isEqualByComparingTo("116");
            assertThat(ledger.getPosition(SYMBOL)).hasValueSatisfying(p -> {
                assertThat(p.getSide()).isEqualTo(PositionSide.LONG);
                assertThat(p.getQuantity()).isEqualTo(250);
                assertThat(p.getStrategyId()).isEqualTo("s-sma");
            });
            assertThat(riskState.getTradesToday(SYMBOL)).isEqualTo(1);
            verify(scanMetricsService).positionOpened();
        }

        @Test
        @DisplayName("A SELL decision agreed by several voters opens an unattributed short")
        void sellOpensShort() {
            givenCandles(candlesEndingAt(100));
            givenVote(Vote.SELL, Map.of(VoterKind.SMA_CROSSOVER, Vote.SELL, VoterKind.RSI, Vote.SELL), -1.0);

            WeightedSignal signal = scanner.scan(SYMBOL, context, STRATEGIES);

            assertThat(signal.getAction()).isEqualTo(ScanAction.POSITION_OPENED);
            assertThat(ledger.getPosition(SYMBOL)).hasValueSatisfying(p -> {
                assertThat(p.getSide()).isEqualTo(PositionSide.SHORT);
                assertThat(p.getStopLoss()).isEqualByComparingTo("108");
                assertThat(p.getStrategyId()).isNull();
            });
        }

        @Test
        @DisplayName("A decision past the daily entry limit is blocked")
        void riskBlocked() {
            givenCandles(candlesEndingAt(100));
            givenVote(Vote.BUY, Map.of(VoterKind.SMA_CROSSOVER, Vote.BUY), 1.0);
            riskState.recordEntry(SYMBOL);
            riskState.recordEntry(SYMBOL);

            WeightedSignal signal = scanner.scan(SYMBOL, context, STRATEGIES);

            assertThat(signal.getAction()).isEqualTo(ScanAction.RISK_BLOCKED);
            assertThat(signal.getNote()).contains("MAX_DAILY_TRADES_REACHED");
            assertThat(ledger.hasOpenPosition(SYMBOL)).isFalse();
        }

        @Test
        @DisplayName("A decision sized to zero is suppressed")
        void sizeSuppressed() {
            RiskState poor = new RiskState(new BigDecimal("50"), LocalDate.of(2025, 6, 11));
            ScanContext poorContext = new ScanContext(null, dataSource, poor, new BigDecimal("50"));
            givenCandles(candlesEndingAt(100));
            givenVote(Vote.BUY, Map.of(VoterKind.SMA_CROSSOVER, Vote.BUY), 1.0);

            WeightedSignal signal = scanner.scan(SYMBOL, poorContext, STRATEGIES);

            assertThat(signal.getAction()).isEqualTo(ScanAction.SIZE_SUPPRESSED);
            assertThat(signal.getSuggestedQuantity()).isZero();
            assertThat(poor.getTradesToday(SYMBOL)).isZero();
            assertThat(ledger.hasOpenPosition(SYMBOL)).isFalse();
        }
    }

    @Nested
    @DisplayName("With an open position")
    class OpenPosition {

        @BeforeEach
        void openLong() {
            ledger.openPosition(
                    SYMBOL, PositionSide.LONG, new BigDecimal("100"), 10, new BigDecimal("92"),
                    new BigDecimal("110"), "s-sma");
        }

        @Test
        @DisplayName("Reaching the target closes the position and books the P&L")
        void takeProfit() {
            givenCandles(candlesEndingAt(112));

            WeightedSignal signal = scanner.scan(SYMBOL, context, STRATEGIES);

            assertThat(signal.getAction()).isEqualTo(ScanAction.POSITION_CLOSED);
            assertThat(signal.getNote()).isEqualTo("TAKE_PROFIT");
            assertThat(ledger.hasOpenPosition(SYMBOL)).isFalse();
            assertThat(riskState.getDailyRealizedPnl()).isEqualByComparingTo("120");
            assertThat(riskState.getCapital()).isEqualByComparingTo("100120");
            verify(scanMetricsService).positionClosed();
            verify(signalAggregator, never()).aggregate(anyList(), anyList());
        }

        @Test
        @DisplayName("Holding advances the stored trailing peak without voting")
        void holdsAndTracksPeak() {
            givenCandles(candlesEndingAt(105));

            WeightedSignal signal = scanner.scan(SYMBOL, context, STRATEGIES);

            assertThat(signal.getAction()).isEqualTo(ScanAction.IN_POSITION);
            assertThat(ledger.getPosition(SYMBOL).map(Position::getTrailingPeak))
                    .hasValueSatisfying(peak -> assertThat(peak).isEqualByComparingTo("105"));
            verify(signalAggregator, never()).aggregate(anyList(), anyList());
        }
    }

    @Test
    @DisplayName("Preview sizes the decision without trading")
    void previewDoesNotTrade() {
        givenCandles(candlesEndingAt(100));
        givenVote(Vote.BUY, Map.of(VoterKind.SMA_CROSSOVER, Vote.BUY), 1.0);

        WeightedSignal signal = scanner.preview(SYMBOL, context, STRATEGIES);

        assertThat(signal.getAction()).isEqualTo(ScanAction.HOLD);
        assertThat(signal.getDecision()).isEqualTo(Vote.BUY);
        assertThat(signal.getSuggestedQuantity()).isEqualTo(250);
        assertThat(signal.getNote()).isEqualTo("preview, not traded");
        assertThat(ledger.hasOpenPosition(SYMBOL)).isFalse();
        assertThat(riskState.getTradesToday(SYMBOL)).isZero();
    }

    @Test
    @DisplayName("Data source failures propagate to the engine")
    void dataSourceFailurePropagates() {
        when(dataSource.fetchCandles(anyString(), anyInt()))
                .thenThrow(new IllegalStateException("feed down"));

        assertThatThrownBy(() -> scanner.scan(SYMBOL, context, STRATEGIES))
                .isInstanceOf(IllegalStateException.class);
        verify(signalAggregator, never()).aggregate(any(), any());
    }
}
