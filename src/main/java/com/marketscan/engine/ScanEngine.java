package com.marketscan.engine;

import com.marketscan.calendar.TradingCalendarService;
import com.marketscan.config.EngineProperties;
import com.marketscan.domain.enums.EngineMode;
import com.marketscan.domain.enums.EngineState;
import com.marketscan.domain.model.EngineSnapshot;
import com.marketscan.domain.model.Position;
import com.marketscan.domain.model.RiskMetrics;
import com.marketscan.domain.model.StrategyDefinition;
import com.marketscan.domain.model.WeightedSignal;
import com.marketscan.exception.DataSourceUnavailableException;
import com.marketscan.exception.EngineConfigurationException;
import com.marketscan.exception.ResourceNotFoundException;
import com.marketscan.ledger.PositionLedger;
import com.marketscan.marketdata.MarketDataSource;
import com.marketscan.marketdata.MarketDataSourceFactory;
import com.marketscan.observability.ScanMetricsService;
import com.marketscan.reporting.RiskMetricsCalculator;
import com.marketscan.risk.RiskState;
import com.marketscan.strategy.StrategyStore;
import com.marketscan.user.BrokerCredentials;
import com.marketscan.user.UserCredentialService;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * The autonomous scan loop.
 *
 * <p>Lifecycle: {@code STOPPED -> RUNNING -> STOPPING -> STOPPED}. {@link #start(String)} and
 * {@link #stop()} are idempotent. While running, a dedicated {@code scan-loop} thread repeats:
 * <ol>
 *   <li>roll the risk counters over on a new trading date</li>
 *   <li>if the market is closed, wait {@code inactiveScanInterval} and repeat</li>
 *   <li>retry failed ledger writes and reload the enabled strategies</li>
 *   <li>scan every symbol concurrently on {@code scanWorkerExecutor} and wait for all</li>
 *   <li>publish a new {@link EngineSnapshot}, then wait {@code activeScanInterval}</li>
 * </ol>
 *
 * <p>The wait between ticks is an await on the stop latch, so a stop request is seen
 * immediately but never interrupts a tick in progress. A failure of one symbol is recorded
 * against that symbol and does not affect the others. A failure of the tick as a whole backs
 * off for {@code errorBackoff}.
 *
 * <p>If the loop thread outlives both stop timeouts the engine stays STOPPING, and a start is
 * ignored, until that thread exits. Each loop only watches the stop latch of the start that
 * created it.
 *
 * <p>All run state (risk counters, signal log, snapshot) belongs to this instance.
 */
@Service
public class ScanEngine {

    private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

    private final StrategyStore strategyStore;
    private final MarketDataSourceFactory marketDataSourceFactory;
    private final UserCredentialService userCredentialService;
    private final TradingCalendarService tradingCalendarService;
    private final PositionLedger positionLedger;
    private final SymbolScanner symbolScanner;
    private final RiskMetricsCalculator riskMetricsCalculator;
    private final ScanMetricsService scanMetricsService;
    private final EngineProperties engineProperties;
    private final Executor scanWorkerExecutor;
    private final Clock clock;

    private final SignalLog signalLog;
    private final AtomicLong scanCount = new AtomicLong();
    private final Map<String, String> lastErrors = new ConcurrentHashMap<>();
    private final AtomicReference<EngineSnapshot> snapshot = new AtomicReference<>();

    private volatile EngineState state = EngineState.STOPPED;
    private volatile ScanContext context;
    private volatile List<StrategyDefinition> strategies = List.of();
    private volatile LocalDateTime lastScanAt;
    private volatile boolean marketOpen;

    private Thread loopThread;
    private CountDownLatch stopSignal = new CountDownLatch(0);
    /** Set when stop() gave up on the loop thread; guarded by this. */
    private boolean stopAbandoned;
    private CountDownLatch loopFinished = new CountDownLatch(0);

    public ScanEngine(
            StrategyStore strategyStore,
            MarketDataSourceFactory marketDataSourceFactory,
            UserCredentialService userCredentialService,
            TradingCalendarService tradingCalendarService,
            PositionLedger positionLedger,
            SymbolScanner symbolScanner,
            RiskMetricsCalculator riskMetricsCalculator,
            ScanMetricsService scanMetricsService,
            EngineProperties engineProperties,
            @Qualifier("scanWorkerExecutor") Executor scanWorkerExecutor,
            Clock clock) {
        this.strategyStore = strategyStore;
        this.marketDataSourceFactory = marketDataSourceFactory;
        this.userCredentialService = userCredentialService;
        this.tradingCalendarService = tradingCalendarService;
        this.positionLedger = positionLedger;
        this.symbolScanner = symbolScanner;
        this.riskMetricsCalculator = riskMetricsCalculator;
        this.scanMetricsService = scanMetricsService;
        this.engineProperties = engineProperties;
        this.scanWorkerExecutor = scanWorkerExecutor;
        this.clock = clock;
        this.signalLog = new SignalLog(engineProperties.getSignalLogCapacity());
        publishSnapshot();
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the scan loop for {@code userId}, or in simulation without a user.
     *
     * @throws EngineConfigurationException if no symbols are configured or the strategy store
     *                                      cannot be read
     * @throws ResourceNotFoundException    if the user does not exist
     */
    public synchronized EngineSnapshot start(String userId) {
        if (state != EngineState.STOPPED) {
            log.info("Engine already {}, ignoring start", state);
            return getSnapshot();
        }
        if (engineProperties.getSymbols() == null || engineProperties.getSymbols().isEmpty()) {
            throw new EngineConfigurationException("No symbols configured under marketscan.engine.symbols");
        }

        List<StrategyDefinition> loaded;
        try {
            loaded = strategyStore.listEnabledStrategies();
        } catch (RuntimeException e) {
            throw new EngineConfigurationException("Strategy store unreachable: " + e.getMessage(), e);
        }

        MarketDataSource dataSource;
        BigDecimal initialCapital = engineProperties.getInitialCapital();
        if (userId == null || userId.isBlank()) {
            dataSource = marketDataSourceFactory.simulated();
        } else {
            BrokerCredentials credentials = userCredentialService.getCredentials(userId);
            dataSource = marketDataSourceFactory.resolve(credentials);
            if (credentials.initialCapital() != null) {
                initialCapital = credentials.initialCapital();
            }
        }

        int restored = positionLedger.restore();
        BigDecimal realized =
                positionLedger.getClosedTradePnls().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        RiskState riskState = new RiskState(initialCapital.add(realized), tradingCalendarService.today());

        context = new ScanContext(userId, dataSource, riskState, initialCapital);
        strategies = loaded;
        scanCount.set(0);
        lastErrors.clear();
        lastScanAt = null;
        CountDownLatch stop = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        stopSignal = stop;
        loopFinished = finished;
        state = EngineState.RUNNING;

        loopThread = new Thread(() -> runLoop(stop, finished), "scan-loop");
        loopThread.setDaemon(true);
        loopThread.start();

        log.info(
                "Engine started in {} mode for user {}: {} symbols, {} strategies, capital {}, {} positions restored",
                dataSource.getMode(),
                userId,
                engineProperties.getSymbols().size(),
                loaded.size(),
                riskState.getCapital(),
                restored);
        publishSnapshot();
        return getSnapshot();
    }

    /**
     * Signals the loop to stop and waits for the tick in progress to finish. Open positions
     * stay in the ledger.
     */
    public EngineSnapshot stop() {
        Thread thread;
        CountDownLatch finished;
        synchronized (this) {
            if (state != EngineState.RUNNING) {
                return getSnapshot();
            }
            state = EngineState.STOPPING;
            publishSnapshot();
            stopSignal.countDown();
            thread = loopThread;
            finished = loopFinished;
        }

        Duration timeout = engineProperties.getStopTimeout();
        try {
            if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scan tick still running after {}, interrupting scan-loop", timeout);
                thread.interrupt();
                finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for scan-loop to finish");
        }

        synchronized (this) {
            if (finished.getCount() > 0 && thread.isAlive()) {
                log.error("scan-loop still running after interrupt; engine stays STOPPING until it exits");
                stopAbandoned = true;
                return getSnapshot();
            }
            if (loopThread == thread) {
                markStopped();
            }
        }
        return getSnapshot();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (engineProperties.isAutoStart()) {
            start(null);
        }
    }

    // ==================== Loop ====================

    private void runLoop(CountDownLatch stop, CountDownLatch finished) {
        try {
            while (state == EngineState.RUNNING) {
                Duration wait;
                try {
                    wait = runTick() ? engineProperties.getActiveScanInterval() : engineProperties.getInactiveScanInterval();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    log.error("Scan tick failed, backing off {}: {}", engineProperties.getErrorBackoff(), e.getMessage(), e);
                    wait = engineProperties.getErrorBackoff();
                }
                if (stop.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finished.countDown();
            completeLateStop();
        }
    }

    /** Finishes a stop that gave up waiting for this loop thread. */
    private synchronized void completeLateStop() {
        if (stopAbandoned && loopThread == Thread.currentThread()) {
            stopAbandoned = false;
            log.warn("scan-loop exited after its stop timed out");
            markStopped();
        }
    }

    private void markStopped() {
        state = EngineState.STOPPED;
        loopThread = null;
        publishSnapshot();
        log.info("Engine stopped after {} scans", scanCount.get());
    }

    /**
     * Runs one tick.
     *
     * @return true if the market was open and the symbols were scanned
     */
    boolean runTick() throws InterruptedException {
        ScanContext ctx = context;
        if (ctx == null) {
            throw new IllegalStateException("Engine has not been started");
        }
        if (ctx.riskState().rollOverIfNeeded(tradingCalendarService.today())) {
            log.info("New trading day {}, daily risk counters reset", ctx.riskState().getDayStart());
        }

        boolean open = tradingCalendarService.isMarketOpen();
        if (open && !marketOpen) {
            log.info("Market open, scanning {} symbols", engineProperties.getSymbols().size());
        } else if (!open && marketOpen) {
            log.info(
                    "Market closed, next trading day {}",
                    tradingCalendarService.getNextTradingDay(tradingCalendarService.today()));
        }
        marketOpen = open;
        if (!open) {
            publishSnapshot();
            return false;
        }

        long startNanos = System.nanoTime();
        int pending = positionLedger.retryPendingWrites();
        if (pending > 0) {
            log.warn("{} ledger writes still pending", pending);
        }
        reloadStrategies();

        List<StrategyDefinition> active = strategies;
        CompletableFuture<?>[] tasks = engineProperties.getSymbols().stream()
                .map(symbol -> CompletableFuture.runAsync(() -> scanSymbol(symbol, ctx, active), scanWorkerExecutor))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(tasks).get();
        } catch (ExecutionException e) {
            log.error("Symbol task escaped its error handler: {}", e.getCause().getMessage(), e.getCause());
        }

        long count = scanCount.incrementAndGet();
        lastScanAt = LocalDateTime.now(clock);
        scanMetricsService.recordTick(Duration.ofNanos(System.nanoTime() - startNanos), ctx.riskState().getDailyRealizedPnl());
        log.info(
                "Scan #{} done: {} symbols, {} open positions, daily P&L {}, {} errors",
                count,
                tasks.length,
                positionLedger.getOpenPositionCount(),
                ctx.riskState().getDailyRealizedPnl(),
                lastErrors.size());
        publishSnapshot();
        return true;
    }

    private void scanSymbol(String symbol, ScanContext ctx, List<StrategyDefinition> active) {
        try {
            signalLog.append(symbolScanner.scan(symbol, ctx, active));
            lastErrors.remove(symbol);
        } catch (DataSourceUnavailableException e) {
            log.warn("Skipping {} this tick: {}", symbol, e.getMessage());
            recordFailure(symbol, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scan of {} failed: {}", symbol, e.getMessage(), e);
            recordFailure(symbol, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void recordFailure(String symbol, String message) {
        lastErrors.put(symbol, message);
        scanMetricsService.symbolFailed();
        signalLog.append(WeightedSignal.error(symbol, LocalDateTime.now(clock), message));
    }

    private void reloadStrategies() {
        try {
            strategies = strategyStore.listEnabledStrategies();
        } catch (RuntimeException e) {
            log.warn("Strategy reload failed, keeping {} strategies: {}", strategies.size(), e.getMessage());
        }
    }

    // ==================== Queries ====================

    public EngineSnapshot getSnapshot() {
        return snapshot.get();
    }

    public EngineState getState() {
        return state;
    }

    /**
     * Computes a fresh signal for {@code symbol} without trading on it.
     *
     * @throws ResourceNotFoundException if the symbol is not in the scan universe
     */
    public WeightedSignal currentSignal(String symbol) {
        if (!engineProperties.getSymbols().contains(symbol)) {
            throw new ResourceNotFoundException("Symbol", symbol);
        }
        ScanContext ctx = context;
        List<StrategyDefinition> active = strategies;
        if (ctx == null) {
            BigDecimal capital = engineProperties.getInitialCapital();
            ctx = new ScanContext(
                    null,
                    marketDataSourceFactory.simulated(),
                    new RiskState(capital, tradingCalendarService.today()),
                    capital);
            active = strategyStore.listEnabledStrategies();
        }
        return symbolScanner.preview(symbol, ctx, active);
    }

    /** Newest first; {@code symbol} null for all symbols. */
    public List<WeightedSignal> getSignals(String symbol, int limit) {
        return signalLog.recent(symbol, limit);
    }

    public List<Position> getOpenPositions() {
        return positionLedger.getOpenPositions();
    }

    public List<String> getSymbols() {
        return List.copyOf(engineProperties.getSymbols());
    }

    public RiskMetrics getRiskMetrics() {
        ScanContext ctx = context;
        BigDecimal initialCapital = ctx != null ? ctx.initialCapital() : engineProperties.getInitialCapital();
        BigDecimal capital;
        BigDecimal dailyPnl;
        int dailyTrades;
        if (ctx != null) {
            capital = ctx.riskState().getCapital();
            dailyPnl = ctx.riskState().getDailyRealizedPnl();
            dailyTrades = ctx.riskState().getTotalTradesToday();
        } else {
            capital = initialCapital.add(
                    positionLedger.getClosedTradePnls().stream().reduce(BigDecimal.ZERO, BigDecimal::add));
            dailyPnl = BigDecimal.ZERO;
            dailyTrades = 0;
        }
        return riskMetricsCalculator.calculate(
                positionLedger.getClosingTrades(),
                initialCapital,
                capital,
                positionLedger.getCommittedCapital(),
                dailyPnl,
                dailyTrades);
    }

    private void publishSnapshot() {
        ScanContext ctx = context;
        RiskState risk = ctx != null ? ctx.riskState() : null;
        snapshot.set(EngineSnapshot.builder()
                .running(state == EngineState.RUNNING)
                .state(state)
                .mode(ctx != null ? ctx.mode() : EngineMode.SIMULATION)
                .userId(ctx != null ? ctx.userId() : null)
                .scanCount(scanCount.get())
                .capital(risk != null ? risk.getCapital() : engineProperties.getInitialCapital())
                .dailyPnl(risk != null ? risk.getDailyRealizedPnl() : BigDecimal.ZERO)
                .tradesToday(risk != null ? risk.getTotalTradesToday() : 0)
                .openPositions(positionLedger.getOpenPositionCount())
                .lastScanAt(lastScanAt)
                .marketOpen(marketOpen)
                .activeVoters(strategies.stream().map(StrategyDefinition::getKind).distinct().toList())
                .symbols(List.copyOf(engineProperties.getSymbols()))
                .signalsInMemory(signalLog.size())
                .lastErrors(Map.copyOf(lastErrors))
                .build());
    }
}
