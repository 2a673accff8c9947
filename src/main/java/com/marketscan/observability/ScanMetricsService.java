package com.marketscan.observability;

import com.marketscan.ledger.PositionLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the scan engine:
 * <ul>
 *   <li><b>scan.ticks</b> (timer): duration of each completed market-hours tick</li>
 *   <li><b>scan.symbol.failures</b> (counter): symbol tasks that ended in an error</li>
 *   <li><b>positions.opened</b> / <b>positions.closed</b> (counters)</li>
 *   <li><b>positions.open</b> (gauge): open positions in the ledger</li>
 *   <li><b>daily.pnl</b> (gauge): realised P&L today, as of the last tick</li>
 * </ul>
 */
@Service
public class ScanMetricsService {

    private final Timer tickTimer;
    private final Counter symbolFailureCounter;
    private final Counter positionsOpenedCounter;
    private final Counter positionsClosedCounter;
    private final AtomicReference<BigDecimal> dailyPnl = new AtomicReference<>(BigDecimal.ZERO);

    public ScanMetricsService(MeterRegistry meterRegistry, PositionLedger positionLedger) {
        this.tickTimer = Timer.builder("scan.ticks")
                .description("Duration of a full scan over all configured symbols")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        this.symbolFailureCounter = Counter.builder("scan.symbol.failures")
                .description("Symbol scans that failed and produced an ERROR signal")
                .register(meterRegistry);

        this.positionsOpenedCounter = Counter.builder("positions.opened")
                .description("Paper positions opened by the engine")
                .register(meterRegistry);

        this.positionsClosedCounter = Counter.builder("positions.closed")
                .description("Paper positions closed by the engine")
                .register(meterRegistry);

        meterRegistry.gauge("positions.open", positionLedger, PositionLedger::getOpenPositionCount);
        meterRegistry.gauge("daily.pnl", dailyPnl, ref -> ref.get().doubleValue());
    }

    public void recordTick(Duration elapsed, BigDecimal dailyRealizedPnl) {
        tickTimer.record(elapsed);
        dailyPnl.set(dailyRealizedPnl);
    }

    public void symbolFailed() {
        symbolFailureCounter.increment();
    }

    public void positionOpened() {
        positionsOpenedCounter.increment();
    }

    public void positionClosed() {
        positionsClosedCounter.increment();
    }
}
