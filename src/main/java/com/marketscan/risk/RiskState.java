package com.marketscan.risk;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Capital and per-day counters of one engine.
 *
 * <p>Updated from the scan worker threads: P&L and capital use {@link AtomicReference} with
 * {@code accumulateAndGet}, entry counts a map of {@link AtomicInteger}. The day rollover is
 * synchronised so a reset happens exactly once per new trading date.
 *
 * <p>Capital is equity: starting capital plus all realised P&L. It survives day rollovers;
 * the daily P&L and entry counts do not. The capital held when the day began is kept apart
 * so the daily loss limit stays fixed while the day's losses accumulate.
 */
public class RiskState {

    private final AtomicReference<BigDecimal> capital;
    private final AtomicReference<BigDecimal> dailyRealizedPnl = new AtomicReference<>(BigDecimal.ZERO);
    private final Map<String, AtomicInteger> tradesToday = new ConcurrentHashMap<>();
    private volatile LocalDate dayStart;
    private volatile BigDecimal startOfDayCapital;

    public RiskState(BigDecimal initialCapital, LocalDate today) {
        this.capital = new AtomicReference<>(initialCapital);
        this.dayStart = today;
        this.startOfDayCapital = initialCapital;
    }

    /**
     * Resets the daily counters when {@code today} is a new date.
     *
     * @return true if a rollover happened
     */
    public synchronized boolean rollOverIfNeeded(LocalDate today) {
        if (today.equals(dayStart)) {
            return false;
        }
        dayStart = today;
        startOfDayCapital = capital.get();
        dailyRealizedPnl.set(BigDecimal.ZERO);
        tradesToday.clear();
        return true;
    }

    public void recordEntry(String symbol) {
        tradesToday.computeIfAbsent(symbol, s -> new AtomicInteger()).incrementAndGet();
    }

    public void recordRealizedPnl(BigDecimal pnl) {
        dailyRealizedPnl.accumulateAndGet(pnl, BigDecimal::add);
        capital.accumulateAndGet(pnl, BigDecimal::add);
    }

    /** {@code max(0, -dailyRealizedPnl)}. */
    public BigDecimal getDailyLossSoFar() {
        BigDecimal pnl = dailyRealizedPnl.get();
        return pnl.signum() < 0 ? pnl.negate() : BigDecimal.ZERO;
    }

    public BigDecimal getDailyRealizedPnl() {
        return dailyRealizedPnl.get();
    }

    public int getTradesToday(String symbol) {
        AtomicInteger count = tradesToday.get(symbol);
        return count == null ? 0 : count.get();
    }

    public int getTotalTradesToday() {
        return tradesToday.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public BigDecimal getCapital() {
        return capital.get();
    }

    /** Equity when the current trading day began. Base of the daily loss limit. */
    public BigDecimal getStartOfDayCapital() {
        return startOfDayCapital;
    }

    public LocalDate getDayStart() {
        return dayStart;
    }
}
