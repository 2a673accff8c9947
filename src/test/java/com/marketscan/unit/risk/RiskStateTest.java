package com.marketscan.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketscan.risk.RiskState;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RiskStateTest {

    private static final LocalDate DAY_ONE = LocalDate.of(2025, 6, 11);
    private static final LocalDate DAY_TWO = LocalDate.of(2025, 6, 12);

    @Test
    @DisplayName("Realised P&L moves both the daily total and capital")
    void realizedPnlMovesCapital() {
        RiskState state = new RiskState(new BigDecimal("100000"), DAY_ONE);

        state.recordRealizedPnl(new BigDecimal("1500"));
        state.recordRealizedPnl(new BigDecimal("-2500"));

        assertThat(state.getDailyRealizedPnl()).isEqualByComparingTo("-1000");
        assertThat(state.getDailyLossSoFar()).isEqualByComparingTo("1000");
        assertThat(state.getCapital()).isEqualByComparingTo("99000");
    }

    @Test
    @DisplayName("A profitable day has no loss so far")
    void noLossWhenProfitable() {
        RiskState state = new RiskState(new BigDecimal("100000"), DAY_ONE);

        state.recordRealizedPnl(new BigDecimal("500"));

        assertThat(state.getDailyLossSoFar()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Rollover resets daily counters but keeps capital")
    void rollover() {
        RiskState state = new RiskState(new BigDecimal("100000"), DAY_ONE);
        state.recordRealizedPnl(new BigDecimal("-3000"));
        state.recordEntry("INFY");
        state.recordEntry("TCS");

        assertThat(state.getStartOfDayCapital()).isEqualByComparingTo("100000");

        boolean rolled = state.rollOverIfNeeded(DAY_TWO);

        assertThat(rolled).isTrue();
        assertThat(state.getDayStart()).isEqualTo(DAY_TWO);
        assertThat(state.getDailyRealizedPnl()).isEqualByComparingTo("0");
        assertThat(state.getTradesToday("INFY")).isZero();
        assertThat(state.getTotalTradesToday()).isZero();
        assertThat(state.getCapital()).isEqualByComparingTo("97000");
        assertThat(state.getStartOfDayCapital()).isEqualByComparingTo("97000");
    }

    @Test
    @DisplayName("Same-day rollover is a no-op")
    void sameDayNoRollover() {
        RiskState state = new RiskState(new BigDecimal("100000"), DAY_ONE);
        state.recordEntry("INFY");

        assertThat(state.rollOverIfNeeded(DAY_ONE)).isFalse();
        assertThat(state.getTradesToday("INFY")).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent updates from scan workers are not lost")
    void concurrentUpdates() throws InterruptedException {
        RiskState state = new RiskState(new BigDecimal("100000"), DAY_ONE);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(400);

        for (int i = 0; i < 400; i++) {
            executor.submit(() -> {
                state.recordEntry("INFY");
                state.recordRealizedPnl(new BigDecimal("-1"));
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(state.getTradesToday("INFY")).isEqualTo(400);
        assertThat(state.getDailyRealizedPnl()).isEqualByComparingTo("-400");
        assertThat(state.getCapital()).isEqualByComparingTo("99600");
    }
}
