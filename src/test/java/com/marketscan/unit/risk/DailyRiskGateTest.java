package com.marketscan.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketscan.exception.ErrorCode;
import com.marketscan.exception.RiskLimitExceededException;
import com.marketscan.risk.DailyRiskGate;
import com.marketscan.risk.RiskLimits;
import com.marketscan.risk.RiskState;
import com.marketscan.risk.RiskValidationResult;
import com.marketscan.risk.RiskViolation;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DailyRiskGateTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 11);

    private DailyRiskGate gate;
    private RiskState state;

    @BeforeEach
    void setUp() {
        gate = new DailyRiskGate(RiskLimits.builder()
                .dailyLossPercentage(new BigDecimal("5.0"))
                .maxTradesPerSymbolPerDay(3)
                .build());
        state = new RiskState(new BigDecimal("100000"), TODAY);
    }

    @Test
    @DisplayName("A fresh day approves entries")
    void approvesFreshDay() {
        RiskValidationResult result = gate.validate("INFY", state);

        assertThat(result.isApproved()).isTrue();
        assertThat(result.violations()).isEmpty();
    }

    @Test
    @DisplayName("Losses below the limit still approve")
    void lossBelowLimit() {
        state.recordRealizedPnl(new BigDecimal("-4000"));

        assertThat(gate.validate("INFY", state).isApproved()).isTrue();
    }

    @Test
    @DisplayName("Reaching 5% of the day's opening capital in losses blocks new entries")
    void dailyLossLimit() {
        state.recordRealizedPnl(new BigDecimal("-5000"));

        RiskValidationResult result = gate.validate("INFY", state);

        assertThat(result.isRejected()).isTrue();
        assertThat(result.violations())
                .extracting(RiskViolation::kind)
                .containsExactly(RiskViolation.Kind.DAILY_LOSS_LIMIT_BREACHED);
        RiskViolation violation = result.violations().get(0);
        assertThat(violation.limit()).isEqualByComparingTo("5000.00");
        assertThat(violation.actual()).isEqualByComparingTo("5000");
    }

    @Test
    @DisplayName("The loss limit does not shrink as the day's losses reduce capital")
    void limitFixedForTheDay() {
        state.recordRealizedPnl(new BigDecimal("-4800"));
        state.recordRealizedPnl(new BigDecimal("-199"));

        assertThat(state.getCapital()).isEqualByComparingTo("95001");
        assertThat(gate.validate("INFY", state).isApproved()).isTrue();

        state.recordRealizedPnl(new BigDecimal("-1"));

        assertThat(gate.validate("INFY", state).breached(RiskViolation.Kind.DAILY_LOSS_LIMIT_BREACHED)).isTrue();
    }

    @Test
    @DisplayName("A new day recomputes the limit from the capital carried over")
    void limitRebasedOnRollover() {
        state.recordRealizedPnl(new BigDecimal("-20000"));
        state.rollOverIfNeeded(TODAY.plusDays(1));
        state.recordRealizedPnl(new BigDecimal("-3999"));

        assertThat(state.getStartOfDayCapital()).isEqualByComparingTo("80000");
        assertThat(gate.validate("INFY", state).isApproved()).isTrue();

        state.recordRealizedPnl(new BigDecimal("-1"));

        assertThat(gate.validate("INFY", state).isRejected()).isTrue();
    }

    @Test
    @DisplayName("Profits earlier in the day offset later losses")
    void profitsOffsetLosses() {
        state.recordRealizedPnl(new BigDecimal("3000"));
        state.recordRealizedPnl(new BigDecimal("-6000"));

        assertThat(gate.validate("INFY", state).isApproved()).isTrue();
    }

    @Test
    @DisplayName("The per-symbol entry count only blocks that symbol")
    void perSymbolTradeLimit() {
        for (int i = 0; i < 3; i++) {
            state.recordEntry("INFY");
        }

        RiskValidationResult blocked = gate.validate("INFY", state);

        assertThat(blocked.breached(RiskViolation.Kind.MAX_DAILY_TRADES_REACHED)).isTrue();
        assertThat(blocked.breached(RiskViolation.Kind.DAILY_LOSS_LIMIT_BREACHED)).isFalse();
        assertThat(gate.validate("TCS", state).isApproved()).isTrue();
    }

    @Test
    @DisplayName("Every breached limit is reported")
    void reportsAllViolations() {
        state.recordRealizedPnl(new BigDecimal("-10000"));
        for (int i = 0; i < 3; i++) {
            state.recordEntry("INFY");
        }

        assertThat(gate.validate("INFY", state).violations()).hasSize(2);
    }

    @Test
    @DisplayName("enforce throws with the violations as details")
    void enforceThrows() {
        state.recordRealizedPnl(new BigDecimal("-10000"));

        assertThatThrownBy(() -> gate.enforce("INFY", state))
                .isInstanceOf(RiskLimitExceededException.class)
                .hasMessageContaining("INFY")
                .satisfies(e -> {
                    RiskLimitExceededException ex = (RiskLimitExceededException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.RISK_LIMIT_EXCEEDED);
                    assertThat(ex.getDetails())
                            .containsEntry("symbol", "INFY")
                            .containsKey("DAILY_LOSS_LIMIT_BREACHED");
                });
    }

    @Test
    @DisplayName("enforce passes silently when approved")
    void enforcePasses() {
        assertThatCode(() -> gate.enforce("INFY", state)).doesNotThrowAnyException();
    }
}
