package com.marketscan.unit.money;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketscan.domain.model.PositionSizingContext;
import com.marketscan.money.MoneyManagementConfig;
import com.marketscan.money.impl.AtrRiskSizer;
import com.marketscan.money.impl.HalfKellySizer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HalfKellySizerTest {

    private HalfKellySizer sizer;

    @BeforeEach
    void setUp() {
        MoneyManagementConfig config = new MoneyManagementConfig();
        sizer = new HalfKellySizer(config, new AtrRiskSizer(config));
    }

    private static List<BigDecimal> history(int wins, String win, int losses, String loss) {
        List<BigDecimal> pnls = new ArrayList<>();
        for (int i = 0; i < wins; i++) {
            pnls.add(new BigDecimal(win));
        }
        for (int i = 0; i < losses; i++) {
            pnls.add(new BigDecimal(loss).negate());
        }
        return pnls;
    }

    private static PositionSizingContext context(List<BigDecimal> pnls) {
        return PositionSizingContext.builder()
                .symbol("TCS")
                .capital(new BigDecimal("100000"))
                .price(new BigDecimal("2000"))
                .atr(new BigDecimal("50"))
                .closedTradePnls(pnls)
                .build();
    }

    @Test
    @DisplayName("60% winners at 2:1 payoff is a 0.4 Kelly, half of it sized at the price")
    void sizesAtHalfKelly() {
        // kelly = (0.6 * 100 - 0.4 * 50) / 100 = 0.4; 100000 * 0.2 / 2000 = 10
        assertThat(sizer.calculateQuantity(context(history(6, "100", 4, "50")))).isEqualTo(10);
    }

    @Test
    @DisplayName("A negative edge suppresses the trade")
    void negativeEdge() {
        assertThat(sizer.calculateQuantity(context(history(3, "50", 7, "100")))).isZero();
    }

    @Test
    @DisplayName("No winning trades suppresses the trade")
    void noWinners() {
        assertThat(sizer.calculateQuantity(context(history(0, "0", 12, "100")))).isZero();
    }

    @Test
    @DisplayName("Short history falls back to ATR risk sizing")
    void fallsBackToAtr() {
        // 2000 risk / (2 * 50) stop distance = 20
        assertThat(sizer.calculateQuantity(context(history(5, "100", 4, "50")))).isEqualTo(20);
    }

    @Test
    @DisplayName("A Kelly position value below one share's price sizes to zero")
    void valueBelowOneShare() {
        PositionSizingContext context = PositionSizingContext.builder()
                .symbol("MRF")
                .capital(new BigDecimal("100000"))
                .price(new BigDecimal("120000"))
                .atr(new BigDecimal("500"))
                .closedTradePnls(history(10, "100", 0, "0"))
                .build();

        assertThat(sizer.calculateQuantity(context)).isZero();
    }
}
