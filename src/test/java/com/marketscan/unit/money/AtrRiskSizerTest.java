package com.marketscan.unit.money;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketscan.domain.enums.PositionSizingType;
import com.marketscan.domain.model.PositionSizingContext;
import com.marketscan.money.MoneyManagementConfig;
import com.marketscan.money.impl.AtrRiskSizer;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AtrRiskSizerTest {

    private AtrRiskSizer sizer;

    @BeforeEach
    void setUp() {
        sizer = new AtrRiskSizer(new MoneyManagementConfig());
    }

    private static PositionSizingContext context(String capital, String price, String atr) {
        return PositionSizingContext.builder()
                .symbol("RELIANCE")
                .capital(new BigDecimal(capital))
                .price(new BigDecimal(price))
                .atr(atr == null ? null : new BigDecimal(atr))
                .build();
    }

    @Test
    @DisplayName("2% of 1,00,000 against a stop two ATRs of 50 away is 20 shares")
    void sizesFromRiskBudget() {
        assertThat(sizer.calculateQuantity(context("100000", "2450.50", "50"))).isEqualTo(20);
    }

    @Test
    @DisplayName("Lower volatility allows a larger position")
    void quantityFallsAsAtrRises() {
        int calm = sizer.calculateQuantity(context("100000", "2450.50", "25"));
        int normal = sizer.calculateQuantity(context("100000", "2450.50", "50"));
        int wild = sizer.calculateQuantity(context("100000", "2450.50", "100"));

        assertThat(calm).isEqualTo(40);
        assertThat(calm).isGreaterThan(normal);
        assertThat(normal).isGreaterThan(wild);
    }

    @Test
    @DisplayName("Never sizes beyond what the capital can buy")
    void cappedByCapital() {
        // risk 200 / stop 10 = 20 shares, but 10,000 buys only 4 at 2450.50
        assertThat(sizer.calculateQuantity(context("10000", "2450.50", "5"))).isEqualTo(4);
    }

    @Test
    @DisplayName("Zero or missing ATR suppresses the trade")
    void noAtrNoTrade() {
        assertThat(sizer.calculateQuantity(context("100000", "2450.50", "0"))).isZero();
        assertThat(sizer.calculateQuantity(context("100000", "2450.50", null))).isZero();
    }

    @Test
    @DisplayName("A risk budget below one share's stop distance suppresses the trade")
    void budgetTooSmall() {
        assertThat(sizer.calculateQuantity(context("1000", "500", "50"))).isZero();
    }

    @Test
    @DisplayName("Risk percentage comes from configuration")
    void configuredRiskPercentage() {
        MoneyManagementConfig config = new MoneyManagementConfig();
        config.setRiskPercentage(new BigDecimal("1.0"));

        assertThat(new AtrRiskSizer(config).calculateQuantity(context("100000", "2450.50", "50"))).isEqualTo(10);
        assertThat(sizer.getType()).isEqualTo(PositionSizingType.ATR_RISK);
    }
}
