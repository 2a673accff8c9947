package com.marketscan.money.impl;

import com.marketscan.domain.enums.PositionSizingType;
import com.marketscan.domain.model.PositionSizingContext;
import com.marketscan.money.MoneyManagementConfig;
import com.marketscan.money.PositionSizer;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sizes positions at half the Kelly fraction estimated from closed-trade P&L.
 *
 * <p>{@code kelly = (winRate * avgWin - lossRate * avgLoss) / avgWin}; the position value is
 * {@code capital * max(kelly, 0) / 2} and the quantity {@code floor(value / price)}. A
 * negative edge sizes to zero.
 *
 * <p>Until {@code kellyMinTrades} closed trades exist the estimate is too noisy and
 * {@link AtrRiskSizer} decides instead.
 */
@Component
public class HalfKellySizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(HalfKellySizer.class);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final MoneyManagementConfig moneyManagementConfig;
    private final AtrRiskSizer atrRiskSizer;

    public HalfKellySizer(MoneyManagementConfig moneyManagementConfig, AtrRiskSizer atrRiskSizer) {
        this.moneyManagementConfig = moneyManagementConfig;
        this.atrRiskSizer = atrRiskSizer;
    }

    @Override
    public int calculateQuantity(PositionSizingContext positionSizingContext) {
        List<BigDecimal> pnls = positionSizingContext.getClosedTradePnls();
        if (pnls.size() < moneyManagementConfig.getKellyMinTrades()) {
            return atrRiskSizer.calculateQuantity(positionSizingContext);
        }

        BigDecimal kelly = kellyFraction(pnls);
        if (kelly.signum() <= 0) {
            log.debug("No edge for {} (kelly {}), no position", positionSizingContext.getSymbol(), kelly);
            return 0;
        }

        BigDecimal positionValue = positionSizingContext.getCapital().multiply(kelly).divide(TWO, MathContext.DECIMAL64);
        BigDecimal price = positionSizingContext.getPrice();
        if (price == null || price.signum() <= 0) {
            return 0;
        }
        int quantity = positionValue.divide(price, 0, RoundingMode.DOWN).intValue();
        quantity = Math.min(quantity, AtrRiskSizer.affordableQuantity(positionSizingContext));

        log.debug(
                "Half-Kelly sizing for {}: kelly {} -> value {} = {} shares",
                positionSizingContext.getSymbol(),
                kelly,
                positionValue,
                quantity);
        return Math.max(0, quantity);
    }

    @Override
    public PositionSizingType getType() {
        return PositionSizingType.HALF_KELLY;
    }

    /** Full Kelly fraction from a P&L history; zero when there are no winning trades. */
    static BigDecimal kellyFraction(List<BigDecimal> pnls) {
        BigDecimal totalWin = BigDecimal.ZERO;
        BigDecimal totalLoss = BigDecimal.ZERO;
        int wins = 0;
        int losses = 0;
        for (BigDecimal pnl : pnls) {
            if (pnl.signum() > 0) {
                totalWin = totalWin.add(pnl);
                wins++;
            } else {
                totalLoss = totalLoss.add(pnl.abs());
                losses++;
            }
        }
        if (wins == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal count = BigDecimal.valueOf(pnls.size());
        BigDecimal winRate = BigDecimal.valueOf(wins).divide(count, MathContext.DECIMAL64);
        BigDecimal lossRate = BigDecimal.ONE.subtract(winRate);
        BigDecimal avgWin = totalWin.divide(BigDecimal.valueOf(wins), MathContext.DECIMAL64);
        BigDecimal avgLoss =
                losses == 0 ? BigDecimal.ZERO : totalLoss.divide(BigDecimal.valueOf(losses), MathContext.DECIMAL64);

        return winRate.multiply(avgWin)
                .subtract(lossRate.multiply(avgLoss))
                .divide(avgWin, MathContext.DECIMAL64);
    }
}
