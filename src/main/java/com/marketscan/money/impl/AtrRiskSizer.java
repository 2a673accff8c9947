package com.marketscan.money.impl;

import com.marketscan.domain.enums.PositionSizingType;
import com.marketscan.domain.model.PositionSizingContext;
import com.marketscan.money.MoneyManagementConfig;
import com.marketscan.money.PositionSizer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sizes positions so that hitting the stop loses a fixed share of capital.
 *
 * <p>Formula: {@code quantity = floor((capital * riskPercentage / 100) / (ATR * stopLossAtrMultiple))}.
 * With Rs 1,00,000 capital, 2% risk and an ATR of 50 the stop sits 100 away, so the result
 * is 20 shares (risking Rs 2,000).
 *
 * <p>A non-positive ATR, or a risk budget smaller than one share's stop distance, gives 0 and
 * the trade is skipped. The result is capped at the shares the capital can buy outright.
 */
@Component
public class AtrRiskSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(AtrRiskSizer.class);

    private final MoneyManagementConfig moneyManagementConfig;

    public AtrRiskSizer(MoneyManagementConfig moneyManagementConfig) {
        this.moneyManagementConfig = moneyManagementConfig;
    }

    @Override
    public int calculateQuantity(PositionSizingContext positionSizingContext) {
        BigDecimal atr = positionSizingContext.getAtr();
        if (atr == null || atr.signum() <= 0) {
            log.debug("ATR unavailable for {}, no position", positionSizingContext.getSymbol());
            return 0;
        }

        BigDecimal riskAmount = positionSizingContext
                .getCapital()
                .multiply(moneyManagementConfig.getRiskPercentage())
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
        BigDecimal stopDistance = atr.multiply(moneyManagementConfig.getStopLossAtrMultiple());

        int quantity = riskAmount.divide(stopDistance, 0, RoundingMode.DOWN).intValue();
        quantity = Math.min(quantity, affordableQuantity(positionSizingContext));

        log.debug(
                "ATR sizing for {}: risk {} / stop distance {} = {} shares",
                positionSizingContext.getSymbol(),
                riskAmount,
                stopDistance,
                quantity);
        return Math.max(0, quantity);
    }

    @Override
    public PositionSizingType getType() {
        return PositionSizingType.ATR_RISK;
    }

    static int affordableQuantity(PositionSizingContext positionSizingContext) {
        BigDecimal price = positionSizingContext.getPrice();
        if (price == null || price.signum() <= 0) {
            return 0;
        }
        return positionSizingContext.getCapital().divide(price, 0, RoundingMode.DOWN).intValue();
    }
}
