package com.marketscan.money;

import com.marketscan.domain.enums.PositionSide;
import java.math.BigDecimal;

/**
 * Sized entry with its protective levels. A quantity of zero means the trade is suppressed.
 */
public record EntryPlan(PositionSide side, int quantity, BigDecimal stopLoss, BigDecimal takeProfit) {

    public boolean isTradeable() {
        return quantity > 0;
    }
}
