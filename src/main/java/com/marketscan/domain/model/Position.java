package com.marketscan.domain.model;

import com.marketscan.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * An open paper position held by the ledger. At most one exists per symbol.
 *
 * <p>Immutable; the ledger swaps in a new instance when the money manager moves the
 * {@code trailingPeak}. The peak only ever moves in the position's favour: up for longs,
 * down for shorts.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String symbol;
    PositionSide side;
    BigDecimal entryPrice;
    int quantity;
    BigDecimal stopLoss;
    BigDecimal takeProfit;

    /** Best price seen since entry, starts at the entry price. */
    @With
    BigDecimal trailingPeak;

    LocalDateTime openedAt;

    /** Strategy that produced the entry signal; null when several voters agreed. */
    String strategyId;

    /** Mark-to-market P&L at the given price. */
    public BigDecimal unrealizedPnl(BigDecimal price) {
        return price.subtract(entryPrice)
                .multiply(BigDecimal.valueOf(quantity))
                .multiply(BigDecimal.valueOf(side.sign()));
    }

    public boolean isLong() {
        return side == PositionSide.LONG;
    }
}
