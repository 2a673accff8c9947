package com.marketscan.domain.enums;

/** Direction of an open position. */
public enum PositionSide {
    LONG,
    SHORT;

    /** +1 for long, -1 for short. Multiplies price moves into P&L. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    /** The side of the trade that opens a position in this direction. */
    public OrderSide entrySide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    public OrderSide exitSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}
