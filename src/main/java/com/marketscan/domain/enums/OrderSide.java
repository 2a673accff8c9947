package com.marketscan.domain.enums;

/**
 * Side of a ledger trade. A long opens with BUY and closes with SELL; a short the reverse.
 *
 * @see PositionSide#entrySide()
 */
public enum OrderSide {
    BUY,
    SELL
}
