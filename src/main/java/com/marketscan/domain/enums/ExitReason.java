package com.marketscan.domain.enums;

/** Why an open position was closed. Evaluated in declaration order. */
public enum ExitReason {
    TAKE_PROFIT,
    STOP_LOSS,
    TRAILING_STOP,
    OPPOSITE_SIGNAL
}
