package com.marketscan.domain.enums;

/** What the engine did for a symbol in one scan, recorded on each signal log entry. */
public enum ScanAction {
    HOLD,
    POSITION_OPENED,
    POSITION_CLOSED,
    IN_POSITION,
    RISK_BLOCKED,
    SIZE_SUPPRESSED,
    ERROR
}
