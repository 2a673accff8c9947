package com.marketscan.domain.enums;

/**
 * Lifecycle of a ledger trade. PENDING until recorded, EXECUTED once applied to the ledger,
 * FAILED when the write to the trade store could not be completed after retries.
 */
public enum TradeStatus {
    PENDING,
    EXECUTED,
    FAILED
}
