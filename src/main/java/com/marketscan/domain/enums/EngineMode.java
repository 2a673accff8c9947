package com.marketscan.domain.enums;

/** Where the engine gets its candles from. */
public enum EngineMode {
    SIMULATION,
    LIVE
}
