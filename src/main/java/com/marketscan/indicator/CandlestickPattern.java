package com.marketscan.indicator;

public enum CandlestickPattern {
    DOJI,
    HAMMER,
    BULLISH_ENGULFING,
    BEARISH_ENGULFING,
    MORNING_STAR,
    EVENING_STAR,
    THREE_WHITE_SOLDIERS,
    THREE_BLACK_CROWS
}
