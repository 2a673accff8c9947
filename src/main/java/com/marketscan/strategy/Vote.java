package com.marketscan.strategy;

/** A single voter's opinion on the latest bar. The value is used in the weighted score. */
public enum Vote {
    BUY(1),
    SELL(-1),
    HOLD(0);

    private final int value;

    Vote(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
