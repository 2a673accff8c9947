package com.marketscan.risk;

import java.math.BigDecimal;

/**
 * One breached daily limit, with the configured limit and the value that breached it.
 */
public record RiskViolation(Kind kind, BigDecimal limit, BigDecimal actual, String message) {

    public enum Kind {
        DAILY_LOSS_LIMIT_BREACHED,
        MAX_DAILY_TRADES_REACHED
    }

    static RiskViolation dailyLoss(BigDecimal limit, BigDecimal lossSoFar) {
        return new RiskViolation(
                Kind.DAILY_LOSS_LIMIT_BREACHED,
                limit,
                lossSoFar,
                String.format("Daily loss %s has reached the limit of %s", lossSoFar, limit));
    }

    static RiskViolation tradeCount(String symbol, int limit, int entries) {
        return new RiskViolation(
                Kind.MAX_DAILY_TRADES_REACHED,
                BigDecimal.valueOf(limit),
                BigDecimal.valueOf(entries),
                String.format("%s already has %d entries today (limit %d)", symbol, entries, limit));
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
