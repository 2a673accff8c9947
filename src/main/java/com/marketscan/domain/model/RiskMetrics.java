package com.marketscan.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Performance and exposure figures derived from the ledger's closed trades.
 *
 * <p>{@code maxDrawdown} and {@code winRate} are percentages. {@code sharpeRatio} is
 * annualised over 252 trading days.
 */
@Value
@Builder
public class RiskMetrics {

    BigDecimal totalCapital;
    BigDecimal availableCapital;
    BigDecimal dailyPnl;
    int dailyTrades;
    int closedTrades;
    BigDecimal maxDrawdown;
    BigDecimal winRate;
    BigDecimal profitFactor;
    BigDecimal sharpeRatio;
}
