package com.marketscan.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Daily limits that gate new entries. Exits are never blocked.
 */
@Data
@Builder
public class RiskLimits {

    /** Daily realised loss, as a percentage of capital, at which new entries stop. */
    private BigDecimal dailyLossPercentage;

    /** Entries allowed per symbol per trading day. */
    private int maxTradesPerSymbolPerDay;
}
