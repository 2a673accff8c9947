package com.marketscan.engine;

import com.marketscan.domain.enums.EngineMode;
import com.marketscan.marketdata.MarketDataSource;
import com.marketscan.risk.RiskState;
import java.math.BigDecimal;

/**
 * What one engine run hands to the symbol scanner: whose account it trades, where candles
 * come from and the risk counters it updates. Created on each start.
 */
public record ScanContext(
        String userId, MarketDataSource dataSource, RiskState riskState, BigDecimal initialCapital) {

    public EngineMode mode() {
        return dataSource.getMode();
    }
}
