package com.marketscan.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scan loop settings under {@code marketscan.engine.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>symbols: ten large-cap NSE stocks</li>
 *   <li>activeScanInterval: 5s while the market is open, inactiveScanInterval: 60s otherwise</li>
 *   <li>errorBackoff: 10s after a tick fails as a whole</li>
 *   <li>candleCount: 100 fetched per symbol, minCandles: 50 needed to vote</li>
 *   <li>signalLogCapacity: 500</li>
 *   <li>initialCapital: 100000, used when the user row has none</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketscan.engine")
public class EngineProperties {

    private List<String> symbols = new ArrayList<>(List.of(
            "RELIANCE", "TCS", "HDFCBANK", "INFY", "ICICIBANK", "HINDUNILVR", "ITC", "SBIN", "BHARTIARTL", "KOTAKBANK"));

    private Duration activeScanInterval = Duration.ofSeconds(5);
    private Duration inactiveScanInterval = Duration.ofSeconds(60);
    private Duration errorBackoff = Duration.ofSeconds(10);

    private int candleCount = 100;
    private int minCandles = 50;
    private int signalLogCapacity = 500;

    private BigDecimal initialCapital = new BigDecimal("100000");

    /** How long stop waits for the in-flight tick before interrupting the loop thread. */
    private Duration stopTimeout = Duration.ofSeconds(30);

    /** Start an engine without a user when the application is ready. */
    private boolean autoStart = false;
}
