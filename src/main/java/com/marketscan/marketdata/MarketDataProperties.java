package com.marketscan.marketdata;

import com.marketscan.timeseries.CandleInterval;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Market data settings under {@code marketscan.market-data}: candle interval, NSE instrument
 * tokens for live fetches and the parameters of the simulated random walk.
 */
@Component
@ConfigurationProperties(prefix = "marketscan.market-data")
@Getter
@Setter
public class MarketDataProperties {

    private CandleInterval interval = CandleInterval.FIVE_MINUTES;

    /** Kite instrument token per trading symbol. Symbols without a token cannot be fetched live. */
    private Map<String, Long> instrumentTokens = new LinkedHashMap<>();

    /** Calendar days of history requested from the Kite historical API. */
    private int historicalLookbackDays = 5;

    private Simulation simulation = new Simulation();

    @Getter
    @Setter
    public static class Simulation {

        /** Lowest starting price; each symbol adds {@code hash % priceSpread} on top. */
        private double basePrice = 1000;

        private int priceSpread = 5000;

        /** Standard deviation of the per-bar return. */
        private double volatility = 0.001;

        /** Bars generated when a symbol is first requested. */
        private int historySize = 100;

        /** The walk is kept inside [start * (1 - band), start * (1 + band)]. */
        private double band = 0.5;
    }
}
