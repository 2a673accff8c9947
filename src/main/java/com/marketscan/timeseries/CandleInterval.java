package com.marketscan.timeseries;

import java.time.Duration;

/**
 * Supported candle intervals.
 *
 * <p>Each interval carries its duration and the interval name the Kite historical data API
 * expects ("minute", "5minute", ...).
 */
public enum CandleInterval {
    ONE_MINUTE(Duration.ofMinutes(1), "minute"),
    FIVE_MINUTES(Duration.ofMinutes(5), "5minute"),
    FIFTEEN_MINUTES(Duration.ofMinutes(15), "15minute"),
    ONE_HOUR(Duration.ofHours(1), "60minute");

    private final Duration duration;
    private final String kiteInterval;

    CandleInterval(Duration duration, String kiteInterval) {
        this.duration = duration;
        this.kiteInterval = kiteInterval;
    }

    public Duration getDuration() {
        return duration;
    }

    public String getKiteInterval() {
        return kiteInterval;
    }
}
