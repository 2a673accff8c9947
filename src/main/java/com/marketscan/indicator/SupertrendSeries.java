package com.marketscan.indicator;

/**
 * SuperTrend line and trend direction: {@code +1} bullish, {@code -1} bearish, {@code 0}
 * during warm-up.
 */
public record SupertrendSeries(double[] line, int[] direction) {}
