package com.marketscan.indicator;

/** MACD line, its signal line and the histogram, aligned with the input candles. */
public record MacdSeries(double[] macd, double[] signal, double[] histogram) {}
