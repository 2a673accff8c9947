package com.marketscan.indicator;

/** Slow stochastic %K and %D, each smoothed over three bars. */
public record StochasticSeries(double[] k, double[] d) {}
