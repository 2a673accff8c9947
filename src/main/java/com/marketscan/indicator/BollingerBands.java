package com.marketscan.indicator;

public record BollingerBands(double[] upper, double[] middle, double[] lower) {}
