package com.marketscan.indicator;

import com.marketscan.timeseries.Candle;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Flags classic candlestick patterns completed by the latest candle.
 *
 * <p>Single-bar patterns look at the last candle, two- and three-bar patterns at the last two
 * or three. Patterns that need more candles than the window holds are simply not reported.
 */
public final class CandlestickPatterns {

    private static final double DOJI_BODY_RATIO = 0.1;
    private static final double SMALL_BODY_RATIO = 0.3;
    private static final double LONG_BODY_RATIO = 0.6;

    private CandlestickPatterns() {}

    public static Set<CandlestickPattern> detect(List<Candle> candles) {
        TechnicalIndicators.requireCandles("Candlestick patterns", candles, 1);
        Set<CandlestickPattern> patterns = EnumSet.noneOf(CandlestickPattern.class);
        int n = candles.size();
        Bar last = new Bar(candles.get(n - 1));

        if (last.range() > 0 && last.body() <= DOJI_BODY_RATIO * last.range()) {
            patterns.add(CandlestickPattern.DOJI);
        }
        if (isHammer(last)) {
            patterns.add(CandlestickPattern.HAMMER);
        }

        if (n >= 2) {
            Bar prev = new Bar(candles.get(n - 2));
            if (prev.bearish() && last.bullish() && last.open <= prev.close && last.close >= prev.open
                    && last.body() > prev.body()) {
                patterns.add(CandlestickPattern.BULLISH_ENGULFING);
            }
            if (prev.bullish() && last.bearish() && last.open >= prev.close && last.close <= prev.open
                    && last.body() > prev.body()) {
                patterns.add(CandlestickPattern.BEARISH_ENGULFING);
            }
        }

        if (n >= 3) {
            Bar first = new Bar(candles.get(n - 3));
            Bar middle = new Bar(candles.get(n - 2));
            if (isStar(first, middle) && first.bearish() && last.bullish() && last.close > first.midpoint()) {
                patterns.add(CandlestickPattern.MORNING_STAR);
            }
            if (isStar(first, middle) && first.bullish() && last.bearish() && last.close < first.midpoint()) {
                patterns.add(CandlestickPattern.EVENING_STAR);
            }
            if (first.bullish() && middle.bullish() && last.bullish()
                    && middle.close > first.close && last.close > middle.close
                    && opensWithinBody(middle, first) && opensWithinBody(last, middle)) {
                patterns.add(CandlestickPattern.THREE_WHITE_SOLDIERS);
            }
            if (first.bearish() && middle.bearish() && last.bearish()
                    && middle.close < first.close && last.close < middle.close
                    && opensWithinBody(middle, first) && opensWithinBody(last, middle)) {
                patterns.add(CandlestickPattern.THREE_BLACK_CROWS);
            }
        }
        return patterns;
    }

    private static boolean isHammer(Bar bar) {
        if (bar.range() <= 0 || bar.body() == 0) {
            return false;
        }
        double lowerShadow = Math.min(bar.open, bar.close) - bar.low;
        double upperShadow = bar.high - Math.max(bar.open, bar.close);
        return bar.body() <= SMALL_BODY_RATIO * bar.range()
                && lowerShadow >= 2 * bar.body()
                && upperShadow <= DOJI_BODY_RATIO * bar.range();
    }

    private static boolean isStar(Bar first, Bar middle) {
        return first.range() > 0
                && first.body() >= LONG_BODY_RATIO * first.range()
                && middle.body() <= SMALL_BODY_RATIO * first.body();
    }

    private static boolean opensWithinBody(Bar bar, Bar previous) {
        double bodyLow = Math.min(previous.open, previous.close);
        double bodyHigh = Math.max(previous.open, previous.close);
        return bar.open >= bodyLow && bar.open <= bodyHigh;
    }

    private record Bar(double open, double high, double low, double close) {

        Bar(Candle candle) {
            this(
                    candle.getOpen().doubleValue(),
                    candle.getHigh().doubleValue(),
                    candle.getLow().doubleValue(),
                    candle.getClose().doubleValue());
        }

        double body() {
            return Math.abs(close - open);
        }

        double range() {
            return high - low;
        }

        double midpoint() {
            return (open + close) / 2.0;
        }

        boolean bullish() {
            return close > open;
        }

        boolean bearish() {
            return close < open;
        }
    }
}
