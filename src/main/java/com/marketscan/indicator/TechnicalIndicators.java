package com.marketscan.indicator;

import com.marketscan.exception.InsufficientDataException;
import com.marketscan.timeseries.Candle;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorDIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;
import org.ta4j.core.indicators.WilliamsRIndicator;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/**
 * Pure technical indicator functions over candle windows.
 *
 * <p>Every function returns a series aligned index-for-index with the input candles. Slots
 * before the indicator's warm-up completes hold {@link Double#NaN}. A value at index
 * {@code i} depends only on candles {@code 0..i}: there is no lookahead.
 *
 * <p>Where ta4j implements the indicator it does the arithmetic; VWAP, SuperTrend and the
 * volume average are computed here. Each function throws {@link InsufficientDataException}
 * when the window is shorter than the indicator's lookback:
 * <ul>
 *   <li>SMA, EMA, Bollinger, Williams %R, average volume: {@code period}</li>
 *   <li>RSI, ATR, SuperTrend: {@code period + 1}</li>
 *   <li>MACD: {@code slow + signal}</li>
 *   <li>ADX: {@code 2 * period}</li>
 *   <li>Stochastic: {@code period + 4} (three-bar smoothing of %K and %D)</li>
 * </ul>
 */
public final class TechnicalIndicators {

    private static final int STOCHASTIC_SMOOTHING = 3;

    private TechnicalIndicators() {}

    // ==================== Trend ====================

    public static double[] sma(List<Candle> candles, int period) {
        requireCandles("SMA", candles, period);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        return toArray(new SMAIndicator(new ClosePriceIndicator(series), period), series, period - 1);
    }

    public static double[] ema(List<Candle> candles, int period) {
        requireCandles("EMA", candles, period);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        return toArray(new EMAIndicator(new ClosePriceIndicator(series), period), series, period - 1);
    }

    public static MacdSeries macd(List<Candle> candles, int fast, int slow, int signal) {
        requireCandles("MACD", candles, slow + signal);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        MACDIndicator macdIndicator = new MACDIndicator(new ClosePriceIndicator(series), fast, slow);
        EMAIndicator signalIndicator = new EMAIndicator(macdIndicator, signal);

        double[] macdLine = toArray(macdIndicator, series, slow - 1);
        double[] signalLine = toArray(signalIndicator, series, slow + signal - 2);
        double[] histogram = new double[macdLine.length];
        for (int i = 0; i < histogram.length; i++) {
            histogram[i] = macdLine[i] - signalLine[i];
        }
        return new MacdSeries(macdLine, signalLine, histogram);
    }

    /**
     * Average directional index. Measures trend strength regardless of direction.
     */
    public static double[] adx(List<Candle> candles, int period) {
        requireCandles("ADX", candles, 2 * period);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        return toArray(new ADXIndicator(series, period), series, 2 * period - 1);
    }

    /**
     * SuperTrend over {@code hl2 +/- multiplier * ATR}.
     *
     * <p>The trend turns bullish when the close breaks above the previous bar's upper band and
     * bearish when it breaks below the previous bar's lower band; otherwise it carries over.
     * The first computed bar starts bullish.
     */
    public static SupertrendSeries supertrend(List<Candle> candles, int period, double multiplier) {
        requireCandles("SuperTrend", candles, period + 1);
        double[] atr = atr(candles, period);
        int size = candles.size();
        double[] upper = new double[size];
        double[] lower = new double[size];
        for (int i = 0; i < size; i++) {
            Candle candle = candles.get(i);
            double hl2 = (candle.getHigh().doubleValue() + candle.getLow().doubleValue()) / 2.0;
            upper[i] = hl2 + multiplier * atr[i];
            lower[i] = hl2 - multiplier * atr[i];
        }

        double[] line = nanArray(size);
        int[] direction = new int[size];
        for (int i = period + 1; i < size; i++) {
            double close = candles.get(i).getClose().doubleValue();
            if (close > upper[i - 1]) {
                direction[i] = 1;
            } else if (close < lower[i - 1]) {
                direction[i] = -1;
            } else {
                direction[i] = i > period + 1 ? direction[i - 1] : 1;
            }
            line[i] = direction[i] == 1 ? lower[i] : upper[i];
        }
        return new SupertrendSeries(line, direction);
    }

    // ==================== Momentum ====================

    public static double[] rsi(List<Candle> candles, int period) {
        requireCandles("RSI", candles, period + 1);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        return toArray(new RSIIndicator(new ClosePriceIndicator(series), period), series, period);
    }

    /** Slow stochastic: %K is the three-bar SMA of the fast %K, %D the three-bar SMA of %K. */
    public static StochasticSeries stochastic(List<Candle> candles, int period) {
        requireCandles("Stochastic", candles, period + 2 * (STOCHASTIC_SMOOTHING - 1));
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        StochasticOscillatorKIndicator fastK = new StochasticOscillatorKIndicator(series, period);
        StochasticOscillatorDIndicator slowK = new StochasticOscillatorDIndicator(fastK);
        SMAIndicator slowD = new SMAIndicator(slowK, STOCHASTIC_SMOOTHING);

        int kStart = period - 1 + STOCHASTIC_SMOOTHING - 1;
        return new StochasticSeries(
                toArray(slowK, series, kStart), toArray(slowD, series, kStart + STOCHASTIC_SMOOTHING - 1));
    }

    public static double[] williamsR(List<Candle> candles, int period) {
        requireCandles("Williams %R", candles, period);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        return toArray(new WilliamsRIndicator(series, period), series, period - 1);
    }

    /** Close minus the close {@code period} bars earlier. */
    public static double[] momentum(List<Candle> candles, int period) {
        requireCandles("Momentum", candles, period + 1);
        double[] values = nanArray(candles.size());
        for (int i = period; i < candles.size(); i++) {
            values[i] = candles.get(i).getClose().doubleValue()
                    - candles.get(i - period).getClose().doubleValue();
        }
        return values;
    }

    // ==================== Volatility ====================

    public static double[] atr(List<Candle> candles, int period) {
        requireCandles("ATR", candles, period + 1);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        return toArray(new ATRIndicator(series, period), series, period);
    }

    public static BollingerBands bollinger(List<Candle> candles, int period, double stdDevMultiplier) {
        requireCandles("Bollinger", candles, period);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(new SMAIndicator(close, period));
        StandardDeviationIndicator deviation = new StandardDeviationIndicator(close, period);
        Num k = series.numOf(stdDevMultiplier);

        return new BollingerBands(
                toArray(new BollingerBandsUpperIndicator(middle, deviation, k), series, period - 1),
                toArray(middle, series, period - 1),
                toArray(new BollingerBandsLowerIndicator(middle, deviation, k), series, period - 1));
    }

    // ==================== Volume ====================

    /**
     * Session-cumulative VWAP over the typical price {@code (high + low + close) / 3}.
     * Accumulation restarts whenever the trading date changes.
     */
    public static double[] vwap(List<Candle> candles) {
        requireCandles("VWAP", candles, 1);
        double[] values = new double[candles.size()];
        double cumulativePriceVolume = 0;
        double cumulativeVolume = 0;
        LocalDate session = null;
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            LocalDate date = candle.getTimestamp().toLocalDate();
            if (!date.equals(session)) {
                session = date;
                cumulativePriceVolume = 0;
                cumulativeVolume = 0;
            }
            double typicalPrice = (candle.getHigh().doubleValue()
                            + candle.getLow().doubleValue()
                            + candle.getClose().doubleValue())
                    / 3.0;
            cumulativePriceVolume += typicalPrice * candle.getVolume();
            cumulativeVolume += candle.getVolume();
            values[i] = cumulativeVolume > 0 ? cumulativePriceVolume / cumulativeVolume : typicalPrice;
        }
        return values;
    }

    /** Trailing mean volume over {@code period} bars, including the current bar. */
    public static double[] averageVolume(List<Candle> candles, int period) {
        requireCandles("Average volume", candles, period);
        BarSeries series = BarSeriesFactory.toBarSeries(candles);
        return toArray(new SMAIndicator(new VolumeIndicator(series), period), series, period - 1);
    }

    // ==================== Helpers ====================

    /** Latest value of a series. */
    public static double last(double[] values) {
        return values[values.length - 1];
    }

    /** Value one bar before the latest. */
    public static double previous(double[] values) {
        return values[values.length - 2];
    }

    static void requireCandles(String indicator, List<Candle> candles, int required) {
        int available = candles == null ? 0 : candles.size();
        if (available < required) {
            throw new InsufficientDataException(indicator, required, available);
        }
    }

    private static double[] toArray(Indicator<Num> indicator, BarSeries series, int firstValidIndex) {
        int size = series.getBarCount();
        double[] values = nanArray(size);
        for (int i = Math.max(0, firstValidIndex); i < size; i++) {
            Num value = indicator.getValue(series.getBeginIndex() + i);
            values[i] = value.isNaN() ? Double.NaN : value.doubleValue();
        }
        return values;
    }

    private static double[] nanArray(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }
}
