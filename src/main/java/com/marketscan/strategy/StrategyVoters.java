package com.marketscan.strategy;

import static com.marketscan.indicator.TechnicalIndicators.last;
import static com.marketscan.indicator.TechnicalIndicators.previous;

import com.marketscan.exception.InsufficientDataException;
import com.marketscan.indicator.BollingerBands;
import com.marketscan.indicator.MacdSeries;
import com.marketscan.indicator.StochasticSeries;
import com.marketscan.indicator.SupertrendSeries;
import com.marketscan.indicator.TechnicalIndicators;
import com.marketscan.timeseries.Candle;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one voter over a candle window.
 *
 * <p>All eight voters live behind a single switch on {@link VoterKind}. Each compares the two
 * most recent bars, so a voter fires only on the bar where its condition first becomes true.
 * A voter never throws: a window shorter than its lookback, or any indicator failure, is a
 * {@link Vote#HOLD}.
 *
 * <p>Parameter keys and defaults:
 * <ul>
 *   <li>SMA_CROSSOVER: shortPeriod=20, longPeriod=50</li>
 *   <li>EMA_CROSSOVER: shortPeriod=12, longPeriod=26</li>
 *   <li>RSI: period=14, oversold=30, overbought=70</li>
 *   <li>MACD: fast=12, slow=26, signal=9</li>
 *   <li>BOLLINGER: period=20, stdDev=2.0</li>
 *   <li>VWAP: volumeThreshold=1.5, volumePeriod=20</li>
 *   <li>SUPERTREND: period=10, multiplier=3.0</li>
 *   <li>STOCH_RSI: rsiPeriod=14, stochPeriod=14</li>
 * </ul>
 */
@Component
public class StrategyVoters {

    private static final Logger log = LoggerFactory.getLogger(StrategyVoters.class);

    private static final double STOCH_RSI_OVERSOLD = 30.0;
    private static final double STOCH_RSI_OVERBOUGHT = 70.0;
    private static final double STOCH_K_OVERSOLD = 20.0;
    private static final double STOCH_K_OVERBOUGHT = 80.0;

    public Vote vote(VoterKind kind, List<Candle> candles, VoterParameters params) {
        try {
            return switch (kind) {
                case SMA_CROSSOVER -> movingAverageCrossover(candles, params, false);
                case EMA_CROSSOVER -> movingAverageCrossover(candles, params, true);
                case RSI -> rsi(candles, params);
                case MACD -> macd(candles, params);
                case BOLLINGER -> bollinger(candles, params);
                case VWAP -> vwap(candles, params);
                case SUPERTREND -> supertrend(candles, params);
                case STOCH_RSI -> stochRsi(candles, params);
            };
        } catch (InsufficientDataException e) {
            log.debug("{} voter holds: {}", kind, e.getMessage());
            return Vote.HOLD;
        } catch (RuntimeException e) {
            log.warn("{} voter failed, holding: {}", kind, e.getMessage());
            return Vote.HOLD;
        }
    }

    private Vote movingAverageCrossover(List<Candle> candles, VoterParameters params, boolean exponential) {
        int shortPeriod = params.getParamOrDefault("shortPeriod", exponential ? 12 : 20);
        int longPeriod = params.getParamOrDefault("longPeriod", exponential ? 26 : 50);
        double[] shortMa = exponential
                ? TechnicalIndicators.ema(candles, shortPeriod)
                : TechnicalIndicators.sma(candles, shortPeriod);
        double[] longMa = exponential
                ? TechnicalIndicators.ema(candles, longPeriod)
                : TechnicalIndicators.sma(candles, longPeriod);
        return crossover(shortMa, longMa);
    }

    /** Mean reversion: buy as RSI drops into oversold, sell as it rises into overbought. */
    private Vote rsi(List<Candle> candles, VoterParameters params) {
        int period = params.getParamOrDefault("period", 14);
        double oversold = params.getDoubleParamOrDefault("oversold", 30.0);
        double overbought = params.getDoubleParamOrDefault("overbought", 70.0);
        double[] rsi = TechnicalIndicators.rsi(candles, period);
        double current = last(rsi);
        double prior = previous(rsi);
        if (Double.isNaN(current) || Double.isNaN(prior)) {
            return Vote.HOLD;
        }
        if (current < oversold && prior >= oversold) {
            return Vote.BUY;
        }
        if (current > overbought && prior <= overbought) {
            return Vote.SELL;
        }
        return Vote.HOLD;
    }

    private Vote macd(List<Candle> candles, VoterParameters params) {
        MacdSeries macd = TechnicalIndicators.macd(
                candles,
                params.getParamOrDefault("fast", 12),
                params.getParamOrDefault("slow", 26),
                params.getParamOrDefault("signal", 9));
        return crossover(macd.macd(), macd.signal());
    }

    /** Mean reversion on the bands: close crossing below the lower band buys, above the upper sells. */
    private Vote bollinger(List<Candle> candles, VoterParameters params) {
        BollingerBands bands = TechnicalIndicators.bollinger(
                candles, params.getParamOrDefault("period", 20), params.getDoubleParamOrDefault("stdDev", 2.0));
        double[] close = closes(candles);
        if (crossedBelow(close, bands.lower())) {
            return Vote.BUY;
        }
        if (crossedAbove(close, bands.upper())) {
            return Vote.SELL;
        }
        return Vote.HOLD;
    }

    /** Breakout above VWAP needs volume confirmation; a break below does not. */
    private Vote vwap(List<Candle> candles, VoterParameters params) {
        double volumeThreshold = params.getDoubleParamOrDefault("volumeThreshold", 1.5);
        int volumePeriod = params.getParamOrDefault("volumePeriod", 20);
        double[] vwap = TechnicalIndicators.vwap(candles);
        double[] averageVolume = TechnicalIndicators.averageVolume(candles, volumePeriod);
        double[] close = closes(candles);

        double currentVolume = candles.get(candles.size() - 1).getVolume();
        boolean volumeConfirmed = currentVolume >= last(averageVolume) * volumeThreshold;

        if (crossedAbove(close, vwap) && volumeConfirmed) {
            return Vote.BUY;
        }
        if (crossedBelow(close, vwap)) {
            return Vote.SELL;
        }
        return Vote.HOLD;
    }

    private Vote supertrend(List<Candle> candles, VoterParameters params) {
        SupertrendSeries supertrend = TechnicalIndicators.supertrend(
                candles, params.getParamOrDefault("period", 10), params.getDoubleParamOrDefault("multiplier", 3.0));
        int[] direction = supertrend.direction();
        int current = direction[direction.length - 1];
        int prior = direction[direction.length - 2];
        if (prior == -1 && current == 1) {
            return Vote.BUY;
        }
        if (prior == 1 && current == -1) {
            return Vote.SELL;
        }
        return Vote.HOLD;
    }

    /** Both oscillators must agree: RSI and stochastic %K oversold buys, both overbought sells. */
    private Vote stochRsi(List<Candle> candles, VoterParameters params) {
        double[] rsi = TechnicalIndicators.rsi(candles, params.getParamOrDefault("rsiPeriod", 14));
        StochasticSeries stochastic = TechnicalIndicators.stochastic(candles, params.getParamOrDefault("stochPeriod", 14));
        double currentRsi = last(rsi);
        double currentK = last(stochastic.k());
        if (Double.isNaN(currentRsi) || Double.isNaN(currentK)) {
            return Vote.HOLD;
        }
        if (currentRsi < STOCH_RSI_OVERSOLD && currentK < STOCH_K_OVERSOLD) {
            return Vote.BUY;
        }
        if (currentRsi > STOCH_RSI_OVERBOUGHT && currentK > STOCH_K_OVERBOUGHT) {
            return Vote.SELL;
        }
        return Vote.HOLD;
    }

    // ==================== Crossing helpers ====================

    private static Vote crossover(double[] fast, double[] slow) {
        if (crossedAbove(fast, slow)) {
            return Vote.BUY;
        }
        if (crossedBelow(fast, slow)) {
            return Vote.SELL;
        }
        return Vote.HOLD;
    }

    /** {@code a} was at or below {@code b} on the previous bar and is above it now. */
    static boolean crossedAbove(double[] a, double[] b) {
        if (a.length < 2 || b.length < 2 || anyNaN(a, b)) {
            return false;
        }
        return previous(a) <= previous(b) && last(a) > last(b);
    }

    static boolean crossedBelow(double[] a, double[] b) {
        if (a.length < 2 || b.length < 2 || anyNaN(a, b)) {
            return false;
        }
        return previous(a) >= previous(b) && last(a) < last(b);
    }

    private static boolean anyNaN(double[] a, double[] b) {
        return Double.isNaN(last(a)) || Double.isNaN(previous(a)) || Double.isNaN(last(b)) || Double.isNaN(previous(b));
    }

    private static double[] closes(List<Candle> candles) {
        double[] close = new double[candles.size()];
        for (int i = 0; i < close.length; i++) {
            close[i] = candles.get(i).getClose().doubleValue();
        }
        return close;
    }
}
