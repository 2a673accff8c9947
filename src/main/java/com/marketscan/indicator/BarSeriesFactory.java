package com.marketscan.indicator;

import com.marketscan.timeseries.Candle;
import java.time.ZoneId;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.num.DoubleNum;

/**
 * Converts candle windows into ta4j {@link BarSeries}.
 *
 * <p>Bars are keyed by the candle timestamp in IST. ta4j rejects bars whose end time does
 * not advance, so the window must be strictly increasing in time. Values use
 * {@link DoubleNum}: indicator output is compared against thresholds, not booked.
 */
public final class BarSeriesFactory {

    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private BarSeriesFactory() {}

    public static BarSeries toBarSeries(List<Candle> candles) {
        String name = candles.isEmpty() ? "empty" : candles.get(0).getSymbol();
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(name)
                .withNumTypeOf(DoubleNum.class)
                .build();
        for (Candle candle : candles) {
            series.addBar(
                    candle.getTimestamp().atZone(IST),
                    candle.getOpen(),
                    candle.getHigh(),
                    candle.getLow(),
                    candle.getClose(),
                    candle.getVolume());
        }
        return series;
    }
}
