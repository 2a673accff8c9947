package com.marketscan.marketdata;

import com.marketscan.domain.enums.EngineMode;
import com.marketscan.exception.DataSourceUnavailableException;
import com.marketscan.indicator.BarSeriesFactory;
import com.marketscan.timeseries.Candle;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.HistoricalData;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live candles from the Kite Connect historical data API.
 *
 * <p>Each fetch requests the last {@code historicalLookbackDays} of bars at the configured
 * interval and keeps the most recent {@code count}. Any SDK, network or parse failure surfaces
 * as {@link DataSourceUnavailableException} so the engine can skip the symbol for the tick.
 */
public class KiteMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(KiteMarketDataSource.class);

    /** Kite timestamps look like {@code 2024-01-15T09:15:00+0530}. */
    static final DateTimeFormatter KITE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final KiteConnect kiteConnect;
    private final MarketDataProperties properties;
    private final Clock clock;

    public KiteMarketDataSource(KiteConnect kiteConnect, MarketDataProperties properties, Clock clock) {
        this.kiteConnect = kiteConnect;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<Candle> fetchCandles(String symbol, int count) {
        Long token = properties.getInstrumentTokens().get(symbol);
        if (token == null) {
            throw new DataSourceUnavailableException(symbol, "no instrument token configured");
        }

        ZonedDateTime to = ZonedDateTime.now(clock);
        ZonedDateTime from = to.minusDays(properties.getHistoricalLookbackDays());
        String interval = properties.getInterval().getKiteInterval();

        HistoricalData response;
        try {
            response = kiteConnect.getHistoricalData(
                    Date.from(from.toInstant()), Date.from(to.toInstant()), String.valueOf(token), interval, false, false);
        } catch (KiteException e) {
            log.error("Kite historical data failed for {} (token {}): {}", symbol, token, e.message);
            throw new DataSourceUnavailableException(symbol, "Kite error " + e.code + ": " + e.message, e);
        } catch (JSONException | IOException e) {
            log.error("Error fetching historical data for {}: {}", symbol, e.getMessage());
            throw new DataSourceUnavailableException(symbol, e.getMessage(), e);
        }

        List<Candle> candles = toCandles(symbol, response);
        if (candles.isEmpty()) {
            throw new DataSourceUnavailableException(symbol, "no candles returned for " + interval);
        }
        log.debug("Fetched {} {} candles for {}", candles.size(), interval, symbol);
        return List.copyOf(candles.subList(Math.max(0, candles.size() - count), candles.size()));
    }

    @Override
    public EngineMode getMode() {
        return EngineMode.LIVE;
    }

    static List<Candle> toCandles(String symbol, HistoricalData response) {
        List<Candle> candles = new ArrayList<>();
        if (response == null || response.dataArrayList == null) {
            return candles;
        }
        for (HistoricalData bar : response.dataArrayList) {
            candles.add(Candle.builder()
                    .symbol(symbol)
                    .timestamp(parseTimestamp(symbol, bar.timeStamp))
                    .open(price(bar.open))
                    .high(price(bar.high))
                    .low(price(bar.low))
                    .close(price(bar.close))
                    .volume(bar.volume)
                    .build());
        }
        return candles;
    }

    static LocalDateTime parseTimestamp(String symbol, String timestamp) {
        if (timestamp == null) {
            throw new DataSourceUnavailableException(symbol, "candle without timestamp");
        }
        try {
            return OffsetDateTime.parse(timestamp, KITE_TIMESTAMP)
                    .atZoneSameInstant(BarSeriesFactory.IST)
                    .toLocalDateTime();
        } catch (DateTimeParseException e) {
            throw new DataSourceUnavailableException(symbol, "unparseable candle timestamp " + timestamp, e);
        }
    }

    private static BigDecimal price(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
