package com.marketscan.marketdata;

import com.marketscan.domain.enums.EngineMode;
import com.marketscan.exception.DataSourceUnavailableException;
import com.marketscan.timeseries.Candle;
import java.util.List;

/**
 * Provider of recent OHLCV candles for a symbol.
 *
 * <p>Implementations return candles oldest first, strictly increasing in timestamp at the
 * configured interval, with at most {@code count} entries. Fewer may be returned when the
 * provider has less history; callers decide whether that is enough.
 */
public interface MarketDataSource {

    /**
     * Fetches the most recent {@code count} candles for {@code symbol}.
     *
     * @throws DataSourceUnavailableException when the provider cannot serve the symbol
     */
    List<Candle> fetchCandles(String symbol, int count);

    EngineMode getMode();
}
