package com.marketscan.timeseries;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A single OHLCV candle for one instrument.
 *
 * <p>Candles are immutable once built. A candle window handed to the indicator library is
 * ordered by strictly increasing {@code timestamp} at a fixed {@link CandleInterval}.
 * Timestamps are exchange-local (Asia/Kolkata) and mark the start of the bucket.
 */
@Value
@Builder
public class Candle {

    String symbol;

    /** Bucket start, exchange-local time. */
    LocalDateTime timestamp;

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;

    long volume;
}
