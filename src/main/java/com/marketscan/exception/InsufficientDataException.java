package com.marketscan.exception;

import java.util.Map;

/**
 * Thrown by the indicator library when a candle window is shorter than the lookback an
 * indicator needs. Voters translate it into a HOLD vote.
 */
public class InsufficientDataException extends BaseException {

    public InsufficientDataException(String indicator, int required, int available) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                String.format("%s needs %d candles but only %d available", indicator, required, available),
                Map.of("indicator", indicator, "required", required, "available", available));
    }
}
