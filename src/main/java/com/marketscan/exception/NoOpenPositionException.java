package com.marketscan.exception;

import java.util.Map;

public class NoOpenPositionException extends BaseException {

    public NoOpenPositionException(String symbol) {
        super(ErrorCode.NO_OPEN_POSITION, String.format("No open position for %s", symbol), Map.of("symbol", symbol));
    }
}
