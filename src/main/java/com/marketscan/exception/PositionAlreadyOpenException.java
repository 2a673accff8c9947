package com.marketscan.exception;

import java.util.Map;

public class PositionAlreadyOpenException extends BaseException {

    public PositionAlreadyOpenException(String symbol) {
        super(
                ErrorCode.POSITION_ALREADY_OPEN,
                String.format("A position is already open for %s", symbol),
                Map.of("symbol", symbol));
    }
}
