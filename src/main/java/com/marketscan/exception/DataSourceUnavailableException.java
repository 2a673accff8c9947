package com.marketscan.exception;

/**
 * Market data could not be fetched for a symbol. The symbol is skipped for the current tick.
 */
public class DataSourceUnavailableException extends BaseException {

    public DataSourceUnavailableException(String symbol, String message) {
        super(ErrorCode.DATA_SOURCE_UNAVAILABLE, String.format("Market data unavailable for %s: %s", symbol, message));
    }

    public DataSourceUnavailableException(String symbol, String message, Throwable cause) {
        super(
                ErrorCode.DATA_SOURCE_UNAVAILABLE,
                String.format("Market data unavailable for %s: %s", symbol, message),
                cause);
    }
}
