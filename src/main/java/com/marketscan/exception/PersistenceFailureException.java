package com.marketscan.exception;

public class PersistenceFailureException extends BaseException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
