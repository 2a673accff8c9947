package com.marketscan.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    POSITION_ALREADY_OPEN("POSITION_ALREADY_OPEN", 409),
    NO_OPEN_POSITION("NO_OPEN_POSITION", 409),
    INSUFFICIENT_DATA("INSUFFICIENT_DATA", 422),
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422),
    ENGINE_MISCONFIGURED("ENGINE_MISCONFIGURED", 500),
    PERSISTENCE_FAILURE("PERSISTENCE_FAILURE", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    DATA_SOURCE_UNAVAILABLE("DATA_SOURCE_UNAVAILABLE", 502);

    private final String code;
    private final int httpStatus;
}
