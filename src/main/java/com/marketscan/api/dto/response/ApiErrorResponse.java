package com.marketscan.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.marketscan.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/** Error envelope written by the global exception handler. Empty details are omitted. */
public record ApiErrorResponse(boolean success, Failure error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> body = details == null || details.isEmpty() ? null : details;
        return new ApiErrorResponse(false, new Failure(errorCode.getCode(), message, body, Instant.now(), path));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Failure(String code, String message, Map<String, Object> details, Instant timestamp, String path) {}
}
