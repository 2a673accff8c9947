package com.marketscan.exception;

import java.util.Map;

/**
 * A daily risk limit blocks a new entry. Never fatal: the scanner turns it into a HOLD.
 */
public class RiskLimitExceededException extends BaseException {

    public RiskLimitExceededException(String message, Map<String, Object> details) {
        super(ErrorCode.RISK_LIMIT_EXCEEDED, message, details);
    }
}
