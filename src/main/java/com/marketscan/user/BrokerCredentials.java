package com.marketscan.user;

import java.math.BigDecimal;

/**
 * Broker access and starting capital of the user an engine trades for.
 *
 * @param initialCapital null when the user row does not set one
 */
public record BrokerCredentials(String userId, String apiKey, String accessToken, BigDecimal initialCapital) {

    /** True when an access token is present, which is what a live Kite session needs. */
    public boolean hasBrokerAccess() {
        return accessToken != null && !accessToken.isBlank();
    }
}
