package com.marketscan.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Kite Connect settings under {@code kite.*}.
 *
 * <p>Credentials live per user in the users table; {@link #apiKey} is only the fallback when a
 * user row carries an access token but no key of its own. Clients are created per engine start
 * by {@link #createClient(String, String)} rather than shared as a singleton, since each start
 * may trade for a different user.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Fallback Kite Connect API key (from the Zerodha developer console). */
    private String apiKey;

    /** Log Kite HTTP traffic through the SDK's debug switch. */
    private boolean debug = false;

    /**
     * Creates an authenticated Kite client.
     *
     * @param userApiKey  the user's API key; {@link #apiKey} is used when blank
     * @param accessToken the session access token
     */
    public KiteConnect createClient(String userApiKey, String accessToken) {
        String key = userApiKey == null || userApiKey.isBlank() ? apiKey : userApiKey;
        log.info("Creating KiteConnect client with API key: {}", maskApiKey(key));
        KiteConnect kiteConnect = new KiteConnect(key, debug);
        kiteConnect.setAccessToken(accessToken);
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired (detected by SDK SessionExpiryHook)"));
        return kiteConnect;
    }

    static String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
