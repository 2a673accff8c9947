package com.marketscan.marketdata;

import com.marketscan.config.KiteConfig;
import com.marketscan.exception.ResourceNotFoundException;
import com.marketscan.user.BrokerCredentials;
import com.marketscan.user.UserCredentialService;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chooses the candle provider for an engine start: live Kite data when the user has a broker
 * session, the shared simulated walk otherwise (including when no user is given).
 */
@Component
public class MarketDataSourceFactory {

    private static final Logger log = LoggerFactory.getLogger(MarketDataSourceFactory.class);

    private final UserCredentialService userCredentialService;
    private final SimulatedMarketDataSource simulatedMarketDataSource;
    private final KiteConfig kiteConfig;
    private final MarketDataProperties properties;
    private final Clock clock;

    public MarketDataSourceFactory(
            UserCredentialService userCredentialService,
            SimulatedMarketDataSource simulatedMarketDataSource,
            KiteConfig kiteConfig,
            MarketDataProperties properties,
            Clock clock) {
        this.userCredentialService = userCredentialService;
        this.simulatedMarketDataSource = simulatedMarketDataSource;
        this.kiteConfig = kiteConfig;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws ResourceNotFoundException if {@code userId} is set but unknown
     */
    public MarketDataSource resolve(String userId) {
        if (userId == null || userId.isBlank()) {
            log.info("No user given, using simulated market data");
            return simulatedMarketDataSource;
        }
        return resolve(userCredentialService.getCredentials(userId));
    }

    public MarketDataSource resolve(BrokerCredentials credentials) {
        if (!credentials.hasBrokerAccess()) {
            log.info("User {} has no broker session, using simulated market data", credentials.userId());
            return simulatedMarketDataSource;
        }
        log.info("Using Kite historical data for user {}", credentials.userId());
        return new KiteMarketDataSource(
                kiteConfig.createClient(credentials.apiKey(), credentials.accessToken()), properties, clock);
    }

    public SimulatedMarketDataSource simulated() {
        return simulatedMarketDataSource;
    }
}
