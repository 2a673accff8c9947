package com.marketscan.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.marketscan.config.KiteConfig;
import com.marketscan.domain.enums.EngineMode;
import com.marketscan.exception.ResourceNotFoundException;
import com.marketscan.marketdata.KiteMarketDataSource;
import com.marketscan.marketdata.MarketDataProperties;
import com.marketscan.marketdata.MarketDataSource;
import com.marketscan.marketdata.MarketDataSourceFactory;
import com.marketscan.marketdata.SimulatedMarketDataSource;
import com.marketscan.user.BrokerCredentials;
import com.marketscan.user.UserCredentialService;
import com.zerodhatech.kiteconnect.KiteConnect;
import java.math.BigDecimal;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MarketDataSourceFactoryTest {

    @Mock
    private UserCredentialService userCredentialService;

    @Mock
    private KiteConfig kiteConfig;

    @Mock
    private KiteConnect kiteConnect;

    private SimulatedMarketDataSource simulated;
    private MarketDataSourceFactory factory;

    @BeforeEach
    void setUp() {
        MarketDataProperties properties = new MarketDataProperties();
        simulated = new SimulatedMarketDataSource(properties, Clock.systemUTC());
        factory = new MarketDataSourceFactory(userCredentialService, simulated, kiteConfig, properties, Clock.systemUTC());
    }

    @Test
    @DisplayName("No user means simulated data")
    void noUser() {
        assertThat(factory.resolve((String) null)).isSameAs(simulated);
        assertThat(factory.resolve(" ")).isSameAs(simulated);
        verifyNoInteractions(userCredentialService);
    }

    @Test
    @DisplayName("A user without an access token gets simulated data")
    void userWithoutSession() {
        when(userCredentialService.getCredentials("user-1"))
                .thenReturn(new BrokerCredentials("user-1", "key", null, BigDecimal.TEN));

        assertThat(factory.resolve("user-1")).isSameAs(simulated);
        verify(kiteConfig, never()).createClient(anyString(), anyString());
    }

    @Test
    @DisplayName("A user with an access token gets live Kite data")
    void userWithSession() {
        when(kiteConfig.createClient("key", "token")).thenReturn(kiteConnect);

        MarketDataSource source = factory.resolve(new BrokerCredentials("user-1", "key", "token", null));

        assertThat(source).isInstanceOf(KiteMarketDataSource.class);
        assertThat(source.getMode()).isEqualTo(EngineMode.LIVE);
    }

    @Test
    @DisplayName("An unknown user is not found")
    void unknownUser() {
        when(userCredentialService.getCredentials("ghost")).thenThrow(new ResourceNotFoundException("User", "ghost"));

        assertThatThrownBy(() -> factory.resolve("ghost")).isInstanceOf(ResourceNotFoundException.class);
    }
}
