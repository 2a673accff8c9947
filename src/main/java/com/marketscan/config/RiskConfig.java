package com.marketscan.config;

import com.marketscan.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.yml.
 *
 * <p>Properties prefix: {@code marketscan.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${marketscan.risk.daily-loss-percentage:5.0}") BigDecimal dailyLossPercentage,
            @Value("${marketscan.risk.max-trades-per-symbol-per-day:50}") int maxTradesPerSymbolPerDay) {
        return RiskLimits.builder()
                .dailyLossPercentage(dailyLossPercentage)
                .maxTradesPerSymbolPerDay(maxTradesPerSymbolPerDay)
                .build();
    }
}
