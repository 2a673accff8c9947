package com.marketscan.strategy;

import com.marketscan.entity.StrategyEntity;
import com.marketscan.repository.jpa.StrategyJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Inserts one strategy row per voter kind when the strategies table is empty.
 *
 * <p>SMA crossover, RSI, MACD and SuperTrend start enabled; the rest are inserted disabled so
 * they can be switched on without writing rows by hand. Disabled with
 * {@code marketscan.strategies.seed-defaults=false}.
 */
@Component
@ConditionalOnProperty(name = "marketscan.strategies.seed-defaults", havingValue = "true", matchIfMissing = true)
public class DefaultStrategySeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultStrategySeeder.class);

    static final Set<VoterKind> ENABLED_BY_DEFAULT =
            EnumSet.of(VoterKind.SMA_CROSSOVER, VoterKind.RSI, VoterKind.MACD, VoterKind.SUPERTREND);

    private final StrategyJpaRepository strategyJpaRepository;

    public DefaultStrategySeeder(StrategyJpaRepository strategyJpaRepository) {
        this.strategyJpaRepository = strategyJpaRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (strategyJpaRepository.count() > 0) {
            return;
        }
        List<StrategyEntity> defaults = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now();
        for (VoterKind kind : VoterKind.values()) {
            defaults.add(StrategyEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .name(displayName(kind))
                    .voterKind(kind)
                    .active(ENABLED_BY_DEFAULT.contains(kind))
                    .parametersJson("{}")
                    .createdAt(now.plusNanos(kind.ordinal()))
                    .build());
        }
        strategyJpaRepository.saveAll(defaults);
        log.info("Seeded {} default strategies ({} enabled)", defaults.size(), ENABLED_BY_DEFAULT.size());
    }

    static String displayName(VoterKind kind) {
        return switch (kind) {
            case SMA_CROSSOVER -> "Moving Average Crossover";
            case EMA_CROSSOVER -> "EMA Crossover";
            case RSI -> "RSI Mean Reversion";
            case MACD -> "MACD";
            case BOLLINGER -> "Bollinger Bands";
            case VWAP -> "VWAP";
            case SUPERTREND -> "SuperTrend";
            case STOCH_RSI -> "Stochastic RSI";
        };
    }
}
