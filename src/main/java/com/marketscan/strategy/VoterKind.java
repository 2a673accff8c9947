package com.marketscan.strategy;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of strategy voters the engine knows how to run.
 *
 * <p>Each kind carries its default aggregation weight and the keywords used to recognise it
 * from a free-form strategy name when the strategy row does not name a kind explicitly. The
 * declaration order is the keyword matching order: kinds whose keywords contain another kind's
 * keyword ("stochastic rsi" contains "rsi") are declared first.
 */
public enum VoterKind {
    STOCH_RSI(0.8, List.of("stochastic", "stoch_rsi", "stoch rsi")),
    SMA_CROSSOVER(1.0, List.of("moving average", "sma", "ma_crossover", "ma crossover")),
    EMA_CROSSOVER(1.0, List.of("ema crossover", "ema_crossover", "exponential", "ema")),
    MACD(1.0, List.of("macd")),
    BOLLINGER(0.7, List.of("bollinger")),
    SUPERTREND(1.2, List.of("supertrend", "super trend")),
    VWAP(0.9, List.of("vwap")),
    RSI(0.8, List.of("rsi"));

    private final double defaultWeight;
    private final List<String> nameKeywords;

    VoterKind(double defaultWeight, List<String> nameKeywords) {
        this.defaultWeight = defaultWeight;
        this.nameKeywords = nameKeywords;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public List<String> getNameKeywords() {
        return nameKeywords;
    }

    /**
     * Resolves a voter kind from a strategy name such as "EMA Crossover 12/26".
     * Matching is case-insensitive; EMA is checked before the plain moving average.
     */
    public static Optional<VoterKind> fromStrategyName(String strategyName) {
        if (strategyName == null || strategyName.isBlank()) {
            return Optional.empty();
        }
        String name = strategyName.toLowerCase(Locale.ROOT);
        if (EMA_CROSSOVER.matches(name)) {
            return Optional.of(EMA_CROSSOVER);
        }
        for (VoterKind kind : values()) {
            if (kind.matches(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    private boolean matches(String lowerCaseName) {
        return nameKeywords.stream().anyMatch(lowerCaseName::contains);
    }
}
