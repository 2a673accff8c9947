package com.marketscan.strategy;

import com.marketscan.domain.model.StrategyDefinition;
import com.marketscan.timeseries.Candle;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the votes of the enabled strategies into one decision.
 *
 * <p>{@code score = sum(vote * weight) / sum(weight)} over the enabled voters only, so
 * disabling a voter renormalises the rest. A score above {@value #DECISION_THRESHOLD} is a
 * BUY, below its negative a SELL. With no enabled voters the result is a HOLD with zero score
 * and zero confidence.
 *
 * <p>When two enabled strategies map to the same voter kind the first one wins.
 */
@Component
public class SignalAggregator {

    private static final Logger log = LoggerFactory.getLogger(SignalAggregator.class);

    public static final double DECISION_THRESHOLD = 0.3;

    private final StrategyVoters strategyVoters;

    public SignalAggregator(StrategyVoters strategyVoters) {
        this.strategyVoters = strategyVoters;
    }

    /**
     * Runs every enabled voter over the window and combines the result.
     */
    public AggregatedVote aggregate(List<Candle> candles, List<StrategyDefinition> enabledStrategies) {
        Map<VoterKind, Vote> votes = new EnumMap<>(VoterKind.class);
        Map<VoterKind, Double> weights = new EnumMap<>(VoterKind.class);
        for (StrategyDefinition strategy : enabledStrategies) {
            if (votes.containsKey(strategy.getKind())) {
                continue;
            }
            Vote vote = strategyVoters.vote(strategy.getKind(), candles, strategy.getParams());
            votes.put(strategy.getKind(), vote);
            weights.put(strategy.getKind(), strategy.effectiveWeight());
        }
        AggregatedVote result = combine(votes, weights);
        log.debug("Aggregated {} votes: score={} decision={}", votes.size(), result.score(), result.decision());
        return result;
    }

    /**
     * Combines already-cast votes. Voters missing from {@code weights} use their default weight.
     */
    public AggregatedVote combine(Map<VoterKind, Vote> votes, Map<VoterKind, Double> weights) {
        if (votes.isEmpty()) {
            return AggregatedVote.noVoters();
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<VoterKind, Vote> entry : votes.entrySet()) {
            double weight = weights.getOrDefault(entry.getKey(), entry.getKey().getDefaultWeight());
            weightedSum += entry.getValue().getValue() * weight;
            totalWeight += weight;
        }
        double score = totalWeight > 0 ? weightedSum / totalWeight : 0.0;

        Vote decision;
        if (score > DECISION_THRESHOLD) {
            decision = Vote.BUY;
        } else if (score < -DECISION_THRESHOLD) {
            decision = Vote.SELL;
        } else {
            decision = Vote.HOLD;
        }

        long agreeing = votes.values().stream().filter(v -> v == decision).count();
        double confidence = (double) agreeing / votes.size();

        return new AggregatedVote(Collections.unmodifiableMap(new EnumMap<>(votes)), score, decision, confidence);
    }
}
