package com.marketscan.domain.model;

import com.marketscan.domain.enums.ScanAction;
import com.marketscan.strategy.Vote;
import com.marketscan.strategy.VoterKind;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * The aggregated opinion of all enabled voters for one symbol at one scan, plus what the
 * engine did with it.
 *
 * <p>Entries in the signal log are never mutated: the scanner builds a fresh instance with
 * {@code toBuilder()} once sizing and the action are known.
 */
@Value
@Builder(toBuilder = true)
public class WeightedSignal {

    String symbol;
    LocalDateTime timestamp;

    /** Individual votes of the enabled voters, in voter declaration order. */
    Map<VoterKind, Vote> votes;

    /** Weighted mean of the votes, within [-1, 1]. */
    double score;

    Vote decision;

    /** Share of enabled voters that voted for the decision, within [0, 1]. */
    double confidence;

    BigDecimal price;

    int suggestedQuantity;
    BigDecimal stopLoss;
    BigDecimal takeProfit;

    ScanAction action;

    /** Exit reason, risk violation or error text; null when nothing to add. */
    String note;

    public static WeightedSignal error(String symbol, LocalDateTime timestamp, String message) {
        return WeightedSignal.builder()
                .symbol(symbol)
                .timestamp(timestamp)
                .votes(Map.of())
                .score(0.0)
                .decision(Vote.HOLD)
                .confidence(0.0)
                .action(ScanAction.ERROR)
                .note(message)
                .build();
    }
}
