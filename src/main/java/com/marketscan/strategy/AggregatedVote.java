package com.marketscan.strategy;

import java.util.Map;

/**
 * Outcome of combining the enabled voters' votes.
 *
 * @param votes      individual votes keyed by voter
 * @param score      weighted mean of the vote values, within [-1, 1]
 * @param decision   BUY above the threshold, SELL below its negative, otherwise HOLD
 * @param confidence share of voters whose vote equals the decision
 */
public record AggregatedVote(Map<VoterKind, Vote> votes, double score, Vote decision, double confidence) {

    public static AggregatedVote noVoters() {
        return new AggregatedVote(Map.of(), 0.0, Vote.HOLD, 0.0);
    }
}
