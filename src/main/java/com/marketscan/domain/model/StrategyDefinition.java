package com.marketscan.domain.model;

import com.marketscan.strategy.VoterKind;
import com.marketscan.strategy.VoterParameters;
import lombok.Builder;
import lombok.Value;

/**
 * An enabled strategy as read from the strategy store: which voter it runs, with which
 * parameters, and an optional weight override for aggregation.
 */
@Value
@Builder
public class StrategyDefinition {

    String id;
    String name;
    VoterKind kind;

    @Builder.Default
    VoterParameters params = VoterParameters.empty();

    /** Null (or non-positive) means the voter kind's default weight. */
    Double weight;

    public double effectiveWeight() {
        return weight != null && weight > 0 ? weight : kind.getDefaultWeight();
    }
}
