package com.marketscan.strategy;

import com.marketscan.domain.model.StrategyDefinition;
import java.util.List;

/**
 * Read access to the strategies the engine should run.
 */
public interface StrategyStore {

    /**
     * Returns the enabled strategies, each resolved to a voter kind. Rows that cannot be
     * resolved are left out.
     *
     * @throws RuntimeException when the backing store cannot be read
     */
    List<StrategyDefinition> listEnabledStrategies();
}
