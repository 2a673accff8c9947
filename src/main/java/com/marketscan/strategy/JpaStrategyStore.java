package com.marketscan.strategy;

import com.marketscan.domain.model.StrategyDefinition;
import com.marketscan.entity.StrategyEntity;
import com.marketscan.mapper.StrategyMapper;
import com.marketscan.repository.jpa.StrategyJpaRepository;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link StrategyStore} backed by the strategies table.
 *
 * <p>Rows whose voter kind cannot be resolved or whose parameters are not valid JSON are
 * skipped with a warning rather than failing the whole load.
 */
@Service
public class JpaStrategyStore implements StrategyStore {

    private static final Logger log = LoggerFactory.getLogger(JpaStrategyStore.class);

    private final StrategyJpaRepository strategyJpaRepository;
    private final StrategyMapper strategyMapper = Mappers.getMapper(StrategyMapper.class);

    public JpaStrategyStore(StrategyJpaRepository strategyJpaRepository) {
        this.strategyJpaRepository = strategyJpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<StrategyDefinition> listEnabledStrategies() {
        List<StrategyDefinition> definitions = new ArrayList<>();
        for (StrategyEntity entity : strategyJpaRepository.findByActiveTrueOrderByCreatedAtAsc()) {
            StrategyDefinition definition;
            try {
                definition = strategyMapper.toDefinition(entity);
            } catch (IllegalStateException e) {
                log.warn("Skipping strategy {} ({}): unreadable parameters", entity.getId(), entity.getName());
                continue;
            }
            if (definition.getKind() == null) {
                log.warn("Skipping strategy {} ({}): no matching voter", entity.getId(), entity.getName());
                continue;
            }
            definitions.add(definition);
        }
        log.debug("Loaded {} enabled strategies", definitions.size());
        return definitions;
    }
}
