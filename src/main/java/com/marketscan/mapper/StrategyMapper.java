package com.marketscan.mapper;

import com.marketscan.domain.model.StrategyDefinition;
import com.marketscan.entity.StrategyEntity;
import com.marketscan.strategy.VoterKind;
import com.marketscan.strategy.VoterParameters;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from StrategyEntity rows to the {@link StrategyDefinition} the engine runs.
 *
 * <p>The voter kind comes from the {@code voter_kind} column, or failing that from keywords in
 * the strategy name. A row matching neither maps to a null kind and is skipped by the store.
 */
@Mapper
public interface StrategyMapper {

    @Mapping(target = "kind", expression = "java(resolveKind(entity))")
    @Mapping(target = "params", expression = "java(toParameters(entity.getParametersJson()))")
    StrategyDefinition toDefinition(StrategyEntity entity);

    default VoterKind resolveKind(StrategyEntity entity) {
        if (entity.getVoterKind() != null) {
            return entity.getVoterKind();
        }
        return VoterKind.fromStrategyName(entity.getName()).orElse(null);
    }

    default VoterParameters toParameters(String parametersJson) {
        return VoterParameters.of(ParametersJson.parse(parametersJson));
    }
}
