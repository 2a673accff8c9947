package com.marketscan.money;

import com.marketscan.domain.enums.PositionSizingType;
import com.marketscan.exception.EngineConfigurationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Every {@link PositionSizer} bean, keyed by the sizing type it implements. Two beans claiming
 * the same type fail startup.
 */
@Component
public class PositionSizerRegistry {

    private final Map<PositionSizingType, PositionSizer> sizers = new EnumMap<>(PositionSizingType.class);

    public PositionSizerRegistry(List<PositionSizer> positionSizers) {
        for (PositionSizer sizer : positionSizers) {
            PositionSizer previous = sizers.putIfAbsent(sizer.getType(), sizer);
            if (previous != null) {
                throw new EngineConfigurationException(String.format(
                        "Both %s and %s size %s positions",
                        previous.getClass().getSimpleName(), sizer.getClass().getSimpleName(), sizer.getType()));
            }
        }
    }

    /**
     * @throws EngineConfigurationException when the configured sizing type has no implementation
     */
    public PositionSizer sizerFor(PositionSizingType type) {
        PositionSizer sizer = sizers.get(type);
        if (sizer == null) {
            throw new EngineConfigurationException("No position sizer registered for " + type);
        }
        return sizer;
    }

    public Set<PositionSizingType> registeredTypes() {
        return Collections.unmodifiableSet(sizers.keySet());
    }
}
