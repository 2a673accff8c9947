package com.marketscan.unit.money;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketscan.domain.enums.PositionSizingType;
import com.marketscan.exception.EngineConfigurationException;
import com.marketscan.money.MoneyManagementConfig;
import com.marketscan.money.PositionSizerRegistry;
import com.marketscan.money.impl.AtrRiskSizer;
import com.marketscan.money.impl.HalfKellySizer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionSizerRegistryTest {

    private final MoneyManagementConfig config = new MoneyManagementConfig();
    private final AtrRiskSizer atrRiskSizer = new AtrRiskSizer(config);

    @Test
    @DisplayName("Each sizer is found by the type it declares")
    void resolvesByType() {
        HalfKellySizer halfKelly = new HalfKellySizer(config, atrRiskSizer);
        PositionSizerRegistry registry = new PositionSizerRegistry(List.of(atrRiskSizer, halfKelly));

        assertThat(registry.sizerFor(PositionSizingType.ATR_RISK)).isSameAs(atrRiskSizer);
        assertThat(registry.sizerFor(PositionSizingType.HALF_KELLY)).isSameAs(halfKelly);
        assertThat(registry.registeredTypes())
                .containsExactly(PositionSizingType.ATR_RISK, PositionSizingType.HALF_KELLY);
    }

    @Test
    @DisplayName("A configured type with no sizer is a configuration error")
    void missingSizer() {
        PositionSizerRegistry registry = new PositionSizerRegistry(List.of(atrRiskSizer));

        assertThatThrownBy(() -> registry.sizerFor(PositionSizingType.HALF_KELLY))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("HALF_KELLY");
    }

    @Test
    @DisplayName("Two sizers for one type fail construction")
    void duplicateType() {
        assertThatThrownBy(() -> new PositionSizerRegistry(List.of(atrRiskSizer, new AtrRiskSizer(config))))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("ATR_RISK");
    }
}
