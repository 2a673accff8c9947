package com.marketscan.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketscan.mapper.ParametersJson;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ParametersJsonTest {

    @Test
    @DisplayName("Numbers, booleans and strings keep their JSON types")
    void parsesScalars() {
        Map<String, Object> parameters =
                ParametersJson.parse("{\"period\": 14, \"multiplier\": 2.5, \"useClose\": true, \"source\": \"hl2\"}");

        assertThat(parameters)
                .containsEntry("period", 14)
                .containsEntry("useClose", true)
                .containsEntry("source", "hl2");
        assertThat(((Number) parameters.get("multiplier")).doubleValue()).isEqualTo(2.5);
        assertThat(parameters.keySet()).containsExactly("period", "multiplier", "useClose", "source");
    }

    @Test
    @DisplayName("Null and blank columns mean no overrides")
    void emptyColumns() {
        assertThat(ParametersJson.parse(null)).isEmpty();
        assertThat(ParametersJson.parse("  ")).isEmpty();
    }

    @Test
    @DisplayName("Broken JSON and non-object JSON are rejected")
    void rejectsInvalid() {
        assertThatThrownBy(() -> ParametersJson.parse("{not json"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ParametersJson.parse("[14, 26]"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ARRAY");
    }
}
