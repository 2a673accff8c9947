package com.marketscan.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the {@code parameters} column of a strategy row. The column holds a flat JSON object
 * such as {@code {"period": 14, "oversold": 30}}; null or blank means no overrides.
 */
public final class ParametersJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private ParametersJson() {}

    /**
     * @throws IllegalStateException when the text is not a JSON object
     */
    public static Map<String, Object> parse(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Strategy parameters are not valid JSON", e);
        }
        if (!root.isObject()) {
            throw new IllegalStateException("Strategy parameters must be a JSON object, got " + root.getNodeType());
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        root.fields().forEachRemaining(field -> parameters.put(field.getKey(), scalar(field.getValue())));
        return parameters;
    }

    private static Object scalar(JsonNode node) {
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
