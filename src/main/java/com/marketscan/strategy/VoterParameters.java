package com.marketscan.strategy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Key/value parameters for one voter, as stored with the strategy.
 *
 * <p>Values may arrive as numbers or strings (JSON columns, request bodies); the typed
 * getters fall back to the supplied default when a key is absent.
 */
public final class VoterParameters {

    private static final VoterParameters EMPTY = new VoterParameters(Map.of());

    private final Map<String, Object> params;

    private VoterParameters(Map<String, Object> params) {
        this.params = params;
    }

    public static VoterParameters empty() {
        return EMPTY;
    }

    public static VoterParameters of(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return EMPTY;
        }
        return new VoterParameters(Collections.unmodifiableMap(new HashMap<>(params)));
    }

    public int getParamOrDefault(String key, int defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return (int) Double.parseDouble(value.toString());
    }

    public double getDoubleParamOrDefault(String key, double defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    public Map<String, Object> asMap() {
        return params;
    }

    @Override
    public String toString() {
        return params.toString();
    }
}
