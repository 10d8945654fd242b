/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed read access to a strategy's parameter mapping.
 */
public final class StrategyParams {
    
    private final String strategy;
    private final Map<String, Object> values;
    
    private StrategyParams(String strategy, Map<String, Object> values) {
        this.strategy = strategy;
        this.values = values;
    }
    
    /**
     * Wraps a parameter mapping.
     * @param strategy Strategy name, used in error messages
     * @param params Raw parameters (null means none)
     * @param known Accepted keys
     * @return Typed view
     * @throws ConfigurationException on an unknown key
     */
    public static StrategyParams of(String strategy, Map<String, ?> params, Set<String> known) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (params != null) {
            for (Map.Entry<String, ?> e : params.entrySet()) {
                if (!known.contains(e.getKey())) {
                    throw new ConfigurationException("Unknown " + strategy + " parameter '" + e.getKey()
                        + "', expected one of " + known);
                }
                copy.put(e.getKey(), e.getValue());
            }
        }
        return new StrategyParams(strategy, Collections.unmodifiableMap(copy));
    }
    
    public String getString(String key, String defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (!(raw instanceof CharSequence)) {
            throw invalid(key, "a string", raw);
        }
        return raw.toString();
    }
    
    public double getDouble(String key, double defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (!(raw instanceof Number)) {
            throw invalid(key, "a number", raw);
        }
        return ((Number) raw).doubleValue();
    }
    
    public int getInt(String key, int defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (!(raw instanceof Number)) {
            throw invalid(key, "an integer", raw);
        }
        double d = ((Number) raw).doubleValue();
        if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
            throw invalid(key, "an integer", raw);
        }
        return (int) d;
    }
    
    public boolean getBoolean(String key, boolean defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof CharSequence) {
            String s = raw.toString().trim().toLowerCase();
            if (s.equals("true") || s.equals("false")) {
                return Boolean.parseBoolean(s);
            }
        }
        throw invalid(key, "a boolean", raw);
    }
    
    private ConfigurationException invalid(String key, String expected, Object raw) {
        return new ConfigurationException(strategy + " parameter '" + key + "' must be " + expected + ", got " + raw);
    }
    
    @Override
    public String toString() {
        return strategy + values;
    }
}
