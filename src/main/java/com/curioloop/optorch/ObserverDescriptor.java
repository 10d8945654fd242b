/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative observer registration: a registry type name, its configuration
 * and optional throttle overrides.
 */
public final class ObserverDescriptor {
    
    private final String type;
    private final Map<String, Object> config;
    private final Double throttleSeconds;
    private final Integer updateEvery;
    
    private ObserverDescriptor(String type, Map<String, ?> config, Double throttleSeconds, Integer updateEvery) {
        if (type == null || type.trim().isEmpty()) {
            throw new ConfigurationException("Observer type is required");
        }
        this.type = type;
        this.config = config == null ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.throttleSeconds = throttleSeconds;
        this.updateEvery = updateEvery;
    }
    
    /**
     * Describes an observer using the request-wide throttles.
     * @param type Registry name
     * @param config Configuration (may be null)
     * @return Descriptor
     */
    public static ObserverDescriptor of(String type, Map<String, ?> config) {
        return new ObserverDescriptor(type, config, null, null);
    }
    
    /**
     * Describes an observer with its own throttles.
     * @param type Registry name
     * @param config Configuration (may be null)
     * @param throttleSeconds Minimum seconds between steps, null for the request default
     * @param updateEvery Step interval, null for the request default
     * @return Descriptor
     */
    public static ObserverDescriptor of(String type, Map<String, ?> config, Double throttleSeconds, Integer updateEvery) {
        return new ObserverDescriptor(type, config, throttleSeconds, updateEvery);
    }
    
    public String getType() {
        return type;
    }
    
    public Map<String, Object> getConfig() {
        return config;
    }
    
    /**
     * Gets the throttle override.
     * @return Seconds, or null to use the request default
     */
    public Double getThrottleSeconds() {
        return throttleSeconds;
    }
    
    /**
     * Gets the step interval override.
     * @return Interval, or null to use the request default
     */
    public Integer getUpdateEvery() {
        return updateEvery;
    }
    
    @Override
    public String toString() {
        return "ObserverDescriptor{" +
                "type='" + type + '\'' +
                ", config=" + config +
                ", throttleSeconds=" + throttleSeconds +
                ", updateEvery=" + updateEvery +
                '}';
    }
}
