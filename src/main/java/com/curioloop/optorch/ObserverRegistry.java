/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps observer type names to factories.
 * <p>
 * The default registry knows {@code cost} (alias {@code cost-curve}) and
 * {@code logging}. Names are trimmed and case-insensitive.
 * </p>
 */
public final class ObserverRegistry {
    
    private final Map<String, Function<Map<String, Object>, ProgressObserver>> factories = new LinkedHashMap<>();
    
    /**
     * Creates a registry holding the built-in observers.
     * @return New registry
     */
    public static ObserverRegistry defaults() {
        ObserverRegistry registry = new ObserverRegistry();
        registry.register("cost", CostCurveObserver::new);
        registry.register("cost-curve", CostCurveObserver::new);
        registry.register("logging", LoggingObserver::new);
        return registry;
    }
    
    /**
     * Creates an empty registry.
     */
    public ObserverRegistry() {}
    
    /**
     * Registers a factory.
     * @param name Type name
     * @param factory Creates an observer from its configuration
     * @return This registry
     */
    public synchronized ObserverRegistry register(String name, Function<Map<String, Object>, ProgressObserver> factory) {
        if (name == null || factory == null) {
            throw new ConfigurationException("Observer name and factory are required");
        }
        factories.put(normalize(name), factory);
        return this;
    }
    
    /**
     * Gets the registered type names.
     * @return Names
     */
    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet()));
    }
    
    /**
     * Instantiates a described observer.
     * @param descriptor Descriptor
     * @return Observer
     * @throws ConfigurationException on an unknown type
     */
    public synchronized ProgressObserver create(ObserverDescriptor descriptor) {
        Function<Map<String, Object>, ProgressObserver> factory = factories.get(normalize(descriptor.getType()));
        if (factory == null) {
            throw new ConfigurationException("Unknown observer type '" + descriptor.getType()
                + "', expected one of " + factories.keySet());
        }
        return factory.apply(descriptor.getConfig());
    }
    
    private static String normalize(String name) {
        return name.trim().toLowerCase();
    }
}
