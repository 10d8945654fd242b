/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory {@link OutputStore} preserving insertion order.
 */
public final class MapOutputStore implements OutputStore {
    
    private final Map<String, Object> values = new LinkedHashMap<>();
    
    @Override
    public synchronized void set(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        values.put(key, value);
    }
    
    @Override
    public synchronized Object get(String key) {
        return values.get(key);
    }
    
    /**
     * Gets a snapshot of every entry.
     * @return Unmodifiable copy
     */
    public synchronized Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
    
    @Override
    public synchronized String toString() {
        return "MapOutputStore" + values.keySet();
    }
}
