/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Key/value store the optimization results are written to, typically owned by
 * the host pipeline.
 */
public interface OutputStore {
    
    void set(String key, Object value);
    
    /**
     * Reads a value.
     * @param key Key
     * @return Value, or null if absent
     */
    Object get(String key);
}
