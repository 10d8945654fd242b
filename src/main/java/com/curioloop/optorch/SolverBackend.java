/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Marker for numerical engines provided by a {@link SolverLibrary}.
 */
public interface SolverBackend {
    
    /**
     * Gets the name the backend is registered under.
     * @return Backend name
     */
    String getName();
}
