/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Thrown when a request is malformed: unknown strategy or observer name,
 * bad bounds, mismatched dimensions, constraint functions of the wrong arity.
 * <p>
 * Raised before any objective evaluation whenever the problem can be detected
 * up front; aborts the whole invocation.
 * </p>
 */
public class ConfigurationException extends OptimizationException {
    
    private static final long serialVersionUID = 1L;
    
    public ConfigurationException(String message) {
        super(message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
