/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Signals that a solver backend cannot be obtained at runtime.
 * <p>
 * Strategies never let this escape: they turn it into a run whose termination
 * reason is {@link StopReason#FAILED} with the {@code skipped} metric set.
 * </p>
 */
public class SolverUnavailableException extends OptimizationException {
    
    private static final long serialVersionUID = 1L;
    
    private final String backend;
    
    /**
     * Creates the exception for a named backend.
     * @param backend Backend name
     * @param message Error message
     */
    public SolverUnavailableException(String backend, String message) {
        super(message);
        this.backend = backend;
    }
    
    /**
     * Creates the exception for a named backend with cause.
     * @param backend Backend name
     * @param message Error message
     * @param cause Underlying cause
     */
    public SolverUnavailableException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }
    
    /**
     * Gets the name of the backend that could not be loaded.
     * @return Backend name
     */
    public String getBackend() {
        return backend;
    }
}
