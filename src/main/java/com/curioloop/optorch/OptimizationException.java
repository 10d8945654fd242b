/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Root of the orchestrator's unchecked exceptions.
 * <p>
 * Every failure carries the {@link StopReason} a run would report if the
 * failure were folded into its termination record.
 * </p>
 */
public class OptimizationException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final StopReason reason;
    
    /**
     * Creates an optimization exception.
     * @param message Error message
     */
    public OptimizationException(String message) {
        super(message);
        this.reason = StopReason.FAILED;
    }
    
    /**
     * Creates an optimization exception with cause.
     * @param message Error message
     * @param cause Underlying cause
     */
    public OptimizationException(String message, Throwable cause) {
        super(message, cause);
        this.reason = StopReason.FAILED;
    }
    
    /**
     * Creates an optimization exception with a specific stop reason.
     * @param message Error message
     * @param reason Stop reason
     * @param cause Underlying cause (may be null)
     */
    protected OptimizationException(String message, StopReason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
    
    /**
     * Gets the stop reason associated with this exception.
     * @return Stop reason
     */
    public StopReason getReason() {
        return reason;
    }
}
