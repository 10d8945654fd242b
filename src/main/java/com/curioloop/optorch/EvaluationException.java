/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Thrown when the objective, its gradient or a constraint function raises
 * or returns a non-numeric (NaN) result.
 * <p>
 * Fatal for the run that hit it only; the other runs of a multi-start batch
 * carry on.
 * </p>
 */
public class EvaluationException extends OptimizationException {
    
    private static final long serialVersionUID = 1L;
    
    private final transient RunResult partialResult;
    
    public EvaluationException(String message) {
        super(message);
        this.partialResult = null;
    }
    
    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
        this.partialResult = null;
    }
    
    /**
     * Creates an exception that carries what the failed run had achieved.
     * @param message Detail message
     * @param cause Original fault
     * @param partialResult Result holding the last known candidate
     */
    public EvaluationException(String message, Throwable cause, RunResult partialResult) {
        super(message, cause);
        this.partialResult = partialResult;
    }
    
    /**
     * Gets the result of the run up to the fault.
     * @return Partial result, or null if the fault happened before any evaluation
     */
    public RunResult getPartialResult() {
        return partialResult;
    }
}
