/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Why a run stopped.
 * <p>
 * Reasons are mutually exclusive. When several hold at the same check the
 * one with the lowest {@link #getPriority() priority} value wins: budget,
 * then convergence, then cancellation, then whatever the solver reported.
 * </p>
 */
public enum StopReason {
    
    /** Evaluation, iteration or wall-clock budget exhausted */
    BUDGET("budget", 0, "Budget exhausted"),
    
    /** Objective change stayed below the absolute tolerance */
    FTOL("ftol", 1, "Function tolerance satisfied"),
    
    /** Step between successive best points fell below the tolerance */
    XTOL("xtol", 1, "Variable tolerance satisfied"),
    
    /** Cancelled through the shared cancellation flag */
    CANCELLED("cancelled", 2, "Cancelled by caller"),
    
    /** Solver reported convergence */
    CONVERGED("converged", 3, "Solver reported convergence"),
    
    /** Solver reported failure, was unavailable, or the run raised */
    FAILED("failed", 3, "Solver reported failure");
    
    private final String label;
    private final int priority;
    private final String message;
    
    StopReason(String label, int priority, String message) {
        this.label = label;
        this.priority = priority;
        this.message = message;
    }
    
    /**
     * Gets the external label written to the output store.
     * @return Lower-case label
     */
    public String getLabel() {
        return label;
    }
    
    /**
     * Gets the priority; lower values win.
     * @return Priority
     */
    public int getPriority() {
        return priority;
    }
    
    /**
     * Gets the default human readable message.
     * @return Message
     */
    public String getMessage() {
        return message;
    }
    
    /**
     * Checks if this reason means the run reached a usable optimum.
     * @return true for convergence reasons
     */
    public boolean isConvergence() {
        return this == FTOL || this == XTOL || this == CONVERGED;
    }
    
    /**
     * Resolves an external label.
     * @param label Label such as {@code "budget"}
     * @return Matching reason
     * @throws ConfigurationException if the label is unknown
     */
    public static StopReason fromLabel(String label) {
        for (StopReason reason : values()) {
            if (reason.label.equalsIgnoreCase(label)) {
                return reason;
            }
        }
        throw new ConfigurationException("Unknown stop reason: " + label);
    }
    
    @Override
    public String toString() {
        return label;
    }
}
