/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Why and when a run stopped.
 */
public final class TerminationResult {
    
    /** Metric flag set when the solver backend was unavailable */
    public static final String SKIPPED = "skipped";
    
    private final StopReason reason;
    private final Map<String, Object> metrics;
    private final Map<String, Integer> budget;
    private final String message;
    
    /**
     * Creates a termination record.
     * @param reason Stop reason
     * @param metrics Final metrics (copied)
     * @param budget Consumed and allotted budget (copied)
     * @param message Optional detail (may be null)
     */
    public TerminationResult(StopReason reason, Map<String, Object> metrics,
                             Map<String, Integer> budget, String message) {
        if (reason == null) {
            throw new IllegalArgumentException("Stop reason is required");
        }
        this.reason = reason;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.budget = Collections.unmodifiableMap(new LinkedHashMap<>(budget));
        this.message = message;
    }
    
    public StopReason getReason() {
        return reason;
    }
    
    public Map<String, Object> getMetrics() {
        return metrics;
    }
    
    public Map<String, Integer> getBudget() {
        return budget;
    }
    
    /**
     * Gets the detail message.
     * @return Message, or the reason's default message
     */
    public String getMessage() {
        return message != null ? message : reason.getMessage();
    }
    
    /**
     * Checks whether the run was skipped because its solver was unavailable.
     * @return true if skipped
     */
    public boolean isSkipped() {
        return Boolean.TRUE.equals(metrics.get(SKIPPED));
    }
    
    /**
     * Renders the {@code {reason, metrics, budget}} output shape.
     * @return Unmodifiable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("reason", reason.getLabel());
        out.put("metrics", metrics);
        out.put("budget", budget);
        if (message != null) {
            out.put("message", message);
        }
        return Collections.unmodifiableMap(out);
    }
    
    @Override
    public String toString() {
        return "TerminationResult{" +
                "reason=" + reason +
                ", metrics=" + metrics +
                ", budget=" + budget +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }
}
