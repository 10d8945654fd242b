/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a run's cumulative counters, handed to step listeners.
 */
public final class RunMetrics {
    
    private final int evaluations;
    private final int probes;
    private final int iterations;
    private final double bestValue;
    private final double functionDelta;
    private final double step;
    private final long elapsedNanos;
    
    RunMetrics(int evaluations, int probes, int iterations, double bestValue,
               double functionDelta, double step, long elapsedNanos) {
        this.evaluations = evaluations;
        this.probes = probes;
        this.iterations = iterations;
        this.bestValue = bestValue;
        this.functionDelta = functionDelta;
        this.step = step;
        this.elapsedNanos = elapsedNanos;
    }
    
    /**
     * Gets the number of objective evaluations, finite-difference probes included.
     * @return Evaluation count
     */
    public int getEvaluations() {
        return evaluations;
    }
    
    /**
     * Gets the number of objective evaluations spent on finite differences.
     * @return Probe count
     */
    public int getProbes() {
        return probes;
    }
    
    public int getIterations() {
        return iterations;
    }
    
    /**
     * Gets the lowest objective value seen so far, regardless of feasibility.
     * @return Best value, NaN before the first evaluation
     */
    public double getBestValue() {
        return bestValue;
    }
    
    /**
     * Gets |value - previous best value| of the last evaluation.
     * @return Delta, NaN if undefined
     */
    public double getFunctionDelta() {
        return functionDelta;
    }
    
    /**
     * Gets the distance between the last two best points.
     * @return Step norm, NaN if undefined
     */
    public double getStep() {
        return step;
    }
    
    public long getElapsedNanos() {
        return elapsedNanos;
    }
    
    /**
     * Renders the metrics for a termination record.
     * @return Unmodifiable map of numbers
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("evaluations", (double) evaluations);
        out.put("probes", (double) probes);
        out.put("iterations", (double) iterations);
        out.put("best_value", bestValue);
        out.put("f_delta", functionDelta);
        out.put("x_step", step);
        out.put("elapsed_ms", elapsedNanos / 1e6);
        return Collections.unmodifiableMap(out);
    }
    
    @Override
    public String toString() {
        return "RunMetrics{" +
                "evaluations=" + evaluations +
                ", probes=" + probes +
                ", iterations=" + iterations +
                ", bestValue=" + bestValue +
                ", functionDelta=" + functionDelta +
                ", step=" + step +
                '}';
    }
}
