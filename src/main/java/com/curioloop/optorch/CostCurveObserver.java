/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects the best-so-far cost of every run, one point per delivered step.
 * <p>
 * Configuration: optional {@code label} (string) naming the curve set.
 * </p>
 */
public final class CostCurveObserver implements ProgressObserver {
    
    private final String label;
    private final Map<Integer, List<Double>> series = new TreeMap<>();
    private final Map<Integer, Double> best = new TreeMap<>();
    
    public CostCurveObserver() {
        this(Collections.emptyMap());
    }
    
    /**
     * Creates the observer from registry configuration.
     * @param config Configuration
     * @throws ConfigurationException on unknown keys
     */
    public CostCurveObserver(Map<String, Object> config) {
        Object raw = null;
        for (Map.Entry<String, Object> e : config.entrySet()) {
            if (!e.getKey().equals("label")) {
                throw new ConfigurationException("Unknown cost observer option: " + e.getKey());
            }
            raw = e.getValue();
        }
        this.label = raw != null ? raw.toString() : "cost";
    }
    
    public String getLabel() {
        return label;
    }
    
    @Override
    public synchronized void onStep(StepEvent event) {
        double value = event.getCandidate().getValue();
        Double previous = best.get(event.getRunIndex());
        double current = previous == null || value < previous ? value : previous;
        best.put(event.getRunIndex(), current);
        series.computeIfAbsent(event.getRunIndex(), k -> new ArrayList<>()).add(current);
    }
    
    /**
     * Gets the cost curve of a run.
     * @param runIndex Run index
     * @return Best-so-far costs, empty if the run delivered no step
     */
    public synchronized List<Double> getSeries(int runIndex) {
        List<Double> values = series.get(runIndex);
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
    }
    
    /**
     * Gets the indices of runs that delivered at least one step.
     * @return Run indices in ascending order
     */
    public synchronized List<Integer> getRuns() {
        return new ArrayList<>(series.keySet());
    }
}
