/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed outcome of an optimization invocation.
 */
public final class OptimizationReport {
    
    private final String strategy;
    private final Map<String, Object> params;
    private final List<HistoryRecord> history;
    private final List<HistoryRecord> events;
    private final List<RunResult> runs;
    private final RunResult best;
    
    OptimizationReport(String strategy, Map<String, Object> params, List<HistoryRecord> history,
                       List<HistoryRecord> events, List<RunResult> runs, RunResult best) {
        this.strategy = strategy;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.history = history;
        this.events = events;
        this.runs = runs;
        this.best = best;
    }
    
    /**
     * Gets the strategy name.
     * @return Name, e.g. {@code LocalConvex}
     */
    public String getStrategy() {
        return strategy;
    }
    
    /**
     * Gets the bounds, termination and strategy parameters in effect.
     * @return Parameters
     */
    public Map<String, Object> getParams() {
        return params;
    }
    
    /**
     * Gets the step records of every run in emission order.
     * @return History
     */
    public List<HistoryRecord> getHistory() {
        return history;
    }
    
    /**
     * Gets every journaled event, start and end included.
     * @return Events
     */
    public List<HistoryRecord> getEvents() {
        return events;
    }
    
    public List<RunResult> getRuns() {
        return runs;
    }
    
    public RunResult getBestRun() {
        return best;
    }
    
    public Candidate getBestCandidate() {
        return best.getCandidate();
    }
    
    public TerminationResult getTermination() {
        return best.getTermination();
    }
    
    @Override
    public String toString() {
        return "OptimizationReport{" +
                "strategy='" + strategy + '\'' +
                ", runs=" + runs.size() +
                ", steps=" + history.size() +
                ", best=" + best.getCandidate() +
                ", termination=" + best.getTermination().getReason() +
                '}';
    }
}
