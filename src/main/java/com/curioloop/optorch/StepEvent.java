/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.time.Instant;

/**
 * A run completed an iteration (iteration 0 is the evaluated starting point).
 */
public final class StepEvent extends ProgressEvent {
    
    private final HistoryRecord record;
    private final RunMetrics metrics;
    private final boolean improved;
    
    StepEvent(int runIndex, Instant timestamp, int iteration, Candidate candidate,
              RunMetrics metrics, boolean improved) {
        super(Kind.STEP, runIndex, timestamp);
        this.record = new HistoryRecord(Kind.STEP, runIndex, iteration, candidate, timestamp, null);
        this.metrics = metrics;
        this.improved = improved;
    }
    
    public int getIteration() {
        return record.getIteration();
    }
    
    public Candidate getCandidate() {
        return record.getCandidate();
    }
    
    public RunMetrics getMetrics() {
        return metrics;
    }
    
    /**
     * Checks whether this step improved the run's best candidate.
     * @return true if improved
     */
    public boolean isImproved() {
        return improved;
    }
    
    @Override
    public HistoryRecord toRecord() {
        return record;
    }
}
