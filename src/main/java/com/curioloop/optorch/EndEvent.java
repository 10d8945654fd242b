/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.time.Instant;

/**
 * A run stopped.
 */
public final class EndEvent extends ProgressEvent {
    
    private final RunResult result;
    private final int iteration;
    
    EndEvent(Instant timestamp, RunResult result, int iteration) {
        super(Kind.END, result.getRunIndex(), timestamp);
        this.result = result;
        this.iteration = iteration;
    }
    
    public RunResult getResult() {
        return result;
    }
    
    public TerminationResult getTermination() {
        return result.getTermination();
    }
    
    /**
     * Gets the last iteration the run emitted.
     * @return Iteration, 0 if the run stopped at its starting point
     */
    public int getIteration() {
        return iteration;
    }
    
    @Override
    public HistoryRecord toRecord() {
        return new HistoryRecord(Kind.END, getRunIndex(), iteration, result.getCandidate(),
            getTimestamp(), result.getTermination().getReason());
    }
}
