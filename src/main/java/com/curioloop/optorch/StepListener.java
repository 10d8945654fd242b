/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Receives one call per solver iteration, synchronously.
 * <p>
 * The run does not continue until the call returns. Nothing the listener
 * does can change the trajectory: it only ever sees immutable candidates
 * and metric snapshots.
 * </p>
 */
@FunctionalInterface
public interface StepListener {
    
    /** Listener that ignores every step */
    StepListener NONE = (iteration, candidate, metrics) -> {};
    
    /**
     * Called after the starting point has been evaluated (iteration 0) and
     * after every completed solver iteration.
     * @param iteration Iteration number
     * @param candidate Point accepted by the solver in this iteration
     * @param metrics Cumulative metrics
     */
    void onStep(int iteration, Candidate candidate, RunMetrics metrics);
}
