/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single strategy run.
 */
public final class RunResult {
    
    private final int runIndex;
    private final double[] seed;
    private final Candidate candidate;
    private final TerminationResult termination;
    private final Throwable error;
    
    /**
     * Creates a run result.
     * @param runIndex Run index within the batch
     * @param seed Starting point
     * @param candidate Best candidate of the run
     * @param termination Why the run stopped
     * @param error Fault that aborted the run, or null
     */
    public RunResult(int runIndex, double[] seed, Candidate candidate, TerminationResult termination, Throwable error) {
        this.runIndex = runIndex;
        this.seed = seed.clone();
        this.candidate = candidate;
        this.termination = termination;
        this.error = error;
    }
    
    public int getRunIndex() {
        return runIndex;
    }
    
    /**
     * Gets the starting point.
     * @return Copy of the seed
     */
    public double[] getSeed() {
        return seed.clone();
    }
    
    public Candidate getCandidate() {
        return candidate;
    }
    
    public TerminationResult getTermination() {
        return termination;
    }
    
    /**
     * Gets the fault that aborted the run.
     * @return Fault, or null if the run completed normally
     */
    public Throwable getError() {
        return error;
    }
    
    /**
     * Checks whether the run was aborted by an evaluation fault.
     * @return true if raised
     */
    public boolean isRaised() {
        return error != null;
    }
    
    /**
     * Renders the candidate with run metadata for {@code optimizer.runs}.
     * @return Mapping
     */
    public Map<String, Object> toMap() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("run_index", runIndex);
        meta.put("seed", Candidate.toList(seed));
        meta.put("reason", termination.getReason().getLabel());
        if (error != null) {
            meta.put("error", String.valueOf(error.getMessage()));
        }
        return candidate.withMeta(meta).toMap();
    }
    
    @Override
    public String toString() {
        return "RunResult{" +
                "runIndex=" + runIndex +
                ", reason=" + termination.getReason() +
                ", candidate=" + candidate +
                (error != null ? ", error=" + error.getMessage() : "") +
                '}';
    }
}
