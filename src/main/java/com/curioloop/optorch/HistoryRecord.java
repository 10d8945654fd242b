/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable journal entry for one progress event.
 * <p>
 * Step records carry the accepted point; start records the starting point
 * (unevaluated) and the bounds; end records the run's best point and stop
 * reason.
 * </p>
 */
public final class HistoryRecord {
    
    private final ProgressEvent.Kind kind;
    private final int runIndex;
    private final int iteration;
    private final Candidate candidate;
    private final Instant timestamp;
    private final StopReason reason;
    private final double[] x0;
    private final Bounds bounds;
    
    HistoryRecord(ProgressEvent.Kind kind, int runIndex, int iteration, Candidate candidate,
                  Instant timestamp, StopReason reason) {
        this(kind, runIndex, iteration, candidate, timestamp, reason, null, null);
    }
    
    private HistoryRecord(ProgressEvent.Kind kind, int runIndex, int iteration, Candidate candidate,
                          Instant timestamp, StopReason reason, double[] x0, Bounds bounds) {
        this.kind = kind;
        this.runIndex = runIndex;
        this.iteration = iteration;
        this.candidate = candidate;
        this.timestamp = timestamp;
        this.reason = reason;
        this.x0 = x0;
        this.bounds = bounds;
    }
    
    static HistoryRecord start(int runIndex, double[] x0, Bounds bounds, Instant timestamp) {
        return new HistoryRecord(ProgressEvent.Kind.START, runIndex, 0, null, timestamp, null,
            x0.clone(), bounds);
    }
    
    public ProgressEvent.Kind getKind() {
        return kind;
    }
    
    public int getRunIndex() {
        return runIndex;
    }
    
    public int getIteration() {
        return iteration;
    }
    
    /**
     * Gets the candidate the record describes.
     * @return Candidate, or null for a start record
     */
    public Candidate getCandidate() {
        return candidate;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    /**
     * Gets the stop reason.
     * @return Reason for end records, null otherwise
     */
    public StopReason getReason() {
        return reason;
    }
    
    /**
     * Gets the starting point.
     * @return Copy of x0 for start records, null otherwise
     */
    public double[] getX0() {
        return x0 != null ? x0.clone() : null;
    }
    
    /**
     * Gets the bounds the run starts in.
     * @return Bounds for start records, null otherwise
     */
    public Bounds getBounds() {
        return bounds;
    }
    
    /**
     * Renders the record for the output store.
     * <p>
     * Keys: {@code kind}, {@code run_index}, {@code iter}, {@code x}, {@code f},
     * {@code feasible}, {@code violation}, {@code timestamp} (epoch seconds),
     * for start records {@code x0} and {@code bounds} and for end records
     * {@code reason}.
     * </p>
     * @return Unmodifiable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", kind.getLabel());
        out.put("run_index", runIndex);
        out.put("iter", iteration);
        if (candidate != null) {
            out.put("x", Candidate.toList(candidate.getX()));
            out.put("f", candidate.getValue());
            out.put("feasible", candidate.isFeasible());
            out.put("violation", candidate.getViolation());
        }
        if (x0 != null) {
            out.put("x0", Candidate.toList(x0));
            out.put("bounds", bounds.toList());
        }
        out.put("timestamp", timestamp.toEpochMilli() / 1000.0);
        if (reason != null) {
            out.put("reason", reason.getLabel());
        }
        return Collections.unmodifiableMap(out);
    }
    
    @Override
    public String toString() {
        return "HistoryRecord" + toMap();
    }
}
