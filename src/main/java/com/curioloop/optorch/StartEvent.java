/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.time.Instant;

/**
 * A run is about to evaluate its starting point {@code x0} within its bounds.
 */
public final class StartEvent extends ProgressEvent {
    
    private final double[] seed;
    private final Bounds bounds;
    private final String strategy;
    
    StartEvent(int runIndex, Instant timestamp, double[] seed, Bounds bounds, String strategy) {
        super(Kind.START, runIndex, timestamp);
        this.seed = seed.clone();
        this.bounds = bounds != null ? bounds : Bounds.none();
        this.strategy = strategy;
    }
    
    public double[] getSeed() {
        return seed.clone();
    }
    
    public Bounds getBounds() {
        return bounds;
    }
    
    public String getStrategy() {
        return strategy;
    }
    
    @Override
    public HistoryRecord toRecord() {
        return HistoryRecord.start(getRunIndex(), seed, bounds, getTimestamp());
    }
}
