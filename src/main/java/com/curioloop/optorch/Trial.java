/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * A candidate together with the constraint residuals it was judged by.
 * <p>
 * Solvers keep trials rather than bare candidates so constraint-aware merit
 * functions never re-evaluate a point.
 * </p>
 */
public final class Trial {
    
    private final Candidate candidate;
    private final Feasibility feasibility;
    private final double[] x;
    
    Trial(Candidate candidate, Feasibility feasibility) {
        this.candidate = candidate;
        this.feasibility = feasibility;
        this.x = candidate.getX();
    }
    
    public Candidate getCandidate() {
        return candidate;
    }
    
    public Feasibility getFeasibility() {
        return feasibility;
    }
    
    public double getValue() {
        return candidate.getValue();
    }
    
    /**
     * Gets a copy of the coordinates.
     * @return Copy of x
     */
    public double[] getX() {
        return x.clone();
    }
    
    // Shared, callers must not modify
    double[] x() {
        return x;
    }
    
    @Override
    public String toString() {
        return "Trial{" + candidate + '}';
    }
}
