/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Smooth function a descent backend minimizes, defined over evaluated trials
 * so it never triggers an evaluation of its own for the value.
 */
public interface MeritFunction {
    
    /**
     * Computes the merit of a trial.
     * @param trial Evaluated trial
     * @return Merit value
     */
    double value(Trial trial);
    
    /**
     * Computes the merit gradient at a trial.
     * <p>May spend finite-difference probes through the session.</p>
     * @param trial Evaluated trial
     * @param g Output gradient
     */
    void gradient(Trial trial, double[] g);
}
