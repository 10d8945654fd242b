/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Hardware or simulation adapter driven alongside (or instead of) an
 * {@link ObjectiveModel}.
 * <p>
 * Controllers are stateful, so runs that use one always execute one after
 * another.
 * </p>
 */
public interface Controller {
    
    /**
     * Restores the controller to its initial state; called before every run.
     */
    void reset();
    
    /**
     * Applies a point and returns the resulting observation.
     * <p>When no model is configured the observation is the objective value.</p>
     * @param x Point (read-only)
     * @return Observation
     */
    double apply(double[] x);
    
    /**
     * Checks whether a point may be applied at all.
     * <p>Unsafe points are never applied and are reported infeasible.</p>
     * @param x Point (read-only)
     * @return true if safe
     */
    boolean safe(double[] x);
}
