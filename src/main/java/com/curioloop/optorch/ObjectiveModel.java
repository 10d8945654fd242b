/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * The user-supplied objective to minimize.
 * <p>
 * Implementations that can also differentiate additionally implement
 * {@link GradientCapable}; strategies probe for that capability instead of
 * relying on a fixed type hierarchy.
 * </p>
 * <p>
 * Implementations must be pure: the orchestrator may call them from several
 * threads when multi-start runs execute in parallel.
 * </p>
 */
@FunctionalInterface
public interface ObjectiveModel {
    
    /**
     * Evaluates the objective.
     * @param x Point (read-only)
     * @return Objective value; NaN is reported as an evaluation error
     */
    double objective(double[] x);
    
    /**
     * Probes the gradient capability of a model.
     * @param model Model to probe
     * @return The model as {@link GradientCapable}, or null if it declares no gradient
     */
    static GradientCapable gradientOf(ObjectiveModel model) {
        return model instanceof GradientCapable ? (GradientCapable) model : null;
    }
}
