/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Optional capability of an {@link ObjectiveModel}: analytical gradient.
 */
public interface GradientCapable {
    
    /**
     * Computes the gradient.
     * @param x Point (read-only)
     * @return Partial derivatives, or null when the gradient is not available at this point
     */
    double[] gradient(double[] x);
}
