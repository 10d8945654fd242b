/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.function.ToDoubleFunction;

/**
 * Vector-valued constraint function.
 * <ul>
 *   <li>Inequality constraints: every component satisfies g(x) &lt;= 0</li>
 *   <li>Equality constraints: every component satisfies h(x) = 0</li>
 * </ul>
 * A function must return the same number of components at every point.
 */
@FunctionalInterface
public interface ConstraintFunction {
    
    /**
     * Evaluates the constraint components.
     * @param x Point (read-only)
     * @return Component values
     */
    double[] evaluate(double[] x);
    
    /**
     * Creates the linear constraint {@code a·x - b}.
     * <p>
     * Used as an inequality it reads {@code a·x <= b}; as an equality,
     * {@code a·x = b}.
     * </p>
     * @param a Coefficients, one per variable
     * @param b Right-hand side
     * @return Single-component constraint
     */
    static ConstraintFunction linear(double[] a, double b) {
        if (a == null || a.length == 0) {
            throw new ConfigurationException("Linear constraint needs at least one coefficient");
        }
        final double[] coeffs = a.clone();
        return x -> {
            if (x.length != coeffs.length) {
                throw new ConfigurationException(
                    "Linear constraint has " + coeffs.length + " coefficients but x has dimension " + x.length);
            }
            double s = -b;
            for (int i = 0; i < coeffs.length; i++) {
                s += coeffs[i] * x[i];
            }
            return new double[]{s};
        };
    }
    
    /**
     * Adapts a scalar constraint.
     * @param g Scalar function
     * @return Single-component constraint
     */
    static ConstraintFunction scalar(ToDoubleFunction<double[]> g) {
        return x -> new double[]{g.applyAsDouble(x)};
    }
}
