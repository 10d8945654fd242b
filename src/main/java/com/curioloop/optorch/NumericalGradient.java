/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Finite-difference derivatives for models that declare no gradient.
 * <p>
 * Each method reports how many extra function evaluations it spends per
 * variable so callers can charge them against the evaluation budget.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * double[] g = new double[2];
 * NumericalGradient.CENTRAL.differentiate(x -> x[0]*x[0] + x[1]*x[1], x, fx, g);
 * }</pre>
 */
public enum NumericalGradient {
    
    /**
     * Forward difference, g[i] ≈ (f(x + h*e_i) - f(x)) / h.
     * One probe per variable, O(h) accuracy.
     */
    FORWARD("forward", 1) {
        @Override
        double partial(ToDoubleFunction<double[]> func, double[] x, int i, double fx) {
            double xi = x[i];
            double h = SQRT_EPSILON * Math.max(1.0, Math.abs(xi));
            if (xi < 0) h = -h;
            // Ensure h is representable
            h = (xi + h) - xi;
            x[i] = xi + h;
            double f1 = func.applyAsDouble(x);
            x[i] = xi;
            return (f1 - fx) / h;
        }
    },
    
    /**
     * Central difference, g[i] ≈ (f(x + h*e_i) - f(x - h*e_i)) / (2*h).
     * Two probes per variable, O(h²) accuracy.
     */
    CENTRAL("central", 2) {
        @Override
        double partial(ToDoubleFunction<double[]> func, double[] x, int i, double fx) {
            double xi = x[i];
            double h = CBRT_EPSILON * Math.max(1.0, Math.abs(xi));
            x[i] = xi + h;
            double f1 = func.applyAsDouble(x);
            x[i] = xi - h;
            double f2 = func.applyAsDouble(x);
            x[i] = xi;
            return (f1 - f2) / (2.0 * h);
        }
    },
    
    /**
     * Five-point stencil, g[i] ≈ (-f(x+2h) + 8f(x+h) - 8f(x-h) + f(x-2h)) / (12h).
     * Four probes per variable, O(h⁴) accuracy.
     */
    FIVE_POINT("five-point", 4) {
        @Override
        double partial(ToDoubleFunction<double[]> func, double[] x, int i, double fx) {
            double xi = x[i];
            double h = FOURTH_ROOT_EPSILON * Math.max(1.0, Math.abs(xi));
            x[i] = xi + 2 * h;
            double f1 = func.applyAsDouble(x);
            x[i] = xi + h;
            double f2 = func.applyAsDouble(x);
            x[i] = xi - h;
            double f3 = func.applyAsDouble(x);
            x[i] = xi - 2 * h;
            double f4 = func.applyAsDouble(x);
            x[i] = xi;
            return (-f1 + 8 * f2 - 8 * f3 + f4) / (12.0 * h);
        }
    };
    
    /** Machine epsilon */
    private static final double EPSILON = Math.ulp(1.0);
    
    private static final double SQRT_EPSILON = Math.sqrt(EPSILON);
    
    private static final double CBRT_EPSILON = Math.cbrt(EPSILON);
    
    private static final double FOURTH_ROOT_EPSILON = Math.pow(EPSILON, 0.25);
    
    private final String label;
    private final int probesPerVariable;
    
    NumericalGradient(String label, int probesPerVariable) {
        this.label = label;
        this.probesPerVariable = probesPerVariable;
    }
    
    abstract double partial(ToDoubleFunction<double[]> func, double[] x, int i, double fx);
    
    /**
     * Gets the parameter label of this method.
     * @return Label such as {@code "central"}
     */
    public String getLabel() {
        return label;
    }
    
    /**
     * Gets the number of function evaluations spent per variable.
     * @return Probes per variable
     */
    public int getProbesPerVariable() {
        return probesPerVariable;
    }
    
    /**
     * Approximates the gradient of a scalar function.
     * <p>
     * {@code x} is perturbed in place during the computation and restored
     * before returning.
     * </p>
     * @param func Scalar function
     * @param x Point
     * @param fx Function value at x (used by {@link #FORWARD})
     * @param g Output gradient
     */
    public void differentiate(ToDoubleFunction<double[]> func, double[] x, double fx, double[] g) {
        for (int i = 0; i < x.length; i++) {
            g[i] = partial(func, x, i, fx);
        }
    }
    
    /**
     * Approximates the Jacobian of a vector function, one row per component.
     * @param func Vector function
     * @param x Point (restored before returning)
     * @param fx Function value at x
     * @return Jacobian {@code J[k][i] = d f_k / d x_i}
     */
    public double[][] jacobian(Function<double[], double[]> func, double[] x, double[] fx) {
        int m = fx.length;
        double[][] jac = new double[m][x.length];
        for (int k = 0; k < m; k++) {
            final int row = k;
            ToDoubleFunction<double[]> component = z -> func.apply(z)[row];
            for (int i = 0; i < x.length; i++) {
                jac[k][i] = partial(component, x, i, fx[k]);
            }
        }
        return jac;
    }
    
    /**
     * Resolves a parameter label.
     * @param label {@code forward}, {@code central} or {@code five-point}
     * @return Method
     * @throws ConfigurationException if unknown
     */
    public static NumericalGradient fromLabel(String label) {
        String key = label.trim().toLowerCase().replace('_', '-');
        for (NumericalGradient method : values()) {
            if (method.label.equals(key)) {
                return method;
            }
        }
        throw new ConfigurationException("Unknown finite-difference method: " + label);
    }
}
