/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.List;

/**
 * Computes feasibility and violation magnitude of a point.
 * <p>
 * A point is feasible when its combined violation is at most the
 * feasibility tolerance. Without constraints every point is feasible with
 * zero violation.
 * </p>
 * <p>
 * Instances are immutable and safe to share between concurrent runs.
 * </p>
 */
public final class ConstraintEvaluator {
    
    /** Default feasibility tolerance */
    public static final double DEFAULT_TOLERANCE = 1e-8;
    
    private final Constraints constraints;
    private final ViolationRule rule;
    private final double tolerance;
    
    // Component counts fixed by probe(); null means not yet established
    private final int[] inequalityArity;
    private final int[] equalityArity;
    private final int inequalityComponents;
    private final int equalityComponents;
    
    /**
     * Creates an evaluator without a fixed component count.
     * @param constraints Constraint set
     * @param rule Violation combination rule
     * @param tolerance Feasibility tolerance (non-negative)
     */
    public ConstraintEvaluator(Constraints constraints, ViolationRule rule, double tolerance) {
        this(constraints, rule, tolerance, null, null);
    }
    
    private ConstraintEvaluator(Constraints constraints, ViolationRule rule, double tolerance,
                                int[] inequalityArity, int[] equalityArity) {
        if (constraints == null || rule == null) {
            throw new ConfigurationException("Constraints and violation rule are required");
        }
        if (!(tolerance >= 0)) {
            throw new ConfigurationException("Feasibility tolerance must be non-negative");
        }
        this.constraints = constraints;
        this.rule = rule;
        this.tolerance = tolerance;
        this.inequalityArity = inequalityArity;
        this.equalityArity = equalityArity;
        this.inequalityComponents = sum(inequalityArity);
        this.equalityComponents = sum(equalityArity);
    }
    
    /**
     * Creates an evaluator with default rule ({@link ViolationRule#MAX}) and tolerance.
     * @param constraints Constraint set
     * @return Evaluator
     */
    public static ConstraintEvaluator of(Constraints constraints) {
        return new ConstraintEvaluator(constraints, ViolationRule.MAX, DEFAULT_TOLERANCE);
    }
    
    /**
     * Evaluates every constraint once at {@code x} and fixes their component
     * counts for later calls.
     * <p>
     * Any failure here, whether a raised fault, a null or empty result or a
     * NaN component, is reported as a configuration error.
     * </p>
     * @param x Probe point
     * @return Evaluator that rejects component count changes
     * @throws ConfigurationException if a constraint cannot be evaluated
     */
    public ConstraintEvaluator probe(double[] x) {
        int[] ineq = probeAll(constraints.getInequalities(), x, "inequality");
        int[] eq = probeAll(constraints.getEqualities(), x, "equality");
        return new ConstraintEvaluator(constraints, rule, tolerance, ineq, eq);
    }
    
    private static int[] probeAll(List<ConstraintFunction> functions, double[] x, String kind) {
        int[] arity = new int[functions.size()];
        for (int i = 0; i < arity.length; i++) {
            double[] values;
            try {
                values = functions.get(i).evaluate(x.clone());
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConfigurationException(kind + " constraint " + i + " failed on probe: " + e.getMessage(), e);
            }
            if (values == null || values.length == 0) {
                throw new ConfigurationException(kind + " constraint " + i + " returned no components");
            }
            for (double v : values) {
                if (Double.isNaN(v)) {
                    throw new ConfigurationException(kind + " constraint " + i + " returned a non-numeric component");
                }
            }
            arity[i] = values.length;
        }
        return arity;
    }
    
    public Constraints getConstraints() {
        return constraints;
    }
    
    public ViolationRule getRule() {
        return rule;
    }
    
    public double getTolerance() {
        return tolerance;
    }
    
    /**
     * Checks whether component counts are fixed by a {@link #probe(double[])}.
     * @return true once probed, or when there is nothing to probe
     */
    public boolean isProbed() {
        return constraints.isEmpty() || inequalityArity != null;
    }
    
    /**
     * Checks whether any constraint function is present.
     * @return true if there is nothing to evaluate
     */
    public boolean isEmpty() {
        return constraints.isEmpty();
    }
    
    /**
     * Evaluates feasibility at a point.
     * @param x Point (read-only)
     * @return Feasibility and violation
     * @throws EvaluationException if a constraint raises or returns NaN
     * @throws ConfigurationException if a constraint changes its component count
     */
    public Feasibility evaluate(double[] x) {
        if (constraints.isEmpty()) {
            return Feasibility.SATISFIED;
        }
        double[] g = inequalityValues(x);
        double[] h = equalityValues(x);
        double violation = 0.0;
        for (double v : g) {
            violation = rule.combine(violation, Math.max(0.0, v));
        }
        for (double v : h) {
            violation = rule.combine(violation, Math.abs(v));
        }
        return new Feasibility(violation <= tolerance, violation, g, h);
    }
    
    /**
     * Evaluates the flattened inequality components.
     * @param x Point (read-only)
     * @return g(x) values in declaration order
     */
    public double[] inequalityValues(double[] x) {
        return collect(constraints.getInequalities(), inequalityArity, inequalityComponents, x, "inequality");
    }
    
    /**
     * Evaluates the flattened equality components.
     * @param x Point (read-only)
     * @return h(x) values in declaration order
     */
    public double[] equalityValues(double[] x) {
        return collect(constraints.getEqualities(), equalityArity, equalityComponents, x, "equality");
    }
    
    private static double[] collect(List<ConstraintFunction> functions, int[] arity, int total,
                                    double[] x, String kind) {
        if (functions.isEmpty()) {
            return new double[0];
        }
        double[][] parts = new double[functions.size()][];
        int count = 0;
        for (int i = 0; i < parts.length; i++) {
            double[] values;
            try {
                values = functions.get(i).evaluate(x.clone());
            } catch (OptimizationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EvaluationException(kind + " constraint " + i + " raised: " + e.getMessage(), e);
            }
            if (values == null || values.length == 0
                    || (arity != null && values.length != arity[i])) {
                throw new ConfigurationException(kind + " constraint " + i + " returned "
                    + (values == null ? "null" : values.length + " components")
                    + (arity != null ? ", expected " + arity[i] : ""));
            }
            for (double v : values) {
                if (Double.isNaN(v)) {
                    throw new EvaluationException(kind + " constraint " + i + " returned a non-numeric component");
                }
            }
            parts[i] = values;
            count += values.length;
        }
        double[] out = new double[arity != null ? total : count];
        int pos = 0;
        for (double[] part : parts) {
            System.arraycopy(part, 0, out, pos, part.length);
            pos += part.length;
        }
        return out;
    }
    
    private static int sum(int[] arity) {
        int total = 0;
        if (arity != null) {
            for (int a : arity) total += a;
        }
        return total;
    }
}
