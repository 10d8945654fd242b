/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Outcome of a constraint check at one point.
 * <p>
 * Also keeps the raw inequality and equality components, flattened in
 * declaration order, for solvers that work with individual residuals.
 * </p>
 */
public final class Feasibility {
    
    private static final double[] EMPTY = new double[0];
    
    static final Feasibility SATISFIED = new Feasibility(true, 0.0, EMPTY, EMPTY);
    
    private final boolean feasible;
    private final double violation;
    private final double[] inequalityValues;
    private final double[] equalityValues;
    
    Feasibility(boolean feasible, double violation, double[] inequalityValues, double[] equalityValues) {
        this.feasible = feasible;
        this.violation = violation;
        this.inequalityValues = inequalityValues;
        this.equalityValues = equalityValues;
    }
    
    public boolean isFeasible() {
        return feasible;
    }
    
    /**
     * Gets the combined violation magnitude.
     * @return Violation, never negative
     */
    public double getViolation() {
        return violation;
    }
    
    /**
     * Gets the flattened inequality components.
     * @return Copy of g(x) values
     */
    public double[] getInequalityValues() {
        return inequalityValues.clone();
    }
    
    /**
     * Gets the flattened equality components.
     * @return Copy of h(x) values
     */
    public double[] getEqualityValues() {
        return equalityValues.clone();
    }
    
    double inequality(int k) {
        return inequalityValues[k];
    }
    
    double equality(int k) {
        return equalityValues[k];
    }
    
    int inequalityCount() {
        return inequalityValues.length;
    }
    
    int equalityCount() {
        return equalityValues.length;
    }
    
    @Override
    public String toString() {
        return "Feasibility{feasible=" + feasible + ", violation=" + violation + '}';
    }
}
