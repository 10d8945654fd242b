/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered inequality ({@code g(x) <= 0}) and equality ({@code h(x) = 0})
 * constraint functions.
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * Constraints constraints = Constraints.builder()
 *     .inequality(x -> new double[]{x[0]})                  // x0 <= 0
 *     .equality(ConstraintFunction.linear(new double[]{1, 1}, 1))  // x0 + x1 = 1
 *     .build();
 * }</pre>
 */
public final class Constraints {
    
    private static final Constraints NONE = new Constraints(List.of(), List.of());
    
    private final List<ConstraintFunction> inequalities;
    private final List<ConstraintFunction> equalities;
    
    private Constraints(List<ConstraintFunction> inequalities, List<ConstraintFunction> equalities) {
        this.inequalities = inequalities;
        this.equalities = equalities;
    }
    
    /**
     * No constraints.
     * @return Empty constraint set
     */
    public static Constraints none() {
        return NONE;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public List<ConstraintFunction> getInequalities() {
        return inequalities;
    }
    
    public List<ConstraintFunction> getEqualities() {
        return equalities;
    }
    
    /**
     * Checks whether any constraint function is present.
     * @return true if empty
     */
    public boolean isEmpty() {
        return inequalities.isEmpty() && equalities.isEmpty();
    }
    
    @Override
    public String toString() {
        return "Constraints{ineq=" + inequalities.size() + ", eq=" + equalities.size() + '}';
    }
    
    /**
     * Builder for constraint sets.
     */
    public static final class Builder {
        private final List<ConstraintFunction> inequalities = new ArrayList<>();
        private final List<ConstraintFunction> equalities = new ArrayList<>();
        
        private Builder() {}
        
        /**
         * Adds inequality constraints (every component {@code <= 0}).
         * @param constraints Constraint functions
         * @return This builder
         */
        public Builder inequality(ConstraintFunction... constraints) {
            add(inequalities, constraints);
            return this;
        }
        
        /**
         * Adds equality constraints (every component {@code = 0}).
         * @param constraints Constraint functions
         * @return This builder
         */
        public Builder equality(ConstraintFunction... constraints) {
            add(equalities, constraints);
            return this;
        }
        
        /**
         * Adds the linear inequality {@code a·x <= b}.
         * @param a Coefficients
         * @param b Right-hand side
         * @return This builder
         */
        public Builder linearInequality(double[] a, double b) {
            inequalities.add(ConstraintFunction.linear(a, b));
            return this;
        }
        
        /**
         * Adds the linear equality {@code a·x = b}.
         * @param a Coefficients
         * @param b Right-hand side
         * @return This builder
         */
        public Builder linearEquality(double[] a, double b) {
            equalities.add(ConstraintFunction.linear(a, b));
            return this;
        }
        
        private static void add(List<ConstraintFunction> target, ConstraintFunction[] constraints) {
            if (constraints == null) {
                return;
            }
            for (ConstraintFunction c : constraints) {
                if (c == null) {
                    throw new ConfigurationException("Constraint function must not be null");
                }
                target.add(c);
            }
        }
        
        public Constraints build() {
            if (inequalities.isEmpty() && equalities.isEmpty()) {
                return NONE;
            }
            return new Constraints(
                Collections.unmodifiableList(new ArrayList<>(inequalities)),
                Collections.unmodifiableList(new ArrayList<>(equalities)));
        }
    }
}
