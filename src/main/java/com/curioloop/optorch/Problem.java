/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Immutable configuration shared by every run of an invocation: what to
 * minimize, where, and when to stop.
 */
public final class Problem {
    
    private final int dimension;
    private final ObjectiveModel model;
    private final Controller controller;
    private final Bounds bounds;
    private final ConstraintEvaluator constraints;
    private final Termination termination;
    
    private Problem(int dimension, ObjectiveModel model, Controller controller, Bounds bounds,
                    ConstraintEvaluator constraints, Termination termination) {
        this.dimension = dimension;
        this.model = model;
        this.controller = controller;
        this.bounds = bounds;
        this.constraints = constraints;
        this.termination = termination;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public int getDimension() {
        return dimension;
    }
    
    /**
     * Gets the objective model.
     * @return Model, or null when the controller observation is the objective
     */
    public ObjectiveModel getModel() {
        return model;
    }
    
    /**
     * Gets the controller.
     * @return Controller, or null
     */
    public Controller getController() {
        return controller;
    }
    
    public Bounds getBounds() {
        return bounds;
    }
    
    public ConstraintEvaluator getConstraints() {
        return constraints;
    }
    
    public Termination getTermination() {
        return termination;
    }
    
    /**
     * Checks whether equality or inequality constraints are present.
     * @return true if constrained beyond bounds
     */
    public boolean isConstrained() {
        return !constraints.isEmpty();
    }
    
    /**
     * Checks whether constraint arity has been fixed.
     * @return true if {@link #probe(double[])} ran or there are no constraints
     */
    public boolean isProbed() {
        return constraints.isProbed();
    }
    
    /**
     * Probes the constraint functions at a point, fixing their arity.
     * @param x Probe point
     * @return Problem whose constraint evaluator rejects arity changes
     * @throws ConfigurationException if a constraint cannot be evaluated
     */
    public Problem probe(double[] x) {
        requireDimension(x, "Probe point");
        if (constraints.isEmpty()) {
            return this;
        }
        return new Problem(dimension, model, controller, bounds, constraints.probe(x), termination);
    }
    
    /**
     * Checks a starting point against the problem dimension.
     * @param x Point
     * @param what Description used in the error message
     * @throws ConfigurationException on mismatch or non-finite coordinates
     */
    public void requireDimension(double[] x, String what) {
        if (x == null || x.length != dimension) {
            throw new ConfigurationException(what + " must have dimension " + dimension
                + (x == null ? ", got null" : ", got " + x.length));
        }
        for (double v : x) {
            if (!Double.isFinite(v)) {
                throw new ConfigurationException(what + " must have finite coordinates");
            }
        }
    }
    
    @Override
    public String toString() {
        return "Problem{" +
                "dimension=" + dimension +
                ", bounds=" + bounds +
                ", constraints=" + constraints.getConstraints() +
                ", termination=" + termination +
                ", controller=" + (controller != null) +
                '}';
    }
    
    /**
     * Builder for problems.
     */
    public static final class Builder {
        private int dimension;
        private ObjectiveModel model;
        private Controller controller;
        private Bounds bounds = Bounds.none();
        private Constraints constraints = Constraints.none();
        private ViolationRule violationRule = ViolationRule.MAX;
        private double feasibilityTolerance = ConstraintEvaluator.DEFAULT_TOLERANCE;
        private Termination termination = Termination.defaults();
        
        private Builder() {}
        
        /**
         * Sets the problem dimension.
         * @param n Dimension (must be positive)
         * @return This builder
         */
        public Builder dimension(int n) {
            if (n <= 0) {
                throw new ConfigurationException("Dimension must be positive");
            }
            this.dimension = n;
            return this;
        }
        
        public Builder model(ObjectiveModel model) {
            this.model = model;
            return this;
        }
        
        public Builder controller(Controller controller) {
            this.controller = controller;
            return this;
        }
        
        public Builder bounds(Bounds bounds) {
            this.bounds = bounds != null ? bounds : Bounds.none();
            return this;
        }
        
        public Builder constraints(Constraints constraints) {
            this.constraints = constraints != null ? constraints : Constraints.none();
            return this;
        }
        
        public Builder violationRule(ViolationRule rule) {
            if (rule == null) {
                throw new ConfigurationException("Violation rule cannot be null");
            }
            this.violationRule = rule;
            return this;
        }
        
        public Builder feasibilityTolerance(double tolerance) {
            if (!(tolerance >= 0)) {
                throw new ConfigurationException("Feasibility tolerance must be non-negative");
            }
            this.feasibilityTolerance = tolerance;
            return this;
        }
        
        public Builder termination(Termination termination) {
            this.termination = termination != null ? termination : Termination.defaults();
            return this;
        }
        
        /**
         * Builds the problem.
         * @return Problem
         * @throws ConfigurationException if configuration is invalid
         */
        public Problem build() {
            if (dimension <= 0) {
                throw new ConfigurationException("Dimension must be set");
            }
            if (model == null && controller == null) {
                throw new ConfigurationException("An objective model or a controller is required");
            }
            bounds.requireDimension(dimension);
            return new Problem(dimension, model, controller, bounds,
                new ConstraintEvaluator(constraints, violationRule, feasibilityTolerance), termination);
        }
    }
}
