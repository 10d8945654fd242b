/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stopping criteria shared by every run of an invocation.
 * <p>
 * Budget criteria always take priority over convergence criteria; see
 * {@link TerminationEvaluator} for the exact order of checks.
 * </p>
 * <ul>
 *   <li>Budget: maxEvaluations, maxIterations, maxComputations (wall clock)</li>
 *   <li>Convergence: functionTolerance, relativeFunctionTolerance, variableTolerance, stallWindow</li>
 * </ul>
 */
public final class Termination {

    static final String MAX_EVALS = "max_evals";
    static final String MAX_ITERS = "max_iters";
    static final String FTOL_ABS = "ftol_abs";
    static final String FTOL_REL = "ftol_rel";
    static final String XTOL_ABS = "xtol_abs";
    static final String STALL_WINDOW = "stall_window";
    static final String MAX_TIME_US = "max_time_us";

    private final int maxEvaluations;
    private final int maxIterations;
    private final long maxComputations;
    private final double functionTolerance;
    private final double relativeFunctionTolerance;
    private final double variableTolerance;
    private final int stallWindow;

    private Termination(Builder builder) {
        this.maxEvaluations = builder.maxEvaluations;
        this.maxIterations = builder.maxIterations;
        this.maxComputations = builder.maxComputations;
        this.functionTolerance = builder.functionTolerance;
        this.relativeFunctionTolerance = builder.relativeFunctionTolerance;
        this.variableTolerance = builder.variableTolerance;
        this.stallWindow = builder.stallWindow;
    }

    /**
     * Creates a new builder for termination criteria.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates default termination criteria.
     * @return Default termination
     */
    public static Termination defaults() {
        return builder().build();
    }

    /**
     * Builds termination criteria from a configuration mapping.
     * <p>
     * Recognized keys: {@code max_evals}, {@code max_iters}, {@code ftol_abs},
     * {@code ftol_rel}, {@code xtol_abs}, {@code stall_window}, {@code max_time_us}.
     * Missing keys keep their defaults.
     * </p>
     * @param config Mapping of numbers (null yields defaults)
     * @return Termination criteria
     * @throws ConfigurationException on unknown keys or non-numeric values
     */
    public static Termination fromMap(Map<String, ?> config) {
        Builder builder = builder();
        if (config == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> e : config.entrySet()) {
            Object raw = e.getValue();
            if (!(raw instanceof Number)) {
                throw new ConfigurationException("Termination field '" + e.getKey() + "' must be numeric, got " + raw);
            }
            Number value = (Number) raw;
            switch (e.getKey()) {
                case MAX_EVALS:
                    builder.maxEvaluations(exactInt(e.getKey(), value));
                    break;
                case MAX_ITERS:
                    builder.maxIterations(exactInt(e.getKey(), value));
                    break;
                case FTOL_ABS:
                    builder.functionTolerance(value.doubleValue());
                    break;
                case FTOL_REL:
                    builder.relativeFunctionTolerance(value.doubleValue());
                    break;
                case XTOL_ABS:
                    builder.variableTolerance(value.doubleValue());
                    break;
                case STALL_WINDOW:
                    builder.stallWindow(exactInt(e.getKey(), value));
                    break;
                case MAX_TIME_US:
                    builder.maxComputations(value.longValue());
                    break;
                default:
                    throw new ConfigurationException("Unknown termination field: " + e.getKey());
            }
        }
        return builder.build();
    }

    private static int exactInt(String key, Number value) {
        double d = value.doubleValue();
        if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            throw new ConfigurationException("Termination field '" + key + "' must be an integer, got " + value);
        }
        return (int) d;
    }

    /**
     * Gets the maximum number of objective evaluations per run.
     * @return Maximum evaluations
     */
    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    /**
     * Gets the maximum number of solver iterations per run.
     * @return Maximum iterations (0 = unlimited)
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Gets the wall-clock budget per run in microseconds.
     * @return Budget (0 = disabled)
     */
    public long getMaxComputations() {
        return maxComputations;
    }

    /**
     * Gets the absolute function tolerance ({@code ftol_abs}).
     * @return Function tolerance
     */
    public double getFunctionTolerance() {
        return functionTolerance;
    }

    /**
     * Gets the relative function tolerance ({@code ftol_rel}).
     * @return Relative tolerance (0 = disabled)
     */
    public double getRelativeFunctionTolerance() {
        return relativeFunctionTolerance;
    }

    /**
     * Gets the absolute variable tolerance ({@code xtol_abs}).
     * @return Variable tolerance
     */
    public double getVariableTolerance() {
        return variableTolerance;
    }

    /**
     * Gets the number of consecutive evaluations that must satisfy the
     * function tolerance before the run stops.
     * @return Stall window
     */
    public int getStallWindow() {
        return stallWindow;
    }

    /**
     * Renders the criteria with their configuration keys.
     * @return Unmodifiable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(MAX_EVALS, maxEvaluations);
        out.put(FTOL_ABS, functionTolerance);
        out.put(FTOL_REL, relativeFunctionTolerance);
        out.put(XTOL_ABS, variableTolerance);
        out.put(MAX_ITERS, maxIterations);
        out.put(STALL_WINDOW, stallWindow);
        out.put(MAX_TIME_US, maxComputations);
        return Collections.unmodifiableMap(out);
    }

    /**
     * Builder for Termination criteria.
     */
    public static final class Builder {
        private int maxEvaluations = 200;
        private int maxIterations = 0;
        private long maxComputations = 0;
        private double functionTolerance = 1e-9;
        private double relativeFunctionTolerance = 0.0;
        private double variableTolerance = 1e-9;
        private int stallWindow = 2;

        private Builder() {}

        /**
         * Sets the maximum number of objective evaluations.
         * <p>Finite-difference probes count toward this budget.</p>
         * @param value Maximum evaluations (must be positive)
         * @return This builder
         */
        public Builder maxEvaluations(int value) {
            if (value <= 0) {
                throw new ConfigurationException("Max evaluations must be positive");
            }
            this.maxEvaluations = value;
            return this;
        }

        /**
         * Sets the maximum number of solver iterations.
         * @param value Maximum iterations (0 for unlimited, must be non-negative)
         * @return This builder
         */
        public Builder maxIterations(int value) {
            if (value < 0) {
                throw new ConfigurationException("Max iterations must be non-negative");
            }
            this.maxIterations = value;
            return this;
        }

        /**
         * Sets the maximum wall-clock time in microseconds.
         * <p>
         * When set to a positive value, a run stops with reason budget once
         * the elapsed time exceeds this limit. Default is 0 (disabled).
         * </p>
         * @param value Maximum wall-clock time in microseconds (0 to disable, must be non-negative)
         * @return This builder
         */
        public Builder maxComputations(long value) {
            if (value < 0) {
                throw new ConfigurationException("Max computations must be non-negative");
            }
            this.maxComputations = value;
            return this;
        }

        /**
         * Sets the absolute function tolerance.
         * @param value Tolerance (must be non-negative)
         * @return This builder
         */
        public Builder functionTolerance(double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new ConfigurationException("Function tolerance must be non-negative");
            }
            this.functionTolerance = value;
            return this;
        }

        /**
         * Sets the relative function tolerance.
         * @param value Tolerance (0 to disable, must be non-negative)
         * @return This builder
         */
        public Builder relativeFunctionTolerance(double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new ConfigurationException("Relative function tolerance must be non-negative");
            }
            this.relativeFunctionTolerance = value;
            return this;
        }

        /**
         * Sets the absolute variable tolerance.
         * @param value Tolerance (must be non-negative)
         * @return This builder
         */
        public Builder variableTolerance(double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new ConfigurationException("Variable tolerance must be non-negative");
            }
            this.variableTolerance = value;
            return this;
        }

        /**
         * Sets how many consecutive evaluations must satisfy the function
         * tolerance before stopping.
         * @param value Window (must be positive)
         * @return This builder
         */
        public Builder stallWindow(int value) {
            if (value <= 0) {
                throw new ConfigurationException("Stall window must be positive");
            }
            this.stallWindow = value;
            return this;
        }

        /**
         * Builds the termination criteria.
         * @return Termination criteria
         */
        public Termination build() {
            return new Termination(this);
        }
    }

    @Override
    public String toString() {
        return "Termination{" +
                "maxEvaluations=" + maxEvaluations +
                ", maxIterations=" + maxIterations +
                ", maxComputations=" + maxComputations +
                ", functionTolerance=" + functionTolerance +
                ", relativeFunctionTolerance=" + relativeFunctionTolerance +
                ", variableTolerance=" + variableTolerance +
                ", stallWindow=" + stallWindow +
                '}';
    }
}
