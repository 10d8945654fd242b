/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * How individual constraint residuals combine into one violation magnitude.
 * <p>
 * Residuals are {@code max(0, g_k)} for inequality components and
 * {@code |h_k|} for equality components.
 * </p>
 */
public enum ViolationRule {
    
    /** Largest residual */
    MAX {
        @Override
        double combine(double acc, double residual) {
            return Math.max(acc, residual);
        }
    },
    
    /** Sum of residuals */
    SUM {
        @Override
        double combine(double acc, double residual) {
            return acc + residual;
        }
    };
    
    abstract double combine(double acc, double residual);
}
