/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Closed interval {@code [lower, upper]} for a single optimization variable.
 * <p>
 * An infinite end means the variable is unbounded on that side.
 * </p>
 */
public final class Bound {
    
    private static final Bound UNBOUNDED = new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    
    private final double lower;
    private final double upper;
    
    private Bound(double lower, double upper) {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new ConfigurationException("Bound ends must not be NaN");
        }
        if (lower > upper) {
            throw new ConfigurationException("Lower bound " + lower + " exceeds upper bound " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }
    
    /**
     * Creates an unbounded variable.
     * @return Unbounded bound
     */
    public static Bound unbounded() {
        return UNBOUNDED;
    }
    
    /**
     * Creates a bound with both limits.
     * @param lower Lower limit (may be negative infinity)
     * @param upper Upper limit (may be positive infinity)
     * @return Bound
     * @throws ConfigurationException if lower exceeds upper or either end is NaN
     */
    public static Bound between(double lower, double upper) {
        return new Bound(lower, upper);
    }
    
    /**
     * Creates a bound with only a lower limit (x >= value).
     * @param value Minimum value
     * @return Bound
     */
    public static Bound atLeast(double value) {
        return new Bound(value, Double.POSITIVE_INFINITY);
    }
    
    /**
     * Creates a bound with only an upper limit (x <= value).
     * @param value Maximum value
     * @return Bound
     */
    public static Bound atMost(double value) {
        return new Bound(Double.NEGATIVE_INFINITY, value);
    }
    
    /**
     * Creates a fixed bound.
     * @param value Exact value
     * @return Bound
     */
    public static Bound exactly(double value) {
        return new Bound(value, value);
    }
    
    public double getLower() {
        return lower;
    }
    
    public double getUpper() {
        return upper;
    }
    
    public boolean hasLower() {
        return lower != Double.NEGATIVE_INFINITY;
    }
    
    public boolean hasUpper() {
        return upper != Double.POSITIVE_INFINITY;
    }
    
    public boolean isFixed() {
        return lower == upper;
    }
    
    public boolean isUnbounded() {
        return !hasLower() && !hasUpper();
    }
    
    /**
     * Checks whether a value lies inside the interval.
     * @param value Value to test
     * @return true if {@code lower <= value <= upper}
     */
    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
    
    /**
     * Clips a value into the interval.
     * @param value Value to clip
     * @return Nearest value inside the interval
     */
    public double clip(double value) {
        if (value < lower) return lower;
        if (value > upper) return upper;
        return value;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bound)) return false;
        Bound other = (Bound) o;
        return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
    }
    
    @Override
    public int hashCode() {
        return 31 * Double.hashCode(lower) + Double.hashCode(upper);
    }
    
    @Override
    public String toString() {
        if (isUnbounded()) return "(-∞, +∞)";
        if (isFixed()) return "[" + lower + "]";
        String l = hasLower() ? String.valueOf(lower) : "-∞";
        String u = hasUpper() ? String.valueOf(upper) : "+∞";
        return "[" + l + ", " + u + "]";
    }
}
