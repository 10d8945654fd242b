/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered box bounds, one {@link Bound} per variable, or absent.
 */
public final class Bounds {
    
    private static final Bounds NONE = new Bounds(null);
    
    private final Bound[] bounds;
    
    private Bounds(Bound[] bounds) {
        this.bounds = bounds;
    }
    
    /**
     * Absent bounds: every variable is unbounded whatever the dimension.
     * @return Absent bounds
     */
    public static Bounds none() {
        return NONE;
    }
    
    /**
     * Creates bounds from individual intervals.
     * @param bounds One bound per variable
     * @return Bounds
     * @throws ConfigurationException if empty or containing null
     */
    public static Bounds of(Bound... bounds) {
        if (bounds == null || bounds.length == 0) {
            throw new ConfigurationException("Bounds must contain at least one interval");
        }
        for (int i = 0; i < bounds.length; i++) {
            if (bounds[i] == null) {
                throw new ConfigurationException("Bound " + i + " is null");
            }
        }
        return new Bounds(bounds.clone());
    }
    
    /**
     * Creates bounds from {@code (low, high)} pairs.
     * @param pairs Array of two-element arrays
     * @return Bounds
     * @throws ConfigurationException if a pair is malformed
     */
    public static Bounds of(double[][] pairs) {
        if (pairs == null) {
            return NONE;
        }
        Bound[] result = new Bound[pairs.length];
        for (int i = 0; i < pairs.length; i++) {
            if (pairs[i] == null || pairs[i].length != 2) {
                throw new ConfigurationException("Bound " + i + " must be a (low, high) pair");
            }
            result[i] = Bound.between(pairs[i][0], pairs[i][1]);
        }
        return of(result);
    }
    
    /**
     * Applies the same interval to every variable.
     * @param dimension Number of variables
     * @param bound Interval
     * @return Bounds
     */
    public static Bounds uniform(int dimension, Bound bound) {
        if (dimension <= 0) {
            throw new ConfigurationException("Dimension must be positive");
        }
        Bound[] result = new Bound[dimension];
        Arrays.fill(result, bound);
        return of(result);
    }
    
    /**
     * Checks whether bounds were supplied.
     * @return true unless absent
     */
    public boolean isPresent() {
        return bounds != null;
    }
    
    /**
     * Gets the number of intervals.
     * @return Dimension, or 0 when absent
     */
    public int getDimension() {
        return bounds == null ? 0 : bounds.length;
    }
    
    /**
     * Gets the interval of variable {@code i}.
     * @param i Variable index
     * @return Interval, unbounded when bounds are absent
     */
    public Bound get(int i) {
        return bounds == null ? Bound.unbounded() : bounds[i];
    }
    
    /**
     * Checks that the bounds fit a problem of the given dimension.
     * @param dimension Problem dimension
     * @throws ConfigurationException on mismatch
     */
    public void requireDimension(int dimension) {
        if (bounds != null && bounds.length != dimension) {
            throw new ConfigurationException(
                "Bounds have " + bounds.length + " entries but the problem has dimension " + dimension);
        }
    }
    
    /**
     * Checks whether a point lies inside the box.
     * @param x Point
     * @return true if every coordinate is inside its interval
     */
    public boolean contains(double[] x) {
        for (int i = 0; i < x.length; i++) {
            if (!get(i).contains(x[i])) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Projects a point onto the box in place.
     * @param x Point, modified in place
     * @return The same array
     */
    public double[] project(double[] x) {
        if (bounds != null) {
            for (int i = 0; i < x.length; i++) {
                x[i] = bounds[i].clip(x[i]);
            }
        }
        return x;
    }
    
    /**
     * Renders the bounds as {@code [[low, high], ...]} for the output store.
     * @return Nested lists, or null when absent
     */
    public List<List<Double>> toList() {
        if (bounds == null) {
            return null;
        }
        List<List<Double>> out = new ArrayList<>(bounds.length);
        for (Bound b : bounds) {
            out.add(List.of(b.getLower(), b.getUpper()));
        }
        return Collections.unmodifiableList(out);
    }
    
    @Override
    public String toString() {
        return bounds == null ? "none" : Arrays.toString(bounds);
    }
}
