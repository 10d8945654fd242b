/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An evaluated point: coordinates, objective value and feasibility.
 * <p>
 * Immutable; coordinate arrays are copied in and out.
 * </p>
 */
public final class Candidate {
    
    /**
     * Preference order between candidates: feasible before infeasible, then
     * lower value among feasible ones or lower violation among infeasible
     * ones. NaN values and violations sort last.
     */
    public static final Comparator<Candidate> PREFERENCE = (a, b) -> {
        if (a.feasible != b.feasible) {
            return a.feasible ? -1 : 1;
        }
        return a.feasible
            ? compareNanLast(a.value, b.value)
            : compareNanLast(a.violation, b.violation);
    };
    
    private final double[] x;
    private final double value;
    private final boolean feasible;
    private final double violation;
    private final Map<String, Object> meta;
    
    /**
     * Creates a candidate.
     * @param x Coordinates
     * @param value Objective value
     * @param feasible Feasibility flag
     * @param violation Violation magnitude (non-negative)
     * @param meta Additional information (copied)
     */
    public Candidate(double[] x, double value, boolean feasible, double violation, Map<String, Object> meta) {
        if (x == null) {
            throw new IllegalArgumentException("Candidate coordinates cannot be null");
        }
        if (violation < 0) {
            throw new IllegalArgumentException("Violation must be non-negative");
        }
        this.x = x.clone();
        this.value = value;
        this.feasible = feasible;
        this.violation = violation;
        this.meta = meta == null || meta.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }
    
    /**
     * Creates a candidate without metadata.
     */
    public Candidate(double[] x, double value, boolean feasible, double violation) {
        this(x, value, feasible, violation, null);
    }
    
    /**
     * Placeholder for a point that was never evaluated.
     * @param x Coordinates
     * @param meta Metadata explaining why
     * @return Infeasible candidate with NaN value and infinite violation
     */
    public static Candidate unevaluated(double[] x, Map<String, Object> meta) {
        return new Candidate(x, Double.NaN, false, Double.POSITIVE_INFINITY, meta);
    }
    
    /**
     * Gets the coordinates.
     * @return Copy of x
     */
    public double[] getX() {
        return x.clone();
    }
    
    /**
     * Gets a single coordinate without copying.
     * @param i Index
     * @return x[i]
     */
    public double getX(int i) {
        return x[i];
    }
    
    public int getDimension() {
        return x.length;
    }
    
    public double getValue() {
        return value;
    }
    
    public boolean isFeasible() {
        return feasible;
    }
    
    public double getViolation() {
        return violation;
    }
    
    public Map<String, Object> getMeta() {
        return meta;
    }
    
    /**
     * Returns a copy with extra metadata merged over the existing entries.
     * @param extra Entries to add
     * @return New candidate
     */
    public Candidate withMeta(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(meta);
        merged.putAll(extra);
        return new Candidate(x, value, feasible, violation, merged);
    }
    
    /**
     * Checks whether this candidate is strictly preferred over another.
     * @param other Other candidate (may be null)
     * @return true if better, or if other is null
     */
    public boolean isBetterThan(Candidate other) {
        return other == null || PREFERENCE.compare(this, other) < 0;
    }
    
    /**
     * Renders the {@code {x, value, feasible, meta}} output shape.
     * @return Unmodifiable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("x", toList(x));
        out.put("value", value);
        out.put("feasible", feasible);
        out.put("meta", meta);
        return Collections.unmodifiableMap(out);
    }
    
    static List<Double> toList(double[] values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return List.of(boxed);
    }
    
    private static int compareNanLast(double a, double b) {
        boolean na = Double.isNaN(a);
        boolean nb = Double.isNaN(b);
        if (na || nb) {
            return na == nb ? 0 : (na ? 1 : -1);
        }
        return Double.compare(a, b);
    }
    
    @Override
    public String toString() {
        return "Candidate{" +
                "x=" + Arrays.toString(x) +
                ", value=" + value +
                ", feasible=" + feasible +
                ", violation=" + violation +
                '}';
    }
}
