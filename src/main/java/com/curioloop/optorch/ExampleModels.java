/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.List;
import java.util.Map;

/**
 * Ready-made objective models, resolvable by name.
 * <ul>
 *   <li>{@code parabola}, {@code quadratic}: {@code sum (x_i - x_star)^2};
 *       parameter {@code x_star} (default 3.0)</li>
 *   <li>{@code poly_residual}, {@code poly}, {@code polynomial}:
 *       {@code sum p(x_i)^2} for a polynomial {@code p}; parameter
 *       {@code coeffs}, highest degree first (default {@code [1, 0, -2]})</li>
 * </ul>
 * Both models provide analytical gradients.
 */
public final class ExampleModels {
    
    private ExampleModels() {}
    
    /**
     * Creates a model by name.
     * @param name Model name
     * @param params Model parameters (may be null)
     * @return Model
     * @throws ConfigurationException on unknown names or parameters
     */
    public static ObjectiveModel create(String name, Map<String, ?> params) {
        if (name == null) {
            throw new ConfigurationException("Model name is required");
        }
        Map<String, ?> p = params != null ? params : Map.of();
        switch (name.trim().toLowerCase()) {
            case "parabola":
            case "quadratic":
                requireOnly(p, "x_star");
                Object xStar = p.get("x_star");
                if (xStar != null && !(xStar instanceof Number)) {
                    throw new ConfigurationException("x_star must be a number, got " + xStar);
                }
                return parabola(xStar != null ? ((Number) xStar).doubleValue() : 3.0);
            case "poly_residual":
            case "poly":
            case "polynomial":
                requireOnly(p, "coeffs");
                Object coeffs = p.get("coeffs");
                return coeffs == null ? polyResidual(1.0, 0.0, -2.0) : polyResidual(toArray(coeffs));
            default:
                throw new ConfigurationException("Unknown example model: " + name);
        }
    }
    
    /**
     * Creates {@code sum (x_i - xStar)^2}.
     * @param xStar Minimizer coordinate
     * @return Model
     */
    public static ObjectiveModel parabola(double xStar) {
        return new Parabola(xStar);
    }
    
    /**
     * Creates {@code sum p(x_i)^2}.
     * @param coeffs Polynomial coefficients, highest degree first
     * @return Model
     */
    public static ObjectiveModel polyResidual(double... coeffs) {
        if (coeffs == null || coeffs.length == 0) {
            throw new ConfigurationException("Polynomial needs at least one coefficient");
        }
        return new PolyResidual(coeffs.clone());
    }
    
    private static void requireOnly(Map<String, ?> params, String key) {
        for (String k : params.keySet()) {
            if (!k.equals(key)) {
                throw new ConfigurationException("Unknown model parameter: " + k);
            }
        }
    }
    
    private static double[] toArray(Object raw) {
        if (raw instanceof double[]) {
            return (double[]) raw;
        }
        if (raw instanceof List) {
            List<?> list = (List<?>) raw;
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                Object v = list.get(i);
                if (!(v instanceof Number)) {
                    throw new ConfigurationException("coeffs must be numbers, got " + v);
                }
                out[i] = ((Number) v).doubleValue();
            }
            return out;
        }
        throw new ConfigurationException("coeffs must be a list of numbers, got " + raw);
    }
    
    static final class Parabola implements ObjectiveModel, GradientCapable {
        private final double xStar;
        
        Parabola(double xStar) {
            this.xStar = xStar;
        }
        
        @Override
        public double objective(double[] x) {
            double f = 0.0;
            for (double v : x) {
                double e = v - xStar;
                f += e * e;
            }
            return f;
        }
        
        @Override
        public double[] gradient(double[] x) {
            double[] g = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                g[i] = 2.0 * (x[i] - xStar);
            }
            return g;
        }
    }
    
    static final class PolyResidual implements ObjectiveModel, GradientCapable {
        private final double[] coeffs;
        private final double[] derivative;
        
        PolyResidual(double[] coeffs) {
            this.coeffs = coeffs;
            int degree = coeffs.length - 1;
            this.derivative = new double[degree];
            for (int i = 0; i < degree; i++) {
                derivative[i] = coeffs[i] * (degree - i);
            }
        }
        
        @Override
        public double objective(double[] x) {
            double f = 0.0;
            for (double v : x) {
                double p = horner(coeffs, v);
                f += p * p;
            }
            return f;
        }
        
        @Override
        public double[] gradient(double[] x) {
            double[] g = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                g[i] = 2.0 * horner(coeffs, x[i]) * horner(derivative, x[i]);
            }
            return g;
        }
        
        private static double horner(double[] c, double t) {
            double v = 0.0;
            for (double ci : c) {
                v = v * t + ci;
            }
            return v;
        }
    }
}
