/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Nelder-Mead downhill simplex.
 * <p>
 * Bounds are enforced by clipping every vertex into the box. Constraints, if
 * any, enter the simplex merit as {@code f(x) + penalty * violation}; the
 * candidates themselves keep their raw value and feasibility.
 * </p>
 * <p>
 * The simplex has converged once both the spread of merits across vertices is
 * at most {@code ftol_abs} and every vertex lies within {@code xtol_abs} of
 * the best one (maximum norm).
 * </p>
 */
public final class NelderMeadBackend implements SolverBackend {
    
    private static final double REFLECT = 1.0;
    
    NelderMeadBackend() {}
    
    @Override
    public String getName() {
        return SolverLibrary.NELDER_MEAD;
    }
    
    /**
     * Minimizes from an evaluated starting trial.
     * @param session Run session
     * @param start Starting trial, the first vertex
     * @param settings Simplex settings
     * @return Termination record
     */
    public TerminationResult minimize(SearchSession session, Trial start, Settings settings) {
        int n = session.getDimension();
        Bounds bounds = session.getBounds();
        Termination termination = session.getProblem().getTermination();
        boolean penalized = session.getProblem().isConstrained();
        
        double expand = 2.0;
        double contract = 0.5;
        double shrink = 0.5;
        if (settings.isAdaptive()) {
            expand = 1.0 + 2.0 / n;
            contract = 0.75 - 1.0 / (2.0 * n);
            shrink = 1.0 - 1.0 / n;
        }
        
        Vertex[] simplex = new Vertex[n + 1];
        simplex[0] = new Vertex(start, merit(start, penalized, settings));
        double[] x0 = start.x();
        for (int k = 0; k < n; k++) {
            double[] y = x0.clone();
            double step = y[k] != 0.0 ? settings.getInitialStep() * y[k] : settings.getZeroStep();
            y[k] += step;
            bounds.project(y);
            if (y[k] == x0[k]) {
                y[k] = x0[k] - step;
                bounds.project(y);
            }
            simplex[k + 1] = vertex(session, y, penalized, settings);
        }
        Arrays.sort(simplex, Vertex.ORDER);
        
        double[] centroid = new double[n];
        double[] point = new double[n];
        while (true) {
            session.beginIteration();
            if (valueSpread(simplex) <= termination.getFunctionTolerance()
                    && pointSpread(simplex) <= termination.getVariableTolerance()) {
                return session.finish(StopReason.CONVERGED, "Simplex collapsed below tolerances");
            }
            
            Arrays.fill(centroid, 0.0);
            for (int j = 0; j < n; j++) {
                double[] v = simplex[j].trial.x();
                for (int i = 0; i < n; i++) {
                    centroid[i] += v[i] / n;
                }
            }
            double[] worst = simplex[n].trial.x();
            
            move(centroid, worst, REFLECT, point, bounds);
            Vertex reflected = vertex(session, point, penalized, settings);
            boolean doShrink = false;
            if (reflected.merit < simplex[0].merit) {
                move(centroid, worst, REFLECT * expand, point, bounds);
                Vertex expanded = vertex(session, point, penalized, settings);
                simplex[n] = expanded.merit < reflected.merit ? expanded : reflected;
            } else if (reflected.merit < simplex[n - 1].merit) {
                simplex[n] = reflected;
            } else if (reflected.merit < simplex[n].merit) {
                move(centroid, worst, contract * REFLECT, point, bounds);
                Vertex outside = vertex(session, point, penalized, settings);
                if (outside.merit <= reflected.merit) {
                    simplex[n] = outside;
                } else {
                    doShrink = true;
                }
            } else {
                move(centroid, worst, -contract, point, bounds);
                Vertex inside = vertex(session, point, penalized, settings);
                if (inside.merit < simplex[n].merit) {
                    simplex[n] = inside;
                } else {
                    doShrink = true;
                }
            }
            
            if (doShrink) {
                double[] best = simplex[0].trial.x();
                for (int j = 1; j <= n; j++) {
                    double[] v = simplex[j].trial.x();
                    for (int i = 0; i < n; i++) {
                        point[i] = best[i] + shrink * (v[i] - best[i]);
                    }
                    bounds.project(point);
                    simplex[j] = vertex(session, point, penalized, settings);
                }
            }
            Arrays.sort(simplex, Vertex.ORDER);
            session.completeIteration(simplex[0].trial);
        }
    }
    
    // point = c + coefficient * (c - worst), clipped into the box
    private static void move(double[] c, double[] worst, double coefficient, double[] point, Bounds bounds) {
        for (int i = 0; i < c.length; i++) {
            point[i] = c[i] + coefficient * (c[i] - worst[i]);
        }
        bounds.project(point);
    }
    
    private static Vertex vertex(SearchSession session, double[] x, boolean penalized, Settings settings) {
        Trial trial = session.evaluate(x);
        return new Vertex(trial, merit(trial, penalized, settings));
    }
    
    private static double merit(Trial trial, boolean penalized, Settings settings) {
        double value = trial.getValue();
        if (penalized) {
            double violation = trial.getCandidate().getViolation();
            if (violation > 0.0) {
                value += settings.getPenalty() * violation;
            }
        }
        return value;
    }
    
    private static double valueSpread(Vertex[] simplex) {
        double spread = 0.0;
        for (int j = 1; j < simplex.length; j++) {
            spread = Math.max(spread, Math.abs(simplex[j].merit - simplex[0].merit));
        }
        return spread;
    }
    
    private static double pointSpread(Vertex[] simplex) {
        double[] best = simplex[0].trial.x();
        double spread = 0.0;
        for (int j = 1; j < simplex.length; j++) {
            double[] v = simplex[j].trial.x();
            for (int i = 0; i < best.length; i++) {
                spread = Math.max(spread, Math.abs(v[i] - best[i]));
            }
        }
        return spread;
    }
    
    private static final class Vertex {
        static final Comparator<Vertex> ORDER = Comparator.comparingDouble(v -> v.merit);
        
        final Trial trial;
        final double merit;
        
        Vertex(Trial trial, double merit) {
            this.trial = trial;
            this.merit = merit;
        }
    }
    
    /**
     * Simplex tunables.
     */
    public static final class Settings {
        private final double initialStep;
        private final double zeroStep;
        private final boolean adaptive;
        private final double penalty;
        
        /**
         * Creates settings.
         * @param initialStep Relative size of the initial simplex (must be positive)
         * @param zeroStep Absolute size along coordinates that are zero (must be positive)
         * @param adaptive Whether to scale coefficients with the dimension
         * @param penalty Weight of constraint violation in the merit (must be non-negative)
         */
        public Settings(double initialStep, double zeroStep, boolean adaptive, double penalty) {
            if (!(initialStep > 0) || Double.isInfinite(initialStep)) {
                throw new ConfigurationException("Initial step must be positive");
            }
            if (!(zeroStep > 0) || Double.isInfinite(zeroStep)) {
                throw new ConfigurationException("Zero step must be positive");
            }
            if (!(penalty >= 0) || Double.isInfinite(penalty)) {
                throw new ConfigurationException("Penalty must be non-negative and finite");
            }
            this.initialStep = initialStep;
            this.zeroStep = zeroStep;
            this.adaptive = adaptive;
            this.penalty = penalty;
        }
        
        public double getInitialStep() {
            return initialStep;
        }
        
        public double getZeroStep() {
            return zeroStep;
        }
        
        public boolean isAdaptive() {
            return adaptive;
        }
        
        public double getPenalty() {
            return penalty;
        }
    }
}
