/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Projected limited-memory BFGS for box-bounded problems.
 * <p>
 * Solves
 * </p>
 * <pre>
 *   minimize m(x)
 *   subject to l <= x <= u
 * </pre>
 * <p>
 * where {@code m} is a {@link MeritFunction}. Each iteration takes the
 * two-loop quasi-Newton direction with components pinned at an active bound
 * zeroed, then backtracks along the projected path until the Armijo condition
 * holds. The run stops when the projected gradient falls below
 * {@link Settings#getGradientTolerance()}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The backend is stateless and may serve concurrent runs; all iteration state
 * is allocated per call.
 * </p>
 */
public final class LbfgsbBackend implements SolverBackend {
    
    private static final double ARMIJO = 1e-4;
    
    LbfgsbBackend() {}
    
    @Override
    public String getName() {
        return SolverLibrary.LBFGSB;
    }
    
    /**
     * Minimizes a merit function from an evaluated starting trial.
     * @param session Run session
     * @param merit Merit function
     * @param start Starting trial
     * @param settings Solver settings
     * @return Termination record
     */
    public TerminationResult minimize(SearchSession session, MeritFunction merit, Trial start, Settings settings) {
        Descent descent = descend(session, merit, start, settings);
        return session.finish(descent.converged ? StopReason.CONVERGED : StopReason.FAILED, descent.message);
    }
    
    Descent descend(SearchSession session, MeritFunction merit, Trial start, Settings settings) {
        int n = session.getDimension();
        Bounds bounds = session.getBounds();
        LbfgsMemory memory = LbfgsMemory.allocate(n, settings.getCorrections());
        
        Trial current = start;
        double f = merit.value(current);
        double[] g = new double[n];
        merit.gradient(current, g);
        double[] pg = new double[n];
        double[] d = new double[n];
        double[] xt = new double[n];
        boolean restarted = false;
        
        while (true) {
            session.beginIteration();
            double[] x = current.x();
            projectedGradient(bounds, x, g, pg);
            if (normInf(pg) <= settings.getGradientTolerance()) {
                return new Descent(current, true, "Projected gradient below tolerance");
            }
            
            memory.direction(g, d);
            for (int i = 0; i < n; i++) {
                if (pg[i] == 0.0) d[i] = 0.0;
            }
            if (!(LbfgsMemory.dot(g, d) < 0.0)) {
                memory.reset();
                for (int i = 0; i < n; i++) d[i] = -pg[i];
            }
            
            double alpha = memory.isEmpty() ? Math.min(1.0, 1.0 / norm2(pg)) : 1.0;
            Trial next = null;
            double fn = f;
            for (int ls = 0; ls < settings.getMaxLineSearch(); ls++) {
                double decrease = 0.0;
                boolean moved = false;
                for (int i = 0; i < n; i++) {
                    xt[i] = x[i] + alpha * d[i];
                }
                bounds.project(xt);
                for (int i = 0; i < n; i++) {
                    double step = xt[i] - x[i];
                    decrease += g[i] * step;
                    moved |= step != 0.0;
                }
                if (!moved) {
                    break;
                }
                Trial trial = session.evaluate(xt);
                double ft = merit.value(trial);
                if (ft <= f + ARMIJO * decrease) {
                    next = trial;
                    fn = ft;
                    break;
                }
                // Safeguarded quadratic interpolation along the projected path
                double curvature = 2.0 * (ft - f - decrease);
                double guess = curvature > 0.0 ? -decrease * alpha / curvature : 0.5 * alpha;
                alpha = Math.max(0.1 * alpha, Math.min(0.5 * alpha, guess));
            }
            
            if (next == null) {
                if (memory.isEmpty() || restarted) {
                    return new Descent(current, false, "Line search could not reduce the merit function");
                }
                memory.reset();
                restarted = true;
                continue;
            }
            restarted = false;
            
            double[] gn = new double[n];
            merit.gradient(next, gn);
            double[] xn = next.x();
            double[] sk = new double[n];
            double[] yk = new double[n];
            for (int i = 0; i < n; i++) {
                sk[i] = xn[i] - x[i];
                yk[i] = gn[i] - g[i];
            }
            memory.push(sk, yk);
            current = next;
            f = fn;
            g = gn;
            session.completeIteration(current);
        }
    }
    
    /**
     * Zeroes gradient components that would push an active variable out of its box.
     */
    static void projectedGradient(Bounds bounds, double[] x, double[] g, double[] pg) {
        for (int i = 0; i < x.length; i++) {
            Bound b = bounds.get(i);
            double gi = g[i];
            if ((gi > 0.0 && b.hasLower() && x[i] <= b.getLower())
                    || (gi < 0.0 && b.hasUpper() && x[i] >= b.getUpper())) {
                gi = 0.0;
            }
            pg[i] = gi;
        }
    }
    
    private static double normInf(double[] v) {
        double max = 0.0;
        for (double e : v) {
            if (Double.isNaN(e)) return Double.NaN;
            max = Math.max(max, Math.abs(e));
        }
        return max;
    }
    
    private static double norm2(double[] v) {
        return Math.sqrt(LbfgsMemory.dot(v, v));
    }
    
    /**
     * Final state of an inner descent.
     */
    static final class Descent {
        final Trial trial;
        final boolean converged;
        final String message;
        
        Descent(Trial trial, boolean converged, String message) {
            this.trial = trial;
            this.converged = converged;
            this.message = message;
        }
    }
    
    /**
     * Tunables of the descent.
     */
    public static final class Settings {
        private final int corrections;
        private final double gradientTolerance;
        private final int maxLineSearch;
        
        /**
         * Creates settings.
         * @param corrections Number of stored correction pairs (must be positive)
         * @param gradientTolerance Projected gradient tolerance (must be non-negative)
         * @param maxLineSearch Trial steps per line search (must be positive)
         */
        public Settings(int corrections, double gradientTolerance, int maxLineSearch) {
            if (corrections <= 0) {
                throw new ConfigurationException("Corrections must be positive");
            }
            if (!(gradientTolerance >= 0)) {
                throw new ConfigurationException("Gradient tolerance must be non-negative");
            }
            if (maxLineSearch <= 0) {
                throw new ConfigurationException("Max line search steps must be positive");
            }
            this.corrections = corrections;
            this.gradientTolerance = gradientTolerance;
            this.maxLineSearch = maxLineSearch;
        }
        
        public int getCorrections() {
            return corrections;
        }
        
        public double getGradientTolerance() {
            return gradientTolerance;
        }
        
        public int getMaxLineSearch() {
            return maxLineSearch;
        }
    }
}
