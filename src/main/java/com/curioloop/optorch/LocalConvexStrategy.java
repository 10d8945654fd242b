/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Gradient-based local search.
 * <p>
 * Box-bounded problems are handed to the {@code lbfgsb} backend. As soon as
 * an equality or inequality constraint is present the run switches to the
 * {@code auglag} backend, which wraps the same descent in an augmented
 * Lagrangian outer loop.
 * </p>
 * <p>
 * The {@code gradient} parameter selects where derivatives come from:
 * </p>
 * <ul>
 *   <li>{@code auto} (default): the model's analytical gradient if it has one
 *       at the starting point, central differences otherwise. The fallback is
 *       logged and recorded as {@code meta.gradient}.</li>
 *   <li>{@code analytic}: the model must be {@link GradientCapable}.</li>
 *   <li>{@code central}, {@code forward}, {@code five-point}: finite
 *       differences, whose probes count toward {@code max_evals}.</li>
 * </ul>
 */
public final class LocalConvexStrategy extends AbstractStrategy {
    
    private static final Logger log = LoggerFactory.getLogger(LocalConvexStrategy.class);
    
    public static final String NAME = "LocalConvex";
    
    static final String GRADIENT = "gradient";
    static final String GTOL = "gtol";
    static final String CORRECTIONS = "corrections";
    static final String MAX_LINE_SEARCH = "max_line_search";
    static final String PENALTY = "penalty";
    static final String MAX_OUTER = "max_outer";
    
    static final String AUTO = "auto";
    static final String ANALYTIC = "analytic";
    
    private static final Set<String> KEYS = new LinkedHashSet<>(Arrays.asList(
        GRADIENT, GTOL, CORRECTIONS, MAX_LINE_SEARCH, PENALTY, MAX_OUTER));
    
    private final String gradient;
    private final LbfgsbBackend.Settings local;
    private final AugmentedLagrangianBackend.Settings outer;
    
    /**
     * Creates the strategy with default parameters and the builtin backends.
     */
    public LocalConvexStrategy() {
        this((Map<String, ?>) null, SolverLibrary.builtin());
    }
    
    /**
     * Creates the strategy.
     * @param params Parameters (null for defaults)
     * @param library Backend lookup
     * @throws ConfigurationException on unknown or invalid parameters
     */
    public LocalConvexStrategy(Map<String, ?> params, SolverLibrary library) {
        this(StrategyParams.of(NAME, params, KEYS), library);
    }
    
    private LocalConvexStrategy(StrategyParams params, SolverLibrary library) {
        this(resolveGradient(params.getString(GRADIENT, AUTO)),
            new LbfgsbBackend.Settings(
                params.getInt(CORRECTIONS, 5),
                params.getDouble(GTOL, 1e-8),
                params.getInt(MAX_LINE_SEARCH, 20)),
            new AugmentedLagrangianBackend.Settings(
                params.getDouble(PENALTY, 10.0),
                params.getInt(MAX_OUTER, 20)),
            library);
    }
    
    private LocalConvexStrategy(String gradient, LbfgsbBackend.Settings local,
                                AugmentedLagrangianBackend.Settings outer, SolverLibrary library) {
        super(NAME, library, describe(gradient, local, outer));
        this.gradient = gradient;
        this.local = local;
        this.outer = outer;
    }
    
    private static String resolveGradient(String raw) {
        String mode = raw.trim().toLowerCase();
        if (mode.equals(AUTO) || mode.equals(ANALYTIC)) {
            return mode;
        }
        return NumericalGradient.fromLabel(mode).getLabel();
    }
    
    private static Map<String, Object> describe(String gradient, LbfgsbBackend.Settings local,
                                                AugmentedLagrangianBackend.Settings outer) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(GRADIENT, gradient);
        out.put(GTOL, local.getGradientTolerance());
        out.put(CORRECTIONS, local.getCorrections());
        out.put(MAX_LINE_SEARCH, local.getMaxLineSearch());
        out.put(PENALTY, outer.getPenalty());
        out.put(MAX_OUTER, outer.getMaxOuter());
        return out;
    }
    
    @Override
    protected Search prepare(Problem problem, SolverLibrary library, Map<String, Object> meta) {
        GradientCapable analytic = ObjectiveModel.gradientOf(problem.getModel());
        if (gradient.equals(ANALYTIC) && analytic == null) {
            throw new ConfigurationException("Gradient mode 'analytic' requires a model with a gradient");
        }
        if (problem.isConstrained()) {
            AugmentedLagrangianBackend backend = library.backend(SolverLibrary.AUGLAG, AugmentedLagrangianBackend.class);
            meta.put("mode", "constrained");
            meta.put("backend", backend.getName());
            return (session, start, m) -> backend.minimize(session, objective(session, start, m), start, local, outer);
        }
        LbfgsbBackend backend = library.backend(SolverLibrary.LBFGSB, LbfgsbBackend.class);
        meta.put("mode", "bounds");
        meta.put("backend", backend.getName());
        return (session, start, m) -> backend.minimize(session, objective(session, start, m), start, local);
    }
    
    private MeritFunction objective(SearchSession session, Trial start, Map<String, Object> meta) {
        GradientCapable analytic = ObjectiveModel.gradientOf(session.getProblem().getModel());
        NumericalGradient numerical = null;
        if (gradient.equals(AUTO)) {
            if (analytic == null) {
                log.info("[optimize] run={} model declares no gradient, using central differences",
                    session.getRunIndex());
                numerical = NumericalGradient.CENTRAL;
            } else if (analyticGradient(analytic, start.getX()) == null) {
                log.info("[optimize] run={} model gradient unavailable at x0, using central differences",
                    session.getRunIndex());
                numerical = NumericalGradient.CENTRAL;
                analytic = null;
            }
        } else if (!gradient.equals(ANALYTIC)) {
            numerical = NumericalGradient.fromLabel(gradient);
            analytic = null;
        }
        meta.put(GRADIENT, numerical != null ? numerical.getLabel() : ANALYTIC);
        return new ObjectiveMerit(session, analytic, numerical);
    }
    
    private static double[] analyticGradient(GradientCapable model, double[] x) {
        try {
            return model.gradient(x);
        } catch (OptimizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Gradient raised at " + Arrays.toString(x) + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * The raw objective with derivatives from the model or finite differences.
     */
    private static final class ObjectiveMerit implements MeritFunction {
        private final SearchSession session;
        private final GradientCapable analytic;
        private final NumericalGradient numerical;
        
        ObjectiveMerit(SearchSession session, GradientCapable analytic, NumericalGradient numerical) {
            this.session = session;
            this.analytic = analytic;
            this.numerical = numerical;
        }
        
        @Override
        public double value(Trial trial) {
            return trial.getValue();
        }
        
        @Override
        public void gradient(Trial trial, double[] g) {
            double[] x = trial.getX();
            if (numerical != null) {
                numerical.differentiate(session::probe, x, trial.getValue(), g);
            } else {
                double[] result = analyticGradient(analytic, x);
                if (result == null) {
                    throw new EvaluationException("Model gradient became unavailable at " + Arrays.toString(x));
                }
                if (result.length != g.length) {
                    throw new ConfigurationException("Model gradient has dimension " + result.length
                        + ", expected " + g.length);
                }
                System.arraycopy(result, 0, g, 0, g.length);
            }
            for (double v : g) {
                if (!Double.isFinite(v)) {
                    throw new EvaluationException("Gradient is not finite at " + Arrays.toString(trial.getX()));
                }
            }
        }
    }
}
