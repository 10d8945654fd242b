/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Gradient-free simplex search.
 * <p>
 * Model gradients are ignored. Bounds are enforced by clipping simplex
 * vertices into the box; constraints are folded into the simplex merit with
 * weight {@code penalty}. Parameters: {@code initial_step} (0.05),
 * {@code zero_step} (0.00025), {@code adaptive} (false), {@code penalty} (1e3).
 * </p>
 */
public final class NelderMeadStrategy extends AbstractStrategy {
    
    public static final String NAME = "NelderMead";
    
    static final String INITIAL_STEP = "initial_step";
    static final String ZERO_STEP = "zero_step";
    static final String ADAPTIVE = "adaptive";
    static final String PENALTY = "penalty";
    
    private static final Set<String> KEYS = new LinkedHashSet<>(Arrays.asList(
        INITIAL_STEP, ZERO_STEP, ADAPTIVE, PENALTY));
    
    private final NelderMeadBackend.Settings settings;
    
    /**
     * Creates the strategy with default parameters and the builtin backends.
     */
    public NelderMeadStrategy() {
        this((Map<String, ?>) null, SolverLibrary.builtin());
    }
    
    /**
     * Creates the strategy.
     * @param params Parameters (null for defaults)
     * @param library Backend lookup
     * @throws ConfigurationException on unknown or invalid parameters
     */
    public NelderMeadStrategy(Map<String, ?> params, SolverLibrary library) {
        this(settings(StrategyParams.of(NAME, params, KEYS)), library);
    }
    
    private NelderMeadStrategy(NelderMeadBackend.Settings settings, SolverLibrary library) {
        super(NAME, library, describe(settings));
        this.settings = settings;
    }
    
    private static NelderMeadBackend.Settings settings(StrategyParams params) {
        return new NelderMeadBackend.Settings(
            params.getDouble(INITIAL_STEP, 0.05),
            params.getDouble(ZERO_STEP, 0.00025),
            params.getBoolean(ADAPTIVE, false),
            params.getDouble(PENALTY, 1e3));
    }
    
    private static Map<String, Object> describe(NelderMeadBackend.Settings settings) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(INITIAL_STEP, settings.getInitialStep());
        out.put(ZERO_STEP, settings.getZeroStep());
        out.put(ADAPTIVE, settings.isAdaptive());
        out.put(PENALTY, settings.getPenalty());
        return out;
    }
    
    @Override
    protected Search prepare(Problem problem, SolverLibrary library, Map<String, Object> meta) {
        NelderMeadBackend backend = library.backend(SolverLibrary.NELDER_MEAD, NelderMeadBackend.class);
        meta.put("backend", backend.getName());
        return (session, start, m) -> backend.minimize(session, start, settings);
    }
}
