/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Map;

/**
 * Resolves strategy names and their aliases.
 * <ul>
 *   <li>{@code local}, {@code local-convex}, {@code local_convex}, {@code localconvex},
 *       {@code lbfgsb}, {@code slsqp}: {@link LocalConvexStrategy}</li>
 *   <li>{@code nelder}, {@code nelder-mead}, {@code nelder_mead}, {@code neldermead}:
 *       {@link NelderMeadStrategy}</li>
 * </ul>
 * Names are trimmed and case-insensitive.
 */
public final class StrategyFactory {
    
    private StrategyFactory() {}
    
    /**
     * Creates a strategy backed by the builtin solvers.
     * @param name Strategy name or alias
     * @param params Strategy parameters (may be null)
     * @return Strategy
     * @throws ConfigurationException on an unknown name or invalid parameters
     */
    public static Strategy create(String name, Map<String, ?> params) {
        return create(name, params, SolverLibrary.builtin());
    }
    
    /**
     * Creates a strategy.
     * @param name Strategy name or alias
     * @param params Strategy parameters (may be null)
     * @param library Backend lookup
     * @return Strategy
     * @throws ConfigurationException on an unknown name or invalid parameters
     */
    public static Strategy create(String name, Map<String, ?> params, SolverLibrary library) {
        if (name == null || name.trim().isEmpty()) {
            throw new ConfigurationException("Strategy name is required");
        }
        switch (name.trim().toLowerCase()) {
            case "local":
            case "local-convex":
            case "local_convex":
            case "localconvex":
            case "lbfgsb":
            case "slsqp":
                return new LocalConvexStrategy(params, library);
            case "nelder":
            case "nelder-mead":
            case "nelder_mead":
            case "neldermead":
                return new NelderMeadStrategy(params, library);
            default:
                throw new ConfigurationException("Unknown strategy: " + name);
        }
    }
}
