/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Lookup of solver backends by name.
 * <p>
 * Strategies obtain their engines here at the start of every run, so a
 * missing backend surfaces as a skipped run instead of a failed invocation.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * // Everything available
 * SolverLibrary library = SolverLibrary.builtin();
 *
 * // Simulate a deployment without the simplex engine
 * SolverLibrary restricted = SolverLibrary.without(SolverLibrary.NELDER_MEAD);
 * }</pre>
 */
@FunctionalInterface
public interface SolverLibrary {
    
    /** Projected limited-memory BFGS for box-bounded problems */
    String LBFGSB = "lbfgsb";
    
    /** Augmented Lagrangian driver for constrained problems */
    String AUGLAG = "auglag";
    
    /** Nelder-Mead simplex */
    String NELDER_MEAD = "nelder-mead";
    
    /**
     * Looks up a backend.
     * @param name Backend name
     * @return Backend
     * @throws SolverUnavailableException if the backend cannot be provided
     */
    SolverBackend backend(String name);
    
    /**
     * Looks up a backend of a given type.
     * @param name Backend name
     * @param type Expected backend type
     * @param <T> Backend type
     * @return Backend
     * @throws SolverUnavailableException if missing or of another type
     */
    default <T extends SolverBackend> T backend(String name, Class<T> type) {
        SolverBackend backend = backend(name);
        if (!type.isInstance(backend)) {
            throw new SolverUnavailableException(name, "Backend '" + name + "' is not a " + type.getSimpleName());
        }
        return type.cast(backend);
    }
    
    /**
     * Gets the library of pure-Java backends.
     * @return Shared library instance
     */
    static SolverLibrary builtin() {
        return BuiltinSolverLibrary.INSTANCE;
    }
    
    /**
     * Gets the builtin library with some backends withdrawn.
     * @param names Backend names to report as unavailable
     * @return Restricted library
     */
    static SolverLibrary without(String... names) {
        Set<String> missing = new HashSet<>(Arrays.asList(names));
        SolverLibrary delegate = builtin();
        return name -> {
            if (missing.contains(name)) {
                throw new SolverUnavailableException(name, "Solver backend '" + name + "' is not installed");
            }
            return delegate.backend(name);
        };
    }
}
