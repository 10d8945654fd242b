/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run skeleton shared by the built-in strategies.
 * <p>
 * A run acquires its backends, evaluates the starting point as step 0, hands
 * control to the backend and finally attaches the strategy's metadata to the
 * best candidate. Stop criteria reached inside the backend unwind back here.
 * </p>
 */
public abstract class AbstractStrategy implements Strategy {
    
    private static final Logger log = LoggerFactory.getLogger(AbstractStrategy.class);
    
    private final String name;
    private final SolverLibrary library;
    private final Map<String, Object> params;
    
    /**
     * @param name Strategy name
     * @param library Backend lookup
     * @param params Effective parameters
     */
    protected AbstractStrategy(String name, SolverLibrary library, Map<String, Object> params) {
        if (library == null) {
            throw new ConfigurationException("Solver library cannot be null");
        }
        this.name = name;
        this.library = library;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
    
    @Override
    public final String getName() {
        return name;
    }
    
    @Override
    public final Map<String, Object> getParams() {
        return params;
    }
    
    @Override
    public final RunResult run(Problem problem, double[] x0, int runIndex,
                               CancellationToken cancellation, StepListener onStep) {
        problem.requireDimension(x0, "Starting point");
        if (!problem.isProbed()) {
            problem = problem.probe(problem.getBounds().project(x0.clone()));
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        Search search;
        try {
            search = prepare(problem, library, meta);
        } catch (SolverUnavailableException e) {
            log.warn("[optimize] run={} skipped, {} backend '{}' unavailable: {}",
                runIndex, name, e.getBackend(), e.getMessage());
            meta.put(TerminationResult.SKIPPED, Boolean.TRUE);
            TerminationResult termination = new TerminationResult(StopReason.FAILED,
                Collections.singletonMap(TerminationResult.SKIPPED, Boolean.TRUE), Collections.emptyMap(),
                e.getMessage());
            return new RunResult(runIndex, x0, Candidate.unevaluated(x0, meta), termination, null);
        }
        
        SearchSession session = new SearchSession(problem, runIndex,
            cancellation != null ? cancellation : new CancellationToken(), onStep);
        TerminationResult termination;
        try {
            Trial start = session.start(x0);
            termination = search.minimize(session, start, meta);
        } catch (TerminationSignal signal) {
            termination = signal.getResult();
        } catch (EvaluationException e) {
            Trial best = session.getBest();
            Candidate last = best != null ? best.getCandidate().withMeta(meta) : Candidate.unevaluated(x0, meta);
            TerminationResult failed = new TerminationResult(StopReason.FAILED,
                session.getMetrics().toMap(), Collections.emptyMap(), e.getMessage());
            throw new EvaluationException(e.getMessage(), e, new RunResult(runIndex, x0, last, failed, e));
        }
        return new RunResult(runIndex, x0, session.getBest().getCandidate().withMeta(meta), termination, null);
    }
    
    /**
     * Acquires backends and binds them to a problem.
     * @param problem Problem of the upcoming run
     * @param library Backend lookup
     * @param meta Metadata attached to the run's best candidate; may be filled
     * @return Search procedure for one run
     * @throws SolverUnavailableException if a backend is missing
     */
    protected abstract Search prepare(Problem problem, SolverLibrary library, Map<String, Object> meta);
    
    /**
     * The backend-driving part of a run.
     */
    @FunctionalInterface
    protected interface Search {
        
        /**
         * Minimizes from the evaluated starting point.
         * @param session Run session
         * @param start Starting trial
         * @param meta Metadata attached to the run's best candidate
         * @return Termination record of a stop the backend reached by itself
         */
        TerminationResult minimize(SearchSession session, Trial start, Map<String, Object> meta);
    }
    
    @Override
    public String toString() {
        return name + params;
    }
}
