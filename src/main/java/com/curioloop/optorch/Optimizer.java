/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Entry point: runs a request end to end and writes the results.
 * <ol>
 *   <li>probe the constraints at the first seed, fixing their arity</li>
 *   <li>run every seed through the {@link MultiStartOrchestrator}</li>
 *   <li>select the best run and write all outputs through the {@link ResultAggregator}</li>
 * </ol>
 */
public final class Optimizer {
    
    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);
    
    private Optimizer() {}
    
    /**
     * Runs a request, writing to a fresh in-memory store.
     * @param request Request
     * @return Report
     */
    public static OptimizationReport optimize(OptimizationRequest request) {
        return optimize(request, new MapOutputStore());
    }
    
    /**
     * Runs a request.
     * @param request Request
     * @param store Output store receiving the {@code optimizer.*} keys
     * @return Report
     * @throws ConfigurationException on configuration errors found before evaluation
     * @throws EvaluationException if every run raised
     */
    public static OptimizationReport optimize(OptimizationRequest request, OutputStore store) {
        Strategy strategy = request.getStrategy();
        List<double[]> seeds = request.getSeeds();
        if (log.isDebugEnabled()) {
            log.debug("[optimize] start strategy={} x0={} seeds={}", strategy.getName(),
                Arrays.toString(seeds.get(0)), seeds.size());
        }
        Problem problem = request.getProblem().probe(seeds.get(0));
        
        List<RunResult> runs;
        ProgressChannel channel = new ProgressChannel(request.getClock());
        try {
            for (OptimizationRequest.Registration r : request.getObservers()) {
                channel.register(r.observer, r.throttleSeconds, r.updateEvery);
            }
            runs = new MultiStartOrchestrator(request.getParallelism())
                .runAll(strategy, problem, seeds, channel, request.getCancellation());
        } finally {
            channel.close();
        }
        
        RunResult best = MultiStartOrchestrator.selectBest(runs);
        OptimizationReport report = new OptimizationReport(strategy.getName(), request.describe(),
            channel.history(), channel.journal(), runs, best);
        ResultAggregator.write(store, report);
        if (log.isDebugEnabled()) {
            log.debug("[optimize] done reason={} best_x={} best_f={}", best.getTermination().getReason(),
                Arrays.toString(best.getCandidate().getX()), best.getCandidate().getValue());
        }
        return report;
    }
}
