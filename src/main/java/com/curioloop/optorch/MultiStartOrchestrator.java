/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one strategy from several seeds and picks the best outcome.
 * <p>
 * Runs share the problem and the progress channel but nothing else; each owns
 * its metrics and history scope ({@code run_index}). With a parallelism above
 * one, runs execute on a fixed pool, except when the problem drives a
 * controller, which forces sequential execution. Results are returned in
 * {@code run_index} order regardless of completion order.
 * </p>
 * <p>
 * An {@link EvaluationException} is fatal for its own run only: the run is
 * recorded as failed with its last known candidate. The batch fails only when
 * every run raised.
 * </p>
 */
public final class MultiStartOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(MultiStartOrchestrator.class);
    
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
    
    private final int parallelism;
    
    public MultiStartOrchestrator() {
        this(1);
    }
    
    /**
     * Creates an orchestrator.
     * @param parallelism Maximum concurrent runs (must be positive)
     */
    public MultiStartOrchestrator(int parallelism) {
        if (parallelism <= 0) {
            throw new ConfigurationException("Parallelism must be positive");
        }
        this.parallelism = parallelism;
    }
    
    public int getParallelism() {
        return parallelism;
    }
    
    /**
     * Runs the strategy from every seed.
     * @param strategy Strategy
     * @param problem Problem shared by all runs
     * @param seeds Starting points, one run each
     * @param channel Progress channel
     * @param cancellation Cancellation flag shared by all runs
     * @return Results ordered by run index
     * @throws ConfigurationException if a seed does not fit the problem
     * @throws EvaluationException if every run raised
     */
    public List<RunResult> runAll(Strategy strategy, Problem problem, List<double[]> seeds,
                                  ProgressChannel channel, CancellationToken cancellation) {
        if (seeds == null || seeds.isEmpty()) {
            throw new ConfigurationException("At least one seed is required");
        }
        for (int i = 0; i < seeds.size(); i++) {
            problem.requireDimension(seeds.get(i), "Seed " + i);
        }
        CancellationToken token = cancellation != null ? cancellation : new CancellationToken();
        
        List<RunResult> results;
        int workers = Math.min(parallelism, seeds.size());
        if (workers > 1 && problem.getController() == null) {
            results = runParallel(strategy, problem, seeds, channel, token, workers);
        } else {
            results = new ArrayList<>(seeds.size());
            for (int i = 0; i < seeds.size(); i++) {
                results.add(runOne(strategy, problem, seeds.get(i), i, channel, token));
            }
        }
        
        EvaluationException first = null;
        for (RunResult r : results) {
            if (!r.isRaised()) {
                return Collections.unmodifiableList(results);
            }
            if (first == null && r.getError() instanceof EvaluationException) {
                first = (EvaluationException) r.getError();
            }
        }
        throw new EvaluationException("All " + results.size() + " runs raised"
            + (first != null ? ": " + first.getMessage() : ""), first);
    }
    
    /**
     * Selects the best run: feasible before infeasible, then lowest value
     * (feasible) or lowest violation (infeasible), ties to the lowest run index.
     * Runs that raised are considered only when no other run exists.
     * @param results Results ordered by run index
     * @return Best run
     */
    public static RunResult selectBest(List<RunResult> results) {
        RunResult best = null;
        for (RunResult r : results) {
            if (best == null
                    || (best.isRaised() && !r.isRaised())
                    || (best.isRaised() == r.isRaised()
                        && Candidate.PREFERENCE.compare(r.getCandidate(), best.getCandidate()) < 0)) {
                best = r;
            }
        }
        if (best == null) {
            throw new IllegalArgumentException("No run results to select from");
        }
        return best;
    }
    
    private List<RunResult> runParallel(Strategy strategy, Problem problem, List<double[]> seeds,
                                        ProgressChannel channel, CancellationToken token, int workers) {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threads = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "optorch-" + pool + "-run-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<RunResult>> futures = new ArrayList<>(seeds.size());
            for (int i = 0; i < seeds.size(); i++) {
                final int index = i;
                Callable<RunResult> task = () -> runOne(strategy, problem, seeds.get(index), index, channel, token);
                futures.add(executor.submit(task));
            }
            List<RunResult> results = new ArrayList<>(seeds.size());
            for (Future<RunResult> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new OptimizationException("Interrupted while waiting for runs", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new OptimizationException("Run failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }
    
    private static RunResult runOne(Strategy strategy, Problem problem, double[] seed, int index,
                                    ProgressChannel channel, CancellationToken token) {
        channel.start(index, seed, problem.getBounds(), strategy.getName());
        RunListener listener = new RunListener(index, channel);
        RunResult result;
        try {
            result = strategy.run(problem, seed, index, token, listener);
        } catch (EvaluationException e) {
            log.error("[optimize] run={} raised: {}", index, e.getMessage(), e);
            result = e.getPartialResult();
            if (result == null) {
                TerminationResult failed = new TerminationResult(StopReason.FAILED,
                    Collections.emptyMap(), Collections.emptyMap(), e.getMessage());
                result = new RunResult(index, seed, Candidate.unevaluated(seed, null), failed, e);
            }
        }
        channel.end(result, listener.lastIteration);
        return result;
    }
    
    /**
     * Forwards steps of one run to the channel, flagging improvements.
     */
    private static final class RunListener implements StepListener {
        private final int runIndex;
        private final ProgressChannel channel;
        private Candidate best;
        private int lastIteration;
        
        RunListener(int runIndex, ProgressChannel channel) {
            this.runIndex = runIndex;
            this.channel = channel;
        }
        
        @Override
        public void onStep(int iteration, Candidate candidate, RunMetrics metrics) {
            boolean improved = candidate.isBetterThan(best);
            if (improved) {
                best = candidate;
            }
            lastIteration = iteration;
            channel.step(runIndex, iteration, candidate, metrics, improved);
        }
    }
}
