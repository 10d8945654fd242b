/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Running metrics accumulator that decides when a run must stop.
 * <p>
 * Owned by exactly one run and mutated once per evaluation; not thread-safe.
 * Checks are made in priority order and the first satisfied reason wins:
 * </p>
 * <ol>
 *   <li>budget: evaluation count, iteration count, wall clock</li>
 *   <li>convergence: {@code ftol} after {@code stallWindow} consecutive small
 *       changes against the best candidate, or {@code xtol} once a new best
 *       point moves less than the tolerance</li>
 *   <li>cancellation, only at iteration boundaries</li>
 * </ol>
 * <p>
 * Convergence verdicts are latched when first observed, so a later check
 * reports the same reason unless the budget ran out meanwhile.
 * </p>
 */
public final class TerminationEvaluator {

    private final Termination criteria;
    private final CancellationToken cancellation;
    private final LongSupplier nanoClock;
    private final long startNanos;

    private int evaluations;
    private int probes;
    private int iterations;
    private Candidate best;
    private double lastDelta = Double.NaN;
    private double lastStep = Double.NaN;
    private int stallCount;
    private StopReason converged;

    /**
     * Creates an evaluator using {@link System#nanoTime()}.
     * @param criteria Termination criteria
     * @param cancellation Shared cancellation flag
     */
    public TerminationEvaluator(Termination criteria, CancellationToken cancellation) {
        this(criteria, cancellation, System::nanoTime);
    }

    /**
     * Creates an evaluator with an explicit clock.
     * @param criteria Termination criteria
     * @param cancellation Shared cancellation flag
     * @param nanoClock Monotonic nanosecond clock
     */
    public TerminationEvaluator(Termination criteria, CancellationToken cancellation, LongSupplier nanoClock) {
        if (criteria == null || cancellation == null || nanoClock == null) {
            throw new IllegalArgumentException("Termination, cancellation token and clock are required");
        }
        this.criteria = criteria;
        this.cancellation = cancellation;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
    }

    /**
     * Records an evaluation of an unconstrained point.
     * @param x Evaluated point
     * @param value Objective value
     * @return Stop verdict, if any
     */
    public Optional<TerminationResult> recordEvaluation(double[] x, double value) {
        return recordEvaluation(new Candidate(x, value, true, 0.0));
    }

    /**
     * Records a candidate evaluation and checks budget and convergence.
     * <p>
     * The convergence reference is the best candidate under
     * {@link Candidate#PREFERENCE}. Feasible candidates are compared by value
     * and infeasible ones by violation; a candidate on the other side of the
     * feasibility line from the reference resets the stall count and never
     * moves the reference backwards.
     * </p>
     * @param candidate Evaluated candidate
     * @return Stop verdict, if any
     */
    public Optional<TerminationResult> recordEvaluation(Candidate candidate) {
        evaluations++;
        if (best != null) {
            if (candidate.isFeasible() == best.isFeasible()) {
                double current = score(candidate);
                double reference = score(best);
                double delta = Math.abs(current - reference);
                lastDelta = delta;
                double scale = Math.max(Math.abs(current), Math.abs(reference));
                boolean small = delta < criteria.getFunctionTolerance()
                    || delta < criteria.getRelativeFunctionTolerance() * scale;
                stallCount = small ? stallCount + 1 : 0;
                if (stallCount >= criteria.getStallWindow()) {
                    latch(StopReason.FTOL);
                }
            } else {
                stallCount = 0;
            }
        }
        if (candidate.isBetterThan(best)) {
            if (best != null && best.isFeasible() == candidate.isFeasible()) {
                lastStep = distance(candidate, best);
                if (lastStep < criteria.getVariableTolerance()) {
                    latch(StopReason.XTOL);
                }
            }
            best = candidate;
        }
        return shouldStop(false);
    }

    /**
     * Records an objective evaluation spent on a finite-difference probe.
     * <p>Probes consume budget but take no part in convergence tests.</p>
     * @return Stop verdict, if any
     */
    public Optional<TerminationResult> recordProbe() {
        evaluations++;
        probes++;
        return shouldStop(false);
    }

    /**
     * Records a completed solver iteration.
     * @return Stop verdict, if any
     */
    public Optional<TerminationResult> recordIteration() {
        iterations++;
        return shouldStop(false);
    }

    /**
     * Check made at the top of every iteration; the only place cancellation
     * is observed.
     * @return Stop verdict, if any
     */
    public Optional<TerminationResult> checkIterationStart() {
        return shouldStop(true);
    }

    /**
     * Evaluates every criterion in priority order.
     * @param iterationBoundary Whether cancellation may be observed
     * @return Stop verdict, if any
     */
    public Optional<TerminationResult> shouldStop(boolean iterationBoundary) {
        if (budgetExhausted()) {
            return Optional.of(result(StopReason.BUDGET, null));
        }
        if (converged != null) {
            return Optional.of(result(converged, null));
        }
        if (iterationBoundary && cancellation.isCancelled()) {
            return Optional.of(result(StopReason.CANCELLED, null));
        }
        return Optional.empty();
    }

    /**
     * Builds the record for a stop the solver itself reported.
     * <p>
     * Budget and latched convergence verdicts still take priority over the
     * solver's own reason.
     * </p>
     * @param reason Solver reason ({@link StopReason#CONVERGED} or {@link StopReason#FAILED})
     * @param message Detail (may be null)
     * @return Termination record
     */
    public TerminationResult solverReported(StopReason reason, String message) {
        return shouldStop(false).orElseGet(() -> result(reason, message));
    }

    /**
     * Builds a record for the given reason with the current metrics.
     * @param reason Stop reason
     * @param message Detail (may be null)
     * @return Termination record
     */
    public TerminationResult result(StopReason reason, String message) {
        return new TerminationResult(reason, snapshot().toMap(), budget(), message);
    }

    /**
     * Takes a snapshot of the running counters.
     * @return Metrics
     */
    public RunMetrics snapshot() {
        double bestValue = best != null ? best.getValue() : Double.NaN;
        return new RunMetrics(evaluations, probes, iterations, bestValue, lastDelta, lastStep,
            nanoClock.getAsLong() - startNanos);
    }

    public int getEvaluations() {
        return evaluations;
    }

    public int getIterations() {
        return iterations;
    }

    private Map<String, Integer> budget() {
        Map<String, Integer> out = new LinkedHashMap<>();
        out.put("evaluations", evaluations);
        out.put(Termination.MAX_EVALS, criteria.getMaxEvaluations());
        out.put("iterations", iterations);
        out.put(Termination.MAX_ITERS, criteria.getMaxIterations());
        return out;
    }

    private boolean budgetExhausted() {
        if (evaluations >= criteria.getMaxEvaluations()) {
            return true;
        }
        if (criteria.getMaxIterations() > 0 && iterations >= criteria.getMaxIterations()) {
            return true;
        }
        long limit = criteria.getMaxComputations();
        return limit > 0 && (nanoClock.getAsLong() - startNanos) / 1000L >= limit;
    }

    private void latch(StopReason reason) {
        if (converged == null) {
            converged = reason;
        }
    }

    // value when feasible, violation otherwise
    private static double score(Candidate c) {
        return c.isFeasible() ? c.getValue() : c.getViolation();
    }

    private static double distance(Candidate a, Candidate b) {
        double sum = 0.0;
        for (int i = 0; i < a.getDimension(); i++) {
            double d = a.getX(i) - b.getX(i);
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
