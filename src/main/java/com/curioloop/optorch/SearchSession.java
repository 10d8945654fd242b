/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * State of a single run as seen by a solver backend.
 * <p>
 * Every point a solver looks at goes through {@link #evaluate(double[])} or
 * {@link #probe(double[])}, which keeps the budget, the best-so-far point and
 * the step stream consistent whatever algorithm is driving. When a stop
 * criterion fires the session unwinds the solver with an unchecked signal
 * that the owning strategy catches.
 * </p>
 */
public final class SearchSession {
    
    private static final Logger log = LoggerFactory.getLogger(SearchSession.class);
    
    /** Metadata flag set on candidates the controller refused */
    public static final String UNSAFE = "unsafe";
    
    private final Problem problem;
    private final int runIndex;
    private final StepListener listener;
    private final TerminationEvaluator termination;
    
    private Trial best;
    private Optional<TerminationResult> pending = Optional.empty();
    
    SearchSession(Problem problem, int runIndex, CancellationToken cancellation, StepListener listener) {
        this.problem = problem;
        this.runIndex = runIndex;
        this.listener = listener != null ? listener : StepListener.NONE;
        this.termination = new TerminationEvaluator(problem.getTermination(), cancellation);
    }
    
    public Problem getProblem() {
        return problem;
    }
    
    public int getDimension() {
        return problem.getDimension();
    }
    
    public Bounds getBounds() {
        return problem.getBounds();
    }
    
    public int getRunIndex() {
        return runIndex;
    }
    
    /**
     * Gets the best trial evaluated so far.
     * @return Best trial, or null before the first evaluation
     */
    public Trial getBest() {
        return best;
    }
    
    /**
     * Gets the running counters.
     * @return Metrics snapshot
     */
    public RunMetrics getMetrics() {
        return termination.snapshot();
    }
    
    /**
     * Resets the controller, evaluates the projected starting point and emits
     * it as iteration 0.
     * @param x0 Starting point
     * @return Starting trial
     */
    Trial start(double[] x0) {
        Controller controller = problem.getController();
        if (controller != null) {
            try {
                controller.reset();
            } catch (OptimizationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EvaluationException("Controller reset failed: " + e.getMessage(), e);
            }
        }
        Trial initial = assess(problem.getBounds().project(x0.clone()));
        emit(0, initial);
        throwIfStopped();
        return initial;
    }
    
    /**
     * Evaluates a candidate point.
     * <p>The point counts toward the evaluation budget and the convergence tests.</p>
     * @param x Point (copied)
     * @return Trial at x
     * @throws EvaluationException if the objective or a constraint fails
     */
    public Trial evaluate(double[] x) {
        Trial trial = assess(x.clone());
        throwIfStopped();
        return trial;
    }
    
    /**
     * Evaluates the raw objective for a finite-difference probe.
     * <p>The probe consumes budget but never becomes a candidate.</p>
     * @param x Point (copied)
     * @return Objective value
     */
    public double probe(double[] x) {
        double[] point = x.clone();
        double value = objective(point, isSafe(point));
        pending = termination.recordProbe();
        throwIfStopped();
        return value;
    }
    
    /**
     * Marks the top of a solver iteration; the only point where cancellation
     * is observed.
     */
    public void beginIteration() {
        pending = termination.checkIterationStart();
        throwIfStopped();
    }
    
    /**
     * Marks a completed solver iteration and emits its step.
     * @param accepted Point the solver moved to
     */
    public void completeIteration(Trial accepted) {
        pending = termination.recordIteration();
        emit(termination.getIterations(), accepted);
        throwIfStopped();
    }
    
    /**
     * Builds the termination record for a stop the solver reached by itself.
     * @param reason {@link StopReason#CONVERGED} or {@link StopReason#FAILED}
     * @param message Detail (may be null)
     * @return Termination record
     */
    public TerminationResult finish(StopReason reason, String message) {
        return termination.solverReported(reason, message);
    }
    
    private Trial assess(double[] point) {
        boolean safe = isSafe(point);
        double value = objective(point, safe);
        Feasibility feasibility = problem.getConstraints().evaluate(point);
        Map<String, Object> meta = safe ? Collections.emptyMap() : Collections.singletonMap(UNSAFE, Boolean.TRUE);
        Candidate candidate = new Candidate(point, value,
            safe && feasibility.isFeasible(),
            safe ? feasibility.getViolation() : Double.POSITIVE_INFINITY,
            meta);
        Trial trial = new Trial(candidate, feasibility);
        if (best == null || candidate.isBetterThan(best.getCandidate())) {
            best = trial;
        }
        pending = termination.recordEvaluation(candidate);
        if (log.isTraceEnabled()) {
            log.trace("[optimize] run={} eval={} f={} feasible={}", runIndex,
                termination.getEvaluations(), value, candidate.isFeasible());
        }
        return trial;
    }
    
    private boolean isSafe(double[] point) {
        Controller controller = problem.getController();
        if (controller == null) {
            return true;
        }
        boolean safe;
        try {
            safe = controller.safe(point.clone());
        } catch (OptimizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Controller safety check raised: " + e.getMessage(), e);
        }
        if (!safe) {
            log.debug("[optimize] run={} unsafe point skipped: {}", runIndex, Arrays.toString(point));
        }
        return safe;
    }
    
    private double objective(double[] point, boolean safe) {
        ObjectiveModel model = problem.getModel();
        Controller controller = problem.getController();
        double value;
        try {
            if (controller != null && safe) {
                double observed = controller.apply(point.clone());
                value = model != null ? model.objective(point.clone()) : observed;
            } else if (model != null) {
                value = model.objective(point.clone());
            } else {
                value = Double.POSITIVE_INFINITY;
            }
        } catch (OptimizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Objective raised at " + Arrays.toString(point) + ": " + e.getMessage(), e);
        }
        if (Double.isNaN(value)) {
            throw new EvaluationException("Objective returned NaN at " + Arrays.toString(point));
        }
        return value;
    }
    
    private void emit(int iteration, Trial trial) {
        listener.onStep(iteration, trial.getCandidate(), termination.snapshot());
    }
    
    private void throwIfStopped() {
        if (pending.isPresent()) {
            throw new TerminationSignal(pending.get());
        }
    }
}
