/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.Map;

/**
 * A search strategy: one solver configuration that can execute runs.
 * <p>
 * Implementations must tolerate concurrent {@code run} calls with distinct
 * run indices; all per-run state lives in the run itself.
 * </p>
 */
public interface Strategy {
    
    /**
     * Gets the strategy name recorded as {@code optimizer.strategy}.
     * @return Name
     */
    String getName();
    
    /**
     * Gets the effective strategy parameters, defaults included.
     * @return Unmodifiable parameters
     */
    Map<String, Object> getParams();
    
    /**
     * Executes one run from a starting point.
     * <p>
     * Constraints of a problem that was never probed are probed at the
     * projected starting point first.
     * </p>
     * @param problem Problem to minimize
     * @param x0 Starting point
     * @param runIndex Run index within the batch
     * @param cancellation Cancellation flag, checked at iteration boundaries
     * @param onStep Step listener
     * @return Run outcome; a missing solver backend yields a skipped run rather than an exception
     * @throws ConfigurationException if the starting point does not fit the problem,
     *         or a constraint fails its probe or changes its component count
     * @throws EvaluationException if the objective or a constraint fails
     */
    RunResult run(Problem problem, double[] x0, int runIndex, CancellationToken cancellation, StepListener onStep);
}
