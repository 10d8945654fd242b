/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the evaluation budget and step accounting.
 */
public class BudgetPropertyTest {

    /**
     * No strategy spends more evaluations than allowed, finite-difference
     * probes included, and every step follows at least one evaluation.
     */
    @Property(tries = 60)
    @Label("Evaluation budget is never exceeded")
    void budgetIsNeverExceeded(
            @ForAll @IntRange(min = 1, max = 40) int maxEvals,
            @ForAll boolean simplex,
            @ForAll @DoubleRange(min = -20, max = 20) double x0
    ) {
        // No analytic gradient so the local strategy probes
        OptimizationRequest request = OptimizationRequest.builder()
            .strategy(simplex ? "nelder" : "local")
            .model(x -> (x[0] - 3) * (x[0] - 3) + (x[1] + 1) * (x[1] + 1))
            .termination(Collections.singletonMap("max_evals", maxEvals))
            .x0(x0, -x0)
            .build();
        OptimizationReport report = Optimizer.optimize(request);

        Double evaluations = (Double) report.getTermination().getMetrics().get("evaluations");
        assertThat(evaluations).isLessThanOrEqualTo((double) maxEvals);
        assertThat(report.getHistory().size()).isLessThanOrEqualTo(maxEvals);
        assertThat(report.getHistory().get(0).getIteration()).isZero();
        if (report.getTermination().getReason() == StopReason.BUDGET) {
            assertThat(evaluations).isEqualTo((double) maxEvals);
        }
    }

    /**
     * Iterations reported by steps are consecutive from zero.
     */
    @Property(tries = 30)
    @Label("Step iterations are consecutive")
    void stepIterationsAreConsecutive(
            @ForAll @IntRange(min = 1, max = 30) int maxIters,
            @ForAll boolean simplex
    ) {
        OptimizationReport report = Optimizer.optimize(OptimizationRequest.builder()
            .strategy(simplex ? "nelder" : "local")
            .model(ExampleModels.polyResidual(1.0, 0.0, -2.0))
            .termination(Termination.builder().maxIterations(maxIters).maxEvaluations(1000).build())
            .x0(0.3)
            .build());

        for (int i = 0; i < report.getHistory().size(); i++) {
            assertThat(report.getHistory().get(i).getIteration()).isEqualTo(i);
        }
        assertThat(report.getHistory().size()).isLessThanOrEqualTo(maxIters + 1);
    }
}
