/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the derivative-free simplex strategy.
 */
public class NelderMeadStrategyTest {

    private static Termination budget(int evals) {
        return Termination.builder().maxEvaluations(evals).functionTolerance(1e-12).variableTolerance(1e-12).build();
    }

    @Test
    @DisplayName("Simplex finds a root of x^2 - 2")
    void testPolynomialRoot() {
        Problem problem = Problem.builder()
            .dimension(1)
            .model(ExampleModels.polyResidual(1.0, 0.0, -2.0))
            .termination(budget(500))
            .build();
        RunResult r = new NelderMeadStrategy().run(problem, new double[]{0.1}, 0, null, StepListener.NONE);

        assertThat(Math.abs(r.getCandidate().getX(0))).isCloseTo(Math.sqrt(2.0), within(1e-3));
        assertThat(r.getCandidate().getValue()).isLessThan(1e-6);
        assertThat(r.getCandidate().getMeta()).containsEntry("backend", SolverLibrary.NELDER_MEAD);
    }

    @Test
    @DisplayName("Simplex stays inside the bounds")
    void testBounded() {
        Problem problem = Problem.builder()
            .dimension(2)
            .model(ExampleModels.parabola(3.0))
            .bounds(Bounds.uniform(2, Bound.between(-1, 1)))
            .termination(budget(800))
            .build();
        RunResult r = new NelderMeadStrategy().run(problem, new double[]{0.0, 0.0}, 0, null,
            (i, c, m) -> assertThat(problem.getBounds().contains(c.getX())).isTrue());

        assertThat(r.getCandidate().getX(0)).isCloseTo(1.0, within(1e-4));
        assertThat(r.getCandidate().getX(1)).isCloseTo(1.0, within(1e-4));
    }

    @Test
    @DisplayName("Penalized simplex returns a feasible point")
    void testConstrained() {
        Problem problem = Problem.builder()
            .dimension(1)
            .model(ExampleModels.parabola(3.0))
            .constraints(Constraints.builder().linearInequality(new double[]{1.0}, 0.0).build())
            .termination(budget(500))
            .build();
        RunResult r = new NelderMeadStrategy().run(problem, new double[]{-1.0}, 0, null, StepListener.NONE);

        assertThat(r.getCandidate().isFeasible()).isTrue();
        assertThat(r.getCandidate().getX(0)).isCloseTo(0.0, within(1e-3));
    }

    @Test
    @DisplayName("Adaptive coefficients also converge")
    void testAdaptive() {
        NelderMeadStrategy strategy = new NelderMeadStrategy(
            Collections.singletonMap("adaptive", true), SolverLibrary.builtin());
        Problem problem = Problem.builder()
            .dimension(3)
            .model(ExampleModels.parabola(1.0))
            .termination(budget(3000))
            .build();
        RunResult r = strategy.run(problem, new double[]{0.0, 2.0, -1.0}, 0, null, StepListener.NONE);

        assertThat(r.getCandidate().getValue()).isLessThan(1e-6);
        assertThat(strategy.getParams()).containsEntry("adaptive", true);
    }

    @Test
    @DisplayName("Missing simplex backend skips the run")
    void testSkipped() {
        NelderMeadStrategy strategy = new NelderMeadStrategy((Map<String, ?>) null, SolverLibrary.without(SolverLibrary.NELDER_MEAD));
        Problem problem = Problem.builder().dimension(1).model(ExampleModels.parabola(0.0)).build();
        RunResult r = strategy.run(problem, new double[]{1.0}, 0, null, StepListener.NONE);

        assertThat(r.getTermination().isSkipped()).isTrue();
    }

    @Test
    @DisplayName("Invalid simplex settings are configuration errors")
    void testInvalidParams() {
        assertThatThrownBy(() -> new NelderMeadStrategy(
                Collections.singletonMap("initial_step", -0.1), SolverLibrary.builtin()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new NelderMeadStrategy(
                Collections.singletonMap("adaptive", "sometimes"), SolverLibrary.builtin()))
            .isInstanceOf(ConfigurationException.class);
    }
}
