/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the gradient-based local strategy.
 */
public class LocalConvexStrategyTest {

    private static Problem.Builder quadratic() {
        return Problem.builder()
            .dimension(1)
            .model(ExampleModels.parabola(3.0))
            .bounds(Bounds.of(Bound.between(-100, 100)));
    }

    @Test
    @DisplayName("Bounded quadratic converges to its minimizer")
    void testQuadratic() {
        List<Integer> iterations = new ArrayList<>();
        RunResult r = new LocalConvexStrategy()
            .run(quadratic().build(), new double[]{0.0}, 0, null, (i, c, m) -> iterations.add(i));

        assertThat(r.isRaised()).isFalse();
        assertThat(r.getCandidate().getX(0)).isCloseTo(3.0, within(1e-6));
        assertThat(r.getCandidate().getValue()).isCloseTo(0.0, within(1e-10));
        assertThat(r.getCandidate().isFeasible()).isTrue();
        assertThat(r.getTermination().getReason()).isEqualTo(StopReason.CONVERGED);
        assertThat(r.getCandidate().getMeta())
            .containsEntry("mode", "bounds")
            .containsEntry("backend", SolverLibrary.LBFGSB)
            .containsEntry("gradient", "analytic");
        // Step 0 is the starting point, then one step per iteration
        assertThat(iterations).startsWith(0, 1).isSorted();
    }

    @Test
    @DisplayName("Active bound stops the descent on the boundary")
    void testActiveBound() {
        Problem problem = quadratic().bounds(Bounds.of(Bound.between(-1, 1))).build();
        RunResult r = new LocalConvexStrategy().run(problem, new double[]{0.0}, 0, null, StepListener.NONE);

        assertThat(r.getCandidate().getX(0)).isEqualTo(1.0);
        assertThat(r.getTermination().getReason()).isEqualTo(StopReason.CONVERGED);
    }

    @Test
    @DisplayName("Starting point outside the bounds is projected first")
    void testProjectedStart() {
        List<Candidate> steps = new ArrayList<>();
        Problem problem = quadratic().bounds(Bounds.of(Bound.between(-1, 1))).build();
        new LocalConvexStrategy().run(problem, new double[]{5.0}, 0, null, (i, c, m) -> steps.add(c));

        assertThat(steps.get(0).getX(0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Models without gradients fall back to central differences")
    void testFiniteDifferenceFallback() {
        Problem problem = quadratic().model(x -> (x[0] - 3) * (x[0] - 3)).build();
        RunResult r = new LocalConvexStrategy().run(problem, new double[]{0.0}, 0, null, StepListener.NONE);

        assertThat(r.getCandidate().getX(0)).isCloseTo(3.0, within(1e-6));
        assertThat(r.getCandidate().getMeta()).containsEntry("gradient", "central");
        assertThat((Double) r.getTermination().getMetrics().get("probes")).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("Configured finite-difference method is used even with an analytic gradient")
    void testExplicitMethod() {
        LocalConvexStrategy strategy = new LocalConvexStrategy(
            Collections.singletonMap("gradient", "five_point"), SolverLibrary.builtin());
        RunResult r = strategy.run(quadratic().build(), new double[]{0.0}, 0, null, StepListener.NONE);

        assertThat(r.getCandidate().getMeta()).containsEntry("gradient", "five-point");
        assertThat(r.getCandidate().getX(0)).isCloseTo(3.0, within(1e-5));
    }

    @Test
    @DisplayName("Analytic mode needs a gradient-capable model")
    void testAnalyticWithoutGradient() {
        LocalConvexStrategy strategy = new LocalConvexStrategy(
            Collections.singletonMap("gradient", "analytic"), SolverLibrary.builtin());
        Problem problem = quadratic().model(x -> x[0] * x[0]).build();

        assertThatThrownBy(() -> strategy.run(problem, new double[]{1.0}, 0, null, StepListener.NONE))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Unknown parameters are rejected on construction")
    void testUnknownParams() {
        assertThatThrownBy(() -> new LocalConvexStrategy(
                Collections.singletonMap("momentum", 0.9), SolverLibrary.builtin()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("momentum");
        assertThatThrownBy(() -> new LocalConvexStrategy(
                Collections.singletonMap("gradient", "sideways"), SolverLibrary.builtin()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new LocalConvexStrategy(
                Collections.singletonMap("corrections", 2.5), SolverLibrary.builtin()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Inequality constraint is honored through the augmented Lagrangian")
    void testConstrained() {
        Problem problem = quadratic()
            .bounds(Bounds.of(Bound.between(-10, 10)))
            .constraints(Constraints.builder().linearInequality(new double[]{1.0}, 0.0).build())
            .termination(Termination.builder().maxEvaluations(500).build())
            .build()
            .probe(new double[]{-1.0});
        RunResult r = new LocalConvexStrategy().run(problem, new double[]{-1.0}, 0, null, StepListener.NONE);

        Candidate best = r.getCandidate();
        assertThat(best.isFeasible()).isTrue();
        assertThat(best.getX(0)).isLessThanOrEqualTo(1e-8).isCloseTo(0.0, within(1e-3));
        assertThat(best.getMeta())
            .containsEntry("mode", "constrained")
            .containsEntry("backend", SolverLibrary.AUGLAG);
    }

    @Test
    @DisplayName("Constraints of an unprobed problem are probed at the start of a run")
    void testUnprobedArityChange() {
        // one component at the origin, two anywhere else
        ConstraintFunction shifting = x -> x[0] == 0.0 ? new double[]{x[0]} : new double[]{x[0], -1.0};
        Problem problem = quadratic()
            .constraints(Constraints.builder().inequality(shifting).build())
            .build();
        assertThat(problem.isProbed()).isFalse();
        assertThat(problem.probe(new double[]{0.0}).isProbed()).isTrue();

        assertThatThrownBy(() -> new LocalConvexStrategy().run(problem, new double[]{0.0}, 0, null, StepListener.NONE))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("expected 1");
    }

    @Test
    @DisplayName("Missing backend skips the run instead of failing")
    void testSkippedBackend() {
        LocalConvexStrategy strategy = new LocalConvexStrategy((Map<String, ?>) null, SolverLibrary.without(SolverLibrary.LBFGSB));
        RunResult r = strategy.run(quadratic().build(), new double[]{0.5}, 2, null, StepListener.NONE);

        assertThat(r.isRaised()).isFalse();
        assertThat(r.getRunIndex()).isEqualTo(2);
        assertThat(r.getTermination().isSkipped()).isTrue();
        assertThat(r.getTermination().getReason()).isEqualTo(StopReason.FAILED);
        assertThat(r.getTermination().getMessage()).contains("lbfgsb");
        assertThat(r.getCandidate().getX()).containsExactly(0.5);
        assertThat(r.getCandidate().getValue()).isNaN();
        assertThat(r.getCandidate().getMeta()).containsEntry("skipped", true);
    }

    @Test
    @DisplayName("Raising objective carries the best point seen so far")
    void testPartialResult() {
        Problem failing = quadratic().model(new FailingAbove(2.0)).build();

        assertThatThrownBy(() -> new LocalConvexStrategy()
                .run(failing, new double[]{0.0}, 0, null, StepListener.NONE))
            .isInstanceOfSatisfying(EvaluationException.class, e -> {
                RunResult partial = e.getPartialResult();
                assertThat(partial).isNotNull();
                assertThat(partial.isRaised()).isTrue();
                assertThat(partial.getTermination().getReason()).isEqualTo(StopReason.FAILED);
                assertThat(partial.getCandidate().getX(0)).isEqualTo(1.0);
            });
    }

    /**
     * Parabola around 3 whose evaluation breaks beyond a threshold.
     */
    private static final class FailingAbove implements ObjectiveModel, GradientCapable {
        private final double limit;

        FailingAbove(double limit) {
            this.limit = limit;
        }

        @Override
        public double objective(double[] x) {
            if (x[0] > limit) {
                throw new IllegalStateException("instrument saturated");
            }
            return (x[0] - 3) * (x[0] - 3);
        }

        @Override
        public double[] gradient(double[] x) {
            return new double[]{2 * (x[0] - 3)};
        }
    }
}
