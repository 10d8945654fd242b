/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

/**
 * End-to-end tests through the request facade and the output store.
 */
public class OptimizerTest {

    private static OptimizationRequest.Builder quadratic() {
        return OptimizationRequest.builder()
            .strategy("local")
            .model("parabola", Collections.singletonMap("x_star", 3.0))
            .bounds(new double[][]{{-100, 100}})
            .x0(0.0);
    }

    @Test
    @DisplayName("Local strategy minimizes a bounded quadratic and fills every output key")
    void testQuadraticOutputs() {
        MapOutputStore store = new MapOutputStore();
        RecordingObserver observer = new RecordingObserver();
        OptimizationReport report = Optimizer.optimize(quadratic().observer(observer).build(), store);

        assertThat(report.getBestCandidate().getX(0)).isCloseTo(3.0, within(1e-6));
        assertThat(report.getTermination().getReason()).isEqualTo(StopReason.CONVERGED);

        assertThat(store.asMap()).containsKeys(ResultAggregator.STRATEGY, ResultAggregator.PARAMS,
            ResultAggregator.HISTORY, ResultAggregator.RUNS, ResultAggregator.BEST_CANDIDATE,
            ResultAggregator.TERMINATION, ResultAggregator.EVENTS);
        assertThat(store.get(ResultAggregator.STRATEGY)).isEqualTo("LocalConvex");

        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) store.get(ResultAggregator.PARAMS);
        assertThat(params).containsEntry("bounds", Collections.singletonList(Arrays.asList(-100.0, 100.0)))
            .containsKeys("termination", "strategy");

        @SuppressWarnings("unchecked")
        Map<String, Object> termination = (Map<String, Object>) store.get(ResultAggregator.TERMINATION);
        assertThat(termination).containsEntry("reason", "converged").containsKeys("metrics", "budget");

        // Unthrottled observer sees exactly the recorded history
        List<?> history = (List<?>) store.get(ResultAggregator.HISTORY);
        assertThat(history).hasSize(observer.steps().size());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> events = (List<Map<String, Object>>) store.get(ResultAggregator.EVENTS);
        assertThat(events).hasSize(history.size() + 2);
        assertThat(events.get(0))
            .containsEntry("kind", "start")
            .containsEntry("x0", Collections.singletonList(0.0))
            .containsEntry("bounds", Collections.singletonList(Arrays.asList(-100.0, 100.0)));
    }

    @Test
    @DisplayName("A single evaluation budget stops after the starting point")
    void testSingleEvaluationBudget() {
        MapOutputStore store = new MapOutputStore();
        Optimizer.optimize(quadratic().termination(Collections.singletonMap("max_evals", 1)).build(), store);

        @SuppressWarnings("unchecked")
        Map<String, Object> termination = (Map<String, Object>) store.get(ResultAggregator.TERMINATION);
        assertThat(termination).containsEntry("reason", "budget");
        assertThat((List<?>) store.get(ResultAggregator.HISTORY)).hasSize(1);
    }

    @Test
    @DisplayName("Repeated invocations give identical results")
    void testDeterminism() {
        OptimizationReport first = Optimizer.optimize(quadratic().strategy("nelder").x0(0.5).build());
        OptimizationReport second = Optimizer.optimize(quadratic().strategy("nelder").x0(0.5).build());

        assertThat(second.getBestCandidate().getX()).isEqualTo(first.getBestCandidate().getX());
        assertThat(second.getHistory()).hasSameSizeAs(first.getHistory());
        for (int i = 0; i < first.getHistory().size(); i++) {
            assertThat(second.getHistory().get(i).getCandidate().getX())
                .isEqualTo(first.getHistory().get(i).getCandidate().getX());
        }
    }

    @Test
    @DisplayName("Update-every two delivers at most half the steps")
    void testUpdateEvery() {
        RecordingObserver observer = new RecordingObserver();
        OptimizationReport report = Optimizer.optimize(quadratic()
            .strategy("nelder")
            .termination(Collections.singletonMap("max_evals", 60))
            .observer(observer)
            .progressUpdateEvery(2)
            .build());

        int steps = report.getHistory().size();
        assertThat(steps).isGreaterThan(2);
        assertThat(observer.steps().size()).isLessThanOrEqualTo((steps + 1) / 2);
        assertThat(observer.count("start")).isEqualTo(1);
        assertThat(observer.count("end")).isEqualTo(1);
    }

    @Test
    @DisplayName("Best candidate equals the minimal feasible run entry across seeds")
    void testMultiStartSelection() {
        MapOutputStore store = new MapOutputStore();
        Optimizer.optimize(quadratic()
            .seeds(Arrays.asList(new double[]{-5.0}, new double[]{0.0}, new double[]{10.0}))
            .parallelism(3)
            .build(), store);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> runs = (List<Map<String, Object>>) store.get(ResultAggregator.RUNS);
        assertThat(runs).hasSize(3);
        Map<String, Object> expected = null;
        for (int i = 0; i < runs.size(); i++) {
            Map<String, Object> run = runs.get(i);
            assertThat(run.get("meta")).asInstanceOf(MAP).containsEntry("run_index", i);
            if (Boolean.TRUE.equals(run.get("feasible"))
                    && (expected == null || (Double) run.get("value") < (Double) expected.get("value"))) {
                expected = run;
            }
        }
        assertThat(expected).isNotNull();
        assertThat(store.get(ResultAggregator.BEST_CANDIDATE)).isEqualTo(expected);
    }

    @Test
    @DisplayName("With every run infeasible the least violating run is selected")
    void testAllRunsInfeasible() {
        MapOutputStore store = new MapOutputStore();
        // x >= 20 is out of reach with a single evaluation per run
        OptimizationReport report = Optimizer.optimize(quadratic()
            .seeds(Arrays.asList(new double[]{-5.0}, new double[]{0.0}, new double[]{10.0}))
            .constraints(Constraints.builder().linearInequality(new double[]{-1.0}, -20.0).build())
            .termination(Collections.singletonMap("max_evals", 1))
            .build(), store);

        assertThat(report.getRuns()).hasSize(3)
            .allSatisfy(r -> assertThat(r.getCandidate().isFeasible()).isFalse());
        assertThat(report.getBestCandidate().isFeasible()).isFalse();
        assertThat(report.getBestCandidate().getViolation()).isEqualTo(10.0);

        @SuppressWarnings("unchecked")
        Map<String, Object> best = (Map<String, Object>) store.get(ResultAggregator.BEST_CANDIDATE);
        assertThat(best).containsEntry("feasible", false);
        assertThat(best.get("meta")).asInstanceOf(MAP).containsEntry("run_index", 2);
    }

    @ParameterizedTest(name = "{0} from x0={1}")
    @CsvSource({
        "local, -5", "local, -1", "local, 0", "local, 5",
        "nelder-mead, -5", "nelder-mead, -1", "nelder-mead, 0", "nelder-mead, 5"
    })
    @DisplayName("Inequality x <= 0 pins the parabola minimum to the boundary")
    void testInequalityBoundary(String strategy, double x0) {
        OptimizationReport report = Optimizer.optimize(OptimizationRequest.builder()
            .strategy(strategy)
            .model(ExampleModels.parabola(3.0))
            .constraints(Constraints.builder().linearInequality(new double[]{1.0}, 0.0).build())
            .x0(x0)
            .build());

        Candidate best = report.getBestCandidate();
        assertThat(best.isFeasible()).isTrue();
        assertThat(best.getX(0)).isCloseTo(0.0, within(1e-3));
        assertThat(report.getTermination().getReason()).isNotEqualTo(StopReason.FTOL);
    }

    @Test
    @DisplayName("Controller safety keeps the best point inside the safe region")
    void testControllerSafety() {
        AtomicInteger resets = new AtomicInteger();
        AtomicInteger unsafeApplies = new AtomicInteger();
        Controller controller = new Controller() {
            @Override
            public void reset() {
                resets.incrementAndGet();
            }

            @Override
            public double apply(double[] x) {
                if (!safe(x)) {
                    unsafeApplies.incrementAndGet();
                }
                return x[0] * x[0];
            }

            @Override
            public boolean safe(double[] x) {
                return x[0] >= -1 && x[0] <= 1;
            }
        };
        OptimizationReport report = Optimizer.optimize(OptimizationRequest.builder()
            .strategy("local")
            .model(ExampleModels.parabola(0.0))
            .controller(controller)
            .bounds(new double[][]{{-1, 1}})
            .x0(5.0)
            .build());

        double best = report.getBestCandidate().getX(0);
        assertThat(best).isBetween(-1.0, 1.0);
        assertThat(report.getBestCandidate().isFeasible()).isTrue();
        assertThat(resets.get()).isEqualTo(1);
        assertThat(unsafeApplies.get()).isZero();
    }

    @Test
    @DisplayName("Unsafe points are never applied and count as infeasible")
    void testUnsafeRegion() {
        AtomicInteger unsafeApplies = new AtomicInteger();
        Controller controller = new Controller() {
            @Override
            public void reset() {}

            @Override
            public double apply(double[] x) {
                if (!safe(x)) {
                    unsafeApplies.incrementAndGet();
                }
                return (x[0] - 3) * (x[0] - 3);
            }

            @Override
            public boolean safe(double[] x) {
                return Math.abs(x[0]) <= 1;
            }
        };
        OptimizationReport report = Optimizer.optimize(OptimizationRequest.builder()
            .strategy("nelder")
            .controller(controller)
            .x0(0.5)
            .build());

        Candidate best = report.getBestCandidate();
        assertThat(best.isFeasible()).isTrue();
        assertThat(best.getX(0)).isLessThanOrEqualTo(1.0);
        assertThat(best.getValue()).isLessThan(6.25);
        assertThat(unsafeApplies.get()).isZero();
        assertThat(report.getHistory())
            .filteredOn(r -> Math.abs(r.getCandidate().getX(0)) > 1)
            .allSatisfy(r -> {
                assertThat(r.getCandidate().isFeasible()).isFalse();
                assertThat(r.getCandidate().getViolation()).isInfinite();
            });
    }

    @Test
    @DisplayName("Cancelled invocation stops at the first iteration boundary")
    void testCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        OptimizationReport report = Optimizer.optimize(quadratic().cancellation(token).build());

        assertThat(report.getTermination().getReason()).isEqualTo(StopReason.CANCELLED);
        assertThat(report.getHistory()).hasSize(1);
        assertThat(report.getBestCandidate().getX()).containsExactly(0.0);
    }

    @Test
    @DisplayName("Configuration errors surface before any evaluation")
    void testConfigurationErrorsFirst() {
        AtomicInteger calls = new AtomicInteger();
        OptimizationRequest request = OptimizationRequest.builder()
            .strategy("local")
            .model(x -> {
                calls.incrementAndGet();
                return x[0] * x[0];
            })
            .constraints(Constraints.builder().inequality(x -> null).build())
            .x0(1.0)
            .build();

        assertThatThrownBy(() -> Optimizer.optimize(request)).isInstanceOf(ConfigurationException.class);
        assertThat(calls.get()).isZero();

        assertThatThrownBy(() -> quadratic().bounds(new double[][]{{0, 1}, {0, 1}}).build())
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> quadratic().x0(Double.NaN).build())
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> OptimizationRequest.builder().x0(1.0).model(x -> 0.0).build())
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> quadratic().progressUpdateEvery(-1).build())
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Unavailable backend yields a skipped result instead of an error")
    void testSkippedBackend() {
        MapOutputStore store = new MapOutputStore();
        Optimizer.optimize(quadratic().solverLibrary(SolverLibrary.without(SolverLibrary.LBFGSB)).build(), store);

        @SuppressWarnings("unchecked")
        Map<String, Object> best = (Map<String, Object>) store.get(ResultAggregator.BEST_CANDIDATE);
        assertThat(best).extractingByKey("meta").asInstanceOf(MAP)
            .containsEntry("skipped", true)
            .containsEntry("reason", "failed");
        assertThat((List<?>) store.get(ResultAggregator.HISTORY)).isEmpty();
    }

    @Test
    @DisplayName("Observers built from descriptors receive events")
    void testObserverDescriptors() {
        RecordingObserver recorder = new RecordingObserver();
        ObserverRegistry registry = ObserverRegistry.defaults().register("recorder", config -> recorder);
        Optimizer.optimize(quadratic()
            .observerRegistry(registry)
            .observer(ObserverDescriptor.of("recorder", null, 0.0, 1))
            .observer(ObserverDescriptor.of("logging", null))
            .build());

        assertThat(recorder.count("start")).isEqualTo(1);
        assertThat(recorder.count("step")).isGreaterThan(0);
        assertThat(recorder.isClosed()).isTrue();
    }
}
