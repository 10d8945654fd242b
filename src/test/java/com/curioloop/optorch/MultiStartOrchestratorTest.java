/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

/**
 * Tests for multi-start execution and run selection.
 */
public class MultiStartOrchestratorTest {

    private static final List<double[]> SEEDS = Arrays.asList(
        new double[]{-5.0}, new double[]{0.0}, new double[]{10.0});

    private static Problem quadratic(ObjectiveModel model) {
        return Problem.builder()
            .dimension(1)
            .model(model)
            .bounds(Bounds.of(Bound.between(-100, 100)))
            .build();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3})
    @DisplayName("Results come back in seed order whatever the parallelism")
    void testOrdering(int parallelism) {
        ProgressChannel channel = new ProgressChannel();
        List<RunResult> results = new MultiStartOrchestrator(parallelism)
            .runAll(new LocalConvexStrategy(), quadratic(ExampleModels.parabola(3.0)), SEEDS, channel, null);

        assertThat(results).extracting(RunResult::getRunIndex).containsExactly(0, 1, 2);
        for (int i = 0; i < results.size(); i++) {
            assertThat(results.get(i).getSeed()).isEqualTo(SEEDS.get(i));
            assertThat(results.get(i).getCandidate().getX(0)).isCloseTo(3.0, within(1e-6));
        }
        long starts = channel.journal().stream().filter(r -> r.getKind() == ProgressEvent.Kind.START).count();
        long ends = channel.journal().stream().filter(r -> r.getKind() == ProgressEvent.Kind.END).count();
        assertThat(starts).isEqualTo(3);
        assertThat(ends).isEqualTo(3);
    }

    @Test
    @DisplayName("Equal candidates select the earliest run")
    void testTieBreak() {
        List<RunResult> results = new MultiStartOrchestrator()
            .runAll(new LocalConvexStrategy(), quadratic(ExampleModels.parabola(3.0)), SEEDS, new ProgressChannel(), null);
        assertThat(MultiStartOrchestrator.selectBest(results).getRunIndex()).isZero();
    }

    @Test
    @DisplayName("A raising run is recorded while the others complete")
    void testRaisingRun() {
        ObjectiveModel fragile = x -> {
            if (x[0] < -50) {
                throw new IllegalArgumentException("out of calibrated range");
            }
            return (x[0] - 3) * (x[0] - 3);
        };
        List<double[]> seeds = Arrays.asList(new double[]{-80.0}, new double[]{0.0});
        ProgressChannel channel = new ProgressChannel();
        List<RunResult> results = new MultiStartOrchestrator()
            .runAll(new LocalConvexStrategy(), quadratic(fragile), seeds, channel, null);

        assertThat(results.get(0).isRaised()).isTrue();
        assertThat(results.get(0).getTermination().getReason()).isEqualTo(StopReason.FAILED);
        assertThat(results.get(0).toMap()).extractingByKey("meta")
            .asInstanceOf(MAP).containsKey("error");
        assertThat(results.get(1).isRaised()).isFalse();
        assertThat(MultiStartOrchestrator.selectBest(results).getRunIndex()).isEqualTo(1);

        HistoryRecord firstEnd = channel.journal().stream()
            .filter(r -> r.getKind() == ProgressEvent.Kind.END && r.getRunIndex() == 0)
            .findFirst().orElseThrow();
        assertThat(firstEnd.getReason()).isEqualTo(StopReason.FAILED);
    }

    @Test
    @DisplayName("All runs raising propagates an evaluation error")
    void testAllRaised() {
        ObjectiveModel broken = x -> {
            throw new IllegalStateException("device disconnected");
        };
        assertThatThrownBy(() -> new MultiStartOrchestrator(2)
                .runAll(new LocalConvexStrategy(), quadratic(broken), SEEDS, new ProgressChannel(), null))
            .isInstanceOf(EvaluationException.class)
            .hasMessageContaining("All 3 runs raised")
            .hasMessageContaining("device disconnected");
    }

    @Test
    @DisplayName("Controller-driven problems run sequentially on the caller thread")
    void testControllerRunsSequentially() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        Controller controller = new Controller() {
            @Override
            public void reset() {}

            @Override
            public double apply(double[] x) {
                threads.add(Thread.currentThread().getName());
                return (x[0] - 1) * (x[0] - 1);
            }

            @Override
            public boolean safe(double[] x) {
                return true;
            }
        };
        Problem problem = Problem.builder()
            .dimension(1)
            .controller(controller)
            .bounds(Bounds.of(Bound.between(-10, 10)))
            .build();
        List<RunResult> results = new MultiStartOrchestrator(4)
            .runAll(new NelderMeadStrategy(), problem, SEEDS, new ProgressChannel(), null);

        assertThat(results).hasSize(3);
        assertThat(threads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    @DisplayName("Seeds must match the problem dimension")
    void testSeedValidation() {
        Problem problem = quadratic(ExampleModels.parabola(3.0));
        MultiStartOrchestrator orchestrator = new MultiStartOrchestrator();
        assertThatThrownBy(() -> orchestrator.runAll(new LocalConvexStrategy(), problem,
                Collections.singletonList(new double[]{1.0, 2.0}), new ProgressChannel(), null))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> orchestrator.runAll(new LocalConvexStrategy(), problem,
                Collections.emptyList(), new ProgressChannel(), null))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new MultiStartOrchestrator(0))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Selection prefers feasible, then value, then lower violation")
    void testSelectBest() {
        TerminationResult done = new TerminationResult(StopReason.CONVERGED,
            Collections.emptyMap(), Collections.emptyMap(), null);
        RunResult infeasibleLow = new RunResult(0, new double[]{0}, new Candidate(new double[]{0}, -10, false, 0.5), done, null);
        RunResult infeasibleLess = new RunResult(1, new double[]{0}, new Candidate(new double[]{0}, 5, false, 0.1), done, null);
        RunResult feasibleHigh = new RunResult(2, new double[]{0}, new Candidate(new double[]{0}, 7, true, 0.0), done, null);
        RunResult feasibleLow = new RunResult(3, new double[]{0}, new Candidate(new double[]{0}, 2, true, 0.0), done, null);

        assertThat(MultiStartOrchestrator.selectBest(Arrays.asList(infeasibleLow, infeasibleLess)).getRunIndex())
            .isEqualTo(1);
        assertThat(MultiStartOrchestrator.selectBest(
                Arrays.asList(infeasibleLow, infeasibleLess, feasibleHigh, feasibleLow)).getRunIndex())
            .isEqualTo(3);
    }
}
