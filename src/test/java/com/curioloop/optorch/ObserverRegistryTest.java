/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for observer lookup and the built-in observers.
 */
public class ObserverRegistryTest {

    private static final RunMetrics METRICS = new RunMetrics(1, 0, 0, 1.0, Double.NaN, Double.NaN, 0L);

    @Test
    @DisplayName("Defaults provide cost and logging observers")
    void testDefaults() {
        ObserverRegistry registry = ObserverRegistry.defaults();
        assertThat(registry.names()).contains("cost", "cost-curve", "logging");
        assertThat(registry.create(ObserverDescriptor.of("Cost", null))).isInstanceOf(CostCurveObserver.class);
        assertThat(registry.create(ObserverDescriptor.of("logging", Collections.singletonMap("level", "debug"))))
            .isInstanceOf(LoggingObserver.class);
    }

    @Test
    @DisplayName("Custom factories receive the descriptor configuration")
    void testCustom() {
        ObserverRegistry registry = new ObserverRegistry()
            .register("curve", config -> new CostCurveObserver(config));
        ProgressObserver observer = registry.create(
            ObserverDescriptor.of("curve", Collections.singletonMap("label", "loss")));

        assertThat(observer).isInstanceOf(CostCurveObserver.class);
        assertThat(((CostCurveObserver) observer).getLabel()).isEqualTo("loss");
    }

    @Test
    @DisplayName("Unknown types and options are configuration errors")
    void testUnknown() {
        ObserverRegistry registry = ObserverRegistry.defaults();
        assertThatThrownBy(() -> registry.create(ObserverDescriptor.of("dashboard", null)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("dashboard");
        assertThatThrownBy(() -> registry.create(ObserverDescriptor.of("cost", Collections.singletonMap("color", "red"))))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> registry.create(ObserverDescriptor.of("logging", Collections.singletonMap("level", "trace"))))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> ObserverDescriptor.of("", null))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Cost curve tracks the best value so far per run")
    void testCostCurve() {
        CostCurveObserver curve = new CostCurveObserver();
        ProgressChannel channel = new ProgressChannel();
        channel.register(curve);

        double[] values = {5.0, 7.0, 2.0, 3.0};
        for (int i = 0; i < values.length; i++) {
            channel.step(0, i, new Candidate(new double[]{i}, values[i], true, 0.0), METRICS, false);
        }
        channel.step(1, 0, new Candidate(new double[]{0}, 9.0, true, 0.0), METRICS, false);

        assertThat(curve.getSeries(0)).containsExactly(5.0, 5.0, 2.0, 2.0);
        assertThat(curve.getSeries(1)).containsExactly(9.0);
        assertThat(curve.getSeries(4)).isEmpty();
        assertThat(curve.getRuns()).containsExactly(0, 1);
    }

    @Test
    @DisplayName("Logging observer accepts every event kind")
    void testLoggingObserver() {
        LoggingObserver observer = new LoggingObserver(Collections.singletonMap("level", "debug"));
        ProgressChannel channel = new ProgressChannel();
        channel.register(observer);
        Candidate c = new Candidate(new double[]{1.0}, 4.0, false, 0.5);

        assertThatCode(() -> {
            channel.start(0, new double[]{1.0}, Bounds.none(), "NelderMead");
            channel.step(0, 0, c, METRICS, true);
            channel.end(new RunResult(0, new double[]{1.0}, c,
                new TerminationResult(StopReason.BUDGET, Collections.emptyMap(), Collections.emptyMap(), null), null), 0);
        }).doesNotThrowAnyException();
        assertThat(channel.journal()).extracting(HistoryRecord::getTimestamp).allMatch(t -> t.isAfter(Instant.EPOCH));
    }
}
