/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class LbfgsMemoryTest {

    @Test
    @DisplayName("Empty memory yields steepest descent")
    void testSteepestDescent() {
        LbfgsMemory memory = LbfgsMemory.allocate(2, 3);
        double[] d = new double[2];
        memory.direction(new double[]{3.0, -1.0}, d);
        assertThat(d).containsExactly(-3.0, 1.0);
        assertThat(memory.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Stored pair satisfies the secant equation")
    void testSecant() {
        LbfgsMemory memory = LbfgsMemory.allocate(2, 3);
        double[] s = {1.0, 1.0};
        double[] y = {2.0, 4.0};
        assertThat(memory.push(s, y)).isTrue();

        double[] d = new double[2];
        memory.direction(y, d);
        assertThat(d[0]).isCloseTo(-1.0, within(1e-12));
        assertThat(d[1]).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    @DisplayName("Pairs without positive curvature are dropped")
    void testCurvatureCheck() {
        LbfgsMemory memory = LbfgsMemory.allocate(1, 2);
        assertThat(memory.push(new double[]{1.0}, new double[]{-1.0})).isFalse();
        assertThat(memory.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Memory keeps at most the configured number of corrections")
    void testRingBuffer() {
        LbfgsMemory memory = LbfgsMemory.allocate(1, 2);
        for (int k = 1; k <= 5; k++) {
            memory.push(new double[]{k}, new double[]{2.0 * k});
        }
        double[] d = new double[1];
        // Every pair has curvature 2, so H = 1/2
        memory.direction(new double[]{4.0}, d);
        assertThat(d[0]).isCloseTo(-2.0, within(1e-12));
        memory.reset();
        assertThat(memory.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Allocation validates its sizes")
    void testAllocate() {
        assertThatThrownBy(() -> LbfgsMemory.allocate(0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LbfgsMemory.allocate(3, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(LbfgsMemory.allocate(3, 5).getCorrections()).isEqualTo(5);
    }
}
