/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Observer that records callback names in order.
 */
class RecordingObserver implements ProgressObserver {

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<StepEvent> steps = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean closed;

    @Override
    public void onStart(StartEvent event) {
        calls.add("start:" + event.getRunIndex());
    }

    @Override
    public void onStep(StepEvent event) {
        calls.add("step:" + event.getRunIndex() + ":" + event.getIteration());
        steps.add(event);
    }

    @Override
    public void onBest(StepEvent event) {
        calls.add("best:" + event.getRunIndex() + ":" + event.getIteration());
    }

    @Override
    public void onEnd(EndEvent event) {
        calls.add("end:" + event.getRunIndex());
    }

    @Override
    public void close() {
        closed = true;
    }

    List<String> calls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    List<StepEvent> steps() {
        synchronized (steps) {
            return new ArrayList<>(steps);
        }
    }

    long count(String prefix) {
        return calls().stream().filter(c -> c.startsWith(prefix)).count();
    }

    boolean isClosed() {
        return closed;
    }
}
