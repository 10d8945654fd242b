/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Read-only subscriber to optimization progress.
 * <p>
 * Observers see immutable events only and nothing they return is consumed,
 * so they cannot influence a run. A fault thrown from any callback is logged
 * by the channel and otherwise ignored. With parallel multi-start runs the
 * callbacks of different runs may interleave, but the channel never invokes an
 * observer concurrently.
 * </p>
 */
public interface ProgressObserver extends AutoCloseable {
    
    default void onStart(StartEvent event) {}
    
    default void onStep(StepEvent event) {}
    
    /**
     * Called right after {@link #onStep(StepEvent)} for a delivered step that
     * improved its run's best candidate.
     * @param event Improving step
     */
    default void onBest(StepEvent event) {}
    
    default void onEnd(EndEvent event) {}
    
    /**
     * Called once after the last run of an invocation.
     */
    @Override
    default void close() {}
}
