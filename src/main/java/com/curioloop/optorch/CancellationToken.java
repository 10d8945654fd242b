/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared flag an external caller sets to cancel every run of an invocation.
 * <p>
 * Runs check the flag at the top of each solver iteration, never in the
 * middle of an evaluation.
 * </p>
 */
public final class CancellationToken {
    
    private final AtomicBoolean cancelled = new AtomicBoolean();
    
    /**
     * Requests cancellation.
     * @return true if this call changed the state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
    
    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + '}';
    }
}
