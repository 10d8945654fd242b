/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Unwinds a solver from wherever a stop verdict was reached.
 */
final class TerminationSignal extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final transient TerminationResult result;
    
    TerminationSignal(TerminationResult result) {
        super(result.getReason().getLabel(), null, false, false);
        this.result = result;
    }
    
    TerminationResult getResult() {
        return result;
    }
}
