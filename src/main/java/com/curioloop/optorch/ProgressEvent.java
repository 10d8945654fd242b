/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.time.Instant;

/**
 * Notification published on the {@link ProgressChannel}.
 */
public abstract class ProgressEvent {
    
    /**
     * Event kinds.
     */
    public enum Kind {
        START("start"),
        STEP("step"),
        END("end");
        
        private final String label;
        
        Kind(String label) {
            this.label = label;
        }
        
        public String getLabel() {
            return label;
        }
    }
    
    private final Kind kind;
    private final int runIndex;
    private final Instant timestamp;
    
    ProgressEvent(Kind kind, int runIndex, Instant timestamp) {
        this.kind = kind;
        this.runIndex = runIndex;
        this.timestamp = timestamp;
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public int getRunIndex() {
        return runIndex;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    /**
     * Converts the event to its journal entry.
     * @return History record
     */
    public abstract HistoryRecord toRecord();
}
