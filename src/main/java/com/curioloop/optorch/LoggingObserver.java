/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/**
 * Writes one log line per delivered step, plus run start and end.
 * <p>
 * Configuration: optional {@code level}, {@code info} (default) or {@code debug}.
 * </p>
 */
public final class LoggingObserver implements ProgressObserver {
    
    private static final Logger log = LoggerFactory.getLogger(LoggingObserver.class);
    
    private final boolean debug;
    
    public LoggingObserver() {
        this(Collections.emptyMap());
    }
    
    /**
     * Creates the observer from registry configuration.
     * @param config Configuration
     * @throws ConfigurationException on unknown keys or levels
     */
    public LoggingObserver(Map<String, Object> config) {
        String level = "info";
        for (Map.Entry<String, Object> e : config.entrySet()) {
            if (!e.getKey().equals("level")) {
                throw new ConfigurationException("Unknown logging observer option: " + e.getKey());
            }
            level = String.valueOf(e.getValue()).trim().toLowerCase();
        }
        if (!level.equals("info") && !level.equals("debug")) {
            throw new ConfigurationException("Logging observer level must be 'info' or 'debug', got " + level);
        }
        this.debug = level.equals("debug");
    }
    
    @Override
    public void onStart(StartEvent event) {
        write("[optimize] run={} start strategy={} x0={} bounds={}",
            event.getRunIndex(), event.getStrategy(), Arrays.toString(event.getSeed()), event.getBounds());
    }
    
    @Override
    public void onStep(StepEvent event) {
        Candidate c = event.getCandidate();
        write("[optimize] run={} iter={} x={} f={} feas={} viol={}",
            event.getRunIndex(), event.getIteration(), Arrays.toString(c.getX()),
            c.getValue(), c.isFeasible(), c.getViolation());
    }
    
    @Override
    public void onEnd(EndEvent event) {
        write("[optimize] run={} end reason={} f={}",
            event.getRunIndex(), event.getTermination().getReason(), event.getResult().getCandidate().getValue());
    }
    
    private void write(String format, Object... args) {
        if (debug) {
            log.debug(format, args);
        } else {
            log.info(format, args);
        }
    }
}
