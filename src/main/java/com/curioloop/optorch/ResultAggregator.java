/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes a report to an {@link OutputStore} under the {@code optimizer.*} keys.
 * <table>
 *   <caption>Output keys</caption>
 *   <tr><td>{@code optimizer.strategy}</td><td>strategy name</td></tr>
 *   <tr><td>{@code optimizer.params}</td><td>{@code {bounds, termination, strategy}}</td></tr>
 *   <tr><td>{@code optimizer.history}</td><td>step records of every run</td></tr>
 *   <tr><td>{@code optimizer.runs}</td><td>{@code {x, value, feasible, meta}} per run</td></tr>
 *   <tr><td>{@code optimizer.best_candidate}</td><td>{@code {x, value, feasible, meta}}</td></tr>
 *   <tr><td>{@code optimizer.termination}</td><td>{@code {reason, metrics, budget}} of the best run</td></tr>
 *   <tr><td>{@code optimizer.events}</td><td>start, step and end records</td></tr>
 * </table>
 */
public final class ResultAggregator {
    
    public static final String STRATEGY = "optimizer.strategy";
    public static final String PARAMS = "optimizer.params";
    public static final String HISTORY = "optimizer.history";
    public static final String RUNS = "optimizer.runs";
    public static final String BEST_CANDIDATE = "optimizer.best_candidate";
    public static final String TERMINATION = "optimizer.termination";
    public static final String EVENTS = "optimizer.events";
    
    private ResultAggregator() {}
    
    /**
     * Writes every output key.
     * @param store Destination
     * @param report Report
     */
    public static void write(OutputStore store, OptimizationReport report) {
        List<Map<String, Object>> runs = new ArrayList<>(report.getRuns().size());
        for (RunResult r : report.getRuns()) {
            runs.add(r.toMap());
        }
        store.set(STRATEGY, report.getStrategy());
        store.set(PARAMS, report.getParams());
        store.set(HISTORY, render(report.getHistory()));
        store.set(RUNS, Collections.unmodifiableList(runs));
        store.set(BEST_CANDIDATE, report.getBestRun().toMap());
        store.set(TERMINATION, report.getTermination().toMap());
        store.set(EVENTS, render(report.getEvents()));
    }
    
    private static List<Map<String, Object>> render(List<HistoryRecord> records) {
        List<Map<String, Object>> out = new ArrayList<>(records.size());
        for (HistoryRecord r : records) {
            out.add(r.toMap());
        }
        return Collections.unmodifiableList(out);
    }
}
