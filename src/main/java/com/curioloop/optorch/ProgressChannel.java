/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fan-out of progress events to observers plus the journal of every event.
 * <p>
 * Every published event is journaled exactly once, whatever the observers do.
 * Step events reach an observer only when one of its throttles is satisfied:
 * </p>
 * <ul>
 *   <li>count: every {@code updateEvery}-th step of a run</li>
 *   <li>time: at least {@code throttleSeconds} since the last step delivered
 *       to that observer for that run</li>
 * </ul>
 * <p>
 * A throttle of zero (or less) is disabled; with both disabled every step is
 * delivered. Start and end events are always delivered. Observers are called
 * in registration order and a fault in one is logged and skipped.
 * </p>
 * <p>
 * Faults cover runtime exceptions and errors such as {@link AssertionError};
 * only a {@link VirtualMachineError} propagates to the publishing run.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Publishing is serialized, so runs executing in parallel may share one
 * channel. Per-run ordering is preserved; runs may interleave.
 * </p>
 */
public final class ProgressChannel implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);
    
    private final Clock clock;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final List<HistoryRecord> journal = new ArrayList<>();
    private final Object lock = new Object();
    
    public ProgressChannel() {
        this(Clock.systemUTC());
    }
    
    /**
     * Creates a channel with an explicit clock for timestamps and time throttles.
     * @param clock Clock
     */
    public ProgressChannel(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.clock = clock;
    }
    
    /**
     * Registers an observer that receives every event.
     * @param observer Observer
     */
    public void register(ProgressObserver observer) {
        register(observer, 0.0, 0);
    }
    
    /**
     * Registers an observer with step throttling.
     * @param observer Observer
     * @param throttleSeconds Minimum seconds between delivered steps of a run (0 disables)
     * @param updateEvery Deliver every n-th step of a run (0 disables)
     */
    public void register(ProgressObserver observer, double throttleSeconds, int updateEvery) {
        if (observer == null) {
            throw new ConfigurationException("Observer cannot be null");
        }
        if (!(throttleSeconds >= 0) || Double.isInfinite(throttleSeconds)) {
            throw new ConfigurationException("Throttle seconds must be non-negative and finite");
        }
        if (updateEvery < 0) {
            throw new ConfigurationException("Update-every count must be non-negative");
        }
        synchronized (lock) {
            subscriptions.add(new Subscription(observer, throttleSeconds, updateEvery));
        }
    }
    
    /**
     * Publishes a start event.
     * @param runIndex Run index
     * @param seed Starting point
     * @param bounds Variable bounds of the run
     * @param strategy Strategy name
     */
    public void start(int runIndex, double[] seed, Bounds bounds, String strategy) {
        publish(new StartEvent(runIndex, clock.instant(), seed, bounds, strategy));
    }
    
    /**
     * Publishes a step event.
     * @param runIndex Run index
     * @param iteration Iteration number
     * @param candidate Accepted point
     * @param metrics Cumulative metrics
     * @param improved Whether the step improved the run's best candidate
     */
    public void step(int runIndex, int iteration, Candidate candidate, RunMetrics metrics, boolean improved) {
        publish(new StepEvent(runIndex, clock.instant(), iteration, candidate, metrics, improved));
    }
    
    /**
     * Publishes an end event.
     * @param result Run result
     * @param iteration Last emitted iteration
     */
    public void end(RunResult result, int iteration) {
        publish(new EndEvent(clock.instant(), result, iteration));
    }
    
    /**
     * Journals an event and delivers it to the observers.
     * @param event Event
     */
    public void publish(ProgressEvent event) {
        synchronized (lock) {
            journal.add(event.toRecord());
            for (Subscription s : subscriptions) {
                s.deliver(event);
            }
        }
    }
    
    /**
     * Gets every journaled record in publication order.
     * @return Snapshot of the journal
     */
    public List<HistoryRecord> journal() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(journal));
        }
    }
    
    /**
     * Gets the step records in publication order.
     * @return Snapshot of the step history
     */
    public List<HistoryRecord> history() {
        synchronized (lock) {
            List<HistoryRecord> steps = new ArrayList<>();
            for (HistoryRecord r : journal) {
                if (r.getKind() == ProgressEvent.Kind.STEP) {
                    steps.add(r);
                }
            }
            return Collections.unmodifiableList(steps);
        }
    }
    
    /**
     * Closes every observer, each in its own failure boundary.
     */
    @Override
    public void close() {
        synchronized (lock) {
            for (Subscription s : subscriptions) {
                try {
                    s.observer.close();
                } catch (Exception | Error e) {
                    rethrowFatal(e);
                    log.warn("[optimize] observer {} failed to close", s.observer.getClass().getSimpleName(), e);
                }
            }
        }
    }
    
    private static void rethrowFatal(Throwable t) {
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        }
    }
    
    /**
     * An observer with its per-run throttle state.
     */
    private static final class Subscription {
        private final ProgressObserver observer;
        private final Duration throttle;
        private final int updateEvery;
        private final Map<Integer, Integer> counts = new HashMap<>();
        private final Map<Integer, Instant> lastDelivered = new HashMap<>();
        
        Subscription(ProgressObserver observer, double throttleSeconds, int updateEvery) {
            this.observer = observer;
            this.throttle = throttleSeconds > 0 ? Duration.ofNanos((long) (throttleSeconds * 1e9)) : null;
            this.updateEvery = updateEvery;
        }
        
        void deliver(ProgressEvent event) {
            try {
                switch (event.getKind()) {
                    case START:
                        observer.onStart((StartEvent) event);
                        break;
                    case STEP:
                        StepEvent step = (StepEvent) event;
                        if (admit(step)) {
                            observer.onStep(step);
                            if (step.isImproved()) {
                                observer.onBest(step);
                            }
                        }
                        break;
                    case END:
                        observer.onEnd((EndEvent) event);
                        break;
                    default:
                        throw new IllegalStateException("Unknown event kind: " + event.getKind());
                }
            } catch (RuntimeException | Error e) {
                rethrowFatal(e);
                log.warn("[optimize] observer {} failed on {} event of run {}",
                    observer.getClass().getSimpleName(), event.getKind().getLabel(), event.getRunIndex(), e);
            }
        }
        
        private boolean admit(StepEvent step) {
            int run = step.getRunIndex();
            int count = counts.merge(run, 1, Integer::sum);
            boolean byCount = updateEvery > 0 && count % updateEvery == 0;
            Instant last = lastDelivered.get(run);
            boolean byTime = throttle != null
                && (last == null || Duration.between(last, step.getTimestamp()).compareTo(throttle) >= 0);
            boolean admitted = (updateEvery <= 0 && throttle == null) || byCount || byTime;
            if (admitted) {
                lastDelivered.put(run, step.getTimestamp());
            }
            return admitted;
        }
    }
}
