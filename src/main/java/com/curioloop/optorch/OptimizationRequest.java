/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable description of one optimization invocation.
 * <p>
 * Everything that can be wrong with a request is reported by
 * {@link Builder#build()} as a {@link ConfigurationException}, before any
 * objective evaluation.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * OptimizationRequest request = OptimizationRequest.builder()
 *     .strategy("local")
 *     .model(ExampleModels.parabola(3.0))
 *     .x0(0.0)
 *     .bounds(new double[][]{{-100, 100}})
 *     .termination(Termination.builder().maxEvaluations(100).build())
 *     .build();
 *
 * OptimizationReport report = Optimizer.optimize(request);
 * }</pre>
 */
public final class OptimizationRequest {
    
    private final Strategy strategy;
    private final Problem problem;
    private final List<double[]> seeds;
    private final List<Registration> observers;
    private final int parallelism;
    private final CancellationToken cancellation;
    private final Clock clock;
    
    private OptimizationRequest(Strategy strategy, Problem problem, List<double[]> seeds,
                                List<Registration> observers, int parallelism,
                                CancellationToken cancellation, Clock clock) {
        this.strategy = strategy;
        this.problem = problem;
        this.seeds = seeds;
        this.observers = observers;
        this.parallelism = parallelism;
        this.cancellation = cancellation;
        this.clock = clock;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public Strategy getStrategy() {
        return strategy;
    }
    
    public Problem getProblem() {
        return problem;
    }
    
    /**
     * Gets the seeds, one run each.
     * @return Copies of the starting points
     */
    public List<double[]> getSeeds() {
        List<double[]> out = new ArrayList<>(seeds.size());
        for (double[] s : seeds) {
            out.add(s.clone());
        }
        return out;
    }
    
    List<Registration> getObservers() {
        return observers;
    }
    
    public int getParallelism() {
        return parallelism;
    }
    
    public CancellationToken getCancellation() {
        return cancellation;
    }
    
    Clock getClock() {
        return clock;
    }
    
    /**
     * Renders the {@code optimizer.params} mapping.
     * @return Bounds, termination and strategy parameters
     */
    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("bounds", problem.getBounds().toList());
        out.put("termination", problem.getTermination().toMap());
        out.put("strategy", strategy.getParams());
        return out;
    }
    
    /**
     * An observer with its resolved throttles.
     */
    static final class Registration {
        final ProgressObserver observer;
        final double throttleSeconds;
        final int updateEvery;
        
        Registration(ProgressObserver observer, double throttleSeconds, int updateEvery) {
            this.observer = observer;
            this.throttleSeconds = throttleSeconds;
            this.updateEvery = updateEvery;
        }
    }
    
    /**
     * Builder for optimization requests.
     */
    public static final class Builder {
        private String strategyName;
        private Map<String, ?> strategyParams;
        private Strategy strategy;
        private SolverLibrary library = SolverLibrary.builtin();
        private final List<double[]> seeds = new ArrayList<>();
        private Bounds bounds = Bounds.none();
        private Termination termination = Termination.defaults();
        private ObjectiveModel model;
        private String modelName;
        private Map<String, ?> modelParams;
        private Controller controller;
        private Constraints constraints = Constraints.none();
        private ViolationRule violationRule = ViolationRule.MAX;
        private double feasibilityTolerance = ConstraintEvaluator.DEFAULT_TOLERANCE;
        private final List<ProgressObserver> observers = new ArrayList<>();
        private final List<ObserverDescriptor> descriptors = new ArrayList<>();
        private ObserverRegistry registry;
        private double throttleSeconds = 0.0;
        private int updateEvery = 0;
        private int parallelism = 1;
        private CancellationToken cancellation;
        private Clock clock = Clock.systemUTC();
        
        private Builder() {}
        
        /**
         * Selects a strategy by name or alias.
         * @param name Strategy name
         * @return This builder
         */
        public Builder strategy(String name) {
            return strategy(name, null);
        }
        
        /**
         * Selects a strategy by name with parameters.
         * @param name Strategy name
         * @param params Strategy parameters (may be null)
         * @return This builder
         */
        public Builder strategy(String name, Map<String, ?> params) {
            this.strategyName = name;
            this.strategyParams = params;
            this.strategy = null;
            return this;
        }
        
        /**
         * Uses a strategy instance.
         * @param strategy Strategy
         * @return This builder
         */
        public Builder strategy(Strategy strategy) {
            this.strategy = strategy;
            this.strategyName = null;
            this.strategyParams = null;
            return this;
        }
        
        /**
         * Sets the backend lookup for strategies resolved by name.
         * @param library Solver library
         * @return This builder
         */
        public Builder solverLibrary(SolverLibrary library) {
            if (library == null) {
                throw new ConfigurationException("Solver library cannot be null");
            }
            this.library = library;
            return this;
        }
        
        /**
         * Sets a single starting point.
         * @param x0 Starting point
         * @return This builder
         */
        public Builder x0(double... x0) {
            this.seeds.clear();
            this.seeds.add(requireSeed(x0));
            return this;
        }
        
        /**
         * Sets multi-start seeds.
         * @param seeds Starting points, one run each
         * @return This builder
         */
        public Builder seeds(List<double[]> seeds) {
            if (seeds == null) {
                throw new ConfigurationException("Seeds cannot be null");
            }
            this.seeds.clear();
            for (double[] s : seeds) {
                this.seeds.add(requireSeed(s));
            }
            return this;
        }
        
        private static double[] requireSeed(double[] x) {
            if (x == null || x.length == 0) {
                throw new ConfigurationException("Starting point cannot be null or empty");
            }
            return x.clone();
        }
        
        public Builder bounds(Bounds bounds) {
            this.bounds = bounds != null ? bounds : Bounds.none();
            return this;
        }
        
        /**
         * Sets bounds as {@code [[low, high], ...]} pairs.
         * @param pairs Bound pairs (null means unbounded)
         * @return This builder
         */
        public Builder bounds(double[][] pairs) {
            this.bounds = Bounds.of(pairs);
            return this;
        }
        
        public Builder termination(Termination termination) {
            this.termination = termination != null ? termination : Termination.defaults();
            return this;
        }
        
        /**
         * Sets termination criteria from a configuration mapping.
         * @param config Mapping with {@code max_evals}, {@code ftol_abs}, ... keys
         * @return This builder
         */
        public Builder termination(Map<String, ?> config) {
            this.termination = Termination.fromMap(config);
            return this;
        }
        
        public Builder model(ObjectiveModel model) {
            this.model = model;
            this.modelName = null;
            return this;
        }
        
        /**
         * Uses an example model by name.
         * @param name Model name, see {@link ExampleModels}
         * @param params Model parameters (may be null)
         * @return This builder
         */
        public Builder model(String name, Map<String, ?> params) {
            this.modelName = name;
            this.modelParams = params;
            this.model = null;
            return this;
        }
        
        public Builder controller(Controller controller) {
            this.controller = controller;
            return this;
        }
        
        public Builder constraints(Constraints constraints) {
            this.constraints = constraints != null ? constraints : Constraints.none();
            return this;
        }
        
        public Builder violationRule(ViolationRule rule) {
            this.violationRule = rule;
            return this;
        }
        
        public Builder feasibilityTolerance(double tolerance) {
            this.feasibilityTolerance = tolerance;
            return this;
        }
        
        /**
         * Registers an observer instance using the request-wide throttles.
         * @param observer Observer
         * @return This builder
         */
        public Builder observer(ProgressObserver observer) {
            if (observer == null) {
                throw new ConfigurationException("Observer cannot be null");
            }
            this.observers.add(observer);
            return this;
        }
        
        /**
         * Registers an observer by registry descriptor.
         * @param descriptor Descriptor
         * @return This builder
         */
        public Builder observer(ObserverDescriptor descriptor) {
            if (descriptor == null) {
                throw new ConfigurationException("Observer descriptor cannot be null");
            }
            this.descriptors.add(descriptor);
            return this;
        }
        
        /**
         * Sets the registry descriptors are resolved against.
         * @param registry Registry (default: {@link ObserverRegistry#defaults()})
         * @return This builder
         */
        public Builder observerRegistry(ObserverRegistry registry) {
            this.registry = registry;
            return this;
        }
        
        /**
         * Sets the default minimum seconds between delivered steps.
         * @param seconds Seconds (0 disables)
         * @return This builder
         */
        public Builder progressThrottleSeconds(double seconds) {
            this.throttleSeconds = seconds;
            return this;
        }
        
        /**
         * Sets the default step interval for observers.
         * @param every Deliver every n-th step (0 disables)
         * @return This builder
         */
        public Builder progressUpdateEvery(int every) {
            this.updateEvery = every;
            return this;
        }
        
        /**
         * Sets how many runs may execute concurrently.
         * @param parallelism Maximum concurrent runs (must be positive)
         * @return This builder
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new ConfigurationException("Parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }
        
        public Builder cancellation(CancellationToken token) {
            this.cancellation = token;
            return this;
        }
        
        /**
         * Sets the clock used for event timestamps and time throttles.
         * @param clock Clock
         * @return This builder
         */
        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new ConfigurationException("Clock cannot be null");
            }
            this.clock = clock;
            return this;
        }
        
        /**
         * Validates and builds the request.
         * @return Request
         * @throws ConfigurationException if anything is missing or inconsistent
         */
        public OptimizationRequest build() {
            if (seeds.isEmpty()) {
                throw new ConfigurationException("A starting point or seeds are required");
            }
            int dimension = seeds.get(0).length;
            for (int i = 1; i < seeds.size(); i++) {
                if (seeds.get(i).length != dimension) {
                    throw new ConfigurationException("Seed " + i + " has dimension " + seeds.get(i).length
                        + ", expected " + dimension);
                }
            }
            Strategy resolved = strategy;
            if (resolved == null) {
                resolved = StrategyFactory.create(strategyName, strategyParams, library);
            }
            ObjectiveModel resolvedModel = model;
            if (resolvedModel == null && modelName != null) {
                resolvedModel = ExampleModels.create(modelName, modelParams);
            }
            Problem problem = Problem.builder()
                .dimension(dimension)
                .model(resolvedModel)
                .controller(controller)
                .bounds(bounds)
                .constraints(constraints)
                .violationRule(violationRule)
                .feasibilityTolerance(feasibilityTolerance)
                .termination(termination)
                .build();
            for (int i = 0; i < seeds.size(); i++) {
                problem.requireDimension(seeds.get(i), "Seed " + i);
            }
            
            if (!(throttleSeconds >= 0) || Double.isInfinite(throttleSeconds)) {
                throw new ConfigurationException("Progress throttle seconds must be non-negative and finite");
            }
            if (updateEvery < 0) {
                throw new ConfigurationException("Progress update-every must be non-negative");
            }
            List<Registration> registrations = new ArrayList<>();
            for (ProgressObserver o : observers) {
                registrations.add(new Registration(o, throttleSeconds, updateEvery));
            }
            ObserverRegistry observerRegistry = registry != null ? registry : ObserverRegistry.defaults();
            for (ObserverDescriptor d : descriptors) {
                registrations.add(new Registration(observerRegistry.create(d),
                    d.getThrottleSeconds() != null ? d.getThrottleSeconds() : throttleSeconds,
                    d.getUpdateEvery() != null ? d.getUpdateEvery() : updateEvery));
            }
            
            List<double[]> copies = new ArrayList<>(seeds.size());
            for (double[] s : seeds) {
                copies.add(s.clone());
            }
            return new OptimizationRequest(resolved, problem, Collections.unmodifiableList(copies),
                Collections.unmodifiableList(registrations), parallelism,
                cancellation != null ? cancellation : new CancellationToken(), clock);
        }
    }
}
