/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Augmented Lagrangian (Powell-Hestenes-Rockafellar) driver for problems with
 * inequality and equality constraints.
 * <p>
 * Solves
 * </p>
 * <pre>
 *   minimize f(x)
 *   subject to g(x) <= 0, h(x) = 0, l <= x <= u
 * </pre>
 * <p>
 * by a sequence of bound-constrained subproblems on
 * </p>
 * <pre>
 *   L(x) = f(x) + (rho/2) sum max(0, g_i + lambda_i/rho)^2 - (lambda_i/rho)^2
 *               + sum mu_j h_j + (rho/2) h_j^2
 * </pre>
 * <p>
 * each solved by {@link LbfgsbBackend}. Multipliers are updated after every
 * subproblem; the penalty grows tenfold whenever the constraint residual fails
 * to shrink to a quarter of its previous value. Constraint Jacobians are taken
 * by central differences and do not consume the evaluation budget.
 * </p>
 */
public final class AugmentedLagrangianBackend implements SolverBackend {
    
    private static final Logger log = LoggerFactory.getLogger(AugmentedLagrangianBackend.class);
    
    private static final double PENALTY_GROWTH = 10.0;
    private static final double MAX_PENALTY = 1e8;
    private static final double REQUIRED_DECREASE = 0.25;
    
    private final LbfgsbBackend inner;
    
    AugmentedLagrangianBackend(LbfgsbBackend inner) {
        this.inner = inner;
    }
    
    @Override
    public String getName() {
        return SolverLibrary.AUGLAG;
    }
    
    /**
     * Minimizes the objective subject to the session's constraints.
     * @param session Run session
     * @param objective Objective merit (value and gradient of f)
     * @param start Starting trial
     * @param local Settings of the bound-constrained subproblem solver
     * @param settings Outer loop settings
     * @return Termination record
     */
    public TerminationResult minimize(SearchSession session, MeritFunction objective, Trial start,
                                      LbfgsbBackend.Settings local, Settings settings) {
        ConstraintEvaluator constraints = session.getProblem().getConstraints();
        Feasibility initial = start.getFeasibility();
        double[] lambda = new double[initial.inequalityCount()];
        double[] mu = new double[initial.equalityCount()];
        double rho = settings.getPenalty();
        double previous = Double.POSITIVE_INFINITY;
        Trial current = start;
        
        for (int outer = 0; outer < settings.getMaxOuter(); outer++) {
            Lagrangian merit = new Lagrangian(objective, constraints, lambda.clone(), mu.clone(), rho);
            LbfgsbBackend.Descent descent = inner.descend(session, merit, current, local);
            current = descent.trial;
            
            Feasibility feasibility = current.getFeasibility();
            double residual = 0.0;
            for (int i = 0; i < lambda.length; i++) {
                double gi = feasibility.inequality(i);
                residual = Math.max(residual, Math.max(0.0, gi));
                lambda[i] = Math.max(0.0, lambda[i] + rho * gi);
            }
            for (int j = 0; j < mu.length; j++) {
                double hj = feasibility.equality(j);
                residual = Math.max(residual, Math.abs(hj));
                mu[j] += rho * hj;
            }
            log.debug("[optimize] run={} outer={} rho={} residual={}", session.getRunIndex(), outer, rho, residual);
            
            if (feasibility.isFeasible() && descent.converged) {
                return session.finish(StopReason.CONVERGED, "Constraints satisfied at a stationary point");
            }
            if (residual > REQUIRED_DECREASE * previous) {
                rho = Math.min(rho * PENALTY_GROWTH, MAX_PENALTY);
            }
            previous = residual;
        }
        return session.finish(current.getCandidate().isFeasible() ? StopReason.CONVERGED : StopReason.FAILED,
            "Outer iteration limit reached");
    }
    
    /**
     * Augmented Lagrangian for fixed multipliers and penalty.
     */
    private static final class Lagrangian implements MeritFunction {
        private final MeritFunction objective;
        private final ConstraintEvaluator constraints;
        private final double[] lambda;
        private final double[] mu;
        private final double rho;
        
        Lagrangian(MeritFunction objective, ConstraintEvaluator constraints,
                   double[] lambda, double[] mu, double rho) {
            this.objective = objective;
            this.constraints = constraints;
            this.lambda = lambda;
            this.mu = mu;
            this.rho = rho;
        }
        
        @Override
        public double value(Trial trial) {
            Feasibility fz = trial.getFeasibility();
            double value = objective.value(trial);
            for (int i = 0; i < lambda.length; i++) {
                double shifted = Math.max(0.0, fz.inequality(i) + lambda[i] / rho);
                double base = lambda[i] / rho;
                value += 0.5 * rho * (shifted * shifted - base * base);
            }
            for (int j = 0; j < mu.length; j++) {
                double hj = fz.equality(j);
                value += mu[j] * hj + 0.5 * rho * hj * hj;
            }
            return value;
        }
        
        @Override
        public void gradient(Trial trial, double[] g) {
            objective.gradient(trial, g);
            Feasibility fz = trial.getFeasibility();
            double[] weights = new double[lambda.length];
            boolean active = false;
            for (int i = 0; i < lambda.length; i++) {
                weights[i] = rho * Math.max(0.0, fz.inequality(i) + lambda[i] / rho);
                active |= weights[i] != 0.0;
            }
            if (active) {
                accumulate(NumericalGradient.CENTRAL.jacobian(constraints::inequalityValues,
                    trial.getX(), fz.getInequalityValues()), weights, g);
            }
            if (mu.length > 0) {
                double[] eq = new double[mu.length];
                for (int j = 0; j < mu.length; j++) {
                    eq[j] = mu[j] + rho * fz.equality(j);
                }
                accumulate(NumericalGradient.CENTRAL.jacobian(constraints::equalityValues,
                    trial.getX(), fz.getEqualityValues()), eq, g);
            }
        }
        
        private static void accumulate(double[][] jacobian, double[] weights, double[] g) {
            for (int k = 0; k < weights.length; k++) {
                if (weights[k] == 0.0) continue;
                for (int i = 0; i < g.length; i++) {
                    g[i] += weights[k] * jacobian[k][i];
                }
            }
        }
    }
    
    /**
     * Outer loop tunables.
     */
    public static final class Settings {
        private final double penalty;
        private final int maxOuter;
        
        /**
         * Creates settings.
         * @param penalty Initial penalty (must be positive)
         * @param maxOuter Maximum number of subproblems (must be positive)
         */
        public Settings(double penalty, int maxOuter) {
            if (!(penalty > 0) || Double.isInfinite(penalty)) {
                throw new ConfigurationException("Penalty must be positive and finite");
            }
            if (maxOuter <= 0) {
                throw new ConfigurationException("Max outer iterations must be positive");
            }
            this.penalty = penalty;
            this.maxOuter = maxOuter;
        }
        
        public double getPenalty() {
            return penalty;
        }
        
        public int getMaxOuter() {
            return maxOuter;
        }
    }
}
