/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Lazily created, shared pure-Java backends.
 * <p>Backends are stateless, so one instance of each serves every run.</p>
 */
final class BuiltinSolverLibrary implements SolverLibrary {
    
    static final BuiltinSolverLibrary INSTANCE = new BuiltinSolverLibrary();
    
    private final Object lock = new Object();
    private volatile LbfgsbBackend lbfgsb;
    private volatile AugmentedLagrangianBackend auglag;
    private volatile NelderMeadBackend nelderMead;
    
    private BuiltinSolverLibrary() {}
    
    @Override
    public SolverBackend backend(String name) {
        if (name == null) {
            throw new SolverUnavailableException(null, "Backend name is required");
        }
        switch (name) {
            case LBFGSB:
                return lbfgsb();
            case AUGLAG:
                if (auglag == null) {
                    synchronized (lock) {
                        if (auglag == null) {
                            auglag = new AugmentedLagrangianBackend(lbfgsb());
                        }
                    }
                }
                return auglag;
            case NELDER_MEAD:
                if (nelderMead == null) {
                    synchronized (lock) {
                        if (nelderMead == null) {
                            nelderMead = new NelderMeadBackend();
                        }
                    }
                }
                return nelderMead;
            default:
                throw new SolverUnavailableException(name, "Unknown solver backend: " + name);
        }
    }
    
    private LbfgsbBackend lbfgsb() {
        if (lbfgsb == null) {
            synchronized (lock) {
                if (lbfgsb == null) {
                    lbfgsb = new LbfgsbBackend();
                }
            }
        }
        return lbfgsb;
    }
}
