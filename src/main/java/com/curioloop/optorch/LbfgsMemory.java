/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optorch;

/**
 * Ring buffer of L-BFGS correction pairs with the two-loop recursion.
 * <p>
 * Holds the most recent {@code m} pairs {@code (s, y)} of an
 * {@code n}-dimensional problem; the oldest pair is overwritten first.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>. Every run allocates its own memory.
 * </p>
 */
final class LbfgsMemory {
    
    private final int n;
    private final int m;
    private final double[][] s;
    private final double[][] y;
    private final double[] rho;
    private final double[] alpha;
    private int head;
    private int size;
    
    private LbfgsMemory(int n, int m) {
        this.n = n;
        this.m = m;
        this.s = new double[m][n];
        this.y = new double[m][n];
        this.rho = new double[m];
        this.alpha = new double[m];
    }
    
    /**
     * Allocates memory for a problem.
     * @param n Problem dimension (must be positive)
     * @param m Number of corrections (must be positive, typically 3-20)
     * @return New memory
     */
    static LbfgsMemory allocate(int n, int m) {
        if (n <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        if (m <= 0) {
            throw new IllegalArgumentException("Corrections must be positive");
        }
        return new LbfgsMemory(n, m);
    }
    
    int getDimension() {
        return n;
    }
    
    int getCorrections() {
        return m;
    }
    
    boolean isEmpty() {
        return size == 0;
    }
    
    void reset() {
        head = 0;
        size = 0;
    }
    
    /**
     * Stores a correction pair.
     * @param sk Step
     * @param yk Gradient change
     * @return false if the pair violates the curvature condition and was dropped
     */
    boolean push(double[] sk, double[] yk) {
        double sy = dot(sk, yk);
        double yy = dot(yk, yk);
        if (!(sy > Math.ulp(1.0) * yy)) {
            return false;
        }
        System.arraycopy(sk, 0, s[head], 0, n);
        System.arraycopy(yk, 0, y[head], 0, n);
        rho[head] = 1.0 / sy;
        head = (head + 1) % m;
        size = Math.min(size + 1, m);
        return true;
    }
    
    /**
     * Computes the quasi-Newton direction {@code d = -H g}.
     * @param g Gradient
     * @param d Output direction
     */
    void direction(double[] g, double[] d) {
        for (int i = 0; i < n; i++) {
            d[i] = g[i];
        }
        int newest = (head - 1 + m) % m;
        for (int k = 0; k < size; k++) {
            int j = (newest - k + m) % m;
            alpha[j] = rho[j] * dot(s[j], d);
            axpy(-alpha[j], y[j], d);
        }
        double gamma = 1.0;
        if (size > 0) {
            gamma = 1.0 / (rho[newest] * dot(y[newest], y[newest]));
        }
        for (int i = 0; i < n; i++) {
            d[i] *= gamma;
        }
        for (int k = size - 1; k >= 0; k--) {
            int j = (newest - k + m) % m;
            double beta = rho[j] * dot(y[j], d);
            axpy(alpha[j] - beta, s[j], d);
        }
        for (int i = 0; i < n; i++) {
            d[i] = -d[i];
        }
    }
    
    static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
    
    private static void axpy(double a, double[] x, double[] y) {
        for (int i = 0; i < x.length; i++) {
            y[i] += a * x[i];
        }
    }
}
