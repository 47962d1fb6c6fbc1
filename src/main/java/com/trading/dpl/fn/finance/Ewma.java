package com.trading.dpl.fn.finance;

import com.trading.dpl.fn.Fn1;

/**
 * Exponential Moving Average.
 *
 * Formula:
 * y[t] = alpha * x[t] + (1 - alpha) * y[t-1], alpha = 2 / (period + 1)
 *
 * The first {@code period} observations seed the state with their simple
 * average; before that the running simple average is returned.
 */
public class Ewma implements Fn1 {
    private final double alpha;
    private final Sma seed;
    private double state;
    private boolean initialized = false;

    public Ewma(int period) {
        if (period < 1)
            throw new IllegalArgumentException("Period must be >= 1");
        this.alpha = 2.0 / (period + 1);
        this.seed = new Sma(period);
    }

    @Override
    public double apply(double input) {
        if (Double.isNaN(input)) {
            return Double.NaN;
        }

        if (!initialized) {
            state = seed.apply(input);
            initialized = seed.isFull();
            return state;
        }

        state = alpha * input + (1.0 - alpha) * state;
        return state;
    }

    /** True once the seeding window is complete. */
    public boolean isWarm() {
        return initialized;
    }
}
