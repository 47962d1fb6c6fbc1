package com.trading.dpl.fn.finance;

import com.trading.dpl.fn.Fn1;

/**
 * Moving Average Convergence Divergence (MACD).
 *
 * Returns the "MACD Line" (Fast EMA - Slow EMA). The signal line is an EMA of
 * the MACD line once the slow average is warm; see {@link #signal()}.
 */
public class Macd implements Fn1 {
    private final Ewma fast;
    private final Ewma slow;
    private final Ewma signal;
    private double lastSignal = Double.NaN;

    public Macd(int fastPeriod, int slowPeriod, int signalPeriod) {
        this.fast = new Ewma(fastPeriod);
        this.slow = new Ewma(slowPeriod);
        this.signal = new Ewma(signalPeriod);
    }

    @Override
    public double apply(double input) {
        double f = fast.apply(input);
        double s = slow.apply(input);
        double line = f - s;
        if (slow.isWarm())
            lastSignal = signal.apply(line);
        return line;
    }

    /** Signal line after the last observation, NaN until the slow average is warm. */
    public double signal() {
        return lastSignal;
    }
}
