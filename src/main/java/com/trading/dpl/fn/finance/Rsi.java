package com.trading.dpl.fn.finance;

import com.trading.dpl.fn.Fn1;

/**
 * Relative Strength Index (RSI).
 *
 * Uses Wilder's Smoothing for Avg Gain/Loss, seeded with the simple average
 * of the first {@code period} price changes.
 * RSI = 100 - (100 / (1 + RS))
 * RS = AvgGain / AvgLoss
 */
public class Rsi implements Fn1 {
    private final int period;
    private double avgGain;
    private double avgLoss;
    private double prevPrice;
    private int changes = 0;
    private boolean initialized = false;

    public Rsi(int period) {
        if (period < 1)
            throw new IllegalArgumentException("Period must be >= 1");
        this.period = period;
    }

    @Override
    public double apply(double input) {
        if (Double.isNaN(input)) {
            return Double.NaN;
        }

        if (!initialized) {
            prevPrice = input;
            initialized = true;
            return 50.0; // Start at neutral
        }

        double change = input - prevPrice;
        prevPrice = input;

        double gain = Math.max(0, change);
        double loss = Math.max(0, -change);

        if (changes < period) {
            changes++;
            avgGain += (gain - avgGain) / changes;
            avgLoss += (loss - avgLoss) / changes;
        } else {
            // Wilder's Smoothing: newAvg = (oldAvg * (N - 1) + newVal) / N
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgLoss == 0) {
            return (avgGain == 0) ? 50.0 : 100.0;
        }

        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    public boolean isWarm() {
        return changes >= period;
    }
}
