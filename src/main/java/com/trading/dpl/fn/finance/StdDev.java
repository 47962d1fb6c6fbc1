package com.trading.dpl.fn.finance;

import com.trading.dpl.fn.Fn1;

/**
 * Rolling population standard deviation.
 *
 * Uses a two-stage approach for numerical stability:
 * - Stage 1 (O(1)): Maintains a rolling sum to compute the mean cheaply.
 * - Stage 2 (O(N)): Computes variance by summing (x - mean)^2 over the window.
 *
 * This avoids the catastrophic cancellation of Var = (Sum(x^2) / N) - mean^2
 * when prices are large relative to their variance.
 */
public class StdDev implements Fn1 {
    private final double[] window;
    private final int size;
    private int head = 0;
    private int count = 0;

    private double sum = 0.0;

    public StdDev(int size) {
        if (size < 1)
            throw new IllegalArgumentException("Size must be >= 1");
        this.size = size;
        this.window = new double[size];
    }

    @Override
    public double apply(double x) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }

        // 1. Evict oldest element from rolling sum
        if (count >= size) {
            sum -= window[head];
        } else {
            count++;
        }

        // 2. Insert new value
        window[head] = x;
        sum += x;

        head++;
        if (head >= size)
            head = 0;

        // 3. Sum of squared deviations over the filled portion of the buffer
        double mean = sum / count;
        double sumSq = 0.0;
        int start = (head + size - count) % size;
        for (int i = 0; i < count; i++) {
            double dev = window[(start + i) % size] - mean;
            sumSq += dev * dev;
        }

        return Math.sqrt(sumSq / count);
    }

    /** Mean of the current window. */
    public double mean() {
        return count == 0 ? Double.NaN : sum / count;
    }
}
