package com.trading.dpl.fn.finance;

import com.trading.dpl.fn.Fn1;

/**
 * Rolling Minimum over a window. Mirror of {@link RollingMax}.
 */
public class RollingMin implements Fn1 {
    private final double[] window;
    private final int size;
    private int head = 0;
    private int count = 0;

    public RollingMin(int size) {
        if (size < 1)
            throw new IllegalArgumentException("Size must be >= 1");
        this.size = size;
        this.window = new double[size];
    }

    @Override
    public double apply(double input) {
        if (Double.isNaN(input)) {
            return Double.NaN;
        }

        window[head] = input;
        head++;
        if (head >= size) {
            head = 0;
        }

        if (count < size) {
            count++;
        }

        double min = Double.MAX_VALUE;
        for (int i = 0; i < count; i++) {
            if (window[i] < min) {
                min = window[i];
            }
        }
        return min;
    }
}
