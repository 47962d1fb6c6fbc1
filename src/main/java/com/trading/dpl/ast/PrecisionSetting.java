package com.trading.dpl.ast;

/**
 * Number of decimal places Decimal results are rounded to.
 */
public record PrecisionSetting(int scale) {
    public PrecisionSetting {
        if (scale < 0)
            throw new IllegalArgumentException("Precision scale must be >= 0");
    }
}
