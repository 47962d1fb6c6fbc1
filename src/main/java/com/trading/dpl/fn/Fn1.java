package com.trading.dpl.fn;

/**
 * Stateful scalar transform fed one observation at a time.
 *
 * <p>
 * Rolling indicators implement this so a series can be folded through them:
 * the value returned for the last observation is the indicator's value for
 * the series.
 */
@FunctionalInterface
public interface Fn1 {
    /**
     * Consumes the next observation.
     *
     * @param a The input value.
     * @return The indicator value after this observation.
     */
    double apply(double a);
}
