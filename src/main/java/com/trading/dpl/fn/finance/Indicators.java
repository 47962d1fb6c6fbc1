package com.trading.dpl.fn.finance;

import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.fn.Fn1;

import java.util.List;

/**
 * Technical indicators over a whole series.
 *
 * <p>
 * Each function folds the series through the matching rolling {@link Fn1}
 * and returns the value at the last observation. Null elements count as 0.
 * Series shorter than the indicator needs produce Null (or an array of Nulls
 * for multi-line indicators).
 */
public final class Indicators {

    private static final Value NULL_TRIPLE = Value.array(Value.NULL, Value.NULL, Value.NULL);

    private Indicators() {
    }

    /** Mean of the last {@code period} values. */
    public static Value sma(List<Value> values, int period) {
        checkPeriod("SMA", period);
        if (values.size() < period)
            return Value.NULL;
        return Value.of(fold(new Sma(period), tail(values, period)));
    }

    /** EMA seeded with the SMA of the first {@code period} values; plain average when shorter. */
    public static Value ema(List<Value> values, int period) {
        checkPeriod("EMA", period);
        if (values.isEmpty())
            return Value.NULL;
        if (values.size() < period)
            return sma(values, values.size());
        return Value.of(fold(new Ewma(period), values));
    }

    /** {@code [macd, signal, histogram]}. */
    public static Value macd(List<Value> values, int fast, int slow, int signal) {
        checkPeriod("MACD", fast);
        checkPeriod("MACD", slow);
        checkPeriod("MACD", signal);
        if (values.size() < slow)
            return NULL_TRIPLE;
        Macd macd = new Macd(fast, slow, signal);
        double line = fold(macd, values);
        double sig = macd.signal();
        return Value.numbers(line, sig, line - sig);
    }

    public static Value rsi(List<Value> values, int period) {
        checkPeriod("RSI", period);
        if (values.size() < period + 1)
            return Value.NULL;
        return Value.of(fold(new Rsi(period), values));
    }

    /** {@code [upper, middle, lower]} at {@code width} standard deviations. */
    public static Value boll(List<Value> values, int period, double width) {
        checkPeriod("BOLL", period);
        if (values.size() < period)
            return NULL_TRIPLE;
        StdDev sd = new StdDev(period);
        double std = fold(sd, tail(values, period));
        double middle = sd.mean();
        return Value.numbers(middle + width * std, middle, middle - width * std);
    }

    /** Average true range over the last {@code period} bars. */
    public static Value atr(List<Value> high, List<Value> low, List<Value> close, int period) {
        checkPeriod("ATR", period);
        int n = high.size();
        if (n < period + 1 || low.size() < period + 1 || close.size() < period + 1)
            return Value.NULL;
        Sma avg = new Sma(period);
        double result = Double.NaN;
        for (int i = n - period; i < n; i++) {
            double h = high.get(i).toNumber();
            double l = low.get(i).toNumber();
            double prevClose = close.get(i - 1).toNumber();
            double tr = Math.max(h - l, Math.max(Math.abs(h - prevClose), Math.abs(l - prevClose)));
            result = avg.apply(tr);
        }
        return Value.of(result);
    }

    /** {@code [K, D, J]} stochastic oscillator, K and D smoothed from 50. */
    public static Value kdj(List<Value> high, List<Value> low, List<Value> close, int n, int m1, int m2) {
        checkPeriod("KDJ", n);
        checkPeriod("KDJ", m1);
        checkPeriod("KDJ", m2);
        int len = close.size();
        if (high.size() < n || low.size() < n || len < n || high.size() != len || low.size() != len)
            return NULL_TRIPLE;
        RollingMax highest = new RollingMax(n);
        RollingMin lowest = new RollingMin(n);
        double k = 50.0;
        double d = 50.0;
        for (int t = 0; t < len; t++) {
            double hh = highest.apply(high.get(t).toNumber());
            double ll = lowest.apply(low.get(t).toNumber());
            if (t < n - 1)
                continue;
            double c = close.get(t).toNumber();
            double rsv = hh == ll ? 50.0 : (c - ll) / (hh - ll) * 100.0;
            k = ((m1 - 1) * k + rsv) / m1;
            d = ((m2 - 1) * d + k) / m2;
        }
        return Value.numbers(k, d, 3 * k - 2 * d);
    }

    /** Highest value of the last {@code n}. */
    public static Value hhv(List<Value> values, int n) {
        checkPeriod("HHV", n);
        return values.isEmpty() ? Value.NULL : Value.of(fold(new RollingMax(n), values));
    }

    /** Lowest value of the last {@code n}. */
    public static Value llv(List<Value> values, int n) {
        checkPeriod("LLV", n);
        return values.isEmpty() ? Value.NULL : Value.of(fold(new RollingMin(n), values));
    }

    /** Population standard deviation of the last {@code n} values. */
    public static Value stddev(List<Value> values, int n) {
        checkPeriod("STDDEV", n);
        if (values.size() < n)
            return Value.NULL;
        return Value.of(fold(new StdDev(n), tail(values, n)));
    }

    private static double fold(Fn1 fn, List<Value> values) {
        double last = Double.NaN;
        for (Value v : values)
            last = fn.apply(v.toNumber());
        return last;
    }

    private static List<Value> tail(List<Value> values, int n) {
        return values.subList(values.size() - n, values.size());
    }

    private static void checkPeriod(String fn, int period) {
        if (period < 1)
            throw ScriptException.typeError(fn + ": period must be >= 1, got " + period);
    }
}
