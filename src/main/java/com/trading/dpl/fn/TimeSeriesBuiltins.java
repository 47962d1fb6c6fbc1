package com.trading.dpl.fn;

import com.trading.dpl.api.RowHistory;
import com.trading.dpl.api.Value;
import com.trading.dpl.engine.EvalContext;

import java.util.ArrayList;
import java.util.List;

/**
 * History lookups by column name: {@code ref}, {@code past}, {@code window}.
 *
 * Output history wins over input history for the same name, except for the
 * current row whose output is still being computed.
 */
final class TimeSeriesBuiltins {

    private TimeSeriesBuiltins() {
    }

    /** {@code ref(name, offset)}: one value {@code offset} rows back, Null when out of range. */
    static Value ref(String fn, EvalContext ctx, List<Value> args) {
        Args.count(fn, args, 2);
        String name = Args.string(fn, args, 0);
        int offset = Args.nonNegative(fn, args, 1, "offset");
        RowHistory history = Args.history(fn, ctx);
        return lookBack(history, name, offset);
    }

    /** {@code past(name, n)}: the n values before the current row, oldest first. */
    static Value past(String fn, EvalContext ctx, List<Value> args) {
        Args.count(fn, args, 2);
        String name = Args.string(fn, args, 0);
        int n = Args.nonNegative(fn, args, 1, "count");
        RowHistory history = Args.history(fn, ctx);
        List<Value> out = new ArrayList<>(n);
        for (int i = n; i >= 1; i--)
            out.add(lookBack(history, name, i));
        return Value.array(out);
    }

    /** {@code window(name, size)}: the previous size-1 values plus the current input value. */
    static Value window(String fn, EvalContext ctx, List<Value> args) {
        Args.count(fn, args, 2);
        String name = Args.string(fn, args, 0);
        int size = Args.nonNegative(fn, args, 1, "size");
        RowHistory history = Args.history(fn, ctx);
        if (size == 0)
            return Value.array(new ArrayList<>());
        List<Value> out = new ArrayList<>(size);
        for (int i = size - 1; i >= 1; i--)
            out.add(lookBack(history, name, i));
        Value current = history.inputHistory(name, 0);
        out.add(current == null ? Value.NULL : current);
        return Value.array(out);
    }

    private static Value lookBack(RowHistory history, String name, int offset) {
        Value v = history.outputHistory(name, offset);
        if (v == null)
            v = history.inputHistory(name, offset);
        return v == null ? Value.NULL : v;
    }
}
