package com.trading.dpl.fn;

import com.trading.dpl.api.RowHistory;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.engine.EvalContext;

import java.util.List;

/**
 * Argument checks shared by builtins. Every failure is a TYPE_ERROR naming
 * the builtin.
 */
public final class Args {
    /** Largest period, offset or count a builtin accepts. */
    public static final int MAX_COUNT = 1_000_000;

    private Args() {
    }

    public static void count(String fn, List<Value> args, int expected) {
        if (args.size() != expected)
            throw ScriptException.typeError(fn + " expects " + expected + " arguments, got " + args.size());
    }

    public static void range(String fn, List<Value> args, int min, int max) {
        if (args.size() < min || args.size() > max)
            throw ScriptException.typeError(
                    fn + " expects " + min + " to " + max + " arguments, got " + args.size());
    }

    public static void atLeast(String fn, List<Value> args, int min) {
        if (args.size() < min)
            throw ScriptException.typeError(fn + " expects at least " + min + " arguments, got " + args.size());
    }

    /** Elements of an Array or ArraySlice argument. */
    public static List<Value> array(String fn, List<Value> args, int i) {
        Value v = args.get(i);
        if (!v.isArray())
            throw ScriptException.typeError(fn + ": argument " + (i + 1) + " must be an array, got " + v.kind());
        return v.elements();
    }

    public static double number(String fn, List<Value> args, int i) {
        return args.get(i).toNumber();
    }

    /** A non-negative whole-number argument such as a period or an offset. */
    public static int nonNegative(String fn, List<Value> args, int i, String what) {
        double n = args.get(i).toNumber();
        if (n < 0 || Double.isNaN(n))
            throw ScriptException.typeError(fn + ": " + what + " must not be negative, got " + Value.formatNumber(n));
        if (n > MAX_COUNT)
            throw ScriptException.typeError(fn + ": " + what + " must be at most " + MAX_COUNT + ", got " + Value.formatNumber(n));
        return (int) n;
    }

    public static String string(String fn, List<Value> args, int i) {
        Value v = args.get(i);
        if (!(v instanceof Value.Str s))
            throw ScriptException.typeError(fn + ": argument " + (i + 1) + " must be a string, got " + v.kind());
        return s.value();
    }

    public static Value callable(String fn, List<Value> args, int i) {
        Value v = args.get(i);
        if (!(v instanceof Value.Lambda) && !(v instanceof Value.Function))
            throw ScriptException.typeError(fn + ": argument " + (i + 1) + " must be a function, got " + v.kind());
        return v;
    }

    public static RowHistory history(String fn, EvalContext ctx) {
        if (!ctx.hasHistory())
            throw ScriptException.typeError(fn + " is only available while executing rows");
        return ctx.history();
    }
}
