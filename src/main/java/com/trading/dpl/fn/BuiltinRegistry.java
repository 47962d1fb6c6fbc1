package com.trading.dpl.fn;

import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.fn.finance.Indicators;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;
import java.util.function.UnaryOperator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Registry mapping builtin names to their implementations.
 *
 * <p>
 * A new registry holds the standard library; hosts may {@link #register}
 * additional functions or replace existing ones before handing the registry to
 * an executor. Registries are read-only once execution starts.
 */
public final class BuiltinRegistry {
    private static final Logger scriptLog = LogManager.getLogger("dpl.script");

    private final Map<String, Builtin> registry = new HashMap<>();

    public BuiltinRegistry() {
        registerBuiltIns();
    }

    public BuiltinRegistry register(String name, Builtin builtin) {
        registry.put(name, builtin);
        return this;
    }

    /** Returns the builtin, or null when no builtin has that name. */
    public Builtin lookup(String name) {
        return registry.get(name);
    }

    public boolean contains(String name) {
        return registry.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    // ── Built-in Functions ───────────────────────────────────────

    private void registerBuiltIns() {
        // --- Aggregates: one array argument or variadic scalars ---
        register("sum", (ev, ctx, a) -> {
            double total = 0.0;
            for (Value v : operands(a)) {
                if (!v.isNull())
                    total += v.toNumber();
            }
            return Value.of(total);
        });
        register("avg", (ev, ctx, a) -> {
            double total = 0.0;
            int n = 0;
            for (Value v : operands(a)) {
                if (!v.isNull()) {
                    total += v.toNumber();
                    n++;
                }
            }
            return n == 0 ? Value.NULL : Value.of(total / n);
        });
        register("max", (ev, ctx, a) -> {
            Args.atLeast("max", a, 1);
            double max = Double.NEGATIVE_INFINITY;
            for (Value v : operands(a))
                max = Math.max(max, v.toNumber());
            return Value.of(max);
        });
        register("min", (ev, ctx, a) -> {
            Args.atLeast("min", a, 1);
            double min = Double.POSITIVE_INFINITY;
            for (Value v : operands(a))
                min = Math.min(min, v.toNumber());
            return Value.of(min);
        });

        // --- Elementwise math ---
        registerNumeric("abs", Math::abs, BigDecimal::abs);
        registerNumeric("sqrt", Math::sqrt, d -> {
            if (d.signum() < 0)
                throw ScriptException.typeError("sqrt: negative decimal " + d.toPlainString());
            return d.sqrt(MathContext.DECIMAL128);
        });
        register("round", (ev, ctx, a) -> {
            Args.range("round", a, 1, 2);
            int digits = a.size() == 2 ? Args.nonNegative("round", a, 1, "digits") : 0;
            return elementwise("round", a.get(0),
                    x -> Double.isFinite(x)
                            ? BigDecimal.valueOf(x).setScale(digits, RoundingMode.HALF_UP).doubleValue()
                            : x,
                    d -> d.setScale(digits, RoundingMode.HALF_UP));
        });
        register("len", (ev, ctx, a) -> {
            Args.count("len", a, 1);
            Value v = a.get(0);
            if (v instanceof Value.Str s)
                return Value.of(s.value().length());
            if (v.isArray())
                return Value.of(v.elements().size());
            throw ScriptException.typeError("len: unsupported argument " + v.kind());
        });

        // --- Conversion and predicates ---
        register("is_null", (ev, ctx, a) -> {
            Args.count("is_null", a, 1);
            return Value.of(a.get(0).isNull());
        });
        register("number", (ev, ctx, a) -> {
            Args.count("number", a, 1);
            return Value.of(a.get(0).toNumber());
        });
        register("decimal", (ev, ctx, a) -> {
            Args.count("decimal", a, 1);
            return Value.of(a.get(0).toDecimal());
        });
        register("str", (ev, ctx, a) -> {
            Args.count("str", a, 1);
            return Value.of(a.get(0).display());
        });

        // --- Higher order ---
        register("map", (ev, ctx, a) -> {
            Args.count("map", a, 2);
            List<Value> items = Args.array("map", a, 0);
            Value fn = Args.callable("map", a, 1);
            List<Value> out = new ArrayList<>(items.size());
            for (Value item : items)
                out.add(ev.invoke(fn, List.of(item), ctx));
            return Value.array(out);
        });
        register("filter", (ev, ctx, a) -> {
            Args.count("filter", a, 2);
            List<Value> items = Args.array("filter", a, 0);
            Value fn = Args.callable("filter", a, 1);
            List<Value> out = new ArrayList<>();
            for (Value item : items) {
                if (ev.invoke(fn, List.of(item), ctx).truthy())
                    out.add(item);
            }
            return Value.array(out);
        });
        register("reduce", (ev, ctx, a) -> {
            Args.range("reduce", a, 2, 3);
            List<Value> items = Args.array("reduce", a, 0);
            Value fn = Args.callable("reduce", a, 1);
            boolean seeded = a.size() == 3;
            if (items.isEmpty()) {
                if (!seeded)
                    throw ScriptException.typeError("reduce of empty array needs an initial value");
                return a.get(2);
            }
            Value acc = seeded ? a.get(2) : items.get(0);
            for (int i = seeded ? 0 : 1; i < items.size(); i++)
                acc = ev.invoke(fn, List.of(acc, items.get(i)), ctx);
            return acc;
        });

        // --- Time series ---
        register("ref", (ev, ctx, a) -> TimeSeriesBuiltins.ref("ref", ctx, a));
        register("offset", (ev, ctx, a) -> TimeSeriesBuiltins.ref("offset", ctx, a));
        register("past", (ev, ctx, a) -> TimeSeriesBuiltins.past("past", ctx, a));
        register("window", (ev, ctx, a) -> TimeSeriesBuiltins.window("window", ctx, a));

        // --- Indicators ---
        registerSeries("SMA", Indicators::sma);
        registerSeries("EMA", Indicators::ema);
        registerSeries("RSI", Indicators::rsi);
        registerSeries("HHV", Indicators::hhv);
        registerSeries("LLV", Indicators::llv);
        registerSeries("STDDEV", Indicators::stddev);
        register("MACD", (ev, ctx, a) -> {
            Args.count("MACD", a, 4);
            return Indicators.macd(Args.array("MACD", a, 0), Args.nonNegative("MACD", a, 1, "fast"),
                    Args.nonNegative("MACD", a, 2, "slow"), Args.nonNegative("MACD", a, 3, "signal"));
        });
        register("BOLL", (ev, ctx, a) -> {
            Args.count("BOLL", a, 3);
            return Indicators.boll(Args.array("BOLL", a, 0), Args.nonNegative("BOLL", a, 1, "period"),
                    Args.number("BOLL", a, 2));
        });
        register("ATR", (ev, ctx, a) -> {
            Args.count("ATR", a, 4);
            return Indicators.atr(Args.array("ATR", a, 0), Args.array("ATR", a, 1), Args.array("ATR", a, 2),
                    Args.nonNegative("ATR", a, 3, "period"));
        });
        register("KDJ", (ev, ctx, a) -> {
            Args.count("KDJ", a, 6);
            return Indicators.kdj(Args.array("KDJ", a, 0), Args.array("KDJ", a, 1), Args.array("KDJ", a, 2),
                    Args.nonNegative("KDJ", a, 3, "n"), Args.nonNegative("KDJ", a, 4, "m1"),
                    Args.nonNegative("KDJ", a, 5, "m2"));
        });

        // --- Utility ---
        register("print", (ev, ctx, a) -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < a.size(); i++) {
                if (i > 0)
                    sb.append(' ');
                sb.append(a.get(i).display());
            }
            scriptLog.info(sb);
            return Value.NULL;
        });
    }

    // ── Helpers ──────────────────────────────────────────────────

    @FunctionalInterface
    private interface SeriesFn {
        Value apply(List<Value> series, int period);
    }

    private void registerSeries(String name, SeriesFn fn) {
        register(name, (ev, ctx, a) -> {
            Args.count(name, a, 2);
            return fn.apply(Args.array(name, a, 0), Args.nonNegative(name, a, 1, "period"));
        });
    }

    private void registerNumeric(String name, DoubleUnaryOperator dop,
            UnaryOperator<BigDecimal> bop) {
        register(name, (ev, ctx, a) -> {
            Args.count(name, a, 1);
            return elementwise(name, a.get(0), dop, bop);
        });
    }

    private static Value elementwise(String name, Value v, DoubleUnaryOperator dop,
            UnaryOperator<BigDecimal> bop) {
        if (v.isArray()) {
            List<Value> out = new ArrayList<>(v.elements().size());
            for (Value e : v.elements())
                out.add(elementwise(name, e, dop, bop));
            return Value.array(out);
        }
        if (v instanceof Value.Dec d)
            return Value.of(bop.apply(d.value()));
        if (v instanceof Value.Num || v.isNull())
            return Value.of(dop.applyAsDouble(v.toNumber()));
        throw ScriptException.typeError(name + ": unsupported argument " + v.kind());
    }

    /** A single array argument spreads into its elements; otherwise the arguments themselves. */
    private static List<Value> operands(List<Value> args) {
        if (args.size() == 1 && args.get(0).isArray())
            return args.get(0).elements();
        return args;
    }
}
