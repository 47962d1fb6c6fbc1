package com.trading.dpl.api;

import com.trading.dpl.ast.Expr;
import com.trading.dpl.ast.FunctionDef;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dynamically typed runtime value of a DPL script.
 *
 * <p>
 * Variants:
 * <ul>
 * <li>{@link Num} - 64-bit floating point number.</li>
 * <li>{@link Dec} - fixed-point decimal, used when a script declares a
 * precision or decimal-typed inputs.</li>
 * <li>{@link Str}, {@link Bool}, {@link Null}.</li>
 * <li>{@link Array} - ordered elements of any kind (mixed kinds allowed).</li>
 * <li>{@link ArraySlice} - zero-copy view over a shared, immutable backing
 * column. The view keeps the column alive.</li>
 * <li>{@link Lambda} - parameters, body expression and a snapshot of the
 * bindings visible when it was created.</li>
 * <li>{@link Function} - a named user function, usually exported by a
 * package.</li>
 * </ul>
 *
 * <p>
 * Arithmetic coerces {@link Null} to numeric zero ({@link #toNumber()}); the
 * {@code is_null} builtin is the explicit check. Both behaviours are part of
 * the contract.
 */
public interface Value {

    enum Kind {
        NUMBER, DECIMAL, STRING, BOOL, NULL, ARRAY, ARRAY_SLICE, LAMBDA, FUNCTION
    }

    Value NULL = Null.INSTANCE;
    Value TRUE = new Bool(true);
    Value FALSE = new Bool(false);
    Value ZERO = new Num(0.0);

    Kind kind();

    /** Truthiness used by conditions, {@code not}, {@code and}, {@code or}. */
    boolean truthy();

    /** Numeric view. Null is 0, Bool is 1/0, Strings are parsed. */
    default double toNumber() {
        throw ScriptException.typeError("cannot convert " + kind() + " to number");
    }

    /** Decimal view. Null is not convertible. */
    default BigDecimal toDecimal() {
        throw ScriptException.typeError("cannot convert " + kind() + " to decimal");
    }

    /** Rendering used by {@code print} and f-strings: strings unquoted. */
    default String display() {
        return toString();
    }

    default boolean isNull() {
        return false;
    }

    /** True for {@link Array} and {@link ArraySlice}. */
    default boolean isArray() {
        return false;
    }

    /** Elements of an array-like value. */
    default List<Value> elements() {
        throw ScriptException.typeError("expected array, got " + kind());
    }

    // ── Factories ──────────────────────────────────────────────────

    static Value of(double value) {
        return new Num(value);
    }

    static Value of(BigDecimal value) {
        return new Dec(value);
    }

    static Value of(String value) {
        return value == null ? NULL : new Str(value);
    }

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value array(List<Value> elements) {
        return new Array(elements);
    }

    static Value array(Value... elements) {
        return new Array(List.of(elements));
    }

    static Value numbers(double... values) {
        List<Value> list = new ArrayList<>(values.length);
        for (double v : values)
            list.add(new Num(v));
        return new Array(list);
    }

    /** Formats a double the way scripts print it: integral values without a fraction. */
    static String formatNumber(double n) {
        if (!Double.isInfinite(n) && n == Math.rint(n) && Math.abs(n) < 1e15) {
            return Long.toString((long) n);
        }
        return Double.toString(n);
    }

    // ── Variants ───────────────────────────────────────────────────

    record Num(double value) implements Value {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public boolean truthy() {
            return value != 0.0;
        }

        @Override
        public double toNumber() {
            return value;
        }

        @Override
        public BigDecimal toDecimal() {
            if (Double.isNaN(value) || Double.isInfinite(value))
                throw ScriptException.typeError("cannot convert " + value + " to decimal");
            return BigDecimal.valueOf(value);
        }

        @Override
        public String toString() {
            return formatNumber(value);
        }
    }

    record Dec(BigDecimal value) implements Value {
        @Override
        public Kind kind() {
            return Kind.DECIMAL;
        }

        @Override
        public boolean truthy() {
            return value.signum() != 0;
        }

        @Override
        public double toNumber() {
            return value.doubleValue();
        }

        @Override
        public BigDecimal toDecimal() {
            return value;
        }

        // Numeric equality: 1.0 and 1.00 are the same decimal.
        @Override
        public boolean equals(Object o) {
            return o instanceof Dec other && value.compareTo(other.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    record Str(String value) implements Value {
        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public boolean truthy() {
            return !value.isEmpty();
        }

        @Override
        public double toNumber() {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw ScriptException.typeError("cannot convert \"" + value + "\" to number");
            }
        }

        @Override
        public BigDecimal toDecimal() {
            try {
                return new BigDecimal(value.trim());
            } catch (NumberFormatException e) {
                throw ScriptException.typeError("cannot convert \"" + value + "\" to decimal");
            }
        }

        @Override
        public String display() {
            return value;
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public boolean truthy() {
            return value;
        }

        @Override
        public double toNumber() {
            return value ? 1.0 : 0.0;
        }

        @Override
        public BigDecimal toDecimal() {
            return value ? BigDecimal.ONE : BigDecimal.ZERO;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    final class Null implements Value {
        static final Null INSTANCE = new Null();

        private Null() {
        }

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public boolean truthy() {
            return false;
        }

        @Override
        public double toNumber() {
            return 0.0;
        }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Array(List<Value> elements) implements Value {
        public Array {
            elements = Collections.unmodifiableList(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        @Override
        public boolean truthy() {
            return !elements.isEmpty();
        }

        @Override
        public boolean isArray() {
            return true;
        }

        @Override
        public String display() {
            return render(elements, true);
        }

        @Override
        public String toString() {
            return render(elements, false);
        }
    }

    /**
     * View of {@code length} elements of a shared column starting at
     * {@code start}. The backing column must be immutable.
     */
    record ArraySlice(List<Value> column, int start, int length) implements Value {
        public ArraySlice {
            if (start < 0 || length < 0 || start + length > column.size())
                throw new IllegalArgumentException(
                        "Slice [" + start + ", " + (start + length) + ") outside column of size " + column.size());
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY_SLICE;
        }

        @Override
        public boolean truthy() {
            return length > 0;
        }

        @Override
        public boolean isArray() {
            return true;
        }

        @Override
        public List<Value> elements() {
            return column.subList(start, start + length);
        }

        /** Copies the viewed elements into a standalone {@link Array}. */
        public Array materialize() {
            return new Array(new ArrayList<>(elements()));
        }

        // Equal to any slice viewing the same elements.
        @Override
        public boolean equals(Object o) {
            return o instanceof ArraySlice other && elements().equals(other.elements());
        }

        @Override
        public int hashCode() {
            return elements().hashCode();
        }

        @Override
        public String display() {
            return render(elements(), true);
        }

        @Override
        public String toString() {
            return render(elements(), false);
        }
    }

    record Lambda(List<String> params, Expr body, Map<String, Value> captures) implements Value {
        public Lambda {
            params = List.copyOf(params);
            captures = Collections.unmodifiableMap(new LinkedHashMap<>(captures));
        }

        @Override
        public Kind kind() {
            return Kind.LAMBDA;
        }

        @Override
        public boolean truthy() {
            return true;
        }

        @Override
        public String toString() {
            return "<lambda(" + String.join(", ", params) + ")>";
        }
    }

    record Function(FunctionDef definition) implements Value {
        @Override
        public Kind kind() {
            return Kind.FUNCTION;
        }

        @Override
        public boolean truthy() {
            return true;
        }

        @Override
        public String toString() {
            return "<function " + definition.name() + ">";
        }
    }

    private static String render(List<Value> elements, boolean display) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0)
                sb.append(", ");
            Value v = elements.get(i);
            sb.append(display ? v.display() : v.toString());
        }
        return sb.append(']').toString();
    }
}
