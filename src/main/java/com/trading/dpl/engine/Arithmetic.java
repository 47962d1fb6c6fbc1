package com.trading.dpl.engine;

import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.BinaryOp;
import com.trading.dpl.ast.UnaryOp;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Operator semantics of the value model.
 *
 * <p>
 * Scalars combine pairwise on matching kinds: Number with Number, Decimal with
 * Decimal, String with String for {@code +} and ordering. Null next to a
 * Number or Decimal counts as zero of that kind. When exactly one operand is
 * array-like the other is broadcast across its elements, keeping operand
 * order; two arrays combine elementwise and must have equal length.
 * Equality compares whole values and never coerces Null.
 */
public final class Arithmetic {

    private static final Value DEC_ZERO = Value.of(BigDecimal.ZERO);
    private static final int UNORDERED = 2;

    private Arithmetic() {
    }

    public static Value binary(BinaryOp op, Value left, Value right) {
        return switch (op) {
            case ADD -> add(left, right);
            case SUB -> sub(left, right);
            case MUL -> mul(left, right);
            case DIV -> div(left, right);
            case MOD -> mod(left, right);
            case POW -> pow(left, right);
            case GT -> gt(left, right);
            case LT -> lt(left, right);
            case GT_EQ -> gte(left, right);
            case LT_EQ -> lte(left, right);
            case EQ -> Value.of(equal(left, right));
            case NOT_EQ -> Value.of(!equal(left, right));
            case AND -> and(left, right);
            case OR -> or(left, right);
        };
    }

    public static Value unary(UnaryOp op, Value operand) {
        return switch (op) {
            case NEG -> neg(operand);
            case NOT -> not(operand);
        };
    }

    // ── Arithmetic ───────────────────────────────────────────────

    public static Value add(Value l, Value r) {
        return lift(l, r, (a, b) -> {
            if (a instanceof Value.Str sa && b instanceof Value.Str sb)
                return Value.of(sa.value() + sb.value());
            return numeric(BinaryOp.ADD, a, b, Double::sum, BigDecimal::add);
        });
    }

    public static Value sub(Value l, Value r) {
        return lift(l, r, (a, b) -> numeric(BinaryOp.SUB, a, b, (x, y) -> x - y, BigDecimal::subtract));
    }

    public static Value mul(Value l, Value r) {
        return lift(l, r, (a, b) -> numeric(BinaryOp.MUL, a, b, (x, y) -> x * y, BigDecimal::multiply));
    }

    public static Value div(Value l, Value r) {
        return lift(l, r, (a, b) -> {
            checkDivisor(a, b);
            return numeric(BinaryOp.DIV, a, b, (x, y) -> x / y, (x, y) -> x.divide(y, MathContext.DECIMAL128));
        });
    }

    public static Value mod(Value l, Value r) {
        return lift(l, r, (a, b) -> {
            checkDivisor(a, b);
            return numeric(BinaryOp.MOD, a, b, (x, y) -> x % y, BigDecimal::remainder);
        });
    }

    public static Value pow(Value l, Value r) {
        return lift(l, r, (a, b) -> numeric(BinaryOp.POW, a, b, Math::pow, null));
    }

    // ── Comparison ───────────────────────────────────────────────

    public static Value gt(Value l, Value r) {
        return lift(l, r, (a, b) -> Value.of(compare(BinaryOp.GT, a, b) == 1));
    }

    public static Value lt(Value l, Value r) {
        return lift(l, r, (a, b) -> Value.of(compare(BinaryOp.LT, a, b) == -1));
    }

    public static Value gte(Value l, Value r) {
        return lift(l, r, (a, b) -> Value.of(isOneOf(compare(BinaryOp.GT_EQ, a, b), 0, 1)));
    }

    public static Value lte(Value l, Value r) {
        return lift(l, r, (a, b) -> Value.of(isOneOf(compare(BinaryOp.LT_EQ, a, b), -1, 0)));
    }

    /**
     * Structural equality. Numbers compare with {@code ==}; arrays and slices
     * compare elementwise; kinds never convert.
     */
    public static boolean equal(Value l, Value r) {
        if (l instanceof Value.Num a && r instanceof Value.Num b)
            return a.value() == b.value();
        if (l.isArray() && r.isArray()) {
            List<Value> a = l.elements();
            List<Value> b = r.elements();
            if (a.size() != b.size())
                return false;
            for (int i = 0; i < a.size(); i++) {
                if (!equal(a.get(i), b.get(i)))
                    return false;
            }
            return true;
        }
        return l.equals(r);
    }

    // ── Logic ────────────────────────────────────────────────────

    public static Value and(Value l, Value r) {
        return lift(l, r, (a, b) -> Value.of(a.truthy() && b.truthy()));
    }

    public static Value or(Value l, Value r) {
        return lift(l, r, (a, b) -> Value.of(a.truthy() || b.truthy()));
    }

    public static Value not(Value v) {
        return map(v, e -> Value.of(!e.truthy()));
    }

    public static Value neg(Value v) {
        return map(v, e -> {
            if (e instanceof Value.Num n)
                return Value.of(-n.value());
            if (e instanceof Value.Dec d)
                return Value.of(d.value().negate());
            if (e.isNull())
                return Value.ZERO;
            throw ScriptException.typeError("cannot negate " + e.kind());
        });
    }

    // ── Internals ────────────────────────────────────────────────

    private static Value lift(Value l, Value r, BinaryOperator<Value> scalar) {
        boolean la = l.isArray();
        boolean ra = r.isArray();
        if (!la && !ra)
            return scalar.apply(l, r);

        if (la && ra) {
            List<Value> a = l.elements();
            List<Value> b = r.elements();
            if (a.size() != b.size())
                throw ScriptException.typeError("array length mismatch: " + a.size() + " vs " + b.size());
            List<Value> out = new ArrayList<>(a.size());
            for (int i = 0; i < a.size(); i++)
                out.add(lift(a.get(i), b.get(i), scalar));
            return Value.array(out);
        }

        List<Value> src = la ? l.elements() : r.elements();
        List<Value> out = new ArrayList<>(src.size());
        for (Value e : src)
            out.add(la ? lift(e, r, scalar) : lift(l, e, scalar));
        return Value.array(out);
    }

    private static Value map(Value v, UnaryOperator<Value> scalar) {
        if (!v.isArray())
            return scalar.apply(v);
        List<Value> src = v.elements();
        List<Value> out = new ArrayList<>(src.size());
        for (Value e : src)
            out.add(map(e, scalar));
        return Value.array(out);
    }

    private static Value numeric(BinaryOp op, Value l, Value r, DoubleBinaryOperator dop,
            BinaryOperator<BigDecimal> bop) {
        Value a = zeroForNull(l, r);
        Value b = zeroForNull(r, l);
        if (a instanceof Value.Num x && b instanceof Value.Num y)
            return Value.of(dop.applyAsDouble(x.value(), y.value()));
        if (bop != null && a instanceof Value.Dec x && b instanceof Value.Dec y)
            return Value.of(bop.apply(x.value(), y.value()));
        throw mismatch(op, l, r);
    }

    /** Returns -1, 0 or 1; {@link #UNORDERED} when either side is NaN. */
    private static int compare(BinaryOp op, Value l, Value r) {
        Value a = zeroForNull(l, r);
        Value b = zeroForNull(r, l);
        if (a instanceof Value.Num x && b instanceof Value.Num y) {
            if (Double.isNaN(x.value()) || Double.isNaN(y.value()))
                return UNORDERED;
            return x.value() < y.value() ? -1 : (x.value() > y.value() ? 1 : 0);
        }
        if (a instanceof Value.Dec x && b instanceof Value.Dec y)
            return x.value().compareTo(y.value());
        if (a instanceof Value.Str x && b instanceof Value.Str y)
            return Integer.signum(x.value().compareTo(y.value()));
        throw mismatch(op, l, r);
    }

    /** Null becomes zero of the other operand's numeric kind; Null with Null is Number zero. */
    private static Value zeroForNull(Value v, Value other) {
        if (!v.isNull())
            return v;
        if (other instanceof Value.Dec)
            return DEC_ZERO;
        if (other instanceof Value.Num || other.isNull())
            return Value.ZERO;
        return v;
    }

    private static boolean isOneOf(int cmp, int a, int b) {
        return cmp == a || cmp == b;
    }

    private static void checkDivisor(Value dividend, Value divisor) {
        Value d = zeroForNull(divisor, dividend);
        if (d instanceof Value.Num n && n.value() == 0.0)
            throw ScriptException.zeroDivision();
        if (d instanceof Value.Dec n && n.value().signum() == 0)
            throw ScriptException.zeroDivision();
    }

    private static ScriptException mismatch(BinaryOp op, Value l, Value r) {
        return ScriptException.typeError("unsupported operand kinds for " + op.symbol() + ": " + l.kind()
                + " and " + r.kind());
    }
}
