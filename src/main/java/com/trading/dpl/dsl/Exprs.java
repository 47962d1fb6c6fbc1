package com.trading.dpl.dsl;

import com.trading.dpl.ast.BinaryOp;
import com.trading.dpl.ast.Expr;
import com.trading.dpl.ast.UnaryOp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static factories for expression trees.
 *
 * <p>
 * Intended for static import:
 *
 * <pre>{@code
 * import static com.trading.dpl.dsl.Exprs.*;
 *
 * Expr ma2 = div(add(id("close"), index(id("close"), num(-1))), num(2));
 * }</pre>
 */
public final class Exprs {

    private Exprs() {
    }

    // ── Literals ─────────────────────────────────────────────────

    public static Expr num(double value) {
        return new Expr.Num(value);
    }

    public static Expr str(String value) {
        return new Expr.Str(value);
    }

    public static Expr bool(boolean value) {
        return new Expr.Bool(value);
    }

    public static Expr nil() {
        return new Expr.Null();
    }

    public static Expr id(String name) {
        return new Expr.Ident(name);
    }

    public static Expr array(Expr... elements) {
        return new Expr.ArrayLit(Arrays.asList(elements));
    }

    /**
     * Interpolated string. {@link String} arguments are literal text, {@link Expr}
     * arguments are interpolated with their display form.
     */
    public static Expr fstr(Object... parts) {
        List<Expr.FStr.Part> list = new ArrayList<>(parts.length);
        for (Object p : parts) {
            if (p instanceof String s) {
                list.add(new Expr.FStr.Text(s));
            } else if (p instanceof Expr e) {
                list.add(new Expr.FStr.Interpolation(e));
            } else {
                throw new IllegalArgumentException("f-string part must be String or Expr: " + p);
            }
        }
        return new Expr.FStr(list);
    }

    // ── Operators ────────────────────────────────────────────────

    public static Expr binary(Expr left, BinaryOp op, Expr right) {
        return new Expr.Binary(left, op, right);
    }

    public static Expr add(Expr l, Expr r) {
        return binary(l, BinaryOp.ADD, r);
    }

    public static Expr sub(Expr l, Expr r) {
        return binary(l, BinaryOp.SUB, r);
    }

    public static Expr mul(Expr l, Expr r) {
        return binary(l, BinaryOp.MUL, r);
    }

    public static Expr div(Expr l, Expr r) {
        return binary(l, BinaryOp.DIV, r);
    }

    public static Expr mod(Expr l, Expr r) {
        return binary(l, BinaryOp.MOD, r);
    }

    public static Expr pow(Expr l, Expr r) {
        return binary(l, BinaryOp.POW, r);
    }

    public static Expr gt(Expr l, Expr r) {
        return binary(l, BinaryOp.GT, r);
    }

    public static Expr lt(Expr l, Expr r) {
        return binary(l, BinaryOp.LT, r);
    }

    public static Expr gte(Expr l, Expr r) {
        return binary(l, BinaryOp.GT_EQ, r);
    }

    public static Expr lte(Expr l, Expr r) {
        return binary(l, BinaryOp.LT_EQ, r);
    }

    public static Expr eq(Expr l, Expr r) {
        return binary(l, BinaryOp.EQ, r);
    }

    public static Expr neq(Expr l, Expr r) {
        return binary(l, BinaryOp.NOT_EQ, r);
    }

    public static Expr and(Expr l, Expr r) {
        return binary(l, BinaryOp.AND, r);
    }

    public static Expr or(Expr l, Expr r) {
        return binary(l, BinaryOp.OR, r);
    }

    public static Expr neg(Expr operand) {
        return new Expr.Unary(UnaryOp.NEG, operand);
    }

    public static Expr not(Expr operand) {
        return new Expr.Unary(UnaryOp.NOT, operand);
    }

    // ── Control flow ─────────────────────────────────────────────

    public static Expr ternary(Expr condition, Expr thenExpr, Expr elseExpr) {
        return new Expr.Ternary(condition, thenExpr, elseExpr);
    }

    public static Expr.WhenBranch branch(Expr condition, Expr result) {
        return new Expr.WhenBranch(condition, result);
    }

    public static Expr when(List<Expr.WhenBranch> branches, Expr elseExpr) {
        return new Expr.When(branches, elseExpr);
    }

    public static Expr when(Expr.WhenBranch... branches) {
        return new Expr.When(Arrays.asList(branches), null);
    }

    // ── Access ───────────────────────────────────────────────────

    public static Expr call(String callee, Expr... args) {
        return new Expr.Call(callee, Arrays.asList(args));
    }

    public static Expr member(String object, String member) {
        return new Expr.Member(object, member);
    }

    public static Expr index(Expr base, Expr index) {
        return new Expr.Index(base, index);
    }

    /** {@code name[offset]}; negative offsets read history. */
    public static Expr hist(String name, int offset) {
        return new Expr.Index(id(name), num(offset));
    }

    /** {@code base[start:end]}; pass null for an open bound. */
    public static Expr slice(Expr base, Expr start, Expr end) {
        return new Expr.Slice(base, start, end);
    }

    public static Expr spread(Expr inner) {
        return new Expr.Spread(inner);
    }

    public static Expr lambda(List<String> params, Expr body) {
        return new Expr.Lambda(params, body);
    }

    public static Expr lambda(String param, Expr body) {
        return new Expr.Lambda(List.of(param), body);
    }

    /** {@code value |> stage1 |> stage2}. */
    public static Expr pipe(Expr value, Expr... stages) {
        return new Expr.Pipeline(value, Arrays.asList(stages));
    }
}
