package com.trading.dpl.dsl;

import com.trading.dpl.ast.Expr;
import com.trading.dpl.ast.FunctionDef;
import com.trading.dpl.ast.Parameter;
import com.trading.dpl.ast.Stmt;
import com.trading.dpl.ast.TypeAnnotation;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for statements, parameters and function definitions.
 */
public final class Stmts {

    private Stmts() {
    }

    public static Stmt let(String name, Expr value) {
        return new Stmt.Assign(name, value, false);
    }

    public static Stmt mutable(String name, Expr value) {
        return new Stmt.Assign(name, value, true);
    }

    public static Stmt destructure(List<Stmt.Pattern> patterns, Expr value) {
        return new Stmt.Destructure(patterns, value);
    }

    public static Stmt.Pattern bind(String name) {
        return new Stmt.Bind(name);
    }

    public static Stmt.Pattern ignore() {
        return new Stmt.Ignore();
    }

    public static Stmt.Pattern rest(String name) {
        return new Stmt.Rest(name);
    }

    public static Stmt ifThen(Expr condition, Stmt... thenBlock) {
        return new Stmt.If(condition, Arrays.asList(thenBlock), null);
    }

    public static Stmt ifElse(Expr condition, List<Stmt> thenBlock, List<Stmt> elseBlock) {
        return new Stmt.If(condition, thenBlock, elseBlock);
    }

    public static Stmt ret(Expr value) {
        return new Stmt.Return(value);
    }

    public static Stmt expr(Expr expr) {
        return new Stmt.ExprStmt(expr);
    }

    // ── Functions ────────────────────────────────────────────────

    public static Parameter param(String name) {
        return Parameter.of(name);
    }

    public static Parameter param(String name, TypeAnnotation type) {
        return Parameter.of(name, type);
    }

    public static Parameter param(String name, Expr defaultValue) {
        return new Parameter(name, null, defaultValue);
    }

    public static FunctionDef function(String name, List<Parameter> params, Stmt... body) {
        return new FunctionDef(name, params, null, Arrays.asList(body));
    }
}
