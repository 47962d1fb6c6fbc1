package com.trading.dpl.engine;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.RowHistory;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.Expr;
import com.trading.dpl.ast.FunctionDef;
import com.trading.dpl.ast.Parameter;
import com.trading.dpl.ast.PrecisionSetting;
import com.trading.dpl.ast.Stmt;
import com.trading.dpl.ast.TypeAnnotation;
import com.trading.dpl.fn.Builtin;
import com.trading.dpl.fn.BuiltinRegistry;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree-walking interpreter for expressions and statements.
 *
 * <p>
 * An Evaluator holds only immutable wiring (builtins, package data, user
 * functions, precision). Everything that changes per row travels in the
 * {@link EvalContext}: the scope being mutated and the history of the row.
 * One Evaluator can therefore serve every row of an executor.
 *
 * <p>
 * Call resolution order, first match wins:
 * <ol>
 * <li>a Lambda bound to the callee name in scope</li>
 * <li>a Function exported by an imported package ({@code pkg.fn})</li>
 * <li>a locally registered user function</li>
 * <li>the builtin table</li>
 * </ol>
 */
public final class Evaluator {
    private final BuiltinRegistry builtins;
    private final Map<String, Value> packageVars;
    private final Map<String, FunctionDef> functions;
    private final PrecisionSetting precision;

    public Evaluator(BuiltinRegistry builtins) {
        this(builtins, Map.of(), Map.of(), null);
    }

    public Evaluator(BuiltinRegistry builtins, Map<String, Value> packageVars,
            Map<String, FunctionDef> functions, PrecisionSetting precision) {
        this.builtins = builtins;
        this.packageVars = Map.copyOf(packageVars);
        this.functions = new HashMap<>(functions);
        this.precision = precision;
    }

    public BuiltinRegistry builtins() {
        return builtins;
    }

    public Map<String, Value> packageVars() {
        return packageVars;
    }

    public PrecisionSetting precision() {
        return precision;
    }

    // ── Statements ───────────────────────────────────────────────

    /**
     * Runs statements in order until the first {@code return}.
     *
     * @return the returned value, or Java {@code null} if no return statement ran
     */
    public Value executeBody(List<Stmt> body, EvalContext ctx) {
        for (Stmt stmt : body) {
            Value result = execute(stmt, ctx);
            if (result != null)
                return result;
        }
        return null;
    }

    private Value execute(Stmt stmt, EvalContext ctx) {
        if (stmt instanceof Stmt.Assign a) {
            ctx.scope().set(a.name(), eval(a.value(), ctx));
            return null;
        }
        if (stmt instanceof Stmt.ExprStmt e) {
            eval(e.expr(), ctx);
            return null;
        }
        if (stmt instanceof Stmt.Return r) {
            return r.value() == null ? Value.NULL : eval(r.value(), ctx);
        }
        if (stmt instanceof Stmt.If i) {
            if (eval(i.condition(), ctx).truthy())
                return executeBody(i.thenBlock(), ctx);
            return i.elseBlock() == null ? null : executeBody(i.elseBlock(), ctx);
        }
        if (stmt instanceof Stmt.Destructure d) {
            destructure(d, ctx);
            return null;
        }
        throw new IllegalArgumentException("Unknown statement: " + stmt.getClass().getSimpleName());
    }

    private void destructure(Stmt.Destructure d, EvalContext ctx) {
        Value value = eval(d.value(), ctx);
        if (!value.isArray())
            throw ScriptException.typeError("cannot destructure " + value.kind());
        List<Value> elements = value.elements();
        int i = 0;
        for (Stmt.Pattern p : d.patterns()) {
            if (p instanceof Stmt.Rest rest) {
                int from = Math.min(i, elements.size());
                ctx.scope().set(rest.name(), Value.array(new ArrayList<>(elements.subList(from, elements.size()))));
                return;
            }
            if (p instanceof Stmt.Bind bind)
                ctx.scope().set(bind.name(), i < elements.size() ? elements.get(i) : Value.NULL);
            i++;
        }
    }

    // ── Expressions ──────────────────────────────────────────────

    public Value eval(Expr expr, EvalContext ctx) {
        if (expr instanceof Expr.Num n)
            return Value.of(n.value());
        if (expr instanceof Expr.Str s)
            return Value.of(s.value());
        if (expr instanceof Expr.Bool b)
            return Value.of(b.value());
        if (expr instanceof Expr.Null)
            return Value.NULL;
        if (expr instanceof Expr.Ident id)
            return lookup(id.name(), ctx);
        if (expr instanceof Expr.Binary b)
            return Arithmetic.binary(b.op(), eval(b.left(), ctx), eval(b.right(), ctx));
        if (expr instanceof Expr.Unary u)
            return Arithmetic.unary(u.op(), eval(u.operand(), ctx));
        if (expr instanceof Expr.Call c)
            return call(c.callee(), evalArgs(c.args(), ctx), ctx);
        if (expr instanceof Expr.Index i)
            return index(i, ctx);
        if (expr instanceof Expr.Slice s)
            return slice(s, ctx);
        if (expr instanceof Expr.ArrayLit a)
            return Value.array(evalArgs(a.elements(), ctx));
        if (expr instanceof Expr.Ternary t)
            return eval(eval(t.condition(), ctx).truthy() ? t.thenExpr() : t.elseExpr(), ctx);
        if (expr instanceof Expr.When w)
            return when(w, ctx);
        if (expr instanceof Expr.FStr f)
            return fstring(f, ctx);
        if (expr instanceof Expr.Lambda l)
            return new Value.Lambda(l.params(), l.body(), ctx.scope().snapshot());
        if (expr instanceof Expr.Pipeline p)
            return pipeline(p, ctx);
        if (expr instanceof Expr.Member m)
            return member(m.object() + "." + m.member());
        if (expr instanceof Expr.Spread s)
            return eval(s.inner(), ctx);
        throw new IllegalArgumentException("Unknown expression: " + expr.getClass().getSimpleName());
    }

    private Value lookup(String name, EvalContext ctx) {
        Value v = ctx.scope().get(name);
        if (v != null)
            return v;
        if (ctx.hasHistory()) {
            Value meta = metadata(name, ctx.history());
            if (meta != null)
                return meta;
        }
        throw ScriptException.undefinedVariable(name);
    }

    private static Value metadata(String name, RowHistory history) {
        switch (name) {
            case "_index":
                return Value.of((double) history.currentIndex());
            case "_total":
                return Value.of((double) history.totalRows());
            case "_args":
                return Value.array(history.currentRow().values());
            case "_args_names": {
                Row row = history.currentRow();
                List<Value> names = new ArrayList<>(row.size());
                for (String n : row.names())
                    names.add(Value.of(n));
                return Value.array(names);
            }
            default:
                return null;
        }
    }

    private Value member(String qualified) {
        Value v = packageVars.get(qualified);
        if (v == null)
            throw ScriptException.undefinedVariable(qualified);
        return v;
    }

    /** Evaluates left to right, flattening spread elements whose value is an array. */
    private List<Value> evalArgs(List<Expr> exprs, EvalContext ctx) {
        List<Value> out = new ArrayList<>(exprs.size());
        for (Expr e : exprs) {
            Value v = eval(e, ctx);
            if (e instanceof Expr.Spread && v.isArray()) {
                out.addAll(v.elements());
            } else {
                out.add(v);
            }
        }
        return out;
    }

    private Value when(Expr.When w, EvalContext ctx) {
        for (Expr.WhenBranch branch : w.branches()) {
            if (eval(branch.condition(), ctx).truthy())
                return eval(branch.result(), ctx);
        }
        return w.elseExpr() == null ? Value.NULL : eval(w.elseExpr(), ctx);
    }

    private Value fstring(Expr.FStr f, EvalContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (Expr.FStr.Part part : f.parts()) {
            if (part instanceof Expr.FStr.Text t) {
                sb.append(t.text());
            } else if (part instanceof Expr.FStr.Interpolation i) {
                sb.append(eval(i.expr(), ctx).display());
            }
        }
        return Value.of(sb.toString());
    }

    private Value pipeline(Expr.Pipeline p, EvalContext ctx) {
        Value result = eval(p.value(), ctx);
        for (Expr stage : p.stages()) {
            if (!(stage instanceof Expr.Call c))
                throw ScriptException.typeError("pipeline stage must be a function call");
            List<Value> args = new ArrayList<>(c.args().size() + 1);
            args.add(result);
            args.addAll(evalArgs(c.args(), ctx));
            result = call(c.callee(), args, ctx);
        }
        return result;
    }

    // ── Indexing ─────────────────────────────────────────────────

    private Value index(Expr.Index expr, EvalContext ctx) {
        Value idx = eval(expr.index(), ctx);
        if (!(idx instanceof Value.Num n))
            throw ScriptException.typeError("index must be a number, got " + idx.kind());
        int i = (int) n.value();

        if (expr.base() instanceof Expr.Ident id) {
            String name = id.name();
            if (i == 0)
                return lookup(name, ctx);
            if (i < 0) {
                if (ctx.hasHistory()) {
                    Value past = historyValue(ctx.history(), name, -i);
                    if (past != null)
                        return past;
                }
                Value own = lookup(name, ctx);
                return own.isArray() ? elementAt(own.elements(), i) : Value.NULL;
            }
        }

        Value base = eval(expr.base(), ctx);
        if (!base.isArray())
            throw ScriptException.typeError("cannot index " + base.kind());
        return elementAt(base.elements(), i);
    }

    private static Value historyValue(RowHistory history, String name, int offset) {
        Value v = history.inputHistory(name, offset);
        return v != null ? v : history.outputHistory(name, offset);
    }

    /** Python-style: negative counts from the end, out of range is Null. */
    private static Value elementAt(List<Value> elements, int i) {
        int actual = i < 0 ? elements.size() + i : i;
        return actual >= 0 && actual < elements.size() ? elements.get(actual) : Value.NULL;
    }

    private Value slice(Expr.Slice expr, EvalContext ctx) {
        Integer start = sliceBound(expr.start(), ctx);
        Integer end = sliceBound(expr.end(), ctx);

        if (expr.base() instanceof Expr.Ident id
                && ((start != null && start < 0) || (end != null && end < 0))) {
            return historySlice(id.name(), start, end, ctx);
        }

        Value base = eval(expr.base(), ctx);
        if (!base.isArray())
            throw ScriptException.typeError("cannot slice " + base.kind());
        List<Value> elements = base.elements();
        int len = elements.size();
        int from = start == null ? 0 : clamp(start < 0 ? len + start : start, len);
        int to = end == null ? len : clamp(end < 0 ? len + end : end, len);
        if (from >= to)
            return Value.array(new ArrayList<>());
        return Value.array(new ArrayList<>(elements.subList(from, to)));
    }

    private Integer sliceBound(Expr bound, EvalContext ctx) {
        if (bound == null)
            return null;
        Value v = eval(bound, ctx);
        if (!(v instanceof Value.Num n))
            throw ScriptException.typeError("slice bound must be a number, got " + v.kind());
        return (int) n.value();
    }

    private static int clamp(int i, int len) {
        return Math.max(0, Math.min(i, len));
    }

    /**
     * {@code name[start:end]} over rows. A missing start means the oldest
     * reachable row, a missing end the current row.
     */
    private Value historySlice(String name, Integer start, Integer end, EvalContext ctx) {
        if (!ctx.hasHistory())
            throw ScriptException.typeError("time-series slice of '" + name + "' requires row history");
        RowHistory history = ctx.history();
        int startOffset = start == null ? history.maxLookback() : Math.max(0, -start);
        int endOffset = end == null ? 0 : Math.max(0, -end);

        if (history.currentRow().contains(name))
            return Value.array(history.inputSlice(name, startOffset, endOffset));

        List<Value> out = new ArrayList<>(history.outputSlice(name, startOffset, Math.max(endOffset, 1)));
        if (endOffset == 0) {
            Value current = ctx.scope().get(name);
            out.add(current == null ? Value.NULL : current);
        }
        return Value.array(out);
    }

    // ── Calls ────────────────────────────────────────────────────

    /** Resolves {@code callee} and invokes it with already evaluated arguments. */
    public Value call(String callee, List<Value> args, EvalContext ctx) {
        Value local = ctx.scope().get(callee);
        if (local instanceof Value.Lambda || local instanceof Value.Function)
            return invoke(local, args, ctx);

        Value exported = packageVars.get(callee);
        if (exported instanceof Value.Function f)
            return invokeFunction(f.definition(), args, ctx);

        FunctionDef fn = functions.get(callee);
        if (fn != null)
            return invokeFunction(fn, args, ctx);

        Builtin builtin = builtins.lookup(callee);
        if (builtin != null)
            return builtin.invoke(this, ctx, args);

        throw ScriptException.undefinedFunction(callee);
    }

    /** Invokes a Lambda or Function value; used by higher-order builtins. */
    public Value invoke(Value callable, List<Value> args, EvalContext ctx) {
        if (callable instanceof Value.Lambda l)
            return invokeLambda(l, args, ctx);
        if (callable instanceof Value.Function f)
            return invokeFunction(f.definition(), args, ctx);
        throw ScriptException.typeError(callable.kind() + " is not callable");
    }

    private Value invokeLambda(Value.Lambda lambda, List<Value> args, EvalContext ctx) {
        if (args.size() != lambda.params().size())
            throw ScriptException.argumentMismatch(
                    "lambda expects " + lambda.params().size() + " arguments, got " + args.size());

        ExecutionContext scope = ctx.scope();
        Map<String, Value> saved = scope.snapshot();
        try {
            scope.restore(lambda.captures());
            for (int i = 0; i < args.size(); i++)
                scope.set(lambda.params().get(i), args.get(i));
            return eval(lambda.body(), ctx);
        } finally {
            scope.restore(saved);
        }
    }

    private Value invokeFunction(FunctionDef fn, List<Value> args, EvalContext ctx) {
        List<Parameter> params = fn.params();
        int required = fn.requiredCount();
        if (args.size() < required || args.size() > params.size()) {
            String expected = required == params.size() ? String.valueOf(required)
                    : required + ".." + params.size();
            throw ScriptException.argumentMismatch(
                    "function " + fn.name() + " expects " + expected + " arguments, got " + args.size());
        }

        ExecutionContext scope = ctx.scope();
        Map<String, Value> saved = scope.snapshot();
        try {
            for (int i = 0; i < params.size(); i++) {
                Parameter p = params.get(i);
                // Defaults see the parameters bound before them.
                scope.set(p.name(), i < args.size() ? args.get(i) : eval(p.defaultValue(), ctx));
            }
            Value result = executeBody(fn.body(), ctx);
            return result == null ? Value.NULL : result;
        } finally {
            scope.restore(saved);
        }
    }

    // ── Precision ────────────────────────────────────────────────

    /** Rounds Decimal values (top level or array elements) to the configured scale. */
    public Value applyPrecision(Value v) {
        if (precision == null || v == null)
            return v;
        if (v instanceof Value.Dec d)
            return Value.of(d.value().setScale(precision.scale(), RoundingMode.HALF_EVEN));
        if (v.isArray()) {
            List<Value> out = new ArrayList<>(v.elements().size());
            for (Value e : v.elements())
                out.add(applyPrecision(e));
            return Value.array(out);
        }
        return v;
    }

    /** Converts a bound input to its declared kind. Only decimal inputs convert; Null stays Null. */
    static Value coerceInput(Parameter param, Value raw) {
        if (raw == null)
            return Value.NULL;
        if (param.type() == TypeAnnotation.DECIMAL && !raw.isNull()
                && !(raw instanceof Value.Dec)) {
            return Value.of(raw.toDecimal());
        }
        return raw;
    }
}
