package com.trading.dpl.engine;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.ast.Parameter;

import lombok.extern.log4j.Log4j2;

/**
 * Evaluates a data script once, without row history.
 *
 * <p>
 * This is the only path where a script's ERROR block can recover: when the
 * body throws a {@link ScriptException}, {@code __error__} is bound to the
 * error message, the ERROR block runs in the same scope and its return value
 * becomes the result. An error inside the ERROR block propagates.
 */
@Log4j2
public final class ScriptExecutor {
    public static final String ERROR_VARIABLE = "__error__";

    private final DataScript script;
    private final Evaluator evaluator;

    public ScriptExecutor(DataScript script) {
        this(script, ScriptEnvironment.defaults());
    }

    public ScriptExecutor(DataScript script, ScriptEnvironment env) {
        this.script = script;
        this.evaluator = env.evaluator(script.precision());
    }

    /**
     * Binds {@code input} to the INPUT columns and runs the body.
     *
     * @return the returned value with precision applied, or Null when the
     *         script returned nothing
     */
    public Value execute(Row input) {
        ExecutionContext scope = new ExecutionContext();
        for (Parameter p : script.input())
            scope.set(p.name(), Evaluator.coerceInput(p, input.get(p.name())));
        EvalContext ctx = EvalContext.of(scope);

        Value result;
        try {
            result = evaluator.executeBody(script.body(), ctx);
        } catch (ScriptException e) {
            if (script.errorBlock() == null)
                throw e;
            log.warn("Script failed, running ERROR block: {}", e.getMessage());
            scope.set(ERROR_VARIABLE, Value.of(e.detail()));
            result = evaluator.executeBody(script.errorBlock(), ctx);
        }
        return result == null ? Value.NULL : evaluator.applyPrecision(result);
    }

    /** Like {@link #execute(Row)} but maps an array result to the OUTPUT columns. */
    public Row executeRow(Row input) {
        Value result = execute(input);
        if (!result.isArray())
            return null;
        Row.Builder row = Row.builder();
        for (int i = 0; i < script.output().size() && i < result.elements().size(); i++)
            row.put(script.output().get(i).name(), result.elements().get(i));
        return row.build();
    }
}
