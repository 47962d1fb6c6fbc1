package com.trading.dpl.engine;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.RowHistory;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.ast.Parameter;

import java.util.List;

/**
 * Shared per-row pipeline of the batch and streaming executors.
 *
 * <p>
 * Per row: lease a scope, bind INPUT columns (missing fields are Null), run
 * the body with this executor as the row history, turn the result into an
 * output row, return the scope. The scope goes back to the pool on every
 * exit path.
 *
 * <p>
 * Subclasses decide how much history they keep.
 */
abstract class RowExecutor implements RowHistory {
    protected final DataScript script;
    protected final Evaluator evaluator;
    private final ContextPool pool;

    protected RowExecutor(DataScript script, ScriptEnvironment env, PoolConfig poolConfig) {
        this.script = script;
        this.evaluator = env.evaluator(script.precision());
        this.pool = new ContextPool(poolConfig);
    }

    /**
     * Evaluates one input row.
     *
     * @return the output row, or null if the body did not return an array
     */
    protected final Row evaluateRow(Row input) {
        try (ContextPool.Lease lease = pool.lease()) {
            ExecutionContext scope = lease.context();
            for (Parameter p : script.input())
                scope.set(p.name(), Evaluator.coerceInput(p, input.get(p.name())));

            Value result = evaluator.executeBody(script.body(), new EvalContext(scope, this));
            return toOutputRow(evaluator.applyPrecision(result));
        }
    }

    /** Maps array elements to OUTPUT names by position; surplus names are left out. */
    private Row toOutputRow(Value result) {
        if (result == null || !result.isArray())
            return null;
        List<Value> values = result.elements();
        List<Parameter> output = script.output();
        Row.Builder row = Row.builder();
        for (int i = 0; i < output.size() && i < values.size(); i++)
            row.put(output.get(i).name(), values.get(i));
        return row.build();
    }

    /** Value of {@code name} in {@code row}, or null when absent. */
    protected static Value field(Row row, String name) {
        return row == null ? null : row.get(name);
    }

    int availableScopes() {
        return pool.availableCount();
    }
}
