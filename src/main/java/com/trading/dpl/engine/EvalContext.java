package com.trading.dpl.engine;

import com.trading.dpl.api.RowHistory;

/**
 * What one evaluation can see: the mutable scope and, when running inside an
 * executor, the time-series history of the current row.
 *
 * @param scope   variable bindings of the current row
 * @param history row history, or null for history-free evaluation
 */
public record EvalContext(ExecutionContext scope, RowHistory history) {

    public static EvalContext of(ExecutionContext scope) {
        return new EvalContext(scope, null);
    }

    public boolean hasHistory() {
        return history != null;
    }
}
