package com.trading.dpl.fn;

import com.trading.dpl.api.Value;
import com.trading.dpl.engine.EvalContext;
import com.trading.dpl.engine.Evaluator;

import java.util.List;

/**
 * A function callable from scripts by name.
 *
 * <p>
 * Builtins receive already evaluated arguments. Higher-order builtins call
 * back through the {@link Evaluator}; time-series builtins read history only
 * through {@link EvalContext#history()}.
 */
@FunctionalInterface
public interface Builtin {
    Value invoke(Evaluator evaluator, EvalContext ctx, List<Value> args);
}
