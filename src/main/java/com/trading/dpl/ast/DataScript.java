package com.trading.dpl.ast;

import java.util.List;

/**
 * A data-processing script: evaluated once per row.
 *
 * @param imports    package names, resolved to package data before execution
 * @param input      INPUT columns bound into scope for every row
 * @param output     OUTPUT columns, matched by position to the returned array
 * @param errorBlock statements run when the body fails (single-shot
 *                   execution only), may be null
 * @param precision  decimal rounding applied to results, may be null
 * @param body       the statements evaluated per row
 */
public record DataScript(List<String> imports, List<Parameter> input, List<Parameter> output,
        List<Stmt> errorBlock, PrecisionSetting precision, List<Stmt> body) {

    public DataScript {
        imports = List.copyOf(imports);
        input = List.copyOf(input);
        output = List.copyOf(output);
        errorBlock = errorBlock == null ? null : List.copyOf(errorBlock);
        body = List.copyOf(body);
    }
}
