package com.trading.dpl.ast;

import java.util.List;

/**
 * A named user function. Parameters with default values must all come after
 * the required ones.
 */
public record FunctionDef(String name, List<Parameter> params, TypeAnnotation returnType, List<Stmt> body) {

    public FunctionDef {
        params = List.copyOf(params);
        body = List.copyOf(body);
        boolean seenDefault = false;
        for (Parameter p : params) {
            if (p.hasDefault()) {
                seenDefault = true;
            } else if (seenDefault) {
                throw new IllegalArgumentException("Function " + name + ": required parameter '" + p.name()
                        + "' follows a parameter with a default value");
            }
        }
    }

    /** Number of leading parameters without a default value. */
    public int requiredCount() {
        int n = 0;
        while (n < params.size() && !params.get(n).hasDefault())
            n++;
        return n;
    }
}
