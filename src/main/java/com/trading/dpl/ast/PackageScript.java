package com.trading.dpl.ast;

import java.util.List;

/**
 * A package: named variables and functions imported by data scripts as
 * {@code name.member}.
 */
public record PackageScript(String name, List<VariableDef> variables, List<FunctionDef> functions) {
    public PackageScript {
        variables = List.copyOf(variables);
        functions = List.copyOf(functions);
    }
}
