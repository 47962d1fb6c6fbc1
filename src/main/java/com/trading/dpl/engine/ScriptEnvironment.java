package com.trading.dpl.engine;

import com.trading.dpl.ast.FunctionDef;
import com.trading.dpl.ast.PrecisionSetting;
import com.trading.dpl.fn.BuiltinRegistry;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything a script can call besides its own statements: builtins, imported
 * package members and locally registered user functions.
 */
public record ScriptEnvironment(BuiltinRegistry builtins, PackageData packages,
        Map<String, FunctionDef> functions) {

    public ScriptEnvironment {
        functions = Map.copyOf(functions);
    }

    public static ScriptEnvironment defaults() {
        return new ScriptEnvironment(new BuiltinRegistry(), PackageData.empty(), Map.of());
    }

    public ScriptEnvironment withPackages(PackageData packages) {
        return new ScriptEnvironment(builtins, packages, functions);
    }

    public ScriptEnvironment withBuiltins(BuiltinRegistry builtins) {
        return new ScriptEnvironment(builtins, packages, functions);
    }

    public ScriptEnvironment withFunction(FunctionDef fn) {
        Map<String, FunctionDef> copy = new HashMap<>(functions);
        copy.put(fn.name(), fn);
        return new ScriptEnvironment(builtins, packages, copy);
    }

    Evaluator evaluator(PrecisionSetting precision) {
        return new Evaluator(builtins, packages.members(), functions, precision);
    }
}
