package com.trading.dpl.engine;

import com.trading.dpl.api.Value;
import com.trading.dpl.ast.FunctionDef;
import com.trading.dpl.ast.PackageScript;
import com.trading.dpl.ast.VariableDef;
import com.trading.dpl.fn.BuiltinRegistry;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Imported package members, flattened to {@code "package.member"} keys.
 *
 * <p>
 * Each package is evaluated once when loaded: its functions are registered,
 * then its variables are evaluated in declaration order (a variable can use
 * earlier variables, the package's own functions and members of packages
 * imported before it). Functions are exported as {@link Value.Function}
 * values. The result is read-only and shared by every row evaluation.
 */
@Log4j2
public final class PackageData {
    private static final PackageData EMPTY = new PackageData(Map.of());

    private final Map<String, Value> members;

    private PackageData(Map<String, Value> members) {
        this.members = members;
    }

    public static PackageData empty() {
        return EMPTY;
    }

    /** Wraps members that were already evaluated elsewhere. */
    public static PackageData of(Map<String, Value> flatMembers) {
        return new PackageData(Collections.unmodifiableMap(new LinkedHashMap<>(flatMembers)));
    }

    /**
     * Evaluates the imported packages.
     *
     * @param imports  package names in import order
     * @param scripts  available packages by name
     * @param builtins builtins visible to package variable initializers
     * @throws IllegalArgumentException if an imported package is not available
     */
    public static PackageData load(List<String> imports, Map<String, PackageScript> scripts,
            BuiltinRegistry builtins) {
        Map<String, Value> flat = new LinkedHashMap<>();
        for (String name : imports) {
            PackageScript pkg = scripts.get(name);
            if (pkg == null)
                throw new IllegalArgumentException("Package not found: " + name);
            flat.putAll(evaluate(pkg, flat, builtins));
            log.debug("Loaded package '{}' ({} variables, {} functions)", name, pkg.variables().size(),
                    pkg.functions().size());
        }
        return new PackageData(Collections.unmodifiableMap(flat));
    }

    private static Map<String, Value> evaluate(PackageScript pkg, Map<String, Value> loaded,
            BuiltinRegistry builtins) {
        Map<String, FunctionDef> functions = new HashMap<>();
        for (FunctionDef fn : pkg.functions())
            functions.put(fn.name(), fn);

        Evaluator evaluator = new Evaluator(builtins, loaded, functions, null);
        ExecutionContext scope = new ExecutionContext();
        EvalContext ctx = EvalContext.of(scope);

        Map<String, Value> out = new LinkedHashMap<>();
        for (VariableDef var : pkg.variables()) {
            Value value = evaluator.eval(var.value(), ctx);
            scope.set(var.name(), value);
            out.put(pkg.name() + "." + var.name(), value);
        }
        for (FunctionDef fn : pkg.functions())
            out.put(pkg.name() + "." + fn.name(), new Value.Function(fn));
        return out;
    }

    public Map<String, Value> members() {
        return members;
    }

    /** The member value, or Java null if absent. */
    public Value get(String qualifiedName) {
        return members.get(qualifiedName);
    }

    public int size() {
        return members.size();
    }
}
