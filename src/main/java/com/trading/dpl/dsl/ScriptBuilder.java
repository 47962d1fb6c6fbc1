package com.trading.dpl.dsl;

import com.trading.dpl.ast.DataScript;
import com.trading.dpl.ast.Expr;
import com.trading.dpl.ast.FunctionDef;
import com.trading.dpl.ast.PackageScript;
import com.trading.dpl.ast.Parameter;
import com.trading.dpl.ast.PrecisionSetting;
import com.trading.dpl.ast.Stmt;
import com.trading.dpl.ast.TypeAnnotation;
import com.trading.dpl.ast.VariableDef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Script Builder -- fluent construction of data and package scripts.
 *
 * Usage Pattern:
 * 1. Create a builder: ScriptBuilder s = ScriptBuilder.create();
 * 2. Declare columns: s.input("close").output("ma2");
 * 3. Add statements: s.body(let("m", ...), ret(array(id("m"))));
 * 4. Build: DataScript script = s.build();
 *
 * A builder can be built once; column names must be unique per section.
 */
public final class ScriptBuilder {
    private final List<String> imports = new ArrayList<>();
    private final List<Parameter> input = new ArrayList<>();
    private final List<Parameter> output = new ArrayList<>();
    private final List<Stmt> body = new ArrayList<>();
    private List<Stmt> errorBlock;
    private PrecisionSetting precision;

    // Flag to prevent modification after building
    private boolean built;

    private ScriptBuilder() {
    }

    public static ScriptBuilder create() {
        return new ScriptBuilder();
    }

    public static PackageBuilder pkg(String name) {
        return new PackageBuilder(name);
    }

    public ScriptBuilder imports(String... packages) {
        checkNotBuilt();
        imports.addAll(Arrays.asList(packages));
        return this;
    }

    public ScriptBuilder input(String... names) {
        checkNotBuilt();
        for (String n : names)
            addUnique(input, Parameter.of(n), "INPUT");
        return this;
    }

    public ScriptBuilder input(String name, TypeAnnotation type) {
        checkNotBuilt();
        addUnique(input, Parameter.of(name, type), "INPUT");
        return this;
    }

    public ScriptBuilder output(String... names) {
        checkNotBuilt();
        for (String n : names)
            addUnique(output, Parameter.of(n), "OUTPUT");
        return this;
    }

    /** Rounds Decimal results to {@code scale} places. */
    public ScriptBuilder precision(int scale) {
        checkNotBuilt();
        this.precision = new PrecisionSetting(scale);
        return this;
    }

    public ScriptBuilder body(Stmt... statements) {
        checkNotBuilt();
        body.addAll(Arrays.asList(statements));
        return this;
    }

    /** Statements run with {@code __error__} bound when the body fails. */
    public ScriptBuilder onError(Stmt... statements) {
        checkNotBuilt();
        this.errorBlock = Arrays.asList(statements);
        return this;
    }

    public DataScript build() {
        checkNotBuilt();
        built = true;
        return new DataScript(imports, input, output, errorBlock, precision, body);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Script already built");
    }

    private static void addUnique(List<Parameter> list, Parameter p, String section) {
        for (Parameter existing : list) {
            if (existing.name().equals(p.name()))
                throw new IllegalArgumentException("Duplicate " + section + " column: " + p.name());
        }
        list.add(p);
    }

    /**
     * Fluent construction of a {@link PackageScript}.
     */
    public static final class PackageBuilder {
        private final String name;
        private final List<VariableDef> variables = new ArrayList<>();
        private final List<FunctionDef> functions = new ArrayList<>();
        private final Set<String> members = new HashSet<>();

        private PackageBuilder(String name) {
            this.name = name;
        }

        public PackageBuilder variable(String member, Expr value) {
            claim(member);
            variables.add(new VariableDef(member, value, false));
            return this;
        }

        public PackageBuilder function(FunctionDef fn) {
            claim(fn.name());
            functions.add(fn);
            return this;
        }

        public PackageScript build() {
            return new PackageScript(name, variables, functions);
        }

        private void claim(String member) {
            if (!members.add(member))
                throw new IllegalArgumentException("Duplicate member in package " + name + ": " + member);
        }
    }
}
