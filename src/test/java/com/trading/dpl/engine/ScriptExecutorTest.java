package com.trading.dpl.engine;

import com.trading.dpl.api.ErrorType;
import com.trading.dpl.api.Row;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.ast.FunctionDef;
import com.trading.dpl.dsl.ScriptBuilder;
import com.trading.dpl.fn.BuiltinRegistry;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.trading.dpl.dsl.Exprs.*;
import static com.trading.dpl.dsl.Stmts.*;
import static org.junit.Assert.*;

public class ScriptExecutorTest {

    @Test
    public void testReturnsValue() {
        DataScript script = ScriptBuilder.create()
                .input("a", "b")
                .body(ret(add(id("a"), id("b"))))
                .build();

        Value v = new ScriptExecutor(script).execute(Row.of("a", Value.of(1), "b", Value.of(2)));

        assertEquals(Value.of(3), v);
    }

    @Test
    public void testMissingInputIsNull() {
        DataScript script = ScriptBuilder.create()
                .input("a")
                .body(ret(call("is_null", id("a"))))
                .build();

        assertEquals(Value.TRUE, new ScriptExecutor(script).execute(Row.EMPTY));
    }

    @Test
    public void testNoReturnIsNull() {
        DataScript script = ScriptBuilder.create().body(let("x", num(1))).build();

        assertEquals(Value.NULL, new ScriptExecutor(script).execute(Row.EMPTY));
    }

    @Test
    public void testErrorBlockRecovers() {
        DataScript script = ScriptBuilder.create()
                .input("x")
                .body(let("before", num(7)), ret(div(num(1), id("x"))))
                .onError(ret(array(id("__error__"), id("before"))))
                .build();

        Value v = new ScriptExecutor(script).execute(Row.of("x", Value.ZERO));

        assertEquals(Value.array(Value.of("division by zero"), Value.of(7)), v);
    }

    @Test
    public void testErrorBlockNotRunOnSuccess() {
        DataScript script = ScriptBuilder.create()
                .input("x")
                .body(ret(div(num(1), id("x"))))
                .onError(ret(num(-1)))
                .build();

        assertEquals(Value.of(0.5), new ScriptExecutor(script).execute(Row.of("x", Value.of(2))));
    }

    @Test
    public void testWithoutErrorBlockExceptionPropagates() {
        DataScript script = ScriptBuilder.create().body(ret(id("ghost"))).build();

        try {
            new ScriptExecutor(script).execute(Row.EMPTY);
            fail("Expected ScriptException");
        } catch (ScriptException e) {
            assertEquals(ErrorType.UNDEFINED_VARIABLE, e.errorType());
            assertEquals("undefined variable: ghost", e.detail());
        }
    }

    @Test
    public void testFailureInsideErrorBlockPropagates() {
        DataScript script = ScriptBuilder.create()
                .body(ret(id("ghost")))
                .onError(ret(call("nope")))
                .build();

        try {
            new ScriptExecutor(script).execute(Row.EMPTY);
            fail("Expected ScriptException");
        } catch (ScriptException e) {
            assertEquals(ErrorType.UNDEFINED_FUNCTION, e.errorType());
        }
    }

    @Test
    public void testHistoryBuiltinsNeedRows() {
        DataScript script = ScriptBuilder.create()
                .input("close")
                .body(ret(call("ref", str("close"), num(1))))
                .build();

        try {
            new ScriptExecutor(script).execute(Row.of("close", Value.of(1)));
            fail("Expected ScriptException");
        } catch (ScriptException e) {
            assertEquals(ErrorType.TYPE_ERROR, e.errorType());
        }
    }

    @Test
    public void testPrecisionAppliedToResult() {
        DataScript script = ScriptBuilder.create()
                .precision(2)
                .body(ret(array(call("decimal", str("1.005")), call("decimal", str("2.675")), num(1.23456))))
                .build();

        Value v = new ScriptExecutor(script).execute(Row.EMPTY);

        // Decimals round half-even; plain numbers are untouched.
        assertEquals(Value.array(Value.of(new BigDecimal("1.00")), Value.of(new BigDecimal("2.68")),
                Value.of(1.23456)), v);
    }

    @Test
    public void testExecuteRowMapsOutputs() {
        DataScript script = ScriptBuilder.create()
                .input("x").output("double", "triple")
                .body(ret(array(mul(id("x"), num(2)), mul(id("x"), num(3)))))
                .build();

        Row row = new ScriptExecutor(script).executeRow(Row.of("x", Value.of(2)));

        assertEquals(List.of("double", "triple"), row.names());
        assertEquals(Value.of(6), row.get("triple"));
    }

    @Test
    public void testLocalFunctionFromEnvironment() {
        FunctionDef square = function("square", List.of(param("v")), ret(mul(id("v"), id("v"))));
        DataScript script = ScriptBuilder.create()
                .input("x")
                .body(ret(call("square", id("x"))))
                .build();

        ScriptExecutor executor = new ScriptExecutor(script, ScriptEnvironment.defaults().withFunction(square));

        assertEquals(Value.of(9), executor.execute(Row.of("x", Value.of(3))));
    }

    @Test
    public void testRoundOfNaNStaysNaN() {
        DataScript script = ScriptBuilder.create()
                .input("x")
                .body(ret(call("round", call("sqrt", id("x")))))
                .onError(ret(str("recovered")))
                .build();

        Value v = new ScriptExecutor(script).execute(Row.of("x", Value.of(-1)));

        assertEquals(Value.of(Double.NaN), v);
    }

    @Test
    public void testCustomBuiltinsFromEnvironment() {
        BuiltinRegistry builtins = new BuiltinRegistry()
                .register("spread", (ev, ctx, a) -> Value.of(a.get(0).toNumber() - a.get(1).toNumber()));
        DataScript script = ScriptBuilder.create()
                .input("bid", "ask")
                .body(ret(call("spread", id("ask"), id("bid"))))
                .build();
        ScriptEnvironment env = ScriptEnvironment.defaults().withBuiltins(builtins);

        Value v = new ScriptExecutor(script, env).execute(Row.of("bid", Value.of(99), "ask", Value.of(101)));

        assertEquals(Value.of(2), v);
    }
}
