package com.trading.dpl.engine;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.ast.PackageScript;
import com.trading.dpl.dsl.ScriptBuilder;
import com.trading.dpl.fn.BuiltinRegistry;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static com.trading.dpl.dsl.Exprs.*;
import static com.trading.dpl.dsl.Stmts.*;
import static org.junit.Assert.*;

public class PackageDataTest {

    private static final PackageScript RISK = ScriptBuilder.pkg("risk")
            .variable("limit", num(100))
            .variable("half", div(id("limit"), num(2)))
            .function(function("clip", List.of(param("x")),
                    ret(ternary(gt(id("x"), num(100)), num(100), id("x")))))
            .build();

    private static final PackageScript SIZING = ScriptBuilder.pkg("sizing")
            .variable("unit", mul(member("risk", "half"), num(3)))
            .build();

    @Test
    public void testVariablesEvaluatedInOrder() {
        PackageData data = PackageData.load(List.of("risk"), Map.of("risk", RISK), new BuiltinRegistry());

        assertEquals(Value.of(100), data.get("risk.limit"));
        assertEquals(Value.of(50), data.get("risk.half"));
        assertTrue(data.get("risk.clip") instanceof Value.Function);
        assertEquals(3, data.size());
    }

    @Test
    public void testLaterPackagesSeeEarlierOnes() {
        PackageData data = PackageData.load(List.of("risk", "sizing"),
                Map.of("risk", RISK, "sizing", SIZING), new BuiltinRegistry());

        assertEquals(Value.of(150), data.get("sizing.unit"));
    }

    @Test
    public void testMissingPackage() {
        try {
            PackageData.load(List.of("nope"), Map.of(), new BuiltinRegistry());
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Package not found: nope", e.getMessage());
        }
    }

    @Test
    public void testScriptUsesPackageMembers() {
        PackageData data = PackageData.load(List.of("risk"), Map.of("risk", RISK), new BuiltinRegistry());
        DataScript script = ScriptBuilder.create()
                .imports("risk")
                .input("qty").output("clipped", "limit")
                .body(ret(array(call("risk.clip", id("qty")), member("risk", "limit"))))
                .build();

        List<Row> out = new BatchExecutor(script,
                List.of(Row.of("qty", Value.of(30)), Row.of("qty", Value.of(300))), data).executeAll();

        assertEquals(Value.of(30), out.get(0).get("clipped"));
        assertEquals(Value.of(100), out.get(1).get("clipped"));
        assertEquals(Value.of(100), out.get(1).get("limit"));
    }

    @Test
    public void testPreEvaluatedMembers() {
        PackageData data = PackageData.of(Map.of("cfg.fee", Value.of(0.001)));

        assertEquals(Value.of(0.001), data.get("cfg.fee"));
        assertNull(data.get("cfg.other"));
        assertEquals(0, PackageData.empty().size());
    }
}
