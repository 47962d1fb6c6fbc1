package com.trading.dpl.engine;

import com.trading.dpl.api.ErrorType;
import com.trading.dpl.api.Row;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.dsl.ScriptBuilder;
import com.trading.dpl.io.EngineConfig;
import org.junit.Test;

import java.util.Optional;

import static com.trading.dpl.dsl.Exprs.*;
import static com.trading.dpl.dsl.Stmts.*;
import static org.junit.Assert.*;

public class StreamingExecutorTest {

    private static Row tick(double close) {
        return Row.of("close", Value.of(close));
    }

    @Test
    public void testEachTickProducesOutput() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("double")
                .body(ret(array(mul(id("close"), num(2)))))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 10);

        assertEquals(Value.of(20), executor.pushTick(tick(10)).get().get("double"));
        assertEquals(Value.of(22), executor.pushTick(tick(11)).get().get("double"));
        assertEquals(2, executor.tickCount());
    }

    @Test
    public void testLookbackBeyondWindowIsNull() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("back2", "back3")
                .body(ret(array(call("ref", str("close"), num(2)), call("ref", str("close"), num(3)))))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 2);

        executor.pushTick(tick(1));
        executor.pushTick(tick(2));
        executor.pushTick(tick(3));
        Row out = executor.pushTick(tick(4)).get();

        assertEquals(Value.of(2), out.get("back2"));
        assertEquals(Value.NULL, out.get("back3"));
    }

    @Test
    public void testOutputHistoryCarriesAcrossTicks() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("total")
                .body(mutable("total", num(0)),
                        ret(array(add(hist("total", -1), id("close")))))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 5);

        executor.pushTick(tick(1));
        executor.pushTick(tick(2));
        Row out = executor.pushTick(tick(3)).get();

        assertEquals(Value.of(6), out.get("total"));
    }

    @Test
    public void testNoArrayResultIsEmpty() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("x")
                .body(expr(id("close")))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 3);

        Optional<Row> out = executor.pushTick(tick(1));

        assertFalse(out.isPresent());
        assertEquals(1, executor.tickCount());
    }

    @Test
    public void testFailedTickLeavesHistoryUnchanged() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("prev", "inv")
                .body(ret(array(call("ref", str("close"), num(1)), div(num(1), id("close")))))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 4);

        executor.pushTick(tick(5));
        try {
            executor.pushTick(tick(0));
            fail("Expected ScriptException");
        } catch (ScriptException e) {
            assertEquals(ErrorType.ZERO_DIVISION, e.errorType());
        }
        assertEquals(1, executor.tickCount());

        // The failed tick is not visible as history.
        Row out = executor.pushTick(tick(2)).get();
        assertEquals(Value.of(5), out.get("prev"));
        assertEquals(Value.of(0.5), out.get("inv"));
        assertEquals(2, executor.tickCount());
    }

    @Test
    public void testIndexTracksTicks() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("i", "n")
                .body(ret(array(id("_index"), id("_total"))))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 1);

        executor.pushTick(tick(1));
        executor.pushTick(tick(1));
        Row out = executor.pushTick(tick(1)).get();

        assertEquals(Value.of(2), out.get("i"));
        assertEquals(Value.of(3), out.get("n"));
    }

    @Test
    public void testWindowSlice() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("last3")
                .body(ret(array(slice(id("close"), num(-2), null))))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 8);

        executor.pushTick(tick(1));
        Row first = executor.pushTick(tick(2)).get();
        executor.pushTick(tick(3));
        Row out = executor.pushTick(tick(4)).get();

        assertEquals(Value.array(Value.NULL, Value.of(1), Value.of(2)), first.get("last3"));
        assertEquals(Value.numbers(2, 3, 4), out.get("last3"));
    }

    @Test
    public void testOpenStartSliceIsBoundedByWindow() {
        DataScript script = ScriptBuilder.create()
                .input("close").output("n", "prev")
                .body(let("prev", slice(id("close"), null, num(-1))),
                        ret(array(call("len", id("prev")), id("prev"))))
                .build();
        StreamingExecutor executor = new StreamingExecutor(script, 3);

        Row first = executor.pushTick(tick(1)).get();
        Row out = first;
        for (int i = 2; i <= 5000; i++)
            out = executor.pushTick(tick(i)).get();

        assertEquals(Value.of(0), first.get("n"));
        assertEquals(Value.of(3), out.get("n"));
        assertEquals(Value.numbers(4997, 4998, 4999), out.get("prev"));
    }

    @Test
    public void testWindowSizeFromConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.getStreaming().setWindowSize(7);
        DataScript script = ScriptBuilder.create().input("close").body(ret(nil())).build();

        StreamingExecutor executor = new StreamingExecutor(script, ScriptEnvironment.defaults(), config);

        assertEquals(7, executor.windowSize());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsEmptyWindow() {
        new StreamingExecutor(ScriptBuilder.create().build(), 0);
    }
}
