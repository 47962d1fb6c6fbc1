package com.trading.dpl.wiring;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.dsl.ScriptBuilder;
import com.trading.dpl.engine.StreamingExecutor;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.trading.dpl.dsl.Exprs.*;
import static com.trading.dpl.dsl.Stmts.*;
import static org.junit.Assert.*;

public class TickFeedTest {

    // delta = close - close[-1], fails on a zero close
    private static final DataScript SCRIPT = ScriptBuilder.create()
            .input("close").output("delta", "inv")
            .body(ret(array(sub(id("close"), call("ref", str("close"), num(1))),
                    div(num(1), id("close")))))
            .build();

    private static Row tick(double close) {
        return Row.of("close", Value.of(close));
    }

    @Test
    public void testOutputsInPublishOrder() throws InterruptedException {
        List<Double> deltas = new CopyOnWriteArrayList<>();
        List<Long> sequences = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(5);

        try (TickFeed feed = new TickFeed(new StreamingExecutor(SCRIPT, 16), (seq, row) -> {
            sequences.add(seq);
            deltas.add(row.get("delta").toNumber());
            done.countDown();
        }).start()) {
            for (int i = 1; i <= 5; i++)
                feed.publish(tick(i * 10));
            assertTrue("Timed out waiting for outputs", done.await(5, TimeUnit.SECONDS));
        }

        assertEquals(List.of(10.0, 10.0, 10.0, 10.0, 10.0), deltas);
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), sequences);
    }

    @Test
    public void testFailedTickDoesNotStopConsumer() throws InterruptedException {
        List<Row> outputs = new CopyOnWriteArrayList<>();
        List<Long> failures = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);

        TickFeed feed = new TickFeed(new StreamingExecutor(SCRIPT, 16), new TickPublisher.OutputListener() {
            @Override
            public void onOutput(long sequenceId, Row output) {
                outputs.add(output);
                done.countDown();
            }

            @Override
            public void onError(long sequenceId, RuntimeException error) {
                assertTrue(error instanceof ScriptException);
                failures.add(sequenceId);
                done.countDown();
            }
        }).start();
        try {
            feed.publish(tick(4));
            feed.publish(tick(0));
            feed.publish(tick(5));
            assertTrue("Timed out waiting for ticks", done.await(5, TimeUnit.SECONDS));
        } finally {
            feed.close();
        }

        assertEquals(List.of(1L), failures);
        assertEquals(2, outputs.size());
        // The failed tick left no trace in history.
        assertEquals(Value.of(1), outputs.get(1).get("delta"));
        assertEquals(2, feed.publisher().processedCount());
        assertEquals(1, feed.publisher().failedCount());
    }

    @Test
    public void testPublishBeforeStartIsRejected() {
        TickFeed feed = new TickFeed(new StreamingExecutor(SCRIPT, 4), (seq, row) -> {
        });
        assertThrows(IllegalStateException.class, () -> feed.publish(tick(1)));
    }

    @Test
    public void testStartTwiceIsRejected() {
        try (TickFeed feed = new TickFeed(new StreamingExecutor(SCRIPT, 4), (seq, row) -> {
        }).start()) {
            assertThrows(IllegalStateException.class, feed::start);
        }
    }
}
