package com.trading.dpl;

import com.trading.dpl.api.Row;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.dsl.ScriptBuilder;
import com.trading.dpl.engine.BatchExecutor;
import com.trading.dpl.engine.ScriptEnvironment;
import com.trading.dpl.engine.ScriptExecutor;
import com.trading.dpl.engine.StreamingExecutor;
import com.trading.dpl.io.EngineConfig;
import com.trading.dpl.wiring.TickFeed;
import com.trading.dpl.wiring.TickPublisher;

import java.util.List;

/**
 * DPL -- row-oriented time-series script engine.
 *
 * <h2>Model</h2>
 * <p>
 * A data script declares INPUT and OUTPUT columns and a body evaluated once
 * per row. The body sees the current row's inputs as variables and can look
 * back at earlier rows: {@code close[-1]}, {@code close[-5:]},
 * {@code ref("ma", 1)}, {@code past("close", 3)}.
 *
 * <h3>Execution</h3>
 * <ul>
 * <li><b>Batch:</b> {@link BatchExecutor} over a complete row set, with
 * unlimited lookback.</li>
 * <li><b>Streaming:</b> {@link StreamingExecutor} over a live feed, with
 * lookback bounded by a ring buffer.</li>
 * <li><b>Live feed:</b> {@link TickFeed} puts a Disruptor ring buffer in front
 * of a streaming executor.</li>
 * <li><b>Single shot:</b> {@link ScriptExecutor}, the only path with ERROR
 * block recovery.</li>
 * </ul>
 */
public final class Dpl {

    private Dpl() {
        // Prevent instantiation of utility class
    }

    /** Entry point: a fluent builder for a data script. */
    public static ScriptBuilder script() {
        return ScriptBuilder.create();
    }

    public static List<Row> runBatch(DataScript script, List<Row> rows) {
        return new BatchExecutor(script, rows, ScriptEnvironment.defaults(), EngineConfig.load()).executeAll();
    }

    /** A streaming executor sized by the classpath configuration. */
    public static StreamingExecutor streaming(DataScript script) {
        return new StreamingExecutor(script, ScriptEnvironment.defaults(), EngineConfig.load());
    }

    /** A started live feed over a new streaming executor. */
    public static TickFeed feed(DataScript script, TickPublisher.OutputListener listener) {
        EngineConfig config = EngineConfig.load();
        StreamingExecutor executor = new StreamingExecutor(script, ScriptEnvironment.defaults(), config);
        return new TickFeed(executor, listener, config).start();
    }
}
