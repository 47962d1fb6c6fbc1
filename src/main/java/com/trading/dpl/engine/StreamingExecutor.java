package com.trading.dpl.engine;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.io.EngineConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a data script over an unbounded feed, one tick at a time.
 *
 * <p>
 * Input and output history live in two rings holding the last
 * {@code windowSize} ticks; older ticks are evicted. Lookbacks further than
 * the window see Null. Offsets are resolved against the ring contents.
 *
 * <p>
 * A tick that fails is dropped from history and its exception propagates;
 * the executor stays usable. Not thread-safe: drive it from one thread, for
 * example the consumer of a {@link com.trading.dpl.wiring.TickFeed}.
 */
@Log4j2
public final class StreamingExecutor extends RowExecutor {
    private final int windowSize;
    private final RowRing inputWindow;
    // Outputs of previous ticks, Row.EMPTY where a tick produced none.
    private final RowRing outputWindow;

    private long ticks; // ticks accepted, excluding the one being evaluated

    public StreamingExecutor(DataScript script, int windowSize) {
        this(script, windowSize, ScriptEnvironment.defaults(), EngineConfig.defaults());
    }

    public StreamingExecutor(DataScript script, int windowSize, PackageData packages) {
        this(script, windowSize, ScriptEnvironment.defaults().withPackages(packages), EngineConfig.defaults());
    }

    /** Window size from {@code config.streaming.windowSize}. */
    public StreamingExecutor(DataScript script, ScriptEnvironment env, EngineConfig config) {
        this(script, config.getStreaming().getWindowSize(), env, config);
    }

    public StreamingExecutor(DataScript script, int windowSize, ScriptEnvironment env, EngineConfig config) {
        super(script, env, config.poolConfig());
        if (windowSize < 1)
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        this.windowSize = windowSize;
        // One extra slot: the current tick sits in the ring before eviction.
        this.inputWindow = new RowRing(windowSize + 1);
        this.outputWindow = new RowRing(windowSize + 1);
    }

    /**
     * Evaluates one tick.
     *
     * @return the output row, or empty if the script returned no array
     * @throws ScriptException if evaluation fails; history is left as before
     *                         the call
     */
    public Optional<Row> pushTick(Row tick) {
        inputWindow.addLast(tick);
        Row out;
        try {
            out = evaluateRow(tick);
        } catch (RuntimeException e) {
            inputWindow.removeLast();
            log.debug("Tick {} failed: {}", ticks, e.getMessage());
            throw e;
        }

        outputWindow.addLast(out == null ? Row.EMPTY : out);
        ticks++;
        while (inputWindow.size() > windowSize)
            inputWindow.removeFirst();
        while (outputWindow.size() > windowSize)
            outputWindow.removeFirst();
        return Optional.ofNullable(out);
    }

    public int windowSize() {
        return windowSize;
    }

    /** Number of ticks successfully processed. */
    public long tickCount() {
        return ticks;
    }

    // ── RowHistory ───────────────────────────────────────────────

    @Override
    public Value inputHistory(String name, int offset) {
        // The current tick is the last element of the input ring.
        int target = inputWindow.size() - 1 - offset;
        if (offset < 0 || target < 0)
            return null;
        return field(inputWindow.get(target), name);
    }

    @Override
    public Value outputHistory(String name, int offset) {
        // The output ring only holds previous ticks.
        int target = outputWindow.size() - offset;
        if (offset <= 0 || target < 0)
            return null;
        return field(outputWindow.get(target), name);
    }

    @Override
    public List<Value> inputSlice(String name, int startOffset, int endOffset) {
        List<Value> out = new ArrayList<>(Math.max(0, startOffset - endOffset + 1));
        for (int off = startOffset; off >= endOffset; off--) {
            Value v = inputHistory(name, off);
            out.add(v == null ? Value.NULL : v);
        }
        return out;
    }

    @Override
    public List<Value> outputSlice(String name, int startOffset, int endOffset) {
        if (endOffset == 0)
            throw ScriptException.typeError("output of the current tick is not available yet: " + name);
        List<Value> out = new ArrayList<>(Math.max(0, startOffset - endOffset + 1));
        for (int off = startOffset; off >= endOffset; off--) {
            Value v = outputHistory(name, off);
            out.add(v == null ? Value.NULL : v);
        }
        return out;
    }

    @Override
    public int maxLookback() {
        return Math.max(0, inputWindow.size() - 1);
    }

    @Override
    public long currentIndex() {
        return ticks;
    }

    @Override
    public long totalRows() {
        return ticks + 1;
    }

    @Override
    public Row currentRow() {
        return inputWindow.size() == 0 ? Row.EMPTY : inputWindow.get(inputWindow.size() - 1);
    }
}
