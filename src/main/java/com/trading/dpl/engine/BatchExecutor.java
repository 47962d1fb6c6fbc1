package com.trading.dpl.engine;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.ScriptException;
import com.trading.dpl.api.Value;
import com.trading.dpl.ast.DataScript;
import com.trading.dpl.io.EngineConfig;
import com.trading.dpl.storage.ColumnarStorage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a data script over a complete, fixed batch of rows.
 *
 * <p>
 * The whole input matrix and every produced output row stay available as
 * history, so lookbacks are limited only by the row index.
 *
 * <p>
 * Lifecycle: IDLE → RUNNING → DONE, or FAILED when a row throws. A failed
 * executor is unhealthy: further calls throw {@link IllegalStateException}.
 * Not thread-safe; use one executor per thread.
 */
@Log4j2
public final class BatchExecutor extends RowExecutor {

    public enum State {
        IDLE, RUNNING, DONE, FAILED
    }

    private final List<Row> inputs;
    // Aligned with inputs: Row.EMPTY where a row produced no output.
    private final List<Row> outputHistory;
    private final List<Row> outputs = new ArrayList<>();
    private final ColumnarStorage columnar;

    private State state = State.IDLE;
    private int index;
    private RuntimeException failure;

    public BatchExecutor(DataScript script, List<Row> rows) {
        this(script, rows, ScriptEnvironment.defaults(), EngineConfig.defaults());
    }

    public BatchExecutor(DataScript script, List<Row> rows, PackageData packages) {
        this(script, rows, ScriptEnvironment.defaults().withPackages(packages), EngineConfig.defaults());
    }

    public BatchExecutor(DataScript script, List<Row> rows, ScriptEnvironment env, EngineConfig config) {
        super(script, env, config.poolConfig());
        // An empty batch still evaluates the script once, against an empty row.
        this.inputs = rows.isEmpty() ? List.of(Row.EMPTY) : List.copyOf(rows);
        this.outputHistory = new ArrayList<>(inputs.size());
        this.columnar = buildColumnar(inputs, config);
    }

    private static ColumnarStorage buildColumnar(List<Row> rows, EngineConfig config) {
        if (!config.getColumnar().isEnabled())
            return null;
        ColumnarStorage storage = ColumnarStorage.fromRows(rows);
        if (!ColumnarStorage.shouldUseColumnar(storage.columnCount(), storage.rowCount()))
            return null;
        log.debug("Serving input history from columnar storage ({} columns x {} rows)",
                storage.columnCount(), storage.rowCount());
        return storage;
    }

    /**
     * Evaluates every row in order.
     *
     * @return output rows in input order; rows without an array result are
     *         skipped
     * @throws ScriptException       if a row fails; carries the row index
     * @throws IllegalStateException if a previous call failed
     */
    public List<Row> executeAll() {
        if (state == State.DONE)
            return Collections.unmodifiableList(outputs);
        if (state == State.FAILED)
            throw new IllegalStateException(
                    "Executor is in unhealthy state due to a failed row. Create a new executor.", failure);
        if (state == State.RUNNING)
            throw new IllegalStateException("executeAll() is not reentrant");

        state = State.RUNNING;
        long start = System.nanoTime();
        try {
            for (; index < inputs.size(); index++) {
                Row out = evaluateRow(inputs.get(index));
                outputHistory.add(out == null ? Row.EMPTY : out);
                if (out != null)
                    outputs.add(out);
            }
        } catch (ScriptException e) {
            ScriptException wrapped = e.atRow(index);
            fail(wrapped);
            throw wrapped;
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }

        state = State.DONE;
        if (log.isDebugEnabled()) {
            log.debug("Batch done: {} rows in, {} rows out, {} us", inputs.size(), outputs.size(),
                    (System.nanoTime() - start) / 1_000);
        }
        return Collections.unmodifiableList(outputs);
    }

    private void fail(RuntimeException e) {
        state = State.FAILED;
        failure = e;
        log.error("Batch aborted at row {} of {}: {}", index, inputs.size(), e.getMessage());
    }

    public State state() {
        return state;
    }

    public boolean isHealthy() {
        return state != State.FAILED;
    }

    // ── RowHistory ───────────────────────────────────────────────

    @Override
    public Value inputHistory(String name, int offset) {
        int target = index - offset;
        if (offset < 0 || target < 0)
            return null;
        Row row = inputs.get(target);
        // Absent cells fall through to output history on both paths.
        if (columnar != null && row.contains(name))
            return columnar.value(name, target);
        return field(row, name);
    }

    @Override
    public Value outputHistory(String name, int offset) {
        int target = index - offset;
        if (offset <= 0 || target < 0)
            return null;
        return field(outputHistory.get(target), name);
    }

    @Override
    public List<Value> inputSlice(String name, int startOffset, int endOffset) {
        int from = index - startOffset;
        int to = index - endOffset;
        if (columnar != null && from >= 0 && from <= to && columnar.hasColumn(name))
            return columnar.columnSlice(name, from, to + 1).elements();

        List<Value> out = new ArrayList<>(Math.max(0, to - from + 1));
        for (int i = from; i <= to; i++) {
            Value v = i < 0 ? null : field(inputs.get(i), name);
            out.add(v == null ? Value.NULL : v);
        }
        return out;
    }

    @Override
    public List<Value> outputSlice(String name, int startOffset, int endOffset) {
        if (endOffset == 0)
            throw ScriptException.typeError("output of the current row is not available yet: " + name);
        int from = index - startOffset;
        int to = index - endOffset;
        List<Value> out = new ArrayList<>(Math.max(0, to - from + 1));
        for (int i = from; i <= to; i++) {
            Value v = i < 0 ? null : field(outputHistory.get(i), name);
            out.add(v == null ? Value.NULL : v);
        }
        return out;
    }

    @Override
    public int maxLookback() {
        return index;
    }

    @Override
    public long currentIndex() {
        return index;
    }

    @Override
    public long totalRows() {
        return inputs.size();
    }

    @Override
    public Row currentRow() {
        return inputs.get(Math.min(index, inputs.size() - 1));
    }
}
