package com.trading.dpl.api;

import java.util.List;

/**
 * Time-series history of the row currently being evaluated.
 *
 * <p>
 * This is the only channel through which the evaluator and builtins read
 * previous rows. Executors hand themselves to the evaluator as the history of
 * each row; nothing is looked up from global or thread-local state.
 *
 * <p>
 * Offsets count rows back from the current one. Input offset 0 is the current
 * input row. Output offset 0 is never available: the current row's output is
 * what is being computed.
 */
public interface RowHistory {

    /** Input field {@code offset} rows back, or Java {@code null} if out of range or absent. */
    Value inputHistory(String name, int offset);

    /** Output field {@code offset} rows back, or Java {@code null} if offset is 0, out of range or absent. */
    Value outputHistory(String name, int offset);

    /**
     * Input values from {@code startOffset} back to {@code endOffset} back,
     * inclusive, oldest first. Positions before the first available row are
     * {@link Value#NULL}.
     */
    List<Value> inputSlice(String name, int startOffset, int endOffset);

    /**
     * Output values from {@code startOffset} back to {@code endOffset} back,
     * inclusive, oldest first, Null padded.
     *
     * @throws ScriptException if {@code endOffset} is 0
     */
    List<Value> outputSlice(String name, int startOffset, int endOffset);

    /** How many rows before the current one are still reachable. Open-start slices begin there. */
    int maxLookback();

    /** Index of the current row (or tick) since the start of the run. */
    long currentIndex();

    /** Number of rows in the run; for live feeds, the ticks accepted so far including the current one. */
    long totalRows();

    /** The current input row. */
    Row currentRow();
}
