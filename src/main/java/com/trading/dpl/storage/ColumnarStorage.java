package com.trading.dpl.storage;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-major copy of a finalized row batch.
 *
 * <p>
 * Columns appear in the order their names are first seen across the rows; a
 * row missing a column contributes Null. Each column is an immutable list
 * shared with every {@link Value.ArraySlice} handed out, so slices are O(1).
 *
 * <p>
 * Read-only after construction; safe to share between readers.
 */
public final class ColumnarStorage {
    private final Map<String, Integer> columnIndex;
    private final List<List<Value>> columns;
    private final int rowCount;

    private ColumnarStorage(Map<String, Integer> columnIndex, List<List<Value>> columns, int rowCount) {
        this.columnIndex = columnIndex;
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static ColumnarStorage fromRows(List<Row> rows) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (Row row : rows) {
            for (String name : row.names())
                index.putIfAbsent(name, index.size());
        }

        List<List<Value>> columns = new ArrayList<>(index.size());
        for (String name : index.keySet()) {
            List<Value> column = new ArrayList<>(rows.size());
            for (Row row : rows)
                column.add(row.getOrNull(name));
            columns.add(Collections.unmodifiableList(column));
        }
        return new ColumnarStorage(Collections.unmodifiableMap(index), Collections.unmodifiableList(columns),
                rows.size());
    }

    /**
     * Transposition pays off for narrow, long batches: fewer than 10 columns
     * and at least 100 rows.
     */
    public static boolean shouldUseColumnar(int columnCount, int rowCount) {
        return columnCount > 0 && columnCount < 10 && rowCount >= 100;
    }

    /** The whole column, or null if there is no such column. */
    public List<Value> column(String name) {
        Integer i = columnIndex.get(name);
        return i == null ? null : columns.get(i);
    }

    /** One cell, or Java null if the column or row does not exist. */
    public Value value(String name, int row) {
        List<Value> column = column(name);
        if (column == null || row < 0 || row >= rowCount)
            return null;
        return column.get(row);
    }

    /**
     * Zero-copy view of rows {@code [start, end)} of a column, or null if the
     * column is unknown or the range is invalid.
     */
    public Value.ArraySlice columnSlice(String name, int start, int end) {
        List<Value> column = column(name);
        if (column == null || start < 0 || end > rowCount || start > end)
            return null;
        return new Value.ArraySlice(column, start, end - start);
    }

    /** Reassembles one row, fields in column order. */
    public Row row(int index) {
        if (index < 0 || index >= rowCount)
            throw new IndexOutOfBoundsException("Row " + index + " outside [0, " + rowCount + ")");
        Row.Builder b = Row.builder();
        for (Map.Entry<String, Integer> e : columnIndex.entrySet())
            b.put(e.getKey(), columns.get(e.getValue()).get(index));
        return b.build();
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return new ArrayList<>(columnIndex.keySet());
    }

    public boolean hasColumn(String name) {
        return columnIndex.containsKey(name);
    }
}
