package com.trading.dpl.storage;

import com.trading.dpl.api.Row;
import com.trading.dpl.api.Value;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ColumnarStorageTest {

    private static final List<Row> ROWS = List.of(
            Row.builder().put("open", 1).put("close", 2).build(),
            Row.builder().put("close", 4).put("volume", 100).build(),
            Row.builder().put("open", 5).put("close", 6).build());

    @Test
    public void testEmpty() {
        ColumnarStorage storage = ColumnarStorage.fromRows(List.of());
        assertEquals(0, storage.rowCount());
        assertEquals(0, storage.columnCount());
    }

    @Test
    public void testColumnsInFirstAppearanceOrder() {
        ColumnarStorage storage = ColumnarStorage.fromRows(ROWS);

        assertEquals(List.of("open", "close", "volume"), storage.columnNames());
        assertEquals(3, storage.rowCount());
        assertEquals(Value.numbers(2, 4, 6).elements(), storage.column("close"));
        assertNull(storage.column("high"));
    }

    @Test
    public void testMissingFieldsAreNull() {
        ColumnarStorage storage = ColumnarStorage.fromRows(ROWS);

        assertEquals(Value.NULL, storage.value("open", 1));
        assertEquals(Value.NULL, storage.value("volume", 0));
        assertNull(storage.value("open", 3));
        assertNull(storage.value("high", 0));
    }

    @Test
    public void testColumnSliceIsZeroCopy() {
        ColumnarStorage storage = ColumnarStorage.fromRows(ROWS);

        Value.ArraySlice slice = storage.columnSlice("close", 1, 3);

        assertSame(storage.column("close"), slice.column());
        assertEquals(Value.numbers(4, 6).elements(), slice.elements());
        assertNull(storage.columnSlice("close", 2, 4));
        assertNull(storage.columnSlice("close", 2, 1));
        assertNull(storage.columnSlice("high", 0, 1));
        assertEquals(0, storage.columnSlice("close", 1, 1).elements().size());
    }

    @Test
    public void testRowReassembly() {
        ColumnarStorage storage = ColumnarStorage.fromRows(ROWS);

        Row row = storage.row(1);

        assertEquals(List.of("open", "close", "volume"), row.names());
        assertEquals(Value.of(4), row.get("close"));
        assertEquals(Value.NULL, row.get("open"));
        assertThrows(IndexOutOfBoundsException.class, () -> storage.row(3));
    }

    @Test
    public void testColumnsAreReadOnly() {
        ColumnarStorage storage = ColumnarStorage.fromRows(ROWS);
        assertThrows(UnsupportedOperationException.class, () -> storage.column("close").set(0, Value.ZERO));
    }

    @Test
    public void testHeuristic() {
        assertTrue(ColumnarStorage.shouldUseColumnar(5, 1000));
        assertFalse(ColumnarStorage.shouldUseColumnar(50, 1000));
        assertFalse(ColumnarStorage.shouldUseColumnar(5, 50));
        assertFalse(ColumnarStorage.shouldUseColumnar(0, 1000));
        assertTrue(ColumnarStorage.shouldUseColumnar(9, 100));
        assertFalse(ColumnarStorage.shouldUseColumnar(10, 100));
    }
}
