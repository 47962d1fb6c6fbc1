package com.trading.dpl.engine;

import com.trading.dpl.api.Row;

/**
 * Fixed-capacity circular buffer of rows, indexed oldest first.
 *
 * Pre-allocated; adding beyond capacity is an error, callers evict first.
 */
final class RowRing {
    private final Row[] slots;
    private int head = 0; // index of oldest
    private int size = 0;

    RowRing(int capacity) {
        if (capacity < 1)
            throw new IllegalArgumentException("Capacity must be >= 1");
        this.slots = new Row[capacity];
    }

    void addLast(Row row) {
        if (size == slots.length)
            throw new IllegalStateException("Ring full (" + slots.length + ")");
        slots[(head + size) % slots.length] = row;
        size++;
    }

    Row removeFirst() {
        if (size == 0)
            throw new IllegalStateException("Ring empty");
        Row row = slots[head];
        slots[head] = null;
        head = (head + 1) % slots.length;
        size--;
        return row;
    }

    Row removeLast() {
        if (size == 0)
            throw new IllegalStateException("Ring empty");
        int tail = (head + size - 1) % slots.length;
        Row row = slots[tail];
        slots[tail] = null;
        size--;
        return row;
    }

    /** Row {@code i} counted from the oldest. */
    Row get(int i) {
        if (i < 0 || i >= size)
            throw new IndexOutOfBoundsException("Index " + i + " outside [0, " + size + ")");
        return slots[(head + i) % slots.length];
    }

    int size() {
        return size;
    }
}
