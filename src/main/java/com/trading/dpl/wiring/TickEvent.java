package com.trading.dpl.wiring;

import com.trading.dpl.api.Row;

/**
 * A mutable tick holder, used within the LMAX Disruptor RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every tick; producers overwrite the payload, the consumer reads it.
 */
public final class TickEvent {
    private Row row;
    private long sequenceId;

    /**
     * @param row   The tick's fields.
     * @param seqId The producer's sequence ID (for correlation/logging).
     */
    public void set(Row row, long seqId) {
        this.row = row;
        this.sequenceId = seqId;
    }

    public Row row() {
        return row;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        row = null;
        sequenceId = 0;
    }
}
