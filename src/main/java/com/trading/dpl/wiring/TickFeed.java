package com.trading.dpl.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.dpl.api.Row;
import com.trading.dpl.engine.StreamingExecutor;
import com.trading.dpl.io.EngineConfig;

import lombok.extern.log4j.Log4j2;

/**
 * Live tick feed: a Disruptor ring buffer in front of one StreamingExecutor.
 *
 * Any number of producer threads may {@link #publish(Row)}; a single daemon
 * consumer thread evaluates ticks strictly in publish order. To use more
 * cores, run one feed per independent stream.
 *
 * <pre>{@code
 * TickFeed feed = new TickFeed(executor, (seq, row) -> handle(row), config);
 * feed.start();
 * feed.publish(tick);
 * ...
 * feed.close();
 * }</pre>
 */
@Log4j2
public final class TickFeed implements AutoCloseable {
    private final Disruptor<TickEvent> disruptor;
    private final TickPublisher publisher;
    private volatile RingBuffer<TickEvent> ringBuffer;

    public TickFeed(StreamingExecutor executor, TickPublisher.OutputListener listener) {
        this(executor, listener, EngineConfig.defaults());
    }

    public TickFeed(StreamingExecutor executor, TickPublisher.OutputListener listener, EngineConfig config) {
        this.publisher = new TickPublisher(executor, listener);
        this.disruptor = new Disruptor<>(
                TickEvent::new,
                config.getFeed().getRingBufferSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
    }

    public synchronized TickFeed start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Feed already started");
        ringBuffer = disruptor.start();
        log.info("Tick feed started (ring buffer size {})", ringBuffer.getBufferSize());
        return this;
    }

    /**
     * Publishes a tick; blocks while the ring buffer is full.
     *
     * @return the tick's sequence ID, as passed to the output listener
     */
    public long publish(Row tick) {
        RingBuffer<TickEvent> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Feed not started");
        long sequence = rb.next();
        try {
            rb.get(sequence).set(tick, sequence);
        } finally {
            rb.publish(sequence);
        }
        return sequence;
    }

    public TickPublisher publisher() {
        return publisher;
    }

    /** Waits for published ticks to be processed, then stops the consumer. */
    @Override
    public synchronized void close() {
        if (ringBuffer != null) {
            disruptor.shutdown();
            log.info("Tick feed stopped: {} ticks processed, {} failed", publisher.processedCount(),
                    publisher.failedCount());
        }
    }
}
