package com.trading.dpl.wiring;

import com.lmax.disruptor.EventHandler;
import com.trading.dpl.api.Row;
import com.trading.dpl.engine.StreamingExecutor;
import com.trading.dpl.util.ErrorRateLimiter;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that feeds TickEvents into a StreamingExecutor.
 *
 * Runs on the single consumer thread, which is the only thread that ever
 * touches the executor. Output rows go to the {@link OutputListener}.
 *
 * A failing tick is logged (rate limited) and skipped; it is never rethrown,
 * which would kill the consumer thread.
 */
public final class TickPublisher implements EventHandler<TickEvent> {
    private static final Logger log = LogManager.getLogger(TickPublisher.class);

    private final StreamingExecutor executor;
    private final OutputListener listener;
    private final ErrorRateLimiter errorLimiter = new ErrorRateLimiter(log, 1000);

    private volatile long processed;
    private volatile long failed;

    public TickPublisher(StreamingExecutor executor, OutputListener listener) {
        this.executor = executor;
        this.listener = listener;
    }

    @Override
    public void onEvent(TickEvent event, long sequence, boolean endOfBatch) {
        try {
            Optional<Row> out = executor.pushTick(event.row());
            processed++;
            if (out.isPresent() && listener != null)
                listener.onOutput(event.sequenceId(), out.get());
        } catch (RuntimeException e) {
            failed++;
            errorLimiter.log("Tick " + event.sequenceId() + " failed: " + e.getMessage(), e);
            if (listener != null)
                listener.onError(event.sequenceId(), e);
        } finally {
            // Drop the reference so the ring does not pin old rows.
            event.clear();
        }
    }

    public long processedCount() {
        return processed;
    }

    public long failedCount() {
        return failed;
    }

    /**
     * Receives the results of the consumer thread.
     */
    public interface OutputListener {
        /**
         * Called with every output row, in publish order.
         *
         * @param sequenceId The tick's sequence ID.
         * @param output     The output row.
         */
        void onOutput(long sequenceId, Row output);

        /** Called when a tick fails. Default: ignore, the failure is already logged. */
        default void onError(long sequenceId, RuntimeException error) {
        }
    }
}
