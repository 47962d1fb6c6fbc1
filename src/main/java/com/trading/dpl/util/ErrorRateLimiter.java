package com.trading.dpl.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging.
 * Used on feed consumer threads so a persistently failing script logs at most
 * once per interval instead of once per tick.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        // First failure always logs.
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /**
     * Logs {@code message} at ERROR unless another error was logged within the
     * interval.
     *
     * @return true if the message was logged
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos) {
            // Check-and-set so only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                long skipped = suppressed.getAndSet(0);
                if (skipped > 0) {
                    logger.error("{} ({} similar errors suppressed)", message, skipped, t);
                } else {
                    logger.error(message, t);
                }
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
