package com.trading.dpl.engine;

import java.util.ArrayDeque;
import java.util.Deque;

import lombok.extern.log4j.Log4j2;

/**
 * Bounded freelist of {@link ExecutionContext} scopes.
 *
 * Executors evaluate thousands of rows; reusing scopes avoids allocating a
 * fresh map per row. Released scopes beyond {@code maxSize} are dropped.
 * Owned by a single executor, not thread-safe.
 */
@Log4j2
public final class ContextPool {
    private final Deque<ExecutionContext> available;
    private final int maxSize;

    public ContextPool() {
        this(PoolConfig.DEFAULT);
    }

    public ContextPool(PoolConfig config) {
        this.maxSize = config.maxSize();
        int preallocate = Math.min(config.initialSize(), maxSize);
        this.available = new ArrayDeque<>(preallocate);
        for (int i = 0; i < preallocate; i++)
            available.push(new ExecutionContext());
    }

    /** Pops a cleared scope, allocating one when the pool is empty. */
    public ExecutionContext acquire() {
        ExecutionContext ctx = available.poll();
        if (ctx == null)
            return new ExecutionContext();
        ctx.reset();
        return ctx;
    }

    public void release(ExecutionContext ctx) {
        if (available.size() < maxSize) {
            available.push(ctx);
        } else {
            log.trace("Pool full ({}), dropping released scope", maxSize);
        }
    }

    /** Acquires a scope that goes back to the pool when the lease is closed. */
    public Lease lease() {
        return new Lease(this, acquire());
    }

    public int availableCount() {
        return available.size();
    }

    public void clear() {
        available.clear();
    }

    /**
     * Scoped ownership of a pooled context. Use with try-with-resources.
     */
    public static final class Lease implements AutoCloseable {
        private final ContextPool pool;
        private ExecutionContext context;

        private Lease(ContextPool pool, ExecutionContext context) {
            this.pool = pool;
            this.context = context;
        }

        public ExecutionContext context() {
            if (context == null)
                throw new IllegalStateException("Lease already closed");
            return context;
        }

        @Override
        public void close() {
            if (context != null) {
                pool.release(context);
                context = null;
            }
        }
    }
}
