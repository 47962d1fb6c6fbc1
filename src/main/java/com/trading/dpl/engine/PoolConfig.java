package com.trading.dpl.engine;

/**
 * Sizing of a {@link ContextPool}.
 *
 * @param initialSize scopes allocated up front, capped at {@code maxSize}
 * @param maxSize     upper bound of idle scopes kept for reuse
 */
public record PoolConfig(int initialSize, int maxSize) {
    public static final PoolConfig DEFAULT = new PoolConfig(16, 1024);

    public PoolConfig {
        if (initialSize < 0)
            throw new IllegalArgumentException("initialSize must be >= 0");
        if (maxSize < 1)
            throw new IllegalArgumentException("maxSize must be >= 1");
    }
}
