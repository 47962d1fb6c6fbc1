package com.trading.dpl.engine;

import com.trading.dpl.api.Value;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ContextPoolTest {

    @Test
    public void testPreallocatesInitialSize() {
        ContextPool pool = new ContextPool(new PoolConfig(4, 10));
        assertEquals(4, pool.availableCount());
    }

    @Test
    public void testAcquiredScopeIsCleared() {
        ContextPool pool = new ContextPool(new PoolConfig(1, 1));
        ExecutionContext ctx = pool.acquire();
        ctx.set("x", Value.of(1));
        pool.release(ctx);

        ExecutionContext again = pool.acquire();

        assertSame(ctx, again);
        assertEquals(0, again.size());
    }

    @Test
    public void testNeverHoldsMoreThanMaxSize() {
        ContextPool pool = new ContextPool(new PoolConfig(10, 3));
        assertEquals(3, pool.availableCount());

        List<ExecutionContext> taken = new ArrayList<>();
        for (int i = 0; i < 8; i++)
            taken.add(pool.acquire());
        assertEquals(0, pool.availableCount());

        for (ExecutionContext ctx : taken) {
            pool.release(ctx);
            assertTrue(pool.availableCount() <= 3);
        }
        assertEquals(3, pool.availableCount());
    }

    @Test
    public void testLeaseReturnsScopeOnce() {
        ContextPool pool = new ContextPool(new PoolConfig(0, 5));
        ContextPool.Lease lease = pool.lease();
        try (lease) {
            lease.context().set("a", Value.of(1));
        }
        lease.close();

        assertEquals(1, pool.availableCount());
        assertThrows(IllegalStateException.class, lease::context);
    }

    @Test
    public void testLeaseReturnsScopeWhenBodyThrows() {
        ContextPool pool = new ContextPool(new PoolConfig(2, 5));
        try (ContextPool.Lease lease = pool.lease()) {
            assertEquals(1, pool.availableCount());
            throw new IllegalStateException("boom");
        } catch (IllegalStateException expected) {
            assertEquals("boom", expected.getMessage());
        }
        assertEquals(2, pool.availableCount());
    }

    @Test
    public void testClear() {
        ContextPool pool = new ContextPool(new PoolConfig(3, 3));
        pool.clear();
        assertEquals(0, pool.availableCount());
        assertNotNull(pool.acquire());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroMaxSize() {
        new PoolConfig(0, 0);
    }
}
