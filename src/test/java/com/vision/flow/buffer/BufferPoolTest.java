package com.vision.flow.buffer;

import com.vision.flow.model.ShapeKey;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class BufferPoolTest {

    // 100 bytes each
    private static final ShapeKey S1 = ShapeKey.of8Bit(10, 10, 1);
    private static final ShapeKey S2 = ShapeKey.of8Bit(10, 5, 2);
    private static final ShapeKey S3 = ShapeKey.of8Bit(5, 5, 4);
    private static final ShapeKey S4 = ShapeKey.of8Bit(20, 5, 1);

    private BufferPool pool;

    @Before
    public void setUp() {
        pool = new BufferPool(1000, 10);
    }

    @After
    public void tearDown() {
        pool.shutdown();
    }

    @Test
    public void testReleasedBufferIsReusedWithoutGrowth() {
        PooledBuffer first = pool.acquire(S1);
        long id = first.id();
        first.close();

        for (int i = 0; i < 100; i++) {
            PooledBuffer b = pool.acquire(S1);
            assertEquals("Same block handed back", id, b.id());
            pool.release(b);
        }

        BufferPoolStatistics stats = pool.statistics();
        assertEquals(1, stats.created());
        assertEquals(100, stats.reused());
        assertEquals(100, stats.totalBytes());
        assertEquals(0, stats.activeBuffers());
        assertEquals(1, stats.idleBuffers());
        assertTrue(stats.hitRate() > 0.99);
    }

    @Test
    public void testOversizedRequestFailsWithoutEvicting() {
        pool.acquire(S1).close();
        pool.acquire(S2).close();

        ShapeKey huge = ShapeKey.of8Bit(100, 100, 1);
        try {
            pool.acquire(huge);
            fail("Expected CapacityExceededException");
        } catch (CapacityExceededException e) {
            assertEquals(huge, e.shape());
            assertEquals(1000, e.budgetBytes());
        }

        BufferPoolStatistics stats = pool.statistics();
        assertEquals(2, stats.idleBuffers());
        assertEquals(0, stats.evicted());
        assertEquals(200, stats.idleBytes());
    }

    @Test
    public void testLeastRecentlyReleasedIsEvictedFirst() {
        BufferPool small = new BufferPool(300, 10);
        try {
            PooledBuffer a = small.acquire(S1);
            PooledBuffer b = small.acquire(S2);
            PooledBuffer c = small.acquire(S3);
            a.close();
            b.close();
            c.close();

            // Full of idle blocks; a fourth shape evicts S1, the oldest
            PooledBuffer d = small.acquire(S4);
            assertEquals(1, small.statistics().evicted());
            assertTrue(small.statistics().totalBytes() <= 300);

            long reusedBefore = small.statistics().reused();
            small.acquire(S2).close();
            assertEquals(reusedBefore + 1, small.statistics().reused());

            long createdBefore = small.statistics().created();
            small.acquire(S1).close();
            assertEquals("S1 was evicted and must be recreated", createdBefore + 1, small.statistics().created());
            d.close();
        } finally {
            small.shutdown();
        }
    }

    @Test
    public void testIdleRetentionPerShapeIsCapped() {
        BufferPool capped = new BufferPool(1000, 1);
        try {
            PooledBuffer a = capped.acquire(S1);
            PooledBuffer b = capped.acquire(S1);
            a.close();
            b.close();

            BufferPoolStatistics stats = capped.statistics();
            assertEquals(1, stats.idleBuffers());
            assertEquals(100, stats.totalBytes());
        } finally {
            capped.shutdown();
        }
    }

    @Test
    public void testIdleBuffersSurviveARequestThatMustWaitAnyway() {
        BufferPool tight = new BufferPool(100, 10);
        try {
            tight.acquire(ShapeKey.of8Bit(40, 1, 1)).close();
            PooledBuffer held = tight.acquire(ShapeKey.of8Bit(50, 1, 1));

            // 50 checked out + 60 requested exceeds the budget even with no idle blocks
            try {
                tight.acquire(ShapeKey.of8Bit(60, 1, 1), 50, () -> false);
                fail("Expected PoolExhaustedException");
            } catch (PoolExhaustedException expected) {
            }

            BufferPoolStatistics stats = tight.statistics();
            assertEquals(40, stats.idleBytes());
            assertEquals(0, stats.evicted());
            assertEquals(1, stats.shapeKeys());
            held.close();
        } finally {
            tight.shutdown();
        }
    }

    @Test
    public void testEvictedShapeIsNoLongerCounted() {
        BufferPool tight = new BufferPool(100, 10);
        try {
            tight.acquire(ShapeKey.of8Bit(40, 1, 1)).close();
            assertEquals(1, tight.statistics().shapeKeys());

            PooledBuffer big = tight.acquire(ShapeKey.of8Bit(70, 1, 1));
            BufferPoolStatistics stats = tight.statistics();
            assertEquals(1, stats.evicted());
            assertEquals(0, stats.idleBytes());
            assertEquals(0, stats.shapeKeys());

            big.close();
            assertEquals(1, tight.statistics().shapeKeys());
            tight.acquire(ShapeKey.of8Bit(70, 1, 1)).close();
            assertEquals("Reused block leaves its shape in place once returned", 1, tight.statistics().shapeKeys());
        } finally {
            tight.shutdown();
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testDoubleReleaseIsRejected() {
        PooledBuffer b = pool.acquire(S1);
        b.close();
        b.close();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReleaseIntoForeignPoolIsRejected() {
        BufferPool other = new BufferPool(1000, 1);
        try {
            PooledBuffer b = other.acquire(S1);
            pool.release(b);
        } finally {
            other.shutdown();
        }
    }

    @Test
    public void testMemoryOnlyAccessibleWhileCheckedOut() {
        PooledBuffer b = pool.acquire(S1);
        assertEquals(100, b.memory().capacity());
        b.memory().put(0, (byte) 7);
        b.close();
        try {
            b.memory();
            fail();
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testAcquireTimesOutWhenBudgetIsCheckedOut() {
        BufferPool tight = new BufferPool(100, 10);
        try {
            PooledBuffer held = tight.acquire(S1);
            long t0 = System.nanoTime();
            try {
                tight.acquire(S2, 100, () -> false);
                fail("Expected PoolExhaustedException");
            } catch (PoolExhaustedException e) {
                assertEquals(S2, e.shape());
            }
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            assertTrue("Waited " + waitedMs + " ms", waitedMs >= 90 && waitedMs < 5000);
            held.close();
        } finally {
            tight.shutdown();
        }
    }

    @Test
    public void testCancelledWaitEndsEarly() {
        BufferPool tight = new BufferPool(100, 10);
        try {
            tight.acquire(S1);
            long t0 = System.nanoTime();
            try {
                tight.acquire(S2, 60_000, () -> true);
                fail("Expected PoolExhaustedException");
            } catch (PoolExhaustedException expected) {
            }
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0) < 5000);
        } finally {
            tight.shutdown();
        }
    }

    @Test
    public void testWaiterIsServedWhenSpaceIsReleased() throws Exception {
        BufferPool tight = new BufferPool(100, 10);
        try {
            PooledBuffer held = tight.acquire(S1);
            CountDownLatch waiting = new CountDownLatch(1);
            Thread releaser = new Thread(() -> {
                try {
                    waiting.await();
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                held.close();
            });
            releaser.start();

            waiting.countDown();
            PooledBuffer b = tight.acquire(S2, 10_000, () -> false);
            assertEquals(S2, b.shape());
            assertEquals(1, tight.statistics().evicted());
            b.close();
            releaser.join();
        } finally {
            tight.shutdown();
        }
    }

    @Test
    public void testShutdownFreesIdleAndRefusesAcquisition() {
        PooledBuffer held = pool.acquire(S1);
        pool.acquire(S2).close();

        pool.shutdown();
        assertTrue(pool.isShutdown());
        assertEquals(0, pool.statistics().idleBuffers());

        // Outstanding buffer is freed on release instead of being kept
        held.close();
        assertEquals(0, pool.activeBuffers());
        assertEquals(0, pool.statistics().totalBytes());

        try {
            pool.acquire(S1);
            fail();
        } catch (IllegalStateException expected) {
        }
        pool.shutdown();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBudgetMustBePositive() {
        new BufferPool(0, 1);
    }
}
