package com.vision.flow.buffer;

import com.vision.flow.model.ShapeKey;

import java.lang.ref.Cleaner;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import lombok.extern.log4j.Log4j2;

/**
 * Cross-run store of reusable native image buffers, keyed by {@link ShapeKey}.
 *
 * Accounting: {@code idleBytes + activeBytes <= budgetBytes} at all times.
 * Idle buffers are kept per shape (most recently released handed out first)
 * and in one global least-recently-released order used for eviction.
 *
 * Acquisition:
 * 1. A request larger than the whole budget fails with
 * {@link CapacityExceededException} before anything is evicted.
 * 2. An idle buffer of the same shape is reused if present.
 * 3. Otherwise, if the checked-out bytes leave room for the new block, idle
 * buffers of other shapes are evicted oldest first until it fits, and a new
 * block is allocated.
 * 4. If checked-out buffers hold too much of the budget, nothing is evicted:
 * the caller waits for releases, bounded by a timeout and a cancellation
 * check, and on expiry gets {@link PoolExhaustedException}.
 *
 * Release returns the buffer to the idle set, unless its shape already has
 * {@code maxIdlePerShape} idle buffers or the pool is shut down, in which case
 * the block is freed at once.
 *
 * All bookkeeping is guarded by one lock. Checked-out buffers are not
 * referenced by the pool, which lets the leak sentinel in
 * {@link PooledBuffer} notice a buffer dropped without release.
 */
@Log4j2
public final class BufferPool implements AutoCloseable {
    private static final Cleaner CLEANER = Cleaner.create();
    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

    private final long budgetBytes;
    private final int maxIdlePerShape;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition spaceFreed = lock.newCondition();

    private final Map<ShapeKey, ArrayDeque<PooledBuffer>> idleByShape = new HashMap<>();
    private final LinkedHashSet<PooledBuffer> idleLru = new LinkedHashSet<>();
    private long idleBytes;
    private long activeBytes;
    private int activeBuffers;
    private boolean shutdown;

    private final AtomicLong ids = new AtomicLong();
    private long acquired, reused, created, released, evicted, leaked;

    public BufferPool(long budgetBytes, int maxIdlePerShape) {
        if (budgetBytes <= 0)
            throw new IllegalArgumentException("Budget must be positive: " + budgetBytes);
        if (maxIdlePerShape <= 0)
            throw new IllegalArgumentException("maxIdlePerShape must be positive: " + maxIdlePerShape);
        this.budgetBytes = budgetBytes;
        this.maxIdlePerShape = maxIdlePerShape;
    }

    public long budgetBytes() {
        return budgetBytes;
    }

    /** Non-blocking acquisition: fails at once if the budget is held by checked-out buffers. */
    public PooledBuffer acquire(ShapeKey shape) {
        return acquire(shape, 0, () -> false);
    }

    /**
     * Acquires a buffer of the given shape, waiting at most {@code timeoutMs}
     * for other holders to release space.
     *
     * @param cancelled polled while waiting; a true result aborts the wait
     * @throws CapacityExceededException if one buffer of this shape exceeds the budget
     * @throws PoolExhaustedException    if no space became available in time
     * @throws IllegalStateException     if the pool has been shut down
     */
    public PooledBuffer acquire(ShapeKey shape, long timeoutMs, BooleanSupplier cancelled) {
        final long bytes = shape.byteSize();
        if (bytes > budgetBytes)
            throw new CapacityExceededException(shape, budgetBytes);

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMs));
        List<PooledBuffer> toFree = new ArrayList<>();
        lock.lock();
        try {
            while (true) {
                if (shutdown)
                    throw new IllegalStateException("Buffer pool is shut down");

                PooledBuffer idle = takeIdle(shape);
                if (idle != null) {
                    acquired++;
                    reused++;
                    return idle;
                }

                if (activeBytes + bytes <= budgetBytes) {
                    // Evicting idle buffers is enough to admit the block.
                    while (idleBytes + activeBytes + bytes > budgetBytes)
                        toFree.add(evictOldest());
                    // Reserve now, allocate outside the lock.
                    activeBytes += bytes;
                    activeBuffers++;
                    acquired++;
                    created++;
                    break;
                }

                if (cancelled.getAsBoolean())
                    throw new PoolExhaustedException(shape, "cancelled while waiting");
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0)
                    throw new PoolExhaustedException(shape, "no space within " + timeoutMs + " ms ("
                            + activeBytes + " of " + budgetBytes + " bytes checked out)");
                try {
                    spaceFreed.awaitNanos(Math.min(remaining, WAIT_SLICE_NANOS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PoolExhaustedException(shape, "interrupted while waiting");
                }
            }
        } finally {
            lock.unlock();
            freeAll(toFree);
        }

        ByteBuffer memory;
        try {
            memory = NativeMemory.allocate(bytes);
        } catch (OutOfMemoryError | RuntimeException e) {
            lock.lock();
            try {
                activeBytes -= bytes;
                activeBuffers--;
                spaceFreed.signalAll();
            } finally {
                lock.unlock();
            }
            throw new PoolExhaustedException(shape, "native allocation failed: " + e);
        }

        PooledBuffer buffer = new PooledBuffer(ids.incrementAndGet(), shape, memory, this, CLEANER);
        lock.lock();
        try {
            buffer.checkedOut = true;
        } finally {
            lock.unlock();
        }
        log.debug("Allocated {} ({} bytes)", buffer, bytes);
        return buffer;
    }

    /**
     * Returns a buffer to the pool.
     *
     * @throws IllegalArgumentException if the buffer belongs to another pool
     * @throws IllegalStateException    if the buffer is not checked out
     */
    public void release(PooledBuffer buffer) {
        if (buffer.pool() != this)
            throw new IllegalArgumentException(buffer + " belongs to another pool");

        List<PooledBuffer> toFree = new ArrayList<>();
        lock.lock();
        try {
            if (!buffer.checkedOut)
                throw new IllegalStateException(buffer + " is not checked out (double release?)");
            buffer.checkedOut = false;
            activeBytes -= buffer.byteSize();
            activeBuffers--;
            released++;

            ArrayDeque<PooledBuffer> idle = idleByShape.get(buffer.shape());
            if (shutdown || (idle != null && idle.size() >= maxIdlePerShape)) {
                toFree.add(buffer);
            } else {
                if (idle == null) {
                    idle = new ArrayDeque<>();
                    idleByShape.put(buffer.shape(), idle);
                }
                idle.addLast(buffer);
                idleLru.add(buffer);
                idleBytes += buffer.byteSize();
            }
            while (idleBytes + activeBytes > budgetBytes && !idleLru.isEmpty())
                toFree.add(evictOldest());
            spaceFreed.signalAll();
        } finally {
            lock.unlock();
            freeAll(toFree);
        }
    }

    /**
     * Frees every idle buffer and refuses further acquisitions. Buffers still
     * checked out are freed when they are released. Idempotent.
     */
    public void shutdown() {
        List<PooledBuffer> toFree;
        lock.lock();
        try {
            if (shutdown)
                return;
            shutdown = true;
            toFree = new ArrayList<>(idleLru);
            idleLru.clear();
            idleByShape.clear();
            idleBytes = 0;
            spaceFreed.signalAll();
        } finally {
            lock.unlock();
        }
        freeAll(toFree);
        log.info("Buffer pool shut down, freed {} idle buffers, {} still checked out", toFree.size(),
                activeBuffers());
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    public int activeBuffers() {
        lock.lock();
        try {
            return activeBuffers;
        } finally {
            lock.unlock();
        }
    }

    public BufferPoolStatistics statistics() {
        lock.lock();
        try {
            return new BufferPoolStatistics(budgetBytes, idleBytes, activeBytes, idleLru.size(), activeBuffers,
                    idleByShape.size(), acquired, reused, created, released, evicted,
                    acquired == 0 ? 0.0 : (double) reused / acquired);
        } finally {
            lock.unlock();
        }
    }

    boolean isCheckedOut(PooledBuffer buffer) {
        lock.lock();
        try {
            return buffer.checkedOut;
        } finally {
            lock.unlock();
        }
    }

    /** Called from the cleaner thread for a checked-out buffer that was never released. */
    void reclaimLeaked(long bufferId, ShapeKey shape) {
        lock.lock();
        try {
            activeBytes -= shape.byteSize();
            activeBuffers--;
            leaked++;
            spaceFreed.signalAll();
        } finally {
            lock.unlock();
        }
        log.error("Buffer #{} ({}) was garbage collected while checked out; release it explicitly", bufferId,
                shape);
    }

    private PooledBuffer takeIdle(ShapeKey shape) {
        ArrayDeque<PooledBuffer> idle = idleByShape.get(shape);
        if (idle == null || idle.isEmpty())
            return null;
        PooledBuffer buffer = idle.pollLast();
        if (idle.isEmpty())
            idleByShape.remove(shape);
        idleLru.remove(buffer);
        idleBytes -= buffer.byteSize();
        activeBytes += buffer.byteSize();
        activeBuffers++;
        buffer.checkedOut = true;
        return buffer;
    }

    private PooledBuffer evictOldest() {
        Iterator<PooledBuffer> it = idleLru.iterator();
        PooledBuffer oldest = it.next();
        it.remove();
        ArrayDeque<PooledBuffer> idle = idleByShape.get(oldest.shape());
        idle.remove(oldest);
        if (idle.isEmpty())
            idleByShape.remove(oldest.shape());
        idleBytes -= oldest.byteSize();
        evicted++;
        return oldest;
    }

    private static void freeAll(List<PooledBuffer> buffers) {
        for (PooledBuffer b : buffers)
            b.free();
    }
}
