package com.vision.flow.buffer;

import com.vision.flow.model.ShapeKey;

import java.lang.ref.Cleaner;
import java.nio.ByteBuffer;

/**
 * A native memory block owned by a {@link BufferPool}.
 *
 * At most one node execution holds a buffer at a time. Return it with
 * {@link #close()} (or {@link BufferPool#release}); try-with-resources is the
 * intended usage. Contents are undefined on acquisition.
 *
 * A checked-out buffer that becomes unreachable without being released is
 * reported as a leak by a {@link Cleaner} registered at creation. That path is
 * a safety net only: the pool's accounting assumes explicit release.
 */
public final class PooledBuffer implements AutoCloseable {
    private final long id;
    private final ShapeKey shape;
    private final ByteBuffer memory;
    private final BufferPool pool;
    private final Sentinel sentinel;
    private final Cleaner.Cleanable cleanable;

    // guarded by the pool lock
    boolean checkedOut;

    PooledBuffer(long id, ShapeKey shape, ByteBuffer memory, BufferPool pool, Cleaner cleaner) {
        this.id = id;
        this.shape = shape;
        this.memory = memory;
        this.pool = pool;
        this.sentinel = new Sentinel(pool, memory, shape, id);
        this.cleanable = cleaner.register(this, sentinel);
    }

    public long id() {
        return id;
    }

    public ShapeKey shape() {
        return shape;
    }

    public long byteSize() {
        return shape.byteSize();
    }

    /** The block, positioned at 0 with limit = capacity. Valid only while checked out. */
    public ByteBuffer memory() {
        if (!pool.isCheckedOut(this))
            throw new IllegalStateException("Buffer " + id + " is not checked out");
        return memory.clear();
    }

    BufferPool pool() {
        return pool;
    }

    /** Releases the native block for good. Called by the pool only. */
    void free() {
        sentinel.orderly = true;
        cleanable.clean();
    }

    @Override
    public void close() {
        pool.release(this);
    }

    @Override
    public String toString() {
        return "PooledBuffer#" + id + "[" + shape + "]";
    }

    /** Cleaner action; must not reference the PooledBuffer itself. */
    private static final class Sentinel implements Runnable {
        private final BufferPool pool;
        private final ByteBuffer memory;
        private final ShapeKey shape;
        private final long id;
        private volatile boolean orderly;

        Sentinel(BufferPool pool, ByteBuffer memory, ShapeKey shape, long id) {
            this.pool = pool;
            this.memory = memory;
            this.shape = shape;
            this.id = id;
        }

        @Override
        public void run() {
            if (!orderly)
                pool.reclaimLeaked(id, shape);
            NativeMemory.free(memory);
        }
    }
}
