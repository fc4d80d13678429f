package com.vision.flow.buffer;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Allocation and eager release of off-heap memory blocks.
 *
 * Blocks are direct {@link ByteBuffer}s. {@link #free(ByteBuffer)} runs the
 * buffer's cleaner immediately through {@code sun.misc.Unsafe.invokeCleaner},
 * looked up reflectively from the {@code jdk.unsupported} module. If the
 * running JVM does not expose it, release falls back to the garbage
 * collector and a warning is logged once.
 */
public final class NativeMemory {
    private static final Logger log = LogManager.getLogger(NativeMemory.class);

    private static final Object UNSAFE;
    private static final Method INVOKE_CLEANER;

    static {
        Object unsafe = null;
        Method invokeCleaner = null;
        try {
            Class<?> unsafeClass = Class.forName("sun.misc.Unsafe");
            Field f = unsafeClass.getDeclaredField("theUnsafe");
            f.setAccessible(true);
            unsafe = f.get(null);
            invokeCleaner = unsafeClass.getMethod("invokeCleaner", ByteBuffer.class);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.warn("Eager release of direct buffers unavailable, native memory will be reclaimed by GC: {}",
                    e.toString());
        }
        UNSAFE = unsafe;
        INVOKE_CLEANER = invokeCleaner;
    }

    private NativeMemory() {
    }

    public static ByteBuffer allocate(long bytes) {
        if (bytes > Integer.MAX_VALUE)
            throw new IllegalArgumentException("Single native block limited to 2 GiB, requested " + bytes);
        return ByteBuffer.allocateDirect((int) bytes);
    }

    /**
     * Releases the block now. The buffer must not be touched afterwards.
     *
     * @return true if memory was released eagerly, false if left to the GC.
     */
    public static boolean free(ByteBuffer buffer) {
        if (INVOKE_CLEANER == null || !buffer.isDirect())
            return false;
        try {
            INVOKE_CLEANER.invoke(UNSAFE, buffer);
            return true;
        } catch (ReflectiveOperationException e) {
            log.warn("Failed to release direct buffer eagerly", e);
            return false;
        }
    }

    public static boolean supportsEagerRelease() {
        return INVOKE_CLEANER != null;
    }
}
