package com.vision.flow.engine;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cooperative cancellation token for a run, combined with its deadline.
 *
 * The signal reads as cancelled once {@link #cancel} has been called or the
 * deadline has passed, whichever comes first. Operators poll
 * {@link #isCancelled()} or call {@link #throwIfCancelled()} at coarse
 * checkpoints such as before and after blocking I/O.
 *
 * <p>
 * A signal may trip a lead time ahead of its deadline. Operators then have
 * until the deadline itself to wind down before the scheduler gives up on
 * them, so the caller still gets its answer by the deadline.
 *
 * <p>
 * A {@link #child} signal covers one step of a run: it trips with its parent
 * or on its own, shorter, deadline.
 */
public final class CancellationSignal {
    private static final Logger log = LogManager.getLogger(CancellationSignal.class);

    private final CancellationSignal parent;
    private final boolean hasDeadline;
    private final long deadlineNanos;
    private final long tripNanos;
    private final long timeoutMs;
    private final AtomicReference<String> cancelReason = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private CancellationSignal(CancellationSignal parent, long timeoutMs, long leadMs) {
        this.parent = parent;
        this.timeoutMs = timeoutMs;
        // Beyond ~292 years nanoTime arithmetic overflows; treat as no deadline.
        this.hasDeadline = timeoutMs > 0 && timeoutMs < TimeUnit.DAYS.toMillis(365L * 100);
        this.deadlineNanos = hasDeadline ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : 0;
        this.tripNanos = deadlineNanos - TimeUnit.MILLISECONDS.toNanos(leadMs);
    }

    /** A signal with no deadline; only {@link #cancel} trips it. */
    public static CancellationSignal none() {
        return new CancellationSignal(null, 0, 0);
    }

    public static CancellationSignal withTimeout(long timeoutMs) {
        return withTimeout(timeoutMs, 0);
    }

    /**
     * A signal that trips {@code leadMs} before its deadline.
     *
     * @throws IllegalArgumentException unless {@code 0 <= leadMs < timeoutMs}
     */
    public static CancellationSignal withTimeout(long timeoutMs, long leadMs) {
        checkTimeout(timeoutMs, leadMs);
        return new CancellationSignal(null, timeoutMs, leadMs);
    }

    /**
     * A signal for one step of the work this signal covers. It trips when this
     * signal trips, when its own deadline nears by {@code leadMs}, or when it
     * is cancelled itself. Cancelling the child leaves this signal untouched.
     */
    public CancellationSignal child(long timeoutMs, long leadMs) {
        checkTimeout(timeoutMs, leadMs);
        CancellationSignal child = new CancellationSignal(this, timeoutMs, leadMs);
        onCancel(() -> child.cancel(reason()));
        return child;
    }

    private static void checkTimeout(long timeoutMs, long leadMs) {
        if (timeoutMs <= 0)
            throw new IllegalArgumentException("Timeout must be positive: " + timeoutMs);
        if (leadMs < 0 || leadMs >= timeoutMs)
            throw new IllegalArgumentException("Lead " + leadMs + " ms must be below the " + timeoutMs
                    + " ms timeout");
    }

    /**
     * Requests cancellation. Only the first call has an effect; it runs the
     * registered callbacks on the calling thread.
     *
     * @return true if this call cancelled the signal
     */
    public boolean cancel(String reason) {
        if (!cancelReason.compareAndSet(null, reason != null ? reason : "cancelled"))
            return false;
        for (Runnable r : callbacks) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.error("Cancellation callback failed", e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelReason.get() != null || isExpired() || (parent != null && parent.isCancelled());
    }

    /** True once this signal's own deadline, less its lead, has passed. */
    public boolean isExpired() {
        return hasDeadline && System.nanoTime() - tripNanos >= 0;
    }

    /**
     * CANCELLED if {@link #cancel} was called, else the parent's cause if the
     * parent tripped, else TIMEOUT if expired, else null.
     */
    public FailureKind cause() {
        if (cancelReason.get() != null)
            return FailureKind.CANCELLED;
        if (parent != null && parent.isCancelled())
            return parent.cause();
        return isExpired() ? FailureKind.TIMEOUT : null;
    }

    /** Human-readable reason, or null while not cancelled. */
    public String reason() {
        String r = cancelReason.get();
        if (r != null)
            return r;
        if (parent != null && parent.isCancelled())
            return parent.reason();
        return isExpired() ? "deadline of " + timeoutMs + " ms reached" : null;
    }

    /** Nanoseconds until the signal trips; {@code Long.MAX_VALUE} if nothing but a cancel can trip it. */
    public long remainingNanos() {
        long own = hasDeadline ? Math.max(0, tripNanos - System.nanoTime()) : Long.MAX_VALUE;
        return parent == null ? own : Math.min(own, parent.remainingNanos());
    }

    public long remainingMillis() {
        long nanos = remainingNanos();
        return nanos == Long.MAX_VALUE ? Long.MAX_VALUE : TimeUnit.NANOSECONDS.toMillis(nanos);
    }

    /** Nanoseconds until this signal's own deadline, lead included; {@code Long.MAX_VALUE} without one. */
    long nanosToDeadline() {
        return hasDeadline ? Math.max(0, deadlineNanos - System.nanoTime()) : Long.MAX_VALUE;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    /** @throws CancellationException if cancelled or past the deadline */
    public void throwIfCancelled() {
        if (isCancelled())
            throw new CancellationException(reason());
    }

    /**
     * Registers a callback for an explicit {@link #cancel}. Runs at once if the
     * signal was already cancelled. Deadline expiry does not fire callbacks.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelReason.get() != null && callbacks.remove(callback))
            callback.run();
    }

    @Override
    public String toString() {
        return "CancellationSignal[" + (isCancelled() ? reason() : "active") + "]";
    }
}
