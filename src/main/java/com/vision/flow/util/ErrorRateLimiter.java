package com.vision.flow.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often one call site logs at ERROR or WARN.
 * Keeps a persistently failing operator from flooding the log on every run.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was logged */
    public boolean log(String message, Throwable t) {
        return emit(message, t, true);
    }

    public boolean warn(String message) {
        return emit(message, null, false);
    }

    /** Messages dropped since the last one that got through. */
    public long suppressed() {
        return suppressed.get();
    }

    private boolean emit(String message, Throwable t, boolean error) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // Only one thread wins the interval.
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                String text = dropped > 0 ? message + " (Throttled, " + dropped + " suppressed)" : message;
                if (error)
                    logger.error(text, t);
                else
                    logger.warn(text);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }
}
