package com.vision.flow.buffer;

/**
 * Point-in-time counters of a {@link BufferPool}.
 *
 * @param shapeKeys shapes with at least one idle buffer
 * @param hitRate   fraction of acquisitions served from idle buffers
 */
public record BufferPoolStatistics(
        long budgetBytes,
        long idleBytes,
        long activeBytes,
        int idleBuffers,
        int activeBuffers,
        int shapeKeys,
        long acquired,
        long reused,
        long created,
        long released,
        long evicted,
        double hitRate) {

    public long totalBytes() {
        return idleBytes + activeBytes;
    }
}
