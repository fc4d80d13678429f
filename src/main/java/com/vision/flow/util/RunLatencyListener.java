package com.vision.flow.util;

import com.vision.flow.api.RunListener;
import com.vision.flow.engine.NodeStatusEntry;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.model.Node;

/**
 * Tracks end-to-end run latency: count, min, max and average, plus the
 * success ratio. Thread-safe; runs may end concurrently.
 */
public final class RunLatencyListener implements RunListener {
    private long totalRuns, failedRuns, totalLatencyMs, lastLatencyMs;
    private long minLatencyMs = Long.MAX_VALUE, maxLatencyMs = Long.MIN_VALUE;

    @Override
    public void onRunStart(String runId, String flowName, int nodeCount) {
        // No-op
    }

    @Override
    public void onNodeStart(String runId, Node node) {
        // No-op
    }

    @Override
    public void onNodeFinished(String runId, Node node, NodeStatusEntry entry, long durationNanos) {
        // No-op to keep overhead minimal
    }

    @Override
    public synchronized void onRunEnd(RunOutcome outcome) {
        lastLatencyMs = outcome.durationMs();
        totalRuns++;
        if (!outcome.isSuccess())
            failedRuns++;
        totalLatencyMs += lastLatencyMs;
        if (lastLatencyMs < minLatencyMs)
            minLatencyMs = lastLatencyMs;
        if (lastLatencyMs > maxLatencyMs)
            maxLatencyMs = lastLatencyMs;
    }

    public synchronized long totalRuns() {
        return totalRuns;
    }

    public synchronized long failedRuns() {
        return failedRuns;
    }

    public synchronized long lastLatencyMs() {
        return lastLatencyMs;
    }

    public synchronized double avgLatencyMs() {
        return totalRuns > 0 ? (double) totalLatencyMs / totalRuns : 0;
    }

    public synchronized long minLatencyMs() {
        return minLatencyMs == Long.MAX_VALUE ? 0 : minLatencyMs;
    }

    public synchronized long maxLatencyMs() {
        return maxLatencyMs == Long.MIN_VALUE ? 0 : maxLatencyMs;
    }

    public synchronized double successRatio() {
        return totalRuns > 0 ? (double) (totalRuns - failedRuns) / totalRuns : 0;
    }

    public synchronized void reset() {
        totalRuns = 0;
        failedRuns = 0;
        totalLatencyMs = 0;
        lastLatencyMs = 0;
        minLatencyMs = Long.MAX_VALUE;
        maxLatencyMs = Long.MIN_VALUE;
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %8s | %8s | %10s | %10s | %10s\n", "Metric", "Runs", "Failed", "Avg (ms)",
                "Min (ms)", "Max (ms)"));
        sb.append("--------------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %8d | %8d | %10.2f | %10d | %10d\n",
                "Run latency",
                totalRuns,
                failedRuns,
                avgLatencyMs(),
                minLatencyMs(),
                maxLatencyMs()));
        return sb.toString();
    }
}
