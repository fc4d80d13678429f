package com.vision.flow.util;

import com.vision.flow.api.RunListener;
import com.vision.flow.engine.NodeStatusEntry;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.model.Node;
import com.vision.flow.model.NodeStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/** Aggregates executor timings per operator type to find the slow stages. */
public class NodeProfileListener implements RunListener {

    public static class OperatorStats {
        public final String operatorType;
        public long count;
        public long failures;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public OperatorStats(String operatorType) {
            this.operatorType = operatorType;
        }

        synchronized void update(long duration, boolean failed) {
            count++;
            if (failed)
                failures++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public synchronized double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }

        synchronized void reset() {
            count = 0;
            failures = 0;
            totalDurationNanos = 0;
            lastDurationNanos = 0;
            minDurationNanos = Long.MAX_VALUE;
            maxDurationNanos = Long.MIN_VALUE;
        }
    }

    private final ConcurrentHashMap<String, OperatorStats> stats = new ConcurrentHashMap<>();

    /** @return stats for one operator type, or null if it never ran */
    public OperatorStats stats(String operatorType) {
        return stats.get(operatorType);
    }

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
        // Skipped and pre-dispatch failures never reached an executor.
        if (entry.startedAt() == null)
            return;
        stats.computeIfAbsent(node.type(), OperatorStats::new)
                .update(durationNanos, entry.status() != NodeStatus.SUCCEEDED);
    }

    @Override
    public void onRunEnd(RunOutcome outcome) {
        // No-op
    }

    public void reset() {
        for (OperatorStats s : stats.values())
            s.reset();
    }

    /** Formatted table, slowest total first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %8s | %8s | %10s | %10s | %10s | %10s%n", "Operator", "Count", "Failed",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append(
                "----------------------------------------------------------------------------------------------------------\n");

        List<OperatorStats> valid = new ArrayList<>();
        for (OperatorStats s : stats.values())
            if (s.count > 0)
                valid.add(s);
        valid.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (OperatorStats s : valid) {
            synchronized (s) {
                sb.append(String.format("%-30s | %8d | %8d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                        truncate(s.operatorType, 30),
                        s.count,
                        s.failures,
                        s.lastDurationNanos / 1000.0,
                        s.avgMicros(),
                        s.minDurationNanos / 1000.0,
                        s.maxDurationNanos / 1000.0));
            }
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
