package com.vision.flow.engine;

import com.vision.flow.model.PortValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate result of one run.
 *
 * @param failure      null on success
 * @param failedNodeId first node that failed, or null for run-level failures
 *                     (invalid graph, timeout, cancellation) and successes
 * @param errorMessage primary diagnostic, null on success
 * @param nodes        final status of every node, in flow order
 * @param outputs      values produced by terminal nodes, keyed {@code "<nodeId>.<port>"}
 */
public record RunOutcome(String runId, String flowId, String flowName, RunStatus status, FailureKind failure,
        String failedNodeId, String errorMessage, Instant startedAt, Instant finishedAt,
        Map<String, NodeStatusEntry> nodes, Map<String, PortValue> outputs) {

    public RunOutcome {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCEEDED;
    }

    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    /** @throws IllegalArgumentException if the node was not part of the run */
    public NodeStatusEntry node(String nodeId) {
        NodeStatusEntry e = nodes.get(nodeId);
        if (e == null)
            throw new IllegalArgumentException("Node " + nodeId + " is not part of run " + runId);
        return e;
    }

    public PortValue output(String nodeId, String port) {
        return outputs.get(nodeId + "." + port);
    }
}
