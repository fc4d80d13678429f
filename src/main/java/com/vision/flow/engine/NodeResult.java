package com.vision.flow.engine;

import com.vision.flow.model.NodeStatus;
import com.vision.flow.model.PortValue;

import java.time.Instant;
import java.util.Map;

/**
 * Result of executing, or declining to execute, one node.
 *
 * @param outputs produced values by output port name; empty unless SUCCEEDED
 */
public record NodeResult(String nodeId, NodeStatus status, FailureKind failure, Map<String, PortValue> outputs,
        String errorMessage, Instant startedAt, long durationNanos) {

    public NodeResult {
        outputs = Map.copyOf(outputs);
    }

    static NodeResult succeeded(String nodeId, Map<String, PortValue> outputs, Instant startedAt,
            long durationNanos) {
        return new NodeResult(nodeId, NodeStatus.SUCCEEDED, null, outputs, null, startedAt, durationNanos);
    }

    static NodeResult failed(String nodeId, FailureKind failure, String error, Instant startedAt,
            long durationNanos) {
        return new NodeResult(nodeId, NodeStatus.FAILED, failure, Map.of(), error, startedAt, durationNanos);
    }

    static NodeResult cancelled(String nodeId, FailureKind failure, String error, Instant startedAt,
            long durationNanos) {
        return new NodeResult(nodeId, NodeStatus.CANCELLED, failure, Map.of(), error, startedAt, durationNanos);
    }

    static NodeResult skipped(String nodeId, String reason) {
        return new NodeResult(nodeId, NodeStatus.SKIPPED, null, Map.of(), reason, null, 0);
    }

    public boolean isSuccess() {
        return status == NodeStatus.SUCCEEDED;
    }

    public long durationMs() {
        return durationNanos / 1_000_000;
    }

    NodeStatusEntry toEntry() {
        return new NodeStatusEntry(nodeId, status, startedAt, durationMs(), errorMessage, failure);
    }
}
