package com.vision.flow.engine;

import com.vision.flow.model.NodeStatus;

import java.time.Instant;

/**
 * One row of an {@link ExecutionStatusTable}.
 *
 * @param startedAt    null until the node starts running
 * @param errorMessage failure or skip reason, null on success
 * @param failure      set for FAILED and CANCELLED entries
 */
public record NodeStatusEntry(String nodeId, NodeStatus status, Instant startedAt, long durationMs,
        String errorMessage, FailureKind failure) {

    public static NodeStatusEntry pending(String nodeId) {
        return new NodeStatusEntry(nodeId, NodeStatus.PENDING, null, 0, null, null);
    }

    NodeStatusEntry running(Instant at) {
        return new NodeStatusEntry(nodeId, NodeStatus.RUNNING, at, 0, null, null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
