package com.vision.flow.model;

/**
 * Snapshot of the most recent execution of a node, across all runs.
 * {@code errorMessage} is null unless the status is FAILED or CANCELLED.
 */
public record LastExecution(NodeStatus status, long durationMs, String errorMessage) {

    public static final LastExecution NEVER = new LastExecution(NodeStatus.PENDING, 0, null);
}
