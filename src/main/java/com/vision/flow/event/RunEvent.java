package com.vision.flow.event;

import com.vision.flow.engine.FailureKind;
import com.vision.flow.engine.RunStatus;
import com.vision.flow.model.NodeStatus;

/**
 * A mutable run transition record living in the {@link RunEventPublisher} ring
 * buffer.
 *
 * <p>
 * <b>Flyweight:</b> instances are pre-allocated with the ring buffer and reused
 * for every event; consumers must copy what they keep. Fields that do not apply
 * to a type are null (or 0).
 */
public final class RunEvent {

    public enum Type {
        RUN_STARTED,
        NODE_STARTED,
        NODE_FINISHED,
        RUN_FINISHED
    }

    private Type type;
    private String runId;
    private String flowName;
    private String nodeId;
    private String nodeName;
    private String operatorType;
    private NodeStatus nodeStatus;
    private RunStatus runStatus;
    private FailureKind failure;
    private String message;
    private int nodeCount;
    private long durationNanos;
    private long timestampMillis;

    void setRunStarted(String runId, String flowName, int nodeCount) {
        clear();
        this.type = Type.RUN_STARTED;
        this.runId = runId;
        this.flowName = flowName;
        this.nodeCount = nodeCount;
        this.timestampMillis = System.currentTimeMillis();
    }

    void setNodeStarted(String runId, String nodeId, String nodeName, String operatorType) {
        clear();
        this.type = Type.NODE_STARTED;
        this.runId = runId;
        this.nodeId = nodeId;
        this.nodeName = nodeName;
        this.operatorType = operatorType;
        this.nodeStatus = NodeStatus.RUNNING;
        this.timestampMillis = System.currentTimeMillis();
    }

    void setNodeFinished(String runId, String nodeId, String nodeName, String operatorType, NodeStatus status,
            FailureKind failure, String message, long durationNanos) {
        clear();
        this.type = Type.NODE_FINISHED;
        this.runId = runId;
        this.nodeId = nodeId;
        this.nodeName = nodeName;
        this.operatorType = operatorType;
        this.nodeStatus = status;
        this.failure = failure;
        this.message = message;
        this.durationNanos = durationNanos;
        this.timestampMillis = System.currentTimeMillis();
    }

    void setRunFinished(String runId, String flowName, RunStatus status, FailureKind failure, String message,
            int nodeCount, long durationMs) {
        clear();
        this.type = Type.RUN_FINISHED;
        this.runId = runId;
        this.flowName = flowName;
        this.runStatus = status;
        this.failure = failure;
        this.message = message;
        this.nodeCount = nodeCount;
        this.durationNanos = durationMs * 1_000_000;
        this.timestampMillis = System.currentTimeMillis();
    }

    public Type type() {
        return type;
    }

    public String runId() {
        return runId;
    }

    public String flowName() {
        return flowName;
    }

    public String nodeId() {
        return nodeId;
    }

    public String nodeName() {
        return nodeName;
    }

    public String operatorType() {
        return operatorType;
    }

    public NodeStatus nodeStatus() {
        return nodeStatus;
    }

    public RunStatus runStatus() {
        return runStatus;
    }

    public FailureKind failure() {
        return failure;
    }

    public String message() {
        return message;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public long durationNanos() {
        return durationNanos;
    }

    public long timestampMillis() {
        return timestampMillis;
    }

    public void clear() {
        type = null;
        runId = null;
        flowName = null;
        nodeId = null;
        nodeName = null;
        operatorType = null;
        nodeStatus = null;
        runStatus = null;
        failure = null;
        message = null;
        nodeCount = 0;
        durationNanos = 0;
        timestampMillis = 0;
    }

    @Override
    public String toString() {
        return "RunEvent[" + type + " " + runId + (nodeId != null ? " " + nodeId + " " + nodeStatus : "") + "]";
    }
}
