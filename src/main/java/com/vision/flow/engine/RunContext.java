package com.vision.flow.engine;

import com.vision.flow.model.Connection;
import com.vision.flow.model.Flow;
import com.vision.flow.model.Node;
import com.vision.flow.model.Port;
import com.vision.flow.model.PortValue;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything that belongs to one run and to no other.
 *
 * Created fresh for each execution request: the flow snapshot, the initial
 * inputs, the cancellation signal with the run's deadline, the status table
 * and the values produced so far. The routing state below the public getters
 * is touched only by the run's coordinator thread.
 */
public final class RunContext {
    private final String runId;
    private final Flow.Snapshot snapshot;
    private final Map<String, PortValue> initialInputs;
    private final CancellationSignal signal;
    private final ExecutionStatusTable table;
    private final Instant startedAt;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile RunOutcome outcome;

    // Coordinator-only state.
    private ExecutionPlan plan;
    private final Map<String, Map<String, PortValue>> produced = new HashMap<>();
    // Nodes whose end (FAILED, CANCELLED, or skipped because of those) fails required consumers.
    private final Set<String> blocking = new HashSet<>();
    private String firstFailedNodeId;
    private FailureKind firstFailure;
    private String firstError;
    private boolean aborted;

    RunContext(String runId, Flow.Snapshot snapshot, Map<String, PortValue> initialInputs,
            CancellationSignal signal) {
        this.runId = runId;
        this.snapshot = snapshot;
        this.initialInputs = Map.copyOf(initialInputs);
        this.signal = signal;
        this.table = new ExecutionStatusTable(runId, snapshot.nodes().stream().map(Node::id).toList());
        this.startedAt = Instant.now();
    }

    public String runId() {
        return runId;
    }

    public String flowId() {
        return snapshot.flowId();
    }

    public String flowName() {
        return snapshot.flowName();
    }

    public Flow.Snapshot snapshot() {
        return snapshot;
    }

    public Map<String, PortValue> initialInputs() {
        return initialInputs;
    }

    public CancellationSignal signal() {
        return signal;
    }

    public ExecutionStatusTable table() {
        return table;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /** Final outcome, or null while the run is in flight. */
    public RunOutcome outcome() {
        return outcome;
    }

    public boolean isClosed() {
        return closed.get();
    }

    void close(RunOutcome outcome) {
        this.outcome = outcome;
        closed.set(true);
    }

    ExecutionPlan plan() {
        return plan;
    }

    void plan(ExecutionPlan plan) {
        this.plan = plan;
    }

    /**
     * Value for an unconnected input port: the initial input keyed
     * {@code "<nodeId>.<port>"}, then the one keyed by the bare port name, then
     * the port default. Values the port cannot read are ignored; ANY-tagged
     * values are retagged to the port's type.
     */
    PortValue rootValue(Node node, Port port) {
        PortValue v = typed(initialInputs.get(node.id() + "." + port.name()), port);
        if (v == null)
            v = typed(initialInputs.get(port.name()), port);
        return v != null ? v : port.defaultValue();
    }

    private static PortValue typed(PortValue v, Port port) {
        return v == null ? null : v.as(port.dataType());
    }

    /** Value routed along a connection, or null if its producer did not emit it. */
    PortValue routed(Connection c) {
        Map<String, PortValue> out = produced.get(c.sourceNodeId());
        return out == null ? null : out.get(c.sourcePort());
    }

    boolean hasProduced(String nodeId) {
        return produced.containsKey(nodeId);
    }

    Map<String, PortValue> producedBy(String nodeId) {
        return produced.get(nodeId);
    }

    void recordProduced(String nodeId, Map<String, PortValue> outputs) {
        produced.put(nodeId, outputs);
    }

    boolean isBlocking(String nodeId) {
        return blocking.contains(nodeId);
    }

    void markBlocking(String nodeId) {
        blocking.add(nodeId);
    }

    void recordFailure(String nodeId, FailureKind kind, String error) {
        if (firstFailedNodeId == null) {
            firstFailedNodeId = nodeId;
            firstFailure = kind;
            firstError = error;
        }
    }

    String firstFailedNodeId() {
        return firstFailedNodeId;
    }

    FailureKind firstFailure() {
        return firstFailure;
    }

    String firstError() {
        return firstError;
    }

    boolean isAborted() {
        return aborted;
    }

    void markAborted() {
        aborted = true;
    }

    List<Node> nodes() {
        return snapshot.nodes();
    }

    @Override
    public String toString() {
        return "Run[" + runId + " of " + snapshot.flowName() + "]";
    }
}
