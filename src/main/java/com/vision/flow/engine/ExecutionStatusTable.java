package com.vision.flow.engine;

import com.vision.flow.model.NodeStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Status of every node of one run, keyed by node id.
 *
 * Each run owns a fresh table; nothing is shared between runs. Writers are the
 * run's coordinator and its worker threads, readers are status-polling callers.
 * Entries are immutable and replaced atomically per key, and a terminal entry
 * is never overwritten, so late writes from abandoned workers are dropped.
 */
public final class ExecutionStatusTable {
    private final String runId;
    private final List<String> nodeIds;
    private final ConcurrentHashMap<String, NodeStatusEntry> entries = new ConcurrentHashMap<>();

    ExecutionStatusTable(String runId, List<String> nodeIds) {
        this.runId = runId;
        this.nodeIds = List.copyOf(nodeIds);
        for (String id : nodeIds)
            entries.put(id, NodeStatusEntry.pending(id));
    }

    public String runId() {
        return runId;
    }

    /** @throws IllegalArgumentException if the node is not part of this run */
    public NodeStatusEntry get(String nodeId) {
        NodeStatusEntry e = entries.get(nodeId);
        if (e == null)
            throw new IllegalArgumentException("Node " + nodeId + " is not part of run " + runId);
        return e;
    }

    public NodeStatus status(String nodeId) {
        return get(nodeId).status();
    }

    /** Consistent-per-entry copy in flow order. */
    public Map<String, NodeStatusEntry> snapshot() {
        Map<String, NodeStatusEntry> copy = new LinkedHashMap<>();
        for (String id : nodeIds)
            copy.put(id, entries.get(id));
        return Collections.unmodifiableMap(copy);
    }

    public int size() {
        return nodeIds.size();
    }

    public int count(NodeStatus status) {
        int n = 0;
        for (NodeStatusEntry e : entries.values())
            if (e.status() == status)
                n++;
        return n;
    }

    /** Fraction of nodes in a terminal state, 1.0 for an empty run. */
    public double progress() {
        if (nodeIds.isEmpty())
            return 1.0;
        int done = 0;
        for (NodeStatusEntry e : entries.values())
            if (e.isTerminal())
                done++;
        return (double) done / nodeIds.size();
    }

    public List<String> runningNodes() {
        List<String> running = new ArrayList<>();
        for (String id : nodeIds)
            if (entries.get(id).status() == NodeStatus.RUNNING)
                running.add(id);
        return running;
    }

    public boolean isComplete() {
        return count(NodeStatus.PENDING) == 0 && count(NodeStatus.RUNNING) == 0;
    }

    /** PENDING -> RUNNING. @return false if the node already left PENDING. */
    boolean markRunning(String nodeId, Instant startedAt) {
        boolean[] applied = new boolean[1];
        entries.computeIfPresent(nodeId, (id, cur) -> {
            if (cur.status() != NodeStatus.PENDING)
                return cur;
            applied[0] = true;
            return cur.running(startedAt);
        });
        return applied[0];
    }

    /** Moves a node to a terminal entry. @return false if it was already terminal. */
    boolean complete(NodeStatusEntry next) {
        if (!next.isTerminal())
            throw new IllegalArgumentException("Not a terminal entry: " + next);
        boolean[] applied = new boolean[1];
        entries.computeIfPresent(next.nodeId(), (id, cur) -> {
            if (cur.isTerminal())
                return cur;
            applied[0] = true;
            if (next.startedAt() == null && cur.startedAt() != null)
                return new NodeStatusEntry(id, next.status(), cur.startedAt(), next.durationMs(),
                        next.errorMessage(), next.failure());
            return next;
        });
        return applied[0];
    }

    @Override
    public String toString() {
        return "ExecutionStatusTable[" + runId + ", " + String.format("%.0f%%", progress() * 100) + "]";
    }
}
