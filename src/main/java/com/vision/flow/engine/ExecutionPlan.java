package com.vision.flow.engine;

import com.vision.flow.model.Connection;
import com.vision.flow.model.CycleCheck;
import com.vision.flow.model.Flow;
import com.vision.flow.model.FlowGraphException;
import com.vision.flow.model.FlowGraphException.Reason;
import com.vision.flow.model.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * A flow snapshot compiled for execution.
 *
 * <p>
 * Nodes are numbered in topological order (producers before consumers) and the
 * connections are flattened into two CSR (compressed sparse row) tables:
 * <ul>
 * <li><b>outgoing:</b> connections leaving node {@code i} are
 * {@code outgoing[outOffset[i] .. outOffset[i+1])}</li>
 * <li><b>incoming:</b> connections entering node {@code i} are
 * {@code incoming[inOffset[i] .. inOffset[i+1])}</li>
 * </ul>
 *
 * <p>
 * Compilation re-verifies the whole graph: every connection must join
 * existing ports and the graph must be acyclic. A plan is immutable and can be
 * driven by any number of concurrent runs.
 */
@Log4j2
public final class ExecutionPlan {
    private final String flowId;
    private final String flowName;
    private final long flowVersion;

    // Nodes in topological order.
    private final Node[] order;
    private final Map<String, Integer> indexById;

    private final int[] outOffset;
    private final Connection[] outgoing;
    private final int[] inOffset;
    private final Connection[] incoming;

    // Longest distance from a source; nodes in one layer share no dependency.
    private final int[] layerOf;
    private final int layerCount;

    private ExecutionPlan(Flow.Snapshot snapshot, Node[] order, Map<String, Integer> indexById, int[] outOffset,
            Connection[] outgoing, int[] inOffset, Connection[] incoming, int[] layerOf, int layerCount) {
        this.flowId = snapshot.flowId();
        this.flowName = snapshot.flowName();
        this.flowVersion = snapshot.version();
        this.order = order;
        this.indexById = indexById;
        this.outOffset = outOffset;
        this.outgoing = outgoing;
        this.inOffset = inOffset;
        this.incoming = incoming;
        this.layerOf = layerOf;
        this.layerCount = layerCount;
    }

    /**
     * Compiles a snapshot.
     *
     * <p>
     * Kahn's algorithm; ties are broken by insertion order so the numbering is
     * deterministic for a given snapshot.
     *
     * @throws FlowGraphException with {@code UNKNOWN_PORT} for a dangling
     *                            connection or {@code CYCLE_DETECTED}
     */
    public static ExecutionPlan compile(Flow.Snapshot snapshot) {
        List<Node> nodes = snapshot.nodes();
        int n = nodes.size();
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < n; i++)
            position.put(nodes.get(i).id(), i);

        for (Connection c : snapshot.connections())
            checkEndpoints(c, nodes, position);

        CycleCheck check = snapshot.validate();
        if (!check.isAcyclic())
            throw new FlowGraphException(Reason.CYCLE_DETECTED,
                    "Flow " + snapshot.flowName() + " contains cycle " + check.cycle(), check.cycle());

        // 1. In-degrees and forward edges over insertion positions
        List<List<Connection>> forward = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            forward.add(new ArrayList<>());
        int[] inDegree = new int[n];
        for (Connection c : snapshot.connections()) {
            forward.get(position.get(c.sourceNodeId())).add(c);
            inDegree[position.get(c.targetNodeId())]++;
        }

        // 2. Kahn
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        int[] topoOf = new int[n];
        int[] depth = new int[n];
        Node[] order = new Node[n];
        int topo = 0;
        while (head < tail) {
            int curr = queue[head++];
            topoOf[curr] = topo;
            order[topo++] = nodes.get(curr);
            for (Connection c : forward.get(curr)) {
                int child = position.get(c.targetNodeId());
                depth[child] = Math.max(depth[child], depth[curr] + 1);
                if (--inDegree[child] == 0)
                    queue[tail++] = child;
            }
        }
        if (topo != n) {
            List<String> stuck = new ArrayList<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] > 0)
                    stuck.add(nodes.get(i).id());
            throw new FlowGraphException(Reason.CYCLE_DETECTED,
                    "Flow " + snapshot.flowName() + " cannot be ordered, nodes on a cycle: " + stuck);
        }

        // 3. CSR tables in topological numbering
        int[] outCount = new int[n];
        int[] inCount = new int[n];
        for (Connection c : snapshot.connections()) {
            outCount[topoOf[position.get(c.sourceNodeId())]]++;
            inCount[topoOf[position.get(c.targetNodeId())]]++;
        }
        int[] outOffset = prefixSums(outCount);
        int[] inOffset = prefixSums(inCount);
        Connection[] outgoing = new Connection[snapshot.connections().size()];
        Connection[] incoming = new Connection[snapshot.connections().size()];
        int[] outFill = new int[n];
        int[] inFill = new int[n];
        for (Connection c : snapshot.connections()) {
            int s = topoOf[position.get(c.sourceNodeId())];
            int t = topoOf[position.get(c.targetNodeId())];
            outgoing[outOffset[s] + outFill[s]++] = c;
            incoming[inOffset[t] + inFill[t]++] = c;
        }

        Map<String, Integer> indexById = new HashMap<>();
        int[] layerOf = new int[n];
        int layers = 0;
        for (int i = 0; i < n; i++) {
            int ti = topoOf[i];
            indexById.put(nodes.get(i).id(), ti);
            layerOf[ti] = depth[i];
            layers = Math.max(layers, depth[i] + 1);
        }

        log.debug("Compiled {} v{}: {} nodes, {} connections, {} layers", snapshot.flowName(), snapshot.version(),
                n, outgoing.length, layers);
        return new ExecutionPlan(snapshot, order, indexById, outOffset, outgoing, inOffset, incoming, layerOf,
                layers);
    }

    private static void checkEndpoints(Connection c, List<Node> nodes, Map<String, Integer> position) {
        Integer s = position.get(c.sourceNodeId());
        if (s == null || nodes.get(s).output(c.sourcePort()) == null)
            throw new FlowGraphException(Reason.UNKNOWN_PORT, "Dangling source " + c);
        Integer t = position.get(c.targetNodeId());
        if (t == null || nodes.get(t).input(c.targetPort()) == null)
            throw new FlowGraphException(Reason.UNKNOWN_PORT, "Dangling target " + c);
    }

    private static int[] prefixSums(int[] counts) {
        int[] offsets = new int[counts.length + 1];
        for (int i = 0; i < counts.length; i++)
            offsets[i + 1] = offsets[i] + counts[i];
        return offsets;
    }

    public String flowId() {
        return flowId;
    }

    public String flowName() {
        return flowName;
    }

    public long flowVersion() {
        return flowVersion;
    }

    public int nodeCount() {
        return order.length;
    }

    public Node node(int ti) {
        return order[ti];
    }

    /** @throws IllegalArgumentException if the node is not in the plan */
    public int indexOf(String nodeId) {
        Integer idx = indexById.get(nodeId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return idx;
    }

    public int outgoingStart(int ti) {
        return outOffset[ti];
    }

    public int outgoingEnd(int ti) {
        return outOffset[ti + 1];
    }

    public Connection outgoingAt(int flatIndex) {
        return outgoing[flatIndex];
    }

    /** Number of connections feeding node {@code ti}. */
    public int producerCount(int ti) {
        return inOffset[ti + 1] - inOffset[ti];
    }

    /** The connection feeding an input port, or null if the port is unconnected. */
    public Connection producerOf(int ti, String port) {
        for (int i = inOffset[ti]; i < inOffset[ti + 1]; i++)
            if (incoming[i].targetPort().equals(port))
                return incoming[i];
        return null;
    }

    /** True if no connection leaves the node; its outputs become run outputs. */
    public boolean isTerminal(int ti) {
        return outOffset[ti + 1] == outOffset[ti];
    }

    public int layer(int ti) {
        return layerOf[ti];
    }

    /** Nodes in dispatch-compatible order: every producer precedes its consumers. */
    public List<Node> executionOrder() {
        return List.of(order);
    }

    /**
     * Groups of mutually independent nodes. Layer {@code k} holds the nodes whose
     * longest path from a source has {@code k} edges, so it depends only on
     * earlier layers.
     */
    public List<List<Node>> layers() {
        List<List<Node>> layers = new ArrayList<>(layerCount);
        for (int i = 0; i < layerCount; i++)
            layers.add(new ArrayList<>());
        for (int ti = 0; ti < order.length; ti++)
            layers.get(layerOf[ti]).add(order[ti]);
        List<List<Node>> frozen = new ArrayList<>(layerCount);
        for (List<Node> layer : layers)
            frozen.add(List.copyOf(layer));
        return Collections.unmodifiableList(frozen);
    }
}
