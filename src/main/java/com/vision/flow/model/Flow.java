package com.vision.flow.model;

import com.vision.flow.model.FlowGraphException.Reason;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import lombok.extern.log4j.Log4j2;

/**
 * A named operator graph: nodes plus the connections between their ports.
 *
 * Invariants maintained by the editing methods:
 * - node ids are unique;
 * - every connection joins an existing output port to an existing input port
 * of a different node, with compatible data types;
 * - an input port has at most one producer;
 * - the graph is acyclic (checked on every {@link #addConnection}).
 *
 * Editing methods are synchronized. Runs never read the live maps: they work
 * from an immutable {@link #snapshot()}, so editing a flow never disturbs a
 * run already in flight.
 */
@Log4j2
public final class Flow {
    private final String id;
    private final String name;

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    // "targetNode\u0000targetPort" -> connection, enforces one producer per input
    private final Map<String, Connection> boundInputs = new HashMap<>();
    private long version;

    public Flow(String name) {
        this(null, name);
    }

    /** @param id pre-existing id, or null to generate one */
    public Flow(String id, String name) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Rebuilds a flow from stored parts without the incremental cycle check.
     * Structural checks (ids, ports, directions, single producer) still apply.
     * Callers must run {@link #validate()} before executing the result; the
     * scheduler does so on every run.
     */
    public static Flow restore(String id, String name, Collection<Node> nodes, Collection<Connection> connections) {
        Flow flow = new Flow(id, name);
        for (Node n : nodes)
            flow.addNode(n);
        for (Connection c : connections)
            flow.insertConnection(c, false);
        return flow;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    /** Edit counter; changes whenever nodes or connections change. */
    public synchronized long version() {
        return version;
    }

    public synchronized void addNode(Node node) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.id()))
            throw new FlowGraphException(Reason.DUPLICATE_NODE_ID, "Node " + node.id() + " already exists");
        nodes.put(node.id(), node);
        version++;
    }

    /** Removes a node together with every connection touching it. */
    public synchronized void removeNode(String nodeId) {
        if (nodes.remove(nodeId) == null)
            throw new FlowGraphException(Reason.UNKNOWN_NODE, "Node " + nodeId + " does not exist");
        connections.values().removeIf(c -> {
            boolean touches = c.sourceNodeId().equals(nodeId) || c.targetNodeId().equals(nodeId);
            if (touches)
                boundInputs.remove(inputKey(c.targetNodeId(), c.targetPort()));
            return touches;
        });
        version++;
    }

    public synchronized void addConnection(Connection connection) {
        insertConnection(Objects.requireNonNull(connection, "connection"), true);
    }

    public synchronized boolean removeConnection(String connectionId) {
        Connection removed = connections.remove(connectionId);
        if (removed == null)
            return false;
        boundInputs.remove(inputKey(removed.targetNodeId(), removed.targetPort()));
        version++;
        return true;
    }

    public synchronized void clearConnections() {
        connections.clear();
        boundInputs.clear();
        version++;
    }

    public synchronized Node node(String nodeId) {
        return nodes.get(nodeId);
    }

    public synchronized List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    public synchronized List<Connection> connections() {
        return List.copyOf(connections.values());
    }

    /** Consistent, immutable view of the graph for execution. */
    public synchronized Snapshot snapshot() {
        return new Snapshot(id, name, version, List.copyOf(nodes.values()), List.copyOf(connections.values()));
    }

    /**
     * Full acyclicity check, independent of the incremental checks.
     *
     * Depth-first search from every unvisited node. {@code visited} holds every
     * node ever entered; {@code onPath} holds only the ancestors of the node
     * currently being expanded and loses each node once its neighbours are done. A
     * cycle exists exactly when a neighbour is already on the path.
     */
    public synchronized CycleCheck validate() {
        return findCycle(nodes.keySet(), connections.values());
    }

    static CycleCheck findCycle(Collection<String> nodeIds, Collection<Connection> edges) {
        Map<String, List<String>> adjacency = adjacency(nodeIds, edges);
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        for (String start : nodeIds) {
            if (visited.contains(start))
                continue;
            List<String> cycle = dfs(start, adjacency, visited, onPath, path);
            if (cycle != null)
                return new CycleCheck(cycle);
        }
        return CycleCheck.ACYCLIC;
    }

    /** Iterative so that long chains cannot overflow the thread stack. */
    private static List<String> dfs(String start, Map<String, List<String>> adjacency, Set<String> visited,
            Set<String> onPath, Deque<String> path) {
        // One frame per node on the path: the node's neighbours still to expand.
        Deque<Iterator<String>> frames = new ArrayDeque<>();
        visited.add(start);
        onPath.add(start);
        path.addLast(start);
        frames.push(adjacency.getOrDefault(start, List.of()).iterator());
        while (!frames.isEmpty()) {
            Iterator<String> it = frames.peek();
            if (!it.hasNext()) {
                frames.pop();
                onPath.remove(path.removeLast());
                continue;
            }
            String next = it.next();
            if (onPath.contains(next))
                return closeCycle(path, next);
            if (visited.add(next)) {
                onPath.add(next);
                path.addLast(next);
                frames.push(adjacency.getOrDefault(next, List.of()).iterator());
            }
        }
        return null;
    }

    private static List<String> closeCycle(Deque<String> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String n : path) {
            if (n.equals(repeated))
                inCycle = true;
            if (inCycle)
                cycle.add(n);
        }
        cycle.add(repeated);
        return cycle;
    }

    private void insertConnection(Connection c, boolean checkCycle) {
        if (c.sourceNodeId().equals(c.targetNodeId()))
            throw new FlowGraphException(Reason.SELF_CONNECTION, "Node " + c.sourceNodeId() + " cannot feed itself");

        Node source = requireEndpoint(c.sourceNodeId(), c.sourcePort());
        Node target = requireEndpoint(c.targetNodeId(), c.targetPort());

        Port sourcePort = source.output(c.sourcePort());
        Port targetPort = target.input(c.targetPort());
        if (sourcePort == null) {
            if (source.input(c.sourcePort()) != null)
                throw new FlowGraphException(Reason.PORT_DIRECTION_MISMATCH,
                        "Source port " + source.id() + "." + c.sourcePort() + " is an input");
            throw new FlowGraphException(Reason.UNKNOWN_PORT, "No output port " + source.id() + "." + c.sourcePort());
        }
        if (targetPort == null) {
            if (target.output(c.targetPort()) != null)
                throw new FlowGraphException(Reason.PORT_DIRECTION_MISMATCH,
                        "Target port " + target.id() + "." + c.targetPort() + " is an output");
            throw new FlowGraphException(Reason.UNKNOWN_PORT, "No input port " + target.id() + "." + c.targetPort());
        }
        if (!sourcePort.dataType().isCompatibleWith(targetPort.dataType()))
            throw new FlowGraphException(Reason.PORT_TYPE_MISMATCH,
                    sourcePort.dataType() + " -> " + targetPort.dataType() + " on " + c);

        String key = inputKey(c.targetNodeId(), c.targetPort());
        Connection existing = boundInputs.get(key);
        if (existing != null)
            throw new FlowGraphException(Reason.INPUT_ALREADY_BOUND,
                    c.targetNodeId() + "." + c.targetPort() + " is already fed by " + existing);
        if (connections.containsKey(c.id()))
            throw new IllegalArgumentException("Duplicate connection id: " + c.id());

        if (checkCycle) {
            // The new edge closes a cycle iff source is already reachable from target.
            List<String> back = pathBetween(c.targetNodeId(), c.sourceNodeId());
            if (back != null) {
                back.add(c.targetNodeId());
                log.debug("Rejected {}: cycle {}", c, back);
                throw new FlowGraphException(Reason.CYCLE_DETECTED, "Connection " + c + " would close a cycle", back);
            }
        }

        connections.put(c.id(), c);
        boundInputs.put(key, c);
        version++;
    }

    /** Path from {@code from} to {@code to} over existing edges, or null if unreachable. */
    private List<String> pathBetween(String from, String to) {
        Map<String, List<String>> adjacency = adjacency(nodes.keySet(), connections.values());
        Map<String, String> parent = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(from);
        parent.put(from, null);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(to)) {
                List<String> path = new ArrayList<>();
                for (String n = to; n != null; n = parent.get(n))
                    path.add(0, n);
                return path;
            }
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    stack.push(next);
                }
            }
        }
        return null;
    }

    private static Map<String, List<String>> adjacency(Collection<String> nodeIds, Collection<Connection> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (String n : nodeIds)
            adjacency.put(n, new ArrayList<>());
        for (Connection c : edges)
            adjacency.computeIfAbsent(c.sourceNodeId(), k -> new ArrayList<>()).add(c.targetNodeId());
        return adjacency;
    }

    // A port on a missing node is an unknown port.
    private Node requireEndpoint(String nodeId, String port) {
        Node n = nodes.get(nodeId);
        if (n == null)
            throw new FlowGraphException(Reason.UNKNOWN_PORT, nodeId + "." + port + ": node does not exist");
        return n;
    }

    private static String inputKey(String nodeId, String port) {
        return nodeId + '\u0000' + port;
    }

    @Override
    public String toString() {
        return "Flow[" + name + "#" + id + "]";
    }

    /** Immutable view of a flow at one version. */
    public record Snapshot(String flowId, String flowName, long version, List<Node> nodes,
            List<Connection> connections) {

        /** Re-runs the acyclicity check on this snapshot. */
        public CycleCheck validate() {
            return findCycle(nodes.stream().map(Node::id).toList(), connections);
        }
    }
}
