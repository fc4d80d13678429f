package com.vision.flow.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A directed edge from an output port of one node to an input port of another.
 *
 * The id is either supplied (re-importing a saved flow) or generated.
 */
public record Connection(String id, String sourceNodeId, String sourcePort, String targetNodeId,
        String targetPort) {

    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(sourcePort, "sourcePort");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        Objects.requireNonNull(targetPort, "targetPort");
    }

    public static Connection of(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        return new Connection(UUID.randomUUID().toString(), sourceNodeId, sourcePort, targetNodeId, targetPort);
    }

    public static Connection withId(String id, String sourceNodeId, String sourcePort, String targetNodeId,
            String targetPort) {
        return new Connection(id, sourceNodeId, sourcePort, targetNodeId, targetPort);
    }

    @Override
    public String toString() {
        return sourceNodeId + "." + sourcePort + " -> " + targetNodeId + "." + targetPort;
    }
}
