package com.vision.flow.model;

import java.util.List;

/**
 * Thrown when an edit would leave a {@link Flow} in an invalid state.
 * The flow is unchanged when this is thrown.
 */
public class FlowGraphException extends RuntimeException {

    /** Why the edit was rejected. */
    public enum Reason {
        DUPLICATE_NODE_ID,
        UNKNOWN_NODE,
        UNKNOWN_PORT,
        PORT_DIRECTION_MISMATCH,
        PORT_TYPE_MISMATCH,
        INPUT_ALREADY_BOUND,
        SELF_CONNECTION,
        CYCLE_DETECTED
    }

    private final Reason reason;
    private final List<String> cycle;

    public FlowGraphException(Reason reason, String message) {
        this(reason, message, List.of());
    }

    public FlowGraphException(Reason reason, String message, List<String> cycle) {
        super(reason + ": " + message);
        this.reason = reason;
        this.cycle = List.copyOf(cycle);
    }

    public Reason reason() {
        return reason;
    }

    /** Node ids forming the detected cycle, first id repeated at the end. Empty for other reasons. */
    public List<String> cycle() {
        return cycle;
    }
}
