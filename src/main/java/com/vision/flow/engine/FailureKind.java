package com.vision.flow.engine;

/** Why a run or a node did not succeed. */
public enum FailureKind {
    /** Cycle or dangling reference found before execution; no node ran. */
    GRAPH_INVALID,
    /** A required input had neither a producer nor an initial value. */
    MISSING_INPUT,
    /** The operator threw, reported failure, or could not get its buffers. */
    EXECUTOR_FAILURE,
    TIMEOUT,
    CANCELLED
}
