package com.vision.flow.engine;

/** Aggregate state of a run. */
public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED
}
