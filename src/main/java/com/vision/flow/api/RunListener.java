package com.vision.flow.api;

import com.vision.flow.engine.NodeStatusEntry;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.model.Node;

/**
 * Observability hook for runs.
 *
 * <p>
 * Callbacks arrive from the run's coordinator thread and from worker threads,
 * possibly for several runs at once, so implementations must be thread-safe.
 * They run on the scheduling path and should return quickly; hand heavy work
 * to another thread (see {@link com.vision.flow.event.RunEventPublisher}).
 * An exception thrown from a callback is logged and swallowed.
 */
public interface RunListener {

    /**
     * Called once the flow has been compiled and before any node is dispatched.
     *
     * @param nodeCount number of nodes in the run
     */
    void onRunStart(String runId, String flowName, int nodeCount);

    /** Called on the worker thread right before the executor is invoked. */
    void onNodeStart(String runId, Node node);

    /**
     * Called when a node reaches a terminal state, whether it executed or was
     * skipped, failed before dispatch or was cancelled.
     *
     * @param durationNanos executor wall time; 0 for nodes that never ran
     */
    void onNodeFinished(String runId, Node node, NodeStatusEntry entry, long durationNanos);

    /** Called after the outcome is final, before it is handed to result sinks. */
    void onRunEnd(RunOutcome outcome);
}
