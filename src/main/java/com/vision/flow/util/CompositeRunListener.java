package com.vision.flow.util;

import com.vision.flow.api.RunListener;
import com.vision.flow.engine.NodeStatusEntry;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.model.Node;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link RunListener}s. Adding copies the array,
 * so iteration never locks.
 */
public class CompositeRunListener implements RunListener {
    private volatile RunListener[] listeners = new RunListener[0];

    public CompositeRunListener(RunListener... listeners) {
        for (RunListener l : listeners)
            add(l);
    }

    public synchronized CompositeRunListener add(RunListener listener) {
        RunListener[] old = listeners;
        RunListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(String runId, String flowName, int nodeCount) {
        for (RunListener l : listeners)
            l.onRunStart(runId, flowName, nodeCount);
    }

    @Override
    public void onNodeStart(String runId, Node node) {
        for (RunListener l : listeners)
            l.onNodeStart(runId, node);
    }

    @Override
    public void onNodeFinished(String runId, Node node, NodeStatusEntry entry, long durationNanos) {
        for (RunListener l : listeners)
            l.onNodeFinished(runId, node, entry, durationNanos);
    }

    @Override
    public void onRunEnd(RunOutcome outcome) {
        for (RunListener l : listeners)
            l.onRunEnd(outcome);
    }
}
