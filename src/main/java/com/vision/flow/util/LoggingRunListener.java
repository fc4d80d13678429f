package com.vision.flow.util;

import com.vision.flow.api.RunListener;
import com.vision.flow.engine.NodeStatusEntry;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.model.Node;
import com.vision.flow.model.NodeStatus;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logs node starts and finishes at DEBUG and failures at WARN. Failure lines
 * are throttled so a flow failing on every frame logs about once a second.
 */
public final class LoggingRunListener implements RunListener {
    private static final Logger log = LogManager.getLogger(LoggingRunListener.class);

    private final ErrorRateLimiter failures;

    public LoggingRunListener() {
        this(1000);
    }

    public LoggingRunListener(long minIntervalMillis) {
        this.failures = new ErrorRateLimiter(log, minIntervalMillis);
    }

    @Override
    public void onRunStart(String runId, String flowName, int nodeCount) {
        log.debug("[{}] {} started with {} nodes", runId, flowName, nodeCount);
    }

    @Override
    public void onNodeStart(String runId, Node node) {
        log.debug("[{}] {} running", runId, node);
    }

    @Override
    public void onNodeFinished(String runId, Node node, NodeStatusEntry entry, long durationNanos) {
        if (entry.status() == NodeStatus.FAILED)
            failures.warn(String.format("[%s] Node '%s' (%s) failed: %s", runId, node.name(), entry.failure(),
                    entry.errorMessage()));
        else if (log.isDebugEnabled())
            log.debug("[{}] {} {} in {} us", runId, node, entry.status(), durationNanos / 1000);
    }

    @Override
    public void onRunEnd(RunOutcome outcome) {
        if (outcome.isSuccess())
            log.debug("[{}] {} succeeded in {} ms", outcome.runId(), outcome.flowName(), outcome.durationMs());
        else
            failures.warn(String.format("[%s] %s failed (%s): %s", outcome.runId(), outcome.flowName(),
                    outcome.failure(), outcome.errorMessage()));
    }
}
