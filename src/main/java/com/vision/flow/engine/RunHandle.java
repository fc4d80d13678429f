package com.vision.flow.engine;

import java.util.concurrent.CompletableFuture;

/** Handle to a run started with {@link FlowScheduler#submit}. */
public final class RunHandle {
    private final String runId;
    private final CompletableFuture<RunOutcome> outcome;
    private final FlowScheduler scheduler;

    RunHandle(String runId, CompletableFuture<RunOutcome> outcome, FlowScheduler scheduler) {
        this.runId = runId;
        this.outcome = outcome;
        this.scheduler = scheduler;
    }

    public String runId() {
        return runId;
    }

    /** Completes with the outcome; completes exceptionally only on a scheduler error. */
    public CompletableFuture<RunOutcome> outcome() {
        return outcome;
    }

    /** Blocks until the run finishes. */
    public RunOutcome await() {
        return outcome.join();
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /** @return true if the run was still active and is now cancelled */
    public boolean cancel() {
        return scheduler.cancelRun(runId);
    }

    public ExecutionStatusTable status() {
        return scheduler.status(runId);
    }

    @Override
    public String toString() {
        return "RunHandle[" + runId + (isDone() ? ", done]" : "]");
    }
}
