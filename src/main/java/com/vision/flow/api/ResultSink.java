package com.vision.flow.api;

import com.vision.flow.engine.RunOutcome;

/**
 * Receives every finished run's outcome, e.g. a results repository.
 *
 * Called once per run on the thread that completed it. A sink that throws is
 * logged and otherwise ignored.
 */
@FunctionalInterface
public interface ResultSink {

    void accept(RunOutcome outcome);
}
