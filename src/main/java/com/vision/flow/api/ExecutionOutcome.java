package com.vision.flow.api;

import com.vision.flow.model.PortValue;

import java.util.Map;

/**
 * What an {@link OperatorExecutor} reports for one execution.
 *
 * A successful outcome may leave an output port out of {@code outputs}: that
 * branch was not taken, and required consumers of the port are skipped.
 *
 * @param errorMessage null on success
 * @param durationMs   as measured by the executor; the scheduler measures its own
 */
public record ExecutionOutcome(boolean success, Map<String, PortValue> outputs, String errorMessage,
        long durationMs) {

    public ExecutionOutcome {
        outputs = Map.copyOf(outputs);
        if (!success && errorMessage == null)
            errorMessage = "operator reported failure";
    }

    public static ExecutionOutcome success(Map<String, PortValue> outputs) {
        return new ExecutionOutcome(true, outputs, null, 0);
    }

    public static ExecutionOutcome failure(String errorMessage) {
        return new ExecutionOutcome(false, Map.of(), errorMessage, 0);
    }

    public ExecutionOutcome withDuration(long durationMs) {
        return new ExecutionOutcome(success, outputs, errorMessage, durationMs);
    }
}
