package com.vision.flow.api;

import com.vision.flow.engine.CancellationSignal;
import com.vision.flow.model.Node;

/**
 * The pluggable unit that transforms a node's inputs into its outputs.
 *
 * Implementations are shared by every node of their {@link #operatorType()}
 * and by concurrent runs, so they must be stateless or thread-safe. They may
 * be invoked repeatedly and must not retain inputs after returning.
 *
 * Long-running executors should poll {@code cancellation} before and after
 * blocking work. Executors that never do are still bounded: the scheduler
 * abandons them at their node timeout or the run deadline, whichever comes
 * first, and discards their late result.
 *
 * Throwing is equivalent to returning {@link ExecutionOutcome#failure}.
 */
public interface OperatorExecutor extends ParameterValidator {

    /** The node type tag this executor binds to. */
    String operatorType();

    ExecutionOutcome execute(Node node, ResolvedInputs inputs, CancellationSignal cancellation) throws Exception;

    @Override
    default ValidationResult validate(Node node) {
        return ValidationResult.VALID;
    }
}
