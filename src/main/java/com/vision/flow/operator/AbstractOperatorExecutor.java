package com.vision.flow.operator;

import com.vision.flow.api.ExecutionOutcome;
import com.vision.flow.api.OperatorExecutor;
import com.vision.flow.api.ResolvedInputs;
import com.vision.flow.api.ValidationResult;
import com.vision.flow.engine.CancellationSignal;
import com.vision.flow.model.Node;
import com.vision.flow.model.PortDataType;
import com.vision.flow.model.PortValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for operators.
 *
 * <p>
 * Handles the parts every operator repeats:
 * <ul>
 * <li>a cancellation check before the core call,</li>
 * <li>timing of the core call into {@link ExecutionOutcome#durationMs()},</li>
 * <li>conversion of exceptions into a failed outcome with a log line.</li>
 * </ul>
 * Cancellation is not converted: a {@link CancellationException} reaches the
 * scheduler, which records the node as cancelled.
 *
 * <p>
 * Subclasses implement {@link #process} and, when they have parameters,
 * {@link #checkParameters}.
 */
public abstract class AbstractOperatorExecutor implements OperatorExecutor {
    protected final Logger log = LogManager.getLogger(getClass());

    private final String operatorType;

    protected AbstractOperatorExecutor(String operatorType) {
        this.operatorType = operatorType;
    }

    @Override
    public final String operatorType() {
        return operatorType;
    }

    @Override
    public final ExecutionOutcome execute(Node node, ResolvedInputs inputs, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        long t0 = System.nanoTime();
        try {
            Map<String, PortValue> outputs = process(node, inputs, cancellation);
            long ms = (System.nanoTime() - t0) / 1_000_000;
            log.debug("{} finished in {} ms", node, ms);
            return ExecutionOutcome.success(outputs).withDuration(ms);
        } catch (CancellationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(node + " interrupted");
        } catch (Exception e) {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            log.warn("{} failed after {} ms: {}", node, ms, e.toString());
            return ExecutionOutcome.failure(e.getMessage() != null ? e.getMessage() : e.toString()).withDuration(ms);
        }
    }

    /**
     * The operator's algorithm. Omitting an output port from the result means
     * that branch was not taken.
     */
    protected abstract Map<String, PortValue> process(Node node, ResolvedInputs inputs,
            CancellationSignal cancellation) throws Exception;

    @Override
    public final ValidationResult validate(Node node) {
        List<String> errors = new ArrayList<>();
        checkParameters(node, errors);
        return ValidationResult.of(errors);
    }

    /** Adds one message per invalid parameter. */
    protected void checkParameters(Node node, List<String> errors) {
    }

    // ── Typed parameter getters ──────────────────────────────────────

    protected static double doubleParam(Node node, String name, double defaultValue) {
        PortValue v = node.parameter(name);
        return v != null && v.type() == PortDataType.SCALAR ? v.asScalar() : defaultValue;
    }

    protected static int intParam(Node node, String name, int defaultValue) {
        PortValue v = node.parameter(name);
        return v != null && v.type() == PortDataType.SCALAR ? (int) Math.round(v.asScalar()) : defaultValue;
    }

    protected static boolean boolParam(Node node, String name, boolean defaultValue) {
        PortValue v = node.parameter(name);
        return v != null && v.type() == PortDataType.BOOLEAN ? v.asBoolean() : defaultValue;
    }

    protected static String textParam(Node node, String name, String defaultValue) {
        PortValue v = node.parameter(name);
        return v != null && v.type() == PortDataType.TEXT ? v.asText() : defaultValue;
    }

    /** Adds an error unless the scalar parameter lies within [min, max]. */
    protected static void checkRange(Node node, String name, double min, double max, List<String> errors) {
        double v = doubleParam(node, name, Double.NaN);
        if (Double.isNaN(v))
            errors.add(name + " is missing");
        else if (v < min || v > max)
            errors.add(name + " must be within [" + min + ", " + max + "], was " + v);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + operatorType + "]";
    }
}
