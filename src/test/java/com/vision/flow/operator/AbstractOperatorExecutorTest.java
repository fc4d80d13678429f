package com.vision.flow.operator;

import com.vision.flow.api.ExecutionOutcome;
import com.vision.flow.api.ResolvedInputs;
import com.vision.flow.api.ValidationResult;
import com.vision.flow.engine.CancellationSignal;
import com.vision.flow.model.Node;
import com.vision.flow.model.PortDataType;
import com.vision.flow.model.PortValue;
import org.junit.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.Assert.*;

public class AbstractOperatorExecutorTest {

    /** Binarizes a scalar against the "level" parameter. */
    private static final class ThresholdOperator extends AbstractOperatorExecutor {
        ThresholdOperator() {
            super("threshold");
        }

        @Override
        protected Map<String, PortValue> process(Node node, ResolvedInputs inputs, CancellationSignal cancellation) {
            double level = doubleParam(node, "level", 128);
            boolean invert = boolParam(node, "invert", false);
            boolean above = inputs.require("value").asScalar() >= level;
            return Map.of("pass", PortValue.bool(above != invert));
        }

        @Override
        protected void checkParameters(Node node, List<String> errors) {
            checkRange(node, "level", 0, 255, errors);
        }
    }

    private static Node threshold(double level) {
        return Node.builder("threshold")
                .input("value", PortDataType.SCALAR)
                .output("pass", PortDataType.BOOLEAN)
                .parameter("level", PortValue.scalar(level))
                .build();
    }

    @Test
    public void testSuccessCarriesOutputsAndDuration() throws Exception {
        ExecutionOutcome outcome = new ThresholdOperator().execute(threshold(100),
                ResolvedInputs.of(Map.of("value", PortValue.scalar(150))), CancellationSignal.none());

        assertTrue(outcome.success());
        assertTrue(outcome.outputs().get("pass").asBoolean());
        assertTrue(outcome.durationMs() >= 0);
    }

    @Test
    public void testExceptionBecomesFailure() throws Exception {
        // "value" is not resolved, require() throws
        ExecutionOutcome outcome = new ThresholdOperator().execute(threshold(100), ResolvedInputs.of(Map.of()),
                CancellationSignal.none());

        assertFalse(outcome.success());
        assertTrue(outcome.errorMessage().contains("value"));
        assertTrue(outcome.outputs().isEmpty());
    }

    @Test
    public void testCheckedExceptionBecomesFailure() throws Exception {
        AbstractOperatorExecutor camera = new AbstractOperatorExecutor("camera") {
            @Override
            protected Map<String, PortValue> process(Node node, ResolvedInputs inputs,
                    CancellationSignal cancellation) throws IOException {
                throw new IOException("device not responding");
            }
        };

        ExecutionOutcome outcome = camera.execute(Node.builder("camera").build(), ResolvedInputs.of(Map.of()),
                CancellationSignal.none());

        assertFalse(outcome.success());
        assertEquals("device not responding", outcome.errorMessage());
    }

    @Test(expected = CancellationException.class)
    public void testCancelledSignalStopsBeforeProcessing() throws Exception {
        CancellationSignal signal = CancellationSignal.none();
        signal.cancel("stop");
        new ThresholdOperator().execute(threshold(100), ResolvedInputs.of(Map.of("value", PortValue.scalar(1))),
                signal);
    }

    @Test
    public void testInterruptionBecomesCancellation() {
        AbstractOperatorExecutor waiter = new AbstractOperatorExecutor("waiter") {
            @Override
            protected Map<String, PortValue> process(Node node, ResolvedInputs inputs,
                    CancellationSignal cancellation) throws InterruptedException {
                throw new InterruptedException();
            }
        };
        try {
            waiter.execute(Node.builder("waiter").build(), ResolvedInputs.of(Map.of()), CancellationSignal.none());
            fail("Expected CancellationException");
        } catch (CancellationException expected) {
            assertTrue(Thread.interrupted());
        }
    }

    @Test
    public void testParameterValidation() {
        ThresholdOperator op = new ThresholdOperator();

        assertSame(ValidationResult.VALID, op.validate(threshold(100)));

        ValidationResult bad = op.validate(threshold(300));
        assertFalse(bad.valid());
        assertEquals(1, bad.errors().size());
        assertTrue(bad.errors().get(0).startsWith("level must be within"));

        ValidationResult missing = op.validate(Node.builder("threshold").build());
        assertEquals(List.of("level is missing"), missing.errors());
    }

    @Test
    public void testTypedParameterDefaults() {
        Node node = Node.builder("x")
                .parameter("name", PortValue.text("left"))
                .parameter("count", PortValue.scalar(2.6))
                .build();

        assertEquals("left", AbstractOperatorExecutor.textParam(node, "name", "?"));
        assertEquals(3, AbstractOperatorExecutor.intParam(node, "count", 0));
        assertEquals(7, AbstractOperatorExecutor.intParam(node, "absent", 7));
        // Wrong type falls back to the default
        assertEquals(1.5, AbstractOperatorExecutor.doubleParam(node, "name", 1.5), 0.0);
    }
}
