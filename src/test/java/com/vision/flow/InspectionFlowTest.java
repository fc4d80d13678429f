package com.vision.flow;

import com.vision.flow.api.ResolvedInputs;
import com.vision.flow.engine.CancellationSignal;
import com.vision.flow.engine.ExecutionPlan;
import com.vision.flow.engine.FailureKind;
import com.vision.flow.engine.RunHandle;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.event.RunEvent;
import com.vision.flow.io.SchedulerConfig;
import com.vision.flow.model.Connection;
import com.vision.flow.model.Flow;
import com.vision.flow.model.ImageFrame;
import com.vision.flow.model.Node;
import com.vision.flow.model.NodeStatus;
import com.vision.flow.model.PortDataType;
import com.vision.flow.model.PortValue;
import com.vision.flow.model.ShapeKey;
import com.vision.flow.operator.AbstractOperatorExecutor;
import com.vision.flow.operator.FlowValidationReport;
import com.vision.flow.util.NodeProfileListener;
import com.vision.flow.util.RunLatencyListener;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class InspectionFlowTest {

    /** Binarizes the image into its working buffer and counts bright pixels. */
    static final class ThresholdOperator extends AbstractOperatorExecutor {
        ThresholdOperator() {
            super("threshold");
        }

        @Override
        protected Map<String, PortValue> process(Node node, ResolvedInputs inputs, CancellationSignal cancellation) {
            ImageFrame src = inputs.require("image").asImage();
            int level = intParam(node, "level", 128);
            ByteBuffer dst = inputs.workingBuffer("mask").memory();
            byte[] data = src.data();
            int bright = 0;
            for (int i = 0; i < data.length; i++) {
                boolean on = (data[i] & 0xFF) >= level;
                dst.put(i, on ? (byte) 255 : 0);
                if (on)
                    bright++;
            }
            byte[] mask = new byte[data.length];
            dst.get(0, mask);
            return Map.of(
                    "mask", PortValue.image(new ImageFrame(src.width(), src.height(), 1, mask)),
                    "count", PortValue.scalar(bright));
        }

        @Override
        protected void checkParameters(Node node, List<String> errors) {
            checkRange(node, "level", 0, 255, errors);
        }
    }

    /** Routes to "ok" or "ng" by comparing the count against "min". */
    static final class JudgeOperator extends AbstractOperatorExecutor {
        JudgeOperator() {
            super("judge");
        }

        @Override
        protected Map<String, PortValue> process(Node node, ResolvedInputs inputs, CancellationSignal cancellation) {
            double count = inputs.require("count").asScalar();
            double min = doubleParam(node, "min", 1);
            return count >= min ? Map.of("ok", PortValue.text("OK " + (int) count))
                    : Map.of("ng", PortValue.text("NG " + (int) count));
        }
    }

    private final List<String> events = new ArrayList<>();
    private final List<RunOutcome> sunk = new ArrayList<>();
    private CountDownLatch runFinished;
    private InspectionFlow engine;

    @Before
    public void setUp() {
        runFinished = new CountDownLatch(1);
        SchedulerConfig config = SchedulerConfig.defaults();
        config.setMaxConcurrency(2);
        config.setWorkerThreads(4);
        config.setCancelGraceMs(100);
        config.setPoolMaxBytes(1 << 20);

        engine = InspectionFlow.builder()
                .config(config)
                .operator(new ThresholdOperator())
                .operator(new JudgeOperator())
                .logFailures()
                .resultSink(o -> {
                    synchronized (sunk) {
                        sunk.add(o);
                    }
                })
                .eventHandler((event, sequence, endOfBatch) -> {
                    synchronized (events) {
                        events.add(event.type().name());
                    }
                    if (event.type() == RunEvent.Type.RUN_FINISHED)
                        runFinished.countDown();
                })
                .build();
    }

    @After
    public void tearDown() {
        engine.close();
    }

    private Flow inspection(double min) {
        Flow flow = engine.newFlow("solder-joint");
        flow.addNode(Node.builder("threshold").id("bin")
                .input("image", PortDataType.IMAGE)
                .output("mask", PortDataType.IMAGE)
                .output("count", PortDataType.SCALAR)
                .parameter("level", PortValue.scalar(100))
                .workingShape(ShapeKey.of8Bit(4, 2, 1))
                .build());
        flow.addNode(Node.builder("judge").id("judge")
                .input("count", PortDataType.SCALAR)
                .output("ok", PortDataType.TEXT)
                .output("ng", PortDataType.TEXT)
                .parameter("min", PortValue.scalar(min))
                .build());
        flow.addConnection(Connection.of("bin", "count", "judge", "count"));
        return flow;
    }

    private static PortValue image() {
        return PortValue.image(new ImageFrame(4, 2, 1, new byte[] { 0, 50, 100, (byte) 150, (byte) 200, 10, 20,
                (byte) 250 }));
    }

    @Test
    public void testInspectionRunEndToEnd() throws Exception {
        Flow flow = inspection(3);
        assertTrue(engine.validate(flow).isValid());

        RunOutcome outcome = engine.run(flow, Map.of("image", image()));

        assertTrue(outcome.errorMessage(), outcome.isSuccess());
        assertEquals("OK 4", outcome.output("judge", "ok").asText());
        assertNull(outcome.output("judge", "ng"));
        // bin is not terminal: its mask feeds nothing but its count feeds judge
        assertNull(outcome.output("bin", "mask"));
        assertEquals(0, engine.poolStatistics().activeBuffers());
        assertEquals(1, engine.poolStatistics().created());

        assertTrue(runFinished.await(5, TimeUnit.SECONDS));
        synchronized (events) {
            assertEquals("RUN_STARTED", events.get(0));
            assertEquals("RUN_FINISHED", events.get(events.size() - 1));
        }
        synchronized (sunk) {
            assertEquals(1, sunk.size());
        }
    }

    @Test
    public void testFailedJudgementIsStillASuccessfulRun() {
        RunOutcome outcome = engine.run(inspection(10), Map.of("image", image()));

        assertTrue(outcome.isSuccess());
        assertEquals("NG 4", outcome.output("judge", "ng").asText());
    }

    @Test
    public void testPlanExposesLayers() {
        ExecutionPlan plan = engine.plan(inspection(1));
        assertEquals(2, plan.layers().size());
        assertEquals("bin", plan.executionOrder().get(0).id());
    }

    @Test
    public void testValidationReportsBadParameters() {
        Flow flow = engine.newFlow("bad");
        flow.addNode(Node.builder("threshold").id("bin").name("Binarize")
                .input("image", PortDataType.IMAGE)
                .parameter("level", PortValue.scalar(999))
                .build());

        FlowValidationReport report = engine.validate(flow);
        assertFalse(report.isValid());
        assertTrue(report.errors().get(0).startsWith("Binarize: level must be within"));

        RunOutcome outcome = engine.run(flow, Map.of("image", image()));
        assertEquals(FailureKind.EXECUTOR_FAILURE, outcome.failure());
        assertTrue(outcome.errorMessage().contains("invalid parameters"));
    }

    @Test
    public void testSupplierProvidesInitialInputs() {
        RunOutcome outcome = engine.run(inspection(1), () -> Map.of("image", image()), 5_000);
        assertTrue(outcome.isSuccess());
    }

    @Test
    public void testSupplierFailureStartsNoRun() {
        try {
            engine.run(inspection(1), () -> {
                throw new IllegalStateException("camera offline");
            }, 5_000);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("camera offline", e.getCause().getMessage());
        }
        assertTrue(engine.scheduler().activeRunIds().isEmpty());
        synchronized (sunk) {
            assertTrue(sunk.isEmpty());
        }
    }

    @Test
    public void testProfilingAndLatencyListeners() {
        NodeProfileListener profile = engine.enableNodeProfiling();
        RunLatencyListener latency = engine.enableLatencyTracking();

        Flow flow = inspection(1);
        for (int i = 0; i < 3; i++)
            engine.run(flow, Map.of("image", image()));

        assertEquals(3, profile.stats("threshold").count);
        assertEquals(3, profile.stats("judge").count);
        assertEquals(3, latency.totalRuns());
        assertEquals(1.0, latency.successRatio(), 0.0);
        assertEquals(2, engine.poolStatistics().reused());
    }

    @Test
    public void testSubmitAndQueryStatus() {
        RunHandle handle = engine.submit(inspection(1), Map.of("image", image()), 5_000);
        RunOutcome outcome = handle.await();

        assertTrue(outcome.isSuccess());
        assertEquals(NodeStatus.SUCCEEDED, engine.status(handle.runId()).status("judge"));
        assertFalse(engine.cancel(handle.runId()));
    }

    @Test
    public void testExecuteSingleNode() {
        Node node = Node.builder("judge").input("count", PortDataType.SCALAR)
                .output("ok", PortDataType.TEXT)
                .output("ng", PortDataType.TEXT)
                .build();

        var result = engine.executeNode(node, Map.of("count", PortValue.scalar(0)), 1_000);

        assertTrue(result.isSuccess());
        assertEquals("NG 0", result.outputs().get("ng").asText());
    }
}
