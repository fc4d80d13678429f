package com.vision.flow;

import com.lmax.disruptor.EventHandler;
import com.vision.flow.api.InitialInputSupplier;
import com.vision.flow.api.OperatorExecutor;
import com.vision.flow.api.ResultSink;
import com.vision.flow.api.RunListener;
import com.vision.flow.buffer.BufferPool;
import com.vision.flow.buffer.BufferPoolStatistics;
import com.vision.flow.engine.ExecutionPlan;
import com.vision.flow.engine.ExecutionStatusTable;
import com.vision.flow.engine.FlowScheduler;
import com.vision.flow.engine.NodeResult;
import com.vision.flow.engine.RunHandle;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.event.RunEvent;
import com.vision.flow.event.RunEventPublisher;
import com.vision.flow.io.SchedulerConfig;
import com.vision.flow.model.Flow;
import com.vision.flow.model.Node;
import com.vision.flow.model.PortValue;
import com.vision.flow.operator.FlowValidationReport;
import com.vision.flow.operator.FlowValidator;
import com.vision.flow.operator.OperatorRegistry;
import com.vision.flow.util.CompositeRunListener;
import com.vision.flow.util.LoggingRunListener;
import com.vision.flow.util.NodeProfileListener;
import com.vision.flow.util.RunLatencyListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of the inspection flow engine.
 *
 * <p>
 * Wires an {@link OperatorRegistry}, a {@link FlowScheduler} with its
 * {@link BufferPool}, the listeners and the result sinks, and exposes the
 * common operations on one object:
 *
 * <pre>{@code
 * try (InspectionFlow engine = InspectionFlow.builder()
 *         .operator(new ThresholdOperator())
 *         .operator(new BlobCountOperator())
 *         .build()) {
 *     Flow flow = engine.newFlow("solder-joint");
 *     // add nodes and connections ...
 *     RunOutcome outcome = engine.run(flow, Map.of("image", PortValue.image(frame)));
 * }
 * }</pre>
 *
 * <p>
 * Flows are plain {@link Flow} objects: they can be edited between runs and
 * shared by concurrent runs.
 */
public final class InspectionFlow implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(InspectionFlow.class);

    private final OperatorRegistry registry;
    private final FlowScheduler scheduler;
    private final FlowValidator validator;
    private final CompositeRunListener listeners;
    private final RunEventPublisher events;

    private InspectionFlow(Builder b) {
        this.registry = b.registry;
        this.listeners = new CompositeRunListener();
        for (RunListener l : b.listeners)
            listeners.add(l);
        this.events = b.eventHandlers.isEmpty() ? null
                : new RunEventPublisher(b.ringSize, List.copyOf(b.eventHandlers));
        if (events != null)
            listeners.add(events);

        FlowScheduler.Builder sb = FlowScheduler.builder(registry)
                .config(b.config)
                .bufferPool(b.pool)
                .listener(listeners);
        for (ResultSink sink : b.sinks)
            sb.resultSink(sink);
        this.scheduler = sb.build();
        this.validator = new FlowValidator(registry);
        log.info("Inspection flow engine ready: {} operator types", registry.types().size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Flow newFlow(String name) {
        return new Flow(name);
    }

    public FlowValidationReport validate(Flow flow) {
        return validator.validate(flow);
    }

    /** Compiles the flow as a run would, for inspecting its order and layers. */
    public ExecutionPlan plan(Flow flow) {
        return ExecutionPlan.compile(flow.snapshot());
    }

    public RunOutcome run(Flow flow, Map<String, PortValue> initialInputs) {
        return scheduler.runFlow(flow, initialInputs);
    }

    public RunOutcome run(Flow flow, Map<String, PortValue> initialInputs, long timeoutMs) {
        return scheduler.runFlow(flow, initialInputs, timeoutMs);
    }

    /**
     * Pulls the initial inputs from a supplier, then runs.
     *
     * @throws IllegalStateException if the supplier fails; no run is started
     */
    public RunOutcome run(Flow flow, InitialInputSupplier supplier, long timeoutMs) {
        Map<String, PortValue> inputs;
        try {
            inputs = supplier.supply();
        } catch (Exception e) {
            throw new IllegalStateException("Initial input supplier failed for " + flow.name(), e);
        }
        return scheduler.runFlow(flow, inputs, timeoutMs);
    }

    public RunHandle submit(Flow flow, Map<String, PortValue> initialInputs, long timeoutMs) {
        return scheduler.submit(flow, initialInputs, timeoutMs);
    }

    public boolean cancel(String runId) {
        return scheduler.cancelRun(runId);
    }

    public ExecutionStatusTable status(String runId) {
        return scheduler.status(runId);
    }

    public NodeResult executeNode(Node node, Map<String, PortValue> inputs, long timeoutMs) {
        return scheduler.executeNode(node, inputs, timeoutMs);
    }

    public BufferPoolStatistics poolStatistics() {
        return scheduler.bufferPool().statistics();
    }

    public OperatorRegistry registry() {
        return registry;
    }

    public FlowScheduler scheduler() {
        return scheduler;
    }

    /** Adds a listener to the running engine. */
    public void addListener(RunListener listener) {
        listeners.add(listener);
    }

    /** Enables per-operator timing. Use the returned listener to dump statistics. */
    public NodeProfileListener enableNodeProfiling() {
        var profile = new NodeProfileListener();
        listeners.add(profile);
        return profile;
    }

    public RunLatencyListener enableLatencyTracking() {
        var latency = new RunLatencyListener();
        listeners.add(latency);
        return latency;
    }

    @Override
    public void close() {
        scheduler.close();
        if (events != null)
            events.close();
    }

    /** Configures an {@link InspectionFlow}. */
    public static final class Builder {
        private SchedulerConfig config;
        private final OperatorRegistry registry = new OperatorRegistry();
        private final List<RunListener> listeners = new ArrayList<>();
        private final List<ResultSink> sinks = new ArrayList<>();
        private final List<EventHandler<RunEvent>> eventHandlers = new ArrayList<>();
        private int ringSize = RunEventPublisher.DEFAULT_RING_SIZE;
        private BufferPool pool;

        private Builder() {
        }

        /** Defaults to {@link SchedulerConfig#load()}. */
        public Builder config(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder operator(OperatorExecutor executor) {
            registry.register(executor);
            return this;
        }

        public Builder listener(RunListener listener) {
            listeners.add(listener);
            return this;
        }

        /** Logs node failures at WARN, throttled. */
        public Builder logFailures() {
            return listener(new LoggingRunListener());
        }

        public Builder resultSink(ResultSink sink) {
            sinks.add(sink);
            return this;
        }

        /** Delivers run events to the handler on a ring-buffer thread. */
        public Builder eventHandler(EventHandler<RunEvent> handler) {
            eventHandlers.add(handler);
            return this;
        }

        public Builder eventRingSize(int ringSize) {
            this.ringSize = ringSize;
            return this;
        }

        /** Shares a pool across engines; it is not shut down by {@link InspectionFlow#close()}. */
        public Builder bufferPool(BufferPool pool) {
            this.pool = pool;
            return this;
        }

        public InspectionFlow build() {
            if (config == null)
                config = SchedulerConfig.load();
            return new InspectionFlow(this);
        }
    }
}
