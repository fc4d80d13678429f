package com.vision.flow.engine;

import com.vision.flow.api.ExecutionOutcome;
import com.vision.flow.api.OperatorExecutor;
import com.vision.flow.api.ParameterValidator;
import com.vision.flow.api.ResolvedInputs;
import com.vision.flow.api.ResultSink;
import com.vision.flow.api.RunListener;
import com.vision.flow.api.ValidationResult;
import com.vision.flow.buffer.BufferPool;
import com.vision.flow.buffer.CapacityExceededException;
import com.vision.flow.buffer.PoolExhaustedException;
import com.vision.flow.buffer.PooledBuffer;
import com.vision.flow.io.SchedulerConfig;
import com.vision.flow.model.Connection;
import com.vision.flow.model.Flow;
import com.vision.flow.model.FlowGraphException;
import com.vision.flow.model.LastExecution;
import com.vision.flow.model.Node;
import com.vision.flow.model.NodeStatus;
import com.vision.flow.model.Port;
import com.vision.flow.model.PortDataType;
import com.vision.flow.model.PortValue;
import com.vision.flow.operator.OperatorRegistry;
import com.vision.flow.util.ErrorRateLimiter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.log4j.Log4j2;

/**
 * Drives flows to completion on a shared worker pool.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li><b>Compile:</b> the flow snapshot is compiled into an
 * {@link ExecutionPlan}; a cycle or dangling connection ends the run as
 * {@code GRAPH_INVALID} before any node runs.</li>
 * <li><b>Missing inputs:</b> every enabled node with a required input that has
 * no producer and no initial value is failed with {@code MISSING_INPUT} up
 * front. Its executor is never invoked.</li>
 * <li><b>Dispatch:</b> each node has a pending count equal to its number of
 * incoming connections. Nodes at zero are ready; the coordinator dispatches
 * ready nodes to the worker pool, at most {@code maxConcurrency} of this run at
 * once, in no particular order.</li>
 * <li><b>Settle:</b> when a node finishes, its outputs are stored for routing
 * and each outgoing connection decrements its target's pending count. A target
 * whose required input stayed empty is skipped instead of dispatched.</li>
 * <li><b>Node timeout:</b> each dispatched node gets a child of the run's
 * signal that also trips near {@code nodeTimeoutMs}. A node still running at
 * that timeout is interrupted, abandoned and failed with {@code TIMEOUT}; its
 * dependents are skipped and independent branches carry on.</li>
 * <li><b>Abort:</b> on deadline or cancellation, nodes not yet started are
 * cancelled, in-flight nodes get {@code cancelGraceMs} to finish, and the rest
 * are interrupted and abandoned. Their late results are discarded. For a
 * deadline the grace is taken from the end of the timeout, so the run still
 * returns by its deadline.</li>
 * </ol>
 *
 * <p>
 * Node failures never escape as exceptions; they are recorded in the run's
 * {@link ExecutionStatusTable} and propagate structurally through skipped
 * dependents. Only scheduler bugs surface to the caller.
 *
 * <p>
 * All per-run state lives in a {@link RunContext}; the scheduler itself holds
 * only the worker pool, the shared {@link BufferPool} and the index of runs.
 */
@Log4j2
public final class FlowScheduler implements AutoCloseable {
    private static final AtomicInteger SCHEDULER_IDS = new AtomicInteger();

    private final SchedulerConfig config;
    private final OperatorRegistry registry;
    private final BufferPool pool;
    private final boolean ownsPool;
    private final RunListener listener;
    private final List<ResultSink> sinks;
    private final ExecutorService workers;
    private final ExecutorService coordinators;
    private final ErrorRateLimiter callbackErrors = new ErrorRateLimiter(log, 1000);

    private final Map<String, RunContext> activeRuns = new ConcurrentHashMap<>();
    private final Map<String, RunContext> finishedRuns;
    private volatile boolean closed;

    private FlowScheduler(Builder b) {
        this.config = b.config;
        this.registry = b.registry;
        this.ownsPool = b.pool == null;
        this.pool = ownsPool ? new BufferPool(config.getPoolMaxBytes(), config.getPoolMaxIdlePerShape()) : b.pool;
        this.listener = b.listener;
        this.sinks = List.copyOf(b.sinks);

        int id = SCHEDULER_IDS.incrementAndGet();
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), threadFactory("flow-worker-" + id));
        this.coordinators = Executors.newCachedThreadPool(threadFactory("flow-run-" + id));

        final int retention = config.getStatusRetention();
        this.finishedRuns = Collections.synchronizedMap(new LinkedHashMap<String, RunContext>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RunContext> eldest) {
                return size() > retention;
            }
        });
    }

    public static Builder builder(OperatorRegistry registry) {
        return new Builder(registry);
    }

    public SchedulerConfig config() {
        return config;
    }

    public OperatorRegistry registry() {
        return registry;
    }

    public BufferPool bufferPool() {
        return pool;
    }

    // ── Invocation surface ───────────────────────────────────────────

    public RunOutcome runFlow(Flow flow, Map<String, PortValue> initialInputs) {
        return runFlow(flow, initialInputs, config.getDefaultTimeoutMs());
    }

    /**
     * Runs a flow on the calling thread and returns its outcome.
     *
     * Returns within {@code timeoutMs}, whether or not the operators cooperate
     * with cancellation: operators are asked to stop up to
     * {@code cancelGraceMs} before the deadline and abandoned at it.
     */
    public RunOutcome runFlow(Flow flow, Map<String, PortValue> initialInputs, long timeoutMs) {
        return drive(open(flow, initialInputs, timeoutMs));
    }

    /** Starts a run on a coordinator thread. */
    public RunHandle submit(Flow flow, Map<String, PortValue> initialInputs, long timeoutMs) {
        RunContext ctx = open(flow, initialInputs, timeoutMs);
        try {
            CompletableFuture<RunOutcome> future = CompletableFuture.supplyAsync(() -> drive(ctx), coordinators);
            return new RunHandle(ctx.runId(), future, this);
        } catch (RejectedExecutionException e) {
            activeRuns.remove(ctx.runId());
            throw new IllegalStateException("Scheduler is closed", e);
        }
    }

    public RunHandle submit(Flow flow, Map<String, PortValue> initialInputs) {
        return submit(flow, initialInputs, config.getDefaultTimeoutMs());
    }

    public boolean cancelRun(String runId) {
        return cancelRun(runId, "cancelled by caller");
    }

    /** @return true if the run was active and this call cancelled it */
    public boolean cancelRun(String runId, String reason) {
        RunContext ctx = activeRuns.get(runId);
        if (ctx == null)
            return false;
        boolean cancelled = ctx.signal().cancel(reason);
        if (cancelled)
            log.info("Run {} cancellation requested: {}", runId, reason);
        return cancelled;
    }

    /**
     * Status table of an active or recently finished run.
     *
     * @throws IllegalArgumentException if the run is unknown or no longer retained
     */
    public ExecutionStatusTable status(String runId) {
        RunContext ctx = activeRuns.get(runId);
        if (ctx == null)
            ctx = finishedRuns.get(runId);
        if (ctx == null)
            throw new IllegalArgumentException("Unknown run: " + runId);
        return ctx.table();
    }

    public Optional<RunOutcome> outcome(String runId) {
        RunContext ctx = finishedRuns.get(runId);
        return ctx == null ? Optional.empty() : Optional.ofNullable(ctx.outcome());
    }

    public Set<String> activeRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    /**
     * Runs one operator outside any flow, with the same failure capture as a
     * flow run. Unconnected semantics apply: each input port takes
     * {@code inputs.get(portName)}, else its default.
     */
    public NodeResult executeNode(Node node, Map<String, PortValue> inputs, long timeoutMs) {
        Objects.requireNonNull(node, "node");
        ensureOpen();
        OperatorExecutor executor = registry.find(node.type());
        if (executor == null)
            return record(node, NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE,
                    noExecutor(node), null, 0));
        String invalid = invalidParameters(node, executor);
        if (invalid != null)
            return record(node, NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, invalid, null, 0));

        Map<String, PortValue> values = new LinkedHashMap<>();
        for (Port port : node.inputs().values()) {
            PortValue v = inputs.get(port.name());
            v = v == null ? null : v.as(port.dataType());
            if (v == null)
                v = port.defaultValue();
            if (v != null)
                values.put(port.name(), v);
            else if (port.required())
                return record(node, NodeResult.failed(node.id(), FailureKind.MISSING_INPUT,
                        missingInput(port), null, 0));
        }

        CancellationSignal signal = CancellationSignal.withTimeout(timeoutMs, leadMs(timeoutMs));
        Instant startedAt = Instant.now();
        Future<NodeResult> future = workers.submit(() -> invoke(node, executor, values, signal));
        NodeResult result;
        try {
            result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            result = NodeResult.cancelled(node.id(), FailureKind.TIMEOUT,
                    "abandoned after " + timeoutMs + " ms deadline", startedAt, elapsedSince(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            result = NodeResult.cancelled(node.id(), FailureKind.CANCELLED, "caller interrupted", startedAt,
                    elapsedSince(startedAt));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Executing " + node + " failed inside the scheduler", e.getCause());
        }
        return record(node, result);
    }

    /**
     * Cancels active runs, stops the worker pool and, if this scheduler created
     * it, shuts the buffer pool down.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        for (String runId : activeRuns.keySet())
            cancelRun(runId, "scheduler closing");
        coordinators.shutdown();
        workers.shutdown();
        try {
            long wait = config.getCancelGraceMs() * 2 + 100;
            if (!coordinators.awaitTermination(wait, TimeUnit.MILLISECONDS))
                coordinators.shutdownNow();
            if (!workers.awaitTermination(wait, TimeUnit.MILLISECONDS))
                workers.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinators.shutdownNow();
            workers.shutdownNow();
        }
        if (ownsPool)
            pool.shutdown();
        log.info("Scheduler closed");
    }

    // ── Run lifecycle ────────────────────────────────────────────────

    private RunContext open(Flow flow, Map<String, PortValue> initialInputs, long timeoutMs) {
        Objects.requireNonNull(flow, "flow");
        Objects.requireNonNull(initialInputs, "initialInputs");
        if (timeoutMs <= 0)
            throw new IllegalArgumentException("Timeout must be positive: " + timeoutMs);
        ensureOpen();
        RunContext ctx = new RunContext(UUID.randomUUID().toString(), flow.snapshot(), initialInputs,
                CancellationSignal.withTimeout(timeoutMs, leadMs(timeoutMs)));
        activeRuns.put(ctx.runId(), ctx);
        return ctx;
    }

    private RunOutcome drive(RunContext ctx) {
        try {
            try {
                ctx.plan(ExecutionPlan.compile(ctx.snapshot()));
            } catch (FlowGraphException e) {
                log.warn("Run {} rejected, {} is invalid: {}", ctx.runId(), ctx.flowName(), e.getMessage());
                return finish(ctx, new RunOutcome(ctx.runId(), ctx.flowId(), ctx.flowName(), RunStatus.FAILED,
                        FailureKind.GRAPH_INVALID, null, e.getMessage(), ctx.startedAt(), Instant.now(),
                        ctx.table().snapshot(), Map.of()));
            }

            int n = ctx.plan().nodeCount();
            log.info("Run {} of {} started: {} nodes, timeout {} ms", ctx.runId(), ctx.flowName(), n,
                    ctx.signal().timeoutMs());
            if (listener != null)
                safely(() -> listener.onRunStart(ctx.runId(), ctx.flowName(), n));

            dispatchLoop(ctx);
            return finish(ctx, aggregate(ctx));
        } catch (RuntimeException | Error e) {
            log.error("Run {} aborted by a scheduler error", ctx.runId(), e);
            ctx.signal().cancel("scheduler error");
            throw e;
        } finally {
            activeRuns.remove(ctx.runId());
        }
    }

    private void dispatchLoop(RunContext ctx) {
        final ExecutionPlan plan = ctx.plan();
        final CancellationSignal signal = ctx.signal();
        final int n = plan.nodeCount();
        final int maxInFlight = config.getMaxConcurrency();

        int[] pending = new int[n];
        ArrayDeque<Integer> ready = new ArrayDeque<>();
        BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        Map<Integer, Running> inFlight = new HashMap<>();
        int settled = 0;

        // An explicit cancel must wake the coordinator before the deadline.
        signal.onCancel(() -> completions.add(Completion.WAKE));

        failMissingInputs(ctx);
        for (int ti = 0; ti < n; ti++) {
            pending[ti] = plan.producerCount(ti);
            if (pending[ti] == 0)
                ready.add(ti);
        }

        while (settled < n) {
            while (!ready.isEmpty() && inFlight.size() < maxInFlight && !signal.isCancelled()) {
                int ti = ready.poll();
                Dispatch d = prepare(ctx, ti);
                if (d == null) {
                    settled++;
                    releaseConsumers(plan, ti, pending, ready);
                    continue;
                }
                inFlight.put(ti, new Running(workers.submit(() -> completions.add(runNode(ctx, d))), d.signal()));
            }
            if (settled == n || signal.isCancelled())
                break;
            if (inFlight.isEmpty())
                throw new IllegalStateException("Run " + ctx.runId() + " stalled with " + (n - settled)
                        + " unsettled nodes");

            Completion c;
            try {
                long wait = Math.min(signal.remainingNanos(), nanosToNodeDeadline(ctx, inFlight));
                c = completions.poll(wait, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                signal.cancel("coordinator interrupted");
                break;
            }
            // A node abandoned on its own timeout may still report; it is already settled.
            if (c != null && c != Completion.WAKE && inFlight.remove(c.index()) != null) {
                if (c.result() != null)
                    settle(ctx, c.index(), c.result());
                settled++;
                releaseConsumers(plan, c.index(), pending, ready);
            }
            if (!signal.isCancelled())
                settled += abandonOverdue(ctx, inFlight, pending, ready);
        }

        if (settled < n)
            abort(ctx, inFlight, completions);
    }

    /** Fails every node whose unconnected required input has no initial value. */
    private void failMissingInputs(RunContext ctx) {
        ExecutionPlan plan = ctx.plan();
        for (int ti = 0; ti < plan.nodeCount(); ti++) {
            Node node = plan.node(ti);
            if (!node.isEnabled())
                continue;
            for (Port port : node.inputs().values()) {
                if (port.required() && plan.producerOf(ti, port.name()) == null
                        && ctx.rootValue(node, port) == null) {
                    settle(ctx, ti, NodeResult.failed(node.id(), FailureKind.MISSING_INPUT, missingInput(port),
                            null, 0));
                    break;
                }
            }
        }
    }

    /**
     * Decides what to do with a node whose producers have all settled.
     *
     * @return the work to dispatch, or null if the node was settled here
     */
    private Dispatch prepare(RunContext ctx, int ti) {
        Node node = ctx.plan().node(ti);
        if (ctx.table().get(node.id()).isTerminal())
            return null;
        if (!node.isEnabled()) {
            settle(ctx, ti, NodeResult.skipped(node.id(), "disabled"));
            return null;
        }

        Map<String, PortValue> values = new LinkedHashMap<>();
        String failedProducer = null;
        String benignReason = null;
        String unreadable = null;
        for (Port port : node.inputs().values()) {
            Connection c = ctx.plan().producerOf(ti, port.name());
            PortValue v = c == null ? ctx.rootValue(node, port) : ctx.routed(c);
            if (v != null) {
                PortValue typed = v.as(port.dataType());
                if (typed == null && unreadable == null)
                    unreadable = "input '" + port.name() + "' received " + v.type() + " value of "
                            + v.payload().getClass().getSimpleName() + ", port expects " + port.dataType();
                if (typed != null)
                    values.put(port.name(), typed);
                continue;
            }
            if (!port.required())
                continue;
            if (ctx.isBlocking(c.sourceNodeId())) {
                if (failedProducer == null)
                    failedProducer = c.sourceNodeId();
            } else if (benignReason == null) {
                benignReason = ctx.hasProduced(c.sourceNodeId()) ? "branch not taken at " + c
                        : "upstream " + c.sourceNodeId() + " skipped";
            }
        }
        if (failedProducer != null) {
            settle(ctx, ti, NodeResult.skipped(node.id(), "upstream " + failedProducer + " did not succeed"));
            ctx.markBlocking(node.id());
            return null;
        }
        if (benignReason != null) {
            settle(ctx, ti, NodeResult.skipped(node.id(), benignReason));
            return null;
        }
        if (unreadable != null) {
            settle(ctx, ti, NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, unreadable, null, 0));
            return null;
        }

        OperatorExecutor executor = registry.find(node.type());
        if (executor == null) {
            settle(ctx, ti, NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, noExecutor(node), null, 0));
            return null;
        }
        String invalid = invalidParameters(node, executor);
        if (invalid != null) {
            settle(ctx, ti, NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, invalid, null, 0));
            return null;
        }
        return new Dispatch(ti, node, executor, values, nodeSignal(ctx.signal()));
    }

    /** Worker side of one dispatch. */
    private Completion runNode(RunContext ctx, Dispatch d) {
        if (ctx.isClosed() || !ctx.table().markRunning(d.node().id(), Instant.now()))
            return new Completion(d.index(), null);
        log.debug("Run {}: starting {}", ctx.runId(), d.node());
        if (listener != null)
            safely(() -> listener.onNodeStart(ctx.runId(), d.node()));
        NodeResult result = invoke(d.node(), d.executor(), d.inputs(), d.signal());
        if (d.signal() != ctx.signal() && !ctx.signal().isCancelled() && overran(d.signal(), result))
            result = NodeResult.failed(d.node().id(), FailureKind.TIMEOUT, nodeTimedOut(d.signal()),
                    result.startedAt(), result.durationNanos());
        if (ctx.isClosed())
            log.debug("Run {} already finished, discarding late result of {}", ctx.runId(), d.node());
        return new Completion(d.index(), result);
    }

    /**
     * Calls the executor with its working buffers and converts every way it can
     * end into a {@link NodeResult}. Buffers are released on every path.
     */
    private NodeResult invoke(Node node, OperatorExecutor executor, Map<String, PortValue> inputs,
            CancellationSignal signal) {
        final Instant startedAt = Instant.now();
        final long t0 = System.nanoTime();
        final List<PooledBuffer> held = new ArrayList<>();
        try {
            signal.throwIfCancelled();
            Map<String, PooledBuffer> working = acquireWorkingBuffers(node, signal, held);
            ExecutionOutcome outcome = executor.execute(node, new ResolvedInputs(inputs, working), signal);
            long nanos = System.nanoTime() - t0;
            if (outcome == null)
                return NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, "executor returned no outcome",
                        startedAt, nanos);
            if (!outcome.success())
                return NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, outcome.errorMessage(), startedAt,
                        nanos);
            String bad = checkOutputs(node, outcome.outputs());
            if (bad != null)
                return NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, bad, startedAt, nanos);
            return NodeResult.succeeded(node.id(), typedOutputs(node, outcome.outputs()), startedAt, nanos);
        } catch (CapacityExceededException | PoolExhaustedException e) {
            if (signal.isCancelled())
                return cancelledResult(node, signal, startedAt, t0);
            return NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, e.getMessage(), startedAt,
                    System.nanoTime() - t0);
        } catch (CancellationException e) {
            return cancelledResult(node, signal, startedAt, t0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelledResult(node, signal, startedAt, t0);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            String message = t.getMessage() != null ? t.getClass().getSimpleName() + ": " + t.getMessage()
                    : t.toString();
            return NodeResult.failed(node.id(), FailureKind.EXECUTOR_FAILURE, message, startedAt,
                    System.nanoTime() - t0);
        } finally {
            for (PooledBuffer b : held) {
                try {
                    pool.release(b);
                } catch (RuntimeException e) {
                    log.error("Failed to release {} after {}", b, node, e);
                }
            }
        }
    }

    private Map<String, PooledBuffer> acquireWorkingBuffers(Node node, CancellationSignal signal,
            List<PooledBuffer> held) {
        if (node.workingShape() == null)
            return Map.of();
        Map<String, PooledBuffer> working = new LinkedHashMap<>();
        for (Port port : node.outputs().values()) {
            if (port.dataType() != PortDataType.IMAGE)
                continue;
            PooledBuffer b = pool.acquire(node.workingShape(), config.getPoolAcquireTimeoutMs(), signal::isCancelled);
            held.add(b);
            working.put(port.name(), b);
        }
        return working;
    }

    private static NodeResult cancelledResult(Node node, CancellationSignal signal, Instant startedAt, long t0) {
        FailureKind kind = signal.cause() != null ? signal.cause() : FailureKind.CANCELLED;
        String reason = signal.reason() != null ? signal.reason() : "operator aborted";
        return NodeResult.cancelled(node.id(), kind, reason, startedAt, System.nanoTime() - t0);
    }

    private static String checkOutputs(Node node, Map<String, PortValue> outputs) {
        for (Map.Entry<String, PortValue> e : outputs.entrySet()) {
            Port port = node.output(e.getKey());
            if (port == null)
                return "produced unknown output port '" + e.getKey() + "'";
            if (!e.getValue().fits(port.dataType()))
                return "output '" + e.getKey() + "' is " + e.getValue().type() + ", port declares " + port.dataType();
        }
        return null;
    }

    // Values tagged ANY on typed ports leave with the port's tag.
    private static Map<String, PortValue> typedOutputs(Node node, Map<String, PortValue> outputs) {
        Map<String, PortValue> typed = new LinkedHashMap<>();
        for (Map.Entry<String, PortValue> e : outputs.entrySet())
            typed.put(e.getKey(), e.getValue().as(node.output(e.getKey()).dataType()));
        return typed;
    }

    /** Records a terminal result on the coordinator thread. */
    private void settle(RunContext ctx, int ti, NodeResult result) {
        Node node = ctx.plan().node(ti);
        NodeStatusEntry entry = result.toEntry();
        if (!ctx.table().complete(entry))
            return;

        switch (result.status()) {
            case SUCCEEDED -> {
                ctx.recordProduced(node.id(), result.outputs());
                log.debug("Run {}: {} succeeded in {} ms", ctx.runId(), node, result.durationMs());
            }
            case FAILED, CANCELLED -> {
                ctx.markBlocking(node.id());
                if (!ctx.isAborted())
                    ctx.recordFailure(node.id(), result.failure(), result.errorMessage());
                if (result.status() == NodeStatus.FAILED)
                    log.warn("Run {}: {} failed ({}): {}", ctx.runId(), node, result.failure(),
                            result.errorMessage());
                else
                    log.debug("Run {}: {} cancelled: {}", ctx.runId(), node, result.errorMessage());
            }
            default -> log.debug("Run {}: {} skipped: {}", ctx.runId(), node, result.errorMessage());
        }

        node.recordExecution(new LastExecution(result.status(), result.durationMs(), result.errorMessage()));
        if (listener != null) {
            NodeStatusEntry finalEntry = ctx.table().get(node.id());
            safely(() -> listener.onNodeFinished(ctx.runId(), node, finalEntry, result.durationNanos()));
        }
    }

    private static void releaseConsumers(ExecutionPlan plan, int ti, int[] pending, ArrayDeque<Integer> ready) {
        final int start = plan.outgoingStart(ti);
        final int end = plan.outgoingEnd(ti);
        for (int ci = start; ci < end; ci++) {
            int child = plan.indexOf(plan.outgoingAt(ci).targetNodeId());
            if (--pending[child] == 0)
                ready.add(child);
        }
    }

    /**
     * Deadline or cancellation: cancel what has not started, give in-flight
     * nodes the grace period, then interrupt and abandon the rest.
     */
    private void abort(RunContext ctx, Map<Integer, Running> inFlight, BlockingQueue<Completion> completions) {
        ctx.markAborted();
        CancellationSignal signal = ctx.signal();
        FailureKind kind = signal.cause() != null ? signal.cause() : FailureKind.CANCELLED;
        String reason = signal.reason() != null ? signal.reason() : "cancelled";
        ExecutionPlan plan = ctx.plan();

        for (int ti = 0; ti < plan.nodeCount(); ti++) {
            if (!inFlight.containsKey(ti) && !ctx.table().get(plan.node(ti).id()).isTerminal())
                settle(ctx, ti, NodeResult.cancelled(plan.node(ti).id(), kind, reason, null, 0));
        }

        // A deadline tripped the signal ahead of time; the grace runs out at the deadline itself.
        long grace = kind == FailureKind.TIMEOUT && signal.nanosToDeadline() != Long.MAX_VALUE
                ? signal.nanosToDeadline()
                : TimeUnit.MILLISECONDS.toNanos(config.getCancelGraceMs());
        long graceEnd = System.nanoTime() + grace;
        while (!inFlight.isEmpty()) {
            long left = graceEnd - System.nanoTime();
            if (left <= 0)
                break;
            Completion c;
            try {
                c = completions.poll(left, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (c == null || c == Completion.WAKE)
                continue;
            inFlight.remove(c.index());
            if (c.result() != null)
                settle(ctx, c.index(), c.result());
        }

        for (Map.Entry<Integer, Running> e : inFlight.entrySet()) {
            e.getValue().future().cancel(true);
            Node node = plan.node(e.getKey());
            NodeStatusEntry current = ctx.table().get(node.id());
            long ran = current.startedAt() == null ? 0 : elapsedSince(current.startedAt());
            settle(ctx, e.getKey(), NodeResult.cancelled(node.id(), kind, "abandoned: " + reason,
                    current.startedAt(), ran));
            log.warn("Run {}: abandoned {} still running after {}", ctx.runId(), node, reason);
        }
    }

    private RunOutcome aggregate(RunContext ctx) {
        ExecutionPlan plan = ctx.plan();
        Map<String, PortValue> outputs = new LinkedHashMap<>();
        for (int ti = 0; ti < plan.nodeCount(); ti++) {
            if (!plan.isTerminal(ti))
                continue;
            Node node = plan.node(ti);
            Map<String, PortValue> produced = ctx.producedBy(node.id());
            if (produced != null)
                for (Port port : node.outputs().values())
                    if (produced.containsKey(port.name()))
                        outputs.put(node.id() + "." + port.name(), produced.get(port.name()));
        }

        RunStatus status;
        FailureKind failure;
        String failedNode;
        String error;
        if (ctx.isAborted()) {
            status = RunStatus.FAILED;
            failure = ctx.signal().cause() != null ? ctx.signal().cause() : FailureKind.CANCELLED;
            failedNode = null;
            error = failure == FailureKind.TIMEOUT ? "run timed out: " + ctx.signal().reason()
                    : "run cancelled: " + ctx.signal().reason();
        } else if (ctx.firstFailedNodeId() != null) {
            status = RunStatus.FAILED;
            failure = ctx.firstFailure();
            failedNode = ctx.firstFailedNodeId();
            error = plan.node(plan.indexOf(failedNode)).name() + ": " + ctx.firstError();
        } else {
            status = RunStatus.SUCCEEDED;
            failure = null;
            failedNode = null;
            error = null;
        }
        return new RunOutcome(ctx.runId(), ctx.flowId(), ctx.flowName(), status, failure, failedNode, error,
                ctx.startedAt(), Instant.now(), ctx.table().snapshot(), outputs);
    }

    private RunOutcome finish(RunContext ctx, RunOutcome outcome) {
        ctx.close(outcome);
        finishedRuns.put(ctx.runId(), ctx);
        if (outcome.isSuccess())
            log.info("Run {} of {} succeeded in {} ms", ctx.runId(), ctx.flowName(), outcome.durationMs());
        else
            log.info("Run {} of {} failed in {} ms ({}): {}", ctx.runId(), ctx.flowName(), outcome.durationMs(),
                    outcome.failure(), outcome.errorMessage());
        if (listener != null)
            safely(() -> listener.onRunEnd(outcome));
        for (ResultSink sink : sinks)
            safely(() -> sink.accept(outcome));
        return outcome;
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private NodeResult record(Node node, NodeResult result) {
        node.recordExecution(new LastExecution(result.status(), result.durationMs(), result.errorMessage()));
        if (!result.isSuccess())
            log.warn("{} did not succeed ({}): {}", node, result.failure(), result.errorMessage());
        return result;
    }

    private static String invalidParameters(Node node, OperatorExecutor executor) {
        ValidationResult result = ParameterValidator.check(executor, node);
        return result.valid() ? null : "invalid parameters: " + String.join("; ", result.errors());
    }

    /**
     * Fails every in-flight node past its own timeout. Its worker is
     * interrupted; whatever it reports later is ignored.
     *
     * @return the number of nodes settled
     */
    private int abandonOverdue(RunContext ctx, Map<Integer, Running> inFlight, int[] pending,
            ArrayDeque<Integer> ready) {
        int abandoned = 0;
        Iterator<Map.Entry<Integer, Running>> it = inFlight.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, Running> e = it.next();
            CancellationSignal nodeSignal = e.getValue().signal();
            if (nodeSignal == ctx.signal() || nodeSignal.nanosToDeadline() > 0)
                continue;
            it.remove();
            e.getValue().future().cancel(true);
            int ti = e.getKey();
            Node node = ctx.plan().node(ti);
            NodeStatusEntry current = ctx.table().get(node.id());
            long ran = current.startedAt() == null ? 0 : elapsedSince(current.startedAt());
            settle(ctx, ti, NodeResult.failed(node.id(), FailureKind.TIMEOUT, "abandoned: " + nodeTimedOut(nodeSignal),
                    current.startedAt(), ran));
            releaseConsumers(ctx.plan(), ti, pending, ready);
            abandoned++;
        }
        return abandoned;
    }

    private static long nanosToNodeDeadline(RunContext ctx, Map<Integer, Running> inFlight) {
        long nearest = Long.MAX_VALUE;
        for (Running r : inFlight.values())
            if (r.signal() != ctx.signal())
                nearest = Math.min(nearest, r.signal().nanosToDeadline());
        return nearest;
    }

    /** Signal for one node: the run's own, or a child bounded by {@code nodeTimeoutMs}. */
    private CancellationSignal nodeSignal(CancellationSignal run) {
        long timeout = config.getNodeTimeoutMs();
        return timeout > 0 ? run.child(timeout, leadMs(timeout)) : run;
    }

    /** Part of a timeout handed to operators for winding down before the deadline. */
    private long leadMs(long timeoutMs) {
        return Math.min(config.getCancelGraceMs(), timeoutMs / 2);
    }

    // Past the deadline itself, or stopped by the early trip ahead of it.
    private static boolean overran(CancellationSignal nodeSignal, NodeResult result) {
        return nodeSignal.nanosToDeadline() == 0 || (!result.isSuccess() && nodeSignal.isExpired());
    }

    private static String nodeTimedOut(CancellationSignal nodeSignal) {
        return "operator exceeded its " + nodeSignal.timeoutMs() + " ms timeout";
    }

    private static String noExecutor(Node node) {
        return "no executor registered for type " + node.type();
    }

    private static String missingInput(Port port) {
        return "required input '" + port.name() + "' has no producer and no initial value";
    }

    private static long elapsedSince(Instant start) {
        return TimeUnit.MILLISECONDS.toNanos(System.currentTimeMillis() - start.toEpochMilli());
    }

    private void safely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            callbackErrors.log("Run callback failed: " + e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("Scheduler is closed");
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Work handed to a worker. */
    private record Dispatch(int index, Node node, OperatorExecutor executor, Map<String, PortValue> inputs,
            CancellationSignal signal) {
    }

    /** A dispatched node as the coordinator tracks it. */
    private record Running(Future<?> future, CancellationSignal signal) {
    }

    /** A worker's report; a null result means the dispatch was dropped. */
    private record Completion(int index, NodeResult result) {
        static final Completion WAKE = new Completion(-1, null);
    }

    /** Wiring for a {@link FlowScheduler}. */
    public static final class Builder {
        private final OperatorRegistry registry;
        private SchedulerConfig config = SchedulerConfig.defaults();
        private BufferPool pool;
        private RunListener listener;
        private final List<ResultSink> sinks = new ArrayList<>();

        private Builder(OperatorRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        public Builder config(SchedulerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** Shares an existing pool; the scheduler will not shut it down. */
        public Builder bufferPool(BufferPool pool) {
            this.pool = pool;
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder resultSink(ResultSink sink) {
            sinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public FlowScheduler build() {
            config.validate();
            return new FlowScheduler(this);
        }
    }
}
