package com.vision.flow.event;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.EventHandlerGroup;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.vision.flow.api.RunListener;
import com.vision.flow.engine.NodeStatusEntry;
import com.vision.flow.engine.RunOutcome;
import com.vision.flow.model.Node;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.log4j.Log4j2;

/**
 * {@link RunListener} that moves run transitions onto an LMAX Disruptor ring
 * buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Scheduler threads (coordinators and workers, many at once) claim a slot
 * with {@code tryNext()}, fill the pre-allocated {@link RunEvent} and
 * publish.</li>
 * <li>Each registered {@link EventHandler} sees every event, in order, on its
 * own daemon thread.</li>
 * <li>A final handler clears the slot so it does not pin run data.</li>
 * </ol>
 *
 * <p>
 * Publishing never blocks the scheduler: when the ring is full the event is
 * dropped and counted in {@link #dropped()}.
 */
@Log4j2
public final class RunEventPublisher implements RunListener, AutoCloseable {
    public static final int DEFAULT_RING_SIZE = 1024;

    private static final EventHandler<RunEvent> CLEAR = (event, sequence, endOfBatch) -> event.clear();

    private final Disruptor<RunEvent> disruptor;
    private final RingBuffer<RunEvent> ringBuffer;
    private final AtomicLong dropped = new AtomicLong();

    public RunEventPublisher(int ringSize, List<EventHandler<RunEvent>> handlers) {
        if (Integer.bitCount(ringSize) != 1)
            throw new IllegalArgumentException("Ring size must be a power of 2: " + ringSize);
        if (handlers.isEmpty())
            throw new IllegalArgumentException("At least one handler is required");

        this.disruptor = new Disruptor<>(
                RunEvent::new,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        // Handlers run side by side; CLEAR waits for all of them.
        EventHandlerGroup<RunEvent> group = null;
        for (EventHandler<RunEvent> handler : handlers) {
            EventHandlerGroup<RunEvent> single = disruptor.handleEventsWith(handler);
            group = group == null ? single : group.and(single);
        }
        group.then(CLEAR);
        this.ringBuffer = disruptor.start();
        log.debug("Run event ring started: {} slots, {} handlers", ringSize, handlers.size());
    }

    @SafeVarargs
    public RunEventPublisher(int ringSize, EventHandler<RunEvent>... handlers) {
        this(ringSize, List.of(handlers));
    }

    @SafeVarargs
    public RunEventPublisher(EventHandler<RunEvent>... handlers) {
        this(DEFAULT_RING_SIZE, List.of(handlers));
    }

    /** Events lost because the ring was full. */
    public long dropped() {
        return dropped.get();
    }

    @Override
    public void onRunStart(String runId, String flowName, int nodeCount) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setRunStarted(runId, flowName, nodeCount);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onNodeStart(String runId, Node node) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setNodeStarted(runId, node.id(), node.name(), node.type());
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onNodeFinished(String runId, Node node, NodeStatusEntry entry, long durationNanos) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setNodeFinished(runId, node.id(), node.name(), node.type(), entry.status(),
                    entry.failure(), entry.errorMessage(), durationNanos);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onRunEnd(RunOutcome outcome) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setRunFinished(outcome.runId(), outcome.flowName(), outcome.status(),
                    outcome.failure(), outcome.errorMessage(), outcome.nodes().size(), outcome.durationMs());
        } finally {
            ringBuffer.publish(seq);
        }
    }

    private long claim() {
        try {
            return ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            if (dropped.incrementAndGet() % 1000 == 1)
                log.warn("Run event ring full, {} events dropped so far", dropped.get());
            return -1;
        }
    }

    /** Drains published events (bounded wait) and stops the handler threads. */
    @Override
    public void close() {
        try {
            disruptor.shutdown(2, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Run event handlers did not drain in time, halting");
            disruptor.halt();
        }
    }
}
