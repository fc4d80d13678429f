package com.vision.flow.engine;

import com.vision.flow.model.NodeStatus;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ExecutionStatusTableTest {

    private ExecutionStatusTable table;

    @Before
    public void setUp() {
        table = new ExecutionStatusTable("run-1", List.of("A", "B", "C", "D"));
    }

    @Test
    public void testEveryNodeStartsPending() {
        assertEquals(4, table.count(NodeStatus.PENDING));
        assertEquals(0.0, table.progress(), 0.0);
        assertFalse(table.isComplete());
        assertNull(table.get("A").startedAt());
    }

    @Test
    public void testLifecycleAndProgress() {
        Instant now = Instant.now();
        assertTrue(table.markRunning("A", now));
        assertFalse("Only PENDING can start", table.markRunning("A", now));
        assertEquals(List.of("A"), table.runningNodes());

        assertTrue(table.complete(NodeResult.succeeded("A", Map.of(), now, 1_000_000).toEntry()));
        assertTrue(table.complete(NodeResult.skipped("B", "disabled").toEntry()));

        assertEquals(0.5, table.progress(), 1e-9);
        assertEquals(NodeStatus.SUCCEEDED, table.status("A"));
        assertEquals(now, table.get("A").startedAt());
        assertEquals(1, table.get("A").durationMs());
        assertEquals("disabled", table.get("B").errorMessage());
        assertTrue(table.runningNodes().isEmpty());
    }

    @Test
    public void testTerminalEntryIsNeverOverwritten() {
        assertTrue(table.complete(NodeResult.cancelled("C", FailureKind.TIMEOUT, "abandoned", null, 0).toEntry()));
        // A late result from an abandoned worker
        assertFalse(table.complete(NodeResult.succeeded("C", Map.of(), Instant.now(), 5).toEntry()));
        assertFalse(table.markRunning("C", Instant.now()));

        assertEquals(NodeStatus.CANCELLED, table.status("C"));
        assertEquals(FailureKind.TIMEOUT, table.get("C").failure());
    }

    @Test
    public void testCancellingARunningNodeKeepsItsStartTime() {
        Instant startedAt = Instant.now();
        table.markRunning("D", startedAt);
        table.complete(NodeResult.cancelled("D", FailureKind.CANCELLED, "cancelled", null, 0).toEntry());

        assertEquals(startedAt, table.get("D").startedAt());
    }

    @Test
    public void testSnapshotKeepsFlowOrder() {
        assertEquals(List.of("A", "B", "C", "D"), List.copyOf(table.snapshot().keySet()));
    }

    @Test
    public void testCompleteWhenAllTerminal() {
        for (String id : List.of("A", "B", "C", "D"))
            table.complete(NodeResult.skipped(id, "test").toEntry());
        assertTrue(table.isComplete());
        assertEquals(1.0, table.progress(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNode() {
        table.get("Z");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonTerminalCompletionRejected() {
        table.complete(NodeStatusEntry.pending("A"));
    }
}
