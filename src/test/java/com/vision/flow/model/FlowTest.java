package com.vision.flow.model;

import com.vision.flow.model.FlowGraphException.Reason;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class FlowTest {

    private Flow flow;

    private static Node relay(String id) {
        return Node.builder("relay").id(id)
                .input("in", PortDataType.SCALAR)
                .output("out", PortDataType.SCALAR)
                .build();
    }

    @Before
    public void setUp() {
        flow = new Flow("test");
    }

    @Test
    public void testConnectionClosingACycleIsRejected() {
        flow.addNode(relay("A"));
        flow.addNode(relay("B"));
        flow.addConnection(Connection.of("A", "out", "B", "in"));

        try {
            flow.addConnection(Connection.of("B", "out", "A", "in"));
            fail("Expected CYCLE_DETECTED");
        } catch (FlowGraphException e) {
            assertEquals(Reason.CYCLE_DETECTED, e.reason());
            assertEquals(List.of("A", "B", "A"), e.cycle());
        }
        // The rejected edge was not stored
        assertEquals(1, flow.connections().size());
        assertTrue(flow.validate().isAcyclic());
    }

    @Test
    public void testLongerCycleReportsFullPath() {
        for (String id : new String[] { "A", "B", "C" })
            flow.addNode(relay(id));
        flow.addConnection(Connection.of("A", "out", "B", "in"));
        flow.addConnection(Connection.of("B", "out", "C", "in"));

        try {
            flow.addConnection(Connection.of("C", "out", "A", "in"));
            fail("Expected CYCLE_DETECTED");
        } catch (FlowGraphException e) {
            assertEquals(Reason.CYCLE_DETECTED, e.reason());
            assertEquals(List.of("A", "B", "C", "A"), e.cycle());
        }
    }

    @Test
    public void testDiamondIsAcyclic() {
        // A -> B -> D and A -> C -> D: D is reached twice, which is not a cycle
        flow.addNode(relay("A"));
        flow.addNode(relay("B"));
        flow.addNode(relay("C"));
        flow.addNode(Node.builder("join").id("D")
                .input("left", PortDataType.SCALAR)
                .input("right", PortDataType.SCALAR)
                .build());
        flow.addConnection(Connection.of("A", "out", "B", "in"));
        flow.addConnection(Connection.of("A", "out", "C", "in"));
        flow.addConnection(Connection.of("B", "out", "D", "left"));
        flow.addConnection(Connection.of("C", "out", "D", "right"));

        CycleCheck check = flow.validate();
        assertTrue(check.isAcyclic());
        assertTrue(check.cycle().isEmpty());
        assertTrue(flow.snapshot().validate().isAcyclic());
    }

    @Test
    public void testValidateFindsCycleInRestoredFlow() {
        Flow restored = Flow.restore("f1", "restored",
                List.of(relay("A"), relay("B")),
                List.of(Connection.of("A", "out", "B", "in"), Connection.of("B", "out", "A", "in")));

        CycleCheck check = restored.validate();
        assertFalse(check.isAcyclic());
        assertEquals("A", check.cycle().get(0));
        assertEquals(check.cycle().get(0), check.cycle().get(check.cycle().size() - 1));
        assertEquals("f1", restored.id());
    }

    @Test
    public void testDuplicateNodeId() {
        flow.addNode(relay("A"));
        try {
            flow.addNode(relay("A"));
            fail();
        } catch (FlowGraphException e) {
            assertEquals(Reason.DUPLICATE_NODE_ID, e.reason());
        }
    }

    @Test
    public void testUnknownPortAndMissingNode() {
        flow.addNode(relay("A"));
        flow.addNode(relay("B"));

        assertReason(Reason.UNKNOWN_PORT, () -> flow.addConnection(Connection.of("A", "nope", "B", "in")));
        assertReason(Reason.UNKNOWN_PORT, () -> flow.addConnection(Connection.of("A", "out", "B", "nope")));
        assertReason(Reason.UNKNOWN_PORT, () -> flow.addConnection(Connection.of("A", "out", "Z", "in")));
    }

    @Test
    public void testDirectionTypeAndBindingChecks() {
        flow.addNode(relay("A"));
        flow.addNode(relay("B"));
        flow.addNode(relay("C"));
        flow.addNode(Node.builder("label").id("T").input("text", PortDataType.TEXT).build());

        assertReason(Reason.PORT_DIRECTION_MISMATCH, () -> flow.addConnection(Connection.of("A", "in", "B", "in")));
        assertReason(Reason.PORT_DIRECTION_MISMATCH, () -> flow.addConnection(Connection.of("A", "out", "B", "out")));
        assertReason(Reason.PORT_TYPE_MISMATCH, () -> flow.addConnection(Connection.of("A", "out", "T", "text")));
        assertReason(Reason.SELF_CONNECTION, () -> flow.addConnection(Connection.of("A", "out", "A", "in")));

        flow.addConnection(Connection.of("A", "out", "C", "in"));
        assertReason(Reason.INPUT_ALREADY_BOUND, () -> flow.addConnection(Connection.of("B", "out", "C", "in")));
    }

    @Test
    public void testAnyIsCompatibleWithEverything() {
        flow.addNode(Node.builder("device").id("cam").output("handle", PortDataType.ANY).build());
        flow.addNode(relay("B"));
        flow.addConnection(Connection.of("cam", "handle", "B", "in"));
        assertEquals(1, flow.connections().size());
    }

    @Test
    public void testRemoveNodeDropsAttachedConnections() {
        flow.addNode(relay("A"));
        flow.addNode(relay("B"));
        flow.addNode(relay("C"));
        flow.addConnection(Connection.of("A", "out", "B", "in"));
        flow.addConnection(Connection.of("B", "out", "C", "in"));
        long before = flow.version();

        flow.removeNode("B");

        assertNull(flow.node("B"));
        assertTrue(flow.connections().isEmpty());
        assertTrue(flow.version() > before);
        // C.in is free again
        flow.addConnection(Connection.of("A", "out", "C", "in"));
        assertReason(Reason.UNKNOWN_NODE, () -> flow.removeNode("B"));
    }

    @Test
    public void testRemoveAndClearConnections() {
        flow.addNode(relay("A"));
        flow.addNode(relay("B"));
        Connection c = Connection.withId("c1", "A", "out", "B", "in");
        flow.addConnection(c);

        assertTrue(flow.removeConnection("c1"));
        assertFalse(flow.removeConnection("c1"));

        flow.addConnection(c);
        flow.clearConnections();
        assertTrue(flow.connections().isEmpty());
        // Input no longer bound
        flow.addConnection(Connection.of("A", "out", "B", "in"));
    }

    @Test
    public void testSnapshotIsUnaffectedByLaterEdits() {
        flow.addNode(relay("A"));
        Flow.Snapshot snapshot = flow.snapshot();
        flow.addNode(relay("B"));

        assertEquals(1, snapshot.nodes().size());
        assertEquals(2, flow.nodes().size());
        assertTrue(flow.snapshot().version() > snapshot.version());
    }

    @Test
    public void testLongChainIsCheckedWithoutDeepRecursion() {
        int n = 50_000;
        List<Node> nodes = new ArrayList<>();
        List<Connection> edges = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            nodes.add(relay("N" + i));
            if (i > 0)
                edges.add(Connection.of("N" + (i - 1), "out", "N" + i, "in"));
        }
        assertTrue(Flow.restore("chain", "chain", nodes, edges).validate().isAcyclic());

        // Closing the chain back onto its head
        edges.add(Connection.of("N" + (n - 1), "out", "N0", "in"));
        CycleCheck check = Flow.restore("ring", "ring", nodes, edges).validate();
        assertFalse(check.isAcyclic());
        assertEquals(n + 1, check.cycle().size());
        assertEquals("N0", check.cycle().get(0));
    }

    private static void assertReason(Reason expected, Runnable action) {
        try {
            action.run();
            fail("Expected " + expected);
        } catch (FlowGraphException e) {
            assertEquals(expected, e.reason());
        }
    }
}
