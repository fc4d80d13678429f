package com.vision.flow.engine;

import com.vision.flow.model.Connection;
import com.vision.flow.model.Flow;
import com.vision.flow.model.FlowGraphException;
import com.vision.flow.model.Node;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ExecutionPlanTest {

    private static List<String> ids(List<Node> nodes) {
        List<String> ids = new ArrayList<>();
        for (Node n : nodes)
            ids.add(n.id());
        return ids;
    }

    @Test
    public void testOrderAndLayersOfDiamond() {
        // Added in reverse so insertion order differs from topological order
        Flow flow = new Flow("diamond");
        flow.addNode(StubOperators.scalarNode("D", "increment", "left", "right"));
        flow.addNode(StubOperators.scalarNode("C", "increment", "in"));
        flow.addNode(StubOperators.scalarNode("B", "increment", "in"));
        flow.addNode(StubOperators.constantNode("A", 1));
        flow.addConnection(Connection.of("A", "out", "B", "in"));
        flow.addConnection(Connection.of("A", "out", "C", "in"));
        flow.addConnection(Connection.of("B", "out", "D", "left"));
        flow.addConnection(Connection.of("C", "out", "D", "right"));

        ExecutionPlan plan = ExecutionPlan.compile(flow.snapshot());

        assertEquals(4, plan.nodeCount());
        List<String> order = ids(plan.executionOrder());
        assertEquals("A", order.get(0));
        assertEquals("D", order.get(3));

        List<List<Node>> layers = plan.layers();
        assertEquals(3, layers.size());
        assertEquals(List.of("A"), ids(layers.get(0)));
        assertEquals(2, layers.get(1).size());
        assertEquals(List.of("D"), ids(layers.get(2)));

        int a = plan.indexOf("A");
        int d = plan.indexOf("D");
        assertEquals(0, plan.producerCount(a));
        assertEquals(2, plan.producerCount(d));
        assertEquals(2, plan.outgoingEnd(a) - plan.outgoingStart(a));
        assertTrue(plan.isTerminal(d));
        assertFalse(plan.isTerminal(a));
        assertEquals("B", plan.producerOf(d, "left").sourceNodeId());
        assertNull(plan.producerOf(a, "in"));
        assertEquals(2, plan.layer(d));
    }

    @Test
    public void testEveryProducerPrecedesItsConsumer() {
        Flow flow = new Flow("chain");
        for (int i = 0; i < 20; i++)
            flow.addNode(StubOperators.scalarNode("N" + i, "increment", "in"));
        // Wire in a shuffled but acyclic way: higher index feeds lower index
        for (int i = 19; i > 0; i--)
            flow.addConnection(Connection.of("N" + i, "out", "N" + (i - 1), "in"));

        ExecutionPlan plan = ExecutionPlan.compile(flow.snapshot());
        for (Connection c : flow.connections())
            assertTrue(c.toString(), plan.indexOf(c.sourceNodeId()) < plan.indexOf(c.targetNodeId()));
        assertEquals(20, plan.layers().size());
    }

    @Test
    public void testCycleIsRejectedWithPath() {
        Flow flow = Flow.restore("id", "cyclic",
                List.of(StubOperators.scalarNode("A", "increment", "in"),
                        StubOperators.scalarNode("B", "increment", "in")),
                List.of(Connection.of("A", "out", "B", "in"), Connection.of("B", "out", "A", "in")));
        try {
            ExecutionPlan.compile(flow.snapshot());
            fail("Expected CYCLE_DETECTED");
        } catch (FlowGraphException e) {
            assertEquals(FlowGraphException.Reason.CYCLE_DETECTED, e.reason());
            assertEquals(List.of("A", "B", "A"), e.cycle());
        }
    }

    @Test
    public void testDanglingConnectionIsRejected() {
        Flow.Snapshot snapshot = new Flow.Snapshot("id", "dangling", 1,
                List.of(StubOperators.constantNode("A", 1)),
                List.of(Connection.of("A", "out", "gone", "in")));
        try {
            ExecutionPlan.compile(snapshot);
            fail("Expected UNKNOWN_PORT");
        } catch (FlowGraphException e) {
            assertEquals(FlowGraphException.Reason.UNKNOWN_PORT, e.reason());
        }
    }

    @Test
    public void testEmptyFlowCompiles() {
        ExecutionPlan plan = ExecutionPlan.compile(new Flow("empty").snapshot());
        assertEquals(0, plan.nodeCount());
        assertTrue(plan.layers().isEmpty());
        assertEquals("empty", plan.flowName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIndexOfUnknownNode() {
        ExecutionPlan.compile(new Flow("empty").snapshot()).indexOf("nope");
    }
}
