package com.nodeflow.dfg.graph;

import com.nodeflow.dfg.MathNode;
import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphChangeListener;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.node.CalcNode;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class GraphTest {

    private Graph graph;
    private MathNode n1;
    private MathNode n2;
    private int structureChanges;
    private final List<String> valueChanges = new ArrayList<>();

    @Before
    public void setUp() {
        graph = new Graph("g");
        n1 = graph.addNode(new MathNode());
        n2 = graph.addNode(new MathNode());
        graph.addChangeListener(new GraphChangeListener() {
            @Override
            public void onStructureChanged(GraphView changed) {
                structureChanges++;
            }

            @Override
            public void onInputValueChanged(Node node, NodePort port) {
                valueChanges.add(node.id() + "." + port.name());
            }
        });
    }

    @Test
    public void testAddConnection() {
        Connection c = graph.addConnection(n1.output("c"), n2.input("a"));

        assertEquals(List.of(c), graph.connections());
        assertEquals(1, n1.output("c").connectionCount());
        assertEquals(1, n2.input("a").connectionCount());
        assertEquals(List.of(c), graph.connectionsTo(n2.input("a")));
        assertEquals(1, structureChanges);
    }

    @Test
    public void testRejectsWrongDirection() {
        ConnectionCheck check = graph.checkConnection(n2.input("a"), n1.output("c"));

        assertFalse(check.allowed());
        assertNotNull(check.reason());
    }

    @Test
    public void testRejectsSelfConnection() {
        assertFalse(graph.checkConnection(n1.output("c"), n1.input("a")).allowed());
    }

    @Test
    public void testRejectsForeignPort() {
        MathNode outside = new MathNode();

        assertFalse(graph.checkConnection(outside.output("c"), n1.input("a")).allowed());
    }

    @Test
    public void testRejectsDuplicateConnection() {
        graph.addConnection(n1.output("c"), n2.input("a"));

        assertFalse(graph.checkConnection(n1.output("c"), n2.input("a")).allowed());
    }

    @Test
    public void testRejectsCycle() {
        graph.addConnection(n1.output("c"), n2.input("a"));

        ConnectionCheck check = graph.checkConnection(n2.output("c"), n1.input("a"));

        assertFalse(check.allowed());
        assertTrue(check.reason().contains("cycle"));
        try {
            graph.addConnection(n2.output("c"), n1.input("a"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            assertEquals(1, graph.connections().size());
        }
    }

    @Test
    public void testReplacesConnectionOfSingleInput() {
        MathNode n3 = graph.addNode(new MathNode());
        Connection old = graph.addConnection(n1.output("c"), n3.input("a"));

        assertEquals(List.of(old), graph.checkConnection(n2.output("c"), n3.input("a")).replaced());
        Connection replacement = graph.addConnection(n2.output("c"), n3.input("a"));

        assertEquals(List.of(replacement), graph.connections());
        assertEquals(0, n1.output("c").connectionCount());
        assertEquals(1, n3.input("a").connectionCount());
    }

    @Test
    public void testMultiInputKeepsConnections() {
        CalcNode sink = graph.addNode(new CalcNode("Sink").withMultiInput("values", List.of()));

        graph.addConnection(n1.output("c"), sink.input("values"));
        graph.addConnection(n2.output("c"), sink.input("values"));

        assertEquals(2, sink.input("values").connectionCount());
    }

    @Test
    public void testRemoveNodeRemovesItsConnections() {
        graph.addConnection(n1.output("c"), n2.input("a"));

        assertTrue(graph.removeNode(n1.id()));

        assertTrue(graph.connections().isEmpty());
        assertEquals(0, n2.input("a").connectionCount());
        assertNull(graph.findNodeById(n1.id()));
        assertFalse(graph.removeNode(n1.id()));
        assertEquals(2, structureChanges);
    }

    @Test
    public void testRemoveConnection() {
        Connection c = graph.addConnection(n1.output("c"), n2.input("a"));

        assertTrue(graph.removeConnection(c));
        assertFalse(graph.removeConnection(c));
        assertEquals(0, n2.input("a").connectionCount());
    }

    @Test
    public void testInputValueChangesNotify() {
        n1.input("a").setValue(5);
        n1.input("a").setValue(5);
        n1.output("c").setValue(9);

        assertEquals(List.of(n1.id() + ".a"), valueChanges);
    }

    @Test
    public void testRemovedNodeStopsNotifying() {
        graph.removeNode(n1.id());

        n1.input("a").setValue(5);

        assertTrue(valueChanges.isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeId() {
        graph.addNode(n1);
    }

    @Test(expected = IllegalStateException.class)
    public void testOutputCannotAcceptMultipleConnections() {
        n1.output("c").allowMultipleConnections();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownPort() {
        n1.input("missing");
    }

    @Test
    public void testFindPort() {
        assertSame(n1.input("a"), graph.findPort(n1.input("a").id()));
        assertNull(graph.findPort("missing"));
    }
}
