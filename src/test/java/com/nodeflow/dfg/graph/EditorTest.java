package com.nodeflow.dfg.graph;

import com.nodeflow.dfg.MathNode;
import com.nodeflow.dfg.api.GraphChangeListener;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.api.NodePort;
import com.nodeflow.dfg.node.SubgraphNode;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class EditorTest {

    private Editor editor;
    private final List<String> events = new ArrayList<>();
    private final GraphChangeListener listener = new GraphChangeListener() {
        @Override
        public void onStructureChanged(GraphView graph) {
            events.add("structure:" + graph.id());
        }

        @Override
        public void onInputValueChanged(Node node, NodePort port) {
            events.add("value:" + port.name());
        }
    };

    @Before
    public void setUp() {
        editor = new Editor(new Graph("root"));
        editor.addChangeListener(listener);
    }

    @Test
    public void testRelaysRootChanges() {
        MathNode n = editor.graph().addNode(new MathNode());
        n.input("b").setValue(2);

        assertEquals(List.of("structure:root", "value:b"), events);
    }

    @Test
    public void testRelaysNestedChangesAndFindsInnerNodes() {
        Graph inner = new Graph("inner");
        MathNode innerNode = inner.addNode(new MathNode());
        editor.graph().addNode(new SubgraphNode(inner));
        events.clear();

        innerNode.input("a").setValue(3);
        inner.addNode(new MathNode());

        assertEquals(List.of("value:a", "structure:inner"), events);
        assertSame(innerNode, editor.findNodeById(innerNode.id()));
        assertNull(editor.findNodeById("missing"));
    }

    @Test
    public void testStopsRelayingGraphOfRemovedSubgraphNode() {
        Graph inner = new Graph("inner");
        MathNode innerNode = inner.addNode(new MathNode());
        SubgraphNode holder = editor.graph().addNode(new SubgraphNode(inner));
        assertTrue(editor.graph().removeNode(holder.id()));
        events.clear();

        innerNode.input("a").setValue(3);
        inner.addNode(new MathNode());

        assertTrue(events.isEmpty());
        assertNull(editor.findNodeById(innerNode.id()));
    }

    @Test
    public void testListenerRegisteredOnce() {
        editor.addChangeListener(listener);
        editor.graph().addNode(new MathNode());

        assertEquals(1, events.size());

        editor.removeChangeListener(listener);
        editor.graph().addNode(new MathNode());
        assertEquals(1, events.size());
    }
}
