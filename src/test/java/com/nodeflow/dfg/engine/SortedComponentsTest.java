package com.nodeflow.dfg.engine;

import com.nodeflow.dfg.MathNode;
import com.nodeflow.dfg.api.Connection;
import com.nodeflow.dfg.api.GraphView;
import com.nodeflow.dfg.api.Node;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class SortedComponentsTest {

    /**
     * node1 -> node2
     * node3
     * node4 -> node5
     *       -> node6
     */
    @Test
    public void testSortedConnectedComponents() {
        MathNode node1 = new MathNode();
        MathNode node2 = new MathNode();
        MathNode node3 = new MathNode();
        Connection conn1 = new Connection("a", node1.output("c"), node2.input("a"));

        MathNode node4 = new MathNode();
        MathNode node5 = new MathNode();
        MathNode node6 = new MathNode();
        Connection conn2 = new Connection("b", node4.output("c"), node5.input("a"));
        Connection conn3 = new Connection("c", node4.output("c"), node6.input("a"));

        List<SortedComponent> components = new ArrayList<>(SortedComponents.getSortedComponents(
                List.of(node1, node2, node3, node4, node5, node6),
                List.of(conn1, conn2, conn3)));
        assertEquals(3, components.size());
        components.sort(Comparator.comparingInt(SortedComponent::size).reversed());

        assertEquals(3, components.get(0).size());
        assertEquals(node4, components.get(0).node(0));
        assertTrue(components.get(0).contains(node5.id()));
        assertTrue(components.get(0).contains(node6.id()));
        assertEquals(List.of(conn2, conn3), components.get(0).connectionsFrom(node4.id()));
        assertEquals(List.of(node1, node2), components.get(1).calculationOrder());
        assertEquals(List.<Node>of(node3), components.get(2).calculationOrder());
    }

    @Test
    public void testUnionIsPermutationOfNodes() {
        MathNode a = new MathNode();
        MathNode b = new MathNode();
        MathNode c = new MathNode();
        GraphView view = GraphView.of(List.of(a, b, c), List.of(new Connection("x", b.output("c"), a.input("a"))));

        Set<Node> all = new HashSet<>();
        int count = 0;
        for (SortedComponent component : SortedComponents.getSortedComponents(view)) {
            all.addAll(component.calculationOrder());
            count += component.size();
        }
        assertEquals(3, count);
        assertEquals(Set.of(a, b, c), all);
    }

    @Test(expected = CycleException.class)
    public void testCycleInOneRegion() {
        MathNode a = new MathNode();
        MathNode b = new MathNode();
        MathNode lone = new MathNode();
        SortedComponents.getSortedComponents(List.of(a, b, lone), List.of(
                new Connection("1", a.output("c"), b.input("a")),
                new Connection("2", b.output("c"), a.input("a"))));
    }

    @Test
    public void testCacheKeepsOrderUntilInvalidated() {
        MathNode a = new MathNode();
        MathNode b = new MathNode();
        GraphView view = GraphView.of("g1", List.of(a, b), List.of());
        SortedComponentCache cache = new SortedComponentCache();

        List<SortedComponent> first = cache.get(view);
        assertEquals(2, first.size());
        assertSame(first, cache.get(view));
        assertTrue(cache.contains("g1"));
        assertEquals(1, cache.size());

        cache.invalidate();
        assertFalse(cache.contains("g1"));
        assertNotSame(first, cache.get(view));
    }

    @Test
    public void testCacheDoesNotKeepCyclicGraph() {
        MathNode a = new MathNode();
        MathNode b = new MathNode();
        GraphView view = GraphView.of("cyclic", List.of(a, b), List.of(
                new Connection("1", a.output("c"), b.input("a")),
                new Connection("2", b.output("c"), a.input("a"))));
        SortedComponentCache cache = new SortedComponentCache();

        try {
            cache.get(view);
            fail("Expected CycleException");
        } catch (CycleException expected) {
            // expected
        }
        assertFalse(cache.contains("cyclic"));
    }
}
