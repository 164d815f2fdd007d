package com.nodeflow.dfg.node;

import com.nodeflow.dfg.api.NodeOutputs;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class CalcNodeTest {

    @Test
    public void testDeclaresPortsAndDelegates() throws Exception {
        CalcNode node = new CalcNode("id-1", "Concat")
                .withInput("left", "a")
                .withInput("right", "b")
                .withOutput("joined", "")
                .calculation((inputs, ctx) -> NodeOutputs.builder()
                        .put("joined", "" + inputs.get("left") + inputs.get("right"))
                        .build());

        NodeOutputs outputs = node.calculate(Map.of("left", "x", "right", "y"), null);

        assertEquals("id-1", node.id());
        assertEquals("Concat", node.title());
        assertEquals(2, node.inputs().size());
        assertEquals("xy", outputs.get("joined"));
        assertFalse(node.alwaysRecalculate());
    }

    @Test
    public void testDefaultCalculationProducesNothing() throws Exception {
        assertTrue(new CalcNode("Empty").calculate(Map.of(), null).values().isEmpty());
    }

    @Test
    public void testMultiInput() {
        CalcNode node = new CalcNode("Sum").withMultiInput("values", null);

        assertTrue(node.input("values").allowsMultipleConnections());
    }

    @Test
    public void testStructuralInputEquality() {
        CalcNode node = new CalcNode("Arrays").withInput("v", new int[] { 1, 2 });

        assertTrue(node.isInputEqualTo(node.input("v"), new int[] { 1, 2 }));
        assertFalse(node.isInputEqualTo(node.input("v"), new int[] { 1, 3 }));
    }
}
