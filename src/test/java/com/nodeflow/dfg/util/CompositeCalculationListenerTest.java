package com.nodeflow.dfg.util;

import com.nodeflow.dfg.api.CalculationListener;
import com.nodeflow.dfg.api.Node;
import com.nodeflow.dfg.node.PassiveNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CompositeCalculationListenerTest {

    private static CalculationListener recording(List<String> log, String name) {
        return new CalculationListener() {
            @Override
            public void beforeNodeCalculation(Node node, Map<String, Object> inputValues) {
                log.add(name + ":before");
            }

            @Override
            public void afterNodeCalculation(Node node, Map<String, Object> outputValues) {
                log.add(name + ":after");
            }

            @Override
            public void onNodeError(Node node, Throwable error) {
                log.add(name + ":error");
            }
        };
    }

    @Test
    public void testDispatchesInSubscriptionOrder() {
        List<String> log = new ArrayList<>();
        CompositeCalculationListener composite = new CompositeCalculationListener();
        composite.subscribe("first", recording(log, "1"));
        composite.subscribe("second", recording(log, "2"));
        Node node = new PassiveNode("n");

        composite.beforeNodeCalculation(node, Map.of());
        composite.afterNodeCalculation(node, Map.of());
        composite.onNodeError(node, new RuntimeException());

        assertEquals(List.of("1:before", "2:before", "1:after", "2:after", "1:error", "2:error"), log);
    }

    @Test
    public void testReplaceKeepsPosition() {
        List<String> log = new ArrayList<>();
        CompositeCalculationListener composite = new CompositeCalculationListener();
        composite.subscribe("first", recording(log, "1"));
        composite.subscribe("second", recording(log, "2"));
        composite.subscribe("first", recording(log, "3"));

        composite.beforeNodeCalculation(new PassiveNode("n"), Map.of());

        assertEquals(2, composite.size());
        assertEquals(List.of("3:before", "2:before"), log);
    }

    @Test
    public void testUnsubscribeIsIdempotent() {
        CompositeCalculationListener composite = new CompositeCalculationListener();
        composite.subscribe("k", new CalculationListener() {
        });

        composite.unsubscribe("k");
        composite.unsubscribe("k");
        composite.unsubscribe("never");

        assertEquals(0, composite.size());
    }
}
