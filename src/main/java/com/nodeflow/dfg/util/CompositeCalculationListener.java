package com.nodeflow.dfg.util;

import com.nodeflow.dfg.api.CalculationListener;
import com.nodeflow.dfg.api.Node;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fans node calculation callbacks out to keyed subscribers, in subscription
 * order.
 *
 * Subscribing again under an existing key replaces that subscriber in place;
 * unsubscribing an unknown key is a no-op. The subscriber array is
 * copy-on-write, so dispatch never allocates and never sees a half-updated
 * set.
 */
public class CompositeCalculationListener implements CalculationListener {
    private final Map<Object, CalculationListener> byKey = new LinkedHashMap<>();
    private volatile CalculationListener[] listeners = new CalculationListener[0];

    public synchronized void subscribe(Object key, CalculationListener listener) {
        byKey.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(listener, "listener"));
        listeners = byKey.values().toArray(new CalculationListener[0]);
    }

    public synchronized void unsubscribe(Object key) {
        if (byKey.remove(key) != null)
            listeners = byKey.values().toArray(new CalculationListener[0]);
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void beforeNodeCalculation(Node node, Map<String, Object> inputValues) {
        for (CalculationListener l : listeners)
            l.beforeNodeCalculation(node, inputValues);
    }

    @Override
    public void afterNodeCalculation(Node node, Map<String, Object> outputValues) {
        for (CalculationListener l : listeners)
            l.afterNodeCalculation(node, outputValues);
    }

    @Override
    public void onNodeError(Node node, Throwable error) {
        for (CalculationListener l : listeners)
            l.onNodeError(node, error);
    }
}
