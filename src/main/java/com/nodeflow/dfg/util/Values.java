package com.nodeflow.dfg.util;

import java.util.Objects;

/**
 * Value comparison helpers used for input change detection.
 */
public final class Values {
    private Values() {
        // Utility class
    }

    /**
     * Structural equality: equal references, equal per {@link Object#equals},
     * or arrays with deeply equal contents. Never relies on identity alone.
     */
    public static boolean structurallyEqual(Object a, Object b) {
        return Objects.deepEquals(a, b);
    }
}
