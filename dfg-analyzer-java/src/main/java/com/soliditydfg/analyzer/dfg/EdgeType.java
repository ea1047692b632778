package com.soliditydfg.analyzer.dfg;

import java.util.Optional;

/**
 * Closed set of DFG edge kinds.
 */
public enum EdgeType {
    DATA_DEPENDENCY("data_dependency"),
    CONTROL_DEPENDENCY("control_dependency"),
    FUNCTION_CALL("function_call"),
    DEFINITION("definition"),
    USAGE("usage"),
    MODIFIES("modifies");

    private final String value;

    EdgeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<EdgeType> fromValue(String value) {
        for (EdgeType t : values()) {
            if (t.value.equals(value)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
