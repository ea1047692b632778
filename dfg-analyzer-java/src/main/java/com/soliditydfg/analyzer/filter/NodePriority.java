package com.soliditydfg.analyzer.filter;

import java.util.Optional;

/**
 * Retention tier of a DFG node, ordered from most to least important.
 */
public enum NodePriority {
    CRITICAL("critical", 4),
    IMPORTANT("important", 3),
    AUXILIARY("auxiliary", 2),
    DISCARD("discard", 1);

    private final String value;
    private final int rank;

    NodePriority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public boolean atLeast(NodePriority threshold) {
        return rank >= threshold.rank;
    }

    public static Optional<NodePriority> fromValue(String value) {
        for (NodePriority p : values()) {
            if (p.value.equalsIgnoreCase(value)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
