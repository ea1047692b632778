package com.soliditydfg.analyzer.filter;

import java.util.Optional;

public enum OutputMode {
    COMPACT("compact"),
    STANDARD("standard"),
    VERBOSE("verbose"),
    CUSTOM("custom");

    private final String value;

    OutputMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<OutputMode> fromValue(String value) {
        for (OutputMode m : values()) {
            if (m.value.equalsIgnoreCase(value)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
