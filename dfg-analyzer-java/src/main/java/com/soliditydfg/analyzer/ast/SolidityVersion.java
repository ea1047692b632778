package com.soliditydfg.analyzer.ast;

import java.util.Optional;

/**
 * Supported language versions, oldest first. Detection is a best-effort substring match
 * over the pragma text.
 */
public enum SolidityVersion {
    V0_4("0.4"),
    V0_5("0.5"),
    V0_6("0.6"),
    V0_7("0.7"),
    V0_8("0.8");

    private final String prefix;

    SolidityVersion(String prefix) {
        this.prefix = prefix;
    }

    /** Label used in AST metadata and serialized output, e.g. {@code 0.4.x}. */
    public String label() {
        return prefix + ".x";
    }

    public boolean isLegacy() {
        return this == V0_4;
    }

    public static SolidityVersion oldest() {
        return V0_4;
    }

    /**
     * First version whose major.minor prefix occurs in the pragma text.
     */
    public static Optional<SolidityVersion> match(String pragmaText) {
        if (pragmaText == null) return Optional.empty();
        for (SolidityVersion v : values()) {
            if (pragmaText.contains(v.prefix)) return Optional.of(v);
        }
        return Optional.empty();
    }
}
