package com.soliditydfg.analyzer.ast;

import java.util.Optional;

public enum StateMutability {
    PURE("pure"),
    VIEW("view"),
    PAYABLE("payable"),
    /** 0.4.x only; equivalent to {@link #VIEW}. */
    CONSTANT("constant"),
    NONPAYABLE("nonpayable");

    private final String keyword;

    StateMutability(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<StateMutability> fromKeyword(String text) {
        for (StateMutability m : values()) {
            if (m.keyword.equals(text)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
