package com.soliditydfg.analyzer.ast;

import java.util.Optional;

public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private"),
    INTERNAL("internal"),
    EXTERNAL("external");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<Visibility> fromKeyword(String text) {
        for (Visibility v : values()) {
            if (v.keyword.equals(text)) return Optional.of(v);
        }
        return Optional.empty();
    }
}
