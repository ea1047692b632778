package com.soliditydfg.analyzer.ast;

/**
 * Declared parameter or return parameter. Either part is empty when the declaration omits it.
 */
public record Parameter(String name, String type) {

    public Parameter {
        name = name != null ? name : "";
        type = type != null ? type : "";
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }
}
