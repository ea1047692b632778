package com.soliditydfg.analyzer.syntax;

/**
 * 0-based (row, column) coordinate inside the parsed source.
 */
public record SyntaxPoint(int row, int column) {

    public static final SyntaxPoint ORIGIN = new SyntaxPoint(0, 0);
}
