package com.soliditydfg.analyzer.ast;

/**
 * 1-based source span of a node.
 */
public record SourceLocation(int line, int column, int endLine, int endColumn) {

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, 0, 0);

    @Override
    public String toString() {
        return line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
