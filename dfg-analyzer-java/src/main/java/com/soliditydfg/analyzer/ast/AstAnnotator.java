package com.soliditydfg.analyzer.ast;

/**
 * A pass that stamps metadata onto an already built tree without changing its shape.
 */
@FunctionalInterface
public interface AstAnnotator {

    void annotate(AstTree tree);
}
