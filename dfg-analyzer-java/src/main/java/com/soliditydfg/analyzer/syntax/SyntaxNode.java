package com.soliditydfg.analyzer.syntax;

import java.util.List;

/**
 * One node of the concrete syntax tree handed over by the external parsing front end.
 * Points are 0-based, as the front end reports them.
 */
public interface SyntaxNode {

    /** Grammar category, e.g. {@code contract_declaration} or {@code ;}. */
    String type();

    List<? extends SyntaxNode> children();

    /** Raw matched source text; never null. */
    String text();

    SyntaxPoint startPoint();

    SyntaxPoint endPoint();
}
