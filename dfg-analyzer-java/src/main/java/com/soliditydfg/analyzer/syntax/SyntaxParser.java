package com.soliditydfg.analyzer.syntax;

import java.util.Optional;

/**
 * Seam to the external parser. Returns empty when the parser produced no root.
 */
@FunctionalInterface
public interface SyntaxParser {

    Optional<SyntaxNode> parse(String sourceText);
}
