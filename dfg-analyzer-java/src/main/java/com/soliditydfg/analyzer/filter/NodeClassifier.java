package com.soliditydfg.analyzer.filter;

import java.util.Locale;

/**
 * Stateless node classification. Both methods are pure functions of their arguments.
 */
public final class NodeClassifier {

    private static final String IDENTIFIER = "identifier";

    private NodeClassifier() {}

    /**
     * Priority tier of a node. Identifiers are judged by their text: a keyword, type name,
     * operator or punctuation token is {@link NodePriority#DISCARD}, any other non-blank
     * identifier is {@link NodePriority#IMPORTANT}. Unknown node types, null included, are
     * auxiliary.
     */
    public static NodePriority priorityOf(String nodeType, String nodeText) {
        if (nodeType == null) return NodePriority.AUXILIARY;
        if (NodeVocabulary.CRITICAL_NODE_TYPES.contains(nodeType)) return NodePriority.CRITICAL;
        if (NodeVocabulary.IMPORTANT_NODE_TYPES.contains(nodeType)) return NodePriority.IMPORTANT;
        if (NodeVocabulary.AUXILIARY_NODE_TYPES.contains(nodeType)) return NodePriority.AUXILIARY;

        if (IDENTIFIER.equals(nodeType)) {
            String word = normalize(nodeText);
            if (!word.isEmpty()) {
                return NodeVocabulary.isVocabularyWord(word) ? NodePriority.DISCARD : NodePriority.IMPORTANT;
            }
        }
        return NodePriority.AUXILIARY;
    }

    /** A null type never matches the include or skip sets and is judged as an unknown type. */
    public static boolean shouldKeep(String nodeType, String nodeName, String nodeText, DfgConfig config) {
        if (nodeType == null) {
            return config.getIncludeNodeTypes().isEmpty()
                && priorityOf(null, nodeText).atLeast(config.getMinNodePriority());
        }
        if (!config.getIncludeNodeTypes().isEmpty() && !config.getIncludeNodeTypes().contains(nodeType)) {
            return false;
        }
        if (config.getSkipNodeTypes().contains(nodeType)) {
            return false;
        }
        if (!priorityOf(nodeType, nodeText).atLeast(config.getMinNodePriority())) {
            return false;
        }

        if (IDENTIFIER.equals(nodeType)) {
            String word = normalize(nodeText);
            if (config.isSkipKeywords() && NodeVocabulary.KEYWORDS.contains(word)) return false;
            if (config.isSkipTypeNames() && NodeVocabulary.TYPE_NAMES.contains(word)) return false;
            if (config.isSkipOperators() && NodeVocabulary.OPERATORS.contains(word)) return false;
            if (config.isSkipPunctuation() && NodeVocabulary.PUNCTUATION.contains(word)) return false;
        }

        return !(config.isSkipLiteralNodes() && nodeType.endsWith("literal"));
    }

    private static String normalize(String text) {
        return text == null ? "" : text.strip().toLowerCase(Locale.ROOT);
    }
}
