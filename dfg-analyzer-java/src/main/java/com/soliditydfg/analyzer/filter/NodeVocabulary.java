package com.soliditydfg.analyzer.filter;

import java.util.Set;

/**
 * Closed vocabularies used to classify nodes. Node-type sets match DFG tags; the word
 * sets match trimmed, lower-cased identifier text.
 */
public final class NodeVocabulary {

    private NodeVocabulary() {}

    public static final Set<String> CRITICAL_NODE_TYPES = Set.of(
        "contract", "interface", "library", "function",
        "constructor_function", "modifier", "state_variable");

    public static final Set<String> IMPORTANT_NODE_TYPES = Set.of(
        "local_variable", "parameter", "expression",
        "if_statement", "for_statement", "while_statement", "return_statement",
        "struct_declaration", "enum_declaration", "event_definition");

    public static final Set<String> AUXILIARY_NODE_TYPES = Set.of(
        "number_literal", "string_literal", "boolean_literal",
        "expression_statement", "block");

    public static final Set<String> KEYWORDS = Set.of(
        "pragma", "solidity", "contract", "function", "public", "private",
        "internal", "external", "pure", "view", "payable", "constant",
        "memory", "storage", "calldata", "returns", "return", "if", "else",
        "for", "while", "do", "break", "continue", "throw", "require",
        "assert", "revert", "emit", "new", "delete", "struct", "enum",
        "mapping", "address", "uint", "int", "bool", "string", "bytes",
        "uint8", "uint16", "uint32", "uint64", "uint128", "uint256",
        "int8", "int16", "int32", "int64", "int128", "int256",
        "bytes1", "bytes2", "bytes4", "bytes8", "bytes16", "bytes32");

    public static final Set<String> TYPE_NAMES = Set.of(
        "uint", "int", "address", "bool", "string", "bytes",
        "uint8", "uint16", "uint32", "uint64", "uint128", "uint256",
        "int8", "int16", "int32", "int64", "int128", "int256",
        "bytes1", "bytes2", "bytes4", "bytes8", "bytes16", "bytes32",
        "mapping", "struct", "enum");

    public static final Set<String> OPERATORS = Set.of(
        "+", "-", "*", "/", "%", "**",
        "==", "!=", "<", ">", "<=", ">=",
        "&&", "||", "!",
        "&", "|", "^", "~", "<<", ">>",
        "=", "+=", "-=", "*=", "/=", "%=",
        "++", "--",
        "?", ":");

    public static final Set<String> PUNCTUATION = Set.of(
        "(", ")", "{", "}", "[", "]",
        ";", ",", ".", "=>");

    public static boolean isVocabularyWord(String normalized) {
        return KEYWORDS.contains(normalized)
            || TYPE_NAMES.contains(normalized)
            || OPERATORS.contains(normalized)
            || PUNCTUATION.contains(normalized);
    }
}
