package com.soliditydfg.analyzer.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of AST type tags. Each tag carries the grammar category it was built from.
 */
public enum AstNodeType {
    SOURCE_FILE("source_file"),

    // declarations
    CONTRACT_DECLARATION("contract_declaration"),
    INTERFACE_DECLARATION("interface_declaration"),
    LIBRARY_DECLARATION("library_declaration"),
    FUNCTION_DEFINITION("function_definition"),
    CONSTRUCTOR_DEFINITION("constructor_definition"),
    FALLBACK_RECEIVE_DEFINITION("fallback_receive_definition"),
    MODIFIER_DEFINITION("modifier_definition"),
    EVENT_DEFINITION("event_definition"),
    STRUCT_DECLARATION("struct_declaration"),
    ENUM_DECLARATION("enum_declaration"),

    // variables
    STATE_VARIABLE_DECLARATION("state_variable_declaration"),
    VARIABLE_DECLARATION("variable_declaration"),
    VARIABLE_DECLARATION_STATEMENT("variable_declaration_statement"),
    PARAMETER("parameter"),

    // statements
    EXPRESSION_STATEMENT("expression_statement"),
    IF_STATEMENT("if_statement"),
    FOR_STATEMENT("for_statement"),
    WHILE_STATEMENT("while_statement"),
    RETURN_STATEMENT("return_statement"),
    EMIT_STATEMENT("emit_statement"),
    BLOCK("block"),

    // expressions
    EXPRESSION("expression"),
    BINARY_EXPRESSION("binary_expression"),
    UNARY_EXPRESSION("unary_expression"),
    UPDATE_EXPRESSION("update_expression"),
    ASSIGNMENT_EXPRESSION("assignment_expression"),
    AUGMENTED_ASSIGNMENT_EXPRESSION("augmented_assignment_expression"),
    CALL_EXPRESSION("call_expression"),
    MEMBER_EXPRESSION("member_expression"),
    IDENTIFIER("identifier"),
    NUMBER_LITERAL("number_literal"),
    STRING_LITERAL("string_literal"),
    BOOLEAN_LITERAL("boolean_literal"),

    // types
    TYPE_NAME("type_name"),
    PRIMITIVE_TYPE("primitive_type"),
    USER_DEFINED_TYPE("user_defined_type"),
    MAPPING_TYPE("mapping_type"),
    ARRAY_TYPE("array_type"),

    // other
    PRAGMA_DIRECTIVE("pragma_directive"),
    IMPORT_DIRECTIVE("import_directive");

    private static final Map<String, AstNodeType> BY_CATEGORY = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(AstNodeType::value, Function.identity()));

    private final String value;

    AstNodeType(String value) {
        this.value = value;
    }

    /** The grammar category string, also used as the tag in serialized output. */
    public String value() {
        return value;
    }

    public static Optional<AstNodeType> fromCategory(String category) {
        return Optional.ofNullable(BY_CATEGORY.get(category));
    }

    public boolean isAssignment() {
        return this == ASSIGNMENT_EXPRESSION || this == AUGMENTED_ASSIGNMENT_EXPRESSION || this == UPDATE_EXPRESSION;
    }
}
