package com.soliditydfg.analyzer.ast;

import com.soliditydfg.analyzer.syntax.SyntaxNode;
import com.soliditydfg.analyzer.syntax.SyntaxParser;
import com.soliditydfg.analyzer.syntax.SyntaxPoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts the front end's concrete syntax tree into the typed AST.
 *
 * <p>Ids are {@code node_<n>}, assigned in pre-order from a counter owned by this
 * instance. Grammar productions that are absent resolve to empty values; nothing here
 * throws on an incomplete tree.
 */
public class AstBuilder {

    static final Set<String> PUNCTUATION = Set.of(";", ",", "(", ")", "{", "}", "[", "]", ".");

    static final Set<String> OPERATORS = Set.of(
        "+", "-", "*", "/", "%", "**",
        "==", "!=", "<", "<=", ">", ">=",
        "&&", "||", "!", "~", "&", "|", "^", "<<", ">>",
        "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=",
        "++", "--"
    );

    private final SyntaxParser parser;
    private int nodeCounter = 0;

    // per-build state
    private SolidityVersion version = SolidityVersion.oldest();
    private Map<String, AstNode> index = new LinkedHashMap<>();

    public AstBuilder(SyntaxParser parser) {
        this.parser = parser;
    }

    /** Builder for callers that already hold a syntax tree; {@link #build(String)} is unavailable. */
    public AstBuilder() {
        this(null);
    }

    public Optional<AstTree> build(String sourceText) {
        if (parser == null) {
            throw new IllegalStateException("No syntax parser configured");
        }
        return parser.parse(sourceText).flatMap(this::build);
    }

    /**
     * Builds the AST for an already parsed tree. Empty when there is no root.
     */
    public Optional<AstTree> build(SyntaxNode syntaxRoot) {
        if (syntaxRoot == null) {
            return Optional.empty();
        }
        version = detectVersion(syntaxRoot);
        index = new LinkedHashMap<>();
        AstNode root = buildNode(syntaxRoot, null, null);
        return Optional.of(new AstTree(root, version, index));
    }

    private String nextId() {
        nodeCounter++;
        return "node_" + nodeCounter;
    }

    // --- Version detection ---

    private SolidityVersion detectVersion(SyntaxNode root) {
        List<SyntaxNode> candidates = new ArrayList<>();
        candidates.add(root);
        candidates.addAll(root.children());
        for (SyntaxNode node : candidates) {
            if (!"pragma_directive".equals(node.type())) continue;
            Optional<SolidityVersion> found = SolidityVersion.match(node.text());
            if (found.isPresent()) return found.get();
        }
        return SolidityVersion.oldest();
    }

    // --- Dispatch ---

    private AstNode buildNode(SyntaxNode node, AstNode parent, SyntaxNode syntaxParent) {
        String id = nextId();
        String parentId = parent != null ? parent.getId() : null;
        AstNode result = switch (node.type()) {
            case "contract_declaration", "interface_declaration", "library_declaration" ->
                buildContract(node, id, parentId);
            case "function_definition", "constructor_definition",
                 "modifier_definition", "fallback_receive_definition" ->
                buildFunction(node, id, parentId);
            case "state_variable_declaration" -> buildVariable(node, id, parentId, null, true);
            case "variable_declaration" -> buildVariable(node, id, parentId, syntaxParent, false);
            case "expression", "binary_expression", "unary_expression", "update_expression",
                 "assignment_expression", "augmented_assignment_expression",
                 "call_expression", "member_expression" ->
                buildExpression(node, id, parentId);
            default -> buildGeneric(node, id, parentId);
        };
        return result;
    }

    private ContractNode buildContract(SyntaxNode node, String id, String parentId) {
        ContractNode contract = new ContractNode(id, typeOf(node), identifierOf(node), locationOf(node),
            parentId, node.text(), baseContractsOf(node));
        register(contract);
        for (SyntaxNode bodyChild : bodyChildren(node, "contract_body")) {
            contract.addChild(buildNode(bodyChild, contract, node));
        }
        return contract;
    }

    private FunctionNode buildFunction(SyntaxNode node, String id, String parentId) {
        AstNodeType type = typeOf(node);
        String name;
        boolean fallback = false;
        boolean receive = false;
        switch (type) {
            case CONSTRUCTOR_DEFINITION -> name = "constructor";
            case FALLBACK_RECEIVE_DEFINITION -> {
                receive = node.text().stripLeading().startsWith("receive");
                fallback = !receive;
                name = receive ? "receive" : "fallback";
            }
            default -> {
                name = identifierOf(node);
                // 0.4.x fallback: "function() payable { ... }"
                fallback = type == AstNodeType.FUNCTION_DEFINITION && name.isEmpty();
            }
        }

        FunctionNode function = new FunctionNode(id, type, name, locationOf(node), parentId, node.text(),
            parametersOf(node, "parameter_list"),
            parametersOf(node, "return_type_definition"),
            keywordChild(node, "visibility").flatMap(Visibility::fromKeyword).orElse(null),
            keywordChild(node, "state_mutability").flatMap(StateMutability::fromKeyword).orElse(null),
            modifiersOf(node),
            type == AstNodeType.CONSTRUCTOR_DEFINITION, fallback, receive);
        register(function);
        for (SyntaxNode bodyChild : bodyChildren(node, "function_body")) {
            function.addChild(buildNode(bodyChild, function, node));
        }
        return function;
    }

    private VariableNode buildVariable(SyntaxNode node, String id, String parentId,
                                       SyntaxNode syntaxParent, boolean stateVariable) {
        String initializer = initializerOf(node);
        if (initializer == null && syntaxParent != null
                && "variable_declaration_statement".equals(syntaxParent.type())) {
            initializer = initializerOf(syntaxParent);
        }
        VariableNode variable = new VariableNode(id, typeOf(node), identifierOf(node), locationOf(node),
            parentId, node.text(),
            childText(node, "type_name"),
            hasKeyword(node, "constant"),
            hasKeyword(node, "immutable"),
            stateVariable,
            keywordChild(node, "visibility").flatMap(Visibility::fromKeyword).orElse(null),
            initializer);
        register(variable);
        return variable;
    }

    private ExpressionNode buildExpression(SyntaxNode node, String id, String parentId) {
        List<SyntaxNode> operands = new ArrayList<>();
        String operator = null;
        for (SyntaxNode child : node.children()) {
            if (PUNCTUATION.contains(child.type())) continue;
            if (OPERATORS.contains(child.type())) {
                if (operator == null) operator = child.text();
                continue;
            }
            operands.add(child);
        }

        String name = null;
        if ("expression".equals(node.type()) && operands.size() == 1
                && "identifier".equals(operands.get(0).type())) {
            name = operands.get(0).text().strip();
        }

        ExpressionNode expression = new ExpressionNode(id, typeOf(node), name, locationOf(node),
            parentId, node.text(), operator);
        register(expression);
        for (SyntaxNode operand : operands) {
            expression.addOperand(buildNode(operand, expression, node));
        }
        return expression;
    }

    private GenericNode buildGeneric(SyntaxNode node, String id, String parentId) {
        AstNodeType type = typeOf(node);
        String name = "identifier".equals(node.type()) ? node.text().strip() : null;
        GenericNode generic = new GenericNode(id, type, name, locationOf(node), parentId, node.text());
        register(generic);
        for (SyntaxNode child : node.children()) {
            generic.addChild(buildNode(child, generic, node));
        }
        return generic;
    }

    private void register(AstNode node) {
        node.getMetadata().put("solidity_version", version.label());
        index.put(node.getId(), node);
    }

    // --- Attribute extraction ---

    private static AstNodeType typeOf(SyntaxNode node) {
        return AstNodeType.fromCategory(node.type()).orElse(AstNodeType.IDENTIFIER);
    }

    private static SourceLocation locationOf(SyntaxNode node) {
        SyntaxPoint start = node.startPoint();
        SyntaxPoint end = node.endPoint();
        return new SourceLocation(start.row() + 1, start.column() + 1, end.row() + 1, end.column() + 1);
    }

    private static List<SyntaxNode> bodyChildren(SyntaxNode node, String bodyType) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!bodyType.equals(child.type())) continue;
            for (SyntaxNode bodyChild : child.children()) {
                if (!PUNCTUATION.contains(bodyChild.type())) {
                    result.add(bodyChild);
                }
            }
        }
        return result;
    }

    private static String identifierOf(SyntaxNode node) {
        return childText(node, "identifier");
    }

    private static String childText(SyntaxNode node, String type) {
        for (SyntaxNode child : node.children()) {
            if (type.equals(child.type())) return child.text().strip();
        }
        return "";
    }

    private static Optional<String> keywordChild(SyntaxNode node, String type) {
        String text = childText(node, type);
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /** True when a direct child is the keyword itself or a modifier node spelling it. */
    private static boolean hasKeyword(SyntaxNode node, String keyword) {
        for (SyntaxNode child : node.children()) {
            if (keyword.equals(child.type()) || keyword.equals(child.text().strip())) return true;
        }
        return false;
    }

    private static List<String> baseContractsOf(SyntaxNode node) {
        List<String> bases = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!"inheritance_specifier".equals(child.type())) continue;
            for (SyntaxNode ancestor : child.children()) {
                if ("identifier".equals(ancestor.type()) || "user_defined_type".equals(ancestor.type())) {
                    bases.add(ancestor.text().strip());
                }
            }
        }
        return bases;
    }

    private static List<Parameter> parametersOf(SyntaxNode node, String listType) {
        List<Parameter> parameters = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!listType.equals(child.type())) continue;
            collectParameters(child, parameters);
        }
        return parameters;
    }

    private static void collectParameters(SyntaxNode list, List<Parameter> out) {
        for (SyntaxNode param : list.children()) {
            if ("parameter".equals(param.type())) {
                String type = childText(param, "type_name");
                String name = childText(param, "identifier");
                if (!type.isEmpty() || !name.isEmpty()) {
                    out.add(new Parameter(name, type));
                }
            } else if ("parameter_list".equals(param.type())) {
                collectParameters(param, out);
            }
        }
    }

    private static List<String> modifiersOf(SyntaxNode node) {
        List<String> modifiers = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (!"modifier_invocation".equals(child.type())) continue;
            for (SyntaxNode part : child.children()) {
                if ("identifier".equals(part.type())) {
                    modifiers.add(part.text().strip());
                    break;
                }
            }
        }
        return modifiers;
    }

    private static String initializerOf(SyntaxNode node) {
        String text = childText(node, "expression");
        return text.isEmpty() ? null : text;
    }
}
