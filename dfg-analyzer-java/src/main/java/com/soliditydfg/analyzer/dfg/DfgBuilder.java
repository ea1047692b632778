package com.soliditydfg.analyzer.dfg;

import com.soliditydfg.analyzer.ast.AstNode;
import com.soliditydfg.analyzer.ast.AstNodeType;
import com.soliditydfg.analyzer.ast.AstVisitor;
import com.soliditydfg.analyzer.ast.ContractNode;
import com.soliditydfg.analyzer.ast.ExpressionNode;
import com.soliditydfg.analyzer.ast.FunctionNode;
import com.soliditydfg.analyzer.ast.GenericNode;
import com.soliditydfg.analyzer.ast.Parameter;
import com.soliditydfg.analyzer.ast.SolidityVersion;
import com.soliditydfg.analyzer.ast.SourceLocation;
import com.soliditydfg.analyzer.ast.VariableNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a scope-aware data-flow graph from a typed AST in one pre-order walk.
 *
 * <p>Scopes are dotted by definition key: a variable {@code x} declared while
 * {@code transfer_function} is on top of the stack is recorded as
 * {@code transfer_function.x}. State variables are also recorded as {@code global.x} so
 * reads inside any function resolve to them.
 *
 * <p>Node and edge counters are instance state and are never reset, so ids stay unique
 * across every graph built by the same instance. One instance per thread.
 */
public class DfgBuilder implements AstVisitor<DfgNode> {

    public static final String GLOBAL_SCOPE = "global";

    static final String RELATION_DEF_USE = "def-use";
    static final String RELATION_STATE_VAR_USE = "state-var-use";

    private static final NodeTagger TAGGER = new NodeTagger();

    private final String solidityVersion;
    private int nodeCounter;
    private int edgeCounter;

    // Per-build state, reset by build()
    private Map<String, DfgNode> nodes;
    private Map<String, DfgEdge> edges;
    private Deque<String> scopeStack;
    private Map<String, DfgNode> variableDefinitions;
    private Map<String, DfgNode> functionDefinitions;
    private List<String> unresolvedReferences;

    public DfgBuilder(String solidityVersion) {
        this.solidityVersion = solidityVersion;
    }

    public DfgBuilder() {
        this(SolidityVersion.oldest().label());
    }

    /**
     * Builds the graph rooted at {@code root}. Empty when there is no root.
     *
     * @throws IllegalStateException if the scope stack is unbalanced after the walk
     */
    public Optional<Dfg> build(AstNode root, String contractName) {
        if (root == null) {
            return Optional.empty();
        }
        nodes = new LinkedHashMap<>();
        edges = new LinkedHashMap<>();
        scopeStack = new ArrayDeque<>();
        scopeStack.push(GLOBAL_SCOPE);
        variableDefinitions = new LinkedHashMap<>();
        functionDefinitions = new LinkedHashMap<>();
        unresolvedReferences = new ArrayList<>();

        DfgNode entry = root.accept(this);
        addFunctionCallEdges();

        if (scopeStack.size() != 1 || !GLOBAL_SCOPE.equals(scopeStack.peek())) {
            throw new IllegalStateException("Scope stack not balanced after build: " + scopeStack);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scope_root", GLOBAL_SCOPE);
        metadata.put("function_count", functionDefinitions.size());
        metadata.put(Dfg.UNRESOLVED_REFERENCES, List.copyOf(unresolvedReferences));

        return Optional.of(new Dfg(contractName, solidityVersion, nodes, edges, entry.getId(), metadata));
    }

    // -------------------------------------------------------------------------
    // Visitor
    // -------------------------------------------------------------------------

    @Override
    public DfgNode visitContract(ContractNode contract) {
        DfgNode node = createNode(contract, Map.of());
        enterScope(contract.getName().orElse("contract"));
        for (AstNode child : contract.getChildren()) {
            DfgNode childNode = child.accept(this);
            addEdge(node.getId(), childNode.getId(), EdgeType.DEFINITION, Map.of());
        }
        for (String base : contract.getBaseContracts()) {
            addEdge(node.getId(), SyntheticIds.forBaseContract(base), EdgeType.DEFINITION,
                Map.of("inheritance_type", "base_contract"));
        }
        exitScope();
        return node;
    }

    @Override
    public DfgNode visitFunction(FunctionNode function) {
        Map<String, Object> props = new LinkedHashMap<>();
        function.getVisibility().ifPresent(v -> props.put("visibility", v.keyword()));
        function.getStateMutability().ifPresent(m -> props.put("state_mutability", m.keyword()));
        if (!function.getModifiers().isEmpty()) props.put("modifiers", function.getModifiers());
        if (function.isConstructor()) props.put("is_constructor", true);
        if (function.isFallback()) props.put("is_fallback", true);
        if (function.isReceive()) props.put("is_receive", true);

        DfgNode node = createNode(function, props);
        function.getName().ifPresent(name -> functionDefinitions.put(name, node));

        enterScope(function.getName().map(n -> n + "_function").orElse("anonymous_function"));
        for (Parameter p : function.getParameters()) {
            addParameter(function, node, p, false);
        }
        for (Parameter p : function.getReturnParameters()) {
            addParameter(function, node, p, true);
        }
        for (AstNode child : function.getChildren()) {
            DfgNode childNode = child.accept(this);
            addEdge(node.getId(), childNode.getId(), EdgeType.CONTROL_DEPENDENCY, Map.of());
        }
        exitScope();
        return node;
    }

    @Override
    public DfgNode visitVariable(VariableNode variable) {
        Map<String, Object> props = new LinkedHashMap<>();
        if (variable.isConstant()) props.put("is_constant", true);
        if (variable.isImmutable()) props.put("is_immutable", true);
        variable.getVisibility().ifPresent(v -> props.put("visibility", v.keyword()));
        variable.getInitialValue().ifPresent(v -> props.put("initial_value", v));

        DfgNode node = createNode(variable, props);
        variable.getName().ifPresent(name -> {
            variableDefinitions.put(currentScope() + "." + name, node);
            if (variable.isStateVariable()) {
                variableDefinitions.put(GLOBAL_SCOPE + "." + name, node);
            }
        });
        if (variable.getInitialValue().isPresent()) {
            addEdge(node.getId(), SyntheticIds.forInitializer(node.getId()), EdgeType.DATA_DEPENDENCY,
                Map.of("initialization", true));
        }
        return node;
    }

    @Override
    public DfgNode visitExpression(ExpressionNode expression) {
        Map<String, Object> props = new LinkedHashMap<>();
        expression.getOperator().ifPresent(op -> props.put("operator", op));
        props.put("expression_type", expression.getType().value());
        DfgNode node = createNode(expression, props);

        List<AstNode> operands = new ArrayList<>();
        expression.getLeftOperand().ifPresent(operands::add);
        expression.getRightOperand().ifPresent(operands::add);
        operands.addAll(expression.getArguments());
        for (AstNode operand : operands) {
            DfgNode operandNode = operand.accept(this);
            addEdge(operandNode.getId(), node.getId(), EdgeType.DATA_DEPENDENCY, Map.of());
        }

        if (expression.isBareIdentifier()) {
            String name = expression.getName().orElseThrow();
            Optional<Resolution> resolved = resolve(name);
            if (resolved.isPresent()) {
                addEdge(resolved.get().definition().getId(), node.getId(), EdgeType.DATA_DEPENDENCY,
                    Map.of("relation", resolved.get().relation()));
            } else {
                unresolvedReferences.add(currentScope() + "." + name);
            }
        }

        if (expression.getType().isAssignment()) {
            expression.getLeftOperand()
                .flatMap(DfgBuilder::targetName)
                .flatMap(this::resolve)
                .ifPresent(r -> addEdge(node.getId(), r.definition().getId(), EdgeType.MODIFIES,
                    Map.of("operator", expression.getOperator().orElse(""))));
        }
        return node;
    }

    @Override
    public DfgNode visitGeneric(GenericNode generic) {
        DfgNode node = createNode(generic, Map.of());
        for (AstNode child : generic.getChildren()) {
            DfgNode childNode = child.accept(this);
            addEdge(node.getId(), childNode.getId(), EdgeType.CONTROL_DEPENDENCY, Map.of());
        }
        return node;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void addParameter(FunctionNode function, DfgNode functionNode, Parameter parameter, boolean isReturn) {
        String id = nextNodeId();
        String name = parameter.isNamed() ? parameter.name() : "param_" + nodeCounter;
        String type = parameter.type().isEmpty() ? "unknown" : parameter.type();

        GenericNode virtual = new GenericNode("param_" + id, AstNodeType.PARAMETER, name,
            function.getLocation(), function.getId(), (type + " " + parameter.name()).trim());
        virtual.getMetadata().put("parameter_type", type);
        virtual.getMetadata().put("is_return", isReturn);

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("is_return", isReturn);
        props.put("function", function.getName().orElse(""));
        DfgNode node = new DfgNode(id, virtual, "parameter", name, type, currentScope(), props);
        nodes.put(id, node);
        addEdge(functionNode.getId(), id, EdgeType.DEFINITION, Map.of());

        if (parameter.isNamed()) {
            variableDefinitions.put(currentScope() + "." + name, node);
        }
    }

    private DfgNode createNode(AstNode ast, Map<String, Object> extra) {
        String id = nextNodeId();
        Map<String, Object> props = new LinkedHashMap<>();
        SourceLocation loc = ast.getLocation();
        props.put("source_location", Map.of("line", loc.line(), "column", loc.column()));
        props.putAll(extra);
        String dataType = ast instanceof VariableNode v ? v.getDataType() : null;
        DfgNode node = new DfgNode(id, ast, ast.accept(TAGGER), ast.getName().orElse(null),
            dataType, currentScope(), props);
        nodes.put(id, node);
        return node;
    }

    private void addEdge(String sourceId, String targetId, EdgeType type, Map<String, Object> props) {
        String id = "dfg_edge_" + (++edgeCounter);
        edges.put(id, new DfgEdge(id, sourceId, targetId, type, props));
    }

    private String nextNodeId() {
        return "dfg_node_" + (++nodeCounter);
    }

    private Optional<Resolution> resolve(String name) {
        DfgNode local = variableDefinitions.get(currentScope() + "." + name);
        if (local != null) {
            return Optional.of(new Resolution(local, RELATION_DEF_USE));
        }
        DfgNode state = variableDefinitions.get(GLOBAL_SCOPE + "." + name);
        if (state != null) {
            return Optional.of(new Resolution(state, RELATION_STATE_VAR_USE));
        }
        return Optional.empty();
    }

    /** Name written by an assignment target: a bare identifier wrapper or an identifier. */
    private static Optional<String> targetName(AstNode target) {
        if (target instanceof ExpressionNode e && e.isBareIdentifier()) {
            return e.getName();
        }
        if (target.getType() == AstNodeType.IDENTIFIER) {
            return target.getName();
        }
        return Optional.empty();
    }

    /**
     * Textual heuristic: an expression whose source text contains {@code name(} calls the
     * function of that name. Over-approximates on shadowed names and string contents.
     */
    private void addFunctionCallEdges() {
        List<DfgNode> expressions = new ArrayList<>();
        for (DfgNode n : nodes.values()) {
            if ("expression".equals(n.getType())) expressions.add(n);
        }
        for (Map.Entry<String, DfgNode> fn : functionDefinitions.entrySet()) {
            String needle = fn.getKey() + "(";
            for (DfgNode expr : expressions) {
                if (expr.getAstNode().getText().contains(needle)) {
                    addEdge(fn.getValue().getId(), expr.getId(), EdgeType.FUNCTION_CALL, Map.of());
                }
            }
        }
    }

    private String currentScope() {
        return scopeStack.peek();
    }

    private void enterScope(String scope) {
        scopeStack.push(scope);
    }

    private void exitScope() {
        if (scopeStack.size() <= 1) {
            throw new IllegalStateException("Cannot exit the " + GLOBAL_SCOPE + " scope");
        }
        scopeStack.pop();
    }

    private record Resolution(DfgNode definition, String relation) {}

    /** Maps each AST variant to its DFG classification tag. */
    private static final class NodeTagger implements AstVisitor<String> {

        @Override
        public String visitContract(ContractNode node) {
            if (node.isInterface()) return "interface";
            if (node.isLibrary()) return "library";
            return "contract";
        }

        @Override
        public String visitFunction(FunctionNode node) {
            if (node.isModifier()) return "modifier";
            if (node.isConstructor()) return "constructor_function";
            return "function";
        }

        @Override
        public String visitVariable(VariableNode node) {
            return node.isStateVariable() ? "state_variable" : "local_variable";
        }

        @Override
        public String visitExpression(ExpressionNode node) {
            return "expression";
        }

        @Override
        public String visitGeneric(GenericNode node) {
            return node.getType().value();
        }
    }
}
