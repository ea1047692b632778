package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.ast.AstBuilder;
import com.soliditydfg.analyzer.ast.AstNode;
import com.soliditydfg.analyzer.ast.AstNodeType;
import com.soliditydfg.analyzer.ast.AstTree;
import com.soliditydfg.analyzer.ast.ContractNode;
import com.soliditydfg.analyzer.ast.ExpressionNode;
import com.soliditydfg.analyzer.ast.FunctionNode;
import com.soliditydfg.analyzer.ast.Parameter;
import com.soliditydfg.analyzer.ast.SolidityVersion;
import com.soliditydfg.analyzer.ast.StateMutability;
import com.soliditydfg.analyzer.ast.VariableNode;
import com.soliditydfg.analyzer.ast.Visibility;
import com.soliditydfg.analyzer.syntax.SyntaxNode;
import com.soliditydfg.analyzer.syntax.SyntaxTreeReader;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static com.soliditydfg.analyzer.SyntaxTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class AstBuilderTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures");

    private static AstTree build(SyntaxNode root) {
        return new AstBuilder().build(root).orElseThrow();
    }

    @Test
    void scenarioContractHasThreeChildren() {
        AstTree tree = build(scenarioContract());

        List<ContractNode> contracts = tree.topLevelContracts();
        assertEquals(1, contracts.size());
        ContractNode c = contracts.get(0);
        assertEquals(Optional.of("C"), c.getName());
        assertEquals(3, c.getChildren().size());
        assertInstanceOf(VariableNode.class, c.getChildren().get(0));
        assertInstanceOf(FunctionNode.class, c.getChildren().get(1));
        assertInstanceOf(FunctionNode.class, c.getChildren().get(2));
    }

    @Test
    void idsStrictlyIncreaseInPreOrder() {
        AstTree tree = build(scenarioContract());

        int previous = 0;
        for (AstNode node : tree.preOrder()) {
            int n = Integer.parseInt(node.getId().substring("node_".length()));
            assertTrue(n > previous, "Id " + node.getId() + " not greater than node_" + previous);
            previous = n;
        }
        assertEquals(tree.size(), tree.preOrder().size());
    }

    @Test
    void idsContinueAcrossBuildsOfSameBuilder() {
        AstBuilder builder = new AstBuilder();
        AstTree first = builder.build(scenarioContract()).orElseThrow();
        AstTree second = builder.build(scenarioContract()).orElseThrow();

        assertEquals("node_1", first.getRoot().getId());
        assertEquals("node_" + (first.size() + 1), second.getRoot().getId());
    }

    @Test
    void parentIsResolvedThroughTree() {
        AstTree tree = build(scenarioContract());
        ContractNode c = tree.topLevelContracts().get(0);
        AstNode get = c.getChildren().get(2);

        assertEquals(Optional.of(c), tree.parentOf(get));
        assertTrue(tree.parentOf(tree.getRoot()).isEmpty());
    }

    @Test
    void versionDetectedFromPragma() {
        AstTree tree = build(sourceFile(pragma("^0.8.0"), contract("A")));
        assertEquals(SolidityVersion.V0_8, tree.getVersion());
        assertEquals("0.8.x", tree.getRoot().getMetadata().get("solidity_version"));
    }

    @Test
    void versionDefaultsToOldest() {
        assertEquals(SolidityVersion.V0_4, build(scenarioContract()).getVersion());
    }

    @Test
    void functionAttributesExtracted() {
        var header = List.of(
            leaf("visibility", "external"),
            leaf("state_mutability", "payable"),
            node("modifier_invocation", ident("onlyOwner")),
            returns(param("bool", "ok")));
        AstTree tree = build(sourceFile(contract("Bank",
            function("pay", params(param("address", "to"), param("uint256", "amount")), header))));

        FunctionNode pay = (FunctionNode) tree.topLevelContracts().get(0).getChildren().get(0);
        assertEquals(Optional.of("pay"), pay.getName());
        assertEquals(List.of(new Parameter("to", "address"), new Parameter("amount", "uint256")), pay.getParameters());
        assertEquals(List.of(new Parameter("ok", "bool")), pay.getReturnParameters());
        assertEquals(Optional.of(Visibility.EXTERNAL), pay.getVisibility());
        assertEquals(Optional.of(StateMutability.PAYABLE), pay.getStateMutability());
        assertEquals(List.of("onlyOwner"), pay.getModifiers());
        assertFalse(pay.isConstructor());
    }

    @Test
    void unnamedFunctionIsFallback() {
        AstTree tree = build(sourceFile(contract("W", function(null, params(), List.of()))));
        FunctionNode fallback = (FunctionNode) tree.topLevelContracts().get(0).getChildren().get(0);
        assertTrue(fallback.isFallback());
        assertTrue(fallback.getName().isEmpty());
    }

    @Test
    void baseContractsExtracted() {
        AstTree tree = build(sourceFile(contractIs("Token", List.of("Ownable", "Pausable"))));
        assertEquals(List.of("Ownable", "Pausable"), tree.topLevelContracts().get(0).getBaseContracts());
    }

    @Test
    void stateVariableFlagsExtracted() {
        AstTree tree = build(sourceFile(contract("K",
            stateVar("uint256", "MAX", leaf("visibility", "public"), leaf("constant")))));

        VariableNode max = (VariableNode) tree.topLevelContracts().get(0).getChildren().get(0);
        assertTrue(max.isStateVariable());
        assertTrue(max.isConstant());
        assertFalse(max.isImmutable());
        assertEquals("uint256", max.getDataType());
        assertEquals(Optional.of(Visibility.PUBLIC), max.getVisibility());
    }

    @Test
    void localInitializerTakenFromDeclarationStatement() {
        AstTree tree = build(sourceFile(contract("L",
            function("f", params(), List.of(), localVar("uint", "y", binary(identExpr("a"), "+", number("2")))))));

        VariableNode y = tree.preOrder().stream()
            .filter(VariableNode.class::isInstance).map(VariableNode.class::cast)
            .findFirst().orElseThrow();
        assertFalse(y.isStateVariable());
        assertEquals(Optional.of("a+2"), y.getInitialValue());
    }

    @Test
    void expressionOperandsSkipOperatorAndPunctuation() {
        AstTree tree = build(sourceFile(contract("E",
            function("f", params(), List.of(), exprStatement(binary(identExpr("a"), "*", identExpr("b")))))));

        ExpressionNode product = tree.preOrder().stream()
            .filter(n -> n.getType() == AstNodeType.BINARY_EXPRESSION)
            .map(ExpressionNode.class::cast)
            .findFirst().orElseThrow();
        assertEquals(Optional.of("*"), product.getOperator());
        assertEquals(2, product.getChildren().size());
        assertEquals(Optional.of("a"), product.getLeftOperand().flatMap(AstNode::getName));
        assertEquals(Optional.of("b"), product.getRightOperand().flatMap(AstNode::getName));
        assertTrue(product.getArguments().isEmpty());
    }

    @Test
    void callArgumentsOverflowIntoArgumentList() {
        AstTree tree = build(sourceFile(contract("E",
            function("f", params(), List.of(), exprStatement(call("g", identExpr("a"), identExpr("b")))))));

        ExpressionNode call = tree.preOrder().stream()
            .filter(n -> n.getType() == AstNodeType.CALL_EXPRESSION)
            .map(ExpressionNode.class::cast)
            .findFirst().orElseThrow();
        assertEquals(Optional.of("g"), call.getLeftOperand().flatMap(AstNode::getName));
        assertEquals(Optional.of("a"), call.getRightOperand().flatMap(AstNode::getName));
        assertEquals(1, call.getArguments().size());
        assertEquals(Optional.of("b"), call.getArguments().get(0).getName());
    }

    @Test
    void bareIdentifierWrapperCarriesName() {
        AstTree tree = build(scenarioContract());
        long bare = tree.preOrder().stream()
            .filter(ExpressionNode.class::isInstance)
            .map(ExpressionNode.class::cast)
            .filter(ExpressionNode::isBareIdentifier)
            .count();
        // x in the assignment and x in the return
        assertEquals(2, bare);
    }

    @Test
    void unknownCategoryFallsBackToIdentifier() {
        AstTree tree = build(sourceFile(leaf("some_future_construct", "??")));
        assertEquals(AstNodeType.IDENTIFIER, tree.getRoot().getChildren().get(0).getType());
    }

    @Test
    void nullRootYieldsEmpty() {
        assertTrue(new AstBuilder().build((SyntaxNode) null).isEmpty());
    }

    @Test
    void sourceTextGoesThroughParser() {
        AstBuilder builder = new AstBuilder(source -> source.isBlank()
            ? Optional.empty()
            : Optional.of(scenarioContract()));

        assertTrue(builder.build("").isEmpty());
        assertTrue(builder.build("contract C {}").isPresent());
    }

    @Test
    void sourceTextWithoutParserIsRejected() {
        assertThrows(IllegalStateException.class, () -> new AstBuilder().build("contract C {}"));
    }

    @Test
    void locationsAreOneBased() {
        SyntaxNode root = new SyntaxTreeReader().read(FIXTURES.resolve("solidity-08x/Vault.sol.json")).orElseThrow();
        AstTree tree = build(root);

        ContractNode vault = tree.topLevelContracts().get(0);
        assertEquals(3, vault.getLocation().line());
        assertEquals(1, vault.getLocation().column());
        assertEquals(1, tree.getRoot().getLocation().line());
    }
}
