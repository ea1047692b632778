package com.soliditydfg.analyzer.ast;

/**
 * Exhaustive dispatch over the closed set of AST variants.
 */
public interface AstVisitor<R> {

    R visitContract(ContractNode node);

    R visitFunction(FunctionNode node);

    R visitVariable(VariableNode node);

    R visitExpression(ExpressionNode node);

    R visitGeneric(GenericNode node);
}
