package com.soliditydfg.analyzer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Operator expression, call, member access, or an {@code expression} wrapper.
 *
 * <p>Operands are owned as ordinary children; the first two fill the left and right slots
 * and any further ones go to the argument list. A wrapper around a lone identifier is a
 * bare identifier expression and carries the identifier as its name.
 */
public final class ExpressionNode extends AstNode {

    private final String operator;
    private AstNode leftOperand;
    private AstNode rightOperand;
    private final List<AstNode> arguments = new ArrayList<>();

    public ExpressionNode(String id, AstNodeType type, String name, SourceLocation location,
                          String parentId, String text, String operator) {
        super(id, type, name, location, parentId, text);
        this.operator = operator != null && !operator.isEmpty() ? operator : null;
    }

    public Optional<String> getOperator()      { return Optional.ofNullable(operator); }
    public Optional<AstNode> getLeftOperand()  { return Optional.ofNullable(leftOperand); }
    public Optional<AstNode> getRightOperand() { return Optional.ofNullable(rightOperand); }
    public List<AstNode> getArguments()        { return Collections.unmodifiableList(arguments); }

    public boolean isBareIdentifier() {
        return getName().isPresent();
    }

    void addOperand(AstNode operand) {
        addChild(operand);
        if (leftOperand == null) {
            leftOperand = operand;
        } else if (rightOperand == null) {
            rightOperand = operand;
        } else {
            arguments.add(operand);
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }
}
