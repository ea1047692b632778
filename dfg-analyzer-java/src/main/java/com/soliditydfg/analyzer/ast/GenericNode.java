package com.soliditydfg.analyzer.ast;

/**
 * Any construct without a dedicated variant; its type tag is the raw grammar category.
 */
public final class GenericNode extends AstNode {

    public GenericNode(String id, AstNodeType type, String name, SourceLocation location,
                       String parentId, String text) {
        super(id, type, name, location, parentId, text);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }
}
