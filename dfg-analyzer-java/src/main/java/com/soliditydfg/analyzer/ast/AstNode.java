package com.soliditydfg.analyzer.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base of the typed AST. Nodes own their children; the parent is held as an id and
 * resolved through the owning {@link AstTree}, so the tree carries no reference cycles.
 */
public abstract sealed class AstNode
        permits ContractNode, FunctionNode, VariableNode, ExpressionNode, GenericNode {

    private final String id;
    private final AstNodeType type;
    private final String name;
    private final SourceLocation location;
    private final String parentId;
    private final String text;
    private final List<AstNode> children = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    protected AstNode(String id, AstNodeType type, String name, SourceLocation location,
                      String parentId, String text) {
        this.id = id;
        this.type = type;
        this.name = name != null && !name.isEmpty() ? name : null;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.parentId = parentId;
        this.text = text != null ? text : "";
    }

    public abstract <R> R accept(AstVisitor<R> visitor);

    public String getId()                { return id; }
    public AstNodeType getType()         { return type; }
    public Optional<String> getName()    { return Optional.ofNullable(name); }
    public SourceLocation getLocation()  { return location; }
    public Optional<String> getParentId() { return Optional.ofNullable(parentId); }
    public String getText()              { return text; }
    public List<AstNode> getChildren()   { return Collections.unmodifiableList(children); }

    /**
     * Open metadata map. Annotation passes write here after the tree is built; the
     * structure of the tree never changes.
     */
    public Map<String, Object> getMetadata() { return metadata; }

    void addChild(AstNode child) {
        if (!id.equals(child.parentId)) {
            throw new IllegalArgumentException("Child " + child.id + " does not name " + id + " as its parent");
        }
        children.add(child);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + " " + type.value()
            + (name != null ? " " + name : "") + " @" + location + "]";
    }
}
