package com.soliditydfg.analyzer.ast;

import java.util.Optional;

/**
 * State or local variable declaration.
 */
public final class VariableNode extends AstNode {

    private final String dataType;
    private final boolean immutable;
    private final boolean stateVariable;
    private final String initialValue;
    private boolean constant;
    private Visibility visibility;

    public VariableNode(String id, AstNodeType type, String name, SourceLocation location,
                        String parentId, String text,
                        String dataType, boolean constant, boolean immutable, boolean stateVariable,
                        Visibility visibility, String initialValue) {
        super(id, type, name, location, parentId, text);
        this.dataType = dataType != null ? dataType : "";
        this.constant = constant;
        this.immutable = immutable;
        this.stateVariable = stateVariable;
        this.visibility = visibility;
        this.initialValue = initialValue != null && !initialValue.isEmpty() ? initialValue : null;
    }

    /** Declared type text; empty when the declaration has none (e.g. {@code var}). */
    public String getDataType()                 { return dataType; }
    public boolean isConstant()                 { return constant; }
    public boolean isImmutable()                { return immutable; }
    public boolean isStateVariable()            { return stateVariable; }
    public Optional<Visibility> getVisibility() { return Optional.ofNullable(visibility); }
    public Optional<String> getInitialValue()   { return Optional.ofNullable(initialValue); }

    public void markConstant()                       { this.constant = true; }
    public void setVisibility(Visibility visibility) { this.visibility = visibility; }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
