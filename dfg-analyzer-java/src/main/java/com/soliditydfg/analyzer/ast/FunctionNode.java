package com.soliditydfg.analyzer.ast;

import java.util.List;
import java.util.Optional;

/**
 * Function, constructor, fallback/receive function or modifier definition.
 *
 * <p>Constructor flag, visibility and state mutability can be rewritten by an
 * {@link AstAnnotator}: 0.4.x sources declare constructors by name and leave the
 * defaults implicit.
 */
public final class FunctionNode extends AstNode {

    private final List<Parameter> parameters;
    private final List<Parameter> returnParameters;
    private final List<String> modifiers;
    private final boolean fallback;
    private final boolean receive;
    private Visibility visibility;
    private StateMutability stateMutability;
    private boolean constructor;

    public FunctionNode(String id, AstNodeType type, String name, SourceLocation location,
                        String parentId, String text,
                        List<Parameter> parameters, List<Parameter> returnParameters,
                        Visibility visibility, StateMutability stateMutability,
                        List<String> modifiers, boolean constructor, boolean fallback, boolean receive) {
        super(id, type, name, location, parentId, text);
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.returnParameters = returnParameters != null ? List.copyOf(returnParameters) : List.of();
        this.visibility = visibility;
        this.stateMutability = stateMutability;
        this.modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        this.constructor = constructor;
        this.fallback = fallback;
        this.receive = receive;
    }

    public List<Parameter> getParameters()       { return parameters; }
    public List<Parameter> getReturnParameters() { return returnParameters; }
    public Optional<Visibility> getVisibility()  { return Optional.ofNullable(visibility); }
    public Optional<StateMutability> getStateMutability() { return Optional.ofNullable(stateMutability); }
    /** Names of the modifiers invoked in the header. */
    public List<String> getModifiers()           { return modifiers; }
    public boolean isConstructor()               { return constructor; }
    public boolean isFallback()                  { return fallback; }
    public boolean isReceive()                   { return receive; }
    public boolean isModifier()                  { return getType() == AstNodeType.MODIFIER_DEFINITION; }

    public void markConstructor()                { this.constructor = true; }
    public void setVisibility(Visibility visibility) { this.visibility = visibility; }
    public void setStateMutability(StateMutability stateMutability) { this.stateMutability = stateMutability; }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
