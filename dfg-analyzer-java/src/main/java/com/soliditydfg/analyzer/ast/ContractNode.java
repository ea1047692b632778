package com.soliditydfg.analyzer.ast;

import java.util.List;

/**
 * Contract, interface or library declaration.
 */
public final class ContractNode extends AstNode {

    private final List<String> baseContracts;

    public ContractNode(String id, AstNodeType type, String name, SourceLocation location,
                        String parentId, String text, List<String> baseContracts) {
        super(id, type, name, location, parentId, text);
        this.baseContracts = baseContracts != null ? List.copyOf(baseContracts) : List.of();
    }

    /** Names after {@code is}, in declaration order. */
    public List<String> getBaseContracts() { return baseContracts; }

    public boolean isInterface() { return getType() == AstNodeType.INTERFACE_DECLARATION; }
    public boolean isLibrary()   { return getType() == AstNodeType.LIBRARY_DECLARATION; }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitContract(this);
    }
}
