package com.soliditydfg.analyzer.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arena holding the nodes of one build, indexed by id.
 */
public final class AstTree {

    private final AstNode root;
    private final SolidityVersion version;
    private final Map<String, AstNode> index;

    AstTree(AstNode root, SolidityVersion version, Map<String, AstNode> index) {
        this.root = root;
        this.version = version;
        this.index = Collections.unmodifiableMap(new LinkedHashMap<>(index));
    }

    public AstNode getRoot()             { return root; }
    public SolidityVersion getVersion()  { return version; }
    public int size()                    { return index.size(); }

    public Optional<AstNode> parentOf(AstNode node) {
        return node.getParentId().map(index::get);
    }

    /** All nodes in pre-order, which is also id order. */
    public List<AstNode> preOrder() {
        List<AstNode> result = new ArrayList<>(index.size());
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            result.add(node);
            List<AstNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Contract-like declarations not nested inside another one, in source order.
     */
    public List<ContractNode> topLevelContracts() {
        List<ContractNode> result = new ArrayList<>();
        collectContracts(root, result);
        return result;
    }

    private void collectContracts(AstNode node, List<ContractNode> out) {
        if (node instanceof ContractNode contract) {
            out.add(contract);
            return;
        }
        for (AstNode child : node.getChildren()) {
            collectContracts(child, out);
        }
    }
}
