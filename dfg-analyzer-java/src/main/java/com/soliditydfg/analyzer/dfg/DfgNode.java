package com.soliditydfg.analyzer.dfg;

import com.soliditydfg.analyzer.ast.AstNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Graph node derived from an AST node. The AST node is borrowed; the tree outlives the graph.
 */
public final class DfgNode {

    private final String id;
    private final AstNode astNode;
    private final String type;
    private final String name;
    private final String dataType;
    private final String scope;
    private final Map<String, Object> properties;

    public DfgNode(String id, AstNode astNode, String type, String name, String dataType,
                   String scope, Map<String, Object> properties) {
        this.id = id;
        this.astNode = astNode;
        this.type = type;
        this.name = name != null && !name.isEmpty() ? name : null;
        this.dataType = dataType != null && !dataType.isEmpty() ? dataType : null;
        this.scope = scope;
        this.properties = properties != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
            : Collections.emptyMap();
    }

    public String getId()                { return id; }
    public AstNode getAstNode()          { return astNode; }
    /** Classification tag, e.g. {@code state_variable} or {@code expression}. */
    public String getType()              { return type; }
    public Optional<String> getName()    { return Optional.ofNullable(name); }
    public Optional<String> getDataType() { return Optional.ofNullable(dataType); }
    public String getScope()             { return scope; }
    public Map<String, Object> getProperties() { return properties; }

    @Override
    public String toString() {
        return "DfgNode[" + id + " " + type + (name != null ? " " + name : "") + " in " + scope + "]";
    }
}
