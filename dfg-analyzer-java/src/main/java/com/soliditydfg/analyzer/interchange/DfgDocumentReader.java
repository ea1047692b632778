package com.soliditydfg.analyzer.interchange;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.soliditydfg.analyzer.ast.AstNodeType;
import com.soliditydfg.analyzer.ast.GenericNode;
import com.soliditydfg.analyzer.ast.SourceLocation;
import com.soliditydfg.analyzer.dfg.Dfg;
import com.soliditydfg.analyzer.dfg.DfgEdge;
import com.soliditydfg.analyzer.dfg.DfgNode;
import com.soliditydfg.analyzer.dfg.EdgeType;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads DFG interchange documents back, validates them and rebuilds {@link Dfg}s.
 *
 * <p>Rebuilt nodes reference detached AST nodes carrying only what the document kept:
 * name, text and source location. Their AST type is inferred from the DFG tag.
 */
public class DfgDocumentReader {

    private static final Gson GSON = new Gson();

    private static final Map<String, AstNodeType> AST_TYPE_BY_TAG = Map.of(
        "contract", AstNodeType.CONTRACT_DECLARATION,
        "interface", AstNodeType.INTERFACE_DECLARATION,
        "library", AstNodeType.LIBRARY_DECLARATION,
        "function", AstNodeType.FUNCTION_DEFINITION,
        "constructor_function", AstNodeType.CONSTRUCTOR_DEFINITION,
        "modifier", AstNodeType.MODIFIER_DEFINITION,
        "state_variable", AstNodeType.STATE_VARIABLE_DECLARATION,
        "local_variable", AstNodeType.VARIABLE_DECLARATION,
        "parameter", AstNodeType.PARAMETER,
        "expression", AstNodeType.EXPRESSION);

    /**
     * @throws DocumentReadException if the file is missing, malformed or fails validation
     */
    public DfgDocument.DfgRoot read(Path documentPath) {
        if (!documentPath.toFile().exists()) {
            throw new DocumentReadException("DFG document not found: " + documentPath);
        }
        try (FileReader reader = new FileReader(documentPath.toFile(), StandardCharsets.UTF_8)) {
            return parse(reader, documentPath.toString());
        } catch (FileNotFoundException e) {
            throw new DocumentReadException("DFG document not found: " + documentPath, e);
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read DFG document: " + documentPath + ": " + e.getMessage(), e);
        }
    }

    public DfgDocument.DfgRoot parse(String json) {
        return parse(new StringReader(json), "<string>");
    }

    private DfgDocument.DfgRoot parse(Reader reader, String origin) {
        DfgDocument.DfgRoot root;
        try {
            root = GSON.fromJson(reader, DfgDocument.DfgRoot.class);
        } catch (JsonParseException e) {
            throw new DocumentReadException("Malformed DFG document " + origin + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new DocumentReadException("DFG document is empty: " + origin);
        }
        List<String> problems = validate(root);
        if (!problems.isEmpty()) {
            throw new DocumentReadException("Invalid DFG document " + origin + ": " + String.join("; ", problems));
        }
        return root;
    }

    /** Structural problems of {@code root}; empty when the document is valid. */
    public List<String> validate(DfgDocument.DfgRoot root) {
        List<String> problems = new ArrayList<>();
        if (root.contract == null)        problems.add("missing required field: contract");
        if (root.solidityVersion == null) problems.add("missing required field: solidity_version");
        if (root.nodes == null)           problems.add("missing required field: nodes");
        if (root.edges == null)           problems.add("missing required field: edges");

        if (root.nodes != null) {
            root.nodes.forEach((key, node) -> {
                if (node == null) {
                    problems.add("node " + key + " is empty");
                    return;
                }
                if (node.id == null)   problems.add("node " + key + " missing required field: id");
                if (node.type == null) problems.add("node " + key + " missing required field: type");
            });
        }
        if (root.edges != null) {
            root.edges.forEach((key, edge) -> {
                if (edge == null) {
                    problems.add("edge " + key + " is empty");
                    return;
                }
                if (edge.id == null)     problems.add("edge " + key + " missing required field: id");
                if (edge.source == null) problems.add("edge " + key + " missing required field: source");
                if (edge.target == null) problems.add("edge " + key + " missing required field: target");
                if (edge.type == null) {
                    problems.add("edge " + key + " missing required field: type");
                } else if (EdgeType.fromValue(edge.type).isEmpty()) {
                    problems.add("edge " + key + " has unknown type: " + edge.type);
                }
            });
        }
        return problems;
    }

    public boolean isValid(DfgDocument.DfgRoot root) {
        return validate(root).isEmpty();
    }

    /** Rebuilds the graph described by a validated document. */
    public Dfg toDfg(DfgDocument.DfgRoot root) {
        Map<String, DfgNode> nodes = new LinkedHashMap<>();
        for (DfgDocument.DfgNodeEntry entry : root.nodes.values()) {
            GenericNode ast = new GenericNode("restored_" + entry.id,
                AST_TYPE_BY_TAG.getOrDefault(entry.type,
                    AstNodeType.fromCategory(entry.type).orElse(AstNodeType.IDENTIFIER)),
                entry.name, locationOf(entry.sourceLocation), null, entry.text);
            if (entry.astMetadata != null) {
                ast.getMetadata().putAll(entry.astMetadata);
            }
            nodes.put(entry.id, new DfgNode(entry.id, ast, entry.type, entry.name, entry.dataType,
                entry.scope, entry.properties));
        }

        Map<String, DfgEdge> edges = new LinkedHashMap<>();
        for (DfgDocument.DfgEdgeEntry entry : root.edges.values()) {
            EdgeType type = EdgeType.fromValue(entry.type)
                .orElseThrow(() -> new DocumentReadException("Unknown edge type: " + entry.type));
            int weight = entry.weight != null ? entry.weight : DfgEdge.DEFAULT_WEIGHT;
            edges.put(entry.id, new DfgEdge(entry.id, entry.source, entry.target, type,
                entry.label, weight, entry.properties));
        }

        return new Dfg(root.contract, root.solidityVersion, nodes, edges, root.entryNodeId, root.metadata);
    }

    private static SourceLocation locationOf(DfgDocument.LocationEntry entry) {
        if (entry == null) {
            return SourceLocation.UNKNOWN;
        }
        return new SourceLocation(entry.line, entry.column, entry.endLine, entry.endColumn);
    }

    public static class DocumentReadException extends RuntimeException {
        public DocumentReadException(String message) { super(message); }
        public DocumentReadException(String message, Throwable cause) { super(message, cause); }
    }
}
