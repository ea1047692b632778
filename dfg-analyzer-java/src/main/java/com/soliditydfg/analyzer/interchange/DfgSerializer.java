package com.soliditydfg.analyzer.interchange;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.soliditydfg.analyzer.ast.AstNode;
import com.soliditydfg.analyzer.ast.SourceLocation;
import com.soliditydfg.analyzer.dfg.Dfg;
import com.soliditydfg.analyzer.dfg.DfgEdge;
import com.soliditydfg.analyzer.dfg.DfgNode;
import com.soliditydfg.analyzer.filter.DfgConfig;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes DFGs to the JSON interchange format. Node text, AST metadata and source
 * locations are included according to the {@link DfgConfig} given at construction.
 */
public class DfgSerializer {

    public static final String SERIALIZER_VERSION = "1.0.0";
    private static final String ELLIPSIS = "...";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final DfgConfig config;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public DfgSerializer(DfgConfig config) {
        this.config = config;
    }

    public DfgSerializer() {
        this(DfgConfig.standard());
    }

    public DfgDocument.DfgRoot toDocument(Dfg dfg) {
        var root = new DfgDocument.DfgRoot();
        root.contract = dfg.getContractName();
        root.solidityVersion = dfg.getSolidityVersion();
        root.nodes = new LinkedHashMap<>();
        for (DfgNode node : dfg.getNodes().values()) {
            root.nodes.put(node.getId(), toEntry(node));
        }
        root.edges = new LinkedHashMap<>();
        for (DfgEdge edge : dfg.getEdges().values()) {
            root.edges.put(edge.getId(), toEntry(edge));
        }
        root.metadata = metadataOf(dfg);
        root.entryNodeId = dfg.getEntryNodeId().orElse(null);
        return root;
    }

    public String toJson(Dfg dfg) {
        return gson.toJson(toDocument(dfg));
    }

    /**
     * Writes {@code dfg} to {@code file}, creating parent directories.
     *
     * @throws SerializerException on any I/O failure
     */
    public void write(Dfg dfg, Path file) {
        writeJson(toDocument(dfg), file);
        System.err.println("[dfg-analyzer] DFG written: " + file);
    }

    /** Writes several DFGs as {@code {"contracts":{...},"metadata":{...}}}. */
    public void writeAll(Map<String, Dfg> dfgs, Path file) {
        var bundle = new DfgDocument.DfgBundle();
        bundle.contracts = new LinkedHashMap<>();
        dfgs.forEach((name, dfg) -> bundle.contracts.put(name, toDocument(dfg)));
        bundle.metadata = new LinkedHashMap<>();
        bundle.metadata.put("generated_at", Instant.now().toString());
        bundle.metadata.put("contract_count", dfgs.size());
        bundle.metadata.put("serializer_version", SERIALIZER_VERSION);
        writeJson(bundle, file);
        System.err.println("[dfg-analyzer] " + dfgs.size() + " DFGs written: " + file);
    }

    public DfgDocument.DfgSummary summarize(Dfg dfg) {
        var summary = new DfgDocument.DfgSummary();
        summary.contract = dfg.getContractName();
        summary.solidityVersion = dfg.getSolidityVersion();
        summary.statistics = new DfgDocument.Statistics();
        summary.statistics.totalNodes = dfg.getNodes().size();
        summary.statistics.totalEdges = dfg.getEdges().size();
        summary.statistics.entryNode = dfg.getEntryNodeId().orElse(null);
        summary.nodeTypes = nodeTypeCounts(dfg);
        summary.edgeTypes = edgeTypeCounts(dfg);
        summary.functions = new ArrayList<>();
        summary.stateVariables = new ArrayList<>();
        for (DfgNode node : dfg.getNodes().values()) {
            switch (node.getType()) {
                case "function", "constructor_function" -> summary.functions.add(summaryEntry(node));
                case "state_variable" -> summary.stateVariables.add(summaryEntry(node));
                default -> { }
            }
        }
        return summary;
    }

    public void exportSummary(Dfg dfg, Path file) {
        writeJson(summarize(dfg), file);
        System.err.println("[dfg-analyzer] Summary written: " + file);
    }

    public void writeReport(DfgDocument.AnalysisReport report, Path file) {
        writeJson(report, file);
        System.err.println("[dfg-analyzer] Analysis report written: " + file);
    }

    // -------------------------------------------------------------------------

    private DfgDocument.DfgNodeEntry toEntry(DfgNode node) {
        var entry = new DfgDocument.DfgNodeEntry();
        entry.id = node.getId();
        entry.type = node.getType();
        entry.name = node.getName().orElse(null);
        entry.dataType = node.getDataType().orElse(null);
        entry.scope = node.getScope();
        entry.properties = new LinkedHashMap<>(node.getProperties());

        AstNode ast = node.getAstNode();
        if (config.isStoreSourceLocation() && !SourceLocation.UNKNOWN.equals(ast.getLocation())) {
            SourceLocation loc = ast.getLocation();
            var location = new DfgDocument.LocationEntry();
            location.line = loc.line();
            location.column = loc.column();
            location.endLine = loc.endLine();
            location.endColumn = loc.endColumn();
            entry.sourceLocation = location;
        }
        if (config.isIncludeNodeText() && !ast.getText().isEmpty()) {
            entry.text = truncate(ast.getText(), config.getTextMaxLength());
        }
        if (config.isIncludeAstMetadata() && !ast.getMetadata().isEmpty()) {
            entry.astMetadata = new LinkedHashMap<>(ast.getMetadata());
        }
        return entry;
    }

    private static DfgDocument.DfgEdgeEntry toEntry(DfgEdge edge) {
        var entry = new DfgDocument.DfgEdgeEntry();
        entry.id = edge.getId();
        entry.source = edge.getSourceId();
        entry.target = edge.getTargetId();
        entry.type = edge.getType().value();
        entry.label = edge.getLabel().orElse(null);
        entry.weight = edge.getWeight();
        entry.properties = new LinkedHashMap<>(edge.getProperties());
        return entry;
    }

    private static Map<String, Object> metadataOf(Dfg dfg) {
        Map<String, Object> metadata = new LinkedHashMap<>(dfg.getMetadata());
        metadata.put("generated_at", Instant.now().toString());
        metadata.put("node_count", dfg.getNodes().size());
        metadata.put("edge_count", dfg.getEdges().size());
        metadata.put("serializer_version", SERIALIZER_VERSION);
        metadata.put("edge_type_distribution", edgeTypeCounts(dfg));
        metadata.put("node_type_distribution", nodeTypeCounts(dfg));
        return metadata;
    }

    private static Map<String, Integer> nodeTypeCounts(Dfg dfg) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DfgNode node : dfg.getNodes().values()) {
            counts.merge(node.getType(), 1, Integer::sum);
        }
        return counts;
    }

    private static Map<String, Integer> edgeTypeCounts(Dfg dfg) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DfgEdge edge : dfg.getEdges().values()) {
            counts.merge(edge.getType().value(), 1, Integer::sum);
        }
        return counts;
    }

    private static DfgDocument.SummaryEntry summaryEntry(DfgNode node) {
        var entry = new DfgDocument.SummaryEntry();
        entry.name = node.getName().orElse(null);
        entry.scope = node.getScope();
        entry.dataType = node.getDataType().orElse(null);
        return entry;
    }

    static String truncate(String text, int maxLength) {
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + ELLIPSIS;
    }

    private void writeJson(Object document, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory for: " + file, e);
        }
        try (Writer w = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            gson.toJson(document, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }
}
