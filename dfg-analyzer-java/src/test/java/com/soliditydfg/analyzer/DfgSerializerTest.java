package com.soliditydfg.analyzer;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.soliditydfg.analyzer.ast.AstBuilder;
import com.soliditydfg.analyzer.ast.AstTree;
import com.soliditydfg.analyzer.dfg.Dfg;
import com.soliditydfg.analyzer.dfg.DfgBuilder;
import com.soliditydfg.analyzer.dfg.DfgEdge;
import com.soliditydfg.analyzer.filter.DfgConfig;
import com.soliditydfg.analyzer.interchange.DfgDocument;
import com.soliditydfg.analyzer.interchange.DfgDocumentReader;
import com.soliditydfg.analyzer.interchange.DfgSerializer;
import com.soliditydfg.analyzer.legacy.Solidity04xAnnotator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.soliditydfg.analyzer.SyntaxTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class DfgSerializerTest {

    private static Dfg dfg;
    private final Gson gson = new Gson();

    @BeforeAll
    static void buildGraph() {
        AstTree tree = new AstBuilder().build(scenarioContract()).orElseThrow();
        new Solidity04xAnnotator().annotate(tree);
        dfg = new DfgBuilder("0.4.x").build(tree.topLevelContracts().get(0), "C").orElseThrow();
    }

    private static List<String> triples(Dfg graph) {
        List<String> result = new ArrayList<>();
        for (DfgEdge e : graph.getEdges().values()) {
            result.add(e.getSourceId() + "|" + e.getTargetId() + "|" + e.getType().value());
        }
        Collections.sort(result);
        return result;
    }

    @Test
    void documentCarriesGraphAndStatistics() {
        DfgDocument.DfgRoot doc = new DfgSerializer().toDocument(dfg);

        assertEquals("C", doc.contract);
        assertEquals("0.4.x", doc.solidityVersion);
        assertEquals(dfg.getNodes().size(), doc.nodes.size());
        assertEquals(dfg.getEdges().size(), doc.edges.size());
        assertEquals(dfg.getEntryNodeId().orElseThrow(), doc.entryNodeId);
        assertEquals(dfg.getNodes().size(), doc.metadata.get("node_count"));
        assertEquals("1.0.0", doc.metadata.get("serializer_version"));
        assertNotNull(doc.metadata.get("generated_at"));

        @SuppressWarnings("unchecked")
        Map<String, Integer> nodeTypes = (Map<String, Integer>) doc.metadata.get("node_type_distribution");
        assertEquals(1, nodeTypes.get("constructor_function"));
        assertEquals(1, nodeTypes.get("state_variable"));
    }

    @Test
    void nullFieldsAreOmitted() {
        JsonObject json = gson.fromJson(new DfgSerializer().toJson(dfg), JsonObject.class);
        JsonObject nodes = json.getAsJsonObject("nodes");
        JsonObject edges = json.getAsJsonObject("edges");

        String unnamed = dfg.getNodes().values().stream()
            .filter(n -> n.getName().isEmpty())
            .findFirst().orElseThrow().getId();
        assertFalse(nodes.getAsJsonObject(unnamed).has("name"));
        assertFalse(nodes.getAsJsonObject(unnamed).has("text"), "standard mode stores no text");
        assertFalse(edges.getAsJsonObject("dfg_edge_1").has("label"));
        assertEquals(1, edges.getAsJsonObject("dfg_edge_1").get("weight").getAsInt());
    }

    @Test
    void verboseIncludesTextAndAstMetadata() {
        DfgDocument.DfgRoot doc = new DfgSerializer(DfgConfig.verbose()).toDocument(dfg);
        String contractId = dfg.getEntryNodeId().orElseThrow();

        assertNotNull(doc.nodes.get(contractId).text);
        assertEquals(true, doc.nodes.get(contractId).astMetadata.get("is_legacy"));
    }

    @Test
    void longTextIsTruncated() {
        DfgConfig shortText = DfgConfig.verbose().toBuilder().textMaxLength(10).build();
        DfgDocument.DfgRoot doc = new DfgSerializer(shortText).toDocument(dfg);
        String text = doc.nodes.get(dfg.getEntryNodeId().orElseThrow()).text;

        assertEquals(13, text.length());
        assertTrue(text.endsWith("..."));
        assertTrue(text.startsWith("contract C"));
    }

    @Test
    void truncationDisabledByNonPositiveLength() {
        DfgConfig unlimited = DfgConfig.verbose().toBuilder().textMaxLength(0).build();
        DfgDocument.DfgRoot doc = new DfgSerializer(unlimited).toDocument(dfg);
        String contractId = dfg.getEntryNodeId().orElseThrow();
        assertEquals(dfg.getNode(contractId).orElseThrow().getAstNode().getText(), doc.nodes.get(contractId).text);
    }

    @Test
    void sourceLocationOmittedWhenDisabled() {
        DfgConfig noLocations = DfgConfig.custom().storeSourceLocation(false).build();
        DfgDocument.DfgRoot doc = new DfgSerializer(noLocations).toDocument(dfg);
        doc.nodes.values().forEach(n -> assertNull(n.sourceLocation));
    }

    @Test
    void writeCreatesDirectoriesAndRoundTrips(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("dfgs/C_dfg.json");
        new DfgSerializer().write(dfg, out);
        assertTrue(Files.exists(out));

        DfgDocumentReader reader = new DfgDocumentReader();
        Dfg restored = reader.toDfg(reader.read(out));

        assertEquals(dfg.getNodes().size(), restored.getNodes().size());
        assertEquals(dfg.getEdges().size(), restored.getEdges().size());
        assertEquals(triples(dfg), triples(restored));
        assertEquals(dfg.getEntryNodeId(), restored.getEntryNodeId());
        assertEquals("C", restored.getContractName());
    }

    @Test
    void writeAllBundlesContracts(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("all.json");
        new DfgSerializer().writeAll(Map.of("C", dfg), out);

        try (FileReader r = new FileReader(out.toFile())) {
            JsonObject json = gson.fromJson(r, JsonObject.class);
            assertTrue(json.getAsJsonObject("contracts").has("C"));
            assertEquals(1, json.getAsJsonObject("metadata").get("contract_count").getAsInt());
        }
    }

    @Test
    void summaryListsFunctionsAndStateVariables(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("C_summary.json");
        new DfgSerializer().exportSummary(dfg, out);

        try (FileReader r = new FileReader(out.toFile())) {
            DfgDocument.DfgSummary summary = gson.fromJson(r, DfgDocument.DfgSummary.class);
            assertEquals("C", summary.contract);
            assertEquals(dfg.getNodes().size(), summary.statistics.totalNodes);
            assertEquals(2, summary.functions.size());
            assertEquals(1, summary.stateVariables.size());
            assertEquals("x", summary.stateVariables.get(0).name);
            assertEquals("uint", summary.stateVariables.get(0).dataType);
        }
    }

    @Test
    void writeIntoFileAsDirectoryThrows(@TempDir Path tmp) throws Exception {
        Path blocker = tmp.resolve("blocker");
        Files.writeString(blocker, "x");
        assertThrows(DfgSerializer.SerializerException.class,
            () -> new DfgSerializer().write(dfg, blocker.resolve("C_dfg.json")));
    }
}
