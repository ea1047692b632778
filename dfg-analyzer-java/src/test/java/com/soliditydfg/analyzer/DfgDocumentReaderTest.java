package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.dfg.Dfg;
import com.soliditydfg.analyzer.dfg.EdgeType;
import com.soliditydfg.analyzer.interchange.DfgDocument;
import com.soliditydfg.analyzer.interchange.DfgDocumentReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DfgDocumentReaderTest {

    private final DfgDocumentReader reader = new DfgDocumentReader();

    private static final String VALID = """
        {
          "contract": "Token",
          "solidity_version": "0.5.x",
          "nodes": {
            "dfg_node_1": {"id": "dfg_node_1", "type": "contract", "name": "Token", "scope": "global",
                           "source_location": {"line": 3, "column": 1, "end_line": 9, "end_column": 2}},
            "dfg_node_2": {"id": "dfg_node_2", "type": "state_variable", "name": "supply",
                           "data_type": "uint256", "scope": "Token", "text": "uint256 supply;"}
          },
          "edges": {
            "dfg_edge_1": {"id": "dfg_edge_1", "source": "dfg_node_1", "target": "dfg_node_2",
                           "type": "definition"},
            "dfg_edge_2": {"id": "dfg_edge_2", "source": "dfg_node_1", "target": "contract_ERC20",
                           "type": "definition", "weight": 3, "properties": {"inheritance_type": "base_contract"}}
          },
          "metadata": {"function_count": 0, "unresolved_references": ["Token.owner"]},
          "entry_node_id": "dfg_node_1"
        }
        """;

    @Test
    void parsesAndRebuildsGraph() {
        Dfg dfg = reader.toDfg(reader.parse(VALID));

        assertEquals("Token", dfg.getContractName());
        assertEquals("0.5.x", dfg.getSolidityVersion());
        assertEquals(2, dfg.getNodes().size());
        assertEquals(2, dfg.edgesOfType(EdgeType.DEFINITION).size());
        assertEquals(3, dfg.getEdge("dfg_edge_2").orElseThrow().getWeight());
        assertEquals(1, dfg.getEdge("dfg_edge_1").orElseThrow().getWeight());
        assertEquals("base_contract", dfg.getEdge("dfg_edge_2").orElseThrow().getProperties().get("inheritance_type"));
        assertEquals("dfg_node_1", dfg.getEntryNodeId().orElseThrow());
    }

    @Test
    void unresolvedReferencesSurviveReading() {
        Dfg dfg = reader.toDfg(reader.parse(VALID));
        assertEquals(List.of("Token.owner"), dfg.getUnresolvedReferences());
    }

    @Test
    void detachedAstKeepsTextAndLocation() {
        Dfg dfg = reader.toDfg(reader.parse(VALID));

        assertEquals(3, dfg.getNode("dfg_node_1").orElseThrow().getAstNode().getLocation().line());
        assertEquals("uint256 supply;", dfg.getNode("dfg_node_2").orElseThrow().getAstNode().getText());
        assertEquals("uint256", dfg.getNode("dfg_node_2").orElseThrow().getDataType().orElseThrow());
    }

    @Test
    void validationReportsEveryMissingField() {
        DfgDocument.DfgRoot doc = new DfgDocument.DfgRoot();
        List<String> problems = reader.validate(doc);
        assertEquals(4, problems.size(), "Got: " + problems);
        assertFalse(reader.isValid(doc));
    }

    @Test
    void nodeWithoutTypeIsInvalid() {
        String json = """
            {"contract": "A", "solidity_version": "0.4.x",
             "nodes": {"n1": {"id": "n1"}}, "edges": {}}
            """;
        DfgDocumentReader.DocumentReadException e =
            assertThrows(DfgDocumentReader.DocumentReadException.class, () -> reader.parse(json));
        assertTrue(e.getMessage().contains("node n1 missing required field: type"), e.getMessage());
    }

    @Test
    void unknownEdgeTypeIsInvalid() {
        String json = """
            {"contract": "A", "solidity_version": "0.4.x", "nodes": {},
             "edges": {"e1": {"id": "e1", "source": "a", "target": "b", "type": "teleports"}}}
            """;
        assertThrows(DfgDocumentReader.DocumentReadException.class, () -> reader.parse(json));
    }

    @Test
    void missingFileThrows() {
        assertThrows(DfgDocumentReader.DocumentReadException.class,
            () -> reader.read(Path.of("/tmp/does-not-exist-dfg.json")));
    }

    @Test
    void emptyFileThrows(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(DfgDocumentReader.DocumentReadException.class, () -> reader.read(empty));
    }
}
