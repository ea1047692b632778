package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.config.DfgConfigReader;
import com.soliditydfg.analyzer.filter.DfgConfig;
import com.soliditydfg.analyzer.filter.NodePriority;
import com.soliditydfg.analyzer.filter.OutputMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DfgConfigReaderTest {

    private final DfgConfigReader reader = new DfgConfigReader();

    private Path write(Path dir, String json) throws IOException {
        Path file = dir.resolve("dfg-config.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void readsEveryField(@TempDir Path tmp) throws IOException {
        Path file = write(tmp, """
            {
              "output_mode": "custom",
              "min_node_priority": "auxiliary",
              "skip_keywords": false,
              "skip_type_names": false,
              "skip_operators": true,
              "skip_punctuation": true,
              "skip_literal_nodes": true,
              "include_node_types": ["number_literal"],
              "skip_node_types": ["emit_statement"],
              "include_node_text": true,
              "include_ast_metadata": true,
              "text_max_length": 40,
              "store_source_location": false
            }
            """);

        DfgConfig config = reader.read(file);

        assertEquals(OutputMode.CUSTOM, config.getOutputMode());
        assertEquals(NodePriority.AUXILIARY, config.getMinNodePriority());
        assertFalse(config.isSkipKeywords());
        assertFalse(config.isSkipTypeNames());
        assertTrue(config.isSkipLiteralNodes());
        assertEquals(Set.of("number_literal"), config.getIncludeNodeTypes());
        assertEquals(Set.of("emit_statement"), config.getSkipNodeTypes());
        assertTrue(config.isIncludeNodeText());
        assertTrue(config.isIncludeAstMetadata());
        assertEquals(40, config.getTextMaxLength());
        assertFalse(config.isStoreSourceLocation());
    }

    @Test
    void absentFieldsFallBackToModePreset(@TempDir Path tmp) throws IOException {
        DfgConfig config = reader.read(write(tmp, "{\"output_mode\": \"verbose\", \"text_max_length\": 20}"));

        assertEquals(OutputMode.VERBOSE, config.getOutputMode());
        assertEquals(NodePriority.AUXILIARY, config.getMinNodePriority());
        assertTrue(config.isIncludeNodeText());
        assertEquals(20, config.getTextMaxLength());
    }

    @Test
    void missingModeMeansStandard(@TempDir Path tmp) throws IOException {
        DfgConfig config = reader.read(write(tmp, "{}"));
        assertEquals(OutputMode.STANDARD, config.getOutputMode());
        assertEquals(NodePriority.IMPORTANT, config.getMinNodePriority());
        assertEquals(DfgConfig.DEFAULT_TEXT_MAX_LENGTH, config.getTextMaxLength());
    }

    @Test
    void nonAsciiNodeTypesAreDecodedAsUtf8(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("dfg-config.json");
        Files.write(file, "{\"skip_node_types\": [\"\u6ce8\u91ca\"]}".getBytes(StandardCharsets.UTF_8));

        assertEquals(Set.of("\u6ce8\u91ca"), reader.read(file).getSkipNodeTypes());
    }

    @Test
    void unknownModeThrows(@TempDir Path tmp) throws IOException {
        Path file = write(tmp, "{\"output_mode\": \"tiny\"}");
        DfgConfigReader.ConfigReadException e =
            assertThrows(DfgConfigReader.ConfigReadException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("tiny"));
    }

    @Test
    void unknownPriorityThrows(@TempDir Path tmp) throws IOException {
        Path file = write(tmp, "{\"min_node_priority\": \"urgent\"}");
        assertThrows(DfgConfigReader.ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void malformedJsonThrows(@TempDir Path tmp) throws IOException {
        Path file = write(tmp, "{\"output_mode\": ");
        assertThrows(DfgConfigReader.ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void emptyFileThrows(@TempDir Path tmp) throws IOException {
        Path file = write(tmp, "");
        assertThrows(DfgConfigReader.ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void missingFileThrows() {
        assertThrows(DfgConfigReader.ConfigReadException.class,
            () -> reader.read(Path.of("/tmp/does-not-exist-dfg-config.json")));
    }
}
