package com.soliditydfg.analyzer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.soliditydfg.analyzer.filter.DfgConfig;
import com.soliditydfg.analyzer.filter.NodePriority;
import com.soliditydfg.analyzer.filter.OutputMode;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashSet;

public class DfgConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads a configuration file and resolves it against its mode preset.
     *
     * @throws ConfigReadException if the file is missing, malformed, or names an unknown
     *                             mode or priority
     */
    public DfgConfig read(Path configPath) {
        return toConfig(readFile(configPath), configPath.toString());
    }

    public DfgConfigFile readFile(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            DfgConfigFile file = GSON.fromJson(reader, DfgConfigFile.class);
            if (file == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return file;
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config file: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Applies every field present in {@code file} on top of its mode preset. */
    public DfgConfig toConfig(DfgConfigFile file, String origin) {
        OutputMode mode = OutputMode.fromValue(file.getOutputMode())
            .orElseThrow(() -> new ConfigReadException(
                "Unknown output_mode '" + file.getOutputMode() + "' in " + origin));
        DfgConfig.Builder b = DfgConfig.builder(mode);

        if (file.getMinNodePriority() != null) {
            b.minNodePriority(NodePriority.fromValue(file.getMinNodePriority())
                .orElseThrow(() -> new ConfigReadException(
                    "Unknown min_node_priority '" + file.getMinNodePriority() + "' in " + origin)));
        }
        if (file.getSkipKeywords() != null)        b.skipKeywords(file.getSkipKeywords());
        if (file.getSkipTypeNames() != null)       b.skipTypeNames(file.getSkipTypeNames());
        if (file.getSkipOperators() != null)       b.skipOperators(file.getSkipOperators());
        if (file.getSkipPunctuation() != null)     b.skipPunctuation(file.getSkipPunctuation());
        if (file.getSkipLiteralNodes() != null)    b.skipLiteralNodes(file.getSkipLiteralNodes());
        if (!file.getIncludeNodeTypes().isEmpty()) b.includeNodeTypes(new HashSet<>(file.getIncludeNodeTypes()));
        if (!file.getSkipNodeTypes().isEmpty())    b.skipNodeTypes(new HashSet<>(file.getSkipNodeTypes()));
        if (file.getIncludeNodeText() != null)     b.includeNodeText(file.getIncludeNodeText());
        if (file.getIncludeAstMetadata() != null)  b.includeAstMetadata(file.getIncludeAstMetadata());
        if (file.getTextMaxLength() != null)       b.textMaxLength(file.getTextMaxLength());
        if (file.getStoreSourceLocation() != null) b.storeSourceLocation(file.getStoreSourceLocation());
        return b.build();
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
