package com.soliditydfg.analyzer.syntax;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the syntax tree JSON dump written by the parsing front end.
 * An empty document or a JSON {@code null} means the parser produced no root.
 */
public class SyntaxTreeReader {

    private static final Gson GSON = new Gson();

    /**
     * @throws SyntaxTreeReadException if the file is missing, unreadable or not a syntax tree
     */
    public Optional<SyntaxNode> read(Path treePath) {
        if (!treePath.toFile().exists()) {
            throw new SyntaxTreeReadException("Syntax tree file not found: " + treePath);
        }
        try (FileReader reader = new FileReader(treePath.toFile(), StandardCharsets.UTF_8)) {
            return parse(reader, treePath.toString());
        } catch (FileNotFoundException e) {
            throw new SyntaxTreeReadException("Syntax tree file not found: " + treePath, e);
        } catch (IOException e) {
            throw new SyntaxTreeReadException("Failed to read syntax tree: " + treePath + ": " + e.getMessage(), e);
        }
    }

    public Optional<SyntaxNode> parse(String json) {
        return parse(new StringReader(json), "<string>");
    }

    private Optional<SyntaxNode> parse(Reader reader, String origin) {
        JsonSyntaxNode root;
        try {
            root = GSON.fromJson(reader, JsonSyntaxNode.class);
        } catch (JsonParseException e) {
            throw new SyntaxTreeReadException("Malformed syntax tree in " + origin + ": " + e.getMessage(), e);
        }
        if (root == null || root.type().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(root);
    }

    public static class SyntaxTreeReadException extends RuntimeException {
        public SyntaxTreeReadException(String message) { super(message); }
        public SyntaxTreeReadException(String message, Throwable cause) { super(message, cause); }
    }
}
