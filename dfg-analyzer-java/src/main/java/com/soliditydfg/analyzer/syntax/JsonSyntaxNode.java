package com.soliditydfg.analyzer.syntax;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of one node in the syntax tree JSON dump.
 * Missing fields read as empty text, no children and the origin point.
 */
public class JsonSyntaxNode implements SyntaxNode {

    @SerializedName("type")        private String type;
    @SerializedName("text")        private String text;
    @SerializedName("start_point") private SyntaxPoint startPoint;
    @SerializedName("end_point")   private SyntaxPoint endPoint;
    @SerializedName("children")    private List<JsonSyntaxNode> children;

    @Override public String type()                  { return type != null ? type : ""; }
    @Override public String text()                  { return text != null ? text : ""; }
    @Override public SyntaxPoint startPoint()       { return startPoint != null ? startPoint : SyntaxPoint.ORIGIN; }
    @Override public SyntaxPoint endPoint()         { return endPoint != null ? endPoint : startPoint(); }
    @Override public List<JsonSyntaxNode> children() { return children != null ? children : Collections.emptyList(); }
}
