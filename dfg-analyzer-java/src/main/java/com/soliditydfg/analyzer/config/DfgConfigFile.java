package com.soliditydfg.analyzer.config;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of a DFG configuration file. Every field is optional; an absent
 * field keeps the value of the {@code output_mode} preset.
 */
public class DfgConfigFile {

    /** One of compact, standard, verbose, custom (default: standard). */
    @SerializedName("output_mode")
    private String outputMode;

    /** One of critical, important, auxiliary, discard. */
    @SerializedName("min_node_priority")
    private String minNodePriority;

    @SerializedName("skip_keywords")
    private Boolean skipKeywords;

    @SerializedName("skip_type_names")
    private Boolean skipTypeNames;

    @SerializedName("skip_operators")
    private Boolean skipOperators;

    @SerializedName("skip_punctuation")
    private Boolean skipPunctuation;

    @SerializedName("skip_literal_nodes")
    private Boolean skipLiteralNodes;

    @SerializedName("include_node_types")
    private List<String> includeNodeTypes;

    @SerializedName("skip_node_types")
    private List<String> skipNodeTypes;

    @SerializedName("include_node_text")
    private Boolean includeNodeText;

    @SerializedName("include_ast_metadata")
    private Boolean includeAstMetadata;

    @SerializedName("text_max_length")
    private Integer textMaxLength;

    @SerializedName("store_source_location")
    private Boolean storeSourceLocation;

    public String getOutputMode()       { return outputMode != null ? outputMode : "standard"; }
    public String getMinNodePriority()  { return minNodePriority; }
    public Boolean getSkipKeywords()    { return skipKeywords; }
    public Boolean getSkipTypeNames()   { return skipTypeNames; }
    public Boolean getSkipOperators()   { return skipOperators; }
    public Boolean getSkipPunctuation() { return skipPunctuation; }
    public Boolean getSkipLiteralNodes() { return skipLiteralNodes; }
    public List<String> getIncludeNodeTypes() { return includeNodeTypes != null ? includeNodeTypes : Collections.emptyList(); }
    public List<String> getSkipNodeTypes()    { return skipNodeTypes    != null ? skipNodeTypes    : Collections.emptyList(); }
    public Boolean getIncludeNodeText()       { return includeNodeText; }
    public Boolean getIncludeAstMetadata()    { return includeAstMetadata; }
    public Integer getTextMaxLength()         { return textMaxLength; }
    public Boolean getStoreSourceLocation()   { return storeSourceLocation; }
}
