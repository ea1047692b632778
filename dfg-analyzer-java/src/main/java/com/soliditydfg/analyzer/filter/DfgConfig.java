package com.soliditydfg.analyzer.filter;

import java.util.Set;

/**
 * Immutable filtering and output options. Obtain one from a preset or from
 * {@link #custom()} / {@link #builder(OutputMode)}.
 *
 * <pre>
 *   mode      min priority  skip vocab  skip literals  text/ast metadata
 *   compact   critical      on          on             off/off
 *   standard  important     on          off            off/off
 *   verbose   auxiliary     off         off            on/on
 * </pre>
 */
public final class DfgConfig {

    public static final int DEFAULT_TEXT_MAX_LENGTH = 100;

    private final OutputMode outputMode;
    private final NodePriority minNodePriority;
    private final boolean skipKeywords;
    private final boolean skipTypeNames;
    private final boolean skipOperators;
    private final boolean skipPunctuation;
    private final boolean skipLiteralNodes;
    private final Set<String> includeNodeTypes;
    private final Set<String> skipNodeTypes;
    private final boolean includeNodeText;
    private final boolean includeAstMetadata;
    private final int textMaxLength;
    private final boolean storeSourceLocation;

    private DfgConfig(Builder b) {
        this.outputMode = b.outputMode;
        this.minNodePriority = b.minNodePriority;
        this.skipKeywords = b.skipKeywords;
        this.skipTypeNames = b.skipTypeNames;
        this.skipOperators = b.skipOperators;
        this.skipPunctuation = b.skipPunctuation;
        this.skipLiteralNodes = b.skipLiteralNodes;
        this.includeNodeTypes = Set.copyOf(b.includeNodeTypes);
        this.skipNodeTypes = Set.copyOf(b.skipNodeTypes);
        this.includeNodeText = b.includeNodeText;
        this.includeAstMetadata = b.includeAstMetadata;
        this.textMaxLength = b.textMaxLength;
        this.storeSourceLocation = b.storeSourceLocation;
    }

    public static DfgConfig compact()  { return builder(OutputMode.COMPACT).build(); }
    public static DfgConfig standard() { return builder(OutputMode.STANDARD).build(); }
    public static DfgConfig verbose()  { return builder(OutputMode.VERBOSE).build(); }

    /** Builder in {@link OutputMode#CUSTOM} mode, seeded with the standard values. */
    public static Builder custom() {
        return builder(OutputMode.CUSTOM);
    }

    public static DfgConfig forMode(OutputMode mode) {
        return builder(mode).build();
    }

    /** Builder seeded with the preset of {@code mode}; custom starts from standard. */
    public static Builder builder(OutputMode mode) {
        Builder b = new Builder();
        b.outputMode = mode;
        switch (mode) {
            case COMPACT -> {
                b.minNodePriority = NodePriority.CRITICAL;
                b.skipLiteralNodes = true;
            }
            case VERBOSE -> {
                b.minNodePriority = NodePriority.AUXILIARY;
                b.skipKeywords = false;
                b.skipTypeNames = false;
                b.skipOperators = false;
                b.skipPunctuation = false;
                b.includeNodeText = true;
                b.includeAstMetadata = true;
            }
            case STANDARD, CUSTOM -> { }
        }
        return b;
    }

    public OutputMode getOutputMode()        { return outputMode; }
    public NodePriority getMinNodePriority() { return minNodePriority; }
    public boolean isSkipKeywords()          { return skipKeywords; }
    public boolean isSkipTypeNames()         { return skipTypeNames; }
    public boolean isSkipOperators()         { return skipOperators; }
    public boolean isSkipPunctuation()       { return skipPunctuation; }
    public boolean isSkipLiteralNodes()      { return skipLiteralNodes; }
    public Set<String> getIncludeNodeTypes() { return includeNodeTypes; }
    public Set<String> getSkipNodeTypes()    { return skipNodeTypes; }
    public boolean isIncludeNodeText()       { return includeNodeText; }
    public boolean isIncludeAstMetadata()    { return includeAstMetadata; }
    /** Maximum serialized text length; zero or negative disables truncation. */
    public int getTextMaxLength()            { return textMaxLength; }
    public boolean isStoreSourceLocation()   { return storeSourceLocation; }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.outputMode = outputMode;
        b.minNodePriority = minNodePriority;
        b.skipKeywords = skipKeywords;
        b.skipTypeNames = skipTypeNames;
        b.skipOperators = skipOperators;
        b.skipPunctuation = skipPunctuation;
        b.skipLiteralNodes = skipLiteralNodes;
        b.includeNodeTypes = includeNodeTypes;
        b.skipNodeTypes = skipNodeTypes;
        b.includeNodeText = includeNodeText;
        b.includeAstMetadata = includeAstMetadata;
        b.textMaxLength = textMaxLength;
        b.storeSourceLocation = storeSourceLocation;
        return b;
    }

    @Override
    public String toString() {
        return "DfgConfig[mode=" + outputMode.value() + ", minPriority=" + minNodePriority.value()
            + ", skipLiterals=" + skipLiteralNodes + ", text=" + includeNodeText + "]";
    }

    public static final class Builder {
        private OutputMode outputMode = OutputMode.STANDARD;
        private NodePriority minNodePriority = NodePriority.IMPORTANT;
        private boolean skipKeywords = true;
        private boolean skipTypeNames = true;
        private boolean skipOperators = true;
        private boolean skipPunctuation = true;
        private boolean skipLiteralNodes = false;
        private Set<String> includeNodeTypes = Set.of();
        private Set<String> skipNodeTypes = Set.of();
        private boolean includeNodeText = false;
        private boolean includeAstMetadata = false;
        private int textMaxLength = DEFAULT_TEXT_MAX_LENGTH;
        private boolean storeSourceLocation = true;

        private Builder() {}

        public Builder minNodePriority(NodePriority v) { this.minNodePriority = v; return this; }
        public Builder skipKeywords(boolean v)         { this.skipKeywords = v; return this; }
        public Builder skipTypeNames(boolean v)        { this.skipTypeNames = v; return this; }
        public Builder skipOperators(boolean v)        { this.skipOperators = v; return this; }
        public Builder skipPunctuation(boolean v)      { this.skipPunctuation = v; return this; }
        public Builder skipLiteralNodes(boolean v)     { this.skipLiteralNodes = v; return this; }
        public Builder includeNodeTypes(Set<String> v) { this.includeNodeTypes = v != null ? v : Set.of(); return this; }
        public Builder skipNodeTypes(Set<String> v)    { this.skipNodeTypes = v != null ? v : Set.of(); return this; }
        public Builder includeNodeText(boolean v)      { this.includeNodeText = v; return this; }
        public Builder includeAstMetadata(boolean v)   { this.includeAstMetadata = v; return this; }
        public Builder textMaxLength(int v)            { this.textMaxLength = v; return this; }
        public Builder storeSourceLocation(boolean v)  { this.storeSourceLocation = v; return this; }

        public DfgConfig build() {
            if (minNodePriority == null) {
                throw new IllegalArgumentException("minNodePriority must not be null");
            }
            return new DfgConfig(this);
        }
    }
}
