package com.soliditydfg.analyzer.dfg;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class DfgEdge {

    public static final int DEFAULT_WEIGHT = 1;

    private final String id;
    private final String sourceId;
    private final String targetId;
    private final EdgeType type;
    private final String label;
    private final int weight;
    private final Map<String, Object> properties;

    public DfgEdge(String id, String sourceId, String targetId, EdgeType type,
                   String label, int weight, Map<String, Object> properties) {
        this.id = id;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.type = type;
        this.label = label;
        this.weight = weight;
        this.properties = properties != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
            : Collections.emptyMap();
    }

    public DfgEdge(String id, String sourceId, String targetId, EdgeType type, Map<String, Object> properties) {
        this(id, sourceId, targetId, type, null, DEFAULT_WEIGHT, properties);
    }

    public String getId()               { return id; }
    public String getSourceId()         { return sourceId; }
    public String getTargetId()         { return targetId; }
    public EdgeType getType()           { return type; }
    public Optional<String> getLabel()  { return Optional.ofNullable(label); }
    public int getWeight()              { return weight; }
    public Map<String, Object> getProperties() { return properties; }

    @Override
    public String toString() {
        return "DfgEdge[" + id + " " + sourceId + " -" + type.value() + "-> " + targetId + "]";
    }
}
