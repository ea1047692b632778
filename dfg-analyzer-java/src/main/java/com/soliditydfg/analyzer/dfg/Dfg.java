package com.soliditydfg.analyzer.dfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Data-flow graph of one contract. Unmodifiable once constructed.
 *
 * <p>Edge endpoints are node ids of this graph or {@link SyntheticIds synthetic} ids.
 */
public final class Dfg {

    /** Metadata key of the unresolved reference list. */
    public static final String UNRESOLVED_REFERENCES = "unresolved_references";

    private final String contractName;
    private final String solidityVersion;
    private final Map<String, DfgNode> nodes;
    private final Map<String, DfgEdge> edges;
    private final String entryNodeId;
    private final Map<String, Object> metadata;

    public Dfg(String contractName, String solidityVersion,
               Map<String, DfgNode> nodes, Map<String, DfgEdge> edges,
               String entryNodeId, Map<String, Object> metadata) {
        this.contractName = contractName;
        this.solidityVersion = solidityVersion;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        this.entryNodeId = entryNodeId;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Collections.emptyMap();
    }

    public String getContractName()          { return contractName; }
    public String getSolidityVersion()       { return solidityVersion; }
    public Map<String, DfgNode> getNodes()   { return nodes; }
    public Map<String, DfgEdge> getEdges()   { return edges; }
    public Optional<String> getEntryNodeId() { return Optional.ofNullable(entryNodeId); }
    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Identifier reads that matched no definition, as {@code <scope>.<name>}. Empty when the
     * metadata carries none.
     */
    public List<String> getUnresolvedReferences() {
        Object value = metadata.get(UNRESOLVED_REFERENCES);
        if (!(value instanceof List<?> references)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(references.size());
        for (Object reference : references) {
            result.add(String.valueOf(reference));
        }
        return Collections.unmodifiableList(result);
    }

    public Optional<DfgNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<DfgEdge> getEdge(String id) {
        return Optional.ofNullable(edges.get(id));
    }

    public List<DfgNode> nodesOfType(String type) {
        return nodes.values().stream()
            .filter(n -> n.getType().equals(type))
            .collect(Collectors.toList());
    }

    public List<DfgEdge> edgesOfType(EdgeType type) {
        return edges.values().stream()
            .filter(e -> e.getType() == type)
            .collect(Collectors.toList());
    }

    public List<DfgEdge> getOutgoingEdges(String nodeId) {
        return edges.values().stream()
            .filter(e -> e.getSourceId().equals(nodeId))
            .collect(Collectors.toList());
    }

    public List<DfgEdge> getIncomingEdges(String nodeId) {
        return edges.values().stream()
            .filter(e -> e.getTargetId().equals(nodeId))
            .collect(Collectors.toList());
    }

    public List<DfgEdge> getDataDependencies(String nodeId) {
        return incomingOfType(nodeId, EdgeType.DATA_DEPENDENCY);
    }

    public List<DfgEdge> getControlDependencies(String nodeId) {
        return incomingOfType(nodeId, EdgeType.CONTROL_DEPENDENCY);
    }

    public List<DfgEdge> getFunctionCalls(String nodeId) {
        return getOutgoingEdges(nodeId).stream()
            .filter(e -> e.getType() == EdgeType.FUNCTION_CALL)
            .collect(Collectors.toList());
    }

    /**
     * Depth-first search from {@code startId} to {@code endId} along data-dependency edges.
     * Returns the node ids on the path, both ends included, or an empty list when
     * {@code endId} is unreachable.
     */
    public List<String> findDataFlowPath(String startId, String endId) {
        List<String> path = new ArrayList<>();
        if (findPath(startId, endId, new HashSet<>(), path)) {
            return path;
        }
        return Collections.emptyList();
    }

    private boolean findPath(String currentId, String endId, Set<String> visited, List<String> path) {
        path.add(currentId);
        if (currentId.equals(endId)) return true;
        if (visited.add(currentId)) {
            for (DfgEdge edge : getOutgoingEdges(currentId)) {
                if (edge.getType() == EdgeType.DATA_DEPENDENCY
                        && findPath(edge.getTargetId(), endId, visited, path)) {
                    return true;
                }
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    private List<DfgEdge> incomingOfType(String nodeId, EdgeType type) {
        return getIncomingEdges(nodeId).stream()
            .filter(e -> e.getType() == type)
            .collect(Collectors.toList());
    }
}
