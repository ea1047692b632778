package com.soliditydfg.analyzer.dfg;

import com.soliditydfg.analyzer.filter.DfgConfig;
import com.soliditydfg.analyzer.filter.NodeClassifier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Removes nodes the configuration does not keep, and every edge that leaves or enters a
 * removed node. Edges to synthetic ids survive as long as their source does.
 */
public final class DfgPruner {

    private DfgPruner() {}

    public static PruneResult prune(Dfg dfg, DfgConfig config) {
        Map<String, DfgNode> keptNodes = new LinkedHashMap<>();
        for (DfgNode node : dfg.getNodes().values()) {
            if (NodeClassifier.shouldKeep(node.getType(), node.getName().orElse(""),
                    node.getAstNode().getText(), config)) {
                keptNodes.put(node.getId(), node);
            }
        }

        Map<String, DfgEdge> keptEdges = new LinkedHashMap<>();
        for (DfgEdge edge : dfg.getEdges().values()) {
            boolean targetKept = keptNodes.containsKey(edge.getTargetId())
                || SyntheticIds.isSynthetic(edge.getTargetId());
            if (keptNodes.containsKey(edge.getSourceId()) && targetKept) {
                keptEdges.put(edge.getId(), edge);
            }
        }

        int filteredNodes = dfg.getNodes().size() - keptNodes.size();
        int filteredEdges = dfg.getEdges().size() - keptEdges.size();

        Map<String, Object> metadata = new LinkedHashMap<>(dfg.getMetadata());
        metadata.put("output_mode", config.getOutputMode().value());
        metadata.put("filtered_nodes", filteredNodes);
        metadata.put("filtered_edges", filteredEdges);

        String entry = dfg.getEntryNodeId().filter(keptNodes::containsKey).orElse(null);
        Dfg pruned = new Dfg(dfg.getContractName(), dfg.getSolidityVersion(), keptNodes, keptEdges, entry, metadata);
        return new PruneResult(pruned, keptNodes.size(), filteredNodes, keptEdges.size(), filteredEdges);
    }
}
