package com.soliditydfg.analyzer.dfg;

/**
 * Outcome of {@link DfgPruner#prune}. Kept plus filtered counts equal the input totals.
 */
public record PruneResult(Dfg dfg, int keptNodes, int filteredNodes, int keptEdges, int filteredEdges) {

    public int totalNodes() {
        return keptNodes + filteredNodes;
    }

    public int totalEdges() {
        return keptEdges + filteredEdges;
    }
}
