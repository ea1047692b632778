package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.ast.SolidityVersion;

import java.util.List;

/**
 * Aggregate output of analyzing one source unit.
 */
public record AnalysisResult(
        SolidityVersion version,
        int astNodeCount,
        List<ContractAnalysis> contracts,
        List<String> warnings
) {
    public int totalNodes() {
        return contracts.stream().mapToInt(c -> c.dfg().getNodes().size()).sum();
    }

    public int totalEdges() {
        return contracts.stream().mapToInt(c -> c.dfg().getEdges().size()).sum();
    }
}
