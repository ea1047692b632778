package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.dfg.Dfg;

import java.util.List;

/**
 * DFG of one contract, after pruning when pruning was requested.
 */
public record ContractAnalysis(
        String contractName,
        Dfg dfg,
        int filteredNodes,
        int filteredEdges,
        List<String> unresolvedReferences
) {}
