package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.ast.AstBuilder;
import com.soliditydfg.analyzer.ast.AstNode;
import com.soliditydfg.analyzer.ast.AstTree;
import com.soliditydfg.analyzer.ast.ContractNode;
import com.soliditydfg.analyzer.dfg.Dfg;
import com.soliditydfg.analyzer.dfg.DfgBuilder;
import com.soliditydfg.analyzer.dfg.DfgPruner;
import com.soliditydfg.analyzer.dfg.PruneResult;
import com.soliditydfg.analyzer.filter.DfgConfig;
import com.soliditydfg.analyzer.legacy.Solidity04xAnnotator;
import com.soliditydfg.analyzer.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the full pipeline for one source unit: syntax tree to AST, legacy annotation for
 * 0.4.x sources, then one DFG per top-level contract.
 */
public class ContractAnalyzer {

    private final DfgConfig config;
    private final boolean prune;

    public ContractAnalyzer(DfgConfig config, boolean prune) {
        this.config = config;
        this.prune = prune;
    }

    public ContractAnalyzer() {
        this(DfgConfig.standard(), false);
    }

    public DfgConfig getConfig() {
        return config;
    }

    /**
     * @param fallbackName contract name used when the unit declares no named contract
     * @return empty when the syntax tree has no root
     */
    public Optional<AnalysisResult> analyze(SyntaxNode syntaxRoot, String fallbackName) {
        // 1. Build AST
        Optional<AstTree> built = new AstBuilder().build(syntaxRoot);
        if (built.isEmpty()) {
            return Optional.empty();
        }
        AstTree tree = built.get();

        // 2. Legacy annotation
        List<String> warnings = List.of();
        if (tree.getVersion().isLegacy()) {
            Solidity04xAnnotator annotator = new Solidity04xAnnotator();
            annotator.annotate(tree);
            warnings = annotator.getWarnings();
        }

        // 3. One DFG per contract; a unit without contracts is analyzed as a whole
        List<AstNode> units = new ArrayList<>(tree.topLevelContracts());
        if (units.isEmpty()) {
            units.add(tree.getRoot());
        }

        List<ContractAnalysis> contracts = new ArrayList<>();
        for (AstNode unit : units) {
            String name = unit instanceof ContractNode ? unit.getName().orElse(fallbackName) : fallbackName;
            contracts.add(analyzeUnit(unit, name, tree));
        }
        return Optional.of(new AnalysisResult(tree.getVersion(), tree.size(), contracts, warnings));
    }

    private ContractAnalysis analyzeUnit(AstNode unit, String name, AstTree tree) {
        Dfg dfg = new DfgBuilder(tree.getVersion().label()).build(unit, name)
            .orElseThrow(() -> new IllegalStateException("No DFG built for " + name));

        List<String> unresolved = dfg.getUnresolvedReferences();

        if (!prune) {
            return new ContractAnalysis(name, dfg, 0, 0, unresolved);
        }
        PruneResult pruned = DfgPruner.prune(dfg, config);
        return new ContractAnalysis(name, pruned.dfg(), pruned.filteredNodes(), pruned.filteredEdges(), unresolved);
    }
}
