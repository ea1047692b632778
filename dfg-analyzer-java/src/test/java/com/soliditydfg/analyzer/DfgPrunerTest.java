package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.ast.AstBuilder;
import com.soliditydfg.analyzer.ast.AstTree;
import com.soliditydfg.analyzer.dfg.Dfg;
import com.soliditydfg.analyzer.dfg.DfgBuilder;
import com.soliditydfg.analyzer.dfg.DfgEdge;
import com.soliditydfg.analyzer.dfg.DfgPruner;
import com.soliditydfg.analyzer.dfg.PruneResult;
import com.soliditydfg.analyzer.dfg.SyntheticIds;
import com.soliditydfg.analyzer.filter.DfgConfig;
import com.soliditydfg.analyzer.filter.NodePriority;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.soliditydfg.analyzer.SyntaxTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class DfgPrunerTest {

    private static Dfg full;

    @BeforeAll
    static void buildGraph() {
        AstTree tree = new AstBuilder().build(sourceFile(contractIs("Bank", List.of("Ownable"),
            stateVar("uint", "total", leaf("visibility", "public")),
            function("add", params(param("uint", "amount")), List.of(leaf("visibility", "public")),
                localVar("uint", "fee", number("1")),
                exprStatement(assign("total", binary(identExpr("amount"), "-", identExpr("fee")))))))).orElseThrow();
        full = new DfgBuilder("0.4.x").build(tree.topLevelContracts().get(0), "Bank").orElseThrow();
    }

    @Test
    void countsAddUpToTotals() {
        for (DfgConfig config : List.of(DfgConfig.compact(), DfgConfig.standard(), DfgConfig.verbose())) {
            PruneResult result = DfgPruner.prune(full, config);
            assertEquals(full.getNodes().size(), result.totalNodes());
            assertEquals(full.getEdges().size(), result.totalEdges());
            assertEquals(result.keptNodes(), result.dfg().getNodes().size());
            assertEquals(result.keptEdges(), result.dfg().getEdges().size());
        }
    }

    @Test
    void compactKeepsOnlyCriticalNodes() {
        PruneResult result = DfgPruner.prune(full, DfgConfig.compact());
        Set<String> types = new java.util.HashSet<>();
        result.dfg().getNodes().values().forEach(n -> types.add(n.getType()));
        assertEquals(Set.of("contract", "state_variable", "function"), types);
        assertTrue(result.filteredNodes() > 0);
    }

    @Test
    void keptEdgesHaveKeptOrSyntheticEndpoints() {
        Dfg pruned = DfgPruner.prune(full, DfgConfig.standard()).dfg();
        for (DfgEdge edge : pruned.getEdges().values()) {
            assertTrue(pruned.getNodes().containsKey(edge.getSourceId()));
            assertTrue(pruned.getNodes().containsKey(edge.getTargetId())
                || SyntheticIds.isSynthetic(edge.getTargetId()), "Dangling: " + edge);
        }
    }

    @Test
    void syntheticBaseEdgeSurvivesWithItsSource() {
        Dfg pruned = DfgPruner.prune(full, DfgConfig.compact()).dfg();
        assertTrue(pruned.getEdges().values().stream()
            .anyMatch(e -> e.getTargetId().equals(SyntheticIds.forBaseContract("Ownable"))));
    }

    @Test
    void entryNodeDroppedWhenFiltered() {
        DfgConfig noContracts = DfgConfig.custom().skipNodeTypes(Set.of("contract")).build();
        Dfg pruned = DfgPruner.prune(full, noContracts).dfg();
        assertTrue(pruned.getEntryNodeId().isEmpty());
        assertEquals(full.getEntryNodeId(), DfgPruner.prune(full, DfgConfig.standard()).dfg().getEntryNodeId());
    }

    @Test
    void metadataRecordsFilterCounts() {
        PruneResult result = DfgPruner.prune(full, DfgConfig.standard());
        assertEquals("standard", result.dfg().getMetadata().get("output_mode"));
        assertEquals(result.filteredNodes(), result.dfg().getMetadata().get("filtered_nodes"));
        assertEquals(full.getMetadata().get("function_count"), result.dfg().getMetadata().get("function_count"));
    }

    @Test
    void keepEverythingIsIdentity() {
        DfgConfig all = DfgConfig.custom()
            .minNodePriority(NodePriority.DISCARD)
            .skipKeywords(false).skipTypeNames(false).skipOperators(false).skipPunctuation(false)
            .build();
        PruneResult result = DfgPruner.prune(full, all);
        assertEquals(0, result.filteredNodes());
        assertEquals(0, result.filteredEdges());
    }
}
