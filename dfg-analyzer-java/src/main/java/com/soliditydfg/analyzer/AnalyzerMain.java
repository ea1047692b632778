package com.soliditydfg.analyzer;

import com.soliditydfg.analyzer.config.DfgConfigReader;
import com.soliditydfg.analyzer.filter.DfgConfig;
import com.soliditydfg.analyzer.filter.OutputMode;
import com.soliditydfg.analyzer.interchange.DfgDocument;
import com.soliditydfg.analyzer.interchange.DfgSerializer;
import com.soliditydfg.analyzer.syntax.SyntaxNode;
import com.soliditydfg.analyzer.syntax.SyntaxTreeReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for the dfg-analyzer command line.
 *
 * A directory input writes each file's DFGs under {@code dfgs/<file-stem>/} so that
 * contracts declared in several files do not overwrite each other.
 *
 * Usage:
 *   java -jar dfg-analyzer-java.jar analyze \
 *     --syntax-tree <tree.json | dir>  \
 *     --output      <output-dir>       \
 *     [--mode compact|standard|verbose] [--config <config.json>] \
 *     [--contract <fallback-name>] [--prune] [--no-summary]
 */
public class AnalyzerMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[dfg-analyzer] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar dfg-analyzer-java.jar analyze " +
                               "--syntax-tree <file|dir> --output <dir> [--mode <mode>] [--config <file>] " +
                               "[--contract <name>] [--prune] [--no-summary]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[dfg-analyzer] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String treePath = null;
        String outputDir = null;
        String mode = null;
        String configPath = null;
        String fallbackName = null;
        boolean prune = false;
        boolean summary = true;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--syntax-tree" -> treePath     = requireNext(args, i++, "--syntax-tree");
                case "--output"      -> outputDir    = requireNext(args, i++, "--output");
                case "--mode"        -> mode         = requireNext(args, i++, "--mode");
                case "--config"      -> configPath   = requireNext(args, i++, "--config");
                case "--contract"    -> fallbackName = requireNext(args, i++, "--contract");
                case "--prune"       -> prune = true;
                case "--no-summary"  -> summary = false;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (treePath == null)  throw new UsageException("--syntax-tree is required");
        if (outputDir == null) throw new UsageException("--output is required");
        if (mode != null && configPath != null) {
            throw new UsageException("--mode and --config are mutually exclusive");
        }

        Path input  = Paths.get(treePath);
        Path output = Paths.get(outputDir);

        // 1. Resolve configuration
        DfgConfig config;
        if (configPath != null) {
            System.err.println("[dfg-analyzer] Reading config: " + configPath);
            config = new DfgConfigReader().read(Paths.get(configPath));
        } else if (mode != null) {
            final String requested = mode;
            OutputMode outputMode = OutputMode.fromValue(requested)
                .filter(m -> m != OutputMode.CUSTOM)
                .orElseThrow(() -> new UsageException("Unknown --mode: " + requested));
            config = DfgConfig.forMode(outputMode);
        } else {
            config = DfgConfig.standard();
        }
        System.err.println("[dfg-analyzer] Using " + config);

        ContractAnalyzer analyzer = new ContractAnalyzer(config, prune);
        DfgSerializer serializer = new DfgSerializer(config);

        // 2. Analyze a single tree or every tree in a directory
        if (Files.isDirectory(input)) {
            List<Path> trees = listTrees(input);
            System.err.println("[dfg-analyzer] Analyzing " + trees.size() + " syntax trees in: " + input);
            List<DfgDocument.FileResult> results = new ArrayList<>();
            Set<String> usedDirs = new HashSet<>();
            for (Path tree : trees) {
                Path dfgDir = output.resolve("dfgs").resolve(uniqueDirName(stemOf(tree), usedDirs));
                results.add(analyzeFile(tree, fallbackName, dfgDir, analyzer, serializer, summary, true));
            }
            serializer.writeReport(buildReport(results, output), output.resolve("analysis_report.json"));
        } else {
            analyzeFile(input, fallbackName, output.resolve("dfgs"), analyzer, serializer, summary, false);
        }

        System.err.println("[dfg-analyzer] Done.");
    }

    /**
     * Analyzes one syntax tree file and writes its DFGs into {@code dfgDir}. In batch mode an
     * unreadable or empty tree is recorded as a failed result; otherwise it is fatal.
     */
    static DfgDocument.FileResult analyzeFile(Path tree, String fallbackName, Path dfgDir,
                                              ContractAnalyzer analyzer, DfgSerializer serializer,
                                              boolean summary, boolean batch) {
        var result = new DfgDocument.FileResult();
        result.file = tree.toString();
        result.contracts = new ArrayList<>();
        result.dfgFiles = new ArrayList<>();

        Optional<SyntaxNode> root;
        try {
            root = new SyntaxTreeReader().read(tree);
        } catch (SyntaxTreeReader.SyntaxTreeReadException e) {
            if (!batch) throw e;
            System.err.println("[dfg-analyzer] WARNING: skipping " + tree + ": " + e.getMessage());
            result.error = e.getMessage();
            return result;
        }

        String name = fallbackName != null ? fallbackName : stemOf(tree);
        Optional<AnalysisResult> analyzed = root.flatMap(r -> analyzer.analyze(r, name));
        if (analyzed.isEmpty()) {
            String message = "Syntax tree has no root: " + tree;
            if (!batch) throw new IllegalStateException(message);
            System.err.println("[dfg-analyzer] WARNING: " + message);
            result.error = message;
            return result;
        }

        AnalysisResult analysis = analyzed.get();
        System.err.println("[dfg-analyzer] Solidity " + analysis.version().label() + ", "
                + analysis.astNodeCount() + " AST nodes: " + tree);
        for (String warning : analysis.warnings()) {
            System.err.println("[dfg-analyzer] WARNING: " + warning);
        }

        for (ContractAnalysis contract : analysis.contracts()) {
            System.err.println("[dfg-analyzer] Contract " + contract.contractName() + ": "
                    + contract.dfg().getNodes().size() + " nodes, "
                    + contract.dfg().getEdges().size() + " edges, "
                    + contract.unresolvedReferences().size() + " unresolved references");
            Path dfgFile = dfgDir.resolve(contract.contractName() + "_dfg.json");
            serializer.write(contract.dfg(), dfgFile);
            if (summary) {
                serializer.exportSummary(contract.dfg(), dfgDir.resolve(contract.contractName() + "_summary.json"));
            }
            result.contracts.add(contract.contractName());
            result.dfgFiles.add(dfgFile.toString());
            result.dfgNodes += contract.dfg().getNodes().size();
            result.dfgEdges += contract.dfg().getEdges().size();
            result.filteredNodes += contract.filteredNodes();
            result.filteredEdges += contract.filteredEdges();
            result.unresolvedReferences += contract.unresolvedReferences().size();
        }

        result.success = true;
        result.solidityVersion = analysis.version().label();
        result.astNodes = analysis.astNodeCount();
        result.warnings = analysis.warnings();
        return result;
    }

    static DfgDocument.AnalysisReport buildReport(List<DfgDocument.FileResult> results, Path output) {
        var report = new DfgDocument.AnalysisReport();

        var summary = new DfgDocument.ReportSummary();
        summary.totalFiles = results.size();
        summary.successfulAnalyses = (int) results.stream().filter(r -> r.success).count();
        summary.failedAnalyses = summary.totalFiles - summary.successfulAnalyses;
        summary.successRate = (double) summary.successfulAnalyses / Math.max(summary.totalFiles, 1);
        report.analysisSummary = summary;

        var stats = new DfgDocument.ReportStatistics();
        stats.analyzedContracts = results.stream()
            .filter(r -> r.success)
            .flatMap(r -> r.contracts.stream())
            .collect(Collectors.toList());
        stats.totalContracts = stats.analyzedContracts.size();
        stats.totalDfgNodes = results.stream().filter(r -> r.success).mapToInt(r -> r.dfgNodes).sum();
        stats.totalDfgEdges = results.stream().filter(r -> r.success).mapToInt(r -> r.dfgEdges).sum();
        stats.averageNodesPerContract = (double) stats.totalDfgNodes / Math.max(stats.totalContracts, 1);
        stats.averageEdgesPerContract = (double) stats.totalDfgEdges / Math.max(stats.totalContracts, 1);
        report.statistics = stats;

        report.outputDirectory = output.toString();
        report.detailedResults = results;
        report.generatedAt = Instant.now().toString();
        return report;
    }

    private static List<Path> listTrees(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".json"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list syntax trees in " + dir + ": " + e.getMessage(), e);
        }
    }

    /** Per-file output directory name; a stem seen before gets a numeric suffix. */
    static String uniqueDirName(String stem, Set<String> used) {
        String name = stem;
        for (int i = 2; !used.add(name); i++) {
            name = stem + "_" + i;
        }
        return name;
    }

    /** {@code Token.sol.json} and {@code Token.json} both give {@code Token}. */
    static String stemOf(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(".json")) name = name.substring(0, name.length() - ".json".length());
        if (name.endsWith(".sol")) name = name.substring(0, name.length() - ".sol".length());
        return name.isEmpty() ? "Unknown" : name;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
