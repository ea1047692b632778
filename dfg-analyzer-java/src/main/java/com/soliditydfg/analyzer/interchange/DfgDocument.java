package com.soliditydfg.analyzer.interchange;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import java.util.Map;

/**
 * POJOs matching the DFG interchange format.
 * Field names use @SerializedName for JSON snake_case mapping; null fields are omitted on write.
 */
public final class DfgDocument {

    private DfgDocument() {}

    public static class DfgRoot {
        @SerializedName("contract")         public String contract;
        @SerializedName("solidity_version") public String solidityVersion;
        @SerializedName("nodes")            public Map<String, DfgNodeEntry> nodes;
        @SerializedName("edges")            public Map<String, DfgEdgeEntry> edges;
        @SerializedName("metadata")         public Map<String, Object> metadata;
        @SerializedName("entry_node_id")    public String entryNodeId;      // nullable
    }

    public static class DfgNodeEntry {
        @SerializedName("id")              public String id;
        @SerializedName("type")            public String type;
        @SerializedName("name")            public String name;
        @SerializedName("data_type")       public String dataType;
        @SerializedName("scope")           public String scope;
        @SerializedName("source_location") public LocationEntry sourceLocation;
        @SerializedName("properties")      public Map<String, Object> properties;
        @SerializedName("text")            public String text;              // verbose only
        @SerializedName("ast_metadata")    public Map<String, Object> astMetadata;
    }

    public static class LocationEntry {
        @SerializedName("line")       public int line;
        @SerializedName("column")     public int column;
        @SerializedName("end_line")   public int endLine;
        @SerializedName("end_column") public int endColumn;
    }

    public static class DfgEdgeEntry {
        @SerializedName("id")         public String id;
        @SerializedName("source")     public String source;
        @SerializedName("target")     public String target;
        @SerializedName("type")       public String type;
        @SerializedName("label")      public String label;
        @SerializedName("weight")     public Integer weight;
        @SerializedName("properties") public Map<String, Object> properties;
    }

    /** Several contracts in one document. */
    public static class DfgBundle {
        @SerializedName("contracts") public Map<String, DfgRoot> contracts;
        @SerializedName("metadata")  public Map<String, Object> metadata;
    }

    public static class DfgSummary {
        @SerializedName("contract")         public String contract;
        @SerializedName("solidity_version") public String solidityVersion;
        @SerializedName("statistics")       public Statistics statistics;
        @SerializedName("node_types")       public Map<String, Integer> nodeTypes;
        @SerializedName("edge_types")       public Map<String, Integer> edgeTypes;
        @SerializedName("functions")        public List<SummaryEntry> functions;
        @SerializedName("state_variables")  public List<SummaryEntry> stateVariables;
    }

    public static class Statistics {
        @SerializedName("total_nodes") public int totalNodes;
        @SerializedName("total_edges") public int totalEdges;
        @SerializedName("entry_node")  public String entryNode;
    }

    public static class SummaryEntry {
        @SerializedName("name")      public String name;
        @SerializedName("scope")     public String scope;
        @SerializedName("data_type") public String dataType;
    }

    /** Batch report written when a whole directory of syntax trees is analyzed. */
    public static class AnalysisReport {
        @SerializedName("analysis_summary")  public ReportSummary analysisSummary;
        @SerializedName("output_directory")  public String outputDirectory;
        @SerializedName("detailed_results")  public List<FileResult> detailedResults;
        @SerializedName("statistics")        public ReportStatistics statistics;
        @SerializedName("generated_at")      public String generatedAt;
    }

    public static class ReportSummary {
        @SerializedName("total_files")         public int totalFiles;
        @SerializedName("successful_analyses") public int successfulAnalyses;
        @SerializedName("failed_analyses")     public int failedAnalyses;
        @SerializedName("success_rate")        public double successRate;
    }

    public static class FileResult {
        @SerializedName("file")                  public String file;
        @SerializedName("success")               public boolean success;
        @SerializedName("error")                 public String error;           // nullable
        @SerializedName("solidity_version")      public String solidityVersion;
        @SerializedName("ast_nodes")             public int astNodes;
        @SerializedName("contracts")             public List<String> contracts;
        @SerializedName("dfg_files")             public List<String> dfgFiles;
        @SerializedName("dfg_nodes")             public int dfgNodes;
        @SerializedName("dfg_edges")             public int dfgEdges;
        @SerializedName("filtered_nodes")        public int filteredNodes;
        @SerializedName("filtered_edges")        public int filteredEdges;
        @SerializedName("unresolved_references") public int unresolvedReferences;
        @SerializedName("warnings")              public List<String> warnings;
    }

    public static class ReportStatistics {
        @SerializedName("total_contracts")            public int totalContracts;
        @SerializedName("total_dfg_nodes")            public int totalDfgNodes;
        @SerializedName("total_dfg_edges")            public int totalDfgEdges;
        @SerializedName("average_nodes_per_contract") public double averageNodesPerContract;
        @SerializedName("average_edges_per_contract") public double averageEdgesPerContract;
        @SerializedName("analyzed_contracts")         public List<String> analyzedContracts;
    }
}
