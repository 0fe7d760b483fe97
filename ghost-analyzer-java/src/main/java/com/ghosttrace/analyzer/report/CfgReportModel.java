package com.ghosttrace.analyzer.report;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs for cfg_report.json.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class CfgReportModel {

    private CfgReportModel() {}

    public static class CfgReportRoot {
        @SerializedName("report_version")   public String reportVersion;
        @SerializedName("analyzer_version") public String analyzerVersion;
        @SerializedName("modules")          public List<CfgModule> modules;
        @SerializedName("failures")         public List<ModuleFailure> failures;
    }

    public static class CfgModule {
        @SerializedName("name")       public String name;
        @SerializedName("blocks")     public List<CfgBlock> blocks;
        @SerializedName("edges")      public List<CfgEdge> edges;
        @SerializedName("unresolved") public List<CfgUnresolved> unresolved;
    }

    public static class CfgBlock {
        @SerializedName("id")           public int id;
        @SerializedName("start_offset") public int startOffset;
        @SerializedName("end_offset")   public int endOffset;
        @SerializedName("lines")        public List<Integer> lines;
        @SerializedName("exec_count")   public long execCount;
        @SerializedName("instructions") public List<String> instructions;
    }

    public static class CfgEdge {
        @SerializedName("source")    public int source;
        @SerializedName("target")    public int target;
        @SerializedName("kind")      public String kind;      // fallthrough, branch, jump, loop_body, loop_exit
        @SerializedName("hit_count") public long hitCount;
    }

    public static class CfgUnresolved {
        @SerializedName("block_id")           public int blockId;
        @SerializedName("instruction_offset") public int instructionOffset;
        @SerializedName("target_offset")      public int targetOffset;
        @SerializedName("kind")               public String kind;
    }

    public static class ModuleFailure {
        @SerializedName("module") public String module;
        @SerializedName("error")  public String error;
    }
}
