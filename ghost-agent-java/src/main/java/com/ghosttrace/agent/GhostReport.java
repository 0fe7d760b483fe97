package com.ghosttrace.agent;

import com.ghosttrace.analyzer.report.CfgReportModel;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * POJO written to ghost_report.json by {@link GhostReportWriter}.
 * CFG modules reuse the analyzer's cfg_report.json shape.
 */
public class GhostReport {

    @SerializedName("report_version")
    public String reportVersion;

    @SerializedName("modules")
    public List<CfgReportModel.CfgModule> modules;

    @SerializedName("variables")
    public List<TracedFunction> variables;

    /** Traced functions no published CFG is named after. */
    @SerializedName("unmatched_functions")
    public List<String> unmatchedFunctions;

    @SerializedName("poll_count")
    public int pollCount;

    @SerializedName("cancelled")
    public boolean cancelled;

    @SerializedName("error")
    public String error;

    public static class TracedFunction {
        @SerializedName("function") public String function;
        @SerializedName("values")   public Map<String, String> values;
    }
}
