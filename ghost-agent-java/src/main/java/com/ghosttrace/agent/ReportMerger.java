package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import com.ghosttrace.analyzer.report.CfgReportBuilder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins a {@link MonitorReport}'s CFGs and traced variables into one {@link GhostReport}.
 *
 * A traced function matches a CFG when its qualified name, or its simple method name, equals a
 * module name or a CFG name. Unmatched functions are kept and listed with a warning.
 */
public class ReportMerger {

    public GhostReport merge(MonitorReport report) {
        GhostReport out = new GhostReport();
        out.reportVersion = CfgReportBuilder.REPORT_VERSION;
        out.modules = new CfgReportBuilder().modules(report.cfgs());
        out.variables = new ArrayList<>();
        out.unmatchedFunctions = new ArrayList<>();
        out.pollCount = report.pollCount();
        out.cancelled = report.cancelled();
        out.error = report.error() == null ? null : describe(report.error());

        Set<String> cfgNames = cfgNames(report.cfgs());
        for (Map.Entry<String, Map<String, String>> fn : report.finalSnapshot().values().entrySet()) {
            GhostReport.TracedFunction traced = new GhostReport.TracedFunction();
            traced.function = fn.getKey();
            traced.values = new LinkedHashMap<>(fn.getValue());
            out.variables.add(traced);

            if (!cfgNames.contains(fn.getKey()) && !cfgNames.contains(simpleName(fn.getKey()))) {
                out.unmatchedFunctions.add(fn.getKey());
            }
        }
        if (!out.unmatchedFunctions.isEmpty() && !report.cfgs().isEmpty()) {
            System.err.println("[ghost-agent] WARNING: " + out.unmatchedFunctions.size()
                + " traced function(s) have no CFG: " + out.unmatchedFunctions);
        }
        return out;
    }

    static String simpleName(String function) {
        int dot = function.lastIndexOf('.');
        return dot >= 0 ? function.substring(dot + 1) : function;
    }

    private static Set<String> cfgNames(Map<String, ControlFlowGraph> cfgs) {
        Set<String> names = new HashSet<>(cfgs.keySet());
        for (ControlFlowGraph cfg : cfgs.values()) {
            names.add(cfg.name());
        }
        return names;
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null
            ? error.getClass().getName()
            : error.getClass().getName() + ": " + error.getMessage();
    }
}
