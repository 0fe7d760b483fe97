package com.ghosttrace.analyzer;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.util.Map;

/**
 * Aggregate result of analyzing several modules: the CFGs that built and the modules that
 * failed, each with the error that stopped it.
 */
public record AnalysisResult(
    Map<String, ControlFlowGraph> cfgs,
    Map<String, String> failures
) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
