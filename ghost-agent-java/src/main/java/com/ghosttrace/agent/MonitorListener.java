package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.util.Map;

/**
 * Callbacks from the monitor thread. All methods default to no-ops.
 */
public interface MonitorListener {

    default void onCfgsPublished(Map<String, ControlFlowGraph> cfgs) {}

    default void onPoll(int pollNumber, TraceSnapshot snapshot) {}

    default void onReport(MonitorReport report) {}
}
