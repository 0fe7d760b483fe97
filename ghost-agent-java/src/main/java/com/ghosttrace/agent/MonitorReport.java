package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import com.ghosttrace.analyzer.render.CfgRenderer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final output of a monitoring session.
 *
 * @param cfgs          published CFGs by module name; empty if none were published
 * @param finalSnapshot variables at the end of the run
 * @param pollCount     snapshots taken while the program ran
 * @param error         the program's terminal error, or null
 * @param cancelled     true when the monitor was stopped through {@link GhostMonitor#cancel()}
 */
public record MonitorReport(
    Map<String, ControlFlowGraph> cfgs,
    TraceSnapshot finalSnapshot,
    int pollCount,
    Throwable error,
    boolean cancelled
) {

    public MonitorReport {
        cfgs = Collections.unmodifiableMap(new LinkedHashMap<>(cfgs));
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ControlFlowGraph> e : cfgs.entrySet()) {
            sb.append("CFG ").append(e.getKey()).append(":\n")
              .append(CfgRenderer.render(e.getValue())).append('\n');
        }
        sb.append("Variables:\n").append(TraceRenderer.render(finalSnapshot)).append('\n');
        sb.append("Polls: ").append(pollCount);
        if (error != null) {
            sb.append("\nError: ").append(error.getClass().getName());
            if (error.getMessage() != null) sb.append(": ").append(error.getMessage());
        }
        if (cancelled) sb.append("\nCancelled");
        return sb.toString();
    }
}
