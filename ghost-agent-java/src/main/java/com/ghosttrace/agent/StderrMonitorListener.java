package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import com.ghosttrace.analyzer.render.CfgRenderer;

import java.util.Map;

/**
 * Prints monitor progress to stderr with the {@code [ghost-monitor]} prefix.
 */
public class StderrMonitorListener implements MonitorListener {

    private static final String PREFIX = "[ghost-monitor] ";

    @Override
    public void onCfgsPublished(Map<String, ControlFlowGraph> cfgs) {
        System.err.println(PREFIX + "CFGs published for " + cfgs.size() + " module(s): " + cfgs.keySet());
        for (Map.Entry<String, ControlFlowGraph> module : cfgs.entrySet()) {
            System.err.println(describe(module.getKey(), module.getValue()));
        }
    }

    @Override
    public void onPoll(int pollNumber, TraceSnapshot snapshot) {
        System.err.println(PREFIX + "poll " + pollNumber + ": " + indent(TraceRenderer.render(snapshot)));
    }

    @Override
    public void onReport(MonitorReport report) {
        System.err.println(PREFIX + "final report\n" + report.render());
    }

    /** CFG and instruction listing of one module, as printed on publication. */
    static String describe(String module, ControlFlowGraph cfg) {
        return PREFIX + "CFG " + module + ":\n" + CfgRenderer.render(cfg)
            + "\n" + PREFIX + "instructions " + module + ":\n" + CfgRenderer.renderInstructions(cfg.partition());
    }

    private static String indent(String text) {
        return text.contains("\n") ? "\n" + text : text;
    }
}
