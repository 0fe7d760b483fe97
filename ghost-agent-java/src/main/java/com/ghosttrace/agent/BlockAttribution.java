package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.BasicBlock;
import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps traced lines onto published CFGs and bumps their block and edge counters.
 *
 * A frame belongs to the CFG whose module or CFG name equals the frame's qualified or simple
 * function name. The line selects the first block whose {@link BasicBlock#lines()} contain it.
 * A block counts as executed when it is entered from a different block, or when its first line
 * runs again (a block looping onto itself). Each entry from a known previous block also bumps
 * that edge, if the graph has it.
 *
 * Attribution is line-granular: a line shared by two blocks always resolves to the first one.
 */
final class BlockAttribution {

    private final Map<String, ControlFlowGraph> byName = new HashMap<>();

    /** Last block seen per CFG, per program thread. */
    private final ThreadLocal<Map<ControlFlowGraph, Integer>> previous =
        ThreadLocal.withInitial(HashMap::new);

    BlockAttribution(Map<String, ControlFlowGraph> cfgs) {
        for (Map.Entry<String, ControlFlowGraph> e : cfgs.entrySet()) {
            byName.putIfAbsent(e.getKey(), e.getValue());
            byName.putIfAbsent(e.getValue().name(), e.getValue());
        }
    }

    /** Returns the block id the frame was attributed to, or -1. */
    int record(TraceFrame frame) {
        if (frame.line() == null) return -1;
        ControlFlowGraph cfg = byName.get(frame.functionName());
        if (cfg == null) cfg = byName.get(ReportMerger.simpleName(frame.functionName()));
        if (cfg == null) return -1;

        BasicBlock block = blockForLine(cfg, frame.line());
        if (block == null) return -1;

        Map<ControlFlowGraph, Integer> last = previous.get();
        Integer from = last.put(cfg, block.id());
        boolean entered = from == null || from != block.id() || block.lines().first().equals(frame.line());
        if (entered) {
            cfg.recordBlockExecution(block.id());
            if (from != null) cfg.recordTransition(from, block.id());
        }
        return block.id();
    }

    private static BasicBlock blockForLine(ControlFlowGraph cfg, int line) {
        for (BasicBlock block : cfg.partition().blocks()) {
            if (block.lines().contains(line)) return block;
        }
        return null;
    }
}
