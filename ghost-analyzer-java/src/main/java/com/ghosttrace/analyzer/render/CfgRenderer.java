package com.ghosttrace.analyzer.render;

import com.ghosttrace.analyzer.cfg.BasicBlock;
import com.ghosttrace.analyzer.cfg.BlockPartition;
import com.ghosttrace.analyzer.cfg.ControlFlowEdge;
import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import com.ghosttrace.analyzer.cfg.UnresolvedTarget;

import java.util.stream.Collectors;

/**
 * Text and Graphviz renderings of a CFG. Diagnostic output only; nothing parses it back.
 */
public final class CfgRenderer {

    private CfgRenderer() {}

    /**
     * One line per block with its execution count, followed by its successor edges:
     * <pre>
     * Node bb0 (exec count=0):
     *   -> bb1 (edge exec count=0)
     * </pre>
     */
    public static String render(ControlFlowGraph cfg) {
        StringBuilder sb = new StringBuilder();
        for (int node : cfg.nodes()) {
            BasicBlock block = cfg.partition().block(node);
            if (sb.length() > 0) sb.append('\n');
            sb.append("Node bb").append(node)
              .append(" (exec count=").append(block.executionCount()).append("):");
            for (int succ : cfg.successors(node)) {
                long hits = cfg.edge(node, succ).map(ControlFlowEdge::hitCount).orElse(0L);
                sb.append("\n  -> bb").append(succ).append(" (edge exec count=").append(hits).append(')');
            }
        }
        for (UnresolvedTarget miss : cfg.unresolvedTargets()) {
            sb.append("\n  !! bb").append(miss.blockId()).append(" unresolved ")
              .append(miss.kind()).append(" target ").append(miss.targetOffset());
        }
        return sb.toString();
    }

    /** Every block with its instructions and covered source lines. */
    public static String renderInstructions(BlockPartition partition) {
        return partition.blocks().stream()
            .map(b -> b + (b.lines().isEmpty() ? "" : "\n  lines " + b.lines()))
            .collect(Collectors.joining("\n"));
    }

    /** Graphviz DOT source; edge labels carry the edge kind. */
    public static String toDot(ControlFlowGraph cfg) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(cfg.name())).append("\" {\n");
        sb.append("  node [shape=box];\n");
        for (int node : cfg.nodes()) {
            BasicBlock block = cfg.partition().block(node);
            sb.append("  bb").append(node).append(" [label=\"BB").append(node)
              .append("\\n@").append(block.startOffset()).append("\"];\n");
        }
        for (ControlFlowEdge edge : cfg.edges()) {
            sb.append("  bb").append(edge.source()).append(" -> bb").append(edge.target())
              .append(" [label=\"").append(edge.kind().name().toLowerCase()).append("\"];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
