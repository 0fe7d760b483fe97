package com.ghosttrace.analyzer.cfg;

import com.ghosttrace.analyzer.bytecode.Instruction;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Resolves each block's outgoing edges from the category of its last instruction.
 *
 * <ul>
 *   <li>conditional branch, jump-or-pop forms included: BRANCH to the target block, then FALLTHROUGH to the next block</li>
 *   <li>unconditional jump: JUMP to the target block</li>
 *   <li>loop iteration: LOOP_BODY to the next instruction's block, then LOOP_EXIT to the target block</li>
 *   <li>return / raise: no successors</li>
 *   <li>anything else: FALLTHROUGH to the following block, unless this is the last block</li>
 * </ul>
 * A target no block contains becomes an {@link UnresolvedTarget} on the graph and a warning
 * on stderr. The partition is never modified.
 */
public class CfgBuilder {

    public ControlFlowGraph build(String name, BlockPartition partition) {
        ControlFlowGraph cfg = new ControlFlowGraph(name, partition);

        for (BasicBlock block : partition.blocks()) {
            cfg.addNode(block.id());
            Instruction last = block.last();

            switch (last.category()) {
                case CONDITIONAL_BRANCH -> {
                    connect(cfg, block, last.target(), EdgeKind.BRANCH);
                    connect(cfg, block, OptionalInt.of(last.nextOffset()), EdgeKind.FALLTHROUGH);
                }
                case UNCONDITIONAL_JUMP -> connect(cfg, block, last.target(), EdgeKind.JUMP);
                case LOOP_ITERATION -> {
                    connect(cfg, block, OptionalInt.of(last.nextOffset()), EdgeKind.LOOP_BODY);
                    connect(cfg, block, last.target(), EdgeKind.LOOP_EXIT);
                }
                case RETURN, RAISE -> { }
                case OTHER -> {
                    if (block.id() + 1 < partition.size()) {
                        cfg.addEdge(block.id(), block.id() + 1, EdgeKind.FALLTHROUGH);
                    }
                }
            }
        }
        return cfg;
    }

    private static void connect(ControlFlowGraph cfg, BasicBlock from, OptionalInt targetOffset, EdgeKind kind) {
        Instruction last = from.last();
        if (targetOffset.isEmpty()) {
            // A jump without an operand has nowhere to go; report it like any other miss.
            reportUnresolved(cfg, new UnresolvedTarget(from.id(), last.offset(), -1, kind));
            return;
        }
        Optional<BasicBlock> target = cfg.partition().blockAt(targetOffset.getAsInt());
        if (target.isPresent()) {
            cfg.addEdge(from.id(), target.get().id(), kind);
        } else {
            reportUnresolved(cfg, new UnresolvedTarget(from.id(), last.offset(), targetOffset.getAsInt(), kind));
        }
    }

    private static void reportUnresolved(ControlFlowGraph cfg, UnresolvedTarget miss) {
        cfg.addUnresolved(miss);
        System.err.println("[ghost-analyzer] WARNING: unresolved " + miss.kind() + " target "
            + miss.targetOffset() + " from bb" + miss.blockId() + " @" + miss.instructionOffset()
            + " in " + cfg.name());
    }
}
