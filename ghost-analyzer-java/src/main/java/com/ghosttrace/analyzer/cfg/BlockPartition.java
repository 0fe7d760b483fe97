package com.ghosttrace.analyzer.cfg;

import com.ghosttrace.analyzer.bytecode.Instruction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ordered basic blocks of one code unit plus an instruction-offset index.
 */
public final class BlockPartition {

    private final List<BasicBlock> blocks;
    private final Map<Integer, BasicBlock> blockByInstructionOffset = new HashMap<>();

    BlockPartition(List<BasicBlock> blocks) {
        this.blocks = List.copyOf(blocks);
        for (BasicBlock block : this.blocks) {
            for (Instruction instr : block.instructions()) {
                blockByInstructionOffset.put(instr.offset(), block);
            }
        }
    }

    public List<BasicBlock> blocks() { return blocks; }

    public int size() { return blocks.size(); }

    public BasicBlock block(int id) { return blocks.get(id); }

    /**
     * The block owning the instruction at exactly {@code offset}. Offsets that fall
     * between instruction boundaries or outside the stream resolve to empty.
     */
    public Optional<BasicBlock> blockAt(int offset) {
        return Optional.ofNullable(blockByInstructionOffset.get(offset));
    }

    /** Offset one past the last instruction of the stream. */
    public int endOffset() {
        return blocks.get(blocks.size() - 1).endOffset();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (BasicBlock block : blocks) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(block);
        }
        return sb.toString();
    }
}
