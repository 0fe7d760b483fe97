package com.ghosttrace.analyzer.cfg;

import com.ghosttrace.analyzer.bytecode.Instruction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Splits a decoded instruction stream into basic blocks.
 *
 * Block starts are the union of:
 * <ol>
 *   <li>offset 0</li>
 *   <li>target and fallthrough of every conditional branch and loop-iteration instruction</li>
 *   <li>target of every unconditional jump</li>
 *   <li>every instruction flagged as a jump target</li>
 * </ol>
 * Candidates outside {@code [0, end]} are discarded, and so is any candidate that is not an
 * instruction boundary ({@code end} included), so every block is non-empty. The sorted starts
 * slice the stream and block IDs follow that order, which makes the partition deterministic.
 */
public class BlockPartitioner {

    public BlockPartition partition(List<Instruction> instructions) {
        if (instructions.isEmpty()) {
            throw new IllegalArgumentException("Cannot partition an empty instruction stream");
        }
        Map<Integer, Integer> indexByOffset = indexByOffset(instructions);
        List<Integer> starts = new ArrayList<>(blockStarts(instructions));

        List<BasicBlock> blocks = new ArrayList<>(starts.size());
        for (int id = 0; id < starts.size(); id++) {
            int from = indexByOffset.get(starts.get(id));
            int to = id + 1 < starts.size() ? indexByOffset.get(starts.get(id + 1)) : instructions.size();
            blocks.add(new BasicBlock(id, instructions.subList(from, to)));
        }
        return new BlockPartition(blocks);
    }

    /** Ascending block-start offsets; each one is the offset of an instruction in the stream. */
    public SortedSet<Integer> blockStarts(List<Instruction> instructions) {
        Map<Integer, Integer> indexByOffset = indexByOffset(instructions);
        int end = instructions.get(instructions.size() - 1).nextOffset();

        SortedSet<Integer> candidates = new TreeSet<>();
        candidates.add(0);
        for (Instruction instr : instructions) {
            switch (instr.category()) {
                case CONDITIONAL_BRANCH, LOOP_ITERATION -> {
                    addIfValid(candidates, instr.target(), end);
                    addIfValid(candidates, OptionalInt.of(instr.nextOffset()), end);
                }
                case UNCONDITIONAL_JUMP -> addIfValid(candidates, instr.target(), end);
                default -> { }
            }
            if (instr.isJumpTarget()) {
                candidates.add(instr.offset());
            }
        }

        SortedSet<Integer> starts = new TreeSet<>();
        for (int offset : candidates) {
            if (indexByOffset.containsKey(offset)) starts.add(offset);
        }
        return starts;
    }

    private static void addIfValid(SortedSet<Integer> candidates, OptionalInt offset, int end) {
        if (offset.isPresent() && offset.getAsInt() >= 0 && offset.getAsInt() <= end) {
            candidates.add(offset.getAsInt());
        }
    }

    private static Map<Integer, Integer> indexByOffset(List<Instruction> instructions) {
        Map<Integer, Integer> index = new HashMap<>();
        for (int i = 0; i < instructions.size(); i++) {
            index.put(instructions.get(i).offset(), i);
        }
        return index;
    }
}
