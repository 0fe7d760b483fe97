package com.ghosttrace.analyzer.cfg;

import com.ghosttrace.analyzer.bytecode.Instruction;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.LongAdder;

/**
 * A maximal straight-line run of instructions. IDs follow ascending start offset.
 *
 * The execution counter is a LongAdder so instrumented threads can bump it without locking.
 */
public final class BasicBlock {

    private final int id;
    private final List<Instruction> instructions;
    private final SortedSet<Integer> lines;
    private final LongAdder execCount = new LongAdder();

    BasicBlock(int id, List<Instruction> instructions) {
        if (instructions.isEmpty()) {
            throw new IllegalArgumentException("Block bb" + id + " has no instructions");
        }
        this.id = id;
        this.instructions = List.copyOf(instructions);
        SortedSet<Integer> covered = new TreeSet<>();
        for (Instruction instr : instructions) {
            if (instr.line() != null) covered.add(instr.line());
        }
        this.lines = Collections.unmodifiableSortedSet(covered);
    }

    public int id() { return id; }
    public List<Instruction> instructions() { return instructions; }

    /** Distinct source lines started by instructions in this block. */
    public SortedSet<Integer> lines() { return lines; }

    public int startOffset() { return instructions.get(0).offset(); }

    /** Exclusive end: the offset right after the last instruction. */
    public int endOffset() { return last().nextOffset(); }

    public Instruction last() { return instructions.get(instructions.size() - 1); }

    public long executionCount() { return execCount.sum(); }

    public void recordExecution() { execCount.increment(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("bb").append(id).append(':');
        for (Instruction instr : instructions) {
            sb.append('\n').append(instr);
        }
        return sb.toString();
    }
}
