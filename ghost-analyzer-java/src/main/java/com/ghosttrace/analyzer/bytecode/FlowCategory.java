package com.ghosttrace.analyzer.bytecode;

/**
 * Control-flow category of an instruction, used by the partitioner and CFG builder.
 */
public enum FlowCategory {
    UNCONDITIONAL_JUMP,
    CONDITIONAL_BRANCH,
    LOOP_ITERATION,
    RETURN,
    RAISE,
    OTHER;

    /** True for categories whose operand names another instruction offset. */
    public boolean hasTarget() {
        return this == UNCONDITIONAL_JUMP || this == CONDITIONAL_BRANCH || this == LOOP_ITERATION;
    }

    /** True for return/raise: the block ends the code path. */
    public boolean isTerminal() {
        return this == RETURN || this == RAISE;
    }
}
