package com.ghosttrace.analyzer.bytecode;

import java.util.HashMap;
import java.util.Map;

/**
 * The control-flow mnemonics the pipeline understands.
 *
 * Any mnemonic not listed here (loads, stores, calls, compares) classifies as
 * {@link FlowCategory#OTHER} with no target.
 */
public enum Opcode {

    JUMP_FORWARD(FlowCategory.UNCONDITIONAL_JUMP, Addressing.FORWARD),
    JUMP_BACKWARD(FlowCategory.UNCONDITIONAL_JUMP, Addressing.BACKWARD),
    JUMP_BACKWARD_NO_INTERRUPT(FlowCategory.UNCONDITIONAL_JUMP, Addressing.BACKWARD),
    JUMP_ABSOLUTE(FlowCategory.UNCONDITIONAL_JUMP, Addressing.ABSOLUTE),
    JUMP(FlowCategory.UNCONDITIONAL_JUMP, Addressing.ABSOLUTE),

    POP_JUMP_IF_TRUE(FlowCategory.CONDITIONAL_BRANCH, Addressing.ABSOLUTE),
    POP_JUMP_IF_FALSE(FlowCategory.CONDITIONAL_BRANCH, Addressing.ABSOLUTE),
    POP_JUMP_IF_NONE(FlowCategory.CONDITIONAL_BRANCH, Addressing.ABSOLUTE),
    POP_JUMP_IF_NOT_NONE(FlowCategory.CONDITIONAL_BRANCH, Addressing.ABSOLUTE),
    JUMP_IF_TRUE_OR_POP(FlowCategory.CONDITIONAL_BRANCH, Addressing.ABSOLUTE),
    JUMP_IF_FALSE_OR_POP(FlowCategory.CONDITIONAL_BRANCH, Addressing.ABSOLUTE),
    POP_JUMP_FORWARD_IF_TRUE(FlowCategory.CONDITIONAL_BRANCH, Addressing.FORWARD),
    POP_JUMP_FORWARD_IF_FALSE(FlowCategory.CONDITIONAL_BRANCH, Addressing.FORWARD),
    POP_JUMP_FORWARD_IF_NONE(FlowCategory.CONDITIONAL_BRANCH, Addressing.FORWARD),
    POP_JUMP_FORWARD_IF_NOT_NONE(FlowCategory.CONDITIONAL_BRANCH, Addressing.FORWARD),
    POP_JUMP_BACKWARD_IF_TRUE(FlowCategory.CONDITIONAL_BRANCH, Addressing.BACKWARD),
    POP_JUMP_BACKWARD_IF_FALSE(FlowCategory.CONDITIONAL_BRANCH, Addressing.BACKWARD),
    POP_JUMP_BACKWARD_IF_NONE(FlowCategory.CONDITIONAL_BRANCH, Addressing.BACKWARD),
    POP_JUMP_BACKWARD_IF_NOT_NONE(FlowCategory.CONDITIONAL_BRANCH, Addressing.BACKWARD),

    // Loop exit is absolute; the loop body is the next instruction.
    FOR_ITER(FlowCategory.LOOP_ITERATION, Addressing.ABSOLUTE),

    RETURN_VALUE(FlowCategory.RETURN, Addressing.NONE),
    RETURN_CONST(FlowCategory.RETURN, Addressing.NONE),

    RAISE_VARARGS(FlowCategory.RAISE, Addressing.NONE),
    RERAISE(FlowCategory.RAISE, Addressing.NONE);

    private static final Map<String, Opcode> BY_MNEMONIC = new HashMap<>();

    static {
        for (Opcode op : values()) {
            BY_MNEMONIC.put(op.name(), op);
        }
    }

    private final FlowCategory category;
    private final Addressing addressing;

    Opcode(FlowCategory category, Addressing addressing) {
        this.category = category;
        this.addressing = addressing;
    }

    public FlowCategory category() { return category; }
    public Addressing addressing() { return addressing; }

    /** Category for an arbitrary mnemonic; unknown mnemonics are OTHER. */
    public static FlowCategory categoryOf(String mnemonic) {
        Opcode op = BY_MNEMONIC.get(mnemonic);
        return op != null ? op.category : FlowCategory.OTHER;
    }

    /** Addressing mode for an arbitrary mnemonic; unknown mnemonics have none. */
    public static Addressing addressingOf(String mnemonic) {
        Opcode op = BY_MNEMONIC.get(mnemonic);
        return op != null ? op.addressing : Addressing.NONE;
    }
}
