package com.ghosttrace.analyzer.bytecode;

/**
 * How a jump operand maps to a target offset.
 *
 * FORWARD and BACKWARD are relative to the offset of the jumping instruction itself.
 */
public enum Addressing {
    NONE,
    ABSOLUTE,
    FORWARD,
    BACKWARD;

    /** Resolves {@code operand} against the instruction at {@code offset}. */
    public int resolve(int offset, int operand) {
        return switch (this) {
            case ABSOLUTE -> operand;
            case FORWARD  -> offset + operand;
            case BACKWARD -> offset - operand;
            case NONE     -> throw new IllegalStateException("instruction has no jump target");
        };
    }
}
