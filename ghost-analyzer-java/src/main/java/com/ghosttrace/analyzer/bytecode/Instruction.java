package com.ghosttrace.analyzer.bytecode;

import java.util.OptionalInt;

/**
 * One decoded instruction. Immutable; owned by the instruction list that produced it.
 *
 * @param mnemonic     opcode name as encoded in the blob
 * @param category     control-flow category derived from the mnemonic
 * @param addressing   how {@code operand} resolves to a target offset
 * @param operand      raw operand, null when the instruction takes none
 * @param offset       byte offset, strictly increasing within a stream
 * @param width        bytes to the next instruction (synthetic for the last one)
 * @param line         source line this instruction starts, or null
 * @param isJumpTarget true when another instruction resolves to this offset
 */
public record Instruction(
    String mnemonic,
    FlowCategory category,
    Addressing addressing,
    Integer operand,
    int offset,
    int width,
    Integer line,
    boolean isJumpTarget
) {

    public Instruction {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive at offset " + offset + ": " + width);
        }
    }

    public static Instruction of(String mnemonic, Integer operand, int offset, int width,
                                 Integer line, boolean isJumpTarget) {
        return new Instruction(
            mnemonic,
            Opcode.categoryOf(mnemonic),
            Opcode.addressingOf(mnemonic),
            operand, offset, width, line, isJumpTarget);
    }

    public int nextOffset() {
        return offset + width;
    }

    /** Resolved jump target, empty for instructions that do not transfer control to an operand. */
    public OptionalInt target() {
        if (!category.hasTarget() || operand == null || addressing == Addressing.NONE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(addressing.resolve(offset, operand));
    }

    Instruction markedAsJumpTarget() {
        return isJumpTarget ? this
            : new Instruction(mnemonic, category, addressing, operand, offset, width, line, true);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%6d %s", offset, mnemonic));
        if (operand != null) sb.append(' ').append(operand);
        OptionalInt t = target();
        if (t.isPresent() && addressing != Addressing.ABSOLUTE) sb.append(" (to ").append(t.getAsInt()).append(')');
        if (line != null) sb.append("  [line ").append(line).append(']');
        if (isJumpTarget) sb.append("  >>");
        return sb.toString();
    }
}
