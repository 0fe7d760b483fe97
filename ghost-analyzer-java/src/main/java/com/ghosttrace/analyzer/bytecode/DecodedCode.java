package com.ghosttrace.analyzer.bytecode;

import java.util.List;

/**
 * Decoded form of one instruction blob: a named code unit and its ordered instructions.
 */
public record DecodedCode(
    String name,
    String sourceFile,
    List<Instruction> instructions
) {

    public DecodedCode {
        instructions = List.copyOf(instructions);
    }

    /** Offset one past the last instruction. */
    public int endOffset() {
        return instructions.get(instructions.size() - 1).nextOffset();
    }
}
