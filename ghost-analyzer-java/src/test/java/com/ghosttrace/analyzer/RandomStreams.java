package com.ghosttrace.analyzer;

import com.ghosttrace.analyzer.bytecode.Instruction;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded generator of arbitrary instruction streams for the partition and graph property tests.
 * Targets may land between instructions, past the end, or nowhere at all.
 */
final class RandomStreams {

    private static final String[] MNEMONICS = {
        "LOAD_CONST", "LOAD_NAME", "STORE_NAME", "CALL", "COMPARE_OP",
        "POP_JUMP_IF_TRUE", "POP_JUMP_IF_FALSE", "POP_JUMP_FORWARD_IF_NONE",
        "JUMP_FORWARD", "JUMP_BACKWARD", "JUMP_ABSOLUTE", "FOR_ITER",
        "RETURN_VALUE", "RAISE_VARARGS"
    };

    private RandomStreams() {}

    static List<Instruction> stream(long seed) {
        Random random = new Random(seed);
        int count = 1 + random.nextInt(40);
        List<Instruction> instrs = new ArrayList<>(count);
        int offset = 0;
        for (int i = 0; i < count; i++) {
            int width = random.nextInt(4) == 0 ? 4 : 2;
            String mnemonic = MNEMONICS[random.nextInt(MNEMONICS.length)];
            Integer operand = random.nextInt(8) == 0 ? null : random.nextInt(count * 3 + 6);
            Integer line = random.nextBoolean() ? i + 1 : null;
            instrs.add(Instruction.of(mnemonic, operand, offset, width, line, random.nextInt(10) == 0));
            offset += width;
        }
        return instrs;
    }
}
