package com.ghosttrace.analyzer.bytecode;

/**
 * Constants of the instruction blob wire format (big-endian, DataInput encoding).
 *
 * <pre>
 * u4  magic "GHBC"
 * u2  version
 * utf code name
 * utf source file
 * u4  instruction count
 * per instruction:
 *   u4  offset
 *   utf mnemonic
 *   u1  flags (HAS_OPERAND | HAS_LINE | JUMP_TARGET)
 *   s4  operand   if HAS_OPERAND
 *   s4  line      if HAS_LINE
 * </pre>
 */
public final class BlobFormat {

    private BlobFormat() {}

    public static final int MAGIC = 0x47484243;
    public static final int VERSION = 1;

    public static final int FLAG_HAS_OPERAND = 0x01;
    public static final int FLAG_HAS_LINE    = 0x02;
    public static final int FLAG_JUMP_TARGET = 0x04;
    static final int KNOWN_FLAGS = FLAG_HAS_OPERAND | FLAG_HAS_LINE | FLAG_JUMP_TARGET;

    /** Width given to the last instruction, which has no successor to measure against. */
    public static final int FINAL_INSTRUCTION_WIDTH = 2;

    /** Conventional file extension for blobs on disk. */
    public static final String FILE_EXTENSION = ".ghbc";
}
