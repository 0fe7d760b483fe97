package com.ghosttrace.analyzer.bytecode;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Decodes an instruction blob into an ordered list of {@link Instruction}s.
 *
 * Widths are derived from the offset delta to the following instruction; the last
 * instruction gets {@link BlobFormat#FINAL_INSTRUCTION_WIDTH}. After decoding, every
 * instruction whose offset is the resolved target of another one is flagged as a jump target.
 */
public class InstructionDecoder {

    /** Raw per-instruction fields, before widths are known. */
    private record RawInstruction(int offset, String mnemonic, Integer operand, Integer line, boolean jumpTarget) {}

    public DecodedCode decode(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new DecodeException("Empty instruction blob");
        }
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(blob))) {
            int magic = in.readInt();
            if (magic != BlobFormat.MAGIC) {
                throw new DecodeException(String.format("Bad magic 0x%08x (expected 0x%08x)", magic, BlobFormat.MAGIC));
            }
            int version = in.readUnsignedShort();
            if (version != BlobFormat.VERSION) {
                throw new DecodeException("Unsupported blob version: " + version);
            }
            String name = in.readUTF();
            String sourceFile = in.readUTF();
            long count = Integer.toUnsignedLong(in.readInt());
            if (count == 0) {
                throw new DecodeException("Code '" + name + "' has no instructions");
            }
            // Each instruction takes at least 7 bytes; reject counts the blob cannot hold.
            if (count > blob.length / 7L) {
                throw new DecodeException("Instruction count " + count + " exceeds blob size " + blob.length);
            }

            List<RawInstruction> raw = new ArrayList<>((int) count);
            long previousOffset = -1;
            for (int i = 0; i < count; i++) {
                long offset = Integer.toUnsignedLong(in.readInt());
                if (i == 0 && offset != 0) {
                    throw new DecodeException("First instruction must be at offset 0, found " + offset);
                }
                if (offset <= previousOffset || offset > Integer.MAX_VALUE) {
                    throw new DecodeException("Offsets must be strictly increasing: " + offset
                        + " follows " + previousOffset + " (instruction " + i + ")");
                }
                String mnemonic = in.readUTF();
                if (mnemonic.isBlank()) {
                    throw new DecodeException("Blank mnemonic at offset " + offset);
                }
                int flags = in.readUnsignedByte();
                if ((flags & ~BlobFormat.KNOWN_FLAGS) != 0) {
                    throw new DecodeException(String.format("Unknown flag bits 0x%02x at offset %d", flags, offset));
                }
                Integer operand = (flags & BlobFormat.FLAG_HAS_OPERAND) != 0 ? in.readInt() : null;
                Integer line = (flags & BlobFormat.FLAG_HAS_LINE) != 0 ? in.readInt() : null;
                raw.add(new RawInstruction((int) offset, mnemonic, operand, line,
                    (flags & BlobFormat.FLAG_JUMP_TARGET) != 0));
                previousOffset = offset;
            }
            if (in.available() > 0) {
                throw new DecodeException(in.available() + " trailing bytes after last instruction");
            }
            return new DecodedCode(name, sourceFile, markJumpTargets(withWidths(raw)));
        } catch (EOFException e) {
            throw new DecodeException("Truncated instruction blob", e);
        } catch (IOException e) {
            throw new DecodeException("Malformed instruction blob: " + e.getMessage(), e);
        }
    }

    private static List<Instruction> withWidths(List<RawInstruction> raw) {
        List<Instruction> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            RawInstruction r = raw.get(i);
            int width = i + 1 < raw.size()
                ? raw.get(i + 1).offset() - r.offset()
                : BlobFormat.FINAL_INSTRUCTION_WIDTH;
            out.add(Instruction.of(r.mnemonic(), r.operand(), r.offset(), width, r.line(), r.jumpTarget()));
        }
        return out;
    }

    static List<Instruction> markJumpTargets(List<Instruction> instructions) {
        Set<Integer> targets = new HashSet<>();
        for (Instruction instr : instructions) {
            OptionalInt t = instr.target();
            if (t.isPresent()) targets.add(t.getAsInt());
        }
        List<Instruction> out = new ArrayList<>(instructions.size());
        for (Instruction instr : instructions) {
            out.add(targets.contains(instr.offset()) ? instr.markedAsJumpTarget() : instr);
        }
        return out;
    }
}
