package com.ghosttrace.analyzer.bytecode;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes instructions into the blob format read by {@link InstructionDecoder}.
 *
 * Used by tooling that emits blobs and by test fixtures:
 * <pre>
 *   byte[] blob = new InstructionBlobWriter("main", "main.jac")
 *       .op(0, "LOAD_CONST", 1, 1)
 *       .op(2, "RETURN_VALUE")
 *       .toBytes();
 * </pre>
 */
public class InstructionBlobWriter {

    private record Entry(int offset, String mnemonic, Integer operand, Integer line, boolean jumpTarget) {}

    private final String name;
    private final String sourceFile;
    private final List<Entry> entries = new ArrayList<>();

    public InstructionBlobWriter(String name, String sourceFile) {
        this.name = name;
        this.sourceFile = sourceFile;
    }

    public InstructionBlobWriter op(int offset, String mnemonic) {
        return op(offset, mnemonic, null, null);
    }

    public InstructionBlobWriter op(int offset, String mnemonic, Integer operand) {
        return op(offset, mnemonic, operand, null);
    }

    public InstructionBlobWriter op(int offset, String mnemonic, Integer operand, Integer line) {
        entries.add(new Entry(offset, mnemonic, operand, line, false));
        return this;
    }

    /** Adds an instruction with the jump-target flag set explicitly in the blob. */
    public InstructionBlobWriter target(int offset, String mnemonic, Integer operand, Integer line) {
        entries.add(new Entry(offset, mnemonic, operand, line, true));
        return this;
    }

    public byte[] toBytes() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(BlobFormat.MAGIC);
            out.writeShort(BlobFormat.VERSION);
            out.writeUTF(name);
            out.writeUTF(sourceFile);
            out.writeInt(entries.size());
            for (Entry e : entries) {
                int flags = 0;
                if (e.operand() != null) flags |= BlobFormat.FLAG_HAS_OPERAND;
                if (e.line() != null)    flags |= BlobFormat.FLAG_HAS_LINE;
                if (e.jumpTarget())      flags |= BlobFormat.FLAG_JUMP_TARGET;
                out.writeInt(e.offset());
                out.writeUTF(e.mnemonic());
                out.writeByte(flags);
                if (e.operand() != null) out.writeInt(e.operand());
                if (e.line() != null)    out.writeInt(e.line());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory blob encoding failed", e);
        }
        return bytes.toByteArray();
    }
}
