package com.ghosttrace.agent;

import net.bytebuddy.jar.asm.Handle;
import net.bytebuddy.jar.asm.Label;
import net.bytebuddy.jar.asm.MethodVisitor;
import net.bytebuddy.jar.asm.Opcodes;
import net.bytebuddy.jar.asm.Type;
import net.bytebuddy.utility.OpenedClassReader;

import java.util.List;

/**
 * Inserts a call to {@link ExecutionHooks#line(String, String, int, String[], Object[])} at the
 * start of every source line of one method.
 *
 * The call is emitted right before the first instruction that follows a line-number entry, so it
 * lands after any stack map frame at that offset. It is straight-line code that leaves the operand
 * stack as it found it; existing frames stay valid and only the max stack grows.
 */
class LineProbeVisitor extends MethodVisitor {

    /** function, file, line, names[], values[], dup, index, one wide value. */
    static final int PROBE_STACK = 9;

    private static final String HOOKS = Type.getInternalName(ExecutionHooks.class);
    private static final String LINE_DESCRIPTOR =
        "(Ljava/lang/String;Ljava/lang/String;I[Ljava/lang/String;[Ljava/lang/Object;)V";

    private final String function;
    private final String sourceFile;
    private final List<LineTable.Site> sites;
    private int nextSite;
    private LineTable.Site pending;

    LineProbeVisitor(MethodVisitor delegate, String function, String sourceFile, List<LineTable.Site> sites) {
        super(OpenedClassReader.ASM_API, delegate);
        this.function = function;
        this.sourceFile = sourceFile;
        this.sites = sites;
    }

    @Override
    public void visitLineNumber(int line, Label start) {
        super.visitLineNumber(line, start);
        LineTable.Site site = nextSite < sites.size() ? sites.get(nextSite) : null;
        nextSite++;
        // Entries are matched by order; a line mismatch means the scan no longer lines up.
        pending = site != null && site.line() == line ? site : null;
    }

    private void flush() {
        if (pending == null) return;
        LineTable.Site site = pending;
        pending = null;

        super.visitLdcInsn(function);
        if (sourceFile == null) {
            super.visitInsn(Opcodes.ACONST_NULL);
        } else {
            super.visitLdcInsn(sourceFile);
        }
        super.visitLdcInsn(site.line());

        List<LineTable.Local> locals = site.locals();
        super.visitLdcInsn(locals.size());
        super.visitTypeInsn(Opcodes.ANEWARRAY, "java/lang/String");
        for (int i = 0; i < locals.size(); i++) {
            super.visitInsn(Opcodes.DUP);
            super.visitLdcInsn(i);
            super.visitLdcInsn(locals.get(i).name());
            super.visitInsn(Opcodes.AASTORE);
        }

        super.visitLdcInsn(locals.size());
        super.visitTypeInsn(Opcodes.ANEWARRAY, "java/lang/Object");
        for (int i = 0; i < locals.size(); i++) {
            super.visitInsn(Opcodes.DUP);
            super.visitLdcInsn(i);
            loadBoxed(locals.get(i));
            super.visitInsn(Opcodes.AASTORE);
        }

        super.visitMethodInsn(Opcodes.INVOKESTATIC, HOOKS, "line", LINE_DESCRIPTOR, false);
    }

    private void loadBoxed(LineTable.Local local) {
        Type type = Type.getType(local.descriptor());
        super.visitVarInsn(type.getOpcode(Opcodes.ILOAD), local.slot());
        String box = switch (type.getSort()) {
            case Type.BOOLEAN -> "java/lang/Boolean";
            case Type.CHAR -> "java/lang/Character";
            case Type.BYTE -> "java/lang/Byte";
            case Type.SHORT -> "java/lang/Short";
            case Type.INT -> "java/lang/Integer";
            case Type.FLOAT -> "java/lang/Float";
            case Type.LONG -> "java/lang/Long";
            case Type.DOUBLE -> "java/lang/Double";
            default -> null;
        };
        if (box != null) {
            super.visitMethodInsn(Opcodes.INVOKESTATIC, box, "valueOf",
                "(" + type.getDescriptor() + ")L" + box + ";", false);
        }
    }

    @Override
    public void visitMaxs(int maxStack, int maxLocals) {
        super.visitMaxs(maxStack + PROBE_STACK, maxLocals);
    }

    // -----------------------------------------------------------------------
    // Every instruction flushes a pending probe first
    // -----------------------------------------------------------------------

    @Override
    public void visitInsn(int opcode) {
        flush();
        super.visitInsn(opcode);
    }

    @Override
    public void visitIntInsn(int opcode, int operand) {
        flush();
        super.visitIntInsn(opcode, operand);
    }

    @Override
    public void visitVarInsn(int opcode, int varIndex) {
        flush();
        super.visitVarInsn(opcode, varIndex);
    }

    @Override
    public void visitTypeInsn(int opcode, String type) {
        flush();
        super.visitTypeInsn(opcode, type);
    }

    @Override
    public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
        flush();
        super.visitFieldInsn(opcode, owner, name, descriptor);
    }

    @Override
    public void visitMethodInsn(int opcode, String owner, String name, String descriptor, boolean isInterface) {
        flush();
        super.visitMethodInsn(opcode, owner, name, descriptor, isInterface);
    }

    @Override
    public void visitInvokeDynamicInsn(String name, String descriptor, Handle bootstrapMethodHandle,
                                       Object... bootstrapMethodArguments) {
        flush();
        super.visitInvokeDynamicInsn(name, descriptor, bootstrapMethodHandle, bootstrapMethodArguments);
    }

    @Override
    public void visitJumpInsn(int opcode, Label label) {
        flush();
        super.visitJumpInsn(opcode, label);
    }

    @Override
    public void visitLdcInsn(Object value) {
        flush();
        super.visitLdcInsn(value);
    }

    @Override
    public void visitIincInsn(int varIndex, int increment) {
        flush();
        super.visitIincInsn(varIndex, increment);
    }

    @Override
    public void visitTableSwitchInsn(int min, int max, Label dflt, Label... labels) {
        flush();
        super.visitTableSwitchInsn(min, max, dflt, labels);
    }

    @Override
    public void visitLookupSwitchInsn(Label dflt, int[] keys, Label[] labels) {
        flush();
        super.visitLookupSwitchInsn(dflt, keys, labels);
    }

    @Override
    public void visitMultiANewArrayInsn(String descriptor, int numDimensions) {
        flush();
        super.visitMultiANewArrayInsn(descriptor, numDimensions);
    }
}
