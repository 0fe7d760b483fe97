package com.ghosttrace.agent;

import net.bytebuddy.asm.AsmVisitorWrapper;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.dynamic.ClassFileLocator;
import net.bytebuddy.matcher.ElementMatcher;

import java.io.IOException;
import java.util.List;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Builds the ByteBuddy visitor that probes every source line of a class.
 *
 * Each probe reports the function, source file, line and the in-scope locals to
 * {@link ExecutionHooks}. Locals come from the class's LocalVariableTable, so a class compiled
 * without {@code -g:vars} reports lines with no locals.
 */
public final class LineProbes {

    private LineProbes() {}

    static final ElementMatcher.Junction<MethodDescription> PROBED = isMethod()
        .and(not(isAbstract()))
        .and(not(isNative()))
        .and(not(isSynthetic()))
        .and(not(isBridge()));

    /**
     * @param classFile the class file the instrumented type is read from; its debug info
     *                  decides which locals each line reports
     */
    public static AsmVisitorWrapper forClassFile(byte[] classFile) {
        LineTable table = LineTable.scan(classFile);
        return new AsmVisitorWrapper.ForDeclaredMethods().method(PROBED,
            (instrumentedType, instrumentedMethod, methodVisitor, implementationContext,
             typePool, writerFlags, readerFlags) -> {
                List<LineTable.Site> sites = table.sites(
                    instrumentedMethod.getInternalName(), instrumentedMethod.getDescriptor());
                if (sites.isEmpty()) return methodVisitor;
                String function = table.className() + "." + instrumentedMethod.getInternalName();
                return new LineProbeVisitor(methodVisitor, function, table.sourceFile(), sites);
            });
    }

    /** The class file of {@code type} as its loader sees it, or null if it cannot be located. */
    static byte[] classFileOf(TypeDescription type, ClassLoader classLoader) {
        try {
            ClassFileLocator.Resolution resolution = ClassFileLocator.ForClassLoader.of(classLoader).locate(type.getName());
            return resolution.isResolved() ? resolution.resolve() : null;
        } catch (IOException e) {
            System.err.println("[ghost-agent] WARNING: cannot read class file of " + type.getName() + ": " + e.getMessage());
            return null;
        }
    }
}
