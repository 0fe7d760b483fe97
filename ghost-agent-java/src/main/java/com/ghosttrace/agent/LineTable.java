package com.ghosttrace.agent;

import net.bytebuddy.jar.asm.ClassReader;
import net.bytebuddy.jar.asm.ClassVisitor;
import net.bytebuddy.jar.asm.Label;
import net.bytebuddy.jar.asm.MethodVisitor;
import net.bytebuddy.utility.OpenedClassReader;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-number and local-variable debug info of one class file, read ahead of instrumentation.
 *
 * The LocalVariableTable is only visited after a method's code, so the probes inserted while the
 * code streams past need it up front. For every LineNumberTable entry, in the order the class
 * reader visits them, a {@link Site} lists the locals whose scope covers that line's start.
 * {@code this} is left out. A method compiled without {@code -g:vars} gets sites with no locals.
 */
final class LineTable {

    record Local(String name, String descriptor, int slot) {}

    record Site(int line, List<Local> locals) {}

    private final String className;
    private final String sourceFile;
    private final Map<String, List<Site>> sitesByMethod;

    private LineTable(String className, String sourceFile, Map<String, List<Site>> sitesByMethod) {
        this.className = className;
        this.sourceFile = sourceFile;
        this.sitesByMethod = sitesByMethod;
    }

    static LineTable scan(byte[] classFile) {
        Scanner scanner = new Scanner();
        OpenedClassReader.of(classFile).accept(scanner, ClassReader.SKIP_FRAMES);
        return new LineTable(scanner.className, scanner.sourceFile, scanner.sites);
    }

    /** Binary name, e.g. {@code com.shop.Cart$Line}. */
    String className() { return className; }

    /** Source file attribute, or null when compiled without it. */
    String sourceFile() { return sourceFile; }

    List<Site> sites(String methodName, String descriptor) {
        return sitesByMethod.getOrDefault(methodName + descriptor, List.of());
    }

    // -----------------------------------------------------------------------
    // Scan
    // -----------------------------------------------------------------------

    private static final class Scanner extends ClassVisitor {
        String className;
        String sourceFile;
        final Map<String, List<Site>> sites = new HashMap<>();

        Scanner() {
            super(OpenedClassReader.ASM_API);
        }

        @Override
        public void visit(int version, int access, String name, String signature,
                          String superName, String[] interfaces) {
            className = name.replace('/', '.');
        }

        @Override
        public void visitSource(String source, String debug) {
            sourceFile = source;
        }

        @Override
        public MethodVisitor visitMethod(int access, String name, String descriptor,
                                         String signature, String[] exceptions) {
            return new MethodScanner(sites, name + descriptor);
        }
    }

    /** Positions are label ordinals: the reader visits labels in increasing bytecode offset. */
    private static final class MethodScanner extends MethodVisitor {
        private final Map<String, List<Site>> out;
        private final String key;
        private final Map<Label, Integer> positions = new IdentityHashMap<>();
        private final List<int[]> lines = new ArrayList<>();
        private final List<Scope> scopes = new ArrayList<>();

        private record Scope(Local local, int start, int end) {}

        MethodScanner(Map<String, List<Site>> out, String key) {
            super(OpenedClassReader.ASM_API);
            this.out = out;
            this.key = key;
        }

        private int position(Label label) {
            return positions.computeIfAbsent(label, l -> positions.size());
        }

        @Override
        public void visitLabel(Label label) {
            position(label);
        }

        @Override
        public void visitLineNumber(int line, Label start) {
            lines.add(new int[] {line, position(start)});
        }

        @Override
        public void visitLocalVariable(String name, String descriptor, String signature,
                                       Label start, Label end, int index) {
            if ("this".equals(name)) return;
            scopes.add(new Scope(new Local(name, descriptor, index), position(start), position(end)));
        }

        @Override
        public void visitEnd() {
            if (lines.isEmpty()) return;
            List<Site> methodSites = new ArrayList<>(lines.size());
            for (int[] entry : lines) {
                List<Local> visible = new ArrayList<>();
                for (Scope scope : scopes) {
                    if (scope.start() <= entry[1] && entry[1] < scope.end()) visible.add(scope.local());
                }
                visible.sort(Comparator.comparingInt(Local::slot));
                methodSites.add(new Site(entry[0], List.copyOf(visible)));
            }
            out.put(key, List.copyOf(methodSites));
        }
    }
}
