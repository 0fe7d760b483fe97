package com.ghosttrace.agent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single process-wide install point for a {@link LineHook}.
 *
 * Line probes call {@link #line(String, String, int, String[], Object[])} from instrumented
 * classes in other packages and class loaders, so the entry points are public. A failing hook is
 * logged and never reaches the traced program.
 */
public final class ExecutionHooks {

    private ExecutionHooks() {}

    private static final AtomicReference<LineHook> active = new AtomicReference<>();

    /** Installs {@code hook} if no hook is installed. Returns false if another one holds the slot. */
    public static boolean install(LineHook hook) {
        if (hook == null) throw new IllegalArgumentException("hook is required");
        return active.compareAndSet(null, hook);
    }

    /** Removes {@code hook} if it is the installed one; otherwise does nothing. */
    public static void uninstall(LineHook hook) {
        active.compareAndSet(hook, null);
    }

    public static LineHook current() {
        return active.get();
    }

    public static boolean isActive() {
        return active.get() != null;
    }

    /** Dispatches to the installed hook, if any. */
    public static void line(TraceFrame frame) {
        LineHook hook = active.get();
        if (hook != null) dispatch(hook, frame);
    }

    /**
     * Entry point of the inserted line probes. {@code names} and {@code values} are parallel:
     * the locals in scope at the start of {@code line}.
     */
    public static void line(String function, String sourceFile, int line, String[] names, Object[] values) {
        LineHook hook = active.get();
        if (hook == null) return;
        Map<String, Object> locals = new LinkedHashMap<>();
        for (int i = 0; i < names.length; i++) {
            locals.put(names[i], values[i]);
        }
        dispatch(hook, new TraceFrame(function, sourceFile, line, locals));
    }

    private static void dispatch(LineHook hook, TraceFrame frame) {
        try {
            hook.onLine(frame);
        } catch (RuntimeException e) {
            System.err.println("[ghost-agent] WARNING: line hook failed at " + frame.functionName()
                + ":" + frame.line() + ": " + e);
        }
    }
}
