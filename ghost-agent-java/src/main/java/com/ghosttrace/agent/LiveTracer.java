package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects the latest value of every traced variable, per function.
 *
 * Values are rendered to strings on the reporting thread, outside the lock, at the moment the
 * line runs. The lock only guards the string store: one frame's writes land together, and
 * {@link #getVariableValues()} copies strings. Values survive {@link #stopTracking()}; a
 * restarted tracer keeps adding to them.
 *
 * Once CFGs are attached with {@link #attributeTo(Map)}, every matching frame also bumps block
 * and edge counters on them.
 */
public class LiveTracer implements LineHook {

    private final String sourceMarker;
    private final RenderLimits renderLimits;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, String>> values = new LinkedHashMap<>();
    private volatile BlockAttribution attribution;

    public LiveTracer() {
        this(MonitorConfig.DEFAULT_SOURCE_MARKER, RenderLimits.defaults());
    }

    public LiveTracer(String sourceMarker, RenderLimits renderLimits) {
        if (sourceMarker == null || sourceMarker.isEmpty()) {
            throw new IllegalArgumentException("sourceMarker is required");
        }
        this.sourceMarker = sourceMarker;
        this.renderLimits = renderLimits;
    }

    /**
     * Installs this tracer as the process-wide hook. No-op if it is already installed.
     *
     * @throws IllegalStateException if a different hook is installed
     */
    public void startTracking() {
        if (ExecutionHooks.current() == this) return;
        if (!ExecutionHooks.install(this)) {
            throw new IllegalStateException("Another tracer is already installed: " + ExecutionHooks.current());
        }
    }

    public void stopTracking() {
        ExecutionHooks.uninstall(this);
    }

    public boolean isTracking() {
        return ExecutionHooks.current() == this;
    }

    public String sourceMarker() { return sourceMarker; }

    /** Starts attributing traced lines to blocks of {@code cfgs}. */
    public void attributeTo(Map<String, ControlFlowGraph> cfgs) {
        attribution = new BlockAttribution(cfgs);
    }

    @Override
    public void onLine(TraceFrame frame) {
        if (frame.sourceFile() == null || !frame.sourceFile().contains(sourceMarker)) return;
        BlockAttribution blocks = attribution;
        if (blocks != null) blocks.record(frame);
        if (frame.annotatedLocals().isEmpty()) return;

        Map<String, String> rendered = new LinkedHashMap<>();
        for (Map.Entry<String, Object> local : frame.annotatedLocals().entrySet()) {
            rendered.put(local.getKey(), renderSafely(local.getValue()));
        }
        lock.lock();
        try {
            values.computeIfAbsent(frame.functionName(), k -> new LinkedHashMap<>()).putAll(rendered);
        } finally {
            lock.unlock();
        }
    }

    /** A value another thread is mutating can fail to render; the line still gets recorded. */
    private String renderSafely(Object value) {
        try {
            return ValueSerializer.render(value, renderLimits);
        } catch (RuntimeException e) {
            return "<unrenderable: " + e.getClass().getSimpleName() + ">";
        }
    }

    public TraceSnapshot getVariableValues() {
        lock.lock();
        try {
            Map<String, Map<String, String>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, String>> fn : values.entrySet()) {
                copy.put(fn.getKey(), new LinkedHashMap<>(fn.getValue()));
            }
            return new TraceSnapshot(copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "LiveTracer[marker=" + sourceMarker + "]";
    }
}
