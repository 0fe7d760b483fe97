package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * One tracing context: a {@link LiveTracer} plus the {@link GhostMonitor} that watches it.
 *
 * The tracer is installed through {@link ExecutionHooks}, so only one session can trace at a time.
 */
public class GhostSession {

    /** How long {@link #finish} waits for the monitor after a cancel. */
    static final Duration CANCEL_GRACE = Duration.ofSeconds(1);

    private final LiveTracer tracer;
    private final GhostMonitor monitor;

    public GhostSession(MonitorConfig config, MonitorListener listener, ReportForwarder forwarder) {
        this.tracer = new LiveTracer(config.sourceMarker(), RenderLimits.defaults());
        this.monitor = new GhostMonitor(tracer, config, listener, forwarder);
    }

    public GhostSession(LiveTracer tracer, GhostMonitor monitor) {
        this.tracer = tracer;
        this.monitor = monitor;
    }

    public LiveTracer tracer() { return tracer; }
    public GhostMonitor monitor() { return monitor; }

    /**
     * Installs the tracer and starts the monitor thread.
     *
     * @throws IllegalStateException if another tracer is installed or the monitor already started
     */
    public void start() {
        tracer.startTracking();
        try {
            monitor.start();
        } catch (IllegalStateException e) {
            tracer.stopTracking();
            throw e;
        }
    }

    public boolean publishCfgs(Map<String, ControlFlowGraph> cfgs) {
        return monitor.publishCfgs(cfgs);
    }

    /**
     * Runs {@code program} on the calling thread under tracing and waits for the final report.
     * An exception from the program is captured into the result and the report, not rethrown.
     */
    public <T> SessionResult<T> run(Callable<T> program, Duration reportTimeout) throws InterruptedException {
        start();
        T value = null;
        Throwable error = null;
        try {
            value = program.call();
        } catch (Exception e) {
            error = e;
        } catch (Error e) {
            finish(e, reportTimeout);
            throw e;
        }
        MonitorReport report = finish(error, reportTimeout);
        return new SessionResult<>(value, error, report);
    }

    /**
     * Stops tracing, signals the monitor and waits up to {@code timeout} for its report.
     * A monitor that does not report in time (e.g. CFGs never published) is cancelled.
     */
    public MonitorReport finish(Throwable error, Duration timeout) throws InterruptedException {
        tracer.stopTracking();
        monitor.notifyFinished(error);
        try {
            return monitor.awaitReport(timeout);
        } catch (TimeoutException e) {
            System.err.println("[ghost-agent] WARNING: no monitor report after " + timeout.toMillis()
                + " ms; cancelling monitor");
            monitor.cancel();
            try {
                return monitor.awaitReport(CANCEL_GRACE);
            } catch (TimeoutException again) {
                throw new IllegalStateException("Monitor did not stop after cancel", again);
            }
        }
    }
}
