package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Watches a running program from a daemon thread.
 *
 * Lifecycle: {@code IDLE -> AWAITING_CFG -> POLLING -> FINALIZING -> DONE}. The monitor blocks until
 * the CFGs are published, then snapshots the tracer every poll interval until the program reports
 * it has finished, and finally builds one {@link MonitorReport}. Trace data is never read before
 * the CFGs arrive.
 *
 * {@link #cancel()} wakes the wait for the CFGs and the sleep between polls, and is checked at
 * every loop entry. A cancelled monitor still produces a report.
 */
public class GhostMonitor {

    public enum Phase { IDLE, AWAITING_CFG, POLLING, FINALIZING, DONE }

    static final String THREAD_NAME = "ghost-monitor";

    private final LiveTracer tracer;
    private final MonitorConfig config;
    private final MonitorListener listener;
    private final ReportForwarder forwarder;

    private final MonitorState state = new MonitorState();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CompletableFuture<Void> cancelSignal = new CompletableFuture<>();
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.IDLE);
    private final CompletableFuture<MonitorReport> report = new CompletableFuture<>();

    // Monitor thread only.
    private TraceSnapshot lastGood = TraceSnapshot.empty();

    public GhostMonitor(LiveTracer tracer, MonitorConfig config) {
        this(tracer, config, new StderrMonitorListener(), null);
    }

    /**
     * @param forwarder optional; receives the rendered report after it is built
     */
    public GhostMonitor(LiveTracer tracer, MonitorConfig config, MonitorListener listener, ReportForwarder forwarder) {
        this.tracer = tracer;
        this.config = config;
        this.listener = listener;
        this.forwarder = forwarder;
    }

    /**
     * Starts the monitor thread.
     *
     * @throws IllegalStateException if the monitor was already started
     */
    public void start() {
        if (!phase.compareAndSet(Phase.IDLE, Phase.AWAITING_CFG)) {
            throw new IllegalStateException("Monitor already started (phase " + phase.get() + ")");
        }
        Thread thread = new Thread(this::run, THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Hands the CFGs to the monitor. Only the first publication counts.
     *
     * @return false if CFGs were already published
     * @throws IllegalArgumentException if {@code cfgs} is empty
     */
    public boolean publishCfgs(Map<String, ControlFlowGraph> cfgs) {
        if (cfgs == null || cfgs.isEmpty()) {
            throw new IllegalArgumentException("Cannot publish an empty CFG map");
        }
        boolean first = state.publish(Collections.unmodifiableMap(new LinkedHashMap<>(cfgs)));
        if (!first) {
            System.err.println("[ghost-monitor] WARNING: CFGs already published; ignoring second publication");
        }
        return first;
    }

    /**
     * Signals that the program has finished, with its terminal error or null.
     * The first call wins; later calls return false and change nothing.
     */
    public boolean notifyFinished(Throwable error) {
        return state.finish(error);
    }

    public void cancel() {
        cancelled.countDown();
        cancelSignal.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public Phase phase() {
        return phase.get();
    }

    /** Completes when the report is built; completes exceptionally if the monitor thread failed. */
    public CompletableFuture<MonitorReport> report() {
        return report;
    }

    public MonitorReport awaitReport(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return report.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Monitor failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    // -----------------------------------------------------------------------
    // Monitor thread
    // -----------------------------------------------------------------------

    private void run() {
        try {
            Map<String, ControlFlowGraph> cfgs = awaitCfgs();
            int polls = 0;
            TraceSnapshot last = TraceSnapshot.empty();

            if (cfgs != null) {
                tracer.attributeTo(cfgs);
                notifyListener(() -> listener.onCfgsPublished(cfgs));
                phase.set(Phase.POLLING);
                polls = poll();
                last = finalSnapshot();
            }

            phase.set(Phase.FINALIZING);
            MonitorReport result = new MonitorReport(
                cfgs != null ? cfgs : Map.of(), last, polls, state.error(), isCancelled());
            notifyListener(() -> listener.onReport(result));
            forward(result);
            phase.set(Phase.DONE);
            report.complete(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            phase.set(Phase.DONE);
            report.completeExceptionally(e);
        } catch (RuntimeException e) {
            System.err.println("[ghost-monitor] ERROR: monitor thread failed: " + e);
            phase.set(Phase.DONE);
            report.completeExceptionally(e);
        }
    }

    /** Returns the published CFGs, or null if cancelled first. */
    private Map<String, ControlFlowGraph> awaitCfgs() throws InterruptedException {
        try {
            CompletableFuture.anyOf(state.cfgs(), cancelSignal).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("CFG publication failed", e.getCause());
        }
        return isCancelled() ? null : state.cfgs().getNow(null);
    }

    private int poll() throws InterruptedException {
        int polls = 0;
        long intervalMs = config.pollInterval().toMillis();
        while (!isCancelled()) {
            if (state.isFinished()) break;
            try {
                TraceSnapshot snapshot = tracer.getVariableValues();
                lastGood = snapshot;
                int pollNumber = ++polls;
                notifyListener(() -> listener.onPoll(pollNumber, snapshot));
            } catch (RuntimeException e) {
                System.err.println("[ghost-monitor] WARNING: skipping poll " + (polls + 1) + ": " + e);
            }
            if (cancelled.await(intervalMs, TimeUnit.MILLISECONDS)) break;
        }
        return polls;
    }

    private TraceSnapshot finalSnapshot() {
        try {
            return tracer.getVariableValues();
        } catch (RuntimeException e) {
            System.err.println("[ghost-monitor] WARNING: final snapshot failed, reporting the last good one: " + e);
            return lastGood;
        }
    }

    private static void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            System.err.println("[ghost-monitor] WARNING: listener failed: " + e);
        }
    }

    private void forward(MonitorReport result) {
        if (forwarder == null) return;
        try {
            forwarder.forward(result.render());
        } catch (Exception e) {
            System.err.println("[ghost-monitor] WARNING: report forwarding failed: " + e.getMessage());
        }
    }
}
