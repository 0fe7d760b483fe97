package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GhostMonitorTest {

    private static final Duration FAST = Duration.ofMillis(20);
    private static final Duration WAIT = Duration.ofSeconds(5);

    /** Records every callback in order and lets tests wait for the first poll. */
    static class RecordingListener implements MonitorListener {
        final List<String> events = Collections.synchronizedList(new ArrayList<>());
        final List<TraceSnapshot> polls = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch firstPoll = new CountDownLatch(1);
        final AtomicReference<Thread> thread = new AtomicReference<>();

        @Override
        public void onCfgsPublished(Map<String, ControlFlowGraph> cfgs) {
            thread.set(Thread.currentThread());
            events.add("cfgs:" + cfgs.size());
        }

        @Override
        public void onPoll(int pollNumber, TraceSnapshot snapshot) {
            events.add("poll:" + pollNumber);
            polls.add(snapshot);
            firstPoll.countDown();
        }

        @Override
        public void onReport(MonitorReport report) {
            events.add("report");
        }
    }

    private final LiveTracer tracer = new LiveTracer();
    private final RecordingListener listener = new RecordingListener();

    private GhostMonitor monitor(Duration interval, ReportForwarder forwarder) {
        return new GhostMonitor(tracer, new MonitorConfig(interval, ".java"), listener, forwarder);
    }

    @Test
    void nothingIsPolledBeforeCfgsArePublished() throws Exception {
        tracer.onLine(AgentFixtures.frame("a.A.f", "A.java", Map.of("x", 1)));
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();

        Thread.sleep(150);
        assertTrue(listener.events.isEmpty());
        assertEquals(GhostMonitor.Phase.AWAITING_CFG, monitor.phase());

        assertTrue(monitor.publishCfgs(AgentFixtures.cfgs("mod")));
        assertTrue(listener.firstPoll.await(5, TimeUnit.SECONDS));
        monitor.notifyFinished(null);
        MonitorReport report = monitor.awaitReport(WAIT);

        assertEquals("cfgs:1", listener.events.get(0));
        assertEquals("poll:1", listener.events.get(1));
        assertEquals("report", listener.events.get(listener.events.size() - 1));
        assertEquals(GhostMonitor.Phase.DONE, monitor.phase());
        assertEquals(1, report.cfgs().size());
        assertTrue(report.pollCount() >= 1);
        assertEquals("1", report.finalSnapshot().value("a.A.f", "x").orElseThrow());
    }

    @Test
    void monitorRunsOnANamedDaemonThread() throws Exception {
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        monitor.notifyFinished(null);
        monitor.awaitReport(WAIT);

        Thread thread = listener.thread.get();
        assertEquals("ghost-monitor", thread.getName());
        assertTrue(thread.isDaemon());
    }

    @Test
    void emptySnapshotsAreReportedAsNoVariables() throws Exception {
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        assertTrue(listener.firstPoll.await(5, TimeUnit.SECONDS));
        monitor.notifyFinished(null);
        MonitorReport report = monitor.awaitReport(WAIT);

        assertTrue(listener.polls.get(0).isEmpty());
        assertEquals("no variables yet", TraceRenderer.render(listener.polls.get(0)));
        assertTrue(report.render().contains("Variables:\nno variables yet"));
    }

    @Test
    void programErrorEndsUpInTheReport() throws Exception {
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        tracer.onLine(AgentFixtures.frame("a.A.f", "A.java", Map.of("x", 7)));
        assertTrue(monitor.notifyFinished(new IllegalStateException("boom")));

        MonitorReport report = monitor.awaitReport(WAIT);
        assertEquals("boom", report.error().getMessage());
        assertFalse(report.cancelled());
        assertEquals("7", report.finalSnapshot().value("a.A.f", "x").orElseThrow());
        assertTrue(report.render().contains("Error: java.lang.IllegalStateException: boom"));
    }

    @Test
    void notifyFinishedKeepsTheFirstError() throws Exception {
        GhostMonitor monitor = monitor(FAST, null);
        assertTrue(monitor.notifyFinished(new RuntimeException("first")));
        assertFalse(monitor.notifyFinished(new RuntimeException("second")));
        assertFalse(monitor.notifyFinished(null));

        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        MonitorReport report = monitor.awaitReport(WAIT);
        assertEquals("first", report.error().getMessage());
        assertEquals(0, report.pollCount(), "already finished before polling began");
    }

    @Test
    void cancelWhileAwaitingCfgsStillProducesAReport() throws Exception {
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();
        monitor.cancel();

        MonitorReport report = monitor.awaitReport(WAIT);
        assertTrue(report.cancelled());
        assertTrue(report.cfgs().isEmpty());
        assertEquals(0, report.pollCount());
        assertTrue(report.finalSnapshot().isEmpty());
        assertEquals(List.of("report"), listener.events);
    }

    @Test
    void cancelWakesThePollSleep() throws Exception {
        GhostMonitor monitor = monitor(Duration.ofHours(1), null);
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        assertTrue(listener.firstPoll.await(5, TimeUnit.SECONDS));

        monitor.cancel();
        MonitorReport report = monitor.awaitReport(WAIT);
        assertTrue(report.cancelled());
        assertEquals(1, report.pollCount());
        assertTrue(report.render().endsWith("Cancelled"));
    }

    @Test
    void forwarderReceivesTheRenderedReport() throws Exception {
        AtomicReference<String> forwarded = new AtomicReference<>();
        GhostMonitor monitor = monitor(FAST, forwarded::set);
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        monitor.notifyFinished(null);

        MonitorReport report = monitor.awaitReport(WAIT);
        assertEquals(report.render(), forwarded.get());
        assertTrue(forwarded.get().startsWith("CFG mod:\nNode bb0"));
    }

    @Test
    void failingForwarderDoesNotFailTheReport() throws Exception {
        GhostMonitor monitor = monitor(FAST, text -> { throw new java.io.IOException("unreachable host"); });
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        monitor.notifyFinished(null);

        MonitorReport report = monitor.awaitReport(WAIT);
        assertNotNull(report);
        assertEquals(GhostMonitor.Phase.DONE, monitor.phase());
    }

    @Test
    void onlyTheFirstPublicationCounts() throws Exception {
        GhostMonitor monitor = monitor(FAST, null);
        assertThrows(IllegalArgumentException.class, () -> monitor.publishCfgs(Map.of()));
        assertTrue(monitor.publishCfgs(AgentFixtures.cfgs("first")));
        assertFalse(monitor.publishCfgs(AgentFixtures.cfgs("second", "third")));

        monitor.start();
        monitor.notifyFinished(null);
        MonitorReport report = monitor.awaitReport(WAIT);
        assertEquals(List.of("first"), List.copyOf(report.cfgs().keySet()));
    }

    @Test
    void startingTwiceIsRejected() {
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();
        try {
            assertThrows(IllegalStateException.class, monitor::start);
        } finally {
            monitor.cancel();
        }
    }

    @Test
    void awaitReportTimesOutWhileCfgsAreMissing() {
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();
        try {
            assertThrows(java.util.concurrent.TimeoutException.class,
                () -> monitor.awaitReport(Duration.ofMillis(100)));
        } finally {
            monitor.cancel();
        }
    }

    @Test
    void mapMutatedByTheProgramWhileTracedStillYieldsAReport() throws Exception {
        Map<Integer, Integer> shared = new HashMap<>();
        AtomicBoolean stop = new AtomicBoolean();
        GhostMonitor monitor = monitor(Duration.ofMillis(1), null);
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));

        Thread mutator = new Thread(() -> {
            for (int i = 0; !stop.get(); i++) {
                shared.put(i % 64, i);
                shared.remove((i + 32) % 64);
            }
        });
        Thread program = new Thread(() -> {
            while (!stop.get()) {
                tracer.onLine(AgentFixtures.frame("a.A.f", "A.java", Map.of("shared", shared)));
            }
        });
        mutator.start();
        program.start();
        try {
            assertTrue(listener.firstPoll.await(5, TimeUnit.SECONDS));
            Thread.sleep(200);
        } finally {
            stop.set(true);
            mutator.join(5000);
            program.join(5000);
        }

        monitor.notifyFinished(null);
        MonitorReport report = monitor.awaitReport(WAIT);
        assertTrue(report.pollCount() >= 1);
        assertTrue(report.finalSnapshot().value("a.A.f", "shared").isPresent());
        assertEquals(GhostMonitor.Phase.DONE, monitor.phase());
    }

    @Test
    void failingListenerDoesNotStopTheMonitor() throws Exception {
        MonitorListener broken = new MonitorListener() {
            @Override
            public void onPoll(int pollNumber, TraceSnapshot snapshot) {
                throw new IllegalStateException("listener bug");
            }
        };
        GhostMonitor monitor = new GhostMonitor(tracer, new MonitorConfig(FAST, ".java"), broken, null);
        monitor.start();
        monitor.publishCfgs(AgentFixtures.cfgs("mod"));
        Thread.sleep(100);
        monitor.notifyFinished(null);

        MonitorReport report = monitor.awaitReport(WAIT);
        assertTrue(report.pollCount() >= 1);
    }

    @Test
    void publishedCfgsCountTracedBlocks() throws Exception {
        GhostMonitor monitor = monitor(FAST, null);
        monitor.start();
        Map<String, ControlFlowGraph> cfgs = AgentFixtures.cfgs("app.Cart.mod");
        monitor.publishCfgs(cfgs);
        assertTrue(listener.firstPoll.await(5, TimeUnit.SECONDS));

        tracer.onLine(AgentFixtures.frameAt("app.Cart.mod", "Cart.java", 1, Map.of("x", 1)));
        tracer.onLine(AgentFixtures.frameAt("app.Cart.mod", "Cart.java", 3, Map.of("x", 2)));
        monitor.notifyFinished(null);
        MonitorReport report = monitor.awaitReport(WAIT);

        ControlFlowGraph cfg = report.cfgs().get("app.Cart.mod");
        assertEquals(1, cfg.partition().block(0).executionCount());
        assertEquals(1, cfg.partition().block(2).executionCount());
        assertEquals(1, cfg.edge(0, 2).orElseThrow().hitCount());
    }
}
