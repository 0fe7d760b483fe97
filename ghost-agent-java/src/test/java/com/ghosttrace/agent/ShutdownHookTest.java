package com.ghosttrace.agent;

import com.google.gson.Gson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownHookTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void uninstall() {
        LineHook hook = ExecutionHooks.current();
        if (hook != null) ExecutionHooks.uninstall(hook);
    }

    private static GhostSession session() {
        return new GhostSession(new MonitorConfig(Duration.ofMillis(20), ".java"), new MonitorListener() {}, null);
    }

    @Test
    void writesReportWithCfgsAndVariables() throws IOException {
        GhostSession session = session();
        session.start();
        session.publishCfgs(AgentFixtures.cfgs("checkout"));
        ExecutionHooks.line(AgentFixtures.frame("shop.Cart.checkout", "Cart.java", Map.of("qty", 3)));
        ExecutionHooks.line(AgentFixtures.frame("shop.Cart.audit", "Cart.java", Map.of("ok", true)));

        Path out = tempDir.resolve("nested").resolve(GhostReportWriter.REPORT_FILE);
        new ShutdownHook(session, out).run();

        assertTrue(Files.exists(out));
        String json = Files.readString(out);
        assertTrue(json.contains("\"poll_count\""));
        assertTrue(json.contains("\"unmatched_functions\""));

        GhostReport report = new Gson().fromJson(json, GhostReport.class);
        assertEquals(1, report.modules.size());
        assertEquals("checkout", report.modules.get(0).name);
        assertEquals(List.of("shop.Cart.audit", "shop.Cart.checkout"),
            report.variables.stream().map(v -> v.function).toList());
        assertEquals("3", report.variables.get(1).values.get("qty"));
        assertEquals(List.of("shop.Cart.audit"), report.unmatchedFunctions);
        assertNull(report.error);
        assertFalse(report.cancelled);
        assertFalse(session.tracer().isTracking());
    }

    @Test
    void recordedErrorSurvivesShutdown() throws IOException {
        GhostSession session = session();
        session.start();
        session.publishCfgs(AgentFixtures.cfgs("checkout"));
        session.monitor().notifyFinished(new IllegalStateException("crashed"));

        Path out = tempDir.resolve(GhostReportWriter.REPORT_FILE);
        new ShutdownHook(session, out).run();

        GhostReport report = new Gson().fromJson(Files.readString(out), GhostReport.class);
        assertEquals("java.lang.IllegalStateException: crashed", report.error);
    }

    @Test
    void unpublishedCfgsStillYieldACancelledReport() throws IOException {
        GhostSession session = session();
        session.start();

        Path out = tempDir.resolve(GhostReportWriter.REPORT_FILE);
        new ShutdownHook(session, out, Duration.ofMillis(100)).run();

        GhostReport report = new Gson().fromJson(Files.readString(out), GhostReport.class);
        assertTrue(report.cancelled);
        assertTrue(report.modules.isEmpty());
    }

    @Test
    void neverStartedSessionDoesNotThrow() {
        Path out = tempDir.resolve(GhostReportWriter.REPORT_FILE);
        assertDoesNotThrow(() -> new ShutdownHook(session(), out, Duration.ofMillis(50)).run());
        assertFalse(Files.exists(out));
    }

    @Test
    void mergerMatchesFunctionsBySimpleOrQualifiedName() {
        MonitorReport report = new MonitorReport(
            AgentFixtures.cfgs("checkout", "shop.Cart.total"),
            new TraceSnapshot(Map.of(
                "shop.Cart.checkout", Map.of("a", "1"),
                "shop.Cart.total", Map.of("b", "2"),
                "shop.Cart.other", Map.of("c", "3"))),
            4, null, false);

        GhostReport merged = new ReportMerger().merge(report);
        assertEquals(List.of("shop.Cart.other"), merged.unmatchedFunctions);
        assertEquals(4, merged.pollCount);
        assertEquals(2, merged.modules.size());
        assertEquals("0.1", merged.reportVersion);
    }

    @Test
    void simpleNameIsTheLastSegment() {
        assertEquals("total", ReportMerger.simpleName("shop.Cart.total"));
        assertEquals("main", ReportMerger.simpleName("main"));
    }
}
