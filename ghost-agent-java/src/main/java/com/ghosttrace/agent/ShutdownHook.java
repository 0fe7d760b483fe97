package com.ghosttrace.agent;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Finishes the session and writes ghost_report.json on JVM shutdown.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class ShutdownHook implements Runnable {

    static final Duration REPORT_TIMEOUT = Duration.ofSeconds(5);

    private final GhostSession session;
    private final Path outputPath;
    private final Duration timeout;

    public ShutdownHook(GhostSession session, Path outputPath) {
        this(session, outputPath, REPORT_TIMEOUT);
    }

    ShutdownHook(GhostSession session, Path outputPath, Duration timeout) {
        this.session = session;
        this.outputPath = outputPath;
        this.timeout = timeout;
    }

    @Override
    public void run() {
        try {
            MonitorReport report = session.finish(null, timeout);
            new GhostReportWriter().write(new ReportMerger().merge(report), outputPath);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("[ghost-agent] ERROR: interrupted while waiting for the monitor report");
        } catch (Exception e) {
            System.err.println("[ghost-agent] ERROR writing " + GhostReportWriter.REPORT_FILE + ": " + e.getMessage());
        }
    }
}
