package com.ghosttrace.agent;

import com.ghosttrace.analyzer.manifest.AnalysisManifest;

import java.time.Duration;

/**
 * Settings for one monitoring session.
 *
 * @param pollInterval time between two snapshots while the program runs
 * @param sourceMarker substring a frame's source file must contain to be traced
 */
public record MonitorConfig(Duration pollInterval, String sourceMarker) {

    public static final long DEFAULT_POLL_INTERVAL_MS = 500;
    public static final String DEFAULT_SOURCE_MARKER = ".java";

    public MonitorConfig {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (sourceMarker == null || sourceMarker.isEmpty()) {
            throw new IllegalArgumentException("sourceMarker is required");
        }
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(Duration.ofMillis(DEFAULT_POLL_INTERVAL_MS), DEFAULT_SOURCE_MARKER);
    }

    public static MonitorConfig from(AnalysisManifest manifest) {
        return new MonitorConfig(Duration.ofMillis(manifest.getPollIntervalMs()), manifest.getSourceMarker());
    }
}
