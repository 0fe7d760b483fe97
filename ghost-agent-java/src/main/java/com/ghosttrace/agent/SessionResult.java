package com.ghosttrace.agent;

/**
 * Outcome of {@link GhostSession#run}: the program's return value or its error, plus the report.
 */
public record SessionResult<T>(T value, Throwable error, MonitorReport report) {

    public boolean failed() {
        return error != null;
    }
}
