package com.ghosttrace.agent;

/**
 * Receives one {@link TraceFrame} per traced execution point.
 * Called on the program's own threads, so implementations must be thread-safe.
 */
public interface LineHook {

    void onLine(TraceFrame frame);
}
