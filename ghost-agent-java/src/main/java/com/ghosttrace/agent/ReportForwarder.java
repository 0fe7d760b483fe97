package com.ghosttrace.agent;

/**
 * Receives the rendered final report, e.g. to post it somewhere.
 * A forwarder that throws is logged by the monitor and otherwise ignored.
 */
@FunctionalInterface
public interface ReportForwarder {

    void forward(String renderedReport) throws Exception;
}
