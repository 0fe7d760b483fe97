package com.ghosttrace.analyzer.cfg;

/** Why control can move along an edge. */
public enum EdgeKind {
    FALLTHROUGH,
    BRANCH,
    JUMP,
    LOOP_BODY,
    LOOP_EXIT
}
