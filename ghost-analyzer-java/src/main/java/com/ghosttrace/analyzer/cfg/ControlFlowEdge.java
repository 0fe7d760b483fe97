package com.ghosttrace.analyzer.cfg;

import java.util.concurrent.atomic.LongAdder;

/**
 * A directed edge between two blocks with its own hit counter.
 */
public final class ControlFlowEdge {

    /** Immutable key for a directed edge. Records provide equals/hashCode. */
    public record Key(int source, int target) {}

    private final Key key;
    private final EdgeKind kind;
    private final LongAdder hits = new LongAdder();

    ControlFlowEdge(int source, int target, EdgeKind kind) {
        this.key = new Key(source, target);
        this.kind = kind;
    }

    public Key key() { return key; }
    public int source() { return key.source(); }
    public int target() { return key.target(); }
    public EdgeKind kind() { return kind; }

    public long hitCount() { return hits.sum(); }

    void recordHit() { hits.increment(); }

    @Override
    public String toString() {
        return "bb" + key.source() + " -> bb" + key.target() + " (" + kind + ")";
    }
}
