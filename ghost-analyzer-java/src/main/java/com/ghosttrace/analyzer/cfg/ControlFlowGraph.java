package com.ghosttrace.analyzer.cfg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph of basic-block IDs for one code unit.
 *
 * Structure is append-only while {@link CfgBuilder} fills it and fixed afterwards; only the
 * block and edge counters change once the graph is published.
 */
public final class ControlFlowGraph {

    private final String name;
    private final BlockPartition partition;
    private final SortedSet<Integer> nodes = new TreeSet<>();
    private final Map<Integer, List<Integer>> successors = new TreeMap<>();
    private final Map<ControlFlowEdge.Key, ControlFlowEdge> edges = new LinkedHashMap<>();
    private final List<UnresolvedTarget> unresolved = new ArrayList<>();

    ControlFlowGraph(String name, BlockPartition partition) {
        this.name = name;
        this.partition = partition;
    }

    // -----------------------------------------------------------------------
    // Construction (CfgBuilder only)
    // -----------------------------------------------------------------------

    void addNode(int id) {
        nodes.add(id);
        successors.computeIfAbsent(id, k -> new ArrayList<>());
    }

    /** Adds an edge unless the same (source, target) pair already exists. */
    boolean addEdge(int source, int target, EdgeKind kind) {
        ControlFlowEdge.Key key = new ControlFlowEdge.Key(source, target);
        if (edges.containsKey(key)) return false;
        addNode(source);
        successors.get(source).add(target);
        edges.put(key, new ControlFlowEdge(source, target, kind));
        return true;
    }

    void addUnresolved(UnresolvedTarget target) {
        unresolved.add(target);
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    public String name() { return name; }

    public BlockPartition partition() { return partition; }

    public SortedSet<Integer> nodes() { return Collections.unmodifiableSortedSet(nodes); }

    /** Successor block IDs in the order the edges were added. */
    public List<Integer> successors(int id) {
        List<Integer> s = successors.get(id);
        return s == null ? List.of() : Collections.unmodifiableList(s);
    }

    public Optional<ControlFlowEdge> edge(int source, int target) {
        return Optional.ofNullable(edges.get(new ControlFlowEdge.Key(source, target)));
    }

    public Collection<ControlFlowEdge> edges() { return Collections.unmodifiableCollection(edges.values()); }

    public List<UnresolvedTarget> unresolvedTargets() { return Collections.unmodifiableList(unresolved); }

    // -----------------------------------------------------------------------
    // Execution counters
    // -----------------------------------------------------------------------

    /** Bumped by the tracing agent each time a traced line enters block {@code id}. */
    public void recordBlockExecution(int id) {
        partition.block(id).recordExecution();
    }

    /** Bumps the hit counter of edge {@code source -> target}; returns false if there is no such edge. */
    public boolean recordTransition(int source, int target) {
        ControlFlowEdge edge = edges.get(new ControlFlowEdge.Key(source, target));
        if (edge == null) return false;
        edge.recordHit();
        return true;
    }

    @Override
    public String toString() {
        return "ControlFlowGraph[" + name + ", " + nodes.size() + " blocks, " + edges.size() + " edges]";
    }
}
