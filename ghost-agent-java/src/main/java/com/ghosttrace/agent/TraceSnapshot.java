package com.ghosttrace.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable point-in-time copy of the traced variables: function name, then variable name,
 * then rendered value. Functions iterate in name order, variables in first-seen order.
 */
public final class TraceSnapshot {

    private static final TraceSnapshot EMPTY = new TraceSnapshot(Map.of());

    private final Map<String, Map<String, String>> values;

    public TraceSnapshot(Map<String, Map<String, String>> values) {
        Map<String, Map<String, String>> copy = new TreeMap<>();
        for (Map.Entry<String, Map<String, String>> e : values.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static TraceSnapshot empty() {
        return EMPTY;
    }

    public Map<String, Map<String, String>> values() { return values; }

    public Map<String, String> variables(String function) {
        return values.getOrDefault(function, Map.of());
    }

    public Optional<String> value(String function, String variable) {
        return Optional.ofNullable(variables(function).get(variable));
    }

    public boolean isEmpty() { return values.isEmpty(); }

    public int variableCount() {
        return values.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TraceSnapshot other && values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "TraceSnapshot" + values; }
}
