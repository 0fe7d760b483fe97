package com.ghosttrace.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One execution point reported by instrumented code.
 *
 * @param functionName    qualified function name, e.g. {@code com.shop.Cart.total}
 * @param sourceFile      source file of the executing frame, or null when unknown
 * @param line            current line, or null when unknown
 * @param annotatedLocals explicitly typed locals visible at this point, in declaration order
 */
public record TraceFrame(
    String functionName,
    String sourceFile,
    Integer line,
    Map<String, Object> annotatedLocals
) {

    public TraceFrame {
        if (functionName == null) {
            throw new IllegalArgumentException("functionName is required");
        }
        // Values are live references; only the map itself is copied. Map.copyOf would reject nulls.
        annotatedLocals = annotatedLocals == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(annotatedLocals));
    }
}
