package com.ghosttrace.agent;

/**
 * Bounds applied by {@link ValueSerializer} when it expands a traced value.
 *
 * @param maxDepth    object graph depth at which a value collapses to {@code <Type>}
 * @param maxElements array, collection or map entries shown before the {@code ...+N} tail
 */
public record RenderLimits(int maxDepth, int maxElements) {

    public static final int DEFAULT_MAX_DEPTH = 2;
    public static final int DEFAULT_MAX_ELEMENTS = 3;

    public RenderLimits {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        if (maxElements < 0) {
            throw new IllegalArgumentException("maxElements must not be negative: " + maxElements);
        }
    }

    public static RenderLimits defaults() {
        return new RenderLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_ELEMENTS);
    }
}
