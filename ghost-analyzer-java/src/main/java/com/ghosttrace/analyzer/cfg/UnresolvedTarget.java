package com.ghosttrace.analyzer.cfg;

/**
 * A branch, jump or loop target that no block contains. Kept on the CFG instead of being
 * dropped so callers can see the control flow the graph is missing.
 *
 * @param blockId           block whose last instruction produced the target
 * @param instructionOffset offset of that instruction
 * @param targetOffset      the offset that failed to resolve
 * @param kind              the edge that would have been added
 */
public record UnresolvedTarget(int blockId, int instructionOffset, int targetOffset, EdgeKind kind) {}
