package com.ghosttrace.agent;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State shared by the program and the monitor thread: the one-shot CFG publication and the
 * (finished, error) pair. The pair only changes together, under {@link #lock}.
 */
final class MonitorState {

    private final CompletableFuture<Map<String, ControlFlowGraph>> cfgs = new CompletableFuture<>();
    private final ReentrantLock lock = new ReentrantLock();
    private boolean finished;
    private Throwable error;

    /** Completes the CFG future. Returns false if it was already completed. */
    boolean publish(Map<String, ControlFlowGraph> published) {
        return cfgs.complete(published);
    }

    CompletableFuture<Map<String, ControlFlowGraph>> cfgs() {
        return cfgs;
    }

    /** Marks the program finished. The first call wins; later calls return false. */
    boolean finish(Throwable terminalError) {
        lock.lock();
        try {
            if (finished) return false;
            finished = true;
            error = terminalError;
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isFinished() {
        lock.lock();
        try {
            return finished;
        } finally {
            lock.unlock();
        }
    }

    Throwable error() {
        lock.lock();
        try {
            return error;
        } finally {
            lock.unlock();
        }
    }
}
