package com.agenttrace.core;

import com.agenttrace.core.model.Node;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Ambient trace and node captured at fork time.
 *
 * A wrapped task installs the snapshot on whichever thread runs it and restores that thread's own
 * values afterwards. Each run starts from the snapshot, so pushes made inside one branch are never
 * seen by a sibling branch.
 */
public final class ContextSnapshot {

    private final ActiveTrace trace;
    private final Node node;

    ContextSnapshot(ActiveTrace trace, Node node) {
        this.trace = trace;
        this.node = node;
    }

    public ActiveTrace trace() {
        return trace;
    }

    public Node node() {
        return node;
    }

    public Runnable wrap(Runnable task) {
        return () -> {
            ContextToken<ActiveTrace> traceToken = TraceContext.pushTrace(trace);
            ContextToken<Node> nodeToken = TraceContext.pushNode(node);
            try {
                task.run();
            } finally {
                nodeToken.reset();
                traceToken.reset();
            }
        };
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        return () -> {
            ContextToken<ActiveTrace> traceToken = TraceContext.pushTrace(trace);
            ContextToken<Node> nodeToken = TraceContext.pushNode(node);
            try {
                return task.call();
            } finally {
                nodeToken.reset();
                traceToken.reset();
            }
        };
    }

    public <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        return () -> {
            ContextToken<ActiveTrace> traceToken = TraceContext.pushTrace(trace);
            ContextToken<Node> nodeToken = TraceContext.pushNode(node);
            try {
                return task.get();
            } finally {
                nodeToken.reset();
                traceToken.reset();
            }
        };
    }

    /** Executor that runs every submitted task under this snapshot. */
    public Executor executor(Executor delegate) {
        return command -> delegate.execute(wrap(command));
    }
}
