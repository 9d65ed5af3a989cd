package com.agenttrace.core;

import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.TraceGraph;

import java.util.concurrent.Callable;

/**
 * Ambient "current trace" and "current node" for the running thread.
 *
 * Every push returns a {@link ContextToken}; callers reset it exactly once, in a finally block,
 * so nested scopes unwind in order. Work handed to other threads sees nothing unless it runs under
 * a {@link #fork() snapshot}.
 */
public final class TraceContext {

    private TraceContext() {}

    private static final ThreadLocal<ActiveTrace> currentTrace = new ThreadLocal<>();
    private static final ThreadLocal<Node> currentNode = new ThreadLocal<>();

    /** The active trace on this thread, or null. */
    public static ActiveTrace currentTrace() {
        return currentTrace.get();
    }

    /** Graph of the active trace on this thread, or null. */
    public static TraceGraph currentGraph() {
        ActiveTrace trace = currentTrace.get();
        return trace != null ? trace.graph() : null;
    }

    /** The innermost entered node on this thread, or null. */
    public static Node currentNode() {
        return currentNode.get();
    }

    public static ContextToken<ActiveTrace> pushTrace(ActiveTrace trace) {
        ContextToken<ActiveTrace> token = new ContextToken<>(currentTrace, currentTrace.get());
        set(currentTrace, trace);
        return token;
    }

    /** Installs {@code node} (null allowed) as the current node. */
    public static ContextToken<Node> pushNode(Node node) {
        ContextToken<Node> token = new ContextToken<>(currentNode, currentNode.get());
        set(currentNode, node);
        return token;
    }

    public static void reset(ContextToken<?> token) {
        token.reset();
    }

    /** Drops both slots on this thread. */
    public static void clear() {
        currentTrace.remove();
        currentNode.remove();
    }

    /** Copies the current trace and node into an immutable snapshot for another branch. */
    public static ContextSnapshot fork() {
        return new ContextSnapshot(currentTrace.get(), currentNode.get());
    }

    public static Runnable wrap(Runnable task) {
        return fork().wrap(task);
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        return fork().wrap(task);
    }

    private static <T> void set(ThreadLocal<T> slot, T value) {
        if (value == null) {
            slot.remove();
        } else {
            slot.set(value);
        }
    }
}
