package com.agenttrace.core;

import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.TraceGraph;

/**
 * Observer of trace lifecycle events. Override any subset; the rest are no-ops.
 *
 * Callbacks run synchronously on the thread that caused the event and should return quickly.
 * An exception thrown from a callback is reported as a diagnostic and does not affect the trace
 * or the other hooks.
 */
public interface TracerHook {

    default void onNodeStarted(Node node, String traceId) {}

    default void onNodeCompleted(Node node, String traceId) {}

    default void onNodeFailed(Node node, String traceId) {}

    /** Fires once per trace, after the root node exits and the save has been attempted. */
    default void onTraceCompleted(TraceGraph trace) {}
}
