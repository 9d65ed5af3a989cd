package com.agenttrace.core;

import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.TraceGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans lifecycle events out to hooks, isolating each callback.
 * Also the single place diagnostics are handed to the {@link DiagnosticListener}.
 */
public final class HookDispatcher {

    private final List<TracerHook> hooks;
    private final DiagnosticListener diagnostics;

    public HookDispatcher(List<? extends TracerHook> hooks, DiagnosticListener diagnostics) {
        this.hooks = hooks == null ? List.of() : List.copyOf(hooks);
        this.diagnostics = diagnostics != null ? diagnostics : DiagnosticListener.logging();
    }

    public static HookDispatcher none() {
        return new HookDispatcher(List.of(), DiagnosticListener.logging());
    }

    public List<TracerHook> hooks() {
        return hooks;
    }

    public void nodeStarted(Node node, String traceId) {
        dispatch("on_node_started", traceId, hook -> hook.onNodeStarted(node, traceId));
    }

    public void nodeCompleted(Node node, String traceId) {
        dispatch("on_node_completed", traceId, hook -> hook.onNodeCompleted(node, traceId));
    }

    public void nodeFailed(Node node, String traceId) {
        dispatch("on_node_failed", traceId, hook -> hook.onNodeFailed(node, traceId));
    }

    public void traceCompleted(TraceGraph trace) {
        dispatch("on_trace_completed", trace.traceId(), hook -> hook.onTraceCompleted(trace));
    }

    private void dispatch(String callback, String traceId, Consumer<TracerHook> call) {
        for (TracerHook hook : hooks) {
            try {
                call.accept(hook);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                report(new Diagnostic(
                    Diagnostic.Kind.HOOK_FAILED,
                    "hook error in " + callback + " (" + hook.getClass().getName() + "): " + t.getMessage(),
                    traceId,
                    t));
            }
        }
    }

    public void report(Diagnostic diagnostic) {
        try {
            diagnostics.onDiagnostic(diagnostic);
        } catch (RuntimeException e) {
            LOGGER.warn("Diagnostic listener failed while reporting {}: {}", diagnostic.kind(), diagnostic.message(), e);
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(HookDispatcher.class);
}
