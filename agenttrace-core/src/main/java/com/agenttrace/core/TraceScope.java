package com.agenttrace.core;

import com.agenttrace.core.config.TracerConfig;
import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.NodeType;
import com.agenttrace.core.model.TraceGraph;
import com.agenttrace.core.storage.TraceStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * One trace, from open to save. Created by {@link Tracer#trace}.
 *
 * Entering makes the trace ambient on the calling thread and starts a root span of type
 * {@code "trace"}. Exiting finishes the root span, restores the caller's context, stamps the graph's
 * end time, saves it and fires {@link TracerHook#onTraceCompleted}. A failed save is reported as a
 * diagnostic; the trace's outcome is unaffected.
 *
 * <pre>
 * String answer = tracer.trace("support-agent").call(root -&gt; {
 *     try (Span plan = root.node("plan", NodeType.DECISION).enter()) {
 *         plan.input("question", question);
 *     }
 *     return "done";
 * });
 * </pre>
 */
public final class TraceScope implements AutoCloseable {

    private final ActiveTrace trace;
    private final TraceStorage storage;

    private ContextToken<ActiveTrace> traceToken;
    private ContextToken<Node> nodeToken;
    private Span root;
    private boolean entered;
    private boolean exited;

    TraceScope(String name, Map<String, ?> metadata, TracerConfig config, TraceStorage storage, HookDispatcher hooks) {
        Map<String, Object> captured = new ValueCapture(config).metadata(metadata != null ? metadata : Map.of());
        TraceGraph graph = new TraceGraph(name, captured, Instant.now());
        this.trace = new ActiveTrace(graph, config, hooks);
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    /**
     * @throws IllegalStateException if this scope was already entered
     */
    public synchronized TraceScope enter() {
        if (entered) {
            throw new IllegalStateException("Trace scope '" + trace.graph().name() + "' has already been entered");
        }
        entered = true;
        traceToken = TraceContext.pushTrace(trace);
        nodeToken = TraceContext.pushNode(null);
        root = new Span(trace, trace.graph().name(), NodeType.TRACE, null);
        root.enter();
        LOGGER.debug("Opened trace {} '{}'", trace.traceId(), trace.graph().name());
        return this;
    }

    @Override
    public void close() {
        exit(null);
    }

    /**
     * Finishes the trace. {@code error} is recorded on the root node; rethrowing it is up to the
     * caller. A second exit is ignored.
     *
     * @throws IllegalStateException if the scope was never entered
     */
    public void exit(Throwable error) {
        synchronized (this) {
            if (!entered) {
                throw new IllegalStateException("Trace scope '" + trace.graph().name() + "' was never entered");
            }
            if (exited) return;
            exited = true;
        }
        try {
            root.exit(error);
        } finally {
            try {
                restoreAmbient();
            } finally {
                finalizeTrace();
            }
        }
    }

    public <T> T call(SpanCallable<T> body) throws Exception {
        enter();
        T result;
        try {
            result = body.call(root);
        } catch (Throwable t) {
            exit(t);
            throw t;
        }
        exit(null);
        return result;
    }

    public void run(SpanRunnable body) throws Exception {
        call(span -> {
            body.run(span);
            return null;
        });
    }

    /**
     * Asynchronous form of {@link #call}: the caller's context is restored once {@code body} returns
     * its stage, and the trace is finalized when the stage completes.
     */
    public <T> CompletableFuture<T> callAsync(Function<? super Span, ? extends CompletionStage<T>> body) {
        enter();
        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(body.apply(root), "async trace body returned null");
        } catch (RuntimeException | Error e) {
            exit(e);
            throw e;
        }
        synchronized (this) {
            exited = true;
        }
        CompletableFuture<T> rootDone = root.exitWhenComplete(stage);
        restoreAmbient();

        CompletableFuture<T> result = new CompletableFuture<>();
        rootDone.whenComplete((value, failure) -> {
            finalizeTrace();
            if (failure == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(Span.unwrap(failure));
            }
        });
        return result;
    }

    private void restoreAmbient() {
        try {
            nodeToken.reset();
            traceToken.reset();
        } catch (IllegalStateException e) {
            report(Diagnostic.Kind.SPAN_FINALIZE_FAILED,
                "could not restore ambient context for trace '" + trace.graph().name() + "': " + e.getMessage(), e);
        }
    }

    private void finalizeTrace() {
        TraceGraph graph = trace.graph();
        graph.markEnded(Instant.now());
        try {
            storage.save(graph);
            LOGGER.debug("Saved trace {} ({} nodes)", graph.traceId(), graph.nodeCount());
        } catch (RuntimeException e) {
            report(Diagnostic.Kind.STORAGE_SAVE_FAILED,
                "failed to save trace " + graph.traceId() + ": " + e.getMessage() + ". Trace data has been dropped.", e);
        }
        trace.hooks().traceCompleted(graph);
    }

    private void report(Diagnostic.Kind kind, String message, Throwable cause) {
        trace.hooks().report(new Diagnostic(kind, message, trace.traceId(), cause));
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public TraceGraph graph()   { return trace.graph(); }
    public String traceId()     { return trace.traceId(); }

    /** The root span, or null before {@link #enter()}. */
    public Span root() {
        return root;
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TraceScope.class);
}
