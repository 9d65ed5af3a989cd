package com.agenttrace.core;

import com.agenttrace.core.model.Edge;
import com.agenttrace.core.model.EdgeType;
import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.NodeStatus;
import com.agenttrace.core.model.NodeType;
import com.agenttrace.core.model.TraceGraph;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Active handle for one {@link Node}.
 *
 * <pre>
 * PENDING --enter()--> RUNNING --exit(null)--> COMPLETED
 *                              --exit(error)-> FAILED
 * PENDING/RUNNING --setStatus(CANCELLED)--> CANCELLED
 * </pre>
 *
 * Construction draws the node's sequence number but leaves the graph untouched. {@link #enter()}
 * registers the node, adds the causal edge from the parent and makes the node ambient on the
 * calling thread. Exit records the outcome, restores the ambient node and fires the completion
 * hook. An error passed to exit is recorded only; rethrowing it is the caller's job, and
 * {@link #call} / {@link #run} always do.
 */
public class Span implements AutoCloseable {

    private final ActiveTrace trace;
    private final Node node;
    private final boolean borrowed;

    private ContextToken<Node> nodeToken;
    private volatile boolean entered;
    private volatile boolean exited;

    /** Creates a span under the ambient node, if that node belongs to {@code trace}. */
    public Span(ActiveTrace trace, String name, String nodeType) {
        this(trace, name, nodeType, ambientParent(trace));
    }

    /** Creates a span under {@code parent}; a null parent makes a root span. */
    public Span(ActiveTrace trace, String name, String nodeType, Node parent) {
        this.trace = Objects.requireNonNull(trace, "trace");
        this.node = new Node(trace.graph().nextSequenceNumber(), name, nodeType, parent);
        this.borrowed = false;
    }

    private Span(ActiveTrace trace, Node existing) {
        this.trace = trace;
        this.node = existing;
        this.borrowed = true;
        this.entered = true;
    }

    /**
     * Creates a span under the ambient trace and node.
     *
     * @return the new (not yet entered) span, or null when no trace is active on this thread
     */
    public static Span child(String name, String nodeType) {
        ActiveTrace active = TraceContext.currentTrace();
        return active != null ? new Span(active, name, nodeType) : null;
    }

    /** Handle onto a node someone else has entered. It can record data and links but cannot exit. */
    static Span attach(ActiveTrace trace, Node node) {
        return new Span(trace, node);
    }

    private static Node ambientParent(ActiveTrace trace) {
        Node current = TraceContext.currentNode();
        if (current == null) return null;
        return trace.graph().node(current.id()) == current ? current : null;
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    /**
     * Starts the span. Calling it again while the span is running has no effect.
     *
     * @throws IllegalStateException if the span has exited or was cancelled before it started,
     *                               or its parent has not been entered
     */
    public synchronized Span enter() {
        if (exited || node.status().isTerminal()) {
            throw new IllegalStateException("Span '" + node.name() + "' has already finished ("
                + node.status().wireName() + ")");
        }
        if (entered) return this;

        TraceGraph graph = trace.graph();
        String parentId = node.parentId();
        if (parentId != null && graph.node(parentId) == null) {
            throw new IllegalStateException("Parent of span '" + node.name() + "' has not been entered");
        }

        node.transitionTo(NodeStatus.RUNNING);
        node.markStarted(Instant.now());
        graph.addNode(node);
        if (parentId != null) {
            graph.addEdge(new Edge(parentId, node.id()));
        }
        nodeToken = TraceContext.pushNode(node);
        entered = true;
        trace.hooks().nodeStarted(node, trace.traceId());
        return this;
    }

    /** Exits successfully. Lets a span be used in try-with-resources. */
    @Override
    public void close() {
        exit(null);
    }

    /**
     * Finishes the span: FAILED with the error's details when {@code error} is non-null, otherwise
     * COMPLETED unless the status was already set explicitly. A status set explicitly to anything
     * other than FAILED wins over {@code error}: the node keeps it, no error details are recorded
     * and hooks see a completion. A second exit is ignored.
     *
     * @throws IllegalStateException if the span was never entered
     */
    public void exit(Throwable error) {
        checkExitable();
        if (!claimExit()) return;
        boolean failed = finish(error);
        detach();
        fireEnd(failed);
    }

    /**
     * Runs {@code body} inside this span. Whatever {@code body} throws is recorded on the node and
     * rethrown unchanged.
     */
    public <T> T call(SpanCallable<T> body) throws Exception {
        enter();
        T result;
        try {
            result = body.call(this);
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
     * Asynchronous form of {@link #call}. The synchronous part of {@code body} runs with this node
     * ambient; the caller's context is restored as soon as {@code body} returns its stage. The span
     * exits when the stage completes, and the returned future completes after that bookkeeping.
     */
    public <T> CompletableFuture<T> callAsync(Function<? super Span, ? extends CompletionStage<T>> body) {
        enter();
        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(body.apply(this), "async span body returned null");
        } catch (RuntimeException | Error e) {
            exit(e);
            throw e;
        }
        return exitWhenComplete(stage);
    }

    /**
     * Detaches this span from the calling thread and exits it when {@code stage} completes, recording
     * the stage's failure if it has one.
     *
     * @return a future that completes like {@code stage}, after the span has exited
     */
    public <T> CompletableFuture<T> exitWhenComplete(CompletionStage<T> stage) {
        checkExitable();
        detach();
        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, failure) -> {
            Throwable cause = unwrap(failure);
            exit(cause);
            if (cause == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    /**
     * Restores the ambient node that was current before {@link #enter()}, leaving the span open.
     * Must run on the entering thread; the span can then exit from any thread.
     */
    public synchronized void detach() {
        ContextToken<Node> token = nodeToken;
        nodeToken = null;
        if (token == null) return;
        try {
            token.reset();
        } catch (IllegalStateException e) {
            report(Diagnostic.Kind.SPAN_FINALIZE_FAILED,
                "could not restore ambient context for span '" + node.name() + "': " + e.getMessage(), e);
        }
    }

    static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private void checkExitable() {
        if (borrowed) {
            throw new IllegalStateException("Span '" + node.name() + "' is a borrowed handle and cannot exit");
        }
        if (!entered) {
            throw new IllegalStateException("Span '" + node.name() + "' was never entered");
        }
    }

    private synchronized boolean claimExit() {
        if (exited) return false;
        exited = true;
        return true;
    }

    /** Returns whether the node ended FAILED because of {@code error}. */
    private boolean finish(Throwable error) {
        boolean failed = false;
        try {
            if (error == null) {
                node.transitionTo(NodeStatus.COMPLETED);
            } else if (node.transitionTo(NodeStatus.FAILED) || node.status() == NodeStatus.FAILED) {
                failed = true;
                node.recordError(
                    messageOf(error),
                    typeLabel(error),
                    trace.capture().capturesTraceback() ? stackTrace(error) : null);
            }
            node.markEnded(Instant.now());
        } catch (RuntimeException e) {
            report(Diagnostic.Kind.SPAN_FINALIZE_FAILED,
                "failed to finalize span '" + node.name() + "': " + e.getMessage(), e);
        }
        return failed;
    }

    private void fireEnd(boolean failed) {
        if (failed) {
            trace.hooks().nodeFailed(node, trace.traceId());
        } else {
            trace.hooks().nodeCompleted(node, trace.traceId());
        }
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    private static String typeLabel(Throwable error) {
        String simple = error.getClass().getSimpleName();
        return simple.isEmpty() ? error.getClass().getName() : simple;
    }

    private static String stackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    // -----------------------------------------------------------------------
    // Captured data
    // -----------------------------------------------------------------------

    public Span input(Map<String, ?> values) {
        ValueCapture capture = trace.capture();
        if (capture.capturesData()) {
            capture.input(values).forEach(node::putInput);
        }
        return this;
    }

    public Span input(String key, Object value) {
        return input(Collections.singletonMap(key, value));
    }

    public Span output(Map<String, ?> values) {
        ValueCapture capture = trace.capture();
        if (capture.capturesData()) {
            capture.output(values).forEach(node::putOutput);
        }
        return this;
    }

    public Span output(String key, Object value) {
        return output(Collections.singletonMap(key, value));
    }

    public Span metadata(Map<String, ?> values) {
        ValueCapture capture = trace.capture();
        if (capture.capturesData()) {
            capture.metadata(values).forEach(node::putMetadata);
        }
        return this;
    }

    public Span metadata(String key, Object value) {
        return metadata(Collections.singletonMap(key, value));
    }

    /** Appends to the node's annotation log. */
    public Span annotate(String message) {
        node.addAnnotation(String.valueOf(message));
        return this;
    }

    /**
     * Sets a terminal status explicitly, typically CANCELLED. A move the state machine does not
     * allow is ignored and reported as a diagnostic.
     *
     * @throws IllegalArgumentException for PENDING or RUNNING, which only the lifecycle sets
     */
    public Span setStatus(NodeStatus status) {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Status " + status.wireName() + " cannot be set explicitly");
        }
        NodeStatus before = node.status();
        if (!node.transitionTo(status)) {
            report(Diagnostic.Kind.INVALID_STATUS_TRANSITION,
                "invalid status transition for node '" + node.name() + "': "
                    + before.wireName() + " -> " + status.wireName(), null);
        }
        return this;
    }

    // -----------------------------------------------------------------------
    // Edges and children
    // -----------------------------------------------------------------------

    public Span link(Span target) {
        return link(target, EdgeType.CAUSED_BY, "");
    }

    public Span link(Span target, EdgeType type) {
        return link(target, type, "");
    }

    /**
     * Adds an explicit edge from this span's node to {@code target}'s node. Both spans must have
     * been entered and belong to the same trace.
     */
    public Span link(Span target, EdgeType type, String label) {
        Objects.requireNonNull(target, "target");
        if (!entered) {
            throw new IllegalStateException("Span '" + node.name() + "' must be entered before linking");
        }
        if (!target.entered) {
            throw new IllegalStateException("Link target '" + target.node.name() + "' has not been entered");
        }
        if (target.trace.graph() != trace.graph()) {
            throw new IllegalArgumentException("Cannot link spans from different traces");
        }
        trace.graph().addEdge(new Edge(node.id(), target.node.id(), type, label, Map.of()));
        return this;
    }

    public Span node(String name) {
        return node(name, NodeType.CUSTOM);
    }

    /** Creates a child span of this one. The child still has to be entered. */
    public Span node(String name, String nodeType) {
        return new Span(trace, name, nodeType, node);
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public Node nodeRecord()     { return node; }
    public String id()           { return node.id(); }
    public NodeStatus status()   { return node.status(); }
    public TraceGraph graph()    { return trace.graph(); }
    public String traceId()      { return trace.traceId(); }
    public boolean isEntered()   { return entered; }
    public boolean isExited()    { return exited; }

    private void report(Diagnostic.Kind kind, String message, Throwable cause) {
        trace.hooks().report(new Diagnostic(kind, message, trace.traceId(), cause));
    }

    @Override
    public String toString() {
        return "Span{" + node + "}";
    }
}
