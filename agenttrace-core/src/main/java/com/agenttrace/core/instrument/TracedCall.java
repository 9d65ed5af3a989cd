package com.agenttrace.core.instrument;

import com.agenttrace.core.Span;
import com.agenttrace.core.model.NodeType;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wraps a callable so that each call becomes a child span of whatever node is ambient at call time.
 * Outside a trace the wrapped callable runs untouched.
 *
 * <pre>
 * Function&lt;String, List&lt;Doc&gt;&gt; search = TracedCall.node("search")
 *     .type(NodeType.RETRIEVAL)
 *     .captureArgs()
 *     .captureReturn()
 *     .wrap(index::search);
 * </pre>
 *
 * Arguments are recorded as input under {@code arg0}, {@code arg1}, ... unless
 * {@link #argNames(String...)} supplies names. Errors are recorded on the node and rethrown
 * unchanged.
 */
public final class TracedCall {

    private final String name;
    private String nodeType = NodeType.CUSTOM;
    private boolean captureArgs;
    private boolean captureReturn;
    private List<String> argNames = List.of();

    private TracedCall(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public static TracedCall node(String name) {
        return new TracedCall(name);
    }

    public TracedCall type(String nodeType) {
        this.nodeType = nodeType != null ? nodeType : NodeType.CUSTOM;
        return this;
    }

    public TracedCall captureArgs() {
        return captureArgs(true);
    }

    public TracedCall captureArgs(boolean enabled) {
        this.captureArgs = enabled;
        return this;
    }

    public TracedCall captureReturn() {
        return captureReturn(true);
    }

    public TracedCall captureReturn(boolean enabled) {
        this.captureReturn = enabled;
        return this;
    }

    public TracedCall argNames(String... names) {
        this.argNames = List.of(names);
        return this;
    }

    public String name()      { return name; }
    public String nodeType()  { return nodeType; }

    // -----------------------------------------------------------------------
    // Blocking
    // -----------------------------------------------------------------------

    public <R> Callable<R> wrap(Callable<R> fn) {
        return () -> invoke(new Object[0], fn);
    }

    public <A, R> Function<A, R> wrap(Function<A, R> fn) {
        return a -> unchecked(() -> invoke(new Object[] {a}, () -> fn.apply(a)));
    }

    public <A, B, R> BiFunction<A, B, R> wrap(BiFunction<A, B, R> fn) {
        return (a, b) -> unchecked(() -> invoke(new Object[] {a, b}, () -> fn.apply(a, b)));
    }

    /**
     * Runs {@code body} inside a child span of the ambient node.
     */
    <T> T invoke(Object[] args, Callable<T> body) throws Exception {
        Span span = Span.child(name, nodeType);
        if (span == null) {
            return body.call();
        }
        return span.call(s -> {
            if (captureArgs) s.input(arguments(args));
            T result = body.call();
            if (captureReturn) s.output(ReturnValues.format(result));
            return result;
        });
    }

    // -----------------------------------------------------------------------
    // Asynchronous
    // -----------------------------------------------------------------------

    public <R> Supplier<CompletionStage<R>> wrapAsync(Supplier<? extends CompletionStage<R>> fn) {
        return () -> unchecked(() -> invokeAsync(new Object[0], fn::get));
    }

    public <A, R> Function<A, CompletionStage<R>> wrapAsync(Function<A, ? extends CompletionStage<R>> fn) {
        return a -> unchecked(() -> invokeAsync(new Object[] {a}, () -> fn.apply(a)));
    }

    /**
     * Async variant of {@link #invoke}: the span stays open until the returned stage completes.
     * A synchronous throw from {@code body} fails the span and propagates as-is.
     */
    <T> CompletionStage<T> invokeAsync(Object[] args, Callable<? extends CompletionStage<T>> body) throws Exception {
        Span span = Span.child(name, nodeType);
        if (span == null) {
            return body.call();
        }
        span.enter();
        CompletionStage<T> stage;
        try {
            if (captureArgs) span.input(arguments(args));
            stage = Objects.requireNonNull(body.call(), "async body returned null");
        } catch (Throwable t) {
            span.exit(t);
            throw t;
        }
        if (captureReturn) {
            stage = stage.thenApply(result -> {
                span.output(ReturnValues.format(result));
                return result;
            });
        }
        return span.exitWhenComplete(stage);
    }

    private Map<String, Object> arguments(Object[] args) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String key = i < argNames.size() ? argNames.get(i) : "arg" + i;
            out.put(key, args[i]);
        }
        return out;
    }

    // Only for bodies that cannot throw checked exceptions.
    private static <T> T unchecked(Callable<T> call) {
        try {
            return call.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new UndeclaredThrowableException(e);
        }
    }
}
