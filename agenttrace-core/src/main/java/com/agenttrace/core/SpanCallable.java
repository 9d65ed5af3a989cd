package com.agenttrace.core;

/** Body of a span that produces a value. */
@FunctionalInterface
public interface SpanCallable<T> {
    T call(Span span) throws Exception;
}
