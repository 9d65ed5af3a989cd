package com.agenttrace.core;

/** Body of a span with no result. */
@FunctionalInterface
public interface SpanRunnable {
    void run(Span span) throws Exception;
}
