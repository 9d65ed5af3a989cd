package com.agenttrace.core;

/**
 * A non-fatal problem in the tracing infrastructure, reported instead of being thrown to the host.
 *
 * @param kind     what went wrong
 * @param message  human-readable description
 * @param traceId  affected trace, or null when not tied to one
 * @param cause    underlying exception, or null
 */
public record Diagnostic(Kind kind, String message, String traceId, Throwable cause) {

    public enum Kind {
        STORAGE_SAVE_FAILED,
        HOOK_FAILED,
        SPAN_FINALIZE_FAILED,
        INVALID_STATUS_TRANSITION,
        SCHEMA_VERSION_MISMATCH
    }
}
