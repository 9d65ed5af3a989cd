package com.agenttrace.core;

/**
 * Receives tracing diagnostics. Implementations must not throw; if one does, the failure is logged
 * and dropped.
 */
@FunctionalInterface
public interface DiagnosticListener {

    void onDiagnostic(Diagnostic diagnostic);

    /** Listener that logs every diagnostic at WARN. */
    static DiagnosticListener logging() {
        return LoggingDiagnosticListener.INSTANCE;
    }
}
