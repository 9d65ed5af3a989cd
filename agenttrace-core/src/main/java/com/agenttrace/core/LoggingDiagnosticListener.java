package com.agenttrace.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingDiagnosticListener implements DiagnosticListener {

    static final LoggingDiagnosticListener INSTANCE = new LoggingDiagnosticListener();

    private LoggingDiagnosticListener() {}

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {
        if (diagnostic.cause() != null) {
            LOGGER.warn("{} (trace {}): {}", diagnostic.kind(), diagnostic.traceId(), diagnostic.message(), diagnostic.cause());
        } else {
            LOGGER.warn("{} (trace {}): {}", diagnostic.kind(), diagnostic.traceId(), diagnostic.message());
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDiagnosticListener.class);
}
