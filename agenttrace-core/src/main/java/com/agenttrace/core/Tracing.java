package com.agenttrace.core;

import com.agenttrace.core.config.ConfigFile;
import com.agenttrace.core.config.ConfigReader;
import com.agenttrace.core.config.TracerConfig;
import com.agenttrace.core.model.Node;
import com.agenttrace.core.storage.TraceStorage;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Process-wide default {@link Tracer}, for code that does not want to pass one around.
 * Until {@link #configure} is called, traces go to an in-memory store with default settings.
 */
public final class Tracing {

    private static volatile Tracer defaultTracer;

    private Tracing() {}

    public static void configure(TracerConfig config, String storage, List<? extends TracerHook> hooks) {
        defaultTracer = new Tracer(config, TraceStorage.fromUri(storage), hooks);
    }

    /**
     * @throws ConfigReader.ConfigReadException if the file cannot be read
     * @throws TracerConfig.ConfigurationException if it holds invalid settings
     */
    public static void configure(Path configFile) {
        ConfigFile file = new ConfigReader().read(configFile);
        defaultTracer = new Tracer(file.toTracerConfig(), TraceStorage.fromUri(file.getStorage()), List.of());
    }

    public static Tracer defaultTracer() {
        Tracer tracer = defaultTracer;
        if (tracer == null) {
            synchronized (Tracing.class) {
                tracer = defaultTracer;
                if (tracer == null) {
                    tracer = new Tracer();
                    defaultTracer = tracer;
                }
            }
        }
        return tracer;
    }

    public static TraceScope trace(String name) {
        return defaultTracer().trace(name);
    }

    public static TraceScope trace(String name, Map<String, ?> metadata) {
        return defaultTracer().trace(name, metadata);
    }

    /**
     * Handle onto the innermost node entered on this thread, or null outside a trace. The handle can
     * record data, annotations and links; the code that entered the node still owns its exit.
     */
    public static Span currentSpan() {
        ActiveTrace trace = TraceContext.currentTrace();
        Node node = TraceContext.currentNode();
        if (trace == null || node == null) return null;
        return Span.attach(trace, node);
    }

    /** Drops the default tracer. */
    public static void reset() {
        defaultTracer = null;
    }
}
