package com.agenttrace.core;

import com.agenttrace.core.config.TracerConfig;
import com.agenttrace.core.instrument.TracedProxy;
import com.agenttrace.core.storage.MemoryStore;
import com.agenttrace.core.storage.TraceStorage;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Opens traces. Configuration, storage and hooks are fixed at construction and shared by every
 * trace this tracer opens.
 */
public class Tracer {

    private final TracerConfig config;
    private final TraceStorage storage;
    private final HookDispatcher hooks;

    public Tracer() {
        this(TracerConfig.defaults());
    }

    public Tracer(TracerConfig config) {
        this(config, new MemoryStore(), List.of());
    }

    public Tracer(TracerConfig config, TraceStorage storage, List<? extends TracerHook> hooks) {
        this(config, storage, hooks, DiagnosticListener.logging());
    }

    public Tracer(TracerConfig config, TraceStorage storage, List<? extends TracerHook> hooks,
                  DiagnosticListener diagnostics) {
        this.config = Objects.requireNonNull(config, "config");
        this.storage = storage != null ? storage : new MemoryStore();
        this.hooks = new HookDispatcher(hooks, diagnostics);
    }

    public TraceScope trace(String name) {
        return trace(name, Map.of());
    }

    /** Creates a trace scope; nothing is recorded until it is entered. */
    public TraceScope trace(String name, Map<String, ?> metadata) {
        return new TraceScope(name, metadata, config, storage, hooks);
    }

    /** Wraps {@code target} so its {@code @Traced} methods record child spans. */
    public <T> T instrument(Class<T> type, T target) {
        return TracedProxy.create(type, target, config);
    }

    public TracerConfig config()     { return config; }
    public TraceStorage storage()    { return storage; }
    public HookDispatcher hooks()    { return hooks; }
}
