package com.agenttrace.core;

import com.agenttrace.core.config.TracerConfig;
import com.agenttrace.core.model.TraceGraph;

/**
 * A trace that is being recorded: its graph plus the settings every span in it shares.
 * This is what the ambient context holds as the "current trace".
 */
public final class ActiveTrace {

    private final TraceGraph graph;
    private final TracerConfig config;
    private final HookDispatcher hooks;
    private final ValueCapture capture;

    public ActiveTrace(TraceGraph graph) {
        this(graph, TracerConfig.defaults(), HookDispatcher.none());
    }

    public ActiveTrace(TraceGraph graph, TracerConfig config, HookDispatcher hooks) {
        this.graph = graph;
        this.config = config != null ? config : TracerConfig.defaults();
        this.hooks = hooks != null ? hooks : HookDispatcher.none();
        this.capture = new ValueCapture(this.config);
    }

    public TraceGraph graph()      { return graph; }
    public TracerConfig config()   { return config; }
    public HookDispatcher hooks()  { return hooks; }
    public String traceId()        { return graph.traceId(); }

    ValueCapture capture() {
        return capture;
    }
}
