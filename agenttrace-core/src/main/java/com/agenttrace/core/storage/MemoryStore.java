package com.agenttrace.core.storage;

import com.agenttrace.core.model.TraceGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Keeps traces in memory, in save order. Thread-safe. */
public class MemoryStore implements TraceStorage {

    private final Map<String, TraceGraph> traces = new LinkedHashMap<>();

    @Override
    public synchronized void save(TraceGraph graph) {
        traces.put(graph.traceId(), graph);
    }

    @Override
    public synchronized Optional<TraceGraph> load(String traceId) {
        return Optional.ofNullable(traces.get(traceId));
    }

    @Override
    public synchronized List<String> listTraces() {
        return new ArrayList<>(traces.keySet());
    }

    public synchronized int size() {
        return traces.size();
    }

    public synchronized void clear() {
        traces.clear();
    }
}
