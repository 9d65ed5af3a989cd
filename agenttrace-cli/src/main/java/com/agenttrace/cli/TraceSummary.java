package com.agenttrace.cli;

import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.NodeStatus;
import com.agenttrace.core.model.TraceGraph;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Map;
import java.util.TreeMap;

/**
 * Counts and headline facts about one trace, as printed by {@code inspect}.
 * Every status appears in {@link #statusCounts()}, zero or not; keys are sorted.
 */
record TraceSummary(
    String traceId,
    String name,
    String schemaVersion,
    Double durationMs,
    int nodeCount,
    int edgeCount,
    Map<String, Integer> statusCounts,
    Map<String, Integer> nodeTypeCounts
) {

    private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    static TraceSummary of(TraceGraph trace) {
        Map<String, Node> nodes = trace.nodes();
        Map<String, Integer> statusCounts = new TreeMap<>();
        for (NodeStatus status : NodeStatus.values()) {
            statusCounts.put(status.wireName(), 0);
        }
        Map<String, Integer> typeCounts = new TreeMap<>();
        for (Node node : nodes.values()) {
            statusCounts.merge(node.status().wireName(), 1, Integer::sum);
            typeCounts.merge(node.nodeType(), 1, Integer::sum);
        }
        return new TraceSummary(
            trace.traceId(),
            trace.name(),
            trace.schemaVersion(),
            trace.durationMs(),
            nodes.size(),
            trace.edges().size(),
            statusCounts,
            typeCounts);
    }

    /** Single-line JSON object with keys in sorted order. */
    String toJson() {
        Map<String, Object> json = new TreeMap<>();
        json.put("trace_id", traceId);
        json.put("name", name);
        json.put("schema_version", schemaVersion);
        json.put("duration_ms", durationMs);
        json.put("node_count", nodeCount);
        json.put("edge_count", edgeCount);
        json.put("status_counts", statusCounts);
        json.put("node_type_counts", nodeTypeCounts);
        return GSON.toJson(json);
    }
}
