package com.agenttrace.core.model;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Complete record of one trace: its nodes, edges and timing.
 *
 * The graph exclusively owns its nodes, keyed by id. Every edge endpoint must already be a node
 * of this graph. {@link #addNode}, {@link #addEdge} and {@link #nextSequenceNumber} are safe to call
 * from concurrently running branches.
 */
public class TraceGraph {

    public static final String CURRENT_SCHEMA_VERSION = "0.1.0";

    @SerializedName("schema_version")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    @SerializedName("trace_id")
    private String traceId = Node.newId();

    @SerializedName("name")
    private String name = "";

    @SerializedName("nodes")
    private Map<String, Node> nodes = new LinkedHashMap<>();

    @SerializedName("edges")
    private List<Edge> edges = new ArrayList<>();

    @SerializedName("start_time")
    private Instant startTime;

    @SerializedName("end_time")
    private volatile Instant endTime;

    @SerializedName("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private final transient AtomicInteger sequenceCounter = new AtomicInteger();

    public TraceGraph() {}

    public TraceGraph(String name) {
        this(name, Map.of(), null);
    }

    public TraceGraph(String name, Map<String, Object> metadata, Instant startTime) {
        this.name = name != null ? name : "";
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.startTime = startTime;
    }

    public String schemaVersion() { return schemaVersion; }
    public String traceId()       { return traceId; }
    public String name()          { return name; }
    public Instant startTime()    { return startTime; }
    public Instant endTime()      { return endTime; }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Double durationMs() {
        return Node.millisBetween(startTime, endTime);
    }

    // -----------------------------------------------------------------------
    // Mutation
    // -----------------------------------------------------------------------

    /** Draws the next sequence number. Values are pairwise distinct within this graph. */
    public int nextSequenceNumber() {
        return sequenceCounter.getAndIncrement();
    }

    public synchronized void addNode(Node node) {
        Node existing = nodes.putIfAbsent(node.id(), node);
        if (existing != null && existing != node) {
            throw new IllegalArgumentException("Duplicate node id: " + node.id());
        }
    }

    public synchronized void addEdge(Edge edge) {
        if (!nodes.containsKey(edge.sourceId())) {
            throw new IllegalArgumentException("Unknown edge source node id: " + edge.sourceId());
        }
        if (!nodes.containsKey(edge.targetId())) {
            throw new IllegalArgumentException("Unknown edge target node id: " + edge.targetId());
        }
        edges.add(edge);
    }

    /**
     * Stamps the end time. A graph ends once.
     *
     * @throws IllegalStateException if the end time is already set
     */
    public synchronized void markEnded(Instant at) {
        if (endTime != null) {
            throw new IllegalStateException("Trace " + traceId + " already ended");
        }
        endTime = at;
    }

    // -----------------------------------------------------------------------
    // Queries (all return snapshots)
    // -----------------------------------------------------------------------

    public synchronized Map<String, Node> nodes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public synchronized List<Edge> edges() {
        return List.copyOf(edges);
    }

    public synchronized Node node(String id) {
        return nodes.get(id);
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    public List<Node> rootNodes() {
        return nodes().values().stream()
            .filter(Node::isRoot)
            .sorted(Comparator.comparingInt(Node::sequenceNumber))
            .collect(Collectors.toList());
    }

    public List<Node> failedNodes() {
        return nodes().values().stream()
            .filter(n -> n.status() == NodeStatus.FAILED)
            .sorted(Comparator.comparingInt(Node::sequenceNumber))
            .collect(Collectors.toList());
    }

    /** Direct children of {@code parentId}, in sequence-number order. */
    public List<Node> children(String parentId) {
        return nodes().values().stream()
            .filter(n -> parentId.equals(n.parentId()))
            .sorted(Comparator.comparingInt(Node::sequenceNumber))
            .collect(Collectors.toList());
    }

    // -----------------------------------------------------------------------
    // Reconstruction
    // -----------------------------------------------------------------------

    /**
     * Checks referential integrity after reconstruction from serialized form, fills defaults for
     * absent fields, and moves the sequence counter past the highest recorded sequence number.
     *
     * @throws IllegalArgumentException if an edge names a node that is not in the graph
     */
    public synchronized void validate() {
        if (schemaVersion == null) schemaVersion = CURRENT_SCHEMA_VERSION;
        if (traceId == null) traceId = Node.newId();
        if (name == null) name = "";
        if (metadata == null) metadata = new LinkedHashMap<>();

        Map<String, Node> rebuilt = new LinkedHashMap<>();
        if (nodes != null) {
            for (Map.Entry<String, Node> entry : nodes.entrySet()) {
                Node node = entry.getValue();
                if (node == null) continue;
                node.normalize(entry.getKey());
                rebuilt.put(node.id(), node);
            }
        }
        nodes = rebuilt;

        List<Edge> checked = new ArrayList<>();
        if (edges != null) {
            for (Edge edge : edges) {
                if (edge == null) continue;
                if (!nodes.containsKey(edge.sourceId())) {
                    throw new IllegalArgumentException("Edge source_id not found in nodes: " + edge.sourceId());
                }
                if (!nodes.containsKey(edge.targetId())) {
                    throw new IllegalArgumentException("Edge target_id not found in nodes: " + edge.targetId());
                }
                edge.normalize();
                checked.add(edge);
            }
        }
        edges = checked;

        int next = nodes.values().stream().mapToInt(Node::sequenceNumber).max().orElse(-1) + 1;
        sequenceCounter.set(Math.max(next, sequenceCounter.get()));
    }

    @Override
    public String toString() {
        return "TraceGraph{" + traceId + " '" + name + "' nodes=" + nodeCount() + "}";
    }
}
