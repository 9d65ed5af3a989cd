package com.agenttrace.core.model;

import com.google.gson.annotations.SerializedName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One recorded execution step.
 *
 * A node refers to its parent by id only; the owning {@link TraceGraph} resolves ids.
 * Status changes go through {@link #transitionTo(NodeStatus)}, which rejects any move out of a
 * terminal state. Captured maps are written by the owning span and read by hooks and serializers,
 * so every accessor returns a copy taken under the node's lock.
 */
public class Node {

    @SerializedName("id")
    private String id;

    @SerializedName("sequence_number")
    private int sequenceNumber;

    @SerializedName("name")
    private String name;

    @SerializedName("node_type")
    private String nodeType = NodeType.CUSTOM;

    @SerializedName("status")
    private volatile NodeStatus status = NodeStatus.PENDING;

    @SerializedName("parent_id")
    private String parentId;

    @SerializedName("depth")
    private int depth;

    @SerializedName("start_time")
    private volatile Instant startTime;

    @SerializedName("end_time")
    private volatile Instant endTime;

    @SerializedName("input_data")
    private Map<String, Object> inputData = new LinkedHashMap<>();

    @SerializedName("output_data")
    private Map<String, Object> outputData = new LinkedHashMap<>();

    @SerializedName("annotations")
    private List<String> annotations = new ArrayList<>();

    @SerializedName("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @SerializedName("error")
    private String error;

    @SerializedName("error_type")
    private String errorType;

    @SerializedName("error_traceback")
    private String errorTraceback;

    // Used by Gson
    private Node() {}

    /** Creates a root node (no parent, depth 0). */
    public Node(int sequenceNumber, String name, String nodeType) {
        this(sequenceNumber, name, nodeType, null);
    }

    /** Creates a node under {@code parent}; a null parent makes it a root. */
    public Node(int sequenceNumber, String name, String nodeType, Node parent) {
        this.id = newId();
        this.sequenceNumber = sequenceNumber;
        this.name = Objects.requireNonNull(name, "name");
        this.nodeType = nodeType != null ? nodeType : NodeType.CUSTOM;
        this.parentId = parent != null ? parent.id : null;
        this.depth = parent != null ? parent.depth + 1 : 0;
    }

    static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    // -----------------------------------------------------------------------
    // Identity and structure
    // -----------------------------------------------------------------------

    public String id()             { return id; }
    public int sequenceNumber()    { return sequenceNumber; }
    public String name()           { return name; }
    public String nodeType()       { return nodeType; }
    public String parentId()       { return parentId; }
    public int depth()             { return depth; }
    public boolean isRoot()        { return parentId == null; }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    public NodeStatus status()     { return status; }
    public Instant startTime()     { return startTime; }
    public Instant endTime()       { return endTime; }

    /**
     * Moves to {@code next} if the state machine allows it.
     *
     * @return false (and no change) when the move is not allowed
     */
    public synchronized boolean transitionTo(NodeStatus next) {
        if (!status.canTransitionTo(next)) return false;
        status = next;
        return true;
    }

    public void markStarted(Instant at) {
        this.startTime = at;
    }

    public void markEnded(Instant at) {
        this.endTime = at;
    }

    /** Milliseconds between start and end, or null unless both are set. */
    public Double durationMs() {
        return millisBetween(startTime, endTime);
    }

    static Double millisBetween(Instant start, Instant end) {
        if (start == null || end == null) return null;
        return Duration.between(start, end).toNanos() / 1_000_000.0;
    }

    // -----------------------------------------------------------------------
    // Captured data
    // -----------------------------------------------------------------------

    public synchronized Map<String, Object> inputData() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(inputData));
    }

    public synchronized Map<String, Object> outputData() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outputData));
    }

    public synchronized Map<String, Object> metadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public synchronized List<String> annotations() {
        return List.copyOf(annotations);
    }

    public synchronized void putInput(String key, Object value) {
        inputData.put(key, value);
    }

    public synchronized void putOutput(String key, Object value) {
        outputData.put(key, value);
    }

    public synchronized void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public synchronized void addAnnotation(String message) {
        annotations.add(message);
    }

    // -----------------------------------------------------------------------
    // Failure details
    // -----------------------------------------------------------------------

    public String error()          { return error; }
    public String errorType()      { return errorType; }
    public String errorTraceback() { return errorTraceback; }

    public synchronized void recordError(String message, String type, String traceback) {
        this.error = message;
        this.errorType = type;
        this.errorTraceback = traceback;
    }

    /** Fills defaults left absent by a tolerant load. */
    void normalize(String mapKey) {
        if (id == null) id = mapKey;
        if (name == null) name = "";
        if (nodeType == null) nodeType = NodeType.CUSTOM;
        if (status == null) status = NodeStatus.PENDING;
        if (inputData == null) inputData = new LinkedHashMap<>();
        if (outputData == null) outputData = new LinkedHashMap<>();
        if (annotations == null) annotations = new ArrayList<>();
        if (metadata == null) metadata = new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "Node{" + name + " #" + sequenceNumber + " " + status.wireName() + "}";
    }
}
