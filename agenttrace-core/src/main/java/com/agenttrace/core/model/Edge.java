package com.agenttrace.core.model;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed, typed relationship between two nodes of the same {@link TraceGraph}.
 * Endpoint existence is checked by the graph, not here.
 */
public class Edge {

    @SerializedName("source_id")
    private String sourceId;

    @SerializedName("target_id")
    private String targetId;

    @SerializedName("edge_type")
    private EdgeType edgeType = EdgeType.CAUSED_BY;

    @SerializedName("label")
    private String label = "";

    @SerializedName("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    // Used by Gson
    private Edge() {}

    public Edge(String sourceId, String targetId) {
        this(sourceId, targetId, EdgeType.CAUSED_BY, "", Map.of());
    }

    public Edge(String sourceId, String targetId, EdgeType edgeType) {
        this(sourceId, targetId, edgeType, "", Map.of());
    }

    public Edge(String sourceId, String targetId, EdgeType edgeType, String label, Map<String, Object> metadata) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.edgeType = edgeType != null ? edgeType : EdgeType.CAUSED_BY;
        this.label = label != null ? label : "";
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public String sourceId()    { return sourceId; }
    public String targetId()    { return targetId; }
    public EdgeType edgeType()  { return edgeType; }
    public String label()       { return label; }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /** Fills defaults left absent by a tolerant load. */
    void normalize() {
        if (edgeType == null) edgeType = EdgeType.CAUSED_BY;
        if (label == null) label = "";
        if (metadata == null) metadata = new LinkedHashMap<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge other)) return false;
        return Objects.equals(sourceId, other.sourceId)
            && Objects.equals(targetId, other.targetId)
            && edgeType == other.edgeType
            && Objects.equals(label, other.label)
            && Objects.equals(metadata, other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, targetId, edgeType, label, metadata);
    }

    @Override
    public String toString() {
        return "Edge{" + sourceId + " -" + edgeType.wireName() + "-> " + targetId + "}";
    }
}
