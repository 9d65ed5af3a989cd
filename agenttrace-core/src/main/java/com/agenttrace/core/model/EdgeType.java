package com.agenttrace.core.model;

import com.google.gson.annotations.SerializedName;

public enum EdgeType {
    @SerializedName("caused_by")     CAUSED_BY("caused_by", "caused by"),
    @SerializedName("data_flow")     DATA_FLOW("data_flow", "data flow to"),
    @SerializedName("branched_from") BRANCHED_FROM("branched_from", "branched from"),
    @SerializedName("retry_of")      RETRY_OF("retry_of", "retry of"),
    @SerializedName("fallback_of")   FALLBACK_OF("fallback_of", "fallback of");

    private final String wireName;
    private final String phrase;

    EdgeType(String wireName, String phrase) {
        this.wireName = wireName;
        this.phrase = phrase;
    }

    public String wireName() {
        return wireName;
    }

    /** Human-readable relation, e.g. "retry of". */
    public String phrase() {
        return phrase;
    }
}
