package com.agenttrace.core.model;

import com.google.gson.annotations.SerializedName;

/**
 * Lifecycle state of a {@link Node}.
 *
 * Allowed transitions: PENDING → RUNNING → {COMPLETED, FAILED, CANCELLED}, plus PENDING → CANCELLED.
 * Terminal states are never left.
 */
public enum NodeStatus {
    @SerializedName("pending")   PENDING("pending"),
    @SerializedName("running")   RUNNING("running"),
    @SerializedName("completed") COMPLETED("completed"),
    @SerializedName("failed")    FAILED("failed"),
    @SerializedName("cancelled") CANCELLED("cancelled");

    private final String wireName;

    NodeStatus(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used in the JSON wire format. */
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(NodeStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
