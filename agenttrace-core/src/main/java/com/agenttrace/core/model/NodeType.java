package com.agenttrace.core.model;

/**
 * Well-known node type labels. {@link Node#nodeType()} is free-form; these are conventions.
 */
public final class NodeType {

    private NodeType() {}

    public static final String LLM_CALL       = "llm_call";
    public static final String TOOL_CALL      = "tool_call";
    public static final String DECISION       = "decision";
    public static final String RETRIEVAL      = "retrieval";
    public static final String TRANSFORMATION = "transformation";
    public static final String VALIDATION     = "validation";
    public static final String HUMAN_INPUT    = "human_input";
    public static final String SUB_AGENT      = "sub_agent";
    public static final String CUSTOM         = "custom";

    /** Type of the root node every trace scope creates. */
    public static final String TRACE          = "trace";
}
