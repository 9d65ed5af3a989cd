package com.agenttrace.core.serialization;

/** What {@link TraceSerializer} does with a payload written under a different schema version. */
public enum SchemaPolicy {
    /** Parse anyway and report a SCHEMA_VERSION_MISMATCH diagnostic. */
    LENIENT,
    /** Reject the payload with a {@link TraceSerializer.TraceLoadException}. */
    STRICT
}
