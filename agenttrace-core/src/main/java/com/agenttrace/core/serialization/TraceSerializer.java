package com.agenttrace.core.serialization;

import com.agenttrace.core.Diagnostic;
import com.agenttrace.core.DiagnosticListener;
import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.TraceGraph;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * JSON wire format for {@link TraceGraph}.
 *
 * Field names are snake_case, timestamps ISO-8601 strings, and null fields are written out.
 * {@code duration_ms} is emitted for the graph and every node as a convenience for readers and is
 * ignored on load. Loading tolerates unknown fields and fills absent ones with defaults.
 */
public class TraceSerializer {

    private static final String SCHEMA_VERSION = "schema_version";
    private static final String DURATION_MS = "duration_ms";

    private final SchemaPolicy schemaPolicy;
    private final DiagnosticListener diagnostics;
    private final Gson gson;

    public TraceSerializer() {
        this(SchemaPolicy.LENIENT, DiagnosticListener.logging());
    }

    public TraceSerializer(SchemaPolicy schemaPolicy, DiagnosticListener diagnostics) {
        this.schemaPolicy = schemaPolicy != null ? schemaPolicy : SchemaPolicy.LENIENT;
        this.diagnostics = diagnostics != null ? diagnostics : DiagnosticListener.logging();
        this.gson = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter().nullSafe())
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();
    }

    public SchemaPolicy schemaPolicy() {
        return schemaPolicy;
    }

    // -----------------------------------------------------------------------
    // Trace -> text
    // -----------------------------------------------------------------------

    public String toJson(TraceGraph graph) {
        JsonObject tree = gson.toJsonTree(graph).getAsJsonObject();
        tree.addProperty(DURATION_MS, graph.durationMs());
        JsonObject nodes = tree.getAsJsonObject("nodes");
        for (Node node : graph.nodes().values()) {
            JsonObject nodeJson = nodes.getAsJsonObject(node.id());
            if (nodeJson != null) {
                nodeJson.addProperty(DURATION_MS, node.durationMs());
            }
        }
        return gson.toJson(tree);
    }

    /**
     * Writes the trace to {@code file} as UTF-8, creating parent directories as needed. A lone
     * surrogate in captured text is written as {@code '?'}.
     */
    public void write(TraceGraph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, toJson(graph).getBytes(StandardCharsets.UTF_8));
    }

    // -----------------------------------------------------------------------
    // Text -> trace
    // -----------------------------------------------------------------------

    /**
     * Parses a trace and re-checks its referential integrity.
     *
     * @throws TraceLoadException if the text is not a JSON object, a field has the wrong shape, an
     *                            edge names an unknown node, or the schema version is rejected
     */
    public TraceGraph fromJson(String json) {
        JsonElement tree;
        try {
            tree = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new TraceLoadException("Failed to parse trace JSON: " + e.getMessage(), e);
        }
        if (tree == null || !tree.isJsonObject()) {
            throw new TraceLoadException("Failed to parse trace JSON: expected an object but found "
                + (tree == null || tree.isJsonNull() ? "nothing" : tree.getClass().getSimpleName()));
        }
        JsonObject object = tree.getAsJsonObject();
        checkSchemaVersion(object);
        try {
            TraceGraph graph = gson.fromJson(object, TraceGraph.class);
            graph.validate();
            return graph;
        } catch (RuntimeException e) {
            throw new TraceLoadException("Failed to parse trace JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a trace file. I/O problems (such as {@link java.nio.file.NoSuchFileException}) surface
     * as-is; content problems as {@link TraceLoadException}.
     */
    public TraceGraph read(Path file) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    private void checkSchemaVersion(JsonObject object) {
        JsonElement version = object.get(SCHEMA_VERSION);
        if (version == null || !version.isJsonPrimitive()) return;
        String found = version.getAsString();
        if (TraceGraph.CURRENT_SCHEMA_VERSION.equals(found)) return;

        String message = "schema version " + found + " differs from supported version "
            + TraceGraph.CURRENT_SCHEMA_VERSION;
        if (schemaPolicy == SchemaPolicy.STRICT) {
            throw new TraceLoadException("Failed to parse trace JSON: " + message);
        }
        JsonElement traceId = object.get("trace_id");
        String id = traceId != null && traceId.isJsonPrimitive() ? traceId.getAsString() : null;
        Diagnostic diagnostic = new Diagnostic(
            Diagnostic.Kind.SCHEMA_VERSION_MISMATCH, message + "; loading anyway", id, null);
        try {
            diagnostics.onDiagnostic(diagnostic);
        } catch (RuntimeException e) {
            LOGGER.warn("Diagnostic listener failed while reporting {}: {}", diagnostic.kind(), diagnostic.message(), e);
        }
    }

    /** Malformed or structurally invalid trace payload. */
    public static class TraceLoadException extends RuntimeException {
        public TraceLoadException(String message) { super(message); }
        public TraceLoadException(String message, Throwable cause) { super(message, cause); }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TraceSerializer.class);
}
