package com.agenttrace.cli;

import com.agenttrace.cli.render.TraceRenderer;
import com.agenttrace.cli.render.Verbosity;
import com.agenttrace.core.model.TraceGraph;
import com.agenttrace.core.serialization.TraceSerializer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * {@code inspect <trace-file>}: loads a trace file and prints a summary plus the rendered tree, or a
 * JSON summary with {@code --json}.
 */
final class InspectCommand {

    private final Path traceFile;
    private final Verbosity verbosity;
    private final boolean json;
    private final Path output;
    private final TraceSerializer serializer;

    InspectCommand(Path traceFile, Verbosity verbosity, boolean json, Path output, TraceSerializer serializer) {
        this.traceFile = traceFile;
        this.verbosity = verbosity;
        this.json = json;
        this.output = output;
        this.serializer = serializer;
    }

    /** @return process exit code */
    int execute(PrintStream out, PrintStream err) {
        TraceGraph trace;
        try {
            trace = serializer.read(traceFile);
        } catch (NoSuchFileException e) {
            err.println("Error: file not found: " + traceFile);
            return TraceCli.EXIT_FAILURE;
        } catch (TraceSerializer.TraceLoadException e) {
            err.println("Error: " + e.getMessage());
            return TraceCli.EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return TraceCli.EXIT_FAILURE;
        }

        TraceSummary summary = TraceSummary.of(trace);
        if (json) {
            return emitJson(summary, out, err);
        }

        Double duration = summary.durationMs();
        out.println("Trace ID: " + summary.traceId());
        out.println("Name: " + (summary.name().isEmpty() ? "<unnamed>" : summary.name()));
        out.println("Schema: " + summary.schemaVersion());
        out.println("Duration: " + (duration != null ? String.format(Locale.ROOT, "%.0fms", duration) : "unknown"));
        out.println("Nodes: " + summary.nodeCount());
        out.println("Edges: " + summary.edgeCount());
        out.println("Status counts:");
        for (Map.Entry<String, Integer> entry : summary.statusCounts().entrySet()) {
            if (entry.getValue() > 0) {
                out.println("  - " + entry.getKey() + ": " + entry.getValue());
            }
        }
        out.println("Node type counts:");
        for (Map.Entry<String, Integer> entry : summary.nodeTypeCounts().entrySet()) {
            out.println("  - " + entry.getKey() + ": " + entry.getValue());
        }
        out.println();
        out.print(new TraceRenderer(verbosity).render(trace));
        return TraceCli.EXIT_OK;
    }

    private int emitJson(TraceSummary summary, PrintStream out, PrintStream err) {
        String payload = summary.toJson();
        if (output == null) {
            out.println(payload);
            return TraceCli.EXIT_OK;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, payload + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error writing output: " + e.getMessage());
            return TraceCli.EXIT_FAILURE;
        }
        return TraceCli.EXIT_OK;
    }
}
