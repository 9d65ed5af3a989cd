package com.agenttrace.cli.render;

import com.agenttrace.core.model.Edge;
import com.agenttrace.core.model.EdgeType;
import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.NodeStatus;
import com.agenttrace.core.model.TraceGraph;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a trace as an indented text tree.
 *
 * <pre>
 * Trace: research-agent (5000ms)
 * └── [trace] research-agent (5000ms) ✓
 *     ├── [decision] plan (1000ms) ✓
 *     │   └── annotation: "three sources"
 *     └── [tool_call] search-v2 (800ms) ✓ [retry of search]
 * </pre>
 */
public class TraceRenderer {

    static final int MAX_JSON_LENGTH = 200;
    static final String JSON_CUT_MARKER = "... [truncated]";

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE = "│   ";
    private static final String SPACE = "    ";

    private final Verbosity verbosity;
    private final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    public TraceRenderer(Verbosity verbosity) {
        this.verbosity = verbosity != null ? verbosity : Verbosity.STANDARD;
    }

    public String render(TraceGraph trace) {
        Map<String, Node> nodes = trace.nodes();
        Map<String, List<Node>> childrenByParent = new HashMap<>();
        List<Node> roots = new ArrayList<>();
        for (Node node : nodes.values()) {
            // a parent missing from the graph makes the node a root
            if (node.parentId() == null || !nodes.containsKey(node.parentId())) {
                roots.add(node);
            } else {
                childrenByParent.computeIfAbsent(node.parentId(), k -> new ArrayList<>()).add(node);
            }
        }
        Comparator<Node> bySequence = Comparator.comparingInt(Node::sequenceNumber);
        roots.sort(bySequence);
        childrenByParent.values().forEach(list -> list.sort(bySequence));

        Map<String, List<String>> linksBySource = new HashMap<>();
        for (Edge edge : trace.edges()) {
            if (isImplicit(edge, nodes)) continue;
            Node target = nodes.get(edge.targetId());
            String targetName = target != null ? target.name() : edge.targetId();
            linksBySource.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>())
                .add("[" + edge.edgeType().phrase() + " " + targetName + "]");
        }

        StringBuilder out = new StringBuilder();
        out.append("Trace: ")
            .append(trace.name().isEmpty() ? trace.traceId() : trace.name())
            .append(" (").append(formatDuration(trace.durationMs(), "ongoing")).append(")\n");
        for (int i = 0; i < roots.size(); i++) {
            renderNode(out, roots.get(i), "", i == roots.size() - 1, childrenByParent, linksBySource);
        }
        return out.toString();
    }

    private void renderNode(StringBuilder out, Node node, String prefix, boolean last,
                            Map<String, List<Node>> childrenByParent, Map<String, List<String>> linksBySource) {
        StringBuilder line = new StringBuilder()
            .append('[').append(node.nodeType()).append("] ")
            .append(node.name())
            .append(" (").append(formatDuration(node.durationMs(), "running")).append(") ")
            .append(statusIcon(node.status()));
        for (String link : linksBySource.getOrDefault(node.id(), List.of())) {
            line.append(' ').append(link);
        }
        out.append(prefix).append(last ? LAST_BRANCH : BRANCH).append(line).append('\n');

        List<String> details = details(node);
        List<Node> children = childrenByParent.getOrDefault(node.id(), List.of());
        String childPrefix = prefix + (last ? SPACE : PIPE);
        int total = details.size() + children.size();
        int index = 0;
        for (String detail : details) {
            index++;
            out.append(childPrefix).append(index == total ? LAST_BRANCH : BRANCH).append(detail).append('\n');
        }
        for (Node child : children) {
            index++;
            renderNode(out, child, childPrefix, index == total, childrenByParent, linksBySource);
        }
    }

    private List<String> details(Node node) {
        List<String> lines = new ArrayList<>();
        if (verbosity == Verbosity.MINIMAL) return lines;
        if (verbosity == Verbosity.FULL) {
            if (!node.inputData().isEmpty()) lines.add("input: " + json(node.inputData()));
            if (!node.outputData().isEmpty()) lines.add("output: " + json(node.outputData()));
            if (!node.metadata().isEmpty()) lines.add("metadata: " + json(node.metadata()));
        }
        for (String annotation : node.annotations()) {
            lines.add("annotation: \"" + annotation + "\"");
        }
        if (node.error() != null) {
            lines.add("error: " + node.errorType() + ": " + node.error());
        }
        return lines;
    }

    String json(Map<String, Object> data) {
        String text = gson.toJson(data);
        if (text.length() > MAX_JSON_LENGTH) {
            return text.substring(0, MAX_JSON_LENGTH) + JSON_CUT_MARKER;
        }
        return text;
    }

    // The parent-to-child causal edge is already shown by nesting.
    private static boolean isImplicit(Edge edge, Map<String, Node> nodes) {
        if (edge.edgeType() != EdgeType.CAUSED_BY) return false;
        Node target = nodes.get(edge.targetId());
        return target != null && edge.sourceId().equals(target.parentId());
    }

    static String formatDuration(Double millis, String absent) {
        return millis != null ? String.format(Locale.ROOT, "%.0fms", millis) : absent;
    }

    static String statusIcon(NodeStatus status) {
        return switch (status) {
            case COMPLETED -> "✓";
            case FAILED -> "✗";
            case CANCELLED -> "⊘";
            case RUNNING -> "…";
            case PENDING -> "·";
        };
    }
}
