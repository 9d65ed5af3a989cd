package com.agenttrace.core;

import com.agenttrace.core.config.CaptureLevel;
import com.agenttrace.core.config.TracerConfig;
import com.agenttrace.core.model.Edge;
import com.agenttrace.core.model.EdgeType;
import com.agenttrace.core.model.Node;
import com.agenttrace.core.model.NodeStatus;
import com.agenttrace.core.model.NodeType;
import com.agenttrace.core.model.TraceGraph;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class SpanTest {

    private RecordingDiagnostics diagnostics;
    private RecordingHook hook;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnostics();
        hook = new RecordingHook();
    }

    @AfterEach
    void clearContext() {
        TraceContext.clear();
    }

    private ActiveTrace activeTrace(TracerConfig config) {
        return new ActiveTrace(new TraceGraph("test"), config, new HookDispatcher(List.of(hook), diagnostics));
    }

    private ActiveTrace activeTrace() {
        return activeTrace(TracerConfig.defaults());
    }

    private static Span root(ActiveTrace trace) {
        return new Span(trace, "root", NodeType.TRACE, null);
    }

    // --- Construction and enter ---

    @Test
    void constructionDrawsSequenceNumberWithoutTouchingGraph() {
        ActiveTrace trace = activeTrace();
        Span first = root(trace);
        Span second = new Span(trace, "second", NodeType.CUSTOM, null);

        assertEquals(0, first.nodeRecord().sequenceNumber());
        assertEquals(1, second.nodeRecord().sequenceNumber());
        assertEquals(NodeStatus.PENDING, first.status());
        assertEquals(0, trace.graph().nodeCount());
        assertTrue(hook.events().isEmpty());
    }

    @Test
    void enterRegistersNodeAndMakesItAmbient() {
        ActiveTrace trace = activeTrace();
        Span span = root(trace).enter();

        assertEquals(NodeStatus.RUNNING, span.status());
        assertNotNull(span.nodeRecord().startTime());
        assertSame(span.nodeRecord(), trace.graph().node(span.id()));
        assertSame(span.nodeRecord(), TraceContext.currentNode());
        assertEquals(List.of("started:root"), hook.events());

        span.close();
        assertEquals(NodeStatus.COMPLETED, span.status());
        assertNotNull(span.nodeRecord().endTime());
        assertNull(TraceContext.currentNode());
        assertEquals(List.of("started:root", "completed:root"), hook.events());
    }

    @Test
    void childEnterAddsCausalEdgeFromParent() {
        ActiveTrace trace = activeTrace();
        try (Span root = root(trace).enter()) {
            try (Span child = root.node("child", NodeType.TOOL_CALL).enter()) {
                assertEquals(root.id(), child.nodeRecord().parentId());
                assertEquals(1, child.nodeRecord().depth());
                assertEquals(List.of(new Edge(root.id(), child.id())), trace.graph().edges());
                assertSame(child.nodeRecord(), TraceContext.currentNode());
            }
            assertSame(root.nodeRecord(), TraceContext.currentNode());
        }
    }

    @Test
    void spanWithoutExplicitParentUsesAmbientNode() {
        ActiveTrace trace = activeTrace();
        try (Span root = root(trace).enter()) {
            Span auto = new Span(trace, "auto", NodeType.CUSTOM);
            assertEquals(root.id(), auto.nodeRecord().parentId());
        }
    }

    @Test
    void ambientNodeOfAnotherTraceIsNotUsedAsParent() {
        ActiveTrace first = activeTrace();
        ActiveTrace second = activeTrace();
        try (Span root = root(first).enter()) {
            Span stranger = new Span(second, "stranger", NodeType.CUSTOM);
            assertNull(stranger.nodeRecord().parentId());
            assertEquals(0, stranger.nodeRecord().depth());
        }
    }

    @Test
    void secondEnterWhileRunningIsIgnored() {
        ActiveTrace trace = activeTrace();
        Span span = root(trace);
        span.enter();
        span.enter();

        assertEquals(1, trace.graph().nodeCount());
        assertEquals(List.of("started:root"), hook.events());
        span.close();
    }

    @Test
    void enterAfterExitFails() {
        Span span = root(activeTrace()).enter();
        span.close();
        assertThrows(IllegalStateException.class, span::enter);
    }

    @Test
    void exitWithoutEnterFails() {
        Span span = root(activeTrace());
        assertThrows(IllegalStateException.class, span::close);
    }

    @Test
    void secondExitIsIgnored() {
        Span span = root(activeTrace()).enter();
        span.close();
        span.exit(new IllegalStateException("late"));

        assertEquals(NodeStatus.COMPLETED, span.status());
        assertNull(span.nodeRecord().error());
        assertEquals(List.of("started:root", "completed:root"), hook.events());
    }

    @Test
    void childOfUnenteredParentCannotEnter() {
        Span parent = root(activeTrace());
        Span child = parent.node("child");
        assertThrows(IllegalStateException.class, child::enter);
    }

    @Test
    void childOutsideAnyTraceIsNull() {
        assertNull(Span.child("orphan", NodeType.CUSTOM));
    }

    // --- Failure capture ---

    @Test
    void callRecordsFailureAndRethrowsSameInstance() {
        ActiveTrace trace = activeTrace();
        IllegalStateException boom = new IllegalStateException("boom");

        try (Span root = root(trace).enter()) {
            Span child = root.node("child", NodeType.TOOL_CALL);
            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> child.call(s -> { throw boom; }));

            assertSame(boom, thrown);
            Node node = child.nodeRecord();
            assertEquals(NodeStatus.FAILED, node.status());
            assertEquals("boom", node.error());
            assertEquals("IllegalStateException", node.errorType());
            assertTrue(node.errorTraceback().contains("IllegalStateException: boom"));
            assertNotNull(node.endTime());
            assertSame(root.nodeRecord(), TraceContext.currentNode());
        }
        assertTrue(hook.events().contains("failed:child"));
    }

    @Test
    void checkedExceptionsPropagateUnchanged() {
        Span span = root(activeTrace());
        IOException io = new IOException("disk");

        IOException thrown = assertThrows(IOException.class, () -> span.run(s -> { throw io; }));
        assertSame(io, thrown);
        assertEquals("IOException", span.nodeRecord().errorType());
    }

    @Test
    void errorWithoutMessageRecordsClassName() {
        Span span = root(activeTrace()).enter();
        span.exit(new UnsupportedOperationException());
        assertEquals("java.lang.UnsupportedOperationException", span.nodeRecord().error());
    }

    @Test
    void callReturnsBodyResult() throws Exception {
        Span span = root(activeTrace());
        int result = span.call(s -> 42);
        assertEquals(42, result);
        assertEquals(NodeStatus.COMPLETED, span.status());
    }

    @Test
    void standardCaptureOmitsTraceback() {
        Span span = root(activeTrace(TracerConfig.defaults().withCaptureLevel(CaptureLevel.STANDARD))).enter();
        span.exit(new IllegalArgumentException("bad"));

        assertEquals("bad", span.nodeRecord().error());
        assertEquals("IllegalArgumentException", span.nodeRecord().errorType());
        assertNull(span.nodeRecord().errorTraceback());
    }

    // --- Captured data ---

    @Test
    void inputLongerThanLimitIsTruncatedWithOriginalSize() {
        Span span = root(activeTrace(TracerConfig.defaults().withMaxInputSize(6))).enter();
        span.input("prompt", "abcdefghij");

        String stored = (String) span.nodeRecord().inputData().get("prompt");
        assertTrue(stored.contains("TRUNCATED"));
        assertTrue(stored.contains("original_size=10"));
        assertEquals("abcdef... [TRUNCATED: original_size=10]", stored);
        span.close();
    }

    @Test
    void inputAndOutputLimitsAreIndependent() {
        Span span = root(activeTrace(TracerConfig.defaults().withMaxOutputSize(3))).enter();
        span.input("q", "abcdefghij").output("a", "abcdefghij");

        assertEquals("abcdefghij", span.nodeRecord().inputData().get("q"));
        assertEquals("abc... [TRUNCATED: original_size=10]", span.nodeRecord().outputData().get("a"));
        span.close();
    }

    @Test
    void valuesAreSanitized() {
        Object opaque = new Object() {
            @Override
            public String toString() {
                return "opaque";
            }
        };
        Span span = root(activeTrace()).enter();
        span.input(Map.of("count", 3, "tags", List.of("a", "b"), "thing", opaque));

        Map<String, Object> input = span.nodeRecord().inputData();
        assertEquals(3L, input.get("count"));
        assertEquals(List.of("a", "b"), input.get("tags"));
        assertEquals("opaque [NON-SERIALIZABLE]", input.get("thing"));
        span.close();
    }

    @Test
    void redactedKeysAreMasked() {
        TracerConfig config = TracerConfig.defaults().withRedactPatterns(List.of("api[_-]?key", "password"));
        Span span = root(activeTrace(config)).enter();
        span.input(Map.of("API_KEY", "sk-123", "query", "weather"));
        span.metadata("db_password", "hunter2");

        assertEquals("[REDACTED]", span.nodeRecord().inputData().get("API_KEY"));
        assertEquals("weather", span.nodeRecord().inputData().get("query"));
        assertEquals("[REDACTED]", span.nodeRecord().metadata().get("db_password"));
        span.close();
    }

    @Test
    void minimalCaptureIgnoresDataButKeepsAnnotations() {
        Span span = root(activeTrace(TracerConfig.defaults().withCaptureLevel(CaptureLevel.MINIMAL))).enter();
        span.input("q", "x").output("a", "y").metadata("m", "z").annotate("kept");

        assertTrue(span.nodeRecord().inputData().isEmpty());
        assertTrue(span.nodeRecord().outputData().isEmpty());
        assertTrue(span.nodeRecord().metadata().isEmpty());
        assertEquals(List.of("kept"), span.nodeRecord().annotations());
        span.close();
    }

    @Test
    void annotationsKeepOrderAndDuplicates() {
        Span span = root(activeTrace()).enter();
        span.annotate("b").annotate("a").annotate("b");
        assertEquals(List.of("b", "a", "b"), span.nodeRecord().annotations());
        span.close();
    }

    @Test
    void laterInputMergesIntoEarlier() {
        Span span = root(activeTrace()).enter();
        span.input("a", 1).input(Map.of("b", 2, "a", 3));
        assertEquals(Map.of("a", 3L, "b", 2L), span.nodeRecord().inputData());
        span.close();
    }

    // --- Explicit status ---

    @Test
    void cancelledBeforeStartCannotEnter() {
        Span span = root(activeTrace());
        span.setStatus(NodeStatus.CANCELLED);
        assertEquals(NodeStatus.CANCELLED, span.status());
        assertThrows(IllegalStateException.class, span::enter);
    }

    @Test
    void cancelledWhileRunningStaysCancelledOnExit() {
        Span span = root(activeTrace()).enter();
        span.setStatus(NodeStatus.CANCELLED);
        span.close();

        assertEquals(NodeStatus.CANCELLED, span.status());
        assertNotNull(span.nodeRecord().endTime());
        assertTrue(diagnostics.all().isEmpty());
    }

    @Test
    void cancelledSpanWhoseBodyThrowsStaysCancelledWithoutError() {
        Span span = root(activeTrace());
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> span.run(s -> {
            s.setStatus(NodeStatus.CANCELLED);
            throw new IllegalStateException("aborted");
        }));

        assertEquals("aborted", thrown.getMessage());
        assertEquals(NodeStatus.CANCELLED, span.status());
        assertNull(span.nodeRecord().error());
        assertNull(span.nodeRecord().errorType());
        assertEquals(List.of("started:root", "completed:root"), hook.events());
    }

    @Test
    void explicitlyFailedSpanWhoseBodyThrowsRecordsTheError() {
        Span span = root(activeTrace());
        assertThrows(IllegalStateException.class, () -> span.run(s -> {
            s.setStatus(NodeStatus.FAILED);
            throw new IllegalStateException("boom");
        }));

        assertEquals(NodeStatus.FAILED, span.status());
        assertEquals("boom", span.nodeRecord().error());
        assertEquals(List.of("started:root", "failed:root"), hook.events());
    }

    @Test
    void lifecycleStatusesCannotBeSetExplicitly() {
        Span span = root(activeTrace());
        assertThrows(IllegalArgumentException.class, () -> span.setStatus(NodeStatus.RUNNING));
        assertThrows(IllegalArgumentException.class, () -> span.setStatus(NodeStatus.PENDING));
    }

    @Test
    void leavingTerminalStateIsReportedNotApplied() {
        Span span = root(activeTrace()).enter();
        span.close();
        span.setStatus(NodeStatus.FAILED);

        assertEquals(NodeStatus.COMPLETED, span.status());
        List<Diagnostic> reported = diagnostics.ofKind(Diagnostic.Kind.INVALID_STATUS_TRANSITION);
        assertEquals(1, reported.size());
        assertTrue(reported.get(0).message().contains("completed -> failed"));
    }

    // --- Links ---

    @Test
    void explicitLinksAreAddedAlongsideCausalEdges() {
        ActiveTrace trace = activeTrace();
        try (Span root = root(trace).enter()) {
            Span first = root.node("search", NodeType.TOOL_CALL).enter();
            Span retry = root.node("search-retry", NodeType.TOOL_CALL).enter();
            Span fallback = root.node("cached-search", NodeType.TOOL_CALL).enter();

            retry.link(first, EdgeType.RETRY_OF);
            fallback.link(retry, EdgeType.FALLBACK_OF, "cache hit");

            List<Edge> edges = trace.graph().edges();
            assertEquals(5, edges.size());
            assertEquals(3, edges.stream().filter(e -> e.edgeType() == EdgeType.CAUSED_BY).count());
            assertTrue(edges.contains(new Edge(retry.id(), first.id(), EdgeType.RETRY_OF)));
            assertTrue(edges.contains(new Edge(fallback.id(), retry.id(), EdgeType.FALLBACK_OF, "cache hit", Map.of())));

            fallback.close();
            retry.close();
            first.close();
        }
    }

    @Test
    void linkDefaultsToCausedBy() {
        ActiveTrace trace = activeTrace();
        try (Span root = root(trace).enter()) {
            Span a = root.node("a").enter();
            a.close();
            Span b = root.node("b").enter();
            b.link(a);
            b.close();
            assertEquals(new Edge(b.id(), a.id()), trace.graph().edges().get(2));
        }
    }

    @Test
    void linkingUnenteredSpanFails() {
        ActiveTrace trace = activeTrace();
        try (Span root = root(trace).enter()) {
            Span pending = root.node("pending");
            assertThrows(IllegalStateException.class, () -> root.link(pending));
            assertThrows(IllegalStateException.class, () -> pending.link(root));
        }
    }

    @Test
    void linkingAcrossTracesFails() {
        Span a = root(activeTrace()).enter();
        Span b = root(activeTrace()).enter();
        assertThrows(IllegalArgumentException.class, () -> b.link(a));
        b.close();
        a.close();
    }

    // --- Async ---

    @Test
    void asyncSpanStaysOpenUntilStageCompletes() {
        ActiveTrace trace = activeTrace();
        try (Span root = root(trace).enter()) {
            CompletableFuture<String> pending = new CompletableFuture<>();
            Span child = root.node("llm", NodeType.LLM_CALL);

            CompletableFuture<String> result = child.callAsync(s -> {
                assertSame(s.nodeRecord(), TraceContext.currentNode());
                return pending;
            });

            assertSame(root.nodeRecord(), TraceContext.currentNode());
            assertEquals(NodeStatus.RUNNING, child.status());
            assertFalse(result.isDone());

            pending.complete("answer");
            assertEquals("answer", result.join());
            assertEquals(NodeStatus.COMPLETED, child.status());
            assertNotNull(child.nodeRecord().endTime());
        }
        assertEquals(List.of("started:root", "started:llm", "completed:llm", "completed:root"), hook.events());
    }

    @Test
    void asyncFailureIsRecordedUnwrapped() {
        Span span = root(activeTrace());
        CompletableFuture<String> result = span.callAsync(s ->
            CompletableFuture.<String>supplyAsync(() -> { throw new IllegalArgumentException("bad input"); }));

        CompletionException thrown = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
        assertEquals(NodeStatus.FAILED, span.status());
        assertEquals("IllegalArgumentException", span.nodeRecord().errorType());
        assertEquals("bad input", span.nodeRecord().error());
    }

    @Test
    void asyncBodyThrowingSynchronouslyFailsTheSpan() {
        Span span = root(activeTrace());
        assertThrows(IllegalStateException.class,
            () -> span.callAsync(s -> { throw new IllegalStateException("sync"); }));
        assertEquals(NodeStatus.FAILED, span.status());
        assertNull(TraceContext.currentNode());
    }
}
