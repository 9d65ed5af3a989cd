package com.agenttrace.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    void rootHasDepthZeroAndNoParent() {
        Node root = new Node(0, "root", NodeType.TRACE);
        assertTrue(root.isRoot());
        assertNull(root.parentId());
        assertEquals(0, root.depth());
        assertEquals(NodeStatus.PENDING, root.status());
    }

    @Test
    void childDepthIsParentDepthPlusOne() {
        Node root = new Node(0, "root", NodeType.TRACE);
        Node child = new Node(1, "child", NodeType.TOOL_CALL, root);
        Node grandchild = new Node(2, "grandchild", NodeType.LLM_CALL, child);

        assertEquals(root.id(), child.parentId());
        assertEquals(1, child.depth());
        assertEquals(2, grandchild.depth());
    }

    @Test
    void idsAreUniqueHexStrings() {
        Node a = new Node(0, "a", NodeType.CUSTOM);
        Node b = new Node(1, "b", NodeType.CUSTOM);
        assertNotEquals(a.id(), b.id());
        assertTrue(a.id().matches("[0-9a-f]{32}"), a.id());
    }

    @Test
    void nullTypeDefaultsToCustom() {
        assertEquals(NodeType.CUSTOM, new Node(0, "a", null).nodeType());
    }

    @Test
    void transitionToRejectsLeavingTerminalState() {
        Node node = new Node(0, "a", NodeType.CUSTOM);
        assertTrue(node.transitionTo(NodeStatus.RUNNING));
        assertTrue(node.transitionTo(NodeStatus.FAILED));
        assertFalse(node.transitionTo(NodeStatus.COMPLETED));
        assertEquals(NodeStatus.FAILED, node.status());
    }

    @Test
    void durationRequiresBothTimestamps() {
        Node node = new Node(0, "a", NodeType.CUSTOM);
        Instant start = Instant.parse("2024-05-01T12:00:00Z");
        node.markStarted(start);
        assertNull(node.durationMs());
        node.markEnded(start.plusMillis(1500));
        assertEquals(1500.0, node.durationMs());
    }

    @Test
    void capturedDataAccessorsReturnCopies() {
        Node node = new Node(0, "a", NodeType.CUSTOM);
        node.putInput("q", "hello");
        node.addAnnotation("first");
        assertThrows(UnsupportedOperationException.class, () -> node.inputData().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> node.annotations().add("second"));
        assertEquals("hello", node.inputData().get("q"));
    }
}
