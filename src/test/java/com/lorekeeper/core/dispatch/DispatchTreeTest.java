package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.error.IllegalStatusTransitionException;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.DispatchState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DispatchTreeTest {

    @Nested
    @DisplayName("DispatchNode")
    class NodeTests {

        private DispatchNode node() {
            return new DispatchTree("task-1").record(AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "x"));
        }

        @Test
        @DisplayName("follows the state machine and records history")
        void followsStateMachine() {
            var node = node();
            assertTrue(node.advance(DispatchState.SCOPED));
            assertTrue(node.advance(DispatchState.INVOKED));
            assertTrue(node.advance(DispatchState.DELEGATED));
            assertTrue(node.advance(DispatchState.DELEGATED));
            assertTrue(node.advance(DispatchState.COMPLETED));

            assertEquals(List.of(DispatchState.REQUESTED, DispatchState.SCOPED, DispatchState.INVOKED,
                            DispatchState.DELEGATED, DispatchState.COMPLETED),
                    node.history().stream().map(DispatchNode.StateChange::state).toList());
        }

        @Test
        @DisplayName("rejects skipped states")
        void rejectsSkips() {
            var node = node();
            assertThrows(IllegalStatusTransitionException.class, () -> node.advance(DispatchState.COMPLETED));
        }

        @Test
        @DisplayName("terminal nodes ignore later transitions")
        void terminalIsFinal() {
            var node = node();
            node.advance(DispatchState.FAILED, "declined: too deep");

            assertFalse(node.advance(DispatchState.SCOPED));
            assertFalse(node.advance(DispatchState.COMPLETED));
            assertEquals(DispatchState.FAILED, node.state());
            assertEquals("declined: too deep", node.failureReason());
        }
    }

    @Test
    @DisplayName("tracks parents, depth and counts, and renders indented")
    void treeStructure() {
        var tree = new DispatchTree("task-1");
        var root = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "plan");
        var research = root.spawn(AgentRole.RESEARCH, "find");
        var data = research.spawn(AgentRole.DATA, "crunch");
        tree.record(root);
        tree.record(research);
        tree.record(data).advance(DispatchState.FAILED, "boom");

        assertEquals(3, tree.size());
        assertEquals(2, tree.maxDepth());
        assertEquals(List.of(root.id()), tree.roots().stream().map(DispatchNode::id).toList());
        assertEquals(List.of(research.id()), tree.children(root.id()).stream().map(DispatchNode::id).toList());
        assertEquals(1, tree.count(DispatchState.FAILED));
        assertEquals(2, tree.count(DispatchState.REQUESTED));
        assertEquals(research.id(), tree.node(data.id()).parentId());

        String rendered = tree.render();
        assertEquals("orchestrator [" + root.id() + "] REQUESTED\n"
                + "  research [" + research.id() + "] REQUESTED\n"
                + "    data [" + data.id() + "] FAILED (boom)\n", rendered);
    }

    @Test
    @DisplayName("declined requests are listed under the requester, not as nodes")
    void declinedNotes() {
        var tree = new DispatchTree("task-1");
        var root = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "plan");
        tree.record(root).recordDeclined("cycle: repeats the assignment of " + root.id());

        assertEquals(1, tree.size());
        assertEquals("orchestrator [" + root.id() + "] REQUESTED\n"
                + "  - declined cycle: repeats the assignment of " + root.id() + "\n", tree.render());
    }

    @Nested
    @DisplayName("Abandonment")
    class AbandonTests {

        @Test
        @DisplayName("fails the node and covers its whole subtree")
        void coversSubtree() {
            var tree = new DispatchTree("task-1");
            var root = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "plan");
            var research = root.spawn(AgentRole.RESEARCH, "find");
            var data = research.spawn(AgentRole.DATA, "crunch");
            tree.record(root);
            tree.record(research);
            tree.record(data);

            assertTrue(tree.abandon(research.id(), "timed out after 1s"));

            assertEquals(DispatchState.FAILED, tree.node(research.id()).state());
            assertEquals("timed out after 1s", tree.node(research.id()).failureReason());
            assertTrue(tree.isAbandoned(data.id()));
            assertFalse(tree.isAbandoned(root.id()));
            assertEquals(DispatchState.REQUESTED, tree.node(data.id()).state());
        }

        @Test
        @DisplayName("writes run only while the dispatch is live")
        void whileLive() {
            var tree = new DispatchTree("task-1");
            var root = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "plan");
            var research = root.spawn(AgentRole.RESEARCH, "find");
            tree.record(root);
            tree.record(research);

            assertEquals("written", tree.whileLive(research.id(), () -> "written").orElseThrow());
            tree.abandon(research.id(), "timed out after 1s");
            assertTrue(tree.whileLive(research.id(), () -> "written").isEmpty());
            assertFalse(tree.abandon(research.id(), "again"));
        }
    }
}
