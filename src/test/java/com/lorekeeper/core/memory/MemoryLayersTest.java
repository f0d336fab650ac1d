package com.lorekeeper.core.memory;

import com.lorekeeper.core.access.AccessArbiter;
import com.lorekeeper.core.access.CanonScope;
import com.lorekeeper.core.error.CanonVersionConflictException;
import com.lorekeeper.core.error.IllegalStatusTransitionException;
import com.lorekeeper.core.error.PermissionDeniedException;
import com.lorekeeper.core.error.SessionClosedException;
import com.lorekeeper.core.error.UnknownTaskException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.events.LoreEvent;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.BufferStatus;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeResolution;
import com.lorekeeper.core.model.DisputeStatus;
import com.lorekeeper.core.persistence.InMemoryMemoryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MemoryLayersTest {

    private EventBus eventBus;
    private MemoryLayers layers;
    private AgentHandle orchestrator;
    private AgentHandle research;
    private AgentHandle curator;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        layers = new MemoryLayers(new InMemoryMemoryStorage(), new AccessArbiter(), eventBus);
        orchestrator = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "plan");
        research = orchestrator.spawn(AgentRole.RESEARCH, "look up boiling point");
        curator = AgentHandle.system("curator", AgentRole.CURATOR, "task-1");
    }

    @Nested
    @DisplayName("Canon")
    class CanonTests {

        @Test
        @DisplayName("versions start at 1 and increase by one per install")
        void versionsAreContiguous() {
            var v1 = layers.writeCanon(CanonWrite.direct("facts/water", "100C", 0.9), orchestrator);
            var v2 = layers.writeCanon(CanonWrite.direct("facts/water", "100 C at sea level", 0.95), orchestrator);

            assertEquals(1, v1.version());
            assertEquals(2, v2.version());
            assertEquals(List.of(1L, 2L), layers.canonHistory("facts/water", research).stream()
                    .map(CanonEntry::version).toList());
            assertEquals("100 C at sea level", layers.readCanonSlice(Set.of("facts/water"), research,
                    CanonScope.unrestricted()).get("facts/water").value());
        }

        @Test
        @DisplayName("a conditional write against a stale version conflicts and installs nothing")
        void conditionalConflict() {
            layers.writeCanon(CanonWrite.direct("facts/water", "100C", 0.9), orchestrator);

            var ex = assertThrows(CanonVersionConflictException.class, () -> layers.writeCanon(
                    new CanonWrite("facts/water", "90C", 0.9, 0L, List.of()), curator));
            assertEquals(0, ex.getExpectedVersion());
            assertEquals(1, ex.getActualVersion());
            assertEquals(1, layers.canonHistory("facts/water", curator).size());
        }

        @Test
        @DisplayName("specialists cannot write Canon")
        void specialistDenied() {
            assertThrows(PermissionDeniedException.class,
                    () -> layers.writeCanon(CanonWrite.direct("facts/x", "y", 0.5), research));
        }

        @Test
        @DisplayName("reads are filtered by the caller's scope")
        void scopedReads() {
            layers.writeCanon(CanonWrite.direct("facts/water", "100C", 0.9), orchestrator);
            layers.writeCanon(CanonWrite.direct("decisions/db", "postgres", 0.9), orchestrator);

            var slice = layers.readCanonScope(research, CanonScope.of("facts"));
            assertEquals(Set.of("facts/water"), slice.keySet());
            assertTrue(layers.readCanonSlice(Set.of("decisions/db", "facts/missing"), research,
                    CanonScope.of("facts")).isEmpty());
        }

        @Test
        @DisplayName("installs publish canon.installed")
        void publishesEvent() {
            List<LoreEvent> events = new ArrayList<>();
            eventBus.subscribeAll(events::add);

            layers.writeCanon(CanonWrite.direct("facts/water", "100C", 0.9), orchestrator);

            assertEquals("canon.installed", events.get(0).eventType());
            assertEquals(1L, events.get(0).payload().get("version"));
        }
    }

    @Nested
    @DisplayName("Buffer")
    class BufferTests {

        @BeforeEach
        void openTasks() {
            layers.openTaskMemory("task-1", "plan");
            layers.openTaskMemory("task-2", "other plan");
        }

        @Test
        @DisplayName("appends are read back in order, filtered by task and status")
        void appendAndFilter() {
            var a = layers.appendBuffer(BufferEntry.pending("task-1", research, "facts/water", "100C", "web", 0.7));
            layers.appendBuffer(BufferEntry.pending("task-2", research, "facts/water", "99C", "web", 0.7));
            var c = layers.appendBuffer(BufferEntry.pending("task-1", research, "facts/salt", "NaCl", "web", 0.9));

            var buffer = layers.readBuffer("task-1", BufferStatus.PENDING, research);
            assertEquals(List.of(a.id(), c.id()), buffer.entries().stream().map(BufferEntry::id).toList());
            assertEquals(3, layers.readBuffer(null, null, research).size());
        }

        @Test
        @DisplayName("only the curator transitions entries, and only out of PENDING")
        void transitions() {
            var entry = layers.appendBuffer(BufferEntry.pending("task-1", research, "facts/water", "100C", "web", 0.7));

            assertThrows(PermissionDeniedException.class,
                    () -> layers.transitionBuffer(entry.id(), BufferStatus.PROMOTED, orchestrator));

            var promoted = layers.transitionBuffer(entry.id(), BufferStatus.PROMOTED, curator);
            assertEquals(BufferStatus.PROMOTED, promoted.status());

            assertThrows(IllegalStatusTransitionException.class,
                    () -> layers.transitionBuffer(entry.id(), BufferStatus.DISMISSED, curator));
            assertThrows(IllegalStatusTransitionException.class,
                    () -> layers.transitionBuffer("missing", BufferStatus.DISMISSED, curator));
        }

        @Test
        @DisplayName("non-PENDING appends are rejected")
        void nonPendingRejected() {
            var entry = BufferEntry.pending("task-1", research, "facts/water", "100C", "web", 0.7)
                    .withStatus(BufferStatus.PROMOTED);
            assertThrows(IllegalStatusTransitionException.class, () -> layers.appendBuffer(entry));
        }

        @Test
        @DisplayName("appends for an unknown task are rejected")
        void unknownTaskRejected() {
            var stray = AgentHandle.root("task-x", AgentRole.ORCHESTRATOR, "stray");

            assertThrows(UnknownTaskException.class, () -> layers.appendBuffer(
                    BufferEntry.pending("task-x", stray.spawn(AgentRole.RESEARCH, "r"), "facts/x", "y", "web", 0.9)));
            assertTrue(layers.readBuffer(null, null, curator).entries().isEmpty());
        }

        @Test
        @DisplayName("appends after the task memory is archived are rejected")
        void archivedTaskRejected() {
            layers.archiveTaskMemory("task-1");

            assertThrows(SessionClosedException.class, () -> layers.appendBuffer(
                    BufferEntry.pending("task-1", research, "facts/x", "late claim", "web", 0.95)));
            assertTrue(layers.readBuffer("task-1", null, curator).entries().isEmpty());
            layers.appendBuffer(BufferEntry.pending("task-2", research, "facts/x", "still open", "web", 0.7));
        }
    }

    @Nested
    @DisplayName("Scratch")
    class ScratchTests {

        @Test
        @DisplayName("only the owner reads its notes")
        void ownerOnly() {
            layers.writeScratch(research, "check NIST");

            assertEquals("check NIST", layers.readScratch(research, research.id(), "task-1").get(0).content());
            assertThrows(PermissionDeniedException.class,
                    () -> layers.readScratch(orchestrator, research.id(), "task-1"));
        }

        @Test
        @DisplayName("discard empties the owner's notes")
        void discard() {
            layers.writeScratch(research, "one");
            layers.writeScratch(research, "two");

            layers.discardScratch(research);

            assertTrue(layers.readScratch(research, research.id(), "task-1").isEmpty());
        }

        @Test
        @DisplayName("the curator has no scratch")
        void curatorDenied() {
            assertThrows(PermissionDeniedException.class, () -> layers.writeScratch(curator, "note"));
        }
    }

    @Nested
    @DisplayName("Task memory")
    class TaskMemoryTests {

        @Test
        @DisplayName("participants append and read in order")
        void appendAndRead() {
            assertTrue(layers.openTaskMemory("task-1", "plan a trip"));
            assertFalse(layers.openTaskMemory("task-1", "again"));

            layers.appendTaskMemory("task-1", orchestrator, "plan", "1. flights");
            layers.appendTaskMemory("task-1", research, "flights", "LHR-JFK");

            var memory = layers.readTaskMemory("task-1", research);
            assertEquals("plan a trip", memory.prompt());
            assertEquals(List.of("plan", "flights"), memory.entries().stream().map(e -> e.key()).toList());
        }

        @Test
        @DisplayName("agents of other tasks are not participants")
        void nonParticipantDenied() {
            layers.openTaskMemory("task-1", "p");
            var stranger = AgentHandle.root("task-2", AgentRole.ORCHESTRATOR, "other");

            assertThrows(PermissionDeniedException.class,
                    () -> layers.appendTaskMemory("task-1", stranger, "k", "v"));
            assertThrows(PermissionDeniedException.class, () -> layers.readTaskMemory("task-1", stranger));
        }

        @Test
        @DisplayName("archived task memory rejects appends; unknown tasks are reported")
        void archivedAndUnknown() {
            layers.openTaskMemory("task-1", "p");
            layers.archiveTaskMemory("task-1");

            assertThrows(SessionClosedException.class,
                    () -> layers.appendTaskMemory("task-1", orchestrator, "k", "v"));
            assertTrue(layers.readTaskMemory("task-1", orchestrator).archived());

            var other = AgentHandle.root("task-x", AgentRole.ORCHESTRATOR, "p");
            assertThrows(UnknownTaskException.class, () -> layers.appendTaskMemory("task-x", other, "k", "v"));
            assertThrows(UnknownTaskException.class, () -> layers.archiveTaskMemory("task-x"));
        }
    }

    @Nested
    @DisplayName("Disputes")
    class DisputeTests {

        private DisputeRecord open() {
            return new DisputeRecord("dsp-1", "task-1", "buf-1", "facts/water", "90C", 0.8,
                    1, "100C", 0.1, Instant.now(), DisputeStatus.OPEN, null);
        }

        @Test
        @DisplayName("curator opens, reads and resolves")
        void lifecycle() {
            layers.openDispute(open(), curator);
            assertEquals(1, layers.readDisputes(DisputeStatus.OPEN, research).size());

            var resolution = new DisputeResolution(DisputeResolution.Outcome.KEPT_CANON, "ops", "", null, Instant.now());
            var resolved = layers.markDisputeResolved("dsp-1", resolution, curator);

            assertEquals(DisputeStatus.RESOLVED, resolved.status());
            assertTrue(layers.readDisputes(DisputeStatus.OPEN, research).isEmpty());
            assertThrows(IllegalStatusTransitionException.class,
                    () -> layers.markDisputeResolved("dsp-1", resolution, curator));
        }

        @Test
        @DisplayName("specialists cannot open disputes")
        void specialistDenied() {
            assertThrows(PermissionDeniedException.class, () -> layers.openDispute(open(), research));
        }
    }

    @Test
    @DisplayName("summary counts every layer")
    void summary() {
        layers.openTaskMemory("task-1", "p");
        layers.writeCanon(CanonWrite.direct("facts/water", "100C", 0.9), orchestrator);
        var entry = layers.appendBuffer(BufferEntry.pending("task-1", research, "facts/x", "y", "web", 0.7));
        layers.appendBuffer(BufferEntry.pending("task-1", research, "facts/z", "w", "web", 0.7));
        layers.transitionBuffer(entry.id(), BufferStatus.DISMISSED, curator);

        assertEquals("Canon:1 entries | Buffer:1 live / 2 total | Tasks:1 | Disputes:0 open", layers.summary());
    }
}
