package com.lorekeeper.core.session;

import com.lorekeeper.core.access.AccessArbiter;
import com.lorekeeper.core.curator.CurationReport;
import com.lorekeeper.core.curator.CuratorProperties;
import com.lorekeeper.core.curator.MemoryCurator;
import com.lorekeeper.core.curator.TokenAgreementPolicy;
import com.lorekeeper.core.dispatch.AgentTurn;
import com.lorekeeper.core.dispatch.DelegationCycleDetector;
import com.lorekeeper.core.dispatch.DispatchProperties;
import com.lorekeeper.core.dispatch.DispatchRouter;
import com.lorekeeper.core.dispatch.InferenceClient;
import com.lorekeeper.core.dispatch.ToolExecutor;
import com.lorekeeper.core.dispatch.ToolRequest;
import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.error.SessionClosedException;
import com.lorekeeper.core.error.StorageFailureException;
import com.lorekeeper.core.error.UnknownTaskException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.memory.MemoryContextBuilder;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.memory.MemoryProperties;
import com.lorekeeper.core.metrics.LoreMetrics;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.DispatchState;
import com.lorekeeper.core.persistence.InMemoryMemoryStorage;
import com.lorekeeper.core.search.SearchProperties;
import com.lorekeeper.core.search.WebSearchClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TaskSessionManagerTest {

    private volatile InferenceClient model;
    private InMemoryMemoryStorage storage;
    private MemoryLayers layers;
    private MemoryCurator curator;
    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private DispatchProperties properties;
    private TaskSessionManager manager;

    @BeforeEach
    void setUp() {
        var eventBus = new EventBus();
        storage = spy(new InMemoryMemoryStorage());
        layers = new MemoryLayers(storage, new AccessArbiter(), eventBus);
        registry = new SimpleMeterRegistry();
        var metrics = new LoreMetrics(registry);
        curator = new MemoryCurator(layers, new TokenAgreementPolicy(), new CuratorProperties(), eventBus, metrics);
        executor = Executors.newCachedThreadPool();
        InferenceClient scripted = (role, system, history, tools) -> model.invoke(role, system, history, tools);
        properties = new DispatchProperties();
        var router = new DispatchRouter(scripted,
                new ToolExecutor(layers, mock(WebSearchClient.class), new SearchProperties()),
                new MemoryContextBuilder(layers, new MemoryProperties()), layers, new DelegationCycleDetector(),
                properties, eventBus, metrics, executor);
        manager = new TaskSessionManager(layers, router, curator, eventBus, metrics);
        model = (role, system, history, tools) -> AgentTurn.answer("ok");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("open")
    class OpenTests {

        @Test
        @DisplayName("creates task memory seeded with the prompt")
        void opensSession() {
            TaskSession session = manager.open("task-1", "plan a trip");

            assertEquals(SessionStatus.OPEN, session.status());
            var reader = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "r");
            assertEquals("plan a trip", layers.readTaskMemory("task-1", reader).prompt());
            assertTrue(manager.session("task-1").isPresent());
        }

        @Test
        @DisplayName("generates an id when none is given")
        void generatesId() {
            TaskSession session = manager.open(null, "p");
            assertTrue(session.taskId().startsWith("task-"));
        }

        @Test
        @DisplayName("rejects a duplicate id")
        void rejectsDuplicate() {
            manager.open("task-1", "p");
            assertThrows(LorekeeperException.class, () -> manager.open("task-1", "again"));
            assertEquals(1, manager.sessions().size());
        }

        @Test
        @DisplayName("does not leave the task id in the caller's logging context")
        void leavesNoLoggingContext() {
            manager.open("task-1", "p");

            assertNull(MDC.get("taskId"));
        }
    }

    @Nested
    @DisplayName("dispatch")
    class DispatchTests {

        @Test
        @DisplayName("runs the root and keeps its outcome")
        void dispatches() {
            manager.open("task-1", "p");

            var outcome = manager.dispatch("task-1", "hello");

            assertEquals(DispatchState.COMPLETED, outcome.state());
            assertEquals(1, manager.session("task-1").orElseThrow().outcomes().size());
        }

        @Test
        @DisplayName("an unknown task is reported")
        void unknownTask() {
            assertThrows(UnknownTaskException.class, () -> manager.dispatch("task-missing", "hello"));
        }

        @Test
        @DisplayName("a closed session accepts no dispatches")
        void closedRejects() {
            manager.open("task-1", "p");
            manager.close("task-1");

            assertThrows(SessionClosedException.class, () -> manager.dispatch("task-1", "hello"));
            assertThrows(SessionClosedException.class, () -> manager.close("task-1"));
        }

        @Test
        @DisplayName("a task archived by an earlier process counts as closed")
        void archivedElsewhere() {
            layers.openTaskMemory("task-old", "p");
            layers.archiveTaskMemory("task-old");

            assertThrows(SessionClosedException.class, () -> manager.dispatch("task-old", "hello"));
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("curates the buffer and archives task memory")
        void curatesAndArchives() {
            model = (role, system, history, tools) -> history.size() == 1
                    ? AgentTurn.tools(ToolRequest.of("write_to_buffer", "canon_key", "facts/water",
                            "claim", "100C", "confidence", "0.9"))
                    : AgentTurn.answer("water boils at 100C");
            manager.open("task-1", "boiling point");
            manager.dispatch("task-1", "boiling point of water?");

            CurationReport report = manager.close("task-1");

            assertEquals(1, report.promoted().size());
            assertEquals("100C", storage.currentCanon("facts/water").orElseThrow().value());
            var reader = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "r");
            assertTrue(layers.readTaskMemory("task-1", reader).archived());
            TaskSession session = manager.session("task-1").orElseThrow();
            assertEquals(SessionStatus.CLOSED, session.status());
            assertSame(report, session.curation());
            assertNotNull(session.closedAt());
        }

        @Test
        @DisplayName("a failed curation leaves the session open for a retry")
        void failedCurationLeavesOpen() {
            manager.open("task-1", "p");
            doThrow(new StorageFailureException("db down")).doCallRealMethod().when(storage).buffer();

            assertThrows(StorageFailureException.class, () -> manager.close("task-1"));
            assertEquals(SessionStatus.OPEN, manager.session("task-1").orElseThrow().status());

            assertDoesNotThrow(() -> manager.close("task-1"));
            assertEquals(SessionStatus.CLOSED, manager.session("task-1").orElseThrow().status());
        }

        @Test
        @DisplayName("a failed archive leaves the session open and the retry installs nothing twice")
        void failedArchiveLeavesOpen() {
            model = (role, system, history, tools) -> history.size() == 1
                    ? AgentTurn.tools(ToolRequest.of("write_to_buffer", "canon_key", "facts/water",
                            "claim", "100C", "confidence", "0.9"))
                    : AgentTurn.answer("noted");
            manager.open("task-1", "p");
            manager.dispatch("task-1", "boiling point of water?");
            doThrow(new StorageFailureException("db down")).doCallRealMethod().when(storage).archiveTaskMemory(any());

            assertThrows(StorageFailureException.class, () -> manager.close("task-1"));
            assertEquals(SessionStatus.OPEN, manager.session("task-1").orElseThrow().status());
            assertEquals(1, storage.canonHistory("facts/water").size());

            CurationReport retry = manager.close("task-1");

            assertEquals(SessionStatus.CLOSED, manager.session("task-1").orElseThrow().status());
            assertTrue(retry.canonVersionsInstalled().isEmpty());
            assertEquals(1, storage.canonHistory("facts/water").size());
        }

        @Test
        @DisplayName("a child still running after close cannot get a claim into the buffer or Canon")
        void timedOutChildAfterClose() throws Exception {
            properties.setChildTimeoutSeconds(1);
            var release = new CountDownLatch(1);
            model = (role, system, history, tools) -> {
                if (role == AgentRole.RESEARCH) {
                    if (history.size() > 1) {
                        return AgentTurn.answer("stored it");
                    }
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return AgentTurn.tools(ToolRequest.of("write_to_buffer", "canon_key", "facts/x",
                            "claim", "late claim", "confidence", "0.95"));
                }
                return history.size() == 1
                        ? AgentTurn.tools(ToolRequest.of("research_agent", "task", "slow lookup"))
                        : AgentTurn.answer("went ahead without it");
            };
            manager.open("task-1", "p");
            manager.dispatch("task-1", "ask the slow one");

            CurationReport report = manager.close("task-1");
            release.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

            assertEquals(0, report.processed());
            assertTrue(storage.currentCanon("facts/x").isEmpty());
            var reader = AgentHandle.system("curator", AgentRole.CURATOR, "task-1");
            assertTrue(layers.readBuffer("task-1", null, reader).entries().isEmpty());
            assertThrows(SessionClosedException.class, () -> manager.close("task-1"));
        }
    }

    @Test
    @DisplayName("run opens, dispatches and closes in one call")
    void runOneShot() {
        model = (role, system, history, tools) -> AgentTurn.answer("the answer");

        TaskReport report = manager.run("question");

        assertTrue(report.succeeded());
        assertEquals("the answer", report.response());
        assertEquals(1, report.dispatches());
        assertNotNull(report.curation());
        assertEquals(SessionStatus.CLOSED, manager.session(report.taskId()).orElseThrow().status());
        assertEquals(1.0, registry.find("lorekeeper.sessions.total").tag("status", "completed").counter().count());
        verify(storage).archiveTaskMemory(report.taskId());
    }
}
