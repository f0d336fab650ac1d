package com.lorekeeper.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("LoreEvent")
    class LoreEventTests {

        @Test
        @DisplayName("of() stamps the current time")
        void ofStampsTime() {
            var event = LoreEvent.of("canon.installed", "task-1", "orchestrator-1", Map.of("key", "facts/x"));

            assertEquals("canon.installed", event.eventType());
            assertEquals("task-1", event.taskId());
            assertEquals("orchestrator-1", event.agentId());
            assertEquals("facts/x", event.payload().get("key"));
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("unknown event types are rejected")
        void unknownTypeRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> LoreEvent.of("canon.deleted", "task-1", null, Map.of()));
        }
    }

    @Nested
    @DisplayName("Task subscriptions")
    class TaskSubscriptionTests {

        @Test
        @DisplayName("delivers only events of the subscribed task")
        void deliversOnlyMatchingTask() {
            List<LoreEvent> received = new ArrayList<>();
            eventBus.subscribe("task-1", received::add);

            eventBus.publish(LoreEvent.of("session.opened", "task-1", null, Map.of()));
            eventBus.publish(LoreEvent.of("session.opened", "task-2", null, Map.of()));

            assertEquals(1, received.size());
            assertEquals("task-1", received.get(0).taskId());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribeStopsDelivery() {
            List<LoreEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("task-1", received::add);

            eventBus.publish(LoreEvent.of("dispatch.requested", "task-1", "a", Map.of()));
            subscription.unsubscribe();
            eventBus.publish(LoreEvent.of("dispatch.completed", "task-1", "a", Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("listeners of a task are dropped after its session.closed event")
        void droppedWhenTaskCloses() {
            List<LoreEvent> received = new ArrayList<>();
            eventBus.subscribe("task-1", received::add);
            eventBus.subscribe("task-2", received::add);
            eventBus.subscribeAll(e -> { });

            eventBus.publish(LoreEvent.of(LoreEvent.SESSION_CLOSED, "task-1", null, Map.of()));
            eventBus.publish(LoreEvent.of(LoreEvent.BUFFER_APPENDED, "task-1", "late", Map.of()));

            assertEquals(List.of(LoreEvent.SESSION_CLOSED), received.stream().map(LoreEvent::eventType).toList());
            assertEquals(2, eventBus.listenerCount());
        }
    }

    @Nested
    @DisplayName("Type subscriptions")
    class TypeSubscriptionTests {

        @Test
        @DisplayName("deliver only the requested types, across tasks")
        void filtersByType() {
            List<LoreEvent> received = new ArrayList<>();
            eventBus.subscribeTo(Set.of(LoreEvent.DISPUTE_OPENED, LoreEvent.CANON_INSTALLED), received::add);

            eventBus.publish(LoreEvent.of(LoreEvent.DISPUTE_OPENED, "task-1", "curator", Map.of()));
            eventBus.publish(LoreEvent.of(LoreEvent.BUFFER_APPENDED, "task-1", "r", Map.of()));
            eventBus.publish(LoreEvent.of(LoreEvent.CANON_INSTALLED, "task-2", "curator", Map.of()));

            assertEquals(List.of("task-1", "task-2"), received.stream().map(LoreEvent::taskId).toList());
        }

        @Test
        @DisplayName("unknown types cannot be subscribed to")
        void unknownTypeRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> eventBus.subscribeTo(Set.of("mission.started"), e -> { }));
        }
    }

    @Nested
    @DisplayName("Global subscriptions")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("receive events from every task, including task-less ones")
        void receivesEverything() {
            List<LoreEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(LoreEvent.of("session.opened", "task-1", null, Map.of()));
            eventBus.publish(LoreEvent.of("session.opened", "task-2", null, Map.of()));
            eventBus.publish(LoreEvent.of("canon.installed", null, "system_init", Map.of()));

            assertEquals(3, received.size());
        }

        @Test
        @DisplayName("a throwing subscriber does not stop the others")
        void throwingSubscriberIsIsolated() {
            List<LoreEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(LoreEvent.of("buffer.appended", "task-1", "r", Map.of())));
            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("concurrent publishers all get delivered")
    void concurrentPublish() throws Exception {
        List<LoreEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe("task-1", received::add);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        var done = new CountDownLatch(100);
        try {
            for (int i = 0; i < 100; i++) {
                pool.submit(() -> {
                    eventBus.publish(LoreEvent.of("buffer.appended", "task-1", "r", Map.of()));
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(100, received.size());
    }
}
