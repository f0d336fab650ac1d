package com.lorekeeper.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process delivery of {@link LoreEvent}s to watchers such as {@code ask --watch}.
 * <p>
 * Listeners run on the publishing thread, which for dispatch events is a dispatch-pool worker.
 * A listener that throws is logged and skipped. Listeners bound to one task are dropped once
 * that task's {@code session.closed} event has been delivered.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(LoreEvent event) {
        log.trace("{} task={} agent={}", event.eventType(), event.taskId(), event.agentId());
        for (Listener listener : listeners) {
            if (listener.wants(event)) {
                deliver(listener, event);
            }
        }
        if (LoreEvent.SESSION_CLOSED.equals(event.eventType()) && event.taskId() != null) {
            if (listeners.removeIf(l -> event.taskId().equals(l.taskId))) {
                log.debug("Dropped listeners of closed task {}", event.taskId());
            }
        }
    }

    /**
     * Listens to one task until it closes.
     */
    public Subscription subscribe(String taskId, Consumer<LoreEvent> consumer) {
        return add(new Listener(Objects.requireNonNull(taskId, "taskId"), Set.of(), consumer));
    }

    /**
     * Listens to every event of every task.
     */
    public Subscription subscribeAll(Consumer<LoreEvent> consumer) {
        return add(new Listener(null, Set.of(), consumer));
    }

    /**
     * Listens to the given event types across all tasks.
     *
     * @throws IllegalArgumentException for a type not in {@link LoreEvent#TYPES}
     */
    public Subscription subscribeTo(Set<String> eventTypes, Consumer<LoreEvent> consumer) {
        for (String type : eventTypes) {
            if (!LoreEvent.TYPES.contains(type)) {
                throw new IllegalArgumentException("Unknown event type: " + type);
            }
        }
        return add(new Listener(null, Set.copyOf(eventTypes), consumer));
    }

    int listenerCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription add(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void deliver(Listener listener, LoreEvent event) {
        try {
            listener.consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
        }
    }

    // identity equality, so unsubscribing removes exactly this registration
    private static final class Listener {
        final String taskId;
        final Set<String> types;
        final Consumer<LoreEvent> consumer;

        Listener(String taskId, Set<String> types, Consumer<LoreEvent> consumer) {
            this.taskId = taskId;
            this.types = types;
            this.consumer = Objects.requireNonNull(consumer, "consumer");
        }

        boolean wants(LoreEvent event) {
            return (taskId == null || taskId.equals(event.taskId()))
                    && (types.isEmpty() || types.contains(event.eventType()));
        }
    }
}
