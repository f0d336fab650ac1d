package com.lorekeeper.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Something that happened to a task's memory or dispatch tree, as seen by watchers.
 *
 * @param eventType one of the type constants below
 * @param taskId    owning task; {@code null} for task-less events such as the Canon seed
 * @param agentId   acting agent, or {@code null}
 * @param payload   event-specific values
 * @param timestamp when the event occurred
 */
public record LoreEvent(
    String eventType,
    String taskId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String SESSION_OPENED = "session.opened";
    public static final String SESSION_CLOSED = "session.closed";
    public static final String DISPATCH_REQUESTED = "dispatch.requested";
    public static final String DISPATCH_COMPLETED = "dispatch.completed";
    public static final String DISPATCH_FAILED = "dispatch.failed";
    public static final String DISPATCH_DECLINED = "dispatch.declined";
    public static final String BUFFER_APPENDED = "buffer.appended";
    public static final String CANON_INSTALLED = "canon.installed";
    public static final String DISPUTE_OPENED = "dispute.opened";
    public static final String DISPUTE_RESOLVED = "dispute.resolved";
    public static final String CURATION_COMPLETED = "curation.completed";

    public static final Set<String> TYPES = Set.of(
            SESSION_OPENED, SESSION_CLOSED,
            DISPATCH_REQUESTED, DISPATCH_COMPLETED, DISPATCH_FAILED, DISPATCH_DECLINED,
            BUFFER_APPENDED, CANON_INSTALLED,
            DISPUTE_OPENED, DISPUTE_RESOLVED,
            CURATION_COMPLETED);

    public LoreEvent {
        if (!TYPES.contains(eventType)) {
            throw new IllegalArgumentException("Unknown event type: " + eventType);
        }
        payload = payload == null ? Map.of() : payload;
    }

    public static LoreEvent of(String eventType, String taskId, String agentId, Map<String, Object> payload) {
        return new LoreEvent(eventType, taskId, agentId, payload, Instant.now());
    }
}
