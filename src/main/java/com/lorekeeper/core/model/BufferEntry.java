package com.lorekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * An unverified claim awaiting curation. Everything except {@code status} is fixed at append time.
 *
 * @param id         unique entry id
 * @param taskId     task the claim was made in
 * @param agentId    agent that asserted the claim
 * @param role       role of that agent
 * @param canonKey   canon key the claim is about
 * @param claim      the claimed value
 * @param source     provenance label ("web_search", "reasoning", ...)
 * @param confidence asserted confidence in [0,1]
 * @param timestamp  append time
 * @param status     current curation status
 */
public record BufferEntry(
    String id,
    String taskId,
    String agentId,
    AgentRole role,
    String canonKey,
    String claim,
    String source,
    double confidence,
    Instant timestamp,
    BufferStatus status
) implements Serializable {

    /**
     * Creates a new PENDING entry with a fresh id and the current time.
     */
    public static BufferEntry pending(String taskId, AgentHandle author, String canonKey, String claim,
                                      String source, double confidence) {
        return new BufferEntry(UUID.randomUUID().toString().substring(0, 8), taskId, author.id(), author.role(),
                canonKey, claim, source == null || source.isBlank() ? author.role().label() : source,
                Math.max(0.0, Math.min(1.0, confidence)), Instant.now(), BufferStatus.PENDING);
    }

    public BufferEntry withStatus(BufferStatus next) {
        return new BufferEntry(id, taskId, agentId, role, canonKey, claim, source, confidence, timestamp, next);
    }
}
