package com.lorekeeper.core.model;

import java.time.Instant;

/**
 * A private note owned by exactly one (agentId, taskId) pair.
 */
public record ScratchNote(String agentId, String taskId, String content, Instant timestamp) {}
