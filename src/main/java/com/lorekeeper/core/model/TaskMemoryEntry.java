package com.lorekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry in a task's shared narrative.
 *
 * @param agentId   writer
 * @param key       optional artifact label ("research_summary", "output:code")
 * @param content   entry text
 * @param timestamp append time
 */
public record TaskMemoryEntry(String agentId, String key, String content, Instant timestamp)
        implements Serializable {}
