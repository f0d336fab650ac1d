package com.lorekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a task's shared memory. Archived snapshots never change again.
 */
public record TaskMemory(
    String taskId,
    String prompt,
    Instant createdAt,
    List<TaskMemoryEntry> entries,
    boolean archived
) implements Serializable {

    public TaskMemory {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
