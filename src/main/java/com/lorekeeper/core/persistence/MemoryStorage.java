package com.lorekeeper.core.persistence;

import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.BufferStatus;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeResolution;
import com.lorekeeper.core.model.TaskMemory;
import com.lorekeeper.core.model.TaskMemoryEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable keyed storage behind the memory layers.
 * <p>
 * Appends are atomic per record. Status changes and Canon installs are compare-and-set:
 * they return {@code false} instead of overwriting when the stored state is not the one
 * the caller expected. Implementations throw
 * {@link com.lorekeeper.core.error.StorageFailureException} on I/O errors.
 */
public interface MemoryStorage {

    // -- Canon -------------------------------------------------------------

    Optional<CanonEntry> currentCanon(String key);

    /** Latest version of every key. */
    Map<String, CanonEntry> currentCanon();

    /** Every version of a key in ascending order. */
    List<CanonEntry> canonHistory(String key);

    /**
     * Installs {@code entry} only if its version is exactly one above the key's current
     * version (or 1 when absent).
     *
     * @return false when another writer already installed that version
     */
    boolean installCanon(CanonEntry entry);

    // -- Buffer ------------------------------------------------------------

    void appendBuffer(BufferEntry entry);

    /** All entries in append order. */
    List<BufferEntry> buffer();

    Optional<BufferEntry> bufferEntry(String id);

    boolean updateBufferStatus(String id, BufferStatus expected, BufferStatus next);

    // -- Disputes ----------------------------------------------------------

    void appendDispute(DisputeRecord record);

    List<DisputeRecord> disputes();

    Optional<DisputeRecord> dispute(String id);

    /** Moves an OPEN dispute to RESOLVED; false if it was not open. */
    boolean resolveDispute(String id, DisputeResolution resolution);

    // -- Task memory -------------------------------------------------------

    /** @return false if a task memory with this id already exists */
    boolean createTaskMemory(String taskId, String prompt, Instant createdAt);

    /** @return false if the task memory is missing or archived */
    boolean appendTaskMemory(String taskId, TaskMemoryEntry entry);

    /** @return false if the task memory is missing or already archived */
    boolean archiveTaskMemory(String taskId);

    Optional<TaskMemory> taskMemory(String taskId);

    List<String> taskIds();

    /** Short human-readable description for health output. */
    String describe();
}
