package com.lorekeeper.core.memory;

import com.lorekeeper.core.access.AccessArbiter;
import com.lorekeeper.core.access.CanonScope;
import com.lorekeeper.core.access.Layer;
import com.lorekeeper.core.access.Operation;
import com.lorekeeper.core.error.CanonVersionConflictException;
import com.lorekeeper.core.error.IllegalStatusTransitionException;
import com.lorekeeper.core.error.PermissionDeniedException;
import com.lorekeeper.core.error.SessionClosedException;
import com.lorekeeper.core.error.UnknownTaskException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.events.LoreEvent;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.BufferStatus;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeResolution;
import com.lorekeeper.core.model.DisputeStatus;
import com.lorekeeper.core.model.ScratchNote;
import com.lorekeeper.core.model.TaskMemory;
import com.lorekeeper.core.model.TaskMemoryEntry;
import com.lorekeeper.core.persistence.MemoryStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point to the five memory layers: Canon, Buffer, Scratch, Task Memory and Disputes.
 * <p>
 * Every operation asks the {@link AccessArbiter} first. Canon installs run inside an exclusive
 * per-key section covering the read-check-write version bump; task-memory appends, buffer
 * appends and archiving are serialized per task. Both sections use a fixed set of lock stripes.
 * Dispute appends take no lock.
 */
@Service
public class MemoryLayers {

    private static final Logger log = LoggerFactory.getLogger(MemoryLayers.class);
    private static final int UNCONDITIONAL_INSTALL_ATTEMPTS = 3;
    private static final int LOCK_STRIPES = 64;

    private final MemoryStorage storage;
    private final AccessArbiter arbiter;
    private final EventBus eventBus;
    private final ScratchPad scratch = new ScratchPad();

    private final ReentrantLock[] canonLocks = stripes();
    private final ReentrantLock[] taskLocks = stripes();

    public MemoryLayers(MemoryStorage storage, AccessArbiter arbiter, EventBus eventBus) {
        this.storage = storage;
        this.arbiter = arbiter;
        this.eventBus = eventBus;
    }

    private static ReentrantLock[] stripes() {
        var locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    private static ReentrantLock stripe(ReentrantLock[] locks, String key) {
        return locks[Math.floorMod(key.hashCode(), locks.length)];
    }

    // ── Canon ─────────────────────────────────────────────────────────────

    /**
     * Returns the current version of each requested key that the scope allows.
     * Missing or out-of-scope keys are simply absent from the result.
     */
    public Map<String, CanonEntry> readCanonSlice(Set<String> keys, AgentHandle caller, CanonScope scope) {
        arbiter.check(Operation.READ, Layer.CANON, caller.role());
        var slice = new LinkedHashMap<String, CanonEntry>();
        for (String key : keys) {
            if (!scope.permits(key)) {
                continue;
            }
            storage.currentCanon(key).ifPresent(entry -> slice.put(key, entry));
        }
        return slice;
    }

    /**
     * Returns the current version of every key visible through the scope.
     */
    public Map<String, CanonEntry> readCanonScope(AgentHandle caller, CanonScope scope) {
        arbiter.check(Operation.READ, Layer.CANON, caller.role());
        var slice = new LinkedHashMap<String, CanonEntry>();
        storage.currentCanon().forEach((key, entry) -> {
            if (scope.permits(key)) {
                slice.put(key, entry);
            }
        });
        return slice;
    }

    public List<CanonEntry> canonHistory(String key, AgentHandle caller) {
        arbiter.check(Operation.READ, Layer.CANON, caller.role());
        return storage.canonHistory(key);
    }

    /**
     * Installs a new Canon version for {@code write.key()}.
     * <p>
     * A conditional write (expected version present) fails with
     * {@link CanonVersionConflictException} when the key has moved on; the caller must
     * re-read and re-check before retrying. An unconditional write supersedes the current version.
     *
     * @return the installed entry
     * @throws PermissionDeniedException unless the caller is ORCHESTRATOR or CURATOR
     */
    public CanonEntry writeCanon(CanonWrite write, AgentHandle caller) {
        arbiter.check(Operation.WRITE, Layer.CANON, caller.role());
        ReentrantLock lock = stripe(canonLocks, write.key());
        lock.lock();
        try {
            int attempts = write.isConditional() ? 1 : UNCONDITIONAL_INSTALL_ATTEMPTS;
            long observed = 0;
            for (int attempt = 1; attempt <= attempts; attempt++) {
                observed = storage.currentCanon(write.key()).map(CanonEntry::version).orElse(0L);
                if (write.isConditional() && write.expectedVersion() != observed) {
                    throw new CanonVersionConflictException(write.key(), write.expectedVersion(), observed);
                }
                var entry = new CanonEntry(write.key(), write.value(), write.confidence(), caller.id(),
                        observed + 1, Instant.now(), write.sourceEntryIds());
                if (storage.installCanon(entry)) {
                    log.info("Canon '{}' -> v{} by {} ({})", entry.key(), entry.version(), caller.id(), caller.role());
                    eventBus.publish(LoreEvent.of(LoreEvent.CANON_INSTALLED, caller.taskId(), caller.id(),
                            Map.of("key", entry.key(), "version", entry.version())));
                    return entry;
                }
                // another process installed this version between our read and write
                log.debug("Canon install for '{}' v{} lost a race (attempt {})", write.key(), observed + 1, attempt);
            }
            long actual = storage.currentCanon(write.key()).map(CanonEntry::version).orElse(0L);
            throw new CanonVersionConflictException(write.key(), observed, actual);
        } finally {
            lock.unlock();
        }
    }

    // ── Buffer ────────────────────────────────────────────────────────────

    /**
     * Appends a claim. Never rejected for its content, only for its task's state.
     *
     * @throws UnknownTaskException   when the task has no task memory
     * @throws SessionClosedException when the task memory is archived; the curator has already run
     */
    public BufferEntry appendBuffer(BufferEntry entry) {
        arbiter.check(Operation.WRITE, Layer.BUFFER, entry.role());
        if (entry.status() != BufferStatus.PENDING) {
            throw new IllegalStatusTransitionException("Buffer entries are appended as PENDING, got " + entry.status());
        }
        ReentrantLock lock = stripe(taskLocks, entry.taskId());
        lock.lock();
        try {
            requireOpenTask(entry.taskId());
            storage.appendBuffer(entry);
        } finally {
            lock.unlock();
        }
        log.debug("Buffer +{} [{}] {}: {}", entry.id(), entry.canonKey(), entry.agentId(), abbreviate(entry.claim(), 60));
        eventBus.publish(LoreEvent.of(LoreEvent.BUFFER_APPENDED, entry.taskId(), entry.agentId(),
                Map.of("entryId", entry.id(), "key", entry.canonKey(), "confidence", entry.confidence())));
        return entry;
    }

    /**
     * Reads buffer entries in append order.
     *
     * @param taskId filter by task, or {@code null} for all tasks
     * @param status filter by status, or {@code null} for all statuses
     */
    public TentativeBuffer readBuffer(String taskId, BufferStatus status, AgentHandle caller) {
        arbiter.check(Operation.READ, Layer.BUFFER, caller.role());
        return new TentativeBuffer(storage.buffer().stream()
                .filter(e -> taskId == null || taskId.equals(e.taskId()))
                .filter(e -> status == null || status == e.status())
                .toList());
    }

    /**
     * Moves a PENDING entry to a terminal status. Any other transition fails.
     */
    public BufferEntry transitionBuffer(String entryId, BufferStatus next, AgentHandle caller) {
        arbiter.check(Operation.UPDATE, Layer.BUFFER, caller.role());
        BufferEntry current = storage.bufferEntry(entryId)
                .orElseThrow(() -> new IllegalStatusTransitionException("Unknown buffer entry " + entryId));
        if (!current.status().canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(
                    "Buffer entry " + entryId + " cannot move from " + current.status() + " to " + next);
        }
        if (!storage.updateBufferStatus(entryId, BufferStatus.PENDING, next)) {
            throw new IllegalStatusTransitionException(
                    "Buffer entry " + entryId + " was transitioned concurrently");
        }
        return current.withStatus(next);
    }

    // ── Scratch ───────────────────────────────────────────────────────────

    public ScratchNote writeScratch(AgentHandle caller, String content) {
        arbiter.check(Operation.WRITE, Layer.SCRATCH, caller.role());
        var note = new ScratchNote(caller.id(), caller.taskId(), content, Instant.now());
        scratch.add(note);
        return note;
    }

    /**
     * @throws PermissionDeniedException when the caller does not own the (agentId, taskId) pair
     */
    public List<ScratchNote> readScratch(AgentHandle caller, String agentId, String taskId) {
        arbiter.check(Operation.READ, Layer.SCRATCH, caller.role());
        if (!caller.id().equals(agentId) || !caller.taskId().equals(taskId)) {
            throw new PermissionDeniedException(caller.id() + " may not read scratch of " + agentId + "@" + taskId);
        }
        return scratch.read(agentId, taskId);
    }

    /**
     * Drops an agent's scratch at the end of its participation in a task.
     */
    public void discardScratch(AgentHandle owner) {
        int removed = scratch.discard(owner.id(), owner.taskId());
        if (removed > 0) {
            log.debug("Discarded {} scratch note(s) of {}", removed, owner.id());
        }
    }

    // ── Task memory ───────────────────────────────────────────────────────

    /**
     * Creates the task memory for a newly opened session, seeded with the prompt.
     *
     * @return false if a task memory with this id already exists
     */
    public boolean openTaskMemory(String taskId, String prompt) {
        boolean created = storage.createTaskMemory(taskId, prompt, Instant.now());
        if (created) {
            log.info("Initialised task memory {}", taskId);
        }
        return created;
    }

    public TaskMemoryEntry appendTaskMemory(String taskId, AgentHandle caller, String key, String content) {
        arbiter.check(Operation.WRITE, Layer.TASK_MEMORY, caller.role());
        requireParticipant(taskId, caller);
        ReentrantLock lock = stripe(taskLocks, taskId);
        lock.lock();
        try {
            requireOpenTask(taskId);
            var entry = new TaskMemoryEntry(caller.id(), key, content, Instant.now());
            if (!storage.appendTaskMemory(taskId, entry)) {
                throw new SessionClosedException(taskId);
            }
            log.debug("Task memory {}[{}] saved by {}", taskId, key, caller.id());
            return entry;
        } finally {
            lock.unlock();
        }
    }

    public TaskMemory readTaskMemory(String taskId, AgentHandle caller) {
        arbiter.check(Operation.READ, Layer.TASK_MEMORY, caller.role());
        requireParticipant(taskId, caller);
        return storage.taskMemory(taskId).orElseThrow(() -> new UnknownTaskException(taskId));
    }

    /**
     * Marks a task memory read-only. Task-memory and buffer appends wait for the task lock,
     * so none can slip in after.
     */
    public void archiveTaskMemory(String taskId) {
        ReentrantLock lock = stripe(taskLocks, taskId);
        lock.lock();
        try {
            if (storage.taskMemory(taskId).isEmpty()) {
                throw new UnknownTaskException(taskId);
            }
            if (storage.archiveTaskMemory(taskId)) {
                log.info("Archived task memory {}", taskId);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean hasTaskMemory(String taskId) {
        return storage.taskMemory(taskId).isPresent();
    }

    public List<String> taskIds() {
        return storage.taskIds();
    }

    // ── Disputes ──────────────────────────────────────────────────────────

    public DisputeRecord openDispute(DisputeRecord record, AgentHandle caller) {
        arbiter.check(Operation.WRITE, Layer.DISPUTE, caller.role());
        storage.appendDispute(record);
        log.info("Dispute {}: buffer {} vs canon '{}' v{}", record.id(), record.bufferEntryId(),
                record.canonKey(), record.existingCanonVersion());
        eventBus.publish(LoreEvent.of(LoreEvent.DISPUTE_OPENED, record.taskId(), caller.id(),
                Map.of("disputeId", record.id(), "key", record.canonKey(),
                       "canonVersion", record.existingCanonVersion())));
        return record;
    }

    /**
     * @param status filter, or {@code null} for all disputes
     */
    public List<DisputeRecord> readDisputes(DisputeStatus status, AgentHandle caller) {
        arbiter.check(Operation.READ, Layer.DISPUTE, caller.role());
        return storage.disputes().stream()
                .filter(d -> status == null || d.status() == status)
                .toList();
    }

    public Optional<DisputeRecord> dispute(String disputeId, AgentHandle caller) {
        arbiter.check(Operation.READ, Layer.DISPUTE, caller.role());
        return storage.dispute(disputeId);
    }

    public DisputeRecord markDisputeResolved(String disputeId, DisputeResolution resolution, AgentHandle caller) {
        arbiter.check(Operation.UPDATE, Layer.DISPUTE, caller.role());
        if (!storage.resolveDispute(disputeId, resolution)) {
            throw new IllegalStatusTransitionException("Dispute " + disputeId + " is not open");
        }
        DisputeRecord resolved = storage.dispute(disputeId)
                .orElseThrow(() -> new IllegalStatusTransitionException("Unknown dispute " + disputeId));
        eventBus.publish(LoreEvent.of(LoreEvent.DISPUTE_RESOLVED, resolved.taskId(), caller.id(),
                Map.of("disputeId", disputeId, "outcome", resolution.outcome().name())));
        return resolved;
    }

    // ── Summary ───────────────────────────────────────────────────────────

    public String summary() {
        int canonCount = storage.currentCanon().size();
        var buffer = storage.buffer();
        long live = buffer.stream().filter(e -> e.status() == BufferStatus.PENDING).count();
        long openDisputes = storage.disputes().stream().filter(d -> d.status() == DisputeStatus.OPEN).count();
        return "Canon:" + canonCount + " entries | Buffer:" + live + " live / " + buffer.size() + " total | "
                + "Tasks:" + storage.taskIds().size() + " | Disputes:" + openDisputes + " open";
    }

    public String storageDescription() {
        return storage.describe();
    }

    private void requireOpenTask(String taskId) {
        TaskMemory memory = storage.taskMemory(taskId).orElseThrow(() -> new UnknownTaskException(taskId));
        if (memory.archived()) {
            throw new SessionClosedException(taskId);
        }
    }

    private static void requireParticipant(String taskId, AgentHandle caller) {
        if (!taskId.equals(caller.taskId())) {
            throw new PermissionDeniedException(caller.id() + " is not a participant of task " + taskId);
        }
    }

    static String abbreviate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
