package com.lorekeeper.core.persistence;

import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.BufferStatus;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeResolution;
import com.lorekeeper.core.model.DisputeStatus;
import com.lorekeeper.core.model.TaskMemory;
import com.lorekeeper.core.model.TaskMemoryEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local {@link MemoryStorage}. State is lost on restart.
 * <p>
 * Buffer and dispute appends go through lock-free queues; Canon installs and task-memory
 * appends use {@link ConcurrentHashMap#compute} so the check and the write are atomic per key.
 */
public class InMemoryMemoryStorage implements MemoryStorage {

    private final ConcurrentHashMap<String, List<CanonEntry>> canon = new ConcurrentHashMap<>();

    private final ConcurrentLinkedQueue<String> bufferOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<String, BufferEntry> bufferEntries = new ConcurrentHashMap<>();

    private final ConcurrentLinkedQueue<String> disputeOrder = new ConcurrentLinkedQueue<>();
    private final ConcurrentHashMap<String, DisputeRecord> disputeRecords = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, TaskMemory> tasks = new ConcurrentHashMap<>();

    @Override
    public Optional<CanonEntry> currentCanon(String key) {
        List<CanonEntry> versions = canon.get(key);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public Map<String, CanonEntry> currentCanon() {
        var latest = new TreeMap<String, CanonEntry>();
        canon.forEach((key, versions) -> {
            if (!versions.isEmpty()) {
                latest.put(key, versions.get(versions.size() - 1));
            }
        });
        return latest;
    }

    @Override
    public List<CanonEntry> canonHistory(String key) {
        List<CanonEntry> versions = canon.get(key);
        return versions == null ? List.of() : versions;
    }

    @Override
    public boolean installCanon(CanonEntry entry) {
        var installed = new AtomicBoolean(false);
        canon.compute(entry.key(), (key, versions) -> {
            long current = versions == null || versions.isEmpty() ? 0 : versions.get(versions.size() - 1).version();
            if (entry.version() != current + 1) {
                return versions;
            }
            var next = versions == null ? new ArrayList<CanonEntry>() : new ArrayList<>(versions);
            next.add(entry);
            installed.set(true);
            return List.copyOf(next);
        });
        return installed.get();
    }

    @Override
    public void appendBuffer(BufferEntry entry) {
        if (bufferEntries.putIfAbsent(entry.id(), entry) == null) {
            bufferOrder.add(entry.id());
        }
    }

    @Override
    public List<BufferEntry> buffer() {
        var result = new ArrayList<BufferEntry>();
        for (String id : bufferOrder) {
            result.add(bufferEntries.get(id));
        }
        return result;
    }

    @Override
    public Optional<BufferEntry> bufferEntry(String id) {
        return Optional.ofNullable(bufferEntries.get(id));
    }

    @Override
    public boolean updateBufferStatus(String id, BufferStatus expected, BufferStatus next) {
        BufferEntry current = bufferEntries.get(id);
        if (current == null || current.status() != expected) {
            return false;
        }
        return bufferEntries.replace(id, current, current.withStatus(next));
    }

    @Override
    public void appendDispute(DisputeRecord record) {
        if (disputeRecords.putIfAbsent(record.id(), record) == null) {
            disputeOrder.add(record.id());
        }
    }

    @Override
    public List<DisputeRecord> disputes() {
        var result = new ArrayList<DisputeRecord>();
        for (String id : disputeOrder) {
            result.add(disputeRecords.get(id));
        }
        return result;
    }

    @Override
    public Optional<DisputeRecord> dispute(String id) {
        return Optional.ofNullable(disputeRecords.get(id));
    }

    @Override
    public boolean resolveDispute(String id, DisputeResolution resolution) {
        DisputeRecord current = disputeRecords.get(id);
        if (current == null || current.status() != DisputeStatus.OPEN) {
            return false;
        }
        return disputeRecords.replace(id, current, current.resolve(resolution));
    }

    @Override
    public boolean createTaskMemory(String taskId, String prompt, Instant createdAt) {
        return tasks.putIfAbsent(taskId, new TaskMemory(taskId, prompt, createdAt, List.of(), false)) == null;
    }

    @Override
    public boolean appendTaskMemory(String taskId, TaskMemoryEntry entry) {
        var appended = new AtomicBoolean(false);
        tasks.computeIfPresent(taskId, (id, memory) -> {
            if (memory.archived()) {
                return memory;
            }
            var entries = new ArrayList<>(memory.entries());
            entries.add(entry);
            appended.set(true);
            return new TaskMemory(id, memory.prompt(), memory.createdAt(), entries, false);
        });
        return appended.get();
    }

    @Override
    public boolean archiveTaskMemory(String taskId) {
        var archived = new AtomicBoolean(false);
        tasks.computeIfPresent(taskId, (id, memory) -> {
            if (memory.archived()) {
                return memory;
            }
            archived.set(true);
            return new TaskMemory(id, memory.prompt(), memory.createdAt(), memory.entries(), true);
        });
        return archived.get();
    }

    @Override
    public Optional<TaskMemory> taskMemory(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<String> taskIds() {
        return new ArrayList<>(tasks.keySet());
    }

    @Override
    public String describe() {
        return "in-memory (" + canon.size() + " canon keys, " + bufferEntries.size() + " buffer entries)";
    }
}
