package com.lorekeeper.core.memory;

import com.lorekeeper.core.model.ScratchNote;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Private per-(agent, task) notes. Ownership is checked by {@link MemoryLayers} before
 * any call reaches this class, so no cross-agent coordination happens here.
 */
class ScratchPad {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ScratchNote>> notes = new ConcurrentHashMap<>();

    void add(ScratchNote note) {
        notes.computeIfAbsent(ownerKey(note.agentId(), note.taskId()), k -> new CopyOnWriteArrayList<>()).add(note);
    }

    List<ScratchNote> read(String agentId, String taskId) {
        var owned = notes.get(ownerKey(agentId, taskId));
        return owned == null ? List.of() : List.copyOf(owned);
    }

    int discard(String agentId, String taskId) {
        var removed = notes.remove(ownerKey(agentId, taskId));
        return removed == null ? 0 : removed.size();
    }

    private static String ownerKey(String agentId, String taskId) {
        return agentId + "@" + taskId;
    }
}
