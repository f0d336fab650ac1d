package com.lorekeeper.core.memory;

import com.lorekeeper.core.access.CanonScope;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.BufferStatus;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.ScratchNote;
import com.lorekeeper.core.model.TaskMemory;
import com.lorekeeper.core.model.TaskMemoryEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the memory context an agent sees before it starts working.
 * <p>
 * Sections appear in a fixed order: task memory, the agent's Canon slice, pending buffer
 * claims (labelled TENTATIVE) and finally the agent's own scratch notes. Empty sections are
 * omitted; an agent with nothing to see gets an empty string.
 */
@Component
public class MemoryContextBuilder {

    private final MemoryLayers layers;
    private final MemoryProperties properties;

    public MemoryContextBuilder(MemoryLayers layers, MemoryProperties properties) {
        this.layers = layers;
        this.properties = properties;
    }

    public String build(AgentHandle agent, CanonScope scope) {
        List<String> sections = new ArrayList<>();
        int chars = properties.getContextValueChars();

        TaskMemory task = layers.hasTaskMemory(agent.taskId())
                ? layers.readTaskMemory(agent.taskId(), agent) : null;
        if (task != null && !task.entries().isEmpty()) {
            var sb = new StringBuilder("-- TASK MEMORY (mission artifacts) --");
            for (TaskMemoryEntry entry : task.entries()) {
                sb.append("\n  [").append(entry.key()).append("|").append(entry.agentId()).append("] ")
                  .append(MemoryLayers.abbreviate(entry.content(), chars));
            }
            sections.add(sb.toString());
        }

        Map<String, CanonEntry> canon = layers.readCanonScope(agent, scope);
        if (!canon.isEmpty()) {
            var sb = new StringBuilder("-- CANON (verified, trust fully) --");
            canon.values().stream().limit(properties.getContextCanonLimit()).forEach(entry ->
                sb.append("\n  [").append(entry.key()).append(" v").append(entry.version()).append("] ")
                  .append(MemoryLayers.abbreviate(entry.value(), chars)));
            sections.add(sb.toString());
        }

        List<BufferEntry> pending = layers.readBuffer(agent.taskId(), BufferStatus.PENDING, agent).entries();
        if (!pending.isEmpty()) {
            var sb = new StringBuilder("-- BUFFER (" + TentativeBuffer.LABEL + ", unverified, do not treat as truth) --");
            int from = Math.max(0, pending.size() - properties.getContextBufferLimit());
            for (BufferEntry entry : pending.subList(from, pending.size())) {
                sb.append("\n  [tentative|").append(entry.agentId())
                  .append("|conf:").append(String.format(Locale.ROOT, "%.1f", entry.confidence())).append("] ")
                  .append(entry.canonKey()).append(": ")
                  .append(MemoryLayers.abbreviate(entry.claim(), chars));
            }
            sections.add(sb.toString());
        }

        if (agent.role() != AgentRole.CURATOR) {
            List<ScratchNote> notes = layers.readScratch(agent, agent.id(), agent.taskId());
            if (!notes.isEmpty()) {
                var sb = new StringBuilder("-- SCRATCH (your own notes) --");
                int from = Math.max(0, notes.size() - properties.getContextScratchLimit());
                for (ScratchNote note : notes.subList(from, notes.size())) {
                    sb.append("\n  - ").append(MemoryLayers.abbreviate(note.content(), chars));
                }
                sections.add(sb.toString());
            }
        }

        if (sections.isEmpty()) {
            return "";
        }
        return "[Memory context for task " + agent.taskId() + " | agent: " + agent.id() + "]\n"
                + String.join("\n\n", sections);
    }
}
