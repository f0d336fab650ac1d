package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.error.InferenceFailureException;
import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.model.ScratchNote;
import com.lorekeeper.core.model.TaskMemory;
import com.lorekeeper.core.model.TaskMemoryEntry;
import com.lorekeeper.core.search.SearchProperties;
import com.lorekeeper.core.search.SearchResult;
import com.lorekeeper.core.search.WebSearchClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs memory and search tools inline on the requesting agent's thread.
 * <p>
 * Failures are reported back to the agent as the tool result so the model can adjust;
 * they never end the dispatch.
 */
@Component
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    private final MemoryLayers layers;
    private final WebSearchClient search;
    private final SearchProperties searchProperties;

    public ToolExecutor(MemoryLayers layers, WebSearchClient search, SearchProperties searchProperties) {
        this.layers = layers;
        this.search = search;
        this.searchProperties = searchProperties;
    }

    /**
     * Runs the tool for a dispatch recorded in {@code tree}. Memory writes are refused once the
     * dispatch has been abandoned by a timed-out parent.
     */
    public String execute(AgentHandle agent, AgentTool tool, ToolRequest request, DispatchTree tree) {
        if (!tool.writesMemory()) {
            return execute(agent, tool, request);
        }
        return tree.whileLive(agent.id(), () -> execute(agent, tool, request))
                .orElseGet(() -> {
                    log.info("Refused {} for abandoned dispatch {}", tool.toolName(), agent.id());
                    return "Dispatch " + agent.id() + " was abandoned; " + tool.toolName() + " was not run.";
                });
    }

    public String execute(AgentHandle agent, AgentTool tool, ToolRequest request) {
        if (!tool.availableTo(agent.role())) {
            return "Tool " + tool.toolName() + " is not available to the " + agent.role().label() + " role.";
        }
        try {
            return switch (tool) {
                case WRITE_TO_BUFFER -> writeBuffer(agent, request);
                case WRITE_TO_SCRATCH -> writeScratch(agent, request);
                case READ_SCRATCH -> readScratch(agent);
                case WRITE_TO_TASK_MEMORY -> writeTaskMemory(agent, request);
                case READ_TASK_MEMORY -> readTaskMemory(agent);
                case WRITE_TO_CANON -> writeCanon(agent, request);
                case WEB_SEARCH -> webSearch(request);
                default -> throw new IllegalArgumentException(tool.toolName() + " is not an inline tool");
            };
        } catch (InferenceFailureException e) {
            throw e;
        } catch (LorekeeperException e) {
            log.warn("Tool {} failed for {}: {}", tool.toolName(), agent.id(), e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    private String writeBuffer(AgentHandle agent, ToolRequest request) {
        String key = request.arg("canon_key");
        String claim = request.arg("claim");
        if (key.isEmpty() || claim.isEmpty()) {
            return "Error: write_to_buffer needs canon_key and claim.";
        }
        BufferEntry entry = layers.appendBuffer(BufferEntry.pending(agent.taskId(), agent, key, claim,
                request.arg("source"), request.doubleArg("confidence", 0.5)));
        return "Stored as TENTATIVE buffer entry " + entry.id() + " for " + key
                + " (confidence " + entry.confidence() + "). The curator will review it when the task closes.";
    }

    private String writeScratch(AgentHandle agent, ToolRequest request) {
        String note = request.arg("note");
        if (note.isEmpty()) {
            return "Error: write_to_scratch needs a note.";
        }
        layers.writeScratch(agent, note);
        return "Noted.";
    }

    private String readScratch(AgentHandle agent) {
        List<ScratchNote> notes = layers.readScratch(agent, agent.id(), agent.taskId());
        if (notes.isEmpty()) {
            return "Your scratchpad is empty.";
        }
        return notes.stream().map(n -> "- " + n.content()).collect(Collectors.joining("\n"));
    }

    private String writeTaskMemory(AgentHandle agent, ToolRequest request) {
        String key = request.arg("key");
        String content = request.arg("content");
        if (key.isEmpty() || content.isEmpty()) {
            return "Error: write_to_task_memory needs key and content.";
        }
        layers.appendTaskMemory(agent.taskId(), agent, key, content);
        return "Saved '" + key + "' to task memory.";
    }

    private String readTaskMemory(AgentHandle agent) {
        TaskMemory memory = layers.readTaskMemory(agent.taskId(), agent);
        var sb = new StringBuilder("Task ").append(memory.taskId()).append(": ").append(memory.prompt());
        for (TaskMemoryEntry e : memory.entries()) {
            sb.append("\n[").append(e.key()).append("|").append(e.agentId()).append("] ").append(e.content());
        }
        return sb.toString();
    }

    private String writeCanon(AgentHandle agent, ToolRequest request) {
        String key = request.arg("key");
        String value = request.arg("value");
        if (key.isEmpty() || value.isEmpty()) {
            return "Error: write_to_canon needs key and value.";
        }
        double confidence = Math.max(0.0, Math.min(1.0, request.doubleArg("confidence", 1.0)));
        CanonEntry installed = layers.writeCanon(CanonWrite.direct(key, value, confidence), agent);
        return "Canon '" + installed.key() + "' is now version " + installed.version() + ".";
    }

    private String webSearch(ToolRequest request) {
        String query = request.arg("query");
        if (query.isEmpty()) {
            return "Error: web_search needs a query.";
        }
        if (!search.isEnabled()) {
            return "Web search is disabled.";
        }
        List<SearchResult> results = search.search(query, searchProperties.getMaxResults());
        if (results.isEmpty()) {
            return "No results for '" + query + "'.";
        }
        return "Search results for '" + query + "' (unverified):\n"
                + results.stream().map(SearchResult::render).collect(Collectors.joining("\n"));
    }
}
