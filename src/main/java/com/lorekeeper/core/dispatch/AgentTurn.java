package com.lorekeeper.core.dispatch;

import java.util.List;

/**
 * One model response: either a final answer or a batch of tool requests.
 *
 * @param finalText    the answer when no tools are requested
 * @param toolRequests tools to run before the next turn; empty for a final answer
 */
public record AgentTurn(String finalText, List<ToolRequest> toolRequests) {

    public AgentTurn {
        toolRequests = toolRequests == null ? List.of() : List.copyOf(toolRequests);
    }

    public static AgentTurn answer(String text) {
        return new AgentTurn(text, List.of());
    }

    public static AgentTurn tools(ToolRequest... requests) {
        return new AgentTurn(null, List.of(requests));
    }

    public boolean isFinal() {
        return toolRequests.isEmpty();
    }
}
