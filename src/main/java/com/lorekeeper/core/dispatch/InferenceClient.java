package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.model.AgentRole;

import java.util.List;

/**
 * Model access for the dispatch loop.
 * <p>
 * Implementations throw {@link com.lorekeeper.core.error.InferenceFailureException} when the
 * model cannot be reached or its answer cannot be parsed into an {@link AgentTurn}.
 */
public interface InferenceClient {

    AgentTurn invoke(AgentRole role, String systemContext, List<ConversationMessage> history, List<AgentTool> tools);

    /** Short label for health output. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
