package com.lorekeeper.core.llm;

import com.lorekeeper.core.dispatch.AgentTool;
import com.lorekeeper.core.dispatch.AgentTurn;
import com.lorekeeper.core.dispatch.ConversationMessage;
import com.lorekeeper.core.dispatch.InferenceClient;
import com.lorekeeper.core.error.InferenceFailureException;
import com.lorekeeper.core.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link InferenceClient} that asks the model for an {@link AgentTurn} as structured output.
 * <p>
 * Tools are described in the system prompt; the model selects them by name in
 * {@code toolRequests}. Any failure to reach the model or to read its reply surfaces as
 * {@link InferenceFailureException}.
 */
@Service
public class LlmInferenceClient implements InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(LlmInferenceClient.class);

    private final LlmService llmService;
    private final LlmProperties properties;

    public LlmInferenceClient(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public AgentTurn invoke(AgentRole role, String systemContext, List<ConversationMessage> history,
                            List<AgentTool> tools) {
        String system = systemContext + "\n\n" + toolSection(tools);
        String user = renderHistory(history);
        try {
            AgentTurn turn = llmService.structuredCall(system, user, AgentTurn.class);
            if (turn == null) {
                throw new InferenceFailureException("Model returned no turn for " + role.label());
            }
            if (turn.isFinal() && (turn.finalText() == null || turn.finalText().isBlank())) {
                throw new InferenceFailureException("Model returned neither an answer nor tool requests for "
                        + role.label());
            }
            return turn;
        } catch (LlmParseException | LlmEmptyResponseException e) {
            log.warn("Inference for {} produced an unusable reply: {}", role.label(), e.getMessage());
            throw new InferenceFailureException("Unusable model reply for " + role.label() + ": " + e.getMessage(), e);
        } catch (InferenceFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Inference for {} failed", role.label(), e);
            throw new InferenceFailureException("Inference call failed for " + role.label() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return properties.describe();
    }

    static String toolSection(List<AgentTool> tools) {
        if (tools.isEmpty()) {
            return "No tools are available. Answer with finalText.";
        }
        var sb = new StringBuilder("""
                Respond with either finalText (your complete answer) or toolRequests. \
                Each tool request names a tool and gives its arguments as strings. \
                Independent delegations can be requested together and will run in parallel.
                Tools:""");
        for (AgentTool tool : tools) {
            sb.append("\n- ").append(tool.render());
        }
        return sb.toString();
    }

    static String renderHistory(List<ConversationMessage> history) {
        var sb = new StringBuilder();
        for (ConversationMessage m : history) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            switch (m.kind()) {
                case TASK -> sb.append("TASK:\n");
                case ASSISTANT -> sb.append("YOU:\n");
                case TOOL_RESULT -> sb.append("TOOL RESULT:\n");
            }
            sb.append(m.content());
        }
        return sb.toString();
    }
}
