package com.lorekeeper.core.dispatch;

/**
 * An item of an agent's running conversation with the model.
 */
public record ConversationMessage(Kind kind, String content) {

    public enum Kind {
        TASK,
        ASSISTANT,
        TOOL_RESULT
    }

    public static ConversationMessage task(String content) {
        return new ConversationMessage(Kind.TASK, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Kind.ASSISTANT, content);
    }

    public static ConversationMessage toolResult(String tool, String content) {
        return new ConversationMessage(Kind.TOOL_RESULT, "[" + tool + "] " + content);
    }
}
