package com.lorekeeper.core.llm;

/**
 * Thrown when the model answers with no content at all.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
