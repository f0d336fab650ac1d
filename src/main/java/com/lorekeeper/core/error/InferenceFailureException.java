package com.lorekeeper.core.error;

/**
 * The inference collaborator errored or returned a tool request that could not be parsed.
 * Terminal for the dispatch that hit it, never for its siblings or parent.
 */
public class InferenceFailureException extends LorekeeperException {
    public InferenceFailureException(String message) {
        super(message);
    }

    public InferenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
