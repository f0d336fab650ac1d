package com.lorekeeper.core.error;

/**
 * The web search backend could not be reached or answered with something unreadable.
 */
public class SearchFailureException extends LorekeeperException {
    public SearchFailureException(String message) {
        super(message);
    }

    public SearchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
