package com.lorekeeper.core.error;

/**
 * Root of the coordination engine's failure taxonomy.
 */
public class LorekeeperException extends RuntimeException {
    public LorekeeperException(String message) {
        super(message);
    }

    public LorekeeperException(String message, Throwable cause) {
        super(message, cause);
    }
}
