package com.lorekeeper.core.error;

/**
 * Transient storage failure. Buffer and task-memory appends may be retried as-is;
 * Canon writes must be retried with a fresh conflict check.
 */
public class StorageFailureException extends LorekeeperException {
    public StorageFailureException(String message) {
        super(message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
