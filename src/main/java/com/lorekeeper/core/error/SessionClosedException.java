package com.lorekeeper.core.error;

public class SessionClosedException extends LorekeeperException {
    public SessionClosedException(String taskId) {
        super("Task session is closed: " + taskId);
    }
}
