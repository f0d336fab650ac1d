package com.lorekeeper.core.error;

public class UnknownTaskException extends LorekeeperException {
    public UnknownTaskException(String taskId) {
        super("Unknown task: " + taskId);
    }
}
