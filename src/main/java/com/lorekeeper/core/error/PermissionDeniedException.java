package com.lorekeeper.core.error;

/**
 * A role attempted a layer operation the access table does not allow.
 * Always surfaced to the caller.
 */
public class PermissionDeniedException extends LorekeeperException {
    public PermissionDeniedException(String message) {
        super(message);
    }
}
