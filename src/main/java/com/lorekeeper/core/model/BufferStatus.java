package com.lorekeeper.core.model;

/**
 * Lifecycle of a buffer entry. Only PENDING may transition, and only to a terminal state.
 */
public enum BufferStatus {
    PENDING,
    PROMOTED,
    DISMISSED,
    DISPUTED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(BufferStatus next) {
        return this == PENDING && next != null && next.isTerminal();
    }
}
