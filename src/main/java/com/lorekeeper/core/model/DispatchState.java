package com.lorekeeper.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single dispatch request.
 * <pre>
 * REQUESTED -&gt; SCOPED -&gt; INVOKED -&gt; {COMPLETED, DELEGATED, FAILED}
 * DELEGATED -&gt; {COMPLETED, FAILED}
 * REQUESTED, SCOPED -&gt; FAILED   (declined before invocation)
 * </pre>
 */
public enum DispatchState {
    REQUESTED,
    SCOPED,
    INVOKED,
    DELEGATED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(DispatchState next) {
        return allowedNext().contains(next);
    }

    private Set<DispatchState> allowedNext() {
        return switch (this) {
            case REQUESTED -> EnumSet.of(SCOPED, FAILED);
            case SCOPED -> EnumSet.of(INVOKED, FAILED);
            case INVOKED -> EnumSet.of(COMPLETED, DELEGATED, FAILED);
            case DELEGATED -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(DispatchState.class);
        };
    }
}
