package com.lorekeeper.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Terminal result of one dispatch and, recursively, of the children it joined.
 *
 * @param dispatchId     handle id of the agent that ran (or would have run)
 * @param role           role dispatched to
 * @param depth          dispatch depth
 * @param state          COMPLETED or FAILED
 * @param response       final text; empty when failed
 * @param failureReason  reason when FAILED, else {@code null}
 * @param children       outcomes of joined sub-dispatches
 * @param elapsedMs      wall time
 */
public record DispatchOutcome(
    String dispatchId,
    AgentRole role,
    int depth,
    DispatchState state,
    String response,
    String failureReason,
    List<DispatchOutcome> children,
    long elapsedMs
) implements Serializable {

    public DispatchOutcome {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static DispatchOutcome failed(String dispatchId, AgentRole role, int depth, String reason, long elapsedMs) {
        return new DispatchOutcome(dispatchId, role, depth, DispatchState.FAILED, "", reason, List.of(), elapsedMs);
    }

    public boolean completed() {
        return state == DispatchState.COMPLETED;
    }

    /**
     * True when at least one direct child failed.
     */
    public boolean partialFailure() {
        return children.stream().anyMatch(c -> c.state() == DispatchState.FAILED);
    }

    /**
     * Deepest depth observed in this subtree.
     */
    public int maxDepth() {
        int max = depth;
        for (var child : children) {
            max = Math.max(max, child.maxDepth());
        }
        return max;
    }
}
