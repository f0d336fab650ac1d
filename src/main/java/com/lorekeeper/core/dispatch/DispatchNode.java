package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.error.IllegalStatusTransitionException;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.DispatchState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One dispatch in a task's tree, with the history of states it moved through.
 */
public final class DispatchNode {

    public record StateChange(DispatchState state, Instant at, String note) {}

    private final String id;
    private final String parentId;
    private final AgentRole role;
    private final int depth;
    private final String assignment;
    private final List<StateChange> history = new ArrayList<>();
    private final List<String> declined = new ArrayList<>();
    private DispatchState state = DispatchState.REQUESTED;
    private String failureReason;
    private volatile boolean abandoned;

    DispatchNode(String id, String parentId, AgentRole role, int depth, String assignment) {
        this.id = id;
        this.parentId = parentId;
        this.role = role;
        this.depth = depth;
        this.assignment = assignment;
        history.add(new StateChange(DispatchState.REQUESTED, Instant.now(), null));
    }

    /**
     * Moves to {@code next}.
     *
     * @return false if the node is already terminal; late results of timed-out children land here
     * @throws IllegalStatusTransitionException for any other transition the state machine forbids
     */
    public synchronized boolean advance(DispatchState next, String note) {
        if (state.isTerminal()) {
            return false;
        }
        if (state == next) {
            return true;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStatusTransitionException("Dispatch " + id + " cannot move from " + state + " to " + next);
        }
        state = next;
        if (next == DispatchState.FAILED) {
            failureReason = note;
        }
        history.add(new StateChange(next, Instant.now(), note));
        return true;
    }

    public boolean advance(DispatchState next) {
        return advance(next, null);
    }

    /**
     * Notes a delegation this dispatch asked for and was refused. Refused requests get no node.
     */
    synchronized void recordDeclined(String note) {
        declined.add(note);
    }

    public synchronized List<String> declined() {
        return List.copyOf(declined);
    }

    void abandon() {
        abandoned = true;
    }

    /**
     * True once the parent stopped waiting for this dispatch. Its remaining work is discarded.
     */
    public boolean abandoned() {
        return abandoned;
    }

    public String id() {
        return id;
    }

    public String parentId() {
        return parentId;
    }

    public AgentRole role() {
        return role;
    }

    public int depth() {
        return depth;
    }

    public String assignment() {
        return assignment;
    }

    public synchronized DispatchState state() {
        return state;
    }

    public synchronized String failureReason() {
        return failureReason;
    }

    public synchronized List<StateChange> history() {
        return List.copyOf(history);
    }
}
