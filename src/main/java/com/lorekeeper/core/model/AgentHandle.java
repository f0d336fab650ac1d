package com.lorekeeper.core.model;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity of one agent participating in a task.
 * <p>
 * The parent reference is weak and lookup-only: it is used for depth computation and
 * ancestor walks, never to reach into the parent's state. Children report back through
 * the dispatch join.
 */
public final class AgentHandle {

    private final String id;
    private final AgentRole role;
    private final int depth;
    private final String taskId;
    private final String assignment;
    private final WeakReference<AgentHandle> parent;

    private AgentHandle(String id, AgentRole role, int depth, String taskId, String assignment,
                        AgentHandle parent) {
        this.id = Objects.requireNonNull(id, "id");
        this.role = Objects.requireNonNull(role, "role");
        this.depth = depth;
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.assignment = assignment == null ? "" : assignment;
        this.parent = parent == null ? null : new WeakReference<>(parent);
    }

    /**
     * Creates the depth-0 handle for a task's root dispatch.
     */
    public static AgentHandle root(String taskId, AgentRole role, String assignment) {
        return new AgentHandle(newId(role), role, 0, taskId, assignment, null);
    }

    /**
     * Creates a handle for a sub-dispatch spawned by {@code this}, one level deeper.
     */
    public AgentHandle spawn(AgentRole childRole, String childAssignment) {
        return new AgentHandle(newId(childRole), childRole, depth + 1, taskId, childAssignment, this);
    }

    /**
     * Handle for operators and services acting outside any dispatch tree (depth 0, no parent).
     */
    public static AgentHandle system(String id, AgentRole role, String taskId) {
        return new AgentHandle(id, role, 0, taskId, "", null);
    }

    private static String newId(AgentRole role) {
        return role.label() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String id() {
        return id;
    }

    public AgentRole role() {
        return role;
    }

    public int depth() {
        return depth;
    }

    public String taskId() {
        return taskId;
    }

    public String assignment() {
        return assignment;
    }

    public Optional<AgentHandle> parent() {
        return parent == null ? Optional.empty() : Optional.ofNullable(parent.get());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AgentHandle other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AgentHandle[" + id + ", " + role + ", depth=" + depth + ", task=" + taskId + "]";
    }
}
