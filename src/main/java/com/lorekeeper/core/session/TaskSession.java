package com.lorekeeper.core.session;

import com.lorekeeper.core.curator.CurationReport;
import com.lorekeeper.core.dispatch.DispatchTree;
import com.lorekeeper.core.model.DispatchOutcome;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One task's lifetime: dispatches run under the read lock, closing takes the write lock so it
 * waits for in-flight dispatches.
 */
public class TaskSession {

    private final String taskId;
    private final String prompt;
    private final Instant openedAt;
    private final DispatchTree tree;
    private final List<DispatchOutcome> outcomes = new CopyOnWriteArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile SessionStatus status = SessionStatus.OPEN;
    private volatile CurationReport curation;
    private volatile Instant closedAt;

    TaskSession(String taskId, String prompt, Instant openedAt) {
        this.taskId = taskId;
        this.prompt = prompt;
        this.openedAt = openedAt;
        this.tree = new DispatchTree(taskId);
    }

    public String taskId() {
        return taskId;
    }

    public String prompt() {
        return prompt;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public DispatchTree tree() {
        return tree;
    }

    public List<DispatchOutcome> outcomes() {
        return List.copyOf(outcomes);
    }

    public SessionStatus status() {
        return status;
    }

    public CurationReport curation() {
        return curation;
    }

    public Instant closedAt() {
        return closedAt;
    }

    ReentrantReadWriteLock lock() {
        return lock;
    }

    void addOutcome(DispatchOutcome outcome) {
        outcomes.add(outcome);
    }

    void status(SessionStatus status) {
        this.status = status;
    }

    void closed(CurationReport curation, Instant at) {
        this.curation = curation;
        this.closedAt = at;
        this.status = SessionStatus.CLOSED;
    }
}
