package com.lorekeeper.core.session;

import com.lorekeeper.core.curator.CurationReport;
import com.lorekeeper.core.curator.MemoryCurator;
import com.lorekeeper.core.dispatch.DispatchRouter;
import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.error.SessionClosedException;
import com.lorekeeper.core.error.UnknownTaskException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.events.LoreEvent;
import com.lorekeeper.core.logging.MdcContext;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.metrics.LoreMetrics;
import com.lorekeeper.core.model.DispatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens, runs and closes task sessions.
 * <p>
 * Closing a session runs the curator over the task's buffer and then archives its task memory.
 * A closed session accepts no further dispatches.
 */
@Service
public class TaskSessionManager {

    private static final Logger log = LoggerFactory.getLogger(TaskSessionManager.class);

    private final MemoryLayers layers;
    private final DispatchRouter router;
    private final MemoryCurator curator;
    private final EventBus eventBus;
    private final LoreMetrics metrics;

    private final ConcurrentHashMap<String, TaskSession> sessions = new ConcurrentHashMap<>();

    public TaskSessionManager(MemoryLayers layers, DispatchRouter router, MemoryCurator curator,
                              EventBus eventBus, LoreMetrics metrics) {
        this.layers = layers;
        this.router = router;
        this.curator = curator;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Opens a session and seeds its task memory with the prompt.
     *
     * @param taskId requested id, or {@code null} to generate one
     * @throws LorekeeperException when a task with this id already exists
     */
    public TaskSession open(String taskId, String prompt) {
        String id = taskId == null || taskId.isBlank() ? "task-" + UUID.randomUUID().toString().substring(0, 8) : taskId;
        var session = new TaskSession(id, prompt, Instant.now());
        if (sessions.putIfAbsent(id, session) != null || !layers.openTaskMemory(id, prompt)) {
            sessions.remove(id, session);
            throw new LorekeeperException("Task " + id + " already exists");
        }
        MdcContext.setTask(id);
        try {
            log.info("Opened task session {}", id);
            metrics.recordSession("opened");
            eventBus.publish(LoreEvent.of(LoreEvent.SESSION_OPENED, id, null, Map.of("prompt", prompt)));
        } finally {
            MdcContext.clear();
        }
        return session;
    }

    /**
     * Runs a root dispatch inside an open session.
     *
     * @throws UnknownTaskException   when no such task exists
     * @throws SessionClosedException when the session is closing or closed
     */
    public DispatchOutcome dispatch(String taskId, String prompt) {
        TaskSession session = requireSession(taskId);
        var readLock = session.lock().readLock();
        readLock.lock();
        try {
            if (session.status() != SessionStatus.OPEN) {
                throw new SessionClosedException(taskId);
            }
            DispatchOutcome outcome = router.dispatchRoot(taskId, prompt, session.tree());
            session.addOutcome(outcome);
            log.info("Task {} root dispatch {} in {}ms (max depth {})", taskId, outcome.state(),
                    outcome.elapsedMs(), outcome.maxDepth());
            return outcome;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Curates the task's buffer, then archives its task memory. Waits for in-flight dispatches.
     * If curation or archiving fails the session goes back to OPEN so the close can be retried;
     * a second curation pass over the same buffer does not install or dispute anything twice.
     */
    public CurationReport close(String taskId) {
        TaskSession session = requireSession(taskId);
        var writeLock = session.lock().writeLock();
        writeLock.lock();
        try {
            if (session.status() != SessionStatus.OPEN) {
                throw new SessionClosedException(taskId);
            }
            session.status(SessionStatus.CLOSING);
            CurationReport report;
            try {
                report = curator.curate(taskId);
            } catch (LorekeeperException e) {
                session.status(SessionStatus.OPEN);
                log.error("Curation failed while closing task {}; session left open", taskId, e);
                throw e;
            }
            try {
                layers.archiveTaskMemory(taskId);
            } catch (LorekeeperException e) {
                session.status(SessionStatus.OPEN);
                log.error("Archiving task memory failed while closing task {}; session left open", taskId, e);
                throw e;
            }
            session.closed(report, Instant.now());
            metrics.recordSession("closed");
            eventBus.publish(LoreEvent.of(LoreEvent.SESSION_CLOSED, taskId, null, Map.of(
                    "promoted", report.promoted().size(),
                    "disputed", report.disputed().size(),
                    "dispatches", session.tree().size())));
            log.info("Closed task session {}: {}", taskId, report.summary());
            return report;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Open, dispatch once, close.
     */
    public TaskReport run(String prompt) {
        long start = System.currentTimeMillis();
        TaskSession session = open(null, prompt);
        DispatchOutcome outcome;
        try {
            outcome = dispatch(session.taskId(), prompt);
        } finally {
            if (session.status() == SessionStatus.OPEN) {
                close(session.taskId());
            }
        }
        metrics.recordSession(outcome.completed() ? "completed" : "failed");
        return new TaskReport(session.taskId(), prompt, outcome, session.curation(), session.tree().size(),
                session.tree().render(), System.currentTimeMillis() - start);
    }

    public Optional<TaskSession> session(String taskId) {
        return Optional.ofNullable(sessions.get(taskId));
    }

    public List<TaskSession> sessions() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(TaskSession::openedAt))
                .toList();
    }

    private TaskSession requireSession(String taskId) {
        TaskSession session = sessions.get(taskId);
        if (session != null) {
            return session;
        }
        // archived by an earlier process against durable storage
        if (layers.hasTaskMemory(taskId)) {
            throw new SessionClosedException(taskId);
        }
        throw new UnknownTaskException(taskId);
    }
}
