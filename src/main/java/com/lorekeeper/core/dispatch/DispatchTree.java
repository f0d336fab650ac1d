package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.DispatchState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Every dispatch made within one task session, keyed by agent id.
 * <p>
 * Also guards against late writes: memory writes of a dispatch run through {@link #whileLive},
 * and a timed-out dispatch is {@link #abandon abandoned} together with its subtree. Abandoning
 * waits for writes already in flight, so none lands afterwards.
 */
public class DispatchTree {

    private final String taskId;
    private final Map<String, DispatchNode> nodes = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock liveness = new ReentrantReadWriteLock();

    public DispatchTree(String taskId) {
        this.taskId = taskId;
    }

    public DispatchNode record(AgentHandle handle) {
        String parentId = handle.parent().map(AgentHandle::id).orElse(null);
        var node = new DispatchNode(handle.id(), parentId, handle.role(), handle.depth(), handle.assignment());
        nodes.put(handle.id(), node);
        return node;
    }

    /**
     * Marks a dispatch abandoned and FAILED with {@code reason}.
     *
     * @return false if the node was already terminal
     */
    public boolean abandon(String id, String reason) {
        liveness.writeLock().lock();
        try {
            DispatchNode node = nodes.get(id);
            if (node == null) {
                return false;
            }
            node.abandon();
            return node.advance(DispatchState.FAILED, reason);
        } finally {
            liveness.writeLock().unlock();
        }
    }

    /**
     * True when the dispatch or any of its ancestors was abandoned.
     */
    public boolean isAbandoned(String id) {
        String current = id;
        while (current != null) {
            DispatchNode node = nodes.get(current);
            if (node == null) {
                return false;
            }
            if (node.abandoned()) {
                return true;
            }
            current = node.parentId();
        }
        return false;
    }

    /**
     * Runs {@code write} unless the dispatch was abandoned.
     *
     * @return the write's result, or empty when it was not run
     */
    public <T> Optional<T> whileLive(String id, Supplier<T> write) {
        liveness.readLock().lock();
        try {
            if (isAbandoned(id)) {
                return Optional.empty();
            }
            return Optional.ofNullable(write.get());
        } finally {
            liveness.readLock().unlock();
        }
    }

    public String taskId() {
        return taskId;
    }

    public DispatchNode node(String id) {
        return nodes.get(id);
    }

    public Collection<DispatchNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<DispatchNode> children(String parentId) {
        List<DispatchNode> children = new ArrayList<>();
        for (DispatchNode n : nodes.values()) {
            if (parentId.equals(n.parentId())) {
                children.add(n);
            }
        }
        children.sort(Comparator.comparing(n -> n.history().get(0).at()));
        return children;
    }

    public List<DispatchNode> roots() {
        return nodes.values().stream()
                .filter(n -> n.parentId() == null)
                .sorted(Comparator.comparing(n -> n.history().get(0).at()))
                .toList();
    }

    public int maxDepth() {
        return nodes.values().stream().mapToInt(DispatchNode::depth).max().orElse(0);
    }

    public long count(DispatchState state) {
        return nodes.values().stream().filter(n -> n.state() == state).count();
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Indented one-line-per-node rendering for CLI output.
     */
    public String render() {
        var sb = new StringBuilder();
        for (DispatchNode root : roots()) {
            render(root, sb);
        }
        return sb.toString();
    }

    private void render(DispatchNode node, StringBuilder sb) {
        sb.append("  ".repeat(node.depth()))
          .append(node.role().label()).append(" [").append(node.id()).append("] ")
          .append(node.state());
        if (node.failureReason() != null) {
            sb.append(" (").append(node.failureReason()).append(")");
        }
        sb.append('\n');
        for (String note : node.declined()) {
            sb.append("  ".repeat(node.depth() + 1)).append("- declined ").append(note).append('\n');
        }
        for (DispatchNode child : children(node.id())) {
            render(child, sb);
        }
    }
}
