package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.error.DelegationCycleException;
import com.lorekeeper.core.error.DepthExceededException;
import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.events.LoreEvent;
import com.lorekeeper.core.logging.MdcContext;
import com.lorekeeper.core.memory.MemoryContextBuilder;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.metrics.LoreMetrics;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.DispatchOutcome;
import com.lorekeeper.core.model.DispatchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes dispatch requests through {@code REQUESTED -> SCOPED -> INVOKED -> terminal}.
 * <p>
 * Depth and cycle checks happen before any inference call; a rejected request becomes a
 * "declined to delegate" tool result for the requesting agent and a note on its node, never a
 * node of its own. Accepted sub-dispatches from one turn run concurrently on the dispatch pool
 * and are joined with a per-child timeout. A failed or timed-out child never aborts its
 * siblings; a timed-out child is abandoned, so nothing it does afterwards reaches memory.
 */
@Service
public class DispatchRouter {

    private static final Logger log = LoggerFactory.getLogger(DispatchRouter.class);
    private static final String ABANDONED = "abandoned after a timeout above it";

    private final InferenceClient inference;
    private final ToolExecutor toolExecutor;
    private final MemoryContextBuilder contextBuilder;
    private final MemoryLayers layers;
    private final DelegationCycleDetector cycleDetector;
    private final DispatchProperties properties;
    private final EventBus eventBus;
    private final LoreMetrics metrics;
    private final ExecutorService executor;

    public DispatchRouter(InferenceClient inference, ToolExecutor toolExecutor,
                          MemoryContextBuilder contextBuilder, MemoryLayers layers,
                          DelegationCycleDetector cycleDetector, DispatchProperties properties,
                          EventBus eventBus, LoreMetrics metrics,
                          @Qualifier("dispatchExecutor") ExecutorService executor) {
        this.inference = inference;
        this.toolExecutor = toolExecutor;
        this.contextBuilder = contextBuilder;
        this.layers = layers;
        this.cycleDetector = cycleDetector;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Runs a root dispatch on the calling thread. Root requests always go to the orchestrator.
     */
    public DispatchOutcome dispatchRoot(String taskId, String prompt, DispatchTree tree) {
        var handle = AgentHandle.root(taskId, AgentRole.ORCHESTRATOR, prompt);
        DispatchNode node = tree.record(handle);
        publishRequested(handle);
        return execute(handle, node, prompt, "", tree);
    }

    /**
     * Result of one delegation request: the text handed back to the requester and, unless the
     * request was declined, the child's outcome.
     */
    record Delegation(String toolResult, DispatchOutcome outcome) {
        boolean declined() {
            return outcome == null;
        }
    }

    /**
     * Validates every request, runs the accepted ones concurrently and waits for all of them.
     * Results are returned in request order.
     */
    List<Delegation> delegate(AgentHandle parent, List<ToolRequest> requests, DispatchTree tree) {
        Delegation[] results = new Delegation[requests.size()];
        List<Integer> accepted = new ArrayList<>();
        List<AgentHandle> children = new ArrayList<>();
        List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>();

        for (int i = 0; i < requests.size(); i++) {
            ToolRequest request = requests.get(i);
            AgentTool tool = AgentTool.fromName(request.tool()).orElseThrow();
            AgentRole role = tool.targetRole(request);
            String task = request.arg("task");
            if (role == null) {
                results[i] = decline(parent, tree, "unknown_tool",
                        "unknown agent_type '" + request.arg("agent_type") + "'");
                continue;
            }
            if (task.isEmpty()) {
                results[i] = decline(parent, tree, "invalid_request", tool.toolName() + " needs a task");
                continue;
            }
            try {
                int depth = parent.depth() + 1;
                if (depth > properties.getMaxDepth()) {
                    throw new DepthExceededException(depth, properties.getMaxDepth());
                }
                cycleDetector.check(parent, role, task);
            } catch (DepthExceededException e) {
                results[i] = decline(parent, tree, "depth_exceeded", e.getMessage());
                continue;
            } catch (DelegationCycleException e) {
                results[i] = decline(parent, tree, "cycle", e.getMessage());
                continue;
            }

            AgentHandle child = parent.spawn(role, task);
            DispatchNode node = tree.record(child);
            publishRequested(child);
            String context = request.arg("context");
            accepted.add(i);
            children.add(child);
            futures.add(CompletableFuture.supplyAsync(() -> execute(child, node, task, context, tree), executor));
        }

        if (!futures.isEmpty()) {
            log.info("{} delegated {} sub-dispatch(es), waiting", parent.id(), futures.size());
        }
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getChildTimeoutSeconds());
        for (int k = 0; k < futures.size(); k++) {
            AgentHandle child = children.get(k);
            DispatchOutcome outcome = join(child, futures.get(k), tree, deadline);
            results[accepted.get(k)] = new Delegation(render(outcome), outcome);
        }
        return List.of(results);
    }

    private DispatchOutcome join(AgentHandle child, CompletableFuture<DispatchOutcome> future,
                                 DispatchTree tree, long deadline) {
        DispatchNode node = tree.node(child.id());
        long started = System.currentTimeMillis();
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            String reason = "timed out after " + properties.getChildTimeoutSeconds() + "s";
            if (tree.abandon(child.id(), reason)) {
                log.warn("Sub-dispatch {} {}; a late result will be discarded", child.id(), reason);
                recordTerminal(child, DispatchState.FAILED, reason, System.currentTimeMillis() - started);
            }
            return DispatchOutcome.failed(child.id(), child.role(), child.depth(), reason,
                    System.currentTimeMillis() - started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            node.advance(DispatchState.FAILED, "interrupted");
            return DispatchOutcome.failed(child.id(), child.role(), child.depth(), "interrupted",
                    System.currentTimeMillis() - started);
        } catch (ExecutionException e) {
            String reason = e.getCause() == null ? e.getMessage() : e.getCause().getMessage();
            node.advance(DispatchState.FAILED, reason);
            return DispatchOutcome.failed(child.id(), child.role(), child.depth(), reason,
                    System.currentTimeMillis() - started);
        }
    }

    /**
     * Runs one accepted dispatch to a terminal state. Never throws; failures become a FAILED outcome.
     */
    DispatchOutcome execute(AgentHandle handle, DispatchNode node, String task, String context, DispatchTree tree) {
        long start = System.currentTimeMillis();
        MdcContext.setAgent(handle);
        metrics.recordDispatchDepth(handle.depth());
        var runner = new AgentRunner(this, inference, toolExecutor, handle, node, tree, properties.getMaxToolRounds());
        try {
            boolean mayDelegate = handle.depth() < properties.getMaxDepth();
            List<AgentTool> tools = AgentTool.offeredTo(handle.role(), mayDelegate);
            String memoryContext = contextBuilder.build(handle, properties.scopeFor(handle.role()));
            node.advance(DispatchState.SCOPED);

            String systemContext = RolePrompts.forRole(handle.role()) + "\n"
                    + RolePrompts.depthNote(handle.depth(), properties.getMaxDepth(), mayDelegate)
                    + (memoryContext.isEmpty() ? "" : "\n\n" + memoryContext);
            node.advance(DispatchState.INVOKED);
            log.info("Invoking {} at depth {} with {} tool(s)", handle.role().label(), handle.depth(), tools.size());

            String response = runner.run(task, context, systemContext, tools);
            long elapsed = System.currentTimeMillis() - start;
            boolean completed = tree.whileLive(handle.id(), () -> {
                if (!node.advance(DispatchState.COMPLETED)) {
                    return false;
                }
                recordOutput(handle, response);
                return true;
            }).orElse(false);
            if (!completed) {
                if (node.advance(DispatchState.FAILED, ABANDONED)) {
                    recordTerminal(handle, DispatchState.FAILED, ABANDONED, elapsed);
                }
                log.info("Discarding late result of {} ({})", handle.id(), node.failureReason());
                return new DispatchOutcome(handle.id(), handle.role(), handle.depth(), DispatchState.FAILED, "",
                        node.failureReason(), runner.children(), elapsed);
            }
            recordTerminal(handle, DispatchState.COMPLETED, null, elapsed);
            return new DispatchOutcome(handle.id(), handle.role(), handle.depth(), DispatchState.COMPLETED,
                    response, null, runner.children(), elapsed);
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - start;
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            if (e instanceof LorekeeperException) {
                log.warn("Dispatch {} failed: {}", handle.id(), reason);
            } else {
                log.error("Dispatch {} failed unexpectedly", handle.id(), e);
            }
            if (node.advance(DispatchState.FAILED, reason)) {
                recordTerminal(handle, DispatchState.FAILED, reason, elapsed);
            }
            return new DispatchOutcome(handle.id(), handle.role(), handle.depth(), DispatchState.FAILED, "",
                    reason, runner.children(), elapsed);
        } finally {
            layers.discardScratch(handle);
            MdcContext.clear();
        }
    }

    private void recordOutput(AgentHandle handle, String response) {
        try {
            layers.appendTaskMemory(handle.taskId(), handle, "output:" + handle.role().label(), response);
        } catch (LorekeeperException e) {
            log.warn("Could not record output of {} in task memory: {}", handle.id(), e.getMessage());
        }
    }

    private Delegation decline(AgentHandle parent, DispatchTree tree, String reason, String message) {
        metrics.recordDeclined(reason);
        log.info("Declined delegation from {} ({}): {}", parent.id(), reason, message);
        DispatchNode requester = tree.node(parent.id());
        if (requester != null) {
            requester.recordDeclined(reason + ": " + message);
        }
        eventBus.publish(LoreEvent.of(LoreEvent.DISPATCH_DECLINED, parent.taskId(), parent.id(),
                Map.of("reason", reason, "message", message, "requestedBy", parent.id())));
        return new Delegation("Declined to delegate: " + message, null);
    }

    private void publishRequested(AgentHandle handle) {
        eventBus.publish(LoreEvent.of(LoreEvent.DISPATCH_REQUESTED, handle.taskId(), handle.id(), Map.of(
                "role", handle.role().label(),
                "depth", handle.depth(),
                "parentId", handle.parent().map(AgentHandle::id).orElse(""))));
    }

    private void recordTerminal(AgentHandle handle, DispatchState state, String reason, long elapsedMs) {
        metrics.recordDispatch(handle.role().label(), state.name(), elapsedMs);
        eventBus.publish(LoreEvent.of(state == DispatchState.COMPLETED ? LoreEvent.DISPATCH_COMPLETED : LoreEvent.DISPATCH_FAILED,
                handle.taskId(), handle.id(), Map.of(
                        "role", handle.role().label(),
                        "depth", handle.depth(),
                        "elapsedMs", elapsedMs,
                        "reason", reason == null ? "" : reason)));
    }

    static String render(DispatchOutcome outcome) {
        String head = outcome.role().label() + " [" + outcome.dispatchId() + "] " + outcome.state();
        return outcome.completed()
                ? head + ":\n" + outcome.response()
                : head + ": " + outcome.failureReason();
    }
}
