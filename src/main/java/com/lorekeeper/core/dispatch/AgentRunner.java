package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.DispatchOutcome;
import com.lorekeeper.core.model.DispatchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The tool loop of a single agent: invoke, run the requested tools, feed their results back,
 * until the model gives a final answer or the round limit is hit.
 */
final class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final DispatchRouter router;
    private final InferenceClient inference;
    private final ToolExecutor toolExecutor;
    private final AgentHandle agent;
    private final DispatchNode node;
    private final DispatchTree tree;
    private final int maxRounds;
    private final List<DispatchOutcome> children = Collections.synchronizedList(new ArrayList<>());

    AgentRunner(DispatchRouter router, InferenceClient inference, ToolExecutor toolExecutor,
                AgentHandle agent, DispatchNode node, DispatchTree tree, int maxRounds) {
        this.router = router;
        this.inference = inference;
        this.toolExecutor = toolExecutor;
        this.agent = agent;
        this.node = node;
        this.tree = tree;
        this.maxRounds = maxRounds;
    }

    String run(String task, String context, String systemContext, List<AgentTool> tools) {
        List<ConversationMessage> history = new ArrayList<>();
        history.add(ConversationMessage.task(context == null || context.isBlank()
                ? task : task + "\n\nContext:\n" + context));

        for (int round = 1; round <= maxRounds; round++) {
            ensureLive();
            AgentTurn turn = inference.invoke(agent.role(), systemContext, List.copyOf(history), tools);
            ensureLive();
            if (turn.isFinal()) {
                return turn.finalText() == null ? "" : turn.finalText();
            }
            log.debug("{} round {}: {} tool request(s)", agent.id(), round, turn.toolRequests().size());
            history.add(ConversationMessage.assistant(describe(turn.toolRequests())));
            runTools(turn.toolRequests(), history);
        }
        throw new LorekeeperException(agent.role().label() + " did not finish within " + maxRounds + " tool rounds");
    }

    private void runTools(List<ToolRequest> requests, List<ConversationMessage> history) {
        String[] results = new String[requests.size()];
        List<Integer> dispatchSlots = new ArrayList<>();
        List<ToolRequest> dispatches = new ArrayList<>();

        for (int i = 0; i < requests.size(); i++) {
            ToolRequest request = requests.get(i);
            Optional<AgentTool> tool = AgentTool.fromName(request.tool());
            if (tool.isEmpty()) {
                results[i] = "Unknown tool '" + request.tool() + "'.";
            } else if (!tool.get().availableTo(agent.role())) {
                results[i] = "Tool " + request.tool() + " is not available to the " + agent.role().label() + " role.";
            } else if (tool.get().isDispatch()) {
                dispatchSlots.add(i);
                dispatches.add(request);
            } else {
                results[i] = toolExecutor.execute(agent, tool.get(), request, tree);
            }
        }

        if (!dispatches.isEmpty()) {
            node.advance(DispatchState.DELEGATED);
            List<DispatchRouter.Delegation> delegations = router.delegate(agent, dispatches, tree);
            int failed = 0;
            int joined = 0;
            for (int k = 0; k < delegations.size(); k++) {
                var delegation = delegations.get(k);
                results[dispatchSlots.get(k)] = delegation.toolResult();
                if (!delegation.declined()) {
                    joined++;
                    children.add(delegation.outcome());
                    if (!delegation.outcome().completed()) {
                        failed++;
                    }
                }
            }
            if (failed > 0) {
                int last = dispatchSlots.get(dispatchSlots.size() - 1);
                results[last] = results[last] + "\n\nPARTIAL FAILURE: " + failed + " of " + joined
                        + " sub-dispatches failed. Their results are missing above.";
            }
        }

        for (int i = 0; i < requests.size(); i++) {
            history.add(ConversationMessage.toolResult(requests.get(i).tool(), results[i]));
        }
    }

    private void ensureLive() {
        if (tree.isAbandoned(node.id())) {
            throw new LorekeeperException("Dispatch " + agent.id() + " was abandoned after a timeout");
        }
    }

    List<DispatchOutcome> children() {
        synchronized (children) {
            return List.copyOf(children);
        }
    }

    private static String describe(List<ToolRequest> requests) {
        var sb = new StringBuilder("Requested tools:");
        for (ToolRequest r : requests) {
            sb.append("\n- ").append(r.tool()).append(' ').append(r.arguments());
        }
        return sb.toString();
    }
}
