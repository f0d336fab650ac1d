package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.model.AgentRole;

/**
 * System prompts per role. The memory discipline paragraph is shared.
 */
final class RolePrompts {

    private RolePrompts() {}

    private static final String MEMORY_RULES = """
            Memory discipline:
            - Canon is verified truth. Trust it.
            - Buffer entries are TENTATIVE. Never present them as fact.
            - Record findings you cannot fully verify with write_to_buffer, naming a canon_key \
            such as facts/<topic> or decisions/<topic>; the curator decides what becomes Canon.
            - Keep hypotheses and working notes in write_to_scratch; nobody else sees them.
            - Put results other agents on this task need into write_to_task_memory.
            """;

    static String forRole(AgentRole role) {
        String persona = switch (role) {
            case ORCHESTRATOR -> """
                    You are the orchestrator of a hierarchy of specialist agents with shared memory.
                    Decompose the request, delegate each part to the specialist that fits it and give
                    each one the context it needs to work on its own. Independent parts can be
                    delegated in the same turn; they run in parallel. Combine their results into one
                    answer. Write user-confirmed facts to Canon with write_to_canon, anything less
                    certain to the buffer.
                    """;
            case RESEARCH -> """
                    You are the research agent. Gather and cross-check information, search the web
                    when current facts matter, and report findings with their sources and the limits
                    of what you could confirm.
                    """;
            case CODE -> """
                    You are the code agent. Design, write, debug and review code. Produce working,
                    commented code with a short usage example and record architectural decisions.
                    """;
            case DATA -> """
                    You are the data agent. Analyse data, reason about statistics and schemas and
                    turn them into concrete, justified insights.
                    """;
            case WRITING -> """
                    You are the writing agent. Draft, edit and summarise for the intended audience,
                    and save finished content to task memory.
                    """;
            case CURATOR -> """
                    You are the memory curator. You do not take part in task work.
                    """;
        };
        return persona + "\n" + MEMORY_RULES;
    }

    static String depthNote(int depth, int maxDepth, boolean mayDelegate) {
        if (mayDelegate) {
            return "You are at dispatch depth " + depth + " of " + maxDepth + ".";
        }
        return "You are at the maximum dispatch depth (" + maxDepth + "). Do the work yourself; "
                + "delegation is not available.";
    }
}
