package com.lorekeeper.core.model;

/**
 * Closed set of agent roles in the hierarchy.
 */
public enum AgentRole {
    ORCHESTRATOR,
    RESEARCH,
    CODE,
    DATA,
    WRITING,
    CURATOR;

    /**
     * Resolves the lower-case agent type used by {@code spawn_sub_agent} (e.g. "research").
     *
     * @return the matching specialist role, or {@code null} when the name is not a specialist
     */
    public static AgentRole fromAgentType(String agentType) {
        if (agentType == null) return null;
        return switch (agentType.trim().toLowerCase()) {
            case "research" -> RESEARCH;
            case "code" -> CODE;
            case "data" -> DATA;
            case "writing" -> WRITING;
            default -> null;
        };
    }

    public boolean isSpecialist() {
        return this == RESEARCH || this == CODE || this == DATA || this == WRITING;
    }

    public String label() {
        return name().toLowerCase();
    }
}
