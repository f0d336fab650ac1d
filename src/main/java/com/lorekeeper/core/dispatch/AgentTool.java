package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.model.AgentRole;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tools an agent may request, with the roles each is offered to.
 */
public enum AgentTool {

    RESEARCH_AGENT("research_agent", Kind.DISPATCH,
            "Delegate information gathering, fact-checking and synthesis to the research agent.",
            "task (required), context", EnumSet.of(AgentRole.ORCHESTRATOR)),
    CODE_AGENT("code_agent", Kind.DISPATCH,
            "Delegate writing, debugging or reviewing code to the code agent.",
            "task (required), context", EnumSet.of(AgentRole.ORCHESTRATOR)),
    DATA_AGENT("data_agent", Kind.DISPATCH,
            "Delegate statistics, data transformation and pattern analysis to the data agent.",
            "task (required), context", EnumSet.of(AgentRole.ORCHESTRATOR)),
    WRITING_AGENT("writing_agent", Kind.DISPATCH,
            "Delegate drafting, editing and summarising to the writing agent.",
            "task (required), context", EnumSet.of(AgentRole.ORCHESTRATOR)),
    SPAWN_SUB_ORCHESTRATOR("spawn_sub_orchestrator", Kind.DISPATCH,
            "Hand a large sub-task to a child orchestrator that coordinates its own specialists.",
            "task (required), context", EnumSet.of(AgentRole.ORCHESTRATOR)),
    SPAWN_SUB_AGENT("spawn_sub_agent", Kind.DISPATCH,
            "Hand part of your task to another specialist.",
            "agent_type (research|code|data|writing, required), task (required), context",
            EnumSet.of(AgentRole.RESEARCH, AgentRole.CODE, AgentRole.DATA, AgentRole.WRITING)),

    WEB_SEARCH("web_search", Kind.SEARCH,
            "Search the web. Results are unverified; record findings with write_to_buffer.",
            "query (required)", EnumSet.of(AgentRole.ORCHESTRATOR, AgentRole.RESEARCH)),

    WRITE_TO_BUFFER("write_to_buffer", Kind.MEMORY,
            "Record an unverified claim about a Canon key for the curator to review. Labelled TENTATIVE.",
            "canon_key (required, e.g. facts/boiling-point), claim (required), source, confidence (0.0-1.0)",
            EnumSet.of(AgentRole.ORCHESTRATOR, AgentRole.RESEARCH, AgentRole.CODE, AgentRole.DATA, AgentRole.WRITING)),
    WRITE_TO_SCRATCH("write_to_scratch", Kind.MEMORY,
            "Write a private note only you can read during this task.",
            "note (required)",
            EnumSet.of(AgentRole.ORCHESTRATOR, AgentRole.RESEARCH, AgentRole.CODE, AgentRole.DATA, AgentRole.WRITING)),
    READ_SCRATCH("read_scratch", Kind.MEMORY,
            "Read back your private notes for this task.",
            "",
            EnumSet.of(AgentRole.ORCHESTRATOR, AgentRole.RESEARCH, AgentRole.CODE, AgentRole.DATA, AgentRole.WRITING)),
    WRITE_TO_TASK_MEMORY("write_to_task_memory", Kind.MEMORY,
            "Share an artifact or result with every agent working on this task.",
            "key (required), content (required)",
            EnumSet.of(AgentRole.ORCHESTRATOR, AgentRole.RESEARCH, AgentRole.CODE, AgentRole.DATA, AgentRole.WRITING)),
    READ_TASK_MEMORY("read_task_memory", Kind.MEMORY,
            "Read the shared artifacts of this task.",
            "",
            EnumSet.of(AgentRole.ORCHESTRATOR, AgentRole.RESEARCH, AgentRole.CODE, AgentRole.DATA, AgentRole.WRITING)),
    WRITE_TO_CANON("write_to_canon", Kind.MEMORY,
            "Install a confirmed fact directly into Canon. Use sparingly; prefer write_to_buffer.",
            "key (required), value (required), confidence (0.0-1.0)",
            EnumSet.of(AgentRole.ORCHESTRATOR));

    public enum Kind {
        DISPATCH,
        MEMORY,
        SEARCH
    }

    private final String toolName;
    private final Kind kind;
    private final String description;
    private final String parameters;
    private final Set<AgentRole> roles;

    AgentTool(String toolName, Kind kind, String description, String parameters, Set<AgentRole> roles) {
        this.toolName = toolName;
        this.kind = kind;
        this.description = description;
        this.parameters = parameters;
        this.roles = roles;
    }

    public String toolName() {
        return toolName;
    }

    public Kind kind() {
        return kind;
    }

    public String description() {
        return description;
    }

    public String parameters() {
        return parameters;
    }

    public boolean availableTo(AgentRole role) {
        return roles.contains(role);
    }

    public boolean isDispatch() {
        return kind == Kind.DISPATCH;
    }

    /**
     * Tools that change memory. They are refused once the calling dispatch is abandoned.
     */
    public boolean writesMemory() {
        return this == WRITE_TO_BUFFER || this == WRITE_TO_SCRATCH
                || this == WRITE_TO_TASK_MEMORY || this == WRITE_TO_CANON;
    }

    public static Optional<AgentTool> fromName(String name) {
        if (name == null) return Optional.empty();
        for (AgentTool tool : values()) {
            if (tool.toolName.equals(name.trim())) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }

    /**
     * Tools offered to an agent. Dispatch tools are withheld when the agent may not delegate.
     */
    public static List<AgentTool> offeredTo(AgentRole role, boolean mayDelegate) {
        List<AgentTool> tools = new ArrayList<>();
        for (AgentTool tool : values()) {
            if (tool.availableTo(role) && (mayDelegate || !tool.isDispatch())) {
                tools.add(tool);
            }
        }
        return tools;
    }

    /**
     * Role a dispatch tool targets, or {@code null} for a non-dispatch tool or an unknown agent type.
     */
    public AgentRole targetRole(ToolRequest request) {
        return switch (this) {
            case RESEARCH_AGENT -> AgentRole.RESEARCH;
            case CODE_AGENT -> AgentRole.CODE;
            case DATA_AGENT -> AgentRole.DATA;
            case WRITING_AGENT -> AgentRole.WRITING;
            case SPAWN_SUB_ORCHESTRATOR -> AgentRole.ORCHESTRATOR;
            case SPAWN_SUB_AGENT -> AgentRole.fromAgentType(request.arg("agent_type"));
            default -> null;
        };
    }

    public String render() {
        return toolName + ": " + description + (parameters.isEmpty() ? "" : " Arguments: " + parameters + ".");
    }
}
