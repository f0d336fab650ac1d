package com.lorekeeper.core.logging;

import com.lorekeeper.core.model.AgentHandle;
import org.slf4j.MDC;

/**
 * Utility for managing Lorekeeper-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setAgent(AgentHandle handle) {
        MDC.put("taskId", handle.taskId());
        MDC.put("agentId", handle.id());
        MDC.put("role", handle.role().name());
        MDC.put("depth", String.valueOf(handle.depth()));
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("agentId");
        MDC.remove("role");
        MDC.remove("depth");
    }
}
