package com.lorekeeper.frontend.cli;

import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.session.TaskSession;
import com.lorekeeper.core.session.TaskSessionManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: lorekeeper status
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show memory layer totals and sessions")
@Component
public class StatusCommand implements Runnable {

    private final MemoryLayers layers;
    private final TaskSessionManager sessions;

    public StatusCommand(MemoryLayers layers, TaskSessionManager sessions) {
        this.layers = layers;
        this.sessions = sessions;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Storage: " + layers.storageDescription());
        ConsoleOutput.info(layers.summary());

        var open = sessions.sessions();
        if (open.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.printf("%-16s %-8s %-10s %s%n", "TASK", "STATUS", "DISPATCHES", "PROMPT");
        for (TaskSession s : open) {
            System.out.printf("%-16s %-8s %-10d %s%n", s.taskId(), s.status(), s.tree().size(),
                    ConsoleOutput.abbreviate(s.prompt(), 50));
        }
    }
}
