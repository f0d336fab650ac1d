package com.lorekeeper.frontend.cli;

import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: lorekeeper disputes
 */
@Command(name = "disputes", mixinStandardHelpOptions = true, description = "List buffer claims that conflict with Canon")
@Component
public class DisputesCommand implements Runnable {

    @Option(names = {"--all", "-a"}, description = "Include resolved disputes")
    private boolean all;

    private final MemoryLayers layers;

    public DisputesCommand(MemoryLayers layers) {
        this.layers = layers;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var operator = AgentHandle.system("operator", AgentRole.CURATOR, "operator");
        var disputes = layers.readDisputes(all ? null : DisputeStatus.OPEN, operator);
        if (disputes.isEmpty()) {
            ConsoleOutput.success(all ? "No disputes recorded" : "No open disputes");
            return;
        }
        for (DisputeRecord d : disputes) {
            System.out.println(d.id() + "  [" + d.status() + "]  " + d.canonKey() + "  (task " + d.taskId() + ")");
            System.out.println("  canon v" + d.existingCanonVersion() + ": " + ConsoleOutput.abbreviate(d.existingCanonValue(), 70));
            ConsoleOutput.tentative(ConsoleOutput.abbreviate(d.incomingClaim(), 70)
                    + String.format(" (conf %.2f, disagreement %.2f)", d.incomingConfidence(), d.disagreement()));
            if (d.resolution() != null) {
                System.out.println("  resolved: " + d.resolution().outcome() + " by " + d.resolution().resolvedBy()
                        + (d.resolution().note().isBlank() ? "" : " (" + d.resolution().note() + ")"));
            }
        }
    }
}
