package com.lorekeeper.frontend.cli;

import com.lorekeeper.core.access.CanonScope;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.CanonEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: lorekeeper canon [key]
 * <p>
 * Lists current Canon entries, optionally under a prefix, or the full version history of one key.
 */
@Command(name = "canon", mixinStandardHelpOptions = true, description = "Show verified Canon entries")
@Component
public class CanonCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Canon key to show history for")
    private String key;

    @Option(names = {"--prefix", "-p"}, description = "Only list keys under this prefix")
    private String prefix;

    private final MemoryLayers layers;

    public CanonCommand(MemoryLayers layers) {
        this.layers = layers;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var operator = AgentHandle.system("operator", AgentRole.CURATOR, "operator");

        if (key != null) {
            List<CanonEntry> history = layers.canonHistory(key, operator);
            if (history.isEmpty()) {
                ConsoleOutput.error("No Canon entry for " + key);
                return;
            }
            System.out.println("CANON " + key);
            System.out.println(ConsoleOutput.RULE);
            for (CanonEntry e : history) {
                System.out.printf("  v%-3d %s  conf=%.2f  by %s%n", e.version(), e.updatedAt(), e.confidence(),
                        e.lastUpdatedBy());
                System.out.println("       " + e.value());
                if (!e.sourceEntryIds().isEmpty()) {
                    System.out.println("       promoted from " + String.join(", ", e.sourceEntryIds()));
                }
            }
            return;
        }

        CanonScope scope = prefix == null ? CanonScope.unrestricted() : CanonScope.of(prefix);
        var entries = layers.readCanonScope(operator, scope);
        if (entries.isEmpty()) {
            ConsoleOutput.info("Canon is empty" + (prefix == null ? "" : " under " + prefix));
            return;
        }
        System.out.printf("%-32s %-4s %-5s %s%n", "KEY", "VER", "CONF", "VALUE");
        for (CanonEntry e : entries.values()) {
            System.out.printf("%-32s v%-3d %.2f  %s%n", e.key(), e.version(), e.confidence(),
                    ConsoleOutput.abbreviate(e.value(), 60));
        }
    }
}
