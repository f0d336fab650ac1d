package com.lorekeeper.frontend.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Lorekeeper.
 * Routes to subcommands: ask, canon, disputes, resolve, status, health.
 */
@Command(
        name = "lorekeeper",
        mixinStandardHelpOptions = true,
        version = "Lorekeeper 0.1.0",
        description = "Layered-memory agent hierarchy with recursive dispatch",
        subcommands = {
                AskCommand.class,
                CanonCommand.class,
                DisputesCommand.class,
                ResolveCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LorekeeperCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
