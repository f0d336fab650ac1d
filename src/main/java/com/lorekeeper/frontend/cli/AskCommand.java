package com.lorekeeper.frontend.cli;

import com.lorekeeper.core.curator.CurationReport;
import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.model.DispatchOutcome;
import com.lorekeeper.core.session.TaskReport;
import com.lorekeeper.core.session.TaskSession;
import com.lorekeeper.core.session.TaskSessionManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * CLI command: lorekeeper ask "&lt;request&gt;"
 * <p>
 * Without a request (or with {@code --interactive}) opens one task session and reads requests
 * line by line until {@code exit}; the session is closed, and its buffer curated, on the way out.
 */
@Command(name = "ask", mixinStandardHelpOptions = true, description = "Send a request to the orchestrator")
@Component
public class AskCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Natural language request")
    private String request;

    @Option(names = {"--interactive", "-i"}, description = "Keep one session open and read requests from stdin")
    private boolean interactive;

    @Option(names = {"--watch", "-w"}, description = "Print memory and dispatch events as they happen")
    private boolean watch;

    @Option(names = {"--tree", "-t"}, description = "Print the dispatch tree after each request")
    private boolean showTree;

    private final TaskSessionManager sessions;
    private final MemoryLayers layers;
    private final EventBus eventBus;
    private final Supplier<BufferedReader> input;

    @Autowired
    public AskCommand(TaskSessionManager sessions, MemoryLayers layers, EventBus eventBus) {
        this(sessions, layers, eventBus,
                () -> new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    AskCommand(TaskSessionManager sessions, MemoryLayers layers, EventBus eventBus, Supplier<BufferedReader> input) {
        this.sessions = sessions;
        this.layers = layers;
        this.eventBus = eventBus;
        this.input = input;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::watchEvent) : null;
        try {
            if (interactive || request == null || request.isBlank()) {
                repl();
            } else {
                oneShot(request);
            }
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    private void oneShot(String prompt) {
        ConsoleOutput.info("Dispatching to orchestrator...");
        TaskReport report;
        try {
            report = sessions.run(prompt);
        } catch (LorekeeperException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
            return;
        }
        printOutcome(report.outcome());
        if (showTree) {
            System.out.print(report.dispatchTree());
        }
        ConsoleOutput.curation(report.curation());
        ConsoleOutput.info("Task " + report.taskId() + " | " + report.dispatches() + " dispatch(es) | "
                + ConsoleOutput.formatDuration(report.elapsedMs()));
    }

    private void repl() {
        TaskSession session = sessions.open(null, "interactive session");
        ConsoleOutput.info("Session " + session.taskId() + " open. Type 'exit' to close, '/memory' for a summary.");
        try {
            BufferedReader reader = input.get();
            String line;
            while (true) {
                System.out.print("> ");
                System.out.flush();
                line = reader.readLine();
                if (line == null) {
                    break;
                }
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) {
                    break;
                }
                if (line.equals("/memory")) {
                    ConsoleOutput.info(layers.summary());
                    continue;
                }
                if (line.equals("/tree")) {
                    System.out.print(session.tree().render());
                    continue;
                }
                try {
                    printOutcome(sessions.dispatch(session.taskId(), line));
                } catch (LorekeeperException e) {
                    ConsoleOutput.error("Request failed: " + e.getMessage());
                }
                if (showTree) {
                    System.out.print(session.tree().render());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading input", e);
        } finally {
            CurationReport report = sessions.close(session.taskId());
            ConsoleOutput.curation(report);
            ConsoleOutput.info("Session " + session.taskId() + " closed. " + layers.summary());
        }
    }

    private static void printOutcome(DispatchOutcome outcome) {
        System.out.println();
        if (outcome.completed()) {
            System.out.println(outcome.response());
            System.out.println();
            if (outcome.partialFailure()) {
                ConsoleOutput.error("Some sub-dispatches failed; the answer may be incomplete.");
            }
            ConsoleOutput.success("Completed in " + ConsoleOutput.formatDuration(outcome.elapsedMs())
                    + " (max depth " + outcome.maxDepth() + ")");
        } else {
            ConsoleOutput.error("Dispatch failed: " + outcome.failureReason());
        }
    }
}
