package com.lorekeeper.frontend.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LorekeeperCommand lorekeeperCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LorekeeperCommand lorekeeperCommand, IFactory factory) {
        this.lorekeeperCommand = lorekeeperCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(lorekeeperCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
