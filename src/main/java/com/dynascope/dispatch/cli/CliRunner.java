package com.dynascope.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments, runs the
 * selected command and hands its exit code to Spring.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DynascopeCommand dynascopeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DynascopeCommand dynascopeCommand, IFactory factory) {
        this.dynascopeCommand = dynascopeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(dynascopeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
