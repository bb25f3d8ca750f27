package com.dynascope.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: analyze, codes, inspect.
 */
@Command(
        name = "dynascope",
        mixinStandardHelpOptions = true,
        version = "dynascope 0.1.0",
        description = "Diagnoses explicit-dynamics solver result directories",
        subcommands = {
                AnalyzeCommand.class,
                CodesCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DynascopeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
