package com.dynascope.dispatch.cli;

import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.engine.DiagnosisEngine;
import com.dynascope.core.events.EventBus;
import com.dynascope.core.model.AnalysisOutcome;
import com.dynascope.core.parser.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: dynascope analyze &lt;directory&gt;
 * <p>
 * Diagnoses a result directory, prints the transcript and optionally writes the
 * JSON document. The exit code reflects the outcome: 0 success, 2 degraded coverage,
 * 1 fatal input, 130 aborted.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Diagnose a solver result directory")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FATAL_INPUT = 1;
    static final int EXIT_DEGRADED = 2;
    static final int EXIT_ABORTED = 130;

    @Parameters(index = "0", description = "Result directory")
    private Path directory;

    @Option(names = {"--verbose", "-v"}, description = "Show progress while reading and analysing")
    private boolean verbose;

    @Option(names = "--max-nodes", description = "Maximum distinct nodes read from each time-history file")
    private Integer maxNodes;

    @Option(names = "--json", paramLabel = "FILE", description = "Also write the report as JSON to FILE")
    private Path jsonFile;

    @Option(names = "--no-terminal", description = "Do not print the report transcript")
    private boolean noTerminal;

    private final DiagnosisEngine engine;
    private final EventBus eventBus;
    private final JsonReportWriter jsonWriter;
    private final DynascopeProperties properties;

    public AnalyzeCommand(DiagnosisEngine engine, EventBus eventBus, JsonReportWriter jsonWriter,
                          DynascopeProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.jsonWriter = jsonWriter;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        if (!noTerminal) {
            ConsoleOutput.printBanner();
        }
        int nodeCap = maxNodes != null ? maxNodes : properties.getInput().getMaxTrackedNodes();
        if (nodeCap < 1) {
            ConsoleOutput.error("--max-nodes must be at least 1");
            return EXIT_FATAL_INPUT;
        }

        String runId = engine.generateRunId();
        CancellationToken cancellation = new CancellationToken();
        Thread interruptHook = new Thread(cancellation::cancel, "dynascope-cancel");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        EventBus.Subscription subscription = verbose
                ? eventBus.subscribe(runId, ConsoleOutput::progressEvent)
                : null;
        AnalysisOutcome outcome;
        try {
            outcome = engine.diagnose(runId, directory, nodeCap, cancellation);
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
            removeHook(interruptHook);
        }
        return render(outcome);
    }

    private int render(AnalysisOutcome outcome) {
        switch (outcome.status()) {
            case FATAL_INPUT -> {
                ConsoleOutput.error(outcome.detail());
                for (String missing : outcome.missingInputs()) {
                    ConsoleOutput.error("  missing: " + missing);
                }
                return EXIT_FATAL_INPUT;
            }
            case ABORTED -> {
                ConsoleOutput.error("Analysis aborted.");
                return EXIT_ABORTED;
            }
            default -> {
                if (!noTerminal) {
                    ReportPrinter.print(outcome.report());
                }
                if (jsonFile != null) {
                    try {
                        jsonWriter.write(outcome.report(), jsonFile);
                        if (!noTerminal) {
                            ConsoleOutput.success("JSON report written to " + jsonFile);
                        }
                    } catch (IOException e) {
                        ConsoleOutput.error("Cannot write " + jsonFile + ": " + e.getMessage());
                        return EXIT_FATAL_INPUT;
                    }
                }
                return exitCode(outcome.status());
            }
        }
    }

    static int exitCode(AnalysisOutcome.Status status) {
        return switch (status) {
            case SUCCESS -> EXIT_SUCCESS;
            case DEGRADED -> EXIT_DEGRADED;
            case FATAL_INPUT -> EXIT_FATAL_INPUT;
            case ABORTED -> EXIT_ABORTED;
        };
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook has cancelled the run
            log.debug("Shutdown in progress, keeping cancel hook: {}", e.getMessage());
        }
    }
}
