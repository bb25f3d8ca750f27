package com.dynascope.dispatch.cli;

import com.dynascope.core.engine.MissingInputException;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.RunBundle;
import com.dynascope.core.scanner.RunBundleScanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: dynascope inspect &lt;directory&gt;
 * <p>
 * Shows which solver outputs were found in a result directory without analysing them.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "List the solver outputs found in a directory")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Result directory")
    private Path directory;

    private final RunBundleScanner scanner;

    public InspectCommand(RunBundleScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        RunBundle bundle;
        try {
            bundle = scanner.scan(directory);
        } catch (MissingInputException e) {
            ConsoleOutput.error(e.getMessage());
            return AnalyzeCommand.EXIT_FATAL_INPUT;
        }

        System.out.println();
        System.out.println("RESULT DIRECTORY " + bundle.directory());
        System.out.println(ConsoleOutput.RULE);
        for (InputKind kind : InputKind.values()) {
            String label = String.format("%-18s", kind.label());
            bundle.path(kind).ifPresentOrElse(
                    path -> ConsoleOutput.success(label + path.getFileName()),
                    () -> {
                        if (kind == InputKind.MESSAGE && bundle.has(kind)) {
                            ConsoleOutput.success(label + "(per-process logs only)");
                        } else if (kind.required()) {
                            ConsoleOutput.warn(label + "not found");
                        } else {
                            ConsoleOutput.info(label + "not found");
                        }
                    });
        }
        for (Map.Entry<Integer, Path> entry : bundle.rankedMessages().entrySet()) {
            ConsoleOutput.success(String.format("%-18s%s", "rank " + entry.getKey(), entry.getValue().getFileName()));
        }
        if (!bundle.hasRequiredInputs()) {
            ConsoleOutput.error("Missing required input: " + String.join(", ", bundle.missingRequired()));
            return AnalyzeCommand.EXIT_FATAL_INPUT;
        }
        return AnalyzeCommand.EXIT_SUCCESS;
    }
}
