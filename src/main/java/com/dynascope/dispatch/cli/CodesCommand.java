package com.dynascope.dispatch.cli;

import com.dynascope.core.knowledge.CodeEntry;
import com.dynascope.core.knowledge.KnowledgeBase;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * CLI command: dynascope codes [CODE...]
 * <p>
 * Explains solver message codes from the built-in catalogue. Without arguments,
 * lists every catalogued code.
 */
@Command(name = "codes", mixinStandardHelpOptions = true, description = "Look up solver message codes")
@Component
public class CodesCommand implements Runnable {

    @Parameters(arity = "0..*", paramLabel = "CODE", description = "Message codes to explain")
    private List<Integer> codes = new ArrayList<>();

    private final KnowledgeBase knowledge;

    public CodesCommand(KnowledgeBase knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public void run() {
        Collection<CodeEntry> entries;
        if (codes.isEmpty()) {
            entries = knowledge.entries();
        } else {
            entries = codes.stream().map(knowledge::lookup).toList();
        }
        for (CodeEntry entry : entries) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("%s @|bold %d|@ %s [%s]",
                    ConsoleOutput.severityTag(entry.severity()), entry.code(), entry.title(), entry.category())));
            System.out.println("      " + entry.description());
            System.out.println("      -> " + entry.recommendation());
        }
        if (codes.isEmpty()) {
            System.out.println();
            System.out.println(knowledge.size() + " catalogued codes");
        }
    }
}
