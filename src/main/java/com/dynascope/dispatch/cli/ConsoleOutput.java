package com.dynascope.dispatch.cli;

import com.dynascope.core.events.DiagnosisEvent;
import com.dynascope.core.model.Severity;
import picocli.CommandLine;

import java.util.TreeMap;

/**
 * ANSI-colored terminal output utilities for the dynascope CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) DYNASCOPE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DYNASCOPE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
        System.out.println(RULE);
    }

    /** Markup for a severity tag; the plain form is used when colors are off. */
    public static String severityTag(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "@|fg(red),bold [CRITICAL]|@";
            case WARNING -> "@|fg(yellow),bold [WARNING]|@";
            case INFO -> "@|fg(cyan) [INFO]|@";
        };
    }

    public static void progressEvent(DiagnosisEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "reader.completed" -> "@|fg(blue) [READ]|@";
            case "analyzer.completed" -> "@|fg(magenta) [ANALYZE]|@";
            case "run.completed" -> "@|fg(green),bold [DONE]|@";
            case "run.aborted" -> "@|fg(red),bold [ABORTED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.subject() != null ? event.subject() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + new TreeMap<>(event.payload())));
    }
}
