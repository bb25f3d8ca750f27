package com.dynascope.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * One diagnostic conclusion. Immutable: the {@code with*} methods return copies.
 *
 * @param severity       how urgent the finding is
 * @param category       grouping key such as {@code energy} or {@code termination}
 * @param title          one-line headline
 * @param message        explanation with the observed values
 * @param recommendation what to change in the model, empty when nothing specific applies
 * @param evidence       references to the data that triggered the finding
 * @param occurrences    how many times the condition was observed, at least 1
 * @param analyzer       name of the analyzer that produced it; set by the aggregator
 */
public record Finding(
    Severity severity,
    String category,
    String title,
    String message,
    String recommendation,
    List<Evidence> evidence,
    long occurrences,
    String analyzer
) implements Serializable {

    public Finding {
        evidence = List.copyOf(evidence);
    }

    public static Finding of(Severity severity, String category, String title, String message) {
        return new Finding(severity, category, title, message, "", List.of(), 1, "");
    }

    public static Finding info(String category, String title, String message) {
        return of(Severity.INFO, category, title, message);
    }

    public static Finding warning(String category, String title, String message) {
        return of(Severity.WARNING, category, title, message);
    }

    public static Finding critical(String category, String title, String message) {
        return of(Severity.CRITICAL, category, title, message);
    }

    public Finding withRecommendation(String text) {
        return new Finding(severity, category, title, message, text, evidence, occurrences, analyzer);
    }

    public Finding withEvidence(Evidence... refs) {
        List<Evidence> merged = new ArrayList<>(evidence);
        merged.addAll(List.of(refs));
        return new Finding(severity, category, title, message, recommendation, merged, occurrences, analyzer);
    }

    public Finding withOccurrences(long count) {
        return new Finding(severity, category, title, message, recommendation, evidence, count, analyzer);
    }

    public Finding withAnalyzer(String name) {
        return new Finding(severity, category, title, message, recommendation, evidence, occurrences, name);
    }

    /** True when any evidence reference points into the given file family. */
    public boolean references(InputKind source) {
        return evidence.stream().anyMatch(e -> e.source() == source);
    }
}
