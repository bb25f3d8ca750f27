package com.dynascope.core.model;

import java.util.List;

/**
 * Terminal result of one analysis run. Only {@code SUCCESS} and {@code DEGRADED}
 * carry a report.
 *
 * @param missingInputs labels of required inputs that were absent (fatal input only)
 * @param detail        human-readable explanation for non-report outcomes
 */
public record AnalysisOutcome(
    Status status,
    Report report,
    List<String> missingInputs,
    String detail
) {

    public enum Status { SUCCESS, DEGRADED, FATAL_INPUT, ABORTED }

    public AnalysisOutcome {
        missingInputs = List.copyOf(missingInputs);
    }

    public static AnalysisOutcome completed(Report report) {
        Status status = report.coverage().degraded() ? Status.DEGRADED : Status.SUCCESS;
        return new AnalysisOutcome(status, report, List.of(), "");
    }

    public static AnalysisOutcome fatal(List<String> missing, String detail) {
        return new AnalysisOutcome(Status.FATAL_INPUT, null, missing, detail);
    }

    public static AnalysisOutcome aborted(String detail) {
        return new AnalysisOutcome(Status.ABORTED, null, List.of(), detail);
    }

    public boolean hasReport() {
        return report != null;
    }
}
