package com.dynascope.core.knowledge;

import com.dynascope.core.model.Severity;

import java.io.Serializable;

/**
 * Explanation of one solver warning or error code.
 *
 * @param category grouping used in findings, for example {@code contact} or {@code negative-volume}
 */
public record CodeEntry(
    int code,
    String category,
    Severity severity,
    String title,
    String description,
    String recommendation
) implements Serializable {

    public static final String UNCATALOGUED = "uncatalogued";

    /**
     * Generic entry for a code that is not in the catalogue. Low codes are
     * system-level failures, the middle ranges are solution warnings.
     */
    public static CodeEntry uncatalogued(int code) {
        Severity severity;
        if (code < 20000) {
            severity = Severity.CRITICAL;
        } else if (code < 60000) {
            severity = Severity.WARNING;
        } else {
            severity = Severity.INFO;
        }
        return new CodeEntry(code, UNCATALOGUED, severity, "Code " + code,
                "Solver message code " + code + " is not in the built-in catalogue.",
                "Consult the solver documentation for code " + code + ".");
    }

    public boolean isCatalogued() {
        return !UNCATALOGUED.equals(category);
    }
}
