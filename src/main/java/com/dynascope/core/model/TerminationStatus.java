package com.dynascope.core.model;

import java.io.Serializable;

/**
 * End-of-run summary. At most one per run.
 *
 * @param state             normal, error or incomplete (no banner seen)
 * @param cycles            last problem cycle, 0 when unknown
 * @param problemTime       simulated time reached
 * @param targetTime        requested termination time, 0 when unknown
 * @param cpuSeconds        total CPU seconds
 * @param elapsedSeconds    wall-clock seconds
 * @param errorCode         code of the last error message, 0 when none
 * @param source            log that supplied the state
 */
public record TerminationStatus(
    TerminationState state,
    long cycles,
    double problemTime,
    double targetTime,
    double cpuSeconds,
    double elapsedSeconds,
    double cpuPerZoneCycleNs,
    double clockPerZoneCycleNs,
    String startedAt,
    String endedAt,
    int errorCode,
    InputKind source
) implements RunRecord, Serializable {

    public static TerminationStatus of(TerminationState state) {
        return of(state, InputKind.HSP);
    }

    public static TerminationStatus of(TerminationState state, InputKind source) {
        return new TerminationStatus(state, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, "", "", 0, source);
    }

    /** The same figures with the state taken from another log. */
    public TerminationStatus withState(TerminationState newState, InputKind newSource) {
        return new TerminationStatus(newState, cycles, problemTime, targetTime, cpuSeconds, elapsedSeconds,
                cpuPerZoneCycleNs, clockPerZoneCycleNs, startedAt, endedAt, errorCode, newSource);
    }

    /**
     * Fraction of the requested end time that was reached, or {@code NaN} when
     * either time is unknown.
     */
    public double completionRatio() {
        if (targetTime <= 0.0 || problemTime <= 0.0) {
            return Double.NaN;
        }
        return problemTime / targetTime;
    }
}
