package com.dynascope.core.model;

import java.io.Serializable;

/**
 * One progress snapshot of the status log. Integer fields are -1 and
 * floating-point fields {@code NaN} when the snapshot does not report them.
 */
public record StatusSample(
    long cycle,
    double time,
    long cpuPerZoneCycleNs,
    long averageCpuPerZoneCycleNs,
    long averageClockPerZoneCycleNs,
    long estimatedTotalCpuSeconds,
    long estimatedCpuRemainingSeconds,
    long estimatedTotalClockSeconds,
    long estimatedClockRemainingSeconds
) implements Serializable {}
