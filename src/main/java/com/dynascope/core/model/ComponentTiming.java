package com.dynascope.core.model;

import java.io.Serializable;

/**
 * One row of the timing information table.
 */
public record ComponentTiming(
    String component,
    double cpuSeconds,
    double cpuPercent,
    double clockSeconds,
    double clockPercent
) implements Serializable {}
