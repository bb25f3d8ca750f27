package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Everything known about one contact interface, merged across files.
 */
public record ContactInterfaceSummary(
    int interfaceId,
    String type,
    String title,
    long warningCount,
    long initialPenetrations,
    double cpuSeconds,
    double clockSeconds,
    double clockPercent
) implements Serializable {}
