package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Per-interface row ({@code Interf. ID}) of the timing information table.
 */
public record InterfaceTiming(
    int interfaceId,
    double cpuSeconds,
    double cpuPercent,
    double clockSeconds,
    double clockPercent
) implements Serializable {}
