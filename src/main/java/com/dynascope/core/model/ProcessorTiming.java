package com.dynascope.core.model;

import java.io.Serializable;

/**
 * CPU time of one MPP rank from the CPU timing table.
 */
public record ProcessorTiming(
    int rank,
    String hostname,
    double cpuRatio,
    double cpuSeconds
) implements Serializable {}
