package com.dynascope.core.model;

import java.io.Serializable;

/**
 * One row of the "100 smallest timesteps" table.
 */
public record SmallestTimestep(
    String elementType,
    long elementId,
    int partId,
    double dt
) implements RunRecord, Serializable {}
