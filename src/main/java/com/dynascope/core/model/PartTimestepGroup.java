package com.dynascope.core.model;

import java.io.Serializable;

/**
 * How many of the smallest-timestep elements belong to one part.
 */
public record PartTimestepGroup(
    int partId,
    String partName,
    int elementCount,
    double minimumDt
) implements Serializable {}
