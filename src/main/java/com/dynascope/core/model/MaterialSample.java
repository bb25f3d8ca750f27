package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Energy and momentum of one part at one output state of the material summary.
 *
 * @param cycle ordinal of the output state (1-based); the file carries no cycle numbers
 */
public record MaterialSample(
    int partId,
    String name,
    long cycle,
    double time,
    double internal,
    double kinetic,
    double hourglass,
    double erodedInternal,
    double erodedKinetic,
    double erodedHourglass,
    double xMomentum,
    double yMomentum,
    double zMomentum
) implements Serializable {}
