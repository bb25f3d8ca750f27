package com.dynascope.core.model;

/**
 * Reaction force, energy and moment at one constrained node at one output step.
 *
 * @param cycle ordinal of the output step (1-based)
 */
public record BoundaryForceSample(
    long nodeId,
    long cycle,
    double time,
    double xForce,
    double yForce,
    double zForce,
    double energy,
    double xMoment,
    double yMoment,
    double zMoment
) {

    public double forceMagnitude() {
        return Math.sqrt(xForce * xForce + yForce * yForce + zForce * zForce);
    }
}
