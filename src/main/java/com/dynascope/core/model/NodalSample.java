package com.dynascope.core.model;

/**
 * Kinematics of one tracked node at one output step.
 */
public record NodalSample(
    long nodeId,
    long cycle,
    double time,
    double xDisplacement,
    double yDisplacement,
    double zDisplacement,
    double xVelocity,
    double yVelocity,
    double zVelocity,
    double xAcceleration,
    double yAcceleration,
    double zAcceleration
) {

    public double speed() {
        return Math.sqrt(xVelocity * xVelocity + yVelocity * yVelocity + zVelocity * zVelocity);
    }
}
