package com.dynascope.core.model;

import java.io.Serializable;

/**
 * One global energy block.
 *
 * @param cycle              cycle number from the "dt of cycle" line
 * @param timeStep           reported time step, {@code NaN} when absent
 * @param sliding            sliding interface (contact) energy
 * @param ratio              total energy / initial energy, {@code NaN} when absent
 * @param controllingType    element type controlling dt ({@code solid}, {@code shell}, ...), empty when unknown
 * @param controllingElement element controlling dt, 0 when unknown
 * @param controllingPart    part of the controlling element, 0 when unknown
 * @param source             file the block was read from
 */
public record EnergySample(
    long cycle,
    double time,
    double timeStep,
    double kinetic,
    double internal,
    double hourglass,
    double sliding,
    double total,
    double externalWork,
    double ratio,
    String controllingType,
    long controllingElement,
    int controllingPart,
    InputKind source
) implements RunRecord, Serializable {

    /** Hourglass energy as a fraction of internal energy; 0 while internal energy is not positive. */
    public double hourglassRatio() {
        return internal > 0.0 ? hourglass / internal : 0.0;
    }
}
