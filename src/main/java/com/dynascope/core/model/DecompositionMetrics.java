package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Domain decomposition cost statistics of an MPP run.
 */
public record DecompositionMetrics(
    double minimumCost,
    double maximumCost,
    double standardDeviation,
    long decompositionMemory,
    long dynamicMemory
) implements Serializable {

    public static DecompositionMetrics empty() {
        return new DecompositionMetrics(0.0, 0.0, 0.0, 0, 0);
    }

    /** (max - min) / max, or 0 when no cost was reported. */
    public double imbalance() {
        if (maximumCost <= 0.0) {
            return 0.0;
        }
        return (maximumCost - minimumCost) / maximumCost;
    }
}
