package com.dynascope.core.model;

import java.io.Serializable;

/**
 * A run of consecutive cycles during which one element controlled the time step.
 * Both bounds are inclusive.
 */
public record ControllingInterval(
    long startCycle,
    long endCycle,
    String elementType,
    long elementId,
    int partId
) implements Serializable {

    public long cycleCount() {
        return endCycle - startCycle + 1;
    }
}
