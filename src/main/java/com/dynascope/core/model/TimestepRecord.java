package com.dynascope.core.model;

import java.io.Serializable;

/**
 * The element that controlled the global time step at one reported cycle.
 */
public record TimestepRecord(
    long cycle,
    double time,
    String elementType,
    long elementId,
    int partId,
    double dt,
    InputKind source
) implements RunRecord, Serializable {

    /**
     * Builds a record from an energy block, or returns {@code null} when the block reports
     * no dt. A block without a named controller keeps an empty type and id 0; one without a
     * part keeps part 0.
     */
    public static TimestepRecord from(EnergySample sample) {
        if (Double.isNaN(sample.timeStep())) {
            return null;
        }
        return new TimestepRecord(sample.cycle(), sample.time(), sample.controllingType(),
                sample.controllingElement(), sample.controllingPart(), sample.timeStep(), sample.source());
    }

    /** True when the block named the controlling element or contact. */
    public boolean hasController() {
        return !elementType.isEmpty() && elementId > 0;
    }

    /** Same controlling element: equal id and equal element type. */
    public boolean sameElement(String type, long id) {
        return elementId == id && elementType.equals(type);
    }
}
