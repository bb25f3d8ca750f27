package com.dynascope.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Derived view of the time step history.
 *
 * @param intervals        controlling intervals partitioning the reported cycle range
 * @param smallestElements the smallest-dt elements, ascending by dt
 * @param partGroups       per-part grouping of the smallest-dt entries, ascending by minimum dt
 * @param initialDt        first reported dt, {@code NaN} when there is no history
 * @param finalDt          last reported dt, {@code NaN} when there is no history
 * @param minimumDt        smallest reported dt, {@code NaN} when there is no history
 */
public record TimestepSummary(
    List<ControllingInterval> intervals,
    List<SmallestTimestep> smallestElements,
    List<PartTimestepGroup> partGroups,
    double initialDt,
    double finalDt,
    double minimumDt
) implements Serializable {

    public TimestepSummary {
        intervals = List.copyOf(intervals);
        smallestElements = List.copyOf(smallestElements);
        partGroups = List.copyOf(partGroups);
    }

    public static TimestepSummary empty() {
        return new TimestepSummary(List.of(), List.of(), List.of(), Double.NaN, Double.NaN, Double.NaN);
    }
}
