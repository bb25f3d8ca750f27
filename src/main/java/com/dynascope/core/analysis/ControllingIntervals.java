package com.dynascope.core.analysis;

import com.dynascope.core.model.ControllingInterval;
import com.dynascope.core.model.TimestepRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Compresses per-cycle timestep records into runs of the same controlling element.
 * <p>
 * Each interval ends one cycle before the next one starts and the last ends at the
 * last reported cycle, so the intervals partition [first cycle, last cycle] without
 * gaps or overlaps. A record naming the element that already controls the current
 * interval extends it. Records that do not advance the cycle are ignored.
 */
public final class ControllingIntervals {

    private ControllingIntervals() {}

    public static List<ControllingInterval> compress(List<TimestepRecord> records) {
        List<ControllingInterval> intervals = new ArrayList<>();
        TimestepRecord open = null;
        long lastCycle = Long.MIN_VALUE;
        for (TimestepRecord record : records) {
            if (record.cycle() <= lastCycle) {
                continue;
            }
            if (open == null) {
                open = record;
            } else if (!record.sameElement(open.elementType(), open.elementId())) {
                intervals.add(interval(open, record.cycle() - 1));
                open = record;
            }
            lastCycle = record.cycle();
        }
        if (open != null) {
            intervals.add(interval(open, lastCycle));
        }
        return intervals;
    }

    private static ControllingInterval interval(TimestepRecord start, long endCycle) {
        return new ControllingInterval(start.cycle(), endCycle, start.elementType(), start.elementId(), start.partId());
    }
}
