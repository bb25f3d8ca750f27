package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Projected, not measured, behaviour of the run at another core count.
 *
 * @param cores              target core count
 * @param elapsedSeconds     projected wall-clock time
 * @param speedup            measured elapsed / projected elapsed
 * @param efficiency         speedup / core ratio, 0..1
 * @param communicationShare projected share of communication in elapsed time, 0..1
 */
public record ScalingProjection(
    int cores,
    double elapsedSeconds,
    double speedup,
    double efficiency,
    double communicationShare,
    Band band
) implements Serializable {

    public enum Band { ACCEPTABLE, CAUTIONARY, SEVERE }

    public static Band classify(double efficiency) {
        if (efficiency < 0.5) {
            return Band.SEVERE;
        }
        if (efficiency <= 0.7) {
            return Band.CAUTIONARY;
        }
        return Band.ACCEPTABLE;
    }
}
