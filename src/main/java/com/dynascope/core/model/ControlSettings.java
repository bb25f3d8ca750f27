package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Time integration controls echoed in the control information section.
 *
 * @param terminationTime       requested end time
 * @param timestepScaleFactor   TSSFAC
 * @param massScalingDt         DT2MS; non-zero when mass scaling is requested
 * @param minimumTimestepFactor TSMIN reduction factor
 */
public record ControlSettings(
    double terminationTime,
    double timestepScaleFactor,
    double massScalingDt,
    double minimumTimestepFactor
) implements Serializable {

    public static ControlSettings empty() {
        return new ControlSettings(0.0, 0.0, 0.0, 0.0);
    }

    public boolean massScalingActive() {
        return massScalingDt != 0.0;
    }
}
