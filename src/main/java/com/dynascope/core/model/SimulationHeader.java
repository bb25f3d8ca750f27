package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Solver build and host details printed at the top of the high-speed-printer log.
 * Unknown text fields are empty strings; {@code processors} is 0 for shared-memory runs.
 */
public record SimulationHeader(
    String version,
    String revision,
    String date,
    String time,
    String platform,
    String osLevel,
    String compiler,
    String hostname,
    String precision,
    String licensee,
    String inputFile,
    int processors
) implements Serializable {

    public static SimulationHeader empty() {
        return new SimulationHeader("", "", "", "", "", "", "", "", "", "", "", 0);
    }
}
