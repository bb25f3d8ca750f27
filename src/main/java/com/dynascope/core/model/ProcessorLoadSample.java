package com.dynascope.core.model;

import java.io.Serializable;

/**
 * Load of one pipeline component on one MPP rank.
 *
 * @param component profile column name, for example {@code contact}
 * @param seconds   clock seconds spent in the component
 * @param percent   share of the rank's clock time, {@code NaN} when not reported
 */
public record ProcessorLoadSample(
    String component,
    int rank,
    double seconds,
    double percent
) implements Serializable {}
