package com.dynascope.core.model;

import java.io.Serializable;

/**
 * A reference from a {@link Finding} back into the data that triggered it.
 *
 * @param source file family holding the referenced data
 * @param entity kind of entity referenced ({@code energy-sample}, {@code node}, {@code element}, ...)
 * @param ref    identifier of the entity within its kind, empty for time-series samples
 * @param cycle  cycle or output step of the reference (nullable)
 * @param time   simulated time of the reference (nullable)
 */
public record Evidence(
    InputKind source,
    String entity,
    String ref,
    Long cycle,
    Double time
) implements Serializable {

    public static Evidence sample(InputKind source, String entity, long cycle, double time) {
        return new Evidence(source, entity, "", cycle, time);
    }

    public static Evidence of(InputKind source, String entity, Object ref) {
        return new Evidence(source, entity, String.valueOf(ref), null, null);
    }

    public static Evidence at(InputKind source, String entity, Object ref, long cycle, double time) {
        return new Evidence(source, entity, String.valueOf(ref), cycle, time);
    }
}
