package com.dynascope.core.model;

import java.io.Serializable;

/**
 * A warning or error message from a solver log.
 *
 * @param code        message code, 0 for uncoded lines such as stand-alone negative volume reports
 * @param level       warning or error
 * @param condition   failure condition recognised in the message text
 * @param interfaceId referenced contact interface (nullable)
 * @param partId      referenced part (nullable)
 * @param elementId   referenced element (nullable)
 * @param cycle       referenced cycle (nullable)
 * @param rank        MPP rank of the log, {@link #UNRANKED} for the primary log and the high-speed-printer log
 * @param message     header plus context lines, whitespace-collapsed
 * @param source      file family the event was read from
 */
public record WarningEvent(
    int code,
    Level level,
    Condition condition,
    Integer interfaceId,
    Integer partId,
    Long elementId,
    Long cycle,
    int rank,
    String message,
    InputKind source
) implements RunRecord, Serializable {

    public static final int UNRANKED = -1;

    public enum Level { WARNING, ERROR }

    public enum Condition { GENERAL, NEGATIVE_VOLUME, CONSTRAINT_NAN }

    public boolean isFailure() {
        return condition != Condition.GENERAL;
    }
}
