package com.dynascope.core.model;

import java.util.List;

/**
 * The complete part definition table, emitted once per high-speed-printer log.
 */
public record PartTable(List<PartDefinition> parts) implements RunRecord {

    public PartTable {
        parts = List.copyOf(parts);
    }
}
